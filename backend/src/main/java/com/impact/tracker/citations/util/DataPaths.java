package com.impact.tracker.citations.util;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class DataPaths {
    private DataPaths() {
    }

    /**
     * Relative paths resolve against the working directory.
     */
    public static Path resolve(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }

    public static String rootMessage(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.toString() : current.getMessage();
    }
}

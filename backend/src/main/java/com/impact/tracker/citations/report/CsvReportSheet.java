package com.impact.tracker.citations.report;

import com.impact.tracker.config.TrackerProperties;
import com.impact.tracker.citations.model.AggregationResult;
import com.impact.tracker.citations.model.DatedAggregation;
import com.impact.tracker.citations.util.DataPaths;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Report sheet kept as CSV: the first row holds {@code metric} followed by one
 * ISO date per column, and each following row holds one metric's values.
 *
 * <pre>
 * metric,2024-01-01,2024-04-01
 * num_original_pubs,12,
 * num_citing_pubs,40,
 * </pre>
 *
 * A date column is pending while its {@code num_original_pubs} cell is empty.
 */
@Component
public class CsvReportSheet implements ImpactReportSink {
    private static final Logger log = LoggerFactory.getLogger(CsvReportSheet.class);

    static final String METRIC_HEADER = "metric";
    static final String NUM_ORIGINAL_PUBS = "num_original_pubs";
    static final String NUM_CITING_PUBS = "num_citing_pubs";

    private final Path sheetPath;

    @Autowired
    public CsvReportSheet(TrackerProperties properties) {
        this(DataPaths.resolve(properties.getData().getReportFile()));
    }

    CsvReportSheet(Path sheetPath) {
        this.sheetPath = sheetPath;
    }

    @Override
    public List<LocalDate> pendingCutoffDates(LocalDate today) {
        if (!Files.exists(sheetPath)) {
            log.warn("Report sheet {} does not exist, no pending dates", sheetPath);
            return List.of();
        }
        Sheet sheet = readSheet();
        List<String> marker = sheet.rows.get(NUM_ORIGINAL_PUBS);
        List<LocalDate> pending = new ArrayList<>();
        for (int column = 1; column < sheet.header.size(); column++) {
            LocalDate date = parseDate(sheet.header.get(column));
            if (date == null || date.isAfter(today) || pending.contains(date)) {
                continue;
            }
            if (isBlank(cell(marker, column))) {
                pending.add(date);
            }
        }
        return pending;
    }

    @Override
    public void record(List<DatedAggregation> aggregations) {
        if (aggregations == null || aggregations.isEmpty()) {
            return;
        }
        Sheet sheet = Files.exists(sheetPath) ? readSheet() : Sheet.empty();
        for (DatedAggregation aggregation : aggregations) {
            int column = sheet.columnFor(aggregation.cutoffDate());
            AggregationResult result = aggregation.result();
            sheet.set(NUM_ORIGINAL_PUBS, column, Integer.toString(result.numOriginalPubs()));
            sheet.set(NUM_CITING_PUBS, column, Integer.toString(result.numCitingPubs()));
        }
        writeSheet(sheet);
        log.info("Recorded {} report columns in {}", aggregations.size(), sheetPath);
    }

    private Sheet readSheet() {
        try (Reader reader = Files.newBufferedReader(sheetPath, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT.builder()
                 .setIgnoreSurroundingSpaces(true)
                 .setIgnoreEmptyLines(true)
                 .build()
                 .parse(reader)) {
            Sheet sheet = null;
            for (CSVRecord record : parser) {
                List<String> values = record.toList();
                if (sheet == null) {
                    sheet = new Sheet(new ArrayList<>(values));
                    if (sheet.header.isEmpty()) {
                        sheet.header.add(METRIC_HEADER);
                    }
                    continue;
                }
                if (values.isEmpty() || isBlank(values.get(0))) {
                    continue;
                }
                sheet.rows.put(values.get(0).trim(), new ArrayList<>(values));
            }
            return sheet == null ? Sheet.empty() : sheet;
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read report sheet " + sheetPath, e);
        }
    }

    private void writeSheet(Sheet sheet) {
        try {
            Path parent = sheetPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(sheetPath, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT)) {
                printer.printRecord(sheet.header);
                for (List<String> row : sheet.rows.values()) {
                    List<String> padded = new ArrayList<>(row);
                    while (padded.size() < sheet.header.size()) {
                        padded.add("");
                    }
                    printer.printRecord(padded);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write report sheet " + sheetPath, e);
        }
    }

    private static String cell(List<String> row, int column) {
        if (row == null || column >= row.size()) {
            return null;
        }
        return row.get(column);
    }

    private static LocalDate parseDate(String raw) {
        if (isBlank(raw)) {
            return null;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class Sheet {
        private final List<String> header;
        private final Map<String, List<String>> rows = new LinkedHashMap<>();

        private Sheet(List<String> header) {
            this.header = header;
        }

        private static Sheet empty() {
            List<String> header = new ArrayList<>();
            header.add(METRIC_HEADER);
            return new Sheet(header);
        }

        private int columnFor(LocalDate date) {
            for (int column = 1; column < header.size(); column++) {
                if (date.equals(parseDate(header.get(column)))) {
                    return column;
                }
            }
            header.add(date.toString());
            return header.size() - 1;
        }

        private void set(String metric, int column, String value) {
            List<String> row = rows.computeIfAbsent(metric, name -> {
                List<String> created = new ArrayList<>();
                created.add(name);
                return created;
            });
            while (row.size() <= column) {
                row.add("");
            }
            row.set(column, value);
        }
    }
}

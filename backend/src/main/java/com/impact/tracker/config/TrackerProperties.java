package com.impact.tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {
    private static final String DEFAULT_USER_AGENT = "impact-tracker/0.1 (+contact)";

    private String userAgent;
    private int requestTimeoutSeconds = 20;
    private int globalConcurrency = 4;
    private int perProviderConcurrency = 1;
    private int perProviderDelayMs = 1000;
    private int rateLimitCooldownSeconds = 30;
    private Fetch fetch = new Fetch();
    private OpenAlex openAlex = new OpenAlex();
    private SemanticScholar semanticScholar = new SemanticScholar();
    private Data data = new Data();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getPerProviderConcurrency() {
        return Math.max(1, perProviderConcurrency);
    }

    public void setPerProviderConcurrency(int perProviderConcurrency) {
        this.perProviderConcurrency = Math.max(1, perProviderConcurrency);
    }

    public int getPerProviderDelayMs() {
        return Math.max(1, perProviderDelayMs);
    }

    public void setPerProviderDelayMs(int perProviderDelayMs) {
        this.perProviderDelayMs = Math.max(1, perProviderDelayMs);
    }

    public int getRateLimitCooldownSeconds() {
        return Math.max(0, rateLimitCooldownSeconds);
    }

    public void setRateLimitCooldownSeconds(int rateLimitCooldownSeconds) {
        this.rateLimitCooldownSeconds = Math.max(0, rateLimitCooldownSeconds);
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public OpenAlex getOpenAlex() {
        return openAlex;
    }

    public void setOpenAlex(OpenAlex openAlex) {
        this.openAlex = openAlex;
    }

    public SemanticScholar getSemanticScholar() {
        return semanticScholar;
    }

    public void setSemanticScholar(SemanticScholar semanticScholar) {
        this.semanticScholar = semanticScholar;
    }

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Fetch {
        private int concurrency = 1;
        private int interPublicationDelayMs = 2000;
        private int maxCitationsPerPublication = 10;

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public int getInterPublicationDelayMs() {
            return Math.max(0, interPublicationDelayMs);
        }

        public void setInterPublicationDelayMs(int interPublicationDelayMs) {
            this.interPublicationDelayMs = Math.max(0, interPublicationDelayMs);
        }

        public int getMaxCitationsPerPublication() {
            return Math.min(100, Math.max(1, maxCitationsPerPublication));
        }

        public void setMaxCitationsPerPublication(int maxCitationsPerPublication) {
            this.maxCitationsPerPublication = Math.min(100, Math.max(1, maxCitationsPerPublication));
        }
    }

    public static class OpenAlex {
        private String baseUrl = "https://api.openalex.org";
        private String mailto = "";

        public String getBaseUrl() {
            return trimTrailingSlash(baseUrl);
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getMailto() {
            return mailto;
        }

        public void setMailto(String mailto) {
            this.mailto = mailto;
        }
    }

    public static class SemanticScholar {
        private String baseUrl = "https://api.semanticscholar.org/graph/v1";
        private String apiKey = "";

        public String getBaseUrl() {
            return trimTrailingSlash(baseUrl);
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }

    public static class Data {
        private String publicationsFile = "../data/publications.json";
        private String snapshotFile = "../data/all_citing_papers_by_doi.json";
        private String reportFile = "../data/publications_stats.csv";

        public String getPublicationsFile() {
            return publicationsFile;
        }

        public void setPublicationsFile(String publicationsFile) {
            this.publicationsFile = publicationsFile;
        }

        public String getSnapshotFile() {
            return snapshotFile;
        }

        public void setSnapshotFile(String snapshotFile) {
            this.snapshotFile = snapshotFile;
        }

        public String getReportFile() {
            return reportFile;
        }

        public void setReportFile(String reportFile) {
            this.reportFile = reportFile;
        }
    }

    public static class Cli {
        private boolean run;
        private String cutoffDates = "";
        private boolean reaggregateOnly;
        private boolean writeReport = true;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getCutoffDates() {
            return cutoffDates;
        }

        public void setCutoffDates(String cutoffDates) {
            this.cutoffDates = cutoffDates;
        }

        public boolean isReaggregateOnly() {
            return reaggregateOnly;
        }

        public void setReaggregateOnly(boolean reaggregateOnly) {
            this.reaggregateOnly = reaggregateOnly;
        }

        public boolean isWriteReport() {
            return writeReport;
        }

        public void setWriteReport(boolean writeReport) {
            this.writeReport = writeReport;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        String value = url.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}

package com.propertymarket.scraper.config;

import com.propertymarket.scraper.crawl.model.SiteId;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    private String userAgent;
    private int perSiteConcurrency = 2;
    private int perSiteDelayMs = 250;
    private int requestTimeoutMs = 10_000;
    private int requestMaxAttempts = 3;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5_000;
    private int rateLimitBackoffMs = 30_000;
    private int scrapeThreads = 3;
    private Pagination pagination = new Pagination();
    private Run run = new Run();
    private Dedup dedup = new Dedup();
    private Metrics metrics = new Metrics();
    private Output output = new Output();
    private Map<String, Site> sites = new LinkedHashMap<>();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerSiteConcurrency() {
        return Math.max(1, perSiteConcurrency);
    }

    public void setPerSiteConcurrency(int perSiteConcurrency) {
        this.perSiteConcurrency = Math.max(1, perSiteConcurrency);
    }

    public int getPerSiteDelayMs() {
        return Math.max(1, perSiteDelayMs);
    }

    public void setPerSiteDelayMs(int perSiteDelayMs) {
        this.perSiteDelayMs = Math.max(1, perSiteDelayMs);
    }

    public int getRequestTimeoutMs() {
        return Math.max(100, requestTimeoutMs);
    }

    public void setRequestTimeoutMs(int requestTimeoutMs) {
        this.requestTimeoutMs = Math.max(100, requestTimeoutMs);
    }

    public int getRequestMaxAttempts() {
        return Math.max(1, requestMaxAttempts);
    }

    public void setRequestMaxAttempts(int requestMaxAttempts) {
        this.requestMaxAttempts = Math.max(1, requestMaxAttempts);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public int getRateLimitBackoffMs() {
        return Math.max(0, rateLimitBackoffMs);
    }

    public void setRateLimitBackoffMs(int rateLimitBackoffMs) {
        this.rateLimitBackoffMs = Math.max(0, rateLimitBackoffMs);
    }

    public int getScrapeThreads() {
        return Math.max(1, scrapeThreads);
    }

    public void setScrapeThreads(int scrapeThreads) {
        this.scrapeThreads = Math.max(1, scrapeThreads);
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public Dedup getDedup() {
        return dedup;
    }

    public void setDedup(Dedup dedup) {
        this.dedup = dedup;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = metrics;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Map<String, Site> getSites() {
        return sites;
    }

    public void setSites(Map<String, Site> sites) {
        this.sites = sites == null ? new LinkedHashMap<>() : sites;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public String searchUrlTemplate(SiteId site) {
        Site override = siteOverride(site);
        if (override != null && override.getSearchUrlTemplate() != null && !override.getSearchUrlTemplate().isBlank()) {
            return override.getSearchUrlTemplate().trim();
        }
        return site.defaultSearchUrlTemplate();
    }

    public String userAgentFor(SiteId site) {
        Site override = siteOverride(site);
        if (override != null && override.getUserAgent() != null && !override.getUserAgent().isBlank()) {
            return override.getUserAgent().trim();
        }
        return getUserAgent();
    }

    private Site siteOverride(SiteId site) {
        if (site == null || sites == null) {
            return null;
        }
        Site direct = sites.get(site.key());
        if (direct != null) {
            return direct;
        }
        return sites.get(site.name().toLowerCase(Locale.ROOT));
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Pagination {
        private int maxPagesPerSite = 5;
        private int maxConsecutiveFailures = 2;

        public int getMaxPagesPerSite() {
            return Math.max(1, maxPagesPerSite);
        }

        public void setMaxPagesPerSite(int maxPagesPerSite) {
            this.maxPagesPerSite = Math.max(1, maxPagesPerSite);
        }

        public int getMaxConsecutiveFailures() {
            return Math.max(1, maxConsecutiveFailures);
        }

        public void setMaxConsecutiveFailures(int maxConsecutiveFailures) {
            this.maxConsecutiveFailures = Math.max(1, maxConsecutiveFailures);
        }
    }

    public static class Run {
        private int maxDurationSeconds = 0;

        public int getMaxDurationSeconds() {
            return Math.max(0, maxDurationSeconds);
        }

        public void setMaxDurationSeconds(int maxDurationSeconds) {
            this.maxDurationSeconds = Math.max(0, maxDurationSeconds);
        }
    }

    /**
     * Controls how close two listings must be to count as the same property.
     */
    public static class Dedup {
        private boolean useLocation = true;
        private boolean usePrice = true;
        private boolean useArea = true;
        private boolean useTitleTokens = true;
        private long priceRoundTo = 1;
        private int areaRoundTo = 1;

        public boolean isUseLocation() {
            return useLocation;
        }

        public void setUseLocation(boolean useLocation) {
            this.useLocation = useLocation;
        }

        public boolean isUsePrice() {
            return usePrice;
        }

        public void setUsePrice(boolean usePrice) {
            this.usePrice = usePrice;
        }

        public boolean isUseArea() {
            return useArea;
        }

        public void setUseArea(boolean useArea) {
            this.useArea = useArea;
        }

        public boolean isUseTitleTokens() {
            return useTitleTokens;
        }

        public void setUseTitleTokens(boolean useTitleTokens) {
            this.useTitleTokens = useTitleTokens;
        }

        public long getPriceRoundTo() {
            return Math.max(1, priceRoundTo);
        }

        public void setPriceRoundTo(long priceRoundTo) {
            this.priceRoundTo = Math.max(1, priceRoundTo);
        }

        public int getAreaRoundTo() {
            return Math.max(1, areaRoundTo);
        }

        public void setAreaRoundTo(int areaRoundTo) {
            this.areaRoundTo = Math.max(1, areaRoundTo);
        }
    }

    public static class Metrics {
        private int memorySampleIntervalMs = 200;

        public int getMemorySampleIntervalMs() {
            return Math.max(10, memorySampleIntervalMs);
        }

        public void setMemorySampleIntervalMs(int memorySampleIntervalMs) {
            this.memorySampleIntervalMs = Math.max(10, memorySampleIntervalMs);
        }
    }

    public static class Output {
        private String directory = "data";

        public String getDirectory() {
            return directory == null || directory.isBlank() ? "data" : directory.trim();
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class Site {
        private String searchUrlTemplate;
        private String userAgent;

        public String getSearchUrlTemplate() {
            return searchUrlTemplate;
        }

        public void setSearchUrlTemplate(String searchUrlTemplate) {
            this.searchUrlTemplate = searchUrlTemplate;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }
    }

    public static class Cli {
        private boolean run;
        private String city = "";
        private String sites = SiteId.ALL;
        private boolean writeCsv = true;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getCity() {
            return city;
        }

        public void setCity(String city) {
            this.city = city;
        }

        public String getSites() {
            return sites;
        }

        public void setSites(String sites) {
            this.sites = sites;
        }

        public boolean isWriteCsv() {
            return writeCsv;
        }

        public void setWriteCsv(boolean writeCsv) {
            this.writeCsv = writeCsv;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}

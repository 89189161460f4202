package com.storescout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "scout")
public class StoreScoutProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private List<String> userAgents = new ArrayList<>();
    private int requestTimeoutSeconds = 30;
    private int requestMaxRetries = 3;
    private long rateLimitBaseWaitMs = 30_000;
    private long serverErrorWaitMs = 10_000;
    private long maxBackoffMs = 300_000;
    private long blockedWaitMs = 300_000;
    private long minRequestDelayMs = 300;
    private long maxRequestDelayMs = 500;
    private int shutdownGraceSeconds = 30;
    private Cache cache = new Cache();
    private Workers workers = new Workers();
    private Progress progress = new Progress();
    private TestMode testMode = new TestMode();
    private Validation validation = new Validation();
    private Cli cli = new Cli();
    private Map<String, RetailerProperties> retailers = new LinkedHashMap<>();

    public List<String> getUserAgents() {
        if (userAgents == null || userAgents.stream().allMatch(ua -> ua == null || ua.isBlank())) {
            return List.of(DEFAULT_USER_AGENT);
        }
        return userAgents.stream().filter(ua -> ua != null && !ua.isBlank()).map(String::trim).toList();
    }

    public void setUserAgents(List<String> userAgents) {
        this.userAgents = userAgents == null ? new ArrayList<>() : new ArrayList<>(userAgents);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestMaxRetries() {
        return Math.max(1, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(1, requestMaxRetries);
    }

    public long getRateLimitBaseWaitMs() {
        return Math.max(0, rateLimitBaseWaitMs);
    }

    public void setRateLimitBaseWaitMs(long rateLimitBaseWaitMs) {
        this.rateLimitBaseWaitMs = Math.max(0, rateLimitBaseWaitMs);
    }

    public long getServerErrorWaitMs() {
        return Math.max(0, serverErrorWaitMs);
    }

    public void setServerErrorWaitMs(long serverErrorWaitMs) {
        this.serverErrorWaitMs = Math.max(0, serverErrorWaitMs);
    }

    public long getMaxBackoffMs() {
        return Math.max(0, maxBackoffMs);
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
        this.maxBackoffMs = Math.max(0, maxBackoffMs);
    }

    public long getBlockedWaitMs() {
        return Math.max(0, blockedWaitMs);
    }

    public void setBlockedWaitMs(long blockedWaitMs) {
        this.blockedWaitMs = Math.max(0, blockedWaitMs);
    }

    public long getMinRequestDelayMs() {
        return Math.max(0, minRequestDelayMs);
    }

    public void setMinRequestDelayMs(long minRequestDelayMs) {
        this.minRequestDelayMs = Math.max(0, minRequestDelayMs);
    }

    public long getMaxRequestDelayMs() {
        return Math.max(getMinRequestDelayMs(), maxRequestDelayMs);
    }

    public void setMaxRequestDelayMs(long maxRequestDelayMs) {
        this.maxRequestDelayMs = Math.max(0, maxRequestDelayMs);
    }

    public int getShutdownGraceSeconds() {
        return Math.max(0, shutdownGraceSeconds);
    }

    public void setShutdownGraceSeconds(int shutdownGraceSeconds) {
        this.shutdownGraceSeconds = Math.max(0, shutdownGraceSeconds);
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Workers getWorkers() {
        return workers;
    }

    public void setWorkers(Workers workers) {
        this.workers = workers;
    }

    public Progress getProgress() {
        return progress;
    }

    public void setProgress(Progress progress) {
        this.progress = progress;
    }

    public TestMode getTestMode() {
        return testMode;
    }

    public void setTestMode(TestMode testMode) {
        this.testMode = testMode;
    }

    public Validation getValidation() {
        return validation;
    }

    public void setValidation(Validation validation) {
        this.validation = validation;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Map<String, RetailerProperties> getRetailers() {
        return retailers;
    }

    public void setRetailers(Map<String, RetailerProperties> retailers) {
        this.retailers = retailers == null ? new LinkedHashMap<>() : retailers;
    }

    public static class Cache {
        private boolean enabled = true;
        private String dir = "data";
        private int urlTtlDays = 7;
        private int responseTtlDays = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDir() {
            return dir == null || dir.isBlank() ? "data" : dir.trim();
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public int getUrlTtlDays() {
            return Math.max(0, urlTtlDays);
        }

        public void setUrlTtlDays(int urlTtlDays) {
            this.urlTtlDays = Math.max(0, urlTtlDays);
        }

        public int getResponseTtlDays() {
            return Math.max(0, responseTtlDays);
        }

        public void setResponseTtlDays(int responseTtlDays) {
            this.responseTtlDays = Math.max(0, responseTtlDays);
        }
    }

    public static class Workers {
        private int direct = 4;
        private int proxied = 10;

        public int getDirect() {
            return Math.max(1, direct);
        }

        public void setDirect(int direct) {
            this.direct = Math.max(1, direct);
        }

        public int getProxied() {
            return Math.max(1, proxied);
        }

        public void setProxied(int proxied) {
            this.proxied = Math.max(1, proxied);
        }
    }

    public static class Progress {
        private int interval = 100;

        public int getInterval() {
            return Math.max(1, interval);
        }

        public void setInterval(int interval) {
            this.interval = Math.max(1, interval);
        }
    }

    public static class TestMode {
        private double gridSpacingMiles = 200;

        public double getGridSpacingMiles() {
            return gridSpacingMiles;
        }

        public void setGridSpacingMiles(double gridSpacingMiles) {
            this.gridSpacingMiles = gridSpacingMiles;
        }
    }

    public static class Validation {
        private boolean strict = false;
        private int errorLogLimit = 10;

        public boolean isStrict() {
            return strict;
        }

        public void setStrict(boolean strict) {
            this.strict = strict;
        }

        public int getErrorLogLimit() {
            return Math.max(0, errorLogLimit);
        }

        public void setErrorLogLimit(int errorLogLimit) {
            this.errorLogLimit = Math.max(0, errorLogLimit);
        }
    }

    public static class Cli {
        private boolean run;
        private String retailer = "cricket";
        private Integer limit;
        private boolean test;
        private boolean refresh;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getRetailer() {
            return retailer;
        }

        public void setRetailer(String retailer) {
            this.retailer = retailer;
        }

        public Integer getLimit() {
            return limit;
        }

        public void setLimit(Integer limit) {
            this.limit = limit;
        }

        public boolean isTest() {
            return test;
        }

        public void setTest(boolean test) {
            this.test = test;
        }

        public boolean isRefresh() {
            return refresh;
        }

        public void setRefresh(boolean refresh) {
            this.refresh = refresh;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}

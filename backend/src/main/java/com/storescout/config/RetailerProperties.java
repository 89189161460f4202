package com.storescout.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-retailer scan settings, bound from {@code scout.retailers.<name>}.
 */
public class RetailerProperties {
    private double gridSpacingMiles = 50;
    private double searchRadiusMiles = 50;
    private Integer parallelWorkers;
    private String defaultCountry = "US";
    private Bounds bounds = new Bounds();
    private Proxy proxy = new Proxy();
    private Api api = new Api();
    private Map<String, String> storeTypes = new LinkedHashMap<>();

    public double getGridSpacingMiles() {
        return gridSpacingMiles;
    }

    public void setGridSpacingMiles(double gridSpacingMiles) {
        this.gridSpacingMiles = gridSpacingMiles;
    }

    public double getSearchRadiusMiles() {
        return searchRadiusMiles;
    }

    public void setSearchRadiusMiles(double searchRadiusMiles) {
        this.searchRadiusMiles = searchRadiusMiles;
    }

    public Integer getParallelWorkers() {
        return parallelWorkers == null ? null : Math.max(1, parallelWorkers);
    }

    public void setParallelWorkers(Integer parallelWorkers) {
        this.parallelWorkers = parallelWorkers;
    }

    public String getDefaultCountry() {
        return defaultCountry == null || defaultCountry.isBlank() ? "US" : defaultCountry.trim();
    }

    public void setDefaultCountry(String defaultCountry) {
        this.defaultCountry = defaultCountry;
    }

    public Bounds getBounds() {
        return bounds;
    }

    public void setBounds(Bounds bounds) {
        this.bounds = bounds;
    }

    public Proxy getProxy() {
        return proxy;
    }

    public void setProxy(Proxy proxy) {
        this.proxy = proxy;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Map<String, String> getStoreTypes() {
        return storeTypes;
    }

    public void setStoreTypes(Map<String, String> storeTypes) {
        this.storeTypes = storeTypes == null ? new LinkedHashMap<>() : storeTypes;
    }

    public enum ProxyMode {
        DIRECT,
        PROXIED
    }

    /**
     * Continental US by default.
     */
    public static class Bounds {
        private double latMin = 24.5;
        private double latMax = 49.4;
        private double lngMin = -125.0;
        private double lngMax = -66.9;

        public double getLatMin() {
            return latMin;
        }

        public void setLatMin(double latMin) {
            this.latMin = latMin;
        }

        public double getLatMax() {
            return latMax;
        }

        public void setLatMax(double latMax) {
            this.latMax = latMax;
        }

        public double getLngMin() {
            return lngMin;
        }

        public void setLngMin(double lngMin) {
            this.lngMin = lngMin;
        }

        public double getLngMax() {
            return lngMax;
        }

        public void setLngMax(double lngMax) {
            this.lngMax = lngMax;
        }
    }

    public static class Proxy {
        private ProxyMode mode = ProxyMode.DIRECT;
        private String host;
        private Integer port;
        private String username;
        private String password;

        public ProxyMode getMode() {
            return mode == null ? ProxyMode.DIRECT : mode;
        }

        public void setMode(ProxyMode mode) {
            this.mode = mode;
        }

        public boolean isProxied() {
            return getMode() == ProxyMode.PROXIED;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public Integer getPort() {
            return port;
        }

        public void setPort(Integer port) {
            this.port = port;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }

    public static class Api {
        private String baseUrl = "https://prod-cdn.us.yextapis.com/v2/accounts/me/search/query";
        private String apiKey = "";
        private String experienceKey = "";
        private String version = "20220511";
        private String locale = "en";
        private String referer;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey == null ? "" : apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getExperienceKey() {
            return experienceKey == null ? "" : experienceKey;
        }

        public void setExperienceKey(String experienceKey) {
            this.experienceKey = experienceKey;
        }

        public String getVersion() {
            return version == null ? "" : version;
        }

        public void setVersion(String version) {
            this.version = version;
        }

        public String getLocale() {
            return locale == null || locale.isBlank() ? "en" : locale;
        }

        public void setLocale(String locale) {
            this.locale = locale;
        }

        public String getReferer() {
            return referer;
        }

        public void setReferer(String referer) {
            this.referer = referer;
        }
    }
}

package com.storescout.scan.search;

import com.storescout.config.RetailerProperties;
import com.storescout.scan.model.GridPoint;
import com.storescout.scan.service.ScanConfigurationException;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Location-search query URL for one grid point. The provider has no result-count parameter;
 * it returns every match inside the radius up to its own cap.
 */
public final class SearchUrlBuilder {
    public static final double METERS_PER_MILE = 1609.34;

    private SearchUrlBuilder() {
    }

    public static String build(RetailerProperties.Api api, GridPoint point, double radiusMiles) {
        requireConfigured(api);
        return api.getBaseUrl().trim()
            + "?api_key=" + encode(api.getApiKey())
            + "&experienceKey=" + encode(api.getExperienceKey())
            + "&v=" + encode(api.getVersion())
            + "&locale=" + encode(api.getLocale())
            + "&input="
            + "&location=" + point.asQueryValue()
            + "&locationRadius=" + radiusMeters(radiusMiles);
    }

    /**
     * @throws ScanConfigurationException when the base URL or the API key is blank
     */
    public static void requireConfigured(RetailerProperties.Api api) {
        if (api == null || api.getBaseUrl() == null || api.getBaseUrl().isBlank()) {
            throw new ScanConfigurationException("Search API base URL is not configured");
        }
        if (api.getApiKey().isBlank()) {
            throw new ScanConfigurationException("Search API key is not configured");
        }
    }

    /**
     * @throws ScanConfigurationException when the radius is not a positive finite number
     */
    public static int radiusMeters(double radiusMiles) {
        if (!Double.isFinite(radiusMiles) || radiusMiles <= 0) {
            throw new ScanConfigurationException("Search radius must be positive, got " + radiusMiles);
        }
        return (int) (radiusMiles * METERS_PER_MILE);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}

package com.storescout.scan.grid;

import com.storescout.config.RetailerProperties;
import com.storescout.scan.service.ScanConfigurationException;

public record BoundingBox(double latMin, double latMax, double lngMin, double lngMax) {

    public BoundingBox {
        if (!Double.isFinite(latMin) || !Double.isFinite(latMax)
            || !Double.isFinite(lngMin) || !Double.isFinite(lngMax)) {
            throw new ScanConfigurationException("Bounding box coordinates must be finite");
        }
        if (latMin < -90.0 || latMax > 90.0 || lngMin < -180.0 || lngMax > 180.0) {
            throw new ScanConfigurationException(
                "Bounding box out of range: lat [" + latMin + ", " + latMax + "], lng [" + lngMin + ", " + lngMax + "]"
            );
        }
        if (latMin > latMax || lngMin > lngMax) {
            throw new ScanConfigurationException(
                "Bounding box is inverted: lat [" + latMin + ", " + latMax + "], lng [" + lngMin + ", " + lngMax + "]"
            );
        }
    }

    public static BoundingBox from(RetailerProperties.Bounds bounds) {
        if (bounds == null) {
            throw new ScanConfigurationException("Retailer bounds are not configured");
        }
        return new BoundingBox(bounds.getLatMin(), bounds.getLatMax(), bounds.getLngMin(), bounds.getLngMax());
    }

    public boolean contains(double latitude, double longitude) {
        return latitude >= latMin && latitude <= latMax && longitude >= lngMin && longitude <= lngMax;
    }
}

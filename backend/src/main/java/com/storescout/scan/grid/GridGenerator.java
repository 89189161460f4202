package com.storescout.scan.grid;

import com.storescout.scan.model.GridPoint;
import com.storescout.scan.service.ScanConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Tiles a bounding box into a row-major lattice of search points.
 *
 * <p>Degrees per mile use a fixed mid-latitude approximation (about 37°N): one degree of
 * latitude is 69 miles and one degree of longitude is 54.6 miles. Cells get narrower towards
 * the poles, so coverage is not geodesically exact outside the continental US.
 */
public final class GridGenerator {
    public static final double MILES_PER_DEGREE_LAT = 69.0;
    public static final double MILES_PER_DEGREE_LNG = 54.6;

    private static final double ROUNDING_SCALE = 10_000.0;

    private GridGenerator() {
    }

    /**
     * Points start at {@code (latMin, lngMin)}; latitude is the outer loop, both ascending.
     * Every point whose unrounded coordinate is within the max bound is included.
     *
     * @throws ScanConfigurationException when spacing is not a positive finite number
     */
    public static List<GridPoint> generate(BoundingBox box, double spacingMiles) {
        if (box == null) {
            throw new ScanConfigurationException("Bounding box is required");
        }
        if (!Double.isFinite(spacingMiles) || spacingMiles <= 0) {
            throw new ScanConfigurationException("Grid spacing must be positive, got " + spacingMiles);
        }
        double latStep = spacingMiles / MILES_PER_DEGREE_LAT;
        double lngStep = spacingMiles / MILES_PER_DEGREE_LNG;

        List<GridPoint> points = new ArrayList<>();
        for (int row = 0; ; row++) {
            double lat = box.latMin() + row * latStep;
            if (lat > box.latMax()) {
                break;
            }
            for (int col = 0; ; col++) {
                double lng = box.lngMin() + col * lngStep;
                if (lng > box.lngMax()) {
                    break;
                }
                points.add(new GridPoint(
                    clamp(round(lat), box.latMin(), box.latMax()),
                    clamp(round(lng), box.lngMin(), box.lngMax())
                ));
            }
        }
        return List.copyOf(points);
    }

    static double round(double value) {
        return Math.round(value * ROUNDING_SCALE) / ROUNDING_SCALE;
    }

    // Rounding must not push a point outside bounds that carry more than four decimals.
    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}

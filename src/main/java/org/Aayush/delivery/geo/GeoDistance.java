package org.Aayush.delivery.geo;

import lombok.experimental.UtilityClass;

import java.util.Collection;
import java.util.Objects;

/**
 * Great-circle distance helpers.
 */
@UtilityClass
public class GeoDistance {
    public static final double EARTH_RADIUS_KM = 6_371.0d;

    /**
     * Computes great-circle distance in kilometers using the haversine formulation.
     *
     * @param a first coordinate.
     * @param b second coordinate.
     * @return non-negative distance in kilometers, exactly {@code 0} for equal points.
     */
    public static double distanceKm(Coordinate a, Coordinate b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.equals(b)) {
            return 0.0d;
        }
        return distanceKm(a.latitude(), a.longitude(), b.latitude(), b.longitude());
    }

    /**
     * Raw-degree overload of {@link #distanceKm(Coordinate, Coordinate)}.
     */
    public static double distanceKm(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg));

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double h = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double c = 2.0d * Math.asin(Math.sqrt(clamp(h, 0.0d, 1.0d)));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Arithmetic mean of a set of coordinates, or null for an empty set.
     *
     * <p>Adequate for the city-scale areas this planner works with; it does not
     * handle sets straddling the antimeridian.</p>
     */
    public static Coordinate centroid(Collection<Coordinate> points) {
        if (points == null || points.isEmpty()) {
            return null;
        }
        double latSum = 0.0d;
        double lonSum = 0.0d;
        for (Coordinate point : points) {
            latSum += point.latitude();
            lonSum += point.longitude();
        }
        return new Coordinate(latSum / points.size(), lonSum / points.size());
    }

    /**
     * Normalizes delta-longitude into the principal range {@code (-180, 180]}.
     */
    static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        double normalized = ((deltaLonDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}

package org.Aayush.delivery.geo;

/**
 * Immutable latitude/longitude pair in decimal degrees.
 *
 * <p>Construction rejects non-finite values and values outside
 * {@code [-90, 90]} x {@code [-180, 180]}.</p>
 */
public record Coordinate(double latitude, double longitude) {
    private static final double MIN_LAT = -90.0d;
    private static final double MAX_LAT = 90.0d;
    private static final double MIN_LON = -180.0d;
    private static final double MAX_LON = 180.0d;

    public static final Coordinate ORIGIN = new Coordinate(0.0d, 0.0d);

    public Coordinate {
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
            throw new IllegalArgumentException("coordinates must be finite");
        }
        if (latitude < MIN_LAT || latitude > MAX_LAT || longitude < MIN_LON || longitude > MAX_LON) {
            throw new IllegalArgumentException(
                    "coordinates must be in [-90,90] and [-180,180]: " + latitude + "," + longitude
            );
        }
    }

    /**
     * Convenience factory mirroring {@code (lat, lon)} argument order.
     */
    public static Coordinate of(double latitude, double longitude) {
        return new Coordinate(latitude, longitude);
    }
}

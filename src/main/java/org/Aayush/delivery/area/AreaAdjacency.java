package org.Aayush.delivery.area;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.delivery.geo.Coordinate;
import org.Aayush.delivery.geo.GeoDistance;
import org.Aayush.delivery.model.Area;

/**
 * Decides whether two coverage areas are close enough to share one route.
 *
 * <p>Rules, first match wins:</p>
 * <ol>
 * <li>Either side absent: adjacent. A route without an area constrains nothing.</li>
 * <li>Same area code: adjacent.</li>
 * <li>Both representative coordinates known: adjacent iff their great-circle
 * distance is at most {@link #proximityThresholdKm()}.</li>
 * <li>Otherwise not adjacent.</li>
 * </ol>
 */
@Getter
@Accessors(fluent = true)
public final class AreaAdjacency {
    public static final double DEFAULT_PROXIMITY_THRESHOLD_KM = 10.0d;

    private final double proximityThresholdKm;

    /**
     * @param proximityThresholdKm inclusive distance between representatives for two areas to be adjacent.
     * @throws IllegalArgumentException when the threshold is negative or not finite.
     */
    public AreaAdjacency(double proximityThresholdKm) {
        if (!Double.isFinite(proximityThresholdKm) || proximityThresholdKm < 0.0d) {
            throw new IllegalArgumentException(
                    "proximityThresholdKm must be finite and >= 0: " + proximityThresholdKm
            );
        }
        this.proximityThresholdKm = proximityThresholdKm;
    }

    public static AreaAdjacency withDefaultThreshold() {
        return new AreaAdjacency(DEFAULT_PROXIMITY_THRESHOLD_KM);
    }

    /**
     * Adjacency test. A null area is adjacent to everything; an area without a
     * representative is adjacent only to its own code.
     */
    public boolean adjacent(Area a, Area b) {
        if (a == null || b == null) {
            return true;
        }
        if (a.code().equals(b.code())) {
            return true;
        }
        Coordinate first = a.representative();
        Coordinate second = b.representative();
        if (first == null || second == null) {
            return false;
        }
        return GeoDistance.distanceKm(first, second) <= proximityThresholdKm;
    }
}

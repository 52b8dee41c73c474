package org.Aayush.delivery.model;

import org.Aayush.delivery.geo.Coordinate;
import org.Aayush.delivery.geo.GeoDistance;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Named coverage region of customers.
 *
 * <p>Areas are identified by their code. The representative coordinate is
 * cached and recomputed on every membership change so that adjacency checks
 * never touch member data. An explicit override, when set, wins over the
 * member centroid.</p>
 */
public final class Area {
    static final String UNNAMED_AREA_CODE = "UNNAMED_AREA";

    private final String code;
    private final String name;
    private volatile boolean active;
    private final Map<String, Coordinate> memberCoordinates = new LinkedHashMap<>();
    private Coordinate representativeOverride;
    private volatile Coordinate representative;

    /**
     * @param code explicit code; blank derives it from {@code name}.
     * @param name display name, required.
     */
    public Area(String code, String name) {
        this.name = Objects.requireNonNull(name, "name");
        this.code = code == null || code.isBlank() ? codeFromName(name) : code.trim();
        this.active = true;
    }

    /**
     * Creates an area whose code is derived from its name.
     */
    public static Area named(String name) {
        return new Area(null, name);
    }

    /**
     * Upper-cases the name and replaces spaces and dashes with underscores.
     */
    public static String codeFromName(String name) {
        if (name == null || name.isBlank()) {
            return UNNAMED_AREA_CODE;
        }
        return name.trim().toUpperCase().replace(' ', '_').replace('-', '_');
    }

    public String code() {
        return code;
    }

    public String name() {
        return name;
    }

    public boolean active() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    /**
     * Adds or moves a member customer and refreshes the representative coordinate.
     */
    public synchronized void putMember(String customerId, Coordinate location) {
        memberCoordinates.put(
                Objects.requireNonNull(customerId, "customerId"),
                Objects.requireNonNull(location, "location")
        );
        refreshRepresentative();
    }

    /**
     * Drops a member customer; the representative is refreshed only when it was a member.
     */
    public synchronized void removeMember(String customerId) {
        if (memberCoordinates.remove(customerId) != null) {
            refreshRepresentative();
        }
    }

    public synchronized int memberCount() {
        return memberCoordinates.size();
    }

    /**
     * Pins the representative coordinate, for areas defined by a depot or boundary center
     * rather than by member customers. Passing null falls back to the member centroid.
     */
    public synchronized void setRepresentativeOverride(Coordinate override) {
        this.representativeOverride = override;
        refreshRepresentative();
    }

    /**
     * Cached representative coordinate, or null when the area has no members and no override.
     */
    public Coordinate representative() {
        return representative;
    }

    private void refreshRepresentative() {
        if (representativeOverride != null) {
            representative = representativeOverride;
            return;
        }
        List<Coordinate> points = new ArrayList<>(memberCoordinates.values());
        representative = GeoDistance.centroid(points);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Area other)) {
            return false;
        }
        return code.equals(other.code);
    }

    @Override
    public int hashCode() {
        return code.hashCode();
    }

    @Override
    public String toString() {
        return code + " - " + name;
    }
}

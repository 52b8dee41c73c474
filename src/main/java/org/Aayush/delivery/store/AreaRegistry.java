package org.Aayush.delivery.store;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.Aayush.delivery.geo.Coordinate;
import org.Aayush.delivery.model.Area;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * In-memory registry of coverage areas and customer membership.
 *
 * <p>Area codes are unique. Moving a customer to another area updates both
 * areas' cached representative coordinates.</p>
 */
public final class AreaRegistry {
    private final Object2ObjectLinkedOpenHashMap<String, Area> areasByCode = new Object2ObjectLinkedOpenHashMap<>();
    private final Object2ObjectOpenHashMap<String, String> areaCodeByCustomer = new Object2ObjectOpenHashMap<>();

    /**
     * Registers a new area.
     *
     * @throws IllegalArgumentException when the code is already taken.
     */
    public synchronized Area register(Area area) {
        Objects.requireNonNull(area, "area");
        if (areasByCode.containsKey(area.code())) {
            throw new IllegalArgumentException("Area code must be unique: " + area.code());
        }
        areasByCode.put(area.code(), area);
        return area;
    }

    /**
     * Returns the area for {@code code}, or null when unknown.
     */
    public synchronized Area find(String code) {
        return code == null ? null : areasByCode.get(code);
    }

    /**
     * Active areas in registration order.
     */
    public synchronized List<Area> activeAreas() {
        List<Area> result = new ArrayList<>();
        for (Area area : areasByCode.values()) {
            if (area.active()) {
                result.add(area);
            }
        }
        return result;
    }

    /**
     * Assigns a customer to an area, removing it from its previous area.
     *
     * @throws IllegalArgumentException when the area code is unknown.
     */
    public synchronized void assignCustomer(String customerId, Coordinate location, String areaCode) {
        Objects.requireNonNull(customerId, "customerId");
        Area target = areasByCode.get(areaCode);
        if (target == null) {
            throw new IllegalArgumentException("Unknown area code: " + areaCode);
        }
        String previous = areaCodeByCustomer.put(customerId, target.code());
        if (previous != null && !previous.equals(target.code())) {
            Area old = areasByCode.get(previous);
            if (old != null) {
                old.removeMember(customerId);
            }
        }
        target.putMember(customerId, location);
    }

    /**
     * Area the customer belongs to, or null when unassigned.
     */
    public synchronized Area areaOfCustomer(String customerId) {
        String code = areaCodeByCustomer.get(customerId);
        return code == null ? null : areasByCode.get(code);
    }
}

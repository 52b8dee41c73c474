package org.Aayush.delivery.model;

import java.util.Objects;

/**
 * Vehicle reference assigned to a route. Owned by the fleet registry, read-only here.
 */
public record Vehicle(String vehicleId, VehicleCapacity capacity) {
    public Vehicle {
        Objects.requireNonNull(vehicleId, "vehicleId");
        Objects.requireNonNull(capacity, "capacity");
    }
}

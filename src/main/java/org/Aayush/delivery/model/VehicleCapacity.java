package org.Aayush.delivery.model;

/**
 * Read-only weight/volume limits of the vehicle serving a route.
 */
public record VehicleCapacity(double maxWeight, double maxVolume) {
    public VehicleCapacity {
        if (!Double.isFinite(maxWeight) || maxWeight < 0.0d) {
            throw new IllegalArgumentException("maxWeight must be finite and >= 0: " + maxWeight);
        }
        if (!Double.isFinite(maxVolume) || maxVolume < 0.0d) {
            throw new IllegalArgumentException("maxVolume must be finite and >= 0: " + maxVolume);
        }
    }

    public static VehicleCapacity of(double maxWeight, double maxVolume) {
        return new VehicleCapacity(maxWeight, maxVolume);
    }
}

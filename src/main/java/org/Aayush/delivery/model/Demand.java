package org.Aayush.delivery.model;

/**
 * Cargo demand expressed as weight and volume.
 *
 * <p>Both components are non-negative. Units follow the vehicle capacity
 * units (kilograms and cubic meters in the default deployment).</p>
 */
public record Demand(double weight, double volume) {
    public static final Demand ZERO = new Demand(0.0d, 0.0d);

    public Demand {
        if (!Double.isFinite(weight) || weight < 0.0d) {
            throw new IllegalArgumentException("weight must be finite and >= 0: " + weight);
        }
        if (!Double.isFinite(volume) || volume < 0.0d) {
            throw new IllegalArgumentException("volume must be finite and >= 0: " + volume);
        }
    }

    public static Demand of(double weight, double volume) {
        return new Demand(weight, volume);
    }

    public Demand plus(Demand other) {
        return new Demand(weight + other.weight, volume + other.volume);
    }

    /**
     * Returns true when this demand fits inside {@code capacity} on both dimensions.
     */
    public boolean fitsWithin(VehicleCapacity capacity) {
        return weight <= capacity.maxWeight() && volume <= capacity.maxVolume();
    }
}

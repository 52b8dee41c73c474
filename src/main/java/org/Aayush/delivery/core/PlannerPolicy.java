package org.Aayush.delivery.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.delivery.area.AreaAdjacency;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Tunable planner constants.
 *
 * <p>Values can be set through the builder or loaded from a properties source
 * using the {@code planner.*} keys below. Missing keys keep their defaults.</p>
 */
@Value
@Builder
public class PlannerPolicy {
    public static final String REASON_INVALID_POLICY = "PLANNER_INVALID_POLICY";

    public static final String DEFAULT_RESOURCE = "route-planner.properties";
    public static final String KEY_PROXIMITY_THRESHOLD_KM = "planner.proximity-threshold-km";
    public static final String KEY_FLEET_PARALLELISM = "planner.fleet-parallelism";
    public static final String KEY_SPLIT_ON_INTAKE = "planner.split-on-intake";

    /**
     * Max distance between two areas' representative coordinates for them to count as adjacent.
     */
    @Builder.Default
    double proximityThresholdKm = AreaAdjacency.DEFAULT_PROXIMITY_THRESHOLD_KM;

    /**
     * Worker threads for fleet-wide distance optimization. {@code 1} runs on the caller thread.
     */
    @Builder.Default
    int fleetParallelism = 1;

    /**
     * Whether routes built from an over-capacity batch are split immediately.
     */
    @Builder.Default
    boolean splitOnIntake = true;

    public static PlannerPolicy defaults() {
        return PlannerPolicy.builder().build();
    }

    /**
     * Loads {@link #DEFAULT_RESOURCE} from the classpath, or returns defaults when it is absent.
     */
    public static PlannerPolicy fromClasspath() {
        ClassLoader loader = PlannerPolicy.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to read " + DEFAULT_RESOURCE, ex);
        }
    }

    /**
     * Builds a policy from {@code planner.*} keys, falling back to defaults for absent keys.
     *
     * @param properties property source.
     * @return validated policy.
     * @throws IllegalArgumentException when a value does not parse or is out of range.
     */
    public static PlannerPolicy fromProperties(Properties properties) {
        PlannerPolicy defaults = defaults();
        PlannerPolicy policy = PlannerPolicy.builder()
                .proximityThresholdKm(parseDouble(
                        properties, KEY_PROXIMITY_THRESHOLD_KM, defaults.getProximityThresholdKm()))
                .fleetParallelism(parseInt(
                        properties, KEY_FLEET_PARALLELISM, defaults.getFleetParallelism()))
                .splitOnIntake(Boolean.parseBoolean(properties.getProperty(
                        KEY_SPLIT_ON_INTAKE, Boolean.toString(defaults.isSplitOnIntake())).trim()))
                .build();
        policy.validate();
        return policy;
    }

    /**
     * Checks value ranges.
     *
     * @throws IllegalArgumentException with a {@link #REASON_INVALID_POLICY} prefix.
     */
    public void validate() {
        if (!Double.isFinite(proximityThresholdKm) || proximityThresholdKm < 0.0d) {
            throw new IllegalArgumentException(
                    REASON_INVALID_POLICY + ": proximityThresholdKm must be finite and >= 0"
            );
        }
        if (fleetParallelism < 1) {
            throw new IllegalArgumentException(REASON_INVALID_POLICY + ": fleetParallelism must be >= 1");
        }
    }

    public AreaAdjacency adjacency() {
        return new AreaAdjacency(proximityThresholdKm);
    }

    private static double parseDouble(Properties properties, String key, double fallback) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(REASON_INVALID_POLICY + ": " + key + " is not a number: " + raw, ex);
        }
    }

    private static int parseInt(Properties properties, String key, int fallback) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(REASON_INVALID_POLICY + ": " + key + " is not an integer: " + raw, ex);
        }
    }
}

package org.Aayush.delivery.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of re-sequencing one route by distance.
 */
@Value
@Builder
public class DistanceOptimizationResult {
    long routeId;
    PlanningStatus status;
    /** Route distance in kilometers before re-sequencing. */
    double beforeDistanceKm;
    /** Route distance in kilometers after re-sequencing. */
    double afterDistanceKm;
    /** Stops whose sequence changed. */
    @Singular
    List<Long> affectedStopIds;
    String message;
}

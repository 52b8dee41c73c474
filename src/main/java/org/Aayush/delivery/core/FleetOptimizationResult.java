package org.Aayush.delivery.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of distance optimization over every plannable route.
 */
@Value
@Builder
public class FleetOptimizationResult {
    PlanningStatus status;
    @Singular
    List<DistanceOptimizationResult> perRouteResults;
    String message;

    public long count(PlanningStatus status) {
        return perRouteResults.stream().filter(r -> r.getStatus() == status).count();
    }
}

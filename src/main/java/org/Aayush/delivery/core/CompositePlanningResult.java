package org.Aayush.delivery.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of a split-then-combine run, optionally followed by re-sequencing.
 */
@Value
@Builder
public class CompositePlanningResult {
    long routeId;
    PlanningStatus status;
    SplitResult split;
    /** One entry per route that attempted to absorb neighbours. */
    @Singular
    List<CombineResult> combines;
    /** Present only for the smart variant. */
    @Singular
    List<DistanceOptimizationResult> optimizations;
    /** Plannable routes left after the run, ascending id. */
    @Singular
    List<Long> resultingRouteIds;
    /** Resulting routes whose demand still exceeds the vehicle. */
    @Singular
    List<Long> overCapacityRouteIds;
    String message;
}

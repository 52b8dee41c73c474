package org.Aayush.delivery.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of splitting a route by per-area capacity.
 */
@Value
@Builder
public class SplitResult {
    long routeId;
    PlanningStatus status;
    /** Ids of sub-routes created by the split. */
    @Singular
    List<Long> newRouteIds;
    /** Stops moved off the source route. */
    @Singular
    List<Long> affectedStopIds;
    /** Stops that individually exceed capacity and need handling at the warehouse. */
    @Singular
    List<Long> oversizedStopIds;
    /** Resulting routes, source included, whose demand still exceeds the vehicle. */
    @Singular
    List<Long> overCapacityRouteIds;
    String message;
}

package org.Aayush.delivery.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of absorbing adjacent routes into a target route.
 */
@Value
@Builder
public class CombineResult {
    long routeId;
    PlanningStatus status;
    /** Routes absorbed and cancelled. */
    @Singular
    List<Long> mergedRouteIds;
    /** Stops moved into the target route. */
    @Singular
    List<Long> affectedStopIds;
    String message;
}

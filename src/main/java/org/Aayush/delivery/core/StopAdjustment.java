package org.Aayush.delivery.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.delivery.model.AdjustmentReason;

import java.time.Instant;

/**
 * Manual dispatcher change to one stop.
 */
@Value
@Builder
public class StopAdjustment {
    long routeId;
    long stopId;
    AdjustmentReason reason;
    /** New visiting position, or null to keep the current one. */
    Integer newSequence;
    /** New window start; applied together with {@link #newTimeWindowEnd} when either is set. */
    Instant newTimeWindowStart;
    Instant newTimeWindowEnd;
}

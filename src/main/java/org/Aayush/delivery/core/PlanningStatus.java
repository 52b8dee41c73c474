package org.Aayush.delivery.core;

/**
 * Outcome class of an orchestration call.
 */
public enum PlanningStatus {
    /** The route aggregate was changed. */
    SUCCESS,
    /**
     * Work was applied but some resulting route still exceeds its vehicle, because a
     * single stop or customer is larger than the vehicle.
     */
    PARTIAL,
    /** Nothing to do: single stop, already optimal, nothing to split or combine. */
    NO_OP,
    /** Capacity-dependent work was skipped because the route has no vehicle. */
    NO_VEHICLE,
    /** The referenced route or stop does not exist. */
    NOT_FOUND,
    /** The request was understood but refused, for example an order larger than the vehicle. */
    REJECTED,
    /** An unexpected failure isolated to this route. */
    FAILED
}

package org.Aayush.delivery.model;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when a route or stop mutation would break the aggregate invariants.
 *
 * <p>Messages are prefixed with deterministic reason-code text, see {@link ReasonCodes}.</p>
 */
@Getter
@Accessors(fluent = true)
public final class RouteStateException extends RuntimeException {
    public static final String REASON_ILLEGAL_TRANSITION = "ROUTE_ILLEGAL_TRANSITION";
    public static final String REASON_NO_VEHICLE = "ROUTE_NO_VEHICLE";
    public static final String REASON_CAPACITY_EXCEEDED = "ROUTE_CAPACITY_EXCEEDED";
    public static final String REASON_NOT_PLANNABLE = "ROUTE_NOT_PLANNABLE";
    public static final String REASON_FOREIGN_STOP = "ROUTE_FOREIGN_STOP";
    public static final String REASON_INVALID_SEQUENCE = "ROUTE_INVALID_SEQUENCE";

    private final String reasonCode;

    /**
     * Creates a reason-coded aggregate invariant failure.
     *
     * @param reasonCode one of the {@code REASON_*} constants.
     * @param message descriptive error message.
     */
    public RouteStateException(String reasonCode, String message) {
        super(ReasonCodes.format(reasonCode, message));
        this.reasonCode = ReasonCodes.require(reasonCode);
    }
}

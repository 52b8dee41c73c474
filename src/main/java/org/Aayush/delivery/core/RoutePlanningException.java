package org.Aayush.delivery.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.delivery.model.ReasonCodes;

/**
 * Reason-coded failure of a planning entry point that cannot be expressed as a result status.
 */
@Getter
@Accessors(fluent = true)
public final class RoutePlanningException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded planning failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public RoutePlanningException(String reasonCode, String message) {
        super(ReasonCodes.format(reasonCode, message));
        this.reasonCode = ReasonCodes.require(reasonCode);
    }

    /**
     * Creates a reason-coded planning failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public RoutePlanningException(String reasonCode, String message, Throwable cause) {
        super(ReasonCodes.format(reasonCode, message), cause);
        this.reasonCode = ReasonCodes.require(reasonCode);
    }
}

package org.Aayush.delivery.model;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Reason-code contract shared by the planner's exceptions.
 *
 * <p>Messages carry a deterministic {@code [REASON_CODE] } prefix so callers and
 * log readers can match failures without parsing free text.</p>
 */
@UtilityClass
public class ReasonCodes {

    /**
     * Formats an exception message with its reason-code prefix.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @return {@code "[" + reasonCode + "] " + message}.
     */
    public static String format(String reasonCode, String message) {
        return "[" + require(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    /**
     * Validates the reason-code contract.
     *
     * @throws IllegalArgumentException when the code is blank.
     */
    public static String require(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}

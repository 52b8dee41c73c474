package org.Aayush.delivery.model;

/**
 * Route lifecycle states.
 *
 * <p>{@code DRAFT -> CONFIRMED -> IN_TRANSIT -> DELIVERED}; any non-terminal
 * state may move to {@code CANCELLED}.</p>
 */
public enum RouteState {
    DRAFT,
    CONFIRMED,
    IN_TRANSIT,
    DELIVERED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED;
    }

    /**
     * Routes that may still be reorganized by split/combine/optimize.
     */
    public boolean isPlannable() {
        return this == DRAFT || this == CONFIRMED;
    }

    public boolean canTransitionTo(RouteState next) {
        if (next == null || isTerminal()) {
            return false;
        }
        return switch (next) {
            case CONFIRMED -> this == DRAFT;
            case IN_TRANSIT -> this == CONFIRMED;
            case DELIVERED -> this == IN_TRANSIT;
            case CANCELLED -> true;
            case DRAFT -> false;
        };
    }
}

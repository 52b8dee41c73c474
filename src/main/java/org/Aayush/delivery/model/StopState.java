package org.Aayush.delivery.model;

/**
 * Delivery state of a single stop.
 */
public enum StopState {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    ADJUSTED
}

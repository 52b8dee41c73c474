package org.Aayush.delivery.model;

/**
 * Why a dispatcher manually adjusted a stop.
 */
public enum AdjustmentReason {
    TRAFFIC,
    WEATHER,
    CUSTOMER,
    VEHICLE,
    OTHER
}

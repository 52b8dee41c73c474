package org.Aayush.delivery.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.experimental.Accessors;
import org.Aayush.delivery.geo.Coordinate;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * One delivery location on a route, with demand aggregated from its orders.
 *
 * <p>A stop belongs to exactly one route at a time. The owning route id and
 * the sequence are only changed through {@link Route}, which keeps the
 * per-route sequence a contiguous {@code 1..N} permutation.</p>
 */
@Getter
@Accessors(fluent = true)
public final class Stop {
    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 4;

    /**
     * Stop ordering used when distributing stops across sub-routes: urgent first,
     * earlier deadline first (open windows last), then id.
     */
    public static final Comparator<Stop> BY_URGENCY = Comparator
            .comparingInt(Stop::priority).reversed()
            .thenComparing(Stop::timeWindowStart, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingLong(Stop::id);

    /** Visiting order, ties by id. */
    public static final Comparator<Stop> BY_SEQUENCE = Comparator
            .comparingInt(Stop::sequence)
            .thenComparingLong(Stop::id);

    private final long id;
    private final String customerId;
    private final Coordinate location;
    private final Demand demand;
    private final Area area;
    private final List<String> orderIds;
    private long routeId;
    private int sequence;
    private Instant timeWindowStart;
    private Instant timeWindowEnd;
    private int priority;
    private StopState state;
    private AdjustmentReason adjustmentReason;

    /**
     * Builder constructor. A new stop is {@link StopState#PENDING} and unowned until
     * {@link Route#addStops} assigns it.
     *
     * @param id store-assigned stop id.
     * @param customerId customer delivered at this stop.
     * @param location delivery coordinate, required.
     * @param demand summed demand of the stop's orders; null means none.
     * @param area area the customer belongs to; may be null.
     * @param orderIds orders delivered at this stop.
     * @param timeWindowStart earliest delivery time, null when open.
     * @param timeWindowEnd latest delivery time, null when open.
     * @param priority urgency in {@code [0,4]}; higher is more urgent.
     * @throws IllegalArgumentException on priority out of range or an inverted window.
     */
    @Builder
    private Stop(
            long id,
            String customerId,
            Coordinate location,
            Demand demand,
            Area area,
            @Singular List<String> orderIds,
            Instant timeWindowStart,
            Instant timeWindowEnd,
            int priority
    ) {
        this.id = id;
        this.customerId = customerId;
        this.location = Objects.requireNonNull(location, "location");
        this.demand = demand == null ? Demand.ZERO : demand;
        this.area = area;
        this.orderIds = List.copyOf(orderIds);
        this.priority = requirePriority(priority);
        setTimeWindow(timeWindowStart, timeWindowEnd);
        this.state = StopState.PENDING;
    }

    /**
     * Sets the delivery state; required.
     */
    public void setState(StopState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    /**
     * @param priority urgency in {@code [0,4]}.
     * @throws IllegalArgumentException when out of range.
     */
    public void setPriority(int priority) {
        this.priority = requirePriority(priority);
    }

    /**
     * Replaces the delivery window. Either bound may be null (open).
     */
    public void setTimeWindow(Instant start, Instant end) {
        if (start != null && end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("time window end precedes start for stop " + id);
        }
        this.timeWindowStart = start;
        this.timeWindowEnd = end;
    }

    /**
     * Records a manual adjustment; the stop becomes {@link StopState#ADJUSTED}.
     */
    public void markAdjusted(AdjustmentReason reason) {
        this.adjustmentReason = Objects.requireNonNull(reason, "reason");
        this.state = StopState.ADJUSTED;
    }

    /**
     * Assigns visiting order. Callers are expected to renumber the whole route.
     */
    public void assignSequence(int sequence) {
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive: " + sequence);
        }
        this.sequence = sequence;
    }

    /**
     * Back-reference to the owning route; only {@link Route} moves ownership.
     */
    void assignRoute(long routeId) {
        this.routeId = routeId;
    }

    private static int requirePriority(int priority) {
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("priority must be in [0,4]: " + priority);
        }
        return priority;
    }

    @Override
    public String toString() {
        return "Stop{" + id + " route=" + routeId + " seq=" + sequence + "}";
    }
}

package org.Aayush.delivery.model;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Route aggregate root: an ordered set of exclusively owned stops served by one vehicle.
 *
 * <p>Invariants maintained by every mutator:</p>
 * <ul>
 * <li>Stop sequences form a contiguous {@code 1..N} permutation.</li>
 * <li>Every owned stop reports this route's id.</li>
 * <li>Leaving {@link RouteState#DRAFT} requires a vehicle whose capacity covers the total demand.</li>
 * </ul>
 *
 * <p>The aggregate is not thread-safe; callers serialize access per batch.</p>
 */
@Getter
@Accessors(fluent = true)
public final class Route {
    private final long id;
    private final String batchId;
    private Area area;
    private Vehicle vehicle;
    private RouteState state;
    @Getter(lombok.AccessLevel.NONE)
    private final List<Stop> stops = new ArrayList<>();

    /**
     * Creates an empty {@link RouteState#DRAFT} route.
     *
     * @param id store-assigned route id.
     * @param batchId picking batch the route delivers; null for unbatched routes.
     * @param area coverage area; null marks a multi-area route.
     * @param vehicle assigned vehicle; may be null until confirmation.
     */
    public Route(long id, String batchId, Area area, Vehicle vehicle) {
        this.id = id;
        this.batchId = batchId;
        this.area = area;
        this.vehicle = vehicle;
        this.state = RouteState.DRAFT;
    }

    /**
     * Owned stops in visiting order.
     */
    public List<Stop> stops() {
        List<Stop> ordered = new ArrayList<>(stops);
        ordered.sort(Stop.BY_SEQUENCE);
        return ordered;
    }

    /**
     * Number of owned stops.
     */
    public int stopCount() {
        return stops.size();
    }

    /**
     * Whether {@code stop} belongs to this route, by both its back-reference and membership.
     */
    public boolean owns(Stop stop) {
        return stop != null && stop.routeId() == id && stops.contains(stop);
    }

    /**
     * Capacity of the assigned vehicle, or null when no vehicle is assigned.
     */
    public VehicleCapacity capacity() {
        return vehicle == null ? null : vehicle.capacity();
    }

    /**
     * Summed demand of all owned stops.
     */
    public Demand totalDemand() {
        Demand total = Demand.ZERO;
        for (Stop stop : stops) {
            total = total.plus(stop.demand());
        }
        return total;
    }

    /**
     * Assigns or clears the vehicle. Capacity is only enforced on {@link #confirm()}.
     */
    public void assignVehicle(Vehicle vehicle) {
        this.vehicle = vehicle;
    }

    /**
     * Re-targets the route's coverage area; null marks a multi-area route.
     */
    public void assignArea(Area area) {
        this.area = area;
    }

    /**
     * Appends new stops at the end of the visiting order and takes ownership.
     */
    public void addStops(Collection<Stop> newStops) {
        for (Stop stop : newStops) {
            Objects.requireNonNull(stop, "stop");
            stop.assignRoute(id);
            stop.assignSequence(stops.size() + 1);
            stops.add(stop);
        }
    }

    /**
     * Moves stops from this route into {@code target}.
     *
     * <p>Moved stops keep their relative order and are appended after the
     * target's existing stops. Both routes are renumbered.</p>
     *
     * @throws RouteStateException when a stop is not owned by this route.
     */
    public void transferStopsTo(Route target, Collection<Stop> moving) {
        Objects.requireNonNull(target, "target");
        if (target == this) {
            return;
        }
        List<Stop> ordered = new ArrayList<>(moving);
        for (Stop stop : ordered) {
            if (!owns(stop)) {
                throw new RouteStateException(
                        RouteStateException.REASON_FOREIGN_STOP,
                        "stop " + stop.id() + " is not owned by route " + id
                );
            }
        }
        ordered.sort(Stop.BY_SEQUENCE);
        stops.removeAll(ordered);
        resequence();
        target.addStops(ordered);
    }

    /**
     * Renumbers stops to {@code 1..N} keeping the current relative order.
     */
    public void resequence() {
        List<Stop> ordered = stops();
        for (int i = 0; i < ordered.size(); i++) {
            ordered.get(i).assignSequence(i + 1);
        }
    }

    /**
     * Applies an explicit visiting order.
     *
     * @param ordered every owned stop exactly once, in the new visiting order.
     * @throws RouteStateException when {@code ordered} is not a permutation of the owned stops.
     */
    public void applyOrder(List<Stop> ordered) {
        if (ordered.size() != stops.size() || !stops.containsAll(ordered)) {
            throw new RouteStateException(
                    RouteStateException.REASON_INVALID_SEQUENCE,
                    "order for route " + id + " must contain every owned stop exactly once"
            );
        }
        for (int i = 0; i < ordered.size(); i++) {
            ordered.get(i).assignSequence(i + 1);
        }
    }

    /**
     * Moves one stop to {@code newSequence}, shifting the stops in between.
     */
    public void reposition(Stop stop, int newSequence) {
        if (!owns(stop)) {
            throw new RouteStateException(
                    RouteStateException.REASON_FOREIGN_STOP,
                    "stop " + (stop == null ? "null" : stop.id()) + " is not owned by route " + id
            );
        }
        if (newSequence < 1 || newSequence > stops.size()) {
            throw new RouteStateException(
                    RouteStateException.REASON_INVALID_SEQUENCE,
                    "sequence " + newSequence + " outside 1.." + stops.size() + " for route " + id
            );
        }
        List<Stop> ordered = stops();
        ordered.remove(stop);
        ordered.add(newSequence - 1, stop);
        applyOrder(ordered);
    }

    public Optional<Stop> findStop(long stopId) {
        for (Stop stop : stops) {
            if (stop.id() == stopId) {
                return Optional.of(stop);
            }
        }
        return Optional.empty();
    }

    /**
     * Confirms a draft route for dispatch.
     *
     * @throws RouteStateException {@code ROUTE_NO_VEHICLE} without a vehicle,
     *                             {@code ROUTE_CAPACITY_EXCEEDED} when the stops do not fit it,
     *                             {@code ROUTE_ILLEGAL_TRANSITION} when the route is not a draft.
     */
    public void confirm() {
        if (vehicle == null) {
            throw new RouteStateException(
                    RouteStateException.REASON_NO_VEHICLE,
                    "route " + id + " cannot be confirmed without a vehicle"
            );
        }
        Demand demand = totalDemand();
        if (!demand.fitsWithin(vehicle.capacity())) {
            throw new RouteStateException(
                    RouteStateException.REASON_CAPACITY_EXCEEDED,
                    "route " + id + " demand " + demand + " exceeds " + vehicle.capacity()
            );
        }
        transitionTo(RouteState.CONFIRMED);
    }

    /**
     * Marks a confirmed route as in transit.
     *
     * @throws RouteStateException when the route is not {@link RouteState#CONFIRMED}.
     */
    public void start() {
        transitionTo(RouteState.IN_TRANSIT);
    }

    /**
     * Completes an in-transit route.
     */
    public void deliver() {
        transitionTo(RouteState.DELIVERED);
    }

    /**
     * Cancels the route. Terminal routes cannot be cancelled.
     */
    public void cancel() {
        transitionTo(RouteState.CANCELLED);
    }

    private void transitionTo(RouteState next) {
        if (!state.canTransitionTo(next)) {
            throw new RouteStateException(
                    RouteStateException.REASON_ILLEGAL_TRANSITION,
                    "route " + id + " cannot move from " + state + " to " + next
            );
        }
        state = next;
    }

    @Override
    public String toString() {
        return "Route{" + id + " " + state + " stops=" + stops.size() + "}";
    }
}

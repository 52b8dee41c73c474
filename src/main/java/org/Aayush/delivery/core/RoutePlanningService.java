package org.Aayush.delivery.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.delivery.area.AreaAdjacency;
import org.Aayush.delivery.batch.BatchRouteBuilder;
import org.Aayush.delivery.batch.BatchRouteResult;
import org.Aayush.delivery.batch.CapacityCheckResult;
import org.Aayush.delivery.batch.DeliveryBatch;
import org.Aayush.delivery.batch.DeliveryOrder;
import org.Aayush.delivery.capacity.CapacitySplitter;
import org.Aayush.delivery.combine.RouteCombiner;
import org.Aayush.delivery.model.Route;
import org.Aayush.delivery.model.Stop;
import org.Aayush.delivery.model.VehicleCapacity;
import org.Aayush.delivery.store.AreaRegistry;
import org.Aayush.delivery.store.InMemoryRouteStore;
import org.Aayush.delivery.store.RouteStore;
import org.Aayush.delivery.tour.TourOptimizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Route planning entry points used by dispatch and automation layers.
 *
 * <p>Every operation addresses routes by id and answers with a structured
 * result instead of throwing for expected conditions: a missing route, a
 * missing vehicle and "nothing to do" are statuses, not exceptions. Illegal
 * lifecycle transitions and malformed input still throw.</p>
 *
 * <p>Split, combine, intake and lifecycle operations run under the
 * per-batch locks of every batch they may touch. Distance optimization only
 * takes the lock of the route's own batch, so the fleet-wide run may fan out
 * across {@link PlannerPolicy#getFleetParallelism()} worker threads.</p>
 */
@Slf4j
public final class RoutePlanningService {
    public static final String REASON_ROUTE_NOT_FOUND = "PLANNER_ROUTE_NOT_FOUND";
    public static final String REASON_STOP_NOT_FOUND = "PLANNER_STOP_NOT_FOUND";
    public static final String REASON_FLEET_RUN_INTERRUPTED = "PLANNER_FLEET_RUN_INTERRUPTED";

    static final String MSG_NO_VEHICLE = "No Vehicle Assigned";
    static final String MSG_NO_OPTIMIZATION_NEEDED = "No Optimization Needed";

    private static final double DISTANCE_EPSILON_KM = 1e-9d;

    private final RouteStore routeStore;
    private final AreaRegistry areaRegistry;
    private final PlannerPolicy policy;
    private final TourOptimizer tourOptimizer;
    private final AreaAdjacency adjacency;
    private final CapacitySplitter capacitySplitter;
    private final RouteCombiner routeCombiner;
    private final BatchRouteBuilder batchRouteBuilder;
    private final BatchLockRegistry batchLocks;

    /**
     * Creates the planning service.
     *
     * @param routeStore route persistence; defaults to an {@link InMemoryRouteStore}.
     * @param areaRegistry area registry; defaults to an empty registry.
     * @param policy planner constants; defaults to {@link PlannerPolicy#defaults()}.
     */
    @Builder
    public RoutePlanningService(RouteStore routeStore, AreaRegistry areaRegistry, PlannerPolicy policy) {
        this.routeStore = routeStore == null ? new InMemoryRouteStore() : routeStore;
        this.areaRegistry = areaRegistry == null ? new AreaRegistry() : areaRegistry;
        this.policy = policy == null ? PlannerPolicy.defaults() : policy;
        this.policy.validate();
        this.tourOptimizer = new TourOptimizer();
        this.adjacency = this.policy.adjacency();
        this.capacitySplitter = new CapacitySplitter(this.routeStore);
        this.routeCombiner = new RouteCombiner(this.routeStore, adjacency);
        this.batchRouteBuilder = new BatchRouteBuilder(
                this.routeStore,
                this.areaRegistry,
                tourOptimizer,
                capacitySplitter,
                this.policy.isSplitOnIntake()
        );
        this.batchLocks = new BatchLockRegistry();
    }

    /**
     * Route persistence the service plans against.
     */
    public RouteStore routeStore() {
        return routeStore;
    }

    public AreaRegistry areaRegistry() {
        return areaRegistry;
    }

    /**
     * Validated planner constants in effect.
     */
    public PlannerPolicy policy() {
        return policy;
    }

    // =====================================================================
    // DISTANCE
    // =====================================================================

    /**
     * Re-sequences one route with the nearest-neighbor heuristic.
     *
     * <p>The new order is kept only when it is not longer than the current
     * one, so repeated calls converge and never regress.</p>
     */
    public DistanceOptimizationResult optimizeRouteByDistance(long routeId) {
        Route route = routeStore.find(routeId).orElse(null);
        if (route == null) {
            return DistanceOptimizationResult.builder()
                    .routeId(routeId)
                    .status(PlanningStatus.NOT_FOUND)
                    .message("Route " + routeId + " not found")
                    .build();
        }
        return batchLocks.withBatchLock(route.batchId(), () -> optimizeLocked(route));
    }

    /**
     * Optimizes every plannable route. Routes without a vehicle are reported, not processed,
     * and a failure on one route never aborts the others.
     */
    public FleetOptimizationResult optimizeAllRoutesForDistance() {
        List<Route> routes = plannableRoutes();
        if (routes.isEmpty()) {
            return FleetOptimizationResult.builder()
                    .status(PlanningStatus.NO_OP)
                    .message("No active routes to optimize")
                    .build();
        }

        List<DistanceOptimizationResult> results = policy.getFleetParallelism() > 1 && routes.size() > 1
                ? optimizeInParallel(routes)
                : optimizeSequentially(routes);

        FleetOptimizationResult.FleetOptimizationResultBuilder builder = FleetOptimizationResult.builder()
                .perRouteResults(results);
        FleetOptimizationResult draft = builder.build();
        long optimized = draft.count(PlanningStatus.SUCCESS);
        long noVehicle = draft.count(PlanningStatus.NO_VEHICLE);
        long failed = draft.count(PlanningStatus.FAILED);

        StringBuilder message = new StringBuilder()
                .append("Optimized ").append(optimized).append(" of ").append(routes.size()).append(" route(s)");
        if (noVehicle > 0) {
            message.append("; ").append(noVehicle).append(" skipped: ").append(MSG_NO_VEHICLE);
        }
        if (failed > 0) {
            message.append("; ").append(failed).append(" failed");
        }
        PlanningStatus status;
        if (optimized > 0) {
            status = PlanningStatus.SUCCESS;
        } else if (noVehicle == routes.size()) {
            status = PlanningStatus.NO_VEHICLE;
        } else if (failed > 0) {
            status = PlanningStatus.FAILED;
        } else {
            status = PlanningStatus.NO_OP;
        }
        log.info("fleet optimization: {}", message);
        return builder.status(status).message(message.toString()).build();
    }

    // =====================================================================
    // SPLIT / COMBINE
    // =====================================================================

    /**
     * Splits a route whose per-area cargo exceeds its vehicle.
     */
    public SplitResult splitRouteByAreaCapacity(long routeId) {
        Route route = routeStore.find(routeId).orElse(null);
        if (route == null) {
            return SplitResult.builder()
                    .routeId(routeId)
                    .status(PlanningStatus.NOT_FOUND)
                    .message("Route " + routeId + " not found")
                    .build();
        }
        return batchLocks.withBatchLock(route.batchId(), () -> splitLocked(route));
    }

    /**
     * Absorbs adjacent plannable routes that fit next to this route's cargo.
     */
    public CombineResult combineNearbyAreasRoute(long routeId) {
        Route route = routeStore.find(routeId).orElse(null);
        if (route == null) {
            return CombineResult.builder()
                    .routeId(routeId)
                    .status(PlanningStatus.NOT_FOUND)
                    .message("Route " + routeId + " not found")
                    .build();
        }
        List<String> locked = adjacentBatches(route);
        return batchLocks.withBatchLocks(locked, () -> combineLocked(route, lockedCandidates(route, locked)));
    }

    /**
     * Splits the route by area capacity, then lets every resulting route absorb adjacent neighbours.
     */
    public CompositePlanningResult splitCombineForAdjacentAreas(long routeId) {
        return splitCombine(routeId, false);
    }

    /**
     * Same as {@link #splitCombineForAdjacentAreas(long)}, then re-sequences every resulting route.
     */
    public CompositePlanningResult smartSplitCombineRoute(long routeId) {
        return splitCombine(routeId, true);
    }

    // =====================================================================
    // BATCH INTAKE
    // =====================================================================

    /**
     * Creates the draft route of a picking batch under that batch's lock.
     *
     * <p>Orders or customers larger than the vehicle reject the batch. An
     * over-capacity batch is split on intake when the policy enables it, and
     * {@link PlanningStatus#PARTIAL} reports parts that still overflow.</p>
     *
     * @param batch picking batch with orders and an optional vehicle.
     * @return intake outcome with every created route id.
     * @throws IllegalArgumentException when the batch id is blank.
     */
    public BatchRouteResult createRouteFromBatch(DeliveryBatch batch) {
        Objects.requireNonNull(batch, "batch");
        return batchLocks.withBatchLock(batch.getBatchId(), () -> batchRouteBuilder.createRoute(batch));
    }

    /**
     * Read-only capacity check of a batch; creates nothing.
     */
    public CapacityCheckResult checkSplitRequirements(DeliveryBatch batch) {
        return batchRouteBuilder.checkSplitRequirements(batch);
    }

    /**
     * Groups orders by resolved area code, first-seen order.
     */
    public Map<String, List<DeliveryOrder>> groupOrdersByArea(Collection<DeliveryOrder> orders) {
        return batchRouteBuilder.groupOrdersByArea(orders);
    }

    // =====================================================================
    // LIFECYCLE
    // =====================================================================

    /**
     * Applies a manual stop adjustment.
     *
     * @throws RoutePlanningException when the route or stop does not exist.
     * @throws org.Aayush.delivery.model.RouteStateException when the new sequence is out of range.
     */
    public Stop adjustStop(StopAdjustment adjustment) {
        Objects.requireNonNull(adjustment, "adjustment");
        Objects.requireNonNull(adjustment.getReason(), "reason");
        Route route = requireRoute(adjustment.getRouteId());
        return batchLocks.withBatchLock(route.batchId(), () -> {
            Stop stop = route.findStop(adjustment.getStopId()).orElseThrow(() -> new RoutePlanningException(
                    REASON_STOP_NOT_FOUND,
                    "stop " + adjustment.getStopId() + " not found on route " + route.id()
            ));
            if (adjustment.getNewSequence() != null) {
                route.reposition(stop, adjustment.getNewSequence());
            }
            if (adjustment.getNewTimeWindowStart() != null || adjustment.getNewTimeWindowEnd() != null) {
                stop.setTimeWindow(adjustment.getNewTimeWindowStart(), adjustment.getNewTimeWindowEnd());
            }
            stop.markAdjusted(adjustment.getReason());
            routeStore.save(route);
            log.info("stop {} on route {} adjusted: {}", stop.id(), route.id(), adjustment.getReason());
            return stop;
        });
    }

    /**
     * Confirms a draft route for dispatch.
     *
     * @param routeId route to confirm.
     * @return the confirmed route.
     * @throws RoutePlanningException when the route does not exist.
     * @throws org.Aayush.delivery.model.RouteStateException without a vehicle, over capacity,
     *                                                       or when the route is not a draft.
     */
    public Route confirmRoute(long routeId) {
        return transition(routeId, Route::confirm);
    }

    /**
     * Moves a confirmed route in transit.
     *
     * @throws RoutePlanningException when the route does not exist.
     */
    public Route startRoute(long routeId) {
        return transition(routeId, Route::start);
    }

    public Route deliverRoute(long routeId) {
        return transition(routeId, Route::deliver);
    }

    /**
     * Cancels a non-terminal route. Its stops stay attached for auditing.
     */
    public Route cancelRoute(long routeId) {
        return transition(routeId, Route::cancel);
    }

    // =====================================================================
    // INTERNALS
    // =====================================================================

    private DistanceOptimizationResult optimizeLocked(Route route) {
        DistanceOptimizationResult.DistanceOptimizationResultBuilder result = DistanceOptimizationResult.builder()
                .routeId(route.id());
        List<Stop> current = route.stops();
        double before = tourOptimizer.routeDistance(current);
        result.beforeDistanceKm(before).afterDistanceKm(before);

        if (current.size() <= 1) {
            return result.status(PlanningStatus.NO_OP)
                    .message(MSG_NO_OPTIMIZATION_NEEDED + ": route " + route.id()
                            + " has " + current.size() + " stop(s)")
                    .build();
        }
        if (!route.state().isPlannable()) {
            return result.status(PlanningStatus.REJECTED)
                    .message("Route " + route.id() + " is " + route.state() + " and can no longer be re-sequenced")
                    .build();
        }

        int[] previousSequence = new int[current.size()];
        for (int i = 0; i < current.size(); i++) {
            previousSequence[i] = current.get(i).sequence();
        }
        List<Stop> candidate = tourOptimizer.optimize(current);
        double after = tourOptimizer.routeDistance(candidate);
        if (after > before + DISTANCE_EPSILON_KM) {
            route.applyOrder(current);
            return result.status(PlanningStatus.NO_OP)
                    .message(MSG_NO_OPTIMIZATION_NEEDED + ": current order of route " + route.id()
                            + " is already shorter (" + formatKm(before) + ")")
                    .build();
        }
        route.applyOrder(candidate);
        routeStore.save(route);

        for (int i = 0; i < current.size(); i++) {
            Stop stop = current.get(i);
            if (stop.sequence() != previousSequence[i]) {
                result.affectedStopId(stop.id());
            }
        }
        DistanceOptimizationResult draft = result.afterDistanceKm(after).build();
        if (draft.getAffectedStopIds().isEmpty()) {
            return result.status(PlanningStatus.NO_OP)
                    .message(MSG_NO_OPTIMIZATION_NEEDED + ": route " + route.id()
                            + " is already in nearest-neighbor order (" + formatKm(after) + ")")
                    .build();
        }
        log.debug("route {} re-sequenced {} -> {}", route.id(), formatKm(before), formatKm(after));
        return result.status(PlanningStatus.SUCCESS)
                .message("Route " + route.id() + " optimized: " + formatKm(before) + " -> " + formatKm(after))
                .build();
    }

    private List<DistanceOptimizationResult> optimizeSequentially(List<Route> routes) {
        List<DistanceOptimizationResult> results = new ArrayList<>(routes.size());
        for (Route route : routes) {
            results.add(optimizeIsolated(route));
        }
        return results;
    }

    /**
     * Runs each route on a bounded pool; results keep the input order.
     */
    private List<DistanceOptimizationResult> optimizeInParallel(List<Route> routes) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(policy.getFleetParallelism(), routes.size()));
        try {
            List<Callable<DistanceOptimizationResult>> tasks = new ArrayList<>(routes.size());
            for (Route route : routes) {
                tasks.add(() -> optimizeIsolated(route));
            }
            List<Future<DistanceOptimizationResult>> futures = executor.invokeAll(tasks);
            List<DistanceOptimizationResult> results = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(resultOf(futures.get(i), routes.get(i)));
            }
            return results;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RoutePlanningException(REASON_FLEET_RUN_INTERRUPTED, "fleet optimization interrupted", ex);
        } finally {
            executor.shutdownNow();
        }
    }

    private DistanceOptimizationResult resultOf(Future<DistanceOptimizationResult> future, Route route)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            return failed(route, ex.getCause() == null ? ex : ex.getCause());
        }
    }

    /**
     * One fleet member under its batch lock. Failures become {@code FAILED} results.
     */
    private DistanceOptimizationResult optimizeIsolated(Route route) {
        if (route.vehicle() == null) {
            return DistanceOptimizationResult.builder()
                    .routeId(route.id())
                    .status(PlanningStatus.NO_VEHICLE)
                    .message(MSG_NO_VEHICLE + ": route " + route.id() + " was skipped")
                    .build();
        }
        try {
            return batchLocks.withBatchLock(route.batchId(), () -> optimizeLocked(route));
        } catch (RuntimeException ex) {
            return failed(route, ex);
        }
    }

    private DistanceOptimizationResult failed(Route route, Throwable cause) {
        log.error("distance optimization failed for route {}", route.id(), cause);
        return DistanceOptimizationResult.builder()
                .routeId(route.id())
                .status(PlanningStatus.FAILED)
                .message("Optimization failed for route " + route.id() + ": " + cause.getMessage())
                .build();
    }

    /**
     * Split body; the caller holds the route's batch lock.
     */
    private SplitResult splitLocked(Route route) {
        SplitResult.SplitResultBuilder result = SplitResult.builder().routeId(route.id());
        VehicleCapacity capacity = route.capacity();
        if (capacity == null) {
            return result.status(PlanningStatus.NO_VEHICLE)
                    .message(MSG_NO_VEHICLE + ": assign a vehicle to route " + route.id()
                            + " to check capacity constraints")
                    .build();
        }
        if (!route.state().isPlannable()) {
            return result.status(PlanningStatus.REJECTED)
                    .message("Route " + route.id() + " is " + route.state() + " and can no longer be split")
                    .build();
        }

        List<Stop> oversized = CapacitySplitter.oversizedStops(route.stops(), capacity);
        for (Stop stop : oversized) {
            result.oversizedStopId(stop.id());
        }
        List<Route> parts = capacitySplitter.splitOversizedAreas(route, capacity);
        routeStore.save(route);
        String oversizedNote = oversized.isEmpty()
                ? ""
                : "; " + oversized.size() + " stop(s) exceed vehicle capacity on their own";
        List<Long> overIds = routeIds(CapacitySplitter.overCapacity(parts, capacity));
        result.overCapacityRouteIds(overIds);
        String overNote = overIds.isEmpty()
                ? ""
                : "; route(s) " + overIds + " still exceed vehicle capacity and cannot be confirmed";
        for (Route part : parts.subList(1, parts.size())) {
            result.newRouteId(part.id());
            for (Stop stop : part.stops()) {
                result.affectedStopId(stop.id());
            }
        }
        if (!overIds.isEmpty()) {
            log.warn("route {} split left over-capacity route(s) {}", route.id(), overIds);
            return result.status(PlanningStatus.PARTIAL)
                    .message("Route " + route.id() + " split into " + parts.size() + " route(s)"
                            + oversizedNote + overNote)
                    .build();
        }
        if (parts.size() == 1) {
            return result.status(PlanningStatus.NO_OP)
                    .message("Route " + route.id() + " fits its vehicle; nothing to split")
                    .build();
        }
        return result.status(PlanningStatus.SUCCESS)
                .message("Route " + route.id() + " split into " + parts.size() + " route(s)")
                .build();
    }

    private CombineResult combineLocked(Route route, List<Route> candidates) {
        CombineResult.CombineResultBuilder result = CombineResult.builder().routeId(route.id());
        VehicleCapacity capacity = route.capacity();
        if (capacity == null) {
            return result.status(PlanningStatus.NO_VEHICLE)
                    .message(MSG_NO_VEHICLE + ": assign a vehicle to route " + route.id() + " before combining")
                    .build();
        }
        if (!route.state().isPlannable()) {
            return result.status(PlanningStatus.REJECTED)
                    .message("Route " + route.id() + " is " + route.state() + " and can no longer absorb stops")
                    .build();
        }

        Set<Stop> before = new LinkedHashSet<>(route.stops());
        List<Route> absorbed = routeCombiner.combineAdjacent(route, candidates, capacity);
        if (absorbed.isEmpty()) {
            return result.status(PlanningStatus.NO_OP)
                    .message("No adjacent routes to combine with route " + route.id())
                    .build();
        }
        for (Route merged : absorbed) {
            result.mergedRouteId(merged.id());
        }
        for (Stop stop : route.stops()) {
            if (!before.contains(stop)) {
                result.affectedStopId(stop.id());
            }
        }
        routeStore.save(route);
        return result.status(PlanningStatus.SUCCESS)
                .message("Route " + route.id() + " absorbed " + absorbed.size() + " adjacent route(s)")
                .build();
    }

    /**
     * Split, then combine each resulting route with its neighbours, all under every plannable batch lock.
     *
     * @param routeId route to start from.
     * @param reoptimize whether surviving routes are re-sequenced afterwards.
     */
    private CompositePlanningResult splitCombine(long routeId, boolean reoptimize) {
        Route route = routeStore.find(routeId).orElse(null);
        CompositePlanningResult.CompositePlanningResultBuilder result = CompositePlanningResult.builder()
                .routeId(routeId);
        if (route == null) {
            return result.status(PlanningStatus.NOT_FOUND)
                    .message("Route " + routeId + " not found")
                    .build();
        }
        if (route.capacity() == null) {
            return result.status(PlanningStatus.NO_VEHICLE)
                    .message(MSG_NO_VEHICLE + ": assign a vehicle to route " + routeId
                            + " before splitting or combining")
                    .build();
        }

        List<String> locked = allPlannableBatches();
        return batchLocks.withBatchLocks(locked, () -> {
            SplitResult split = splitLocked(route);
            result.split(split);
            if (split.getStatus() == PlanningStatus.REJECTED) {
                return result.status(PlanningStatus.REJECTED).message(split.getMessage()).build();
            }

            List<Long> family = new ArrayList<>();
            family.add(route.id());
            family.addAll(split.getNewRouteIds());

            boolean changed = !split.getNewRouteIds().isEmpty();
            int absorbedCount = 0;
            for (long memberId : family) {
                Route member = routeStore.find(memberId).orElse(null);
                if (member == null || !member.state().isPlannable()) {
                    continue;
                }
                CombineResult combine = combineLocked(member, lockedCandidates(member, locked));
                result.combine(combine);
                if (combine.getStatus() == PlanningStatus.SUCCESS) {
                    changed = true;
                    absorbedCount += combine.getMergedRouteIds().size();
                }
            }

            List<Long> survivors = new ArrayList<>();
            for (long memberId : family) {
                routeStore.find(memberId)
                        .filter(r -> r.state().isPlannable())
                        .ifPresent(r -> survivors.add(r.id()));
            }
            result.resultingRouteIds(survivors);

            if (reoptimize) {
                for (long survivorId : survivors) {
                    Route survivor = routeStore.find(survivorId).orElseThrow();
                    DistanceOptimizationResult optimization = optimizeLocked(survivor);
                    result.optimization(optimization);
                    if (optimization.getStatus() == PlanningStatus.SUCCESS) {
                        changed = true;
                    }
                }
            }

            List<Route> survivorRoutes = new ArrayList<>(survivors.size());
            for (long survivorId : survivors) {
                routeStore.find(survivorId).ifPresent(survivorRoutes::add);
            }
            List<Long> overIds = routeIds(CapacitySplitter.overCapacity(survivorRoutes, route.capacity()));
            result.overCapacityRouteIds(overIds);

            String summary = split.getMessage() + "; absorbed " + absorbedCount + " adjacent route(s); "
                    + survivors.size() + " route(s) remain";
            PlanningStatus status;
            if (!overIds.isEmpty()) {
                status = PlanningStatus.PARTIAL;
                if (split.getStatus() != PlanningStatus.PARTIAL) {
                    summary += "; route(s) " + overIds + " still exceed vehicle capacity";
                }
            } else {
                status = changed ? PlanningStatus.SUCCESS : PlanningStatus.NO_OP;
            }
            return result.status(status)
                    .message(summary)
                    .build();
        });
    }

    /**
     * Applies a lifecycle step under the route's batch lock and saves the route.
     */
    private Route transition(long routeId, Consumer<Route> step) {
        Route route = requireRoute(routeId);
        return batchLocks.withBatchLock(route.batchId(), () -> {
            step.accept(route);
            routeStore.save(route);
            log.info("route {} is now {}", route.id(), route.state());
            return route;
        });
    }

    private Route requireRoute(long routeId) {
        return routeStore.find(routeId).orElseThrow(() -> new RoutePlanningException(
                REASON_ROUTE_NOT_FOUND,
                "route " + routeId + " not found"
        ));
    }

    /**
     * Draft and confirmed routes, ascending id.
     */
    private List<Route> plannableRoutes() {
        List<Route> routes = new ArrayList<>();
        for (Route route : routeStore.findAll()) {
            if (route.state().isPlannable()) {
                routes.add(route);
            }
        }
        routes.sort(Comparator.comparingLong(Route::id));
        return routes;
    }

    /**
     * Other plannable routes whose batch is among {@code lockedBatchIds}, ascending id.
     */
    private List<Route> lockedCandidates(Route route, Collection<String> lockedBatchIds) {
        List<Route> candidates = new ArrayList<>();
        for (Route candidate : plannableRoutes()) {
            if (candidate.id() != route.id() && lockedBatchIds.contains(candidate.batchId())) {
                candidates.add(candidate);
            }
        }
        return candidates;
    }

    /**
     * Batch ids a combine starting from {@code route} may touch: its own plus those of adjacent routes.
     */
    private List<String> adjacentBatches(Route route) {
        Set<String> batchIds = new LinkedHashSet<>();
        batchIds.add(route.batchId());
        for (Route candidate : plannableRoutes()) {
            if (adjacency.adjacent(route.area(), candidate.area())) {
                batchIds.add(candidate.batchId());
            }
        }
        return new ArrayList<>(batchIds);
    }

    /**
     * Sub-routes created by a split may sit in other areas than their source, so
     * composite runs lock every batch that still has a plannable route.
     */
    private List<String> allPlannableBatches() {
        Set<String> batchIds = new LinkedHashSet<>();
        for (Route candidate : plannableRoutes()) {
            batchIds.add(candidate.batchId());
        }
        return new ArrayList<>(batchIds);
    }

    private static List<Long> routeIds(List<Route> routes) {
        List<Long> ids = new ArrayList<>(routes.size());
        for (Route route : routes) {
            ids.add(route.id());
        }
        return ids;
    }

    /**
     * Formats a distance for result messages.
     */
    private static String formatKm(double km) {
        return String.format("%.2f km", km);
    }
}

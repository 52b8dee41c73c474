package org.Aayush.delivery.batch;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.delivery.capacity.CapacitySplitter;
import org.Aayush.delivery.core.PlanningStatus;
import org.Aayush.delivery.model.Area;
import org.Aayush.delivery.model.Demand;
import org.Aayush.delivery.model.Route;
import org.Aayush.delivery.model.Stop;
import org.Aayush.delivery.model.VehicleCapacity;
import org.Aayush.delivery.store.AreaRegistry;
import org.Aayush.delivery.store.RouteStore;
import org.Aayush.delivery.tour.TourOptimizer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds draft routes from picking batches.
 *
 * <p>One stop is created per customer, carrying the summed demand of that
 * customer's orders, the earliest deadline as window start and the highest
 * order priority. The route's area is the one most orders belong to. Stops are
 * then sequenced by {@link TourOptimizer}. A batch may own only one live route;
 * sub-routes created by an intake split share the batch id.</p>
 */
@Slf4j
public final class BatchRouteBuilder {
    public static final String NO_AREA_KEY = "";

    private final RouteStore routeStore;
    private final AreaRegistry areaRegistry;
    private final TourOptimizer tourOptimizer;
    private final CapacitySplitter capacitySplitter;
    private final boolean splitOnIntake;

    /**
     * @param routeStore route persistence.
     * @param areaRegistry resolves order area codes and customer areas.
     * @param tourOptimizer sequences the created stops.
     * @param capacitySplitter used for the intake split.
     * @param splitOnIntake whether an over-capacity batch is split immediately.
     */
    public BatchRouteBuilder(
            RouteStore routeStore,
            AreaRegistry areaRegistry,
            TourOptimizer tourOptimizer,
            CapacitySplitter capacitySplitter,
            boolean splitOnIntake
    ) {
        this.routeStore = Objects.requireNonNull(routeStore, "routeStore");
        this.areaRegistry = Objects.requireNonNull(areaRegistry, "areaRegistry");
        this.tourOptimizer = Objects.requireNonNull(tourOptimizer, "tourOptimizer");
        this.capacitySplitter = Objects.requireNonNull(capacitySplitter, "capacitySplitter");
        this.splitOnIntake = splitOnIntake;
    }

    /**
     * Creates the batch's route.
     *
     * <p>Outcomes: {@code NO_OP} when the batch is empty or already has a live
     * route; {@code REJECTED} when a single order, or the summed orders of one
     * customer (which become one stop), exceed the vehicle; otherwise
     * {@code SUCCESS}. An over-capacity batch is split right away when
     * {@code splitOnIntake} is set; {@code PARTIAL} reports parts that still
     * exceed the vehicle after that split.</p>
     *
     * @param batch picking batch with its orders and optional vehicle.
     * @return intake outcome with the created route ids.
     * @throws IllegalArgumentException when the batch id is blank.
     */
    public BatchRouteResult createRoute(DeliveryBatch batch) {
        String batchId = requireBatchId(batch);
        BatchRouteResult.BatchRouteResultBuilder result = BatchRouteResult.builder().batchId(batchId);

        if (batch.getOrders().isEmpty()) {
            return result.status(PlanningStatus.NO_OP)
                    .message("No orders in batch " + batchId)
                    .build();
        }
        for (Route existing : routeStore.findByBatch(batchId)) {
            if (!existing.state().isTerminal()) {
                return result.status(PlanningStatus.NO_OP)
                        .routeId(existing.id())
                        .message("Route Already Exists: batch " + batchId + " already has route " + existing.id())
                        .build();
            }
        }

        VehicleCapacity capacity = batch.getVehicle() == null ? null : batch.getVehicle().capacity();
        List<DeliveryOrder> oversized = oversizedOrders(batch.getOrders(), capacity);
        if (!oversized.isEmpty()) {
            for (DeliveryOrder order : oversized) {
                result.oversizedOrderId(order.getOrderId());
            }
            return result.status(PlanningStatus.REJECTED)
                    .message(describeOversized(oversized, capacity))
                    .build();
        }
        List<List<DeliveryOrder>> oversizedCustomers = oversizedCustomers(batch.getOrders(), capacity);
        if (!oversizedCustomers.isEmpty()) {
            return result.status(PlanningStatus.REJECTED)
                    .oversizedOrderIds(orderIds(oversizedCustomers))
                    .message(describeOversizedCustomers(oversizedCustomers, capacity))
                    .build();
        }

        Route route = new Route(routeStore.nextRouteId(), batchId, dominantArea(batch.getOrders()), batch.getVehicle());
        route.addStops(buildStops(batch.getOrders()));
        route.applyOrder(tourOptimizer.optimize(route.stops()));
        routeStore.save(route);
        result.routeId(route.id());
        log.info("batch {} -> route {} with {} stop(s)", batchId, route.id(), route.stopCount());

        if (capacity != null && splitOnIntake && !route.totalDemand().fitsWithin(capacity)) {
            List<Route> split = capacitySplitter.splitOversizedAreas(route, capacity);
            for (Route part : split) {
                part.applyOrder(tourOptimizer.optimize(part.stops()));
                routeStore.save(part);
                if (part.id() != route.id()) {
                    result.routeId(part.id());
                }
            }
            List<Route> stillOver = CapacitySplitter.overCapacity(split, capacity);
            if (!stillOver.isEmpty()) {
                List<Long> overIds = new ArrayList<>(stillOver.size());
                for (Route part : stillOver) {
                    overIds.add(part.id());
                }
                log.warn("batch {} split left over-capacity route(s) {}", batchId, overIds);
                return result.status(PlanningStatus.PARTIAL)
                        .message("Batch " + batchId + " was split into " + split.size()
                                + " route(s) but route(s) " + overIds + " still exceed vehicle capacity")
                        .build();
            }
            return result.status(PlanningStatus.SUCCESS)
                    .message("Batch " + batchId + " exceeded vehicle capacity and was split into "
                            + split.size() + " route(s)")
                    .build();
        }
        return result.status(PlanningStatus.SUCCESS)
                .message("Route " + route.id() + " created for batch " + batchId
                        + " with " + route.stopCount() + " stop(s)")
                .build();
    }

    /**
     * Checks whether the batch fits its vehicle before any route is created.
     *
     * @param batch picking batch to check.
     * @return {@code NO_VEHICLE}, {@code REJECTED} for orders or customers larger than the
     *         vehicle, {@code SUCCESS} when a split is required, otherwise {@code NO_OP}.
     */
    public CapacityCheckResult checkSplitRequirements(DeliveryBatch batch) {
        String batchId = requireBatchId(batch);
        Demand total = Demand.ZERO;
        for (DeliveryOrder order : batch.getOrders()) {
            total = total.plus(order.getDemand());
        }
        CapacityCheckResult.CapacityCheckResultBuilder result = CapacityCheckResult.builder()
                .batchId(batchId)
                .totalDemand(total);
        if (batch.getVehicle() == null) {
            return result.status(PlanningStatus.NO_VEHICLE)
                    .message("No Vehicle Assigned: assign a vehicle to batch " + batchId
                            + " to check capacity requirements")
                    .build();
        }

        VehicleCapacity capacity = batch.getVehicle().capacity();
        List<DeliveryOrder> oversized = oversizedOrders(batch.getOrders(), capacity);
        boolean splitRequired = !total.fitsWithin(capacity);
        result.splitRequired(splitRequired);
        if (!oversized.isEmpty()) {
            for (DeliveryOrder order : oversized) {
                result.oversizedOrderId(order.getOrderId());
            }
            return result.status(PlanningStatus.REJECTED)
                    .message(describeOversized(oversized, capacity))
                    .build();
        }
        List<List<DeliveryOrder>> oversizedCustomers = oversizedCustomers(batch.getOrders(), capacity);
        if (!oversizedCustomers.isEmpty()) {
            return result.status(PlanningStatus.REJECTED)
                    .oversizedOrderIds(orderIds(oversizedCustomers))
                    .message(describeOversizedCustomers(oversizedCustomers, capacity))
                    .build();
        }
        if (splitRequired) {
            return result.status(PlanningStatus.SUCCESS)
                    .message("Batch " + batchId + " exceeds one vehicle; the route will be split by area")
                    .build();
        }
        return result.status(PlanningStatus.NO_OP)
                .message("All orders fit within vehicle capacity. Ready to create route.")
                .build();
    }

    /**
     * Groups orders by resolved area code in first-seen order; unassigned orders use {@link #NO_AREA_KEY}.
     *
     * @param orders orders to group.
     * @return area code to orders, in first-seen order.
     */
    public Map<String, List<DeliveryOrder>> groupOrdersByArea(Collection<DeliveryOrder> orders) {
        Map<String, List<DeliveryOrder>> groups = new LinkedHashMap<>();
        for (DeliveryOrder order : orders) {
            Area area = resolveArea(order);
            String key = area == null ? NO_AREA_KEY : area.code();
            groups.computeIfAbsent(key, ignored -> new ArrayList<>()).add(order);
        }
        return groups;
    }

    /**
     * One stop per customer: summed demand, highest priority, earliest deadline as window start.
     */
    private List<Stop> buildStops(List<DeliveryOrder> orders) {
        Map<String, List<DeliveryOrder>> byCustomer = groupByCustomer(orders);

        List<Stop> stops = new ArrayList<>(byCustomer.size());
        for (List<DeliveryOrder> customerOrders : byCustomer.values()) {
            DeliveryOrder first = customerOrders.get(0);
            Demand demand = Demand.ZERO;
            Instant windowStart = null;
            int priority = Stop.MIN_PRIORITY;
            Stop.StopBuilder stop = Stop.builder()
                    .id(routeStore.nextStopId())
                    .customerId(first.getCustomerId())
                    .location(first.getLocation())
                    .area(resolveArea(first));
            for (DeliveryOrder order : customerOrders) {
                demand = demand.plus(order.getDemand());
                priority = Math.max(priority, order.getPriority());
                if (order.getDeadline() != null && (windowStart == null || order.getDeadline().isBefore(windowStart))) {
                    windowStart = order.getDeadline();
                }
                stop.orderId(order.getOrderId());
            }
            stops.add(stop.demand(demand).priority(priority).timeWindowStart(windowStart).build());
        }
        return stops;
    }

    /**
     * Area most orders resolve to, first seen on ties; null when no order resolves.
     */
    private Area dominantArea(List<DeliveryOrder> orders) {
        Map<Area, Integer> counts = new LinkedHashMap<>();
        for (DeliveryOrder order : orders) {
            Area area = resolveArea(order);
            if (area != null) {
                counts.merge(area, 1, Integer::sum);
            }
        }
        Area best = null;
        int bestCount = 0;
        for (Map.Entry<Area, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    /**
     * Explicit area code first, then the customer's registered area.
     */
    private Area resolveArea(DeliveryOrder order) {
        if (order.getAreaCode() != null) {
            Area area = areaRegistry.find(order.getAreaCode());
            if (area != null) {
                return area;
            }
            log.warn("order {} references unknown area {}", order.getOrderId(), order.getAreaCode());
        }
        return order.getCustomerId() == null ? null : areaRegistry.areaOfCustomer(order.getCustomerId());
    }

    private static Map<String, List<DeliveryOrder>> groupByCustomer(List<DeliveryOrder> orders) {
        Map<String, List<DeliveryOrder>> byCustomer = new LinkedHashMap<>();
        for (DeliveryOrder order : orders) {
            byCustomer.computeIfAbsent(order.getCustomerId(), ignored -> new ArrayList<>()).add(order);
        }
        return byCustomer;
    }

    /**
     * Orders of customers whose summed demand exceeds {@code capacity}. Such a customer
     * becomes a single stop that no split can bring within limits.
     */
    private static List<List<DeliveryOrder>> oversizedCustomers(List<DeliveryOrder> orders, VehicleCapacity capacity) {
        List<List<DeliveryOrder>> oversized = new ArrayList<>();
        if (capacity == null) {
            return oversized;
        }
        for (List<DeliveryOrder> customerOrders : groupByCustomer(orders).values()) {
            Demand total = Demand.ZERO;
            for (DeliveryOrder order : customerOrders) {
                total = total.plus(order.getDemand());
            }
            if (!total.fitsWithin(capacity)) {
                oversized.add(customerOrders);
            }
        }
        return oversized;
    }

    private static List<DeliveryOrder> oversizedOrders(List<DeliveryOrder> orders, VehicleCapacity capacity) {
        List<DeliveryOrder> oversized = new ArrayList<>();
        if (capacity == null) {
            return oversized;
        }
        for (DeliveryOrder order : orders) {
            if (!order.getDemand().fitsWithin(capacity)) {
                oversized.add(order);
            }
        }
        return oversized;
    }

    private static String describeOversized(List<DeliveryOrder> oversized, VehicleCapacity capacity) {
        StringBuilder message = new StringBuilder("The following orders exceed vehicle capacity (")
                .append(String.format("%.2f kg, %.2f m3", capacity.maxWeight(), capacity.maxVolume()))
                .append(") and must be split at the warehouse:");
        for (DeliveryOrder order : oversized) {
            message.append("\n- ").append(order.getOrderId()).append(": ")
                    .append(String.format("%.2f kg / %.2f m3",
                            order.getDemand().weight(), order.getDemand().volume()));
        }
        return message.toString();
    }

    private static List<String> orderIds(List<List<DeliveryOrder>> groups) {
        List<String> ids = new ArrayList<>();
        for (List<DeliveryOrder> group : groups) {
            for (DeliveryOrder order : group) {
                ids.add(order.getOrderId());
            }
        }
        return ids;
    }

    private static String describeOversizedCustomers(List<List<DeliveryOrder>> customers, VehicleCapacity capacity) {
        StringBuilder message = new StringBuilder("The combined orders of the following customers exceed vehicle capacity (")
                .append(String.format("%.2f kg, %.2f m3", capacity.maxWeight(), capacity.maxVolume()))
                .append(") and must be split at the warehouse:");
        for (List<DeliveryOrder> customerOrders : customers) {
            Demand total = Demand.ZERO;
            List<String> orderIds = new ArrayList<>(customerOrders.size());
            for (DeliveryOrder order : customerOrders) {
                total = total.plus(order.getDemand());
                orderIds.add(order.getOrderId());
            }
            message.append("\n- ").append(customerOrders.get(0).getCustomerId()).append(" ").append(orderIds)
                    .append(": ").append(String.format("%.2f kg / %.2f m3", total.weight(), total.volume()));
        }
        return message.toString();
    }

    private static String requireBatchId(DeliveryBatch batch) {
        Objects.requireNonNull(batch, "batch");
        if (batch.getBatchId() == null || batch.getBatchId().isBlank()) {
            throw new IllegalArgumentException("batchId must be non-blank");
        }
        return batch.getBatchId();
    }
}

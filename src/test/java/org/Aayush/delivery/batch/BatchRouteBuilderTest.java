package org.Aayush.delivery.batch;

import org.Aayush.delivery.capacity.CapacitySplitter;
import org.Aayush.delivery.core.PlanningStatus;
import org.Aayush.delivery.geo.Coordinate;
import org.Aayush.delivery.model.Area;
import org.Aayush.delivery.model.Demand;
import org.Aayush.delivery.model.Route;
import org.Aayush.delivery.model.Stop;
import org.Aayush.delivery.store.AreaRegistry;
import org.Aayush.delivery.store.InMemoryRouteStore;
import org.Aayush.delivery.store.RouteStore;
import org.Aayush.delivery.tour.TourOptimizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.Aayush.delivery.testutil.RouteFixtures.BAY_RIDGE;
import static org.Aayush.delivery.testutil.RouteFixtures.MANHATTAN;
import static org.Aayush.delivery.testutil.RouteFixtures.TRUCK_CAPACITY;
import static org.Aayush.delivery.testutil.RouteFixtures.WEST_VILLAGE;
import static org.Aayush.delivery.testutil.RouteFixtures.area;
import static org.Aayush.delivery.testutil.RouteFixtures.assertRouteInvariants;
import static org.Aayush.delivery.testutil.RouteFixtures.truck;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("BatchRouteBuilder Tests")
class BatchRouteBuilderTest {

    private RouteStore store;
    private AreaRegistry registry;
    private Area north;
    private Area south;

    @BeforeEach
    void setUp() {
        store = new InMemoryRouteStore();
        registry = new AreaRegistry();
        north = registry.register(area("NORTH", MANHATTAN));
        south = registry.register(area("SOUTH", BAY_RIDGE));
    }

    private BatchRouteBuilder builder(boolean splitOnIntake) {
        return new BatchRouteBuilder(store, registry, new TourOptimizer(), new CapacitySplitter(store), splitOnIntake);
    }

    private static DeliveryOrder order(String orderId, String customerId, Coordinate location, String areaCode, double weight) {
        return DeliveryOrder.builder()
                .orderId(orderId)
                .customerId(customerId)
                .location(location)
                .areaCode(areaCode)
                .demand(Demand.of(weight, 1.0d))
                .build();
    }

    @Test
    @DisplayName("Orders of one customer collapse into one stop with summed demand")
    void testStopAggregation() {
        Instant early = Instant.parse("2026-05-01T08:00:00Z");
        Instant late = Instant.parse("2026-05-01T15:00:00Z");
        DeliveryBatch batch = DeliveryBatch.builder()
                .batchId("WAVE-1")
                .vehicle(truck())
                .order(DeliveryOrder.builder().orderId("SO1").customerId("C1").location(MANHATTAN)
                        .areaCode("NORTH").demand(Demand.of(100.0d, 2.0d)).priority(1).deadline(late).build())
                .order(DeliveryOrder.builder().orderId("SO2").customerId("C1").location(MANHATTAN)
                        .areaCode("NORTH").demand(Demand.of(50.0d, 1.0d)).priority(3).deadline(early).build())
                .order(order("SO3", "C2", WEST_VILLAGE, "NORTH", 200.0d))
                .build();

        BatchRouteResult result = builder(true).createRoute(batch);

        assertEquals(PlanningStatus.SUCCESS, result.getStatus());
        assertEquals(1, result.getRouteIds().size());
        Route route = store.find(result.getRouteIds().get(0)).orElseThrow();
        assertEquals(2, route.stopCount());
        Stop customerOne = route.stops().stream().filter(s -> "C1".equals(s.customerId())).findFirst().orElseThrow();
        assertEquals(Demand.of(150.0d, 3.0d), customerOne.demand());
        assertEquals(3, customerOne.priority());
        assertEquals(early, customerOne.timeWindowStart());
        assertEquals(List.of("SO1", "SO2"), customerOne.orderIds());
        assertEquals("WAVE-1", route.batchId());
        assertRouteInvariants(route);
    }

    @Test
    @DisplayName("Route area is the one most orders belong to")
    void testDominantArea() {
        DeliveryBatch batch = DeliveryBatch.builder()
                .batchId("WAVE-1")
                .vehicle(truck())
                .order(order("SO1", "C1", BAY_RIDGE, "SOUTH", 10.0d))
                .order(order("SO2", "C2", MANHATTAN, "NORTH", 10.0d))
                .order(order("SO3", "C3", WEST_VILLAGE, "NORTH", 10.0d))
                .build();

        BatchRouteResult result = builder(true).createRoute(batch);

        assertEquals(north, store.find(result.getRouteIds().get(0)).orElseThrow().area());
    }

    @Test
    @DisplayName("A batch with a live route does not get a second one")
    void testRouteAlreadyExists() {
        DeliveryBatch batch = DeliveryBatch.builder()
                .batchId("WAVE-1")
                .vehicle(truck())
                .order(order("SO1", "C1", MANHATTAN, "NORTH", 10.0d))
                .build();
        BatchRouteBuilder builder = builder(true);
        long first = builder.createRoute(batch).getRouteIds().get(0);

        BatchRouteResult again = builder.createRoute(batch);

        assertEquals(PlanningStatus.NO_OP, again.getStatus());
        assertTrue(again.getMessage().startsWith("Route Already Exists"));
        assertEquals(List.of(first), again.getRouteIds());

        store.find(first).orElseThrow().cancel();
        assertEquals(PlanningStatus.SUCCESS, builder.createRoute(batch).getStatus());
    }

    @Test
    @DisplayName("Orders heavier than the vehicle reject the batch")
    void testOversizedOrdersRejected() {
        DeliveryBatch batch = DeliveryBatch.builder()
                .batchId("WAVE-1")
                .vehicle(truck())
                .order(order("SO1", "C1", MANHATTAN, "NORTH", 10.0d))
                .order(order("SO2", "C2", MANHATTAN, "NORTH", 1500.0d))
                .build();

        BatchRouteResult result = builder(true).createRoute(batch);

        assertEquals(PlanningStatus.REJECTED, result.getStatus());
        assertEquals(List.of("SO2"), result.getOversizedOrderIds());
        assertTrue(result.getMessage().contains("must be split at the warehouse"));
        assertTrue(store.findAll().isEmpty());
    }

    @Test
    @DisplayName("A customer whose orders together exceed the vehicle rejects the batch")
    void testOversizedCustomerRejected() {
        DeliveryBatch batch = DeliveryBatch.builder()
                .batchId("WAVE-3")
                .vehicle(truck())
                .order(order("SO1", "C3", MANHATTAN, "NORTH", 700.0d))
                .order(order("SO2", "C3", MANHATTAN, "NORTH", 700.0d))
                .order(order("SO3", "C1", WEST_VILLAGE, "NORTH", 600.0d))
                .order(order("SO4", "C2", BAY_RIDGE, "SOUTH", 600.0d))
                .build();

        BatchRouteResult result = builder(true).createRoute(batch);
        CapacityCheckResult check = builder(true).checkSplitRequirements(batch);

        assertEquals(PlanningStatus.REJECTED, result.getStatus());
        assertEquals(List.of("SO1", "SO2"), result.getOversizedOrderIds());
        assertTrue(result.getMessage().contains("C3"));
        assertTrue(result.getRouteIds().isEmpty());
        assertTrue(store.findAll().isEmpty());
        assertEquals(PlanningStatus.REJECTED, check.getStatus());
        assertEquals(List.of("SO1", "SO2"), check.getOversizedOrderIds());
    }

    @Test
    @DisplayName("A batch that overflows only across areas is split into routes that each fit")
    void testSplitOnIntakeAcrossAreas() {
        DeliveryBatch batch = DeliveryBatch.builder()
                .batchId("WAVE-4")
                .vehicle(truck())
                .order(order("SO1", "C1", MANHATTAN, "NORTH", 600.0d))
                .order(order("SO2", "C2", BAY_RIDGE, "SOUTH", 600.0d))
                .build();

        BatchRouteResult result = builder(true).createRoute(batch);

        assertEquals(PlanningStatus.SUCCESS, result.getStatus());
        assertTrue(result.getOversizedOrderIds().isEmpty());
        assertEquals(2, result.getRouteIds().size());
        for (long routeId : result.getRouteIds()) {
            Route route = store.find(routeId).orElseThrow();
            assertEquals(1, route.stopCount());
            assertTrue(route.totalDemand().fitsWithin(TRUCK_CAPACITY));
            assertRouteInvariants(route);
        }
        assertTrue(CapacitySplitter.overCapacity(store.findByBatch("WAVE-4"), TRUCK_CAPACITY).isEmpty());
    }

    @Test
    @DisplayName("Over-capacity batch is split on intake when enabled")
    void testSplitOnIntake() {
        DeliveryBatch batch = heavyBatch();

        BatchRouteResult result = builder(true).createRoute(batch);

        assertEquals(PlanningStatus.SUCCESS, result.getStatus());
        assertEquals(2, result.getRouteIds().size());
        int stops = 0;
        for (long routeId : result.getRouteIds()) {
            Route route = store.find(routeId).orElseThrow();
            assertTrue(route.totalDemand().fitsWithin(TRUCK_CAPACITY));
            assertEquals("WAVE-9", route.batchId());
            assertRouteInvariants(route);
            stops += route.stopCount();
        }
        assertEquals(5, stops);
    }

    @Test
    @DisplayName("Over-capacity batch stays on one draft route when intake split is off")
    void testNoSplitOnIntake() {
        BatchRouteResult result = builder(false).createRoute(heavyBatch());

        assertEquals(1, result.getRouteIds().size());
        Route route = store.find(result.getRouteIds().get(0)).orElseThrow();
        assertFalse(route.totalDemand().fitsWithin(TRUCK_CAPACITY));
    }

    @Test
    @DisplayName("Empty batch and blank batch id")
    void testEmptyAndInvalidBatch() {
        BatchRouteBuilder builder = builder(true);
        DeliveryBatch empty = DeliveryBatch.builder().batchId("WAVE-0").vehicle(truck()).build();

        assertEquals(PlanningStatus.NO_OP, builder.createRoute(empty).getStatus());
        assertThrows(IllegalArgumentException.class,
                () -> builder.createRoute(DeliveryBatch.builder().batchId(" ").build()));
    }

    @Test
    @DisplayName("Capacity check reports each outcome")
    void testCheckSplitRequirements() {
        BatchRouteBuilder builder = builder(true);
        DeliveryBatch fits = DeliveryBatch.builder()
                .batchId("W1").vehicle(truck()).order(order("SO1", "C1", MANHATTAN, "NORTH", 10.0d)).build();
        DeliveryBatch noVehicle = DeliveryBatch.builder()
                .batchId("W2").order(order("SO1", "C1", MANHATTAN, "NORTH", 10.0d)).build();
        DeliveryBatch oversized = DeliveryBatch.builder()
                .batchId("W3").vehicle(truck()).order(order("SO1", "C1", MANHATTAN, "NORTH", 1200.0d)).build();

        CapacityCheckResult fitsResult = builder.checkSplitRequirements(fits);
        CapacityCheckResult heavyResult = builder.checkSplitRequirements(heavyBatch());
        CapacityCheckResult oversizedResult = builder.checkSplitRequirements(oversized);

        assertEquals(PlanningStatus.NO_OP, fitsResult.getStatus());
        assertFalse(fitsResult.isSplitRequired());
        assertEquals(PlanningStatus.NO_VEHICLE, builder.checkSplitRequirements(noVehicle).getStatus());
        assertEquals(PlanningStatus.SUCCESS, heavyResult.getStatus());
        assertTrue(heavyResult.isSplitRequired());
        assertEquals(1250.0d, heavyResult.getTotalDemand().weight());
        assertEquals(PlanningStatus.REJECTED, oversizedResult.getStatus());
        assertEquals(List.of("SO1"), oversizedResult.getOversizedOrderIds());
        assertTrue(store.findAll().isEmpty());
    }

    @Test
    @DisplayName("Orders group by explicit area, then by the customer's registered area")
    void testGroupOrdersByArea() {
        registry.assignCustomer("C2", BAY_RIDGE, "SOUTH");
        DeliveryOrder explicit = order("SO1", "C1", MANHATTAN, "NORTH", 10.0d);
        DeliveryOrder registered = order("SO2", "C2", BAY_RIDGE, null, 10.0d);
        DeliveryOrder unknownCode = order("SO3", "C2", BAY_RIDGE, "NOWHERE", 10.0d);
        DeliveryOrder unassigned = order("SO4", "C9", MANHATTAN, null, 10.0d);

        Map<String, List<DeliveryOrder>> groups = builder(true)
                .groupOrdersByArea(List.of(explicit, registered, unknownCode, unassigned));

        assertEquals(List.of("NORTH", "SOUTH", BatchRouteBuilder.NO_AREA_KEY), new ArrayList<>(groups.keySet()));
        assertEquals(List.of(registered, unknownCode), groups.get(south.code()));
        assertEquals(List.of(unassigned), groups.get(BatchRouteBuilder.NO_AREA_KEY));
    }

    private static DeliveryBatch heavyBatch() {
        DeliveryBatch.DeliveryBatchBuilder batch = DeliveryBatch.builder().batchId("WAVE-9").vehicle(truck());
        for (int i = 0; i < 5; i++) {
            batch.order(order("SO" + i, "C" + i, Coordinate.of(40.7128 + 0.002 * i, -74.0060), "NORTH", 250.0d));
        }
        return batch.build();
    }
}

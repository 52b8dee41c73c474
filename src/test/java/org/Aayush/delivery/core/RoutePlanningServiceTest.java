package org.Aayush.delivery.core;

import org.Aayush.delivery.geo.Coordinate;
import org.Aayush.delivery.model.AdjustmentReason;
import org.Aayush.delivery.model.Area;
import org.Aayush.delivery.model.Route;
import org.Aayush.delivery.model.RouteState;
import org.Aayush.delivery.model.RouteStateException;
import org.Aayush.delivery.model.Stop;
import org.Aayush.delivery.model.StopState;
import org.Aayush.delivery.store.RouteStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.Aayush.delivery.testutil.RouteFixtures.BAY_RIDGE;
import static org.Aayush.delivery.testutil.RouteFixtures.BOSTON;
import static org.Aayush.delivery.testutil.RouteFixtures.MANHATTAN;
import static org.Aayush.delivery.testutil.RouteFixtures.TRUCK_CAPACITY;
import static org.Aayush.delivery.testutil.RouteFixtures.WEST_VILLAGE;
import static org.Aayush.delivery.testutil.RouteFixtures.area;
import static org.Aayush.delivery.testutil.RouteFixtures.assertRouteInvariants;
import static org.Aayush.delivery.testutil.RouteFixtures.route;
import static org.Aayush.delivery.testutil.RouteFixtures.stop;
import static org.Aayush.delivery.testutil.RouteFixtures.stopIds;
import static org.Aayush.delivery.testutil.RouteFixtures.truck;
import static org.Aayush.delivery.testutil.RouteFixtures.uniformRoute;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("RoutePlanningService Tests")
class RoutePlanningServiceTest {

    private RoutePlanningService service;
    private RouteStore store;
    private Area north;
    private Area south;

    @BeforeEach
    void setUp() {
        service = RoutePlanningService.builder().build();
        store = service.routeStore();
        north = area("NORTH", MANHATTAN);
        south = area("SOUTH", BAY_RIDGE);
    }

    @Nested
    @DisplayName("Distance optimization")
    class DistanceTests {

        @Test
        @DisplayName("Unknown route id reports NOT_FOUND")
        void testNotFound() {
            DistanceOptimizationResult result = service.optimizeRouteByDistance(404L);
            assertEquals(PlanningStatus.NOT_FOUND, result.getStatus());
            assertEquals(404L, result.getRouteId());
        }

        @Test
        @DisplayName("Single-stop route needs no optimization")
        void testSingleStop() {
            Route route = route(store, "B1", north, truck(), List.of(stop(store, MANHATTAN, 1, 1, north)));

            DistanceOptimizationResult result = service.optimizeRouteByDistance(route.id());

            assertEquals(PlanningStatus.NO_OP, result.getStatus());
            assertTrue(result.getMessage().contains(RoutePlanningService.MSG_NO_OPTIMIZATION_NEEDED));
            assertEquals(0.0d, result.getAfterDistanceKm());
        }

        @Test
        @DisplayName("Scenario: stops created out of order are re-sequenced, then the second run is a no-op")
        void testOptimizeThenIdempotent() {
            Stop a = stop(store, MANHATTAN, 1, 1, north);
            Stop c = stop(store, BAY_RIDGE, 1, 1, north);
            Stop b = stop(store, WEST_VILLAGE, 1, 1, north);
            Route route = route(store, "B1", north, truck(), List.of(a, c, b));

            DistanceOptimizationResult first = service.optimizeRouteByDistance(route.id());
            DistanceOptimizationResult second = service.optimizeRouteByDistance(route.id());

            assertEquals(PlanningStatus.SUCCESS, first.getStatus());
            assertTrue(first.getAfterDistanceKm() < first.getBeforeDistanceKm());
            assertEquals(Set.of(b.id(), c.id()), new HashSet<>(first.getAffectedStopIds()));
            assertEquals(List.of(a, b, c), route.stops());
            assertEquals(PlanningStatus.NO_OP, second.getStatus());
            assertEquals(second.getBeforeDistanceKm(), second.getAfterDistanceKm(), 1e-9);
            assertTrue(second.getAffectedStopIds().isEmpty());
        }

        @Test
        @DisplayName("An order shorter than nearest-neighbor is kept")
        void testNeverRegresses() {
            List<Stop> stops = List.of(
                    stop(store, Coordinate.of(0.0, 0.0), 1, 1, null),
                    stop(store, Coordinate.of(0.0, -0.02), 1, 1, null),
                    stop(store, Coordinate.of(0.0, 0.01), 1, 1, null),
                    stop(store, Coordinate.of(0.0, 0.045), 1, 1, null)
            );
            Route route = route(store, "B1", null, truck(), stops);

            DistanceOptimizationResult result = service.optimizeRouteByDistance(route.id());

            assertEquals(PlanningStatus.NO_OP, result.getStatus());
            assertEquals(result.getBeforeDistanceKm(), result.getAfterDistanceKm());
            assertEquals(stops, route.stops());
            assertRouteInvariants(route);
        }

        @Test
        @DisplayName("Routes already in transit are not re-sequenced")
        void testInTransitRejected() {
            Route route = uniformRoute(store, "B1", north, truck(), MANHATTAN, 3, 1, 1);
            route.confirm();
            route.start();

            assertEquals(PlanningStatus.REJECTED, service.optimizeRouteByDistance(route.id()).getStatus());
        }
    }

    @Nested
    @DisplayName("Fleet optimization")
    class FleetTests {

        @Test
        @DisplayName("Routes without a vehicle are skipped and reported")
        void testSkipsRoutesWithoutVehicle() {
            route(store, "B1", north, truck(), List.of(
                    stop(store, MANHATTAN, 1, 1, north),
                    stop(store, BAY_RIDGE, 1, 1, north),
                    stop(store, WEST_VILLAGE, 1, 1, north)
            ));
            Route unassigned = uniformRoute(store, "B2", north, null, MANHATTAN, 3, 1, 1);

            FleetOptimizationResult result = service.optimizeAllRoutesForDistance();

            assertEquals(PlanningStatus.SUCCESS, result.getStatus());
            assertEquals(2, result.getPerRouteResults().size());
            assertEquals(1L, result.count(PlanningStatus.NO_VEHICLE));
            assertTrue(result.getMessage().contains("No Vehicle Assigned"));
            assertEquals(unassigned.id(), result.getPerRouteResults().get(1).getRouteId());
        }

        @Test
        @DisplayName("Fleet of only unassigned routes reports NO_VEHICLE; empty fleet is a no-op")
        void testDegenerateFleets() {
            assertEquals(PlanningStatus.NO_OP, service.optimizeAllRoutesForDistance().getStatus());

            uniformRoute(store, "B1", north, null, MANHATTAN, 3, 1, 1);
            assertEquals(PlanningStatus.NO_VEHICLE, service.optimizeAllRoutesForDistance().getStatus());
        }

        @Test
        @Timeout(value = 10, unit = TimeUnit.SECONDS)
        @DisplayName("Parallel fleet run optimizes every route without failures")
        void testParallelFleet() {
            RoutePlanningService parallel = RoutePlanningService.builder()
                    .policy(PlannerPolicy.builder().fleetParallelism(4).build())
                    .build();
            RouteStore parallelStore = parallel.routeStore();
            Random random = new Random(3L);
            for (int r = 0; r < 24; r++) {
                List<Stop> stops = new ArrayList<>();
                for (int i = 0; i < 12; i++) {
                    stops.add(stop(parallelStore, Coordinate.of(
                            40.6 + random.nextDouble() * 0.2, -74.1 + random.nextDouble() * 0.2), 1, 1, null));
                }
                route(parallelStore, "B" + (r % 5), null, truck(), stops);
            }

            FleetOptimizationResult result = parallel.optimizeAllRoutesForDistance();

            assertEquals(24, result.getPerRouteResults().size());
            assertEquals(0L, result.count(PlanningStatus.FAILED));
            for (DistanceOptimizationResult perRoute : result.getPerRouteResults()) {
                assertTrue(perRoute.getAfterDistanceKm() <= perRoute.getBeforeDistanceKm() + 1e-9);
            }
            for (Route route : parallelStore.findAll()) {
                assertEquals(12, route.stopCount());
                assertRouteInvariants(route);
            }
        }
    }

    @Nested
    @DisplayName("Split and combine")
    class SplitCombineTests {

        @Test
        @DisplayName("Overflowing area is split into a new draft route")
        void testSplit() {
            Route route = uniformRoute(store, "B1", north, truck(), MANHATTAN, 5, 250.0d, 1.0d);

            SplitResult result = service.splitRouteByAreaCapacity(route.id());

            assertEquals(PlanningStatus.SUCCESS, result.getStatus());
            assertEquals(1, result.getNewRouteIds().size());
            assertEquals(2, result.getAffectedStopIds().size());
            assertEquals(3, route.stopCount());
            assertTrue(result.getOversizedStopIds().isEmpty());
        }

        @Test
        @DisplayName("Stops heavier than the vehicle are reported alongside the split")
        void testSplitReportsOversizedStops() {
            Stop heavy = stop(store, MANHATTAN, 1200.0d, 1.0d, north);
            Route route = route(store, "B1", north, truck(), List.of(heavy, stop(store, MANHATTAN, 10.0d, 1.0d, north)));

            SplitResult result = service.splitRouteByAreaCapacity(route.id());

            assertEquals(PlanningStatus.PARTIAL, result.getStatus());
            assertEquals(List.of(heavy.id()), result.getOversizedStopIds());
            assertEquals(List.of(route.id()), result.getOverCapacityRouteIds());
            assertTrue(result.getMessage().contains("still exceed vehicle capacity"));
            assertTrue(route.owns(heavy));
            assertEquals(1, route.stopCount());
        }

        @Test
        @DisplayName("Areas that fit alone but overflow together leave every route confirmable")
        void testSplitAcrossAreas() {
            List<Stop> stops = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                stops.add(stop(store, MANHATTAN, 250.0d, 1.0d, north));
            }
            stops.add(stop(store, BAY_RIDGE, 600.0d, 1.0d, south));
            Route route = route(store, "B1", null, truck(), stops);

            SplitResult result = service.splitRouteByAreaCapacity(route.id());

            assertEquals(PlanningStatus.SUCCESS, result.getStatus());
            assertTrue(result.getOverCapacityRouteIds().isEmpty());
            assertEquals(2, result.getNewRouteIds().size());
            for (Route part : store.findByBatch("B1")) {
                assertTrue(part.totalDemand().fitsWithin(TRUCK_CAPACITY));
                assertEquals(RouteState.CONFIRMED, service.confirmRoute(part.id()).state());
            }
        }

        @Test
        @DisplayName("Capacity operations need a vehicle")
        void testNoVehicle() {
            Route route = uniformRoute(store, "B1", north, null, MANHATTAN, 5, 250.0d, 1.0d);

            assertEquals(PlanningStatus.NO_VEHICLE, service.splitRouteByAreaCapacity(route.id()).getStatus());
            assertEquals(PlanningStatus.NO_VEHICLE, service.combineNearbyAreasRoute(route.id()).getStatus());
            assertEquals(PlanningStatus.NO_VEHICLE, service.splitCombineForAdjacentAreas(route.id()).getStatus());
            assertEquals(PlanningStatus.NO_VEHICLE, service.smartSplitCombineRoute(route.id()).getStatus());
            assertTrue(service.splitRouteByAreaCapacity(route.id()).getMessage().contains("No Vehicle Assigned"));
            assertEquals(5, route.stopCount());
        }

        @Test
        @DisplayName("Fitting route is not split")
        void testSplitNoOp() {
            Route route = uniformRoute(store, "B1", north, truck(), MANHATTAN, 4, 250.0d, 1.0d);
            assertEquals(PlanningStatus.NO_OP, service.splitRouteByAreaCapacity(route.id()).getStatus());
            assertEquals(1, store.findAll().size());
            assertEquals(PlanningStatus.NO_OP, service.combineNearbyAreasRoute(route.id()).getStatus());
        }

        @Test
        @DisplayName("Adjacent route in another batch is absorbed, distant one is not")
        void testCombine() {
            Route target = uniformRoute(store, "B1", north, truck(), MANHATTAN, 3, 50.0d, 1.0d);
            Route neighbour = uniformRoute(store, "B2", south, truck(), BAY_RIDGE, 2, 50.0d, 1.0d);
            Route distant = uniformRoute(store, "B3", area("BOSTON", BOSTON), truck(), BOSTON, 1, 50.0d, 1.0d);

            CombineResult result = service.combineNearbyAreasRoute(target.id());

            assertEquals(PlanningStatus.SUCCESS, result.getStatus());
            assertEquals(List.of(neighbour.id()), result.getMergedRouteIds());
            assertEquals(2, result.getAffectedStopIds().size());
            assertEquals(RouteState.CANCELLED, neighbour.state());
            assertEquals(RouteState.DRAFT, distant.state());
            assertEquals(1, distant.stopCount());
        }

        @Test
        @DisplayName("Scenario: split NORTH then absorb the adjacent SOUTH route")
        void testSplitCombine() {
            Route northRoute = uniformRoute(store, "B1", north, truck(), MANHATTAN, 5, 250.0d, 1.0d);
            Route southRoute = uniformRoute(store, "B2", south, truck(), BAY_RIDGE, 1, 100.0d, 1.0d);
            Set<Long> allStops = new HashSet<>(stopIds(northRoute.stops()));
            allStops.addAll(stopIds(southRoute.stops()));

            CompositePlanningResult result = service.splitCombineForAdjacentAreas(northRoute.id());

            assertEquals(PlanningStatus.SUCCESS, result.getStatus());
            assertEquals(PlanningStatus.SUCCESS, result.getSplit().getStatus());
            assertEquals(RouteState.CANCELLED, southRoute.state());
            assertEquals(2, result.getResultingRouteIds().size());
            assertEquals(northRoute.id(), result.getResultingRouteIds().get(0));
            assertTrue(result.getOptimizations().isEmpty());

            Set<Long> remaining = new HashSet<>();
            for (long id : result.getResultingRouteIds()) {
                Route survivor = store.find(id).orElseThrow();
                assertTrue(survivor.totalDemand().fitsWithin(TRUCK_CAPACITY));
                assertRouteInvariants(survivor);
                remaining.addAll(stopIds(survivor.stops()));
            }
            assertEquals(allStops, remaining);
            assertEquals(850.0d, northRoute.totalDemand().weight());
        }

        @Test
        @DisplayName("Smart variant re-optimizes every resulting route")
        void testSmartSplitCombine() {
            Route northRoute = uniformRoute(store, "B1", north, truck(), MANHATTAN, 5, 250.0d, 1.0d);
            uniformRoute(store, "B2", south, truck(), BAY_RIDGE, 1, 100.0d, 1.0d);

            CompositePlanningResult result = service.smartSplitCombineRoute(northRoute.id());

            assertEquals(PlanningStatus.SUCCESS, result.getStatus());
            assertEquals(result.getResultingRouteIds().size(), result.getOptimizations().size());
            for (DistanceOptimizationResult optimization : result.getOptimizations()) {
                assertNotEquals(PlanningStatus.FAILED, optimization.getStatus());
            }
        }

        @Test
        @DisplayName("Composite run on an unknown route reports NOT_FOUND")
        void testCompositeNotFound() {
            assertEquals(PlanningStatus.NOT_FOUND, service.smartSplitCombineRoute(77L).getStatus());
            assertEquals(PlanningStatus.NOT_FOUND, service.combineNearbyAreasRoute(77L).getStatus());
            assertEquals(PlanningStatus.NOT_FOUND, service.splitRouteByAreaCapacity(77L).getStatus());
        }
    }

    @Nested
    @DisplayName("Lifecycle and adjustments")
    class LifecycleTests {

        @Test
        @DisplayName("Route moves through confirm, start and deliver")
        void testLifecycle() {
            Route route = uniformRoute(store, "B1", north, truck(), MANHATTAN, 2, 100.0d, 1.0d);

            assertEquals(RouteState.CONFIRMED, service.confirmRoute(route.id()).state());
            assertEquals(RouteState.IN_TRANSIT, service.startRoute(route.id()).state());
            assertEquals(RouteState.DELIVERED, service.deliverRoute(route.id()).state());
            assertThrows(RouteStateException.class, () -> service.cancelRoute(route.id()));
        }

        @Test
        @DisplayName("Unknown route throws a reason-coded exception")
        void testUnknownRoute() {
            RoutePlanningException ex = assertThrows(RoutePlanningException.class, () -> service.confirmRoute(9L));
            assertEquals(RoutePlanningService.REASON_ROUTE_NOT_FOUND, ex.reasonCode());
            assertTrue(ex.getMessage().startsWith("[" + RoutePlanningService.REASON_ROUTE_NOT_FOUND + "]"));
        }

        @Test
        @DisplayName("Stop adjustment repositions the stop and records the reason")
        void testAdjustStop() {
            Route route = uniformRoute(store, "B1", north, truck(), MANHATTAN, 3, 1, 1);
            Stop last = route.stops().get(2);
            Instant start = Instant.parse("2026-03-01T09:00:00Z");
            Instant end = Instant.parse("2026-03-01T11:00:00Z");

            Stop adjusted = service.adjustStop(StopAdjustment.builder()
                    .routeId(route.id())
                    .stopId(last.id())
                    .reason(AdjustmentReason.TRAFFIC)
                    .newSequence(1)
                    .newTimeWindowStart(start)
                    .newTimeWindowEnd(end)
                    .build());

            assertEquals(1, adjusted.sequence());
            assertEquals(StopState.ADJUSTED, adjusted.state());
            assertEquals(AdjustmentReason.TRAFFIC, adjusted.adjustmentReason());
            assertEquals(start, adjusted.timeWindowStart());
            assertEquals(last, route.stops().get(0));
            assertRouteInvariants(route);
        }

        @Test
        @DisplayName("Adjusting an unknown stop or an out-of-range sequence throws")
        void testAdjustStopFailures() {
            Route route = uniformRoute(store, "B1", north, truck(), MANHATTAN, 3, 1, 1);

            RoutePlanningException missing = assertThrows(RoutePlanningException.class, () -> service.adjustStop(
                    StopAdjustment.builder().routeId(route.id()).stopId(999L).reason(AdjustmentReason.OTHER).build()));
            assertEquals(RoutePlanningService.REASON_STOP_NOT_FOUND, missing.reasonCode());

            long stopId = route.stops().get(0).id();
            assertThrows(RouteStateException.class, () -> service.adjustStop(StopAdjustment.builder()
                    .routeId(route.id()).stopId(stopId).reason(AdjustmentReason.OTHER).newSequence(4).build()));
        }
    }
}

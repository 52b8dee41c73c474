package org.Aayush.delivery.capacity;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.delivery.model.Area;
import org.Aayush.delivery.model.Demand;
import org.Aayush.delivery.model.Route;
import org.Aayush.delivery.model.Stop;
import org.Aayush.delivery.model.VehicleCapacity;
import org.Aayush.delivery.store.RouteStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Detects per-area capacity overflow on a route and spins the excess off into draft sub-routes.
 *
 * <p>For each overflowing area group the stops are ordered by urgency
 * ({@link Stop#BY_URGENCY}) and cut into contiguous chunks whose sizes differ
 * by at most one, earlier chunks taking the remainder. The first chunk stays
 * on the source route; every later chunk becomes a new {@code DRAFT} route.
 * The chunk count starts at {@code max(ceil(w/maxW), ceil(v/maxV), 1)} and is
 * raised while any multi-stop chunk still overflows, up to one stop per route.</p>
 *
 * <p>Areas that fit on their own can still overflow the source route together.
 * A second pass then packs the source's remaining stops, area by area and
 * urgent first, into consecutive chunks that each fit; the first chunk stays
 * and the rest become sub-routes. After both passes only a stop that alone
 * exceeds capacity can leave a route over its limit.</p>
 */
@Slf4j
public final class CapacitySplitter {
    static final String NO_AREA_KEY = "";

    private final RouteStore routeStore;

    /**
     * @param routeStore store that issues sub-route ids and persists sub-routes.
     */
    public CapacitySplitter(RouteStore routeStore) {
        this.routeStore = Objects.requireNonNull(routeStore, "routeStore");
    }

    /**
     * Splits every overflowing area group of {@code route}.
     *
     * @param route source route, mutated in place.
     * @param capacity vehicle capacity; null makes the call a no-op.
     * @return the source route followed by any created sub-routes.
     */
    public List<Route> splitOversizedAreas(Route route, VehicleCapacity capacity) {
        Objects.requireNonNull(route, "route");
        List<Route> result = new ArrayList<>();
        result.add(route);
        if (capacity == null) {
            return result;
        }

        for (AreaLoad load : groupByArea(route.stops()).values()) {
            if (load.demand().fitsWithin(capacity)) {
                continue;
            }
            List<Stop> sorted = new ArrayList<>(load.stops());
            sorted.sort(Stop.BY_URGENCY);
            List<List<Stop>> chunks = partitionWithinCapacity(sorted, load.demand(), capacity);
            log.debug(
                    "route {} area {} demand {} over {}: {} chunk(s)",
                    route.id(), load.areaKey(), load.demand(), capacity, chunks.size()
            );
            for (int i = 1; i < chunks.size(); i++) {
                result.add(createSubRoute(route, chunks.get(i)));
            }
        }

        if (route.stopCount() > 1 && !route.totalDemand().fitsWithin(capacity)) {
            List<List<Stop>> chunks = packInOrder(residueOrder(route.stops()), capacity);
            log.debug(
                    "route {} still carries {} over {} across areas: {} chunk(s)",
                    route.id(), route.totalDemand(), capacity, chunks.size()
            );
            for (int i = 1; i < chunks.size(); i++) {
                result.add(createSubRoute(route, chunks.get(i)));
            }
        }
        return result;
    }

    /**
     * Routes among {@code routes} whose total demand still exceeds {@code capacity}.
     */
    public static List<Route> overCapacity(Collection<Route> routes, VehicleCapacity capacity) {
        List<Route> over = new ArrayList<>();
        if (capacity == null) {
            return over;
        }
        for (Route route : routes) {
            if (!route.totalDemand().fitsWithin(capacity)) {
                over.add(route);
            }
        }
        return over;
    }

    /**
     * Creates a draft route in the source's batch and moves {@code stops} onto it.
     *
     * <p>The sub-route inherits batch and vehicle. It inherits the source area
     * unless the moved stops all belong to a different area, in which case it
     * takes theirs.</p>
     */
    public Route createSubRoute(Route source, Collection<Stop> stops) {
        Area area = commonArea(stops, source.area());
        Route subRoute = new Route(routeStore.nextRouteId(), source.batchId(), area, source.vehicle());
        routeStore.save(subRoute);
        routeStore.moveStops(source, subRoute, stops);
        log.info("created sub-route {} from route {} with {} stop(s)", subRoute.id(), source.id(), stops.size());
        return subRoute;
    }

    /**
     * Stops whose own demand exceeds capacity. Splitting cannot bring these within limits.
     */
    public static List<Stop> oversizedStops(Collection<Stop> stops, VehicleCapacity capacity) {
        List<Stop> oversized = new ArrayList<>();
        if (capacity == null) {
            return oversized;
        }
        for (Stop stop : stops) {
            if (!stop.demand().fitsWithin(capacity)) {
                oversized.add(stop);
            }
        }
        return oversized;
    }

    /**
     * Groups stops by area code in first-seen order. Stops without an area share one group.
     */
    public static Map<String, AreaLoad> groupByArea(List<Stop> stops) {
        Map<String, List<Stop>> buckets = new LinkedHashMap<>();
        for (Stop stop : stops) {
            String key = stop.area() == null ? NO_AREA_KEY : stop.area().code();
            buckets.computeIfAbsent(key, ignored -> new ArrayList<>()).add(stop);
        }
        Map<String, AreaLoad> loads = new LinkedHashMap<>();
        for (Map.Entry<String, List<Stop>> entry : buckets.entrySet()) {
            loads.put(entry.getKey(), AreaLoad.of(entry.getKey(), entry.getValue()));
        }
        return loads;
    }

    /**
     * Number of routes a demand needs under {@code capacity}, at least one.
     */
    static int routesNeeded(Demand demand, VehicleCapacity capacity, int stopCount) {
        int byWeight = routesFor(demand.weight(), capacity.maxWeight(), stopCount);
        int byVolume = routesFor(demand.volume(), capacity.maxVolume(), stopCount);
        return Math.max(Math.max(byWeight, byVolume), 1);
    }

    /**
     * Splits {@code sorted} into {@code parts} contiguous chunks, sizes differing by at most one.
     */
    static List<List<Stop>> partition(List<Stop> sorted, int parts) {
        int n = sorted.size();
        int effectiveParts = Math.max(1, Math.min(parts, n));
        int base = n / effectiveParts;
        int remainder = n % effectiveParts;

        List<List<Stop>> chunks = new ArrayList<>(effectiveParts);
        int start = 0;
        for (int i = 0; i < effectiveParts; i++) {
            int size = base + (i < remainder ? 1 : 0);
            chunks.add(new ArrayList<>(sorted.subList(start, start + size)));
            start += size;
        }
        return chunks;
    }

    private static List<List<Stop>> partitionWithinCapacity(List<Stop> sorted, Demand demand, VehicleCapacity capacity) {
        int n = sorted.size();
        int parts = Math.min(routesNeeded(demand, capacity, n), n);
        List<List<Stop>> chunks = partition(sorted, parts);
        while (parts < n && anyMultiStopChunkOverflows(chunks, capacity)) {
            parts++;
            chunks = partition(sorted, parts);
        }
        return chunks;
    }

    /**
     * Stops grouped by area in first-seen order, urgent first within each area.
     */
    private static List<Stop> residueOrder(List<Stop> stops) {
        List<Stop> ordered = new ArrayList<>(stops.size());
        for (AreaLoad load : groupByArea(stops).values()) {
            List<Stop> group = new ArrayList<>(load.stops());
            group.sort(Stop.BY_URGENCY);
            ordered.addAll(group);
        }
        return ordered;
    }

    /**
     * Greedy consecutive packing: a new chunk starts whenever the next stop would overflow the current one.
     */
    static List<List<Stop>> packInOrder(List<Stop> ordered, VehicleCapacity capacity) {
        List<List<Stop>> chunks = new ArrayList<>();
        List<Stop> current = new ArrayList<>();
        Demand running = Demand.ZERO;
        for (Stop stop : ordered) {
            Demand next = running.plus(stop.demand());
            if (!current.isEmpty() && !next.fitsWithin(capacity)) {
                chunks.add(current);
                current = new ArrayList<>();
                next = stop.demand();
            }
            current.add(stop);
            running = next;
        }
        if (!current.isEmpty()) {
            chunks.add(current);
        }
        return chunks;
    }

    private static boolean anyMultiStopChunkOverflows(List<List<Stop>> chunks, VehicleCapacity capacity) {
        for (List<Stop> chunk : chunks) {
            if (chunk.size() > 1 && !AreaLoad.of(NO_AREA_KEY, chunk).demand().fitsWithin(capacity)) {
                return true;
            }
        }
        return false;
    }

    private static int routesFor(double demand, double max, int stopCount) {
        if (demand <= 0.0d) {
            return 1;
        }
        if (max <= 0.0d) {
            return Math.max(stopCount, 1);
        }
        return (int) Math.ceil(demand / max);
    }

    private static Area commonArea(Collection<Stop> stops, Area fallback) {
        Area common = null;
        for (Stop stop : stops) {
            if (stop.area() == null) {
                return fallback;
            }
            if (common == null) {
                common = stop.area();
            } else if (!common.equals(stop.area())) {
                return fallback;
            }
        }
        return common == null ? fallback : common;
    }
}

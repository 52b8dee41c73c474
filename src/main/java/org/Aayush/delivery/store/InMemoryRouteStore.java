package org.Aayush.delivery.store;

import it.unimi.dsi.fastutil.longs.Long2ObjectAVLTreeMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectSortedMap;
import org.Aayush.delivery.model.Route;
import org.Aayush.delivery.model.Stop;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Heap-backed {@link RouteStore} keyed by route id.
 *
 * <p>All access goes through the instance monitor, which also makes stop
 * moves atomic with respect to concurrent lookups.</p>
 */
public final class InMemoryRouteStore implements RouteStore {
    private final Long2ObjectSortedMap<Route> routes = new Long2ObjectAVLTreeMap<>();
    private final AtomicLong routeIds = new AtomicLong();
    private final AtomicLong stopIds = new AtomicLong();

    @Override
    public long nextRouteId() {
        return routeIds.incrementAndGet();
    }

    @Override
    public long nextStopId() {
        return stopIds.incrementAndGet();
    }

    @Override
    public synchronized Route save(Route route) {
        Objects.requireNonNull(route, "route");
        routes.put(route.id(), route);
        routeIds.accumulateAndGet(route.id(), Math::max);
        return route;
    }

    @Override
    public synchronized Optional<Route> find(long routeId) {
        return Optional.ofNullable(routes.get(routeId));
    }

    @Override
    public synchronized List<Route> findAll() {
        return new ArrayList<>(routes.values());
    }

    @Override
    public synchronized List<Route> findByBatch(String batchId) {
        List<Route> result = new ArrayList<>();
        for (Route route : routes.values()) {
            if (Objects.equals(route.batchId(), batchId)) {
                result.add(route);
            }
        }
        return result;
    }

    @Override
    public synchronized void moveStops(Route source, Route target, Collection<Stop> stops) {
        source.transferStopsTo(target, stops);
        routes.put(source.id(), source);
        routes.put(target.id(), target);
    }
}

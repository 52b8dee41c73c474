package org.Aayush.delivery.combine;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.delivery.area.AreaAdjacency;
import org.Aayush.delivery.model.Demand;
import org.Aayush.delivery.model.Route;
import org.Aayush.delivery.model.VehicleCapacity;
import org.Aayush.delivery.store.RouteStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Absorbs adjacent, under-capacity routes into a target route.
 *
 * <p>Candidates are visited in ascending id order. A candidate qualifies when
 * it is a different, still plannable route whose area is adjacent to the
 * target's and whose demand fits next to the target's running total. Its stops
 * move to the end of the target and the emptied candidate is cancelled. Once no
 * candidate qualifies, re-running the combiner changes nothing.</p>
 */
@Slf4j
public final class RouteCombiner {
    private final RouteStore routeStore;
    private final AreaAdjacency adjacency;

    public RouteCombiner(RouteStore routeStore, AreaAdjacency adjacency) {
        this.routeStore = Objects.requireNonNull(routeStore, "routeStore");
        this.adjacency = Objects.requireNonNull(adjacency, "adjacency");
    }

    /**
     * Merges qualifying candidates into {@code target}.
     *
     * @param target route receiving stops.
     * @param candidates routes that may be absorbed; absorbed routes end up cancelled.
     * @param capacity capacity limit for the combined route; null disables combining.
     * @return the routes absorbed into {@code target}, in processing order.
     */
    public List<Route> combineAdjacent(Route target, List<Route> candidates, VehicleCapacity capacity) {
        Objects.requireNonNull(target, "target");
        List<Route> absorbed = new ArrayList<>();
        if (capacity == null || candidates == null || !target.state().isPlannable()) {
            return absorbed;
        }

        List<Route> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingLong(Route::id));

        Demand running = target.totalDemand();
        for (Route candidate : ordered) {
            if (!qualifies(target, candidate)) {
                continue;
            }
            Demand combined = running.plus(candidate.totalDemand());
            if (!combined.fitsWithin(capacity)) {
                log.debug("route {} skipped for {}: combined {} exceeds {}",
                        candidate.id(), target.id(), combined, capacity);
                continue;
            }
            absorb(target, candidate);
            running = combined;
            absorbed.add(candidate);
        }
        return absorbed;
    }

    private boolean qualifies(Route target, Route candidate) {
        return candidate != null
                && candidate.id() != target.id()
                && candidate.state().isPlannable()
                && adjacency.adjacent(target.area(), candidate.area());
    }

    private void absorb(Route target, Route candidate) {
        int moved = candidate.stopCount();
        if (target.area() != null && candidate.area() != null && !target.area().equals(candidate.area())) {
            target.assignArea(null);
        } else if (target.area() == null && target.stopCount() == 0) {
            target.assignArea(candidate.area());
        }
        routeStore.moveStops(candidate, target, candidate.stops());
        candidate.cancel();
        routeStore.save(candidate);
        log.info("route {} absorbed {} stop(s) from route {}", target.id(), moved, candidate.id());
    }
}

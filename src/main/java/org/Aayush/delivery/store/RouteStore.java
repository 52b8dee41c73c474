package org.Aayush.delivery.store;

import org.Aayush.delivery.model.Route;
import org.Aayush.delivery.model.Stop;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence seam for route aggregates.
 *
 * <p>Implementations must make a {@link #moveStops} call atomic to other
 * readers of the store: a stop is never observed in both routes or in neither.</p>
 */
public interface RouteStore {

    /**
     * Allocates a fresh route identity.
     */
    long nextRouteId();

    /**
     * Allocates a fresh stop identity.
     */
    long nextStopId();

    /**
     * Inserts or replaces a route.
     *
     * @return the stored route.
     */
    Route save(Route route);

    Optional<Route> find(long routeId);

    /**
     * Returns all routes in ascending id order.
     */
    List<Route> findAll();

    /**
     * Returns routes created for one batch, in ascending id order.
     */
    List<Route> findByBatch(String batchId);

    /**
     * Transfers ownership of {@code stops} from {@code source} to {@code target}.
     */
    void moveStops(Route source, Route target, Collection<Stop> stops);
}

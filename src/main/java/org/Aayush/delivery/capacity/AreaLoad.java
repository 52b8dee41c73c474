package org.Aayush.delivery.capacity;

import org.Aayush.delivery.model.Demand;
import org.Aayush.delivery.model.Stop;

import java.util.List;

/**
 * Stops of one area group on a route and their aggregated demand.
 *
 * @param areaKey area code, or empty for stops without an area.
 */
public record AreaLoad(String areaKey, List<Stop> stops, Demand demand) {

    public static AreaLoad of(String areaKey, List<Stop> stops) {
        Demand total = Demand.ZERO;
        for (Stop stop : stops) {
            total = total.plus(stop.demand());
        }
        return new AreaLoad(areaKey, List.copyOf(stops), total);
    }
}

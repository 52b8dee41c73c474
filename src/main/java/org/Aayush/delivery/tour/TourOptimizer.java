package org.Aayush.delivery.tour;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.delivery.geo.GeoDistance;
import org.Aayush.delivery.model.Stop;

import java.util.ArrayList;
import java.util.List;

/**
 * Nearest-neighbor tour construction over one route's stops.
 *
 * <p>The tour is anchored at the stop with the lowest current sequence (ties by
 * lowest id). Each step appends the closest unvisited stop to the last visited
 * one, again breaking distance ties by lowest id, so results are reproducible
 * for identical input. This is a greedy heuristic, not an optimal tour.</p>
 *
 * <p>Instances are stateless and safe for concurrent use.</p>
 */
public final class TourOptimizer {

    /**
     * Reorders stops and renumbers their sequences {@code 1..N} in visiting order.
     *
     * @param stops stops of a single route, in any order.
     * @return the same stop instances in visiting order. Inputs of size 0 or 1 are returned unchanged.
     */
    public List<Stop> optimize(List<Stop> stops) {
        if (stops == null || stops.size() <= 1) {
            return stops == null ? List.of() : stops;
        }

        // Dense index space sorted by (sequence, id) so index 0 is the anchor
        // and lower indices always win ties.
        List<Stop> candidates = new ArrayList<>(stops);
        candidates.sort(Stop.BY_SEQUENCE);
        int n = candidates.size();

        double[][] distance = distanceMatrix(candidates);
        boolean[] visited = new boolean[n];
        IntArrayList tour = new IntArrayList(n);

        int current = 0;
        visited[current] = true;
        tour.add(current);
        while (tour.size() < n) {
            int next = nearestUnvisited(current, distance, visited, candidates);
            visited[next] = true;
            tour.add(next);
            current = next;
        }

        List<Stop> ordered = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Stop stop = candidates.get(tour.getInt(i));
            stop.assignSequence(i + 1);
            ordered.add(stop);
        }
        return ordered;
    }

    /**
     * Sums consecutive great-circle legs in the given order.
     *
     * @param orderedStops stops already in visiting order.
     * @return total distance in kilometers, {@code 0} for fewer than two stops.
     */
    public double routeDistance(List<Stop> orderedStops) {
        if (orderedStops == null || orderedStops.size() <= 1) {
            return 0.0d;
        }
        double total = 0.0d;
        for (int i = 1; i < orderedStops.size(); i++) {
            total += GeoDistance.distanceKm(
                    orderedStops.get(i - 1).location(),
                    orderedStops.get(i).location()
            );
        }
        return total;
    }

    private static double[][] distanceMatrix(List<Stop> stops) {
        int n = stops.size();
        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = GeoDistance.distanceKm(stops.get(i).location(), stops.get(j).location());
                matrix[i][j] = d;
                matrix[j][i] = d;
            }
        }
        return matrix;
    }

    private static int nearestUnvisited(int from, double[][] distance, boolean[] visited, List<Stop> stops) {
        int best = -1;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int candidate = 0; candidate < visited.length; candidate++) {
            if (visited[candidate]) {
                continue;
            }
            double d = distance[from][candidate];
            if (best < 0
                    || d < bestDistance
                    || (d == bestDistance && stops.get(candidate).id() < stops.get(best).id())) {
                best = candidate;
                bestDistance = d;
            }
        }
        return best;
    }
}

package org.latticeville.runtime.transit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.latticeville.runtime.model.LocationGraph;

/**
 * Shortest path by edge count over a {@link LocationGraph}.
 * <p>
 * Breadth-first search visiting neighbours in sorted order, keeping the first parent that
 * discovers each node. Among all shortest paths this yields the one whose sequence of node
 * ids is lexicographically smallest, so ties are always broken the same way.
 */
public final class PathFinder {

    private PathFinder() {
    }

    /**
     * @param graph The location graph.
     * @param start The starting location.
     * @param goal  The destination.
     * @return The path including start and goal, or an empty list if the goal is the start,
     *         unknown, or unreachable.
     */
    public static List<String> shortestPath(LocationGraph graph, String start, String goal) {
        if (start.equals(goal) || !graph.contains(start) || !graph.contains(goal)) {
            return Collections.emptyList();
        }
        Map<String, String> cameFrom = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        cameFrom.put(start, null);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(goal)) {
                break;
            }
            for (String neighbour : graph.neighbours(current)) {
                if (!cameFrom.containsKey(neighbour)) {
                    cameFrom.put(neighbour, current);
                    queue.add(neighbour);
                }
            }
        }
        if (!cameFrom.containsKey(goal)) {
            return Collections.emptyList();
        }

        List<String> path = new ArrayList<>();
        for (String node = goal; node != null; node = cameFrom.get(node)) {
            path.add(node);
        }
        Collections.reverse(path);
        return path;
    }
}

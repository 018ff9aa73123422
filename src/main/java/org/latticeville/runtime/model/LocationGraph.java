package org.latticeville.runtime.model;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Undirected graph over area nodes used for movement.
 * <p>
 * Edges come from two sources: every parent/child pair of non-root areas in the tree
 * (a room is adjacent to the building that contains it), and explicit edges supplied by
 * the world loader (streets, doors, portals). The root area is a container, not a place,
 * and never takes part in the graph.
 * <p>
 * Neighbour sets are sorted so that any traversal over the graph is reproducible.
 * The graph is immutable once built.
 */
public final class LocationGraph {

    private final Map<String, SortedSet<String>> adjacency;

    private LocationGraph(Map<String, SortedSet<String>> adjacency) {
        this.adjacency = adjacency;
    }

    /**
     * Builds the graph for the given tree and explicit edges.
     *
     * @param tree  The world tree.
     * @param edges Extra edges between areas.
     * @return The graph.
     * @throws StructuralInvariantException if an edge references an unknown node or a non-area.
     */
    public static LocationGraph build(WorldTree tree, List<LocationEdge> edges) {
        Map<String, SortedSet<String>> adjacency = new TreeMap<>();
        String rootId = tree.getRootId();
        for (WorldNode node : tree.getNodes()) {
            if (node.getKind() != NodeKind.AREA || node.getId().equals(rootId)) {
                continue;
            }
            adjacency.computeIfAbsent(node.getId(), k -> new TreeSet<>());
            String parentId = node.getParentId();
            WorldNode parent = parentId != null ? tree.getNode(parentId) : null;
            if (parent != null && parent.getKind() == NodeKind.AREA && !parentId.equals(rootId)) {
                link(adjacency, node.getId(), parentId);
            }
        }
        for (LocationEdge edge : edges) {
            requireArea(tree, edge.from());
            requireArea(tree, edge.to());
            if (edge.from().equals(rootId) || edge.to().equals(rootId)) {
                throw new StructuralInvariantException("Edge " + edge + " must not touch the root area");
            }
            if (edge.from().equals(edge.to())) {
                throw new StructuralInvariantException("Edge " + edge + " is a self loop");
            }
            link(adjacency, edge.from(), edge.to());
        }
        Map<String, SortedSet<String>> frozen = new TreeMap<>();
        adjacency.forEach((id, neighbours) -> frozen.put(id, Collections.unmodifiableSortedSet(neighbours)));
        return new LocationGraph(Collections.unmodifiableMap(frozen));
    }

    private static void requireArea(WorldTree tree, String id) {
        WorldNode node = tree.getNode(id);
        if (node == null) {
            throw new StructuralInvariantException("Edge references unknown node '" + id + "'");
        }
        if (node.getKind() != NodeKind.AREA) {
            throw new StructuralInvariantException("Edge endpoint '" + id + "' is not an area");
        }
    }

    private static void link(Map<String, SortedSet<String>> adjacency, String a, String b) {
        adjacency.computeIfAbsent(a, k -> new TreeSet<>()).add(b);
        adjacency.computeIfAbsent(b, k -> new TreeSet<>()).add(a);
    }

    /**
     * @param locationId An area id.
     * @return Whether the id is a location in this graph.
     */
    public boolean contains(String locationId) {
        return adjacency.containsKey(locationId);
    }

    /**
     * @param locationId An area id.
     * @return The sorted neighbours, empty for unknown ids.
     */
    public SortedSet<String> neighbours(String locationId) {
        SortedSet<String> neighbours = adjacency.get(locationId);
        return neighbours != null ? neighbours : Collections.emptySortedSet();
    }

    /**
     * Collects every location reachable from the start, excluding the start itself.
     *
     * @param startId The starting location.
     * @return Reachable location ids in breadth-first order.
     */
    public Set<String> reachableFrom(String startId) {
        Set<String> visited = new LinkedHashSet<>();
        if (!contains(startId)) {
            return visited;
        }
        Deque<String> queue = new ArrayDeque<>();
        queue.add(startId);
        visited.add(startId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String neighbour : neighbours(current)) {
                if (visited.add(neighbour)) {
                    queue.add(neighbour);
                }
            }
        }
        visited.remove(startId);
        return visited;
    }

    /**
     * @return All location ids in sorted order.
     */
    public Set<String> locations() {
        return adjacency.keySet();
    }
}

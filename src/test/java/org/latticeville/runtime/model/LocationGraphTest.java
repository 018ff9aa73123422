package org.latticeville.runtime.model;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LocationGraphTest {

    private static WorldTree house() {
        WorldTree tree = new WorldTree();
        tree.addRoot(new WorldNode("world", "World", NodeKind.AREA));
        tree.addNode(new WorldNode("house", "House", NodeKind.AREA), "world");
        tree.addNode(new WorldNode("kitchen", "Kitchen", NodeKind.AREA), "house");
        tree.addNode(new WorldNode("bedroom", "Bedroom", NodeKind.AREA), "house");
        tree.addNode(new WorldNode("park", "Park", NodeKind.AREA), "world");
        tree.addNode(new WorldNode("fridge", "Fridge", NodeKind.OBJECT), "kitchen");
        return tree;
    }

    @Test
    void linksAreaParentsAndChildrenButNotTheRoot() {
        LocationGraph graph = LocationGraph.build(house(), List.of());

        assertThat(graph.locations()).containsExactlyInAnyOrder("house", "kitchen", "bedroom", "park");
        assertThat(graph.neighbours("house")).containsExactly("bedroom", "kitchen");
        assertThat(graph.neighbours("park")).isEmpty();
        assertThat(graph.contains("world")).isFalse();
    }

    @Test
    void explicitEdgesAreUndirected() {
        LocationGraph graph = LocationGraph.build(house(), List.of(new LocationEdge("park", "house")));

        assertThat(graph.neighbours("park")).containsExactly("house");
        assertThat(graph.reachableFrom("park")).containsExactlyInAnyOrder("house", "kitchen", "bedroom");
        assertThat(graph.reachableFrom("kitchen")).doesNotContain("kitchen");
    }

    @Test
    void rejectsEdgesToObjectsRootOrSelf() {
        assertThatThrownBy(() -> LocationGraph.build(house(), List.of(new LocationEdge("kitchen", "fridge"))))
                .isInstanceOf(StructuralInvariantException.class);
        assertThatThrownBy(() -> LocationGraph.build(house(), List.of(new LocationEdge("park", "world"))))
                .isInstanceOf(StructuralInvariantException.class);
        assertThatThrownBy(() -> LocationGraph.build(house(), List.of(new LocationEdge("park", "park"))))
                .isInstanceOf(StructuralInvariantException.class);
    }
}

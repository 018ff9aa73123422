package org.latticeville.runtime.model;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link WorldTree} structure and validation.
 */
@Tag("unit")
class WorldTreeTest {

    private WorldTree tree;

    @BeforeEach
    void setUp() {
        tree = new WorldTree();
        tree.addRoot(new WorldNode("root", "Root", NodeKind.AREA));
        tree.addNode(new WorldNode("house", "House", NodeKind.AREA), "root");
        tree.addNode(new WorldNode("kitchen", "Kitchen", NodeKind.AREA), "house");
        tree.addNode(new WorldNode("ada", "Ada", NodeKind.AGENT), "kitchen");
    }

    @Test
    void keepsParentAndChildLinksConsistent() {
        tree.validate();

        assertThat(tree.getNode("kitchen").getParentId()).isEqualTo("house");
        assertThat(tree.getNode("house").getChildren()).containsExactly("kitchen");
        assertThat(tree.idsOfKind(NodeKind.AREA)).containsExactly("root", "house", "kitchen");
    }

    @Test
    void moveReparentsNodeOnBothSides() {
        tree.moveNode("ada", "house");

        assertThat(tree.getNode("ada").getParentId()).isEqualTo("house");
        assertThat(tree.getNode("kitchen").getChildren()).doesNotContain("ada");
        assertThat(tree.getNode("house").getChildren()).containsExactly("kitchen", "ada");
        tree.validate();
    }

    @Test
    void rejectsMoveThatWouldCreateCycle() {
        assertThatThrownBy(() -> tree.moveNode("house", "kitchen"))
                .isInstanceOf(StructuralInvariantException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    void rejectsDuplicateIdsAndMissingParents() {
        assertThatThrownBy(() -> tree.addNode(new WorldNode("kitchen", "Again", NodeKind.AREA), "root"))
                .isInstanceOf(StructuralInvariantException.class);
        assertThatThrownBy(() -> tree.addNode(new WorldNode("shed", "Shed", NodeKind.AREA), "garden"))
                .isInstanceOf(StructuralInvariantException.class);
        assertThatThrownBy(() -> tree.addRoot(new WorldNode("other", "Other", NodeKind.AREA)))
                .isInstanceOf(StructuralInvariantException.class);
    }

    @Test
    void detectsInconsistentSnapshots() {
        Map<String, NodeSnapshot> nodes = tree.snapshot();
        NodeSnapshot orphan = new NodeSnapshot("shed", "Shed", NodeKind.AREA, "house", List.of());
        List<NodeSnapshot> broken = new java.util.ArrayList<>(nodes.values());
        broken.add(orphan);

        assertThatThrownBy(() -> WorldTree.fromSnapshots("root", broken))
                .isInstanceOf(StructuralInvariantException.class)
                .hasMessageContaining("does not list child 'shed'");
    }

    @Test
    void detectsCycleDetachedFromRoot() {
        List<NodeSnapshot> nodes = List.of(
                new NodeSnapshot("root", "Root", NodeKind.AREA, null, List.of()),
                new NodeSnapshot("p", "P", NodeKind.AREA, "q", List.of("q")),
                new NodeSnapshot("q", "Q", NodeKind.AREA, "p", List.of("p")));

        assertThatThrownBy(() -> WorldTree.fromSnapshots("root", nodes))
                .isInstanceOf(StructuralInvariantException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    void copyIsIndependent() {
        WorldTree copy = tree.copy();
        copy.moveNode("ada", "house");

        assertThat(tree.getNode("ada").getParentId()).isEqualTo("kitchen");
        assertThat(copy.getNode("ada").getParentId()).isEqualTo("house");
    }
}

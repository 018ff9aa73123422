package org.latticeville.runtime.perception;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.latticeville.runtime.action.ValidTargets;
import org.latticeville.runtime.model.CanonicalWorldState;
import org.latticeville.runtime.model.LocationGraph;
import org.latticeville.runtime.model.NodeSnapshot;
import org.latticeville.runtime.spi.WorldDefinition;
import org.latticeville.runtime.transit.TransitState;
import org.latticeville.test.utils.WorldFixtures;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class PerceptionTest {

    private CanonicalWorldState state;
    private LocationGraph graph;

    @BeforeEach
    void setUp() {
        WorldDefinition kitchen = WorldFixtures.kitchen();
        state = new CanonicalWorldState(kitchen.tree(), kitchen.objectTypes(), kitchen.objectStates(), kitchen.ambient());
        graph = LocationGraph.build(state.getTree(), kitchen.edges());
    }

    @Test
    void seesCurrentAreaAndItsImmediateChildren() {
        PerceptionSlice slice = Perception.sliceFor(state.snapshot(), "A", 3);

        assertThat(slice.location().id()).isEqualTo("kitchen");
        assertThat(slice.nodes()).extracting(NodeSnapshot::id).containsExactly("kitchen", "fridge", "A", "B");
        assertThat(slice.visibleAgents()).extracting(NodeSnapshot::id).containsExactly("B");
        assertThat(slice.objectStates()).containsKey("fridge");
        assertThat(slice.contains("Z")).isFalse();
    }

    @Test
    void validTargetsComeFromSliceAndGraph() {
        ValidTargets targets = Perception.validTargetsFor(Perception.sliceFor(state, "A", 0), graph);

        assertThat(targets.locations()).containsExactly("Z", "house");
        assertThat(targets.objects()).containsExactly("fridge");
        assertThat(targets.agents()).containsExactly("B");
    }

    @Test
    void travellingAgentSeesOnlyAgentsAndHasNoTargets() {
        state.setTransit("A", new TransitState.InTransit("kitchen", "Z", List.of("kitchen", "house", "Z"), 2, 0));

        PerceptionSlice slice = Perception.sliceFor(state, "A", 1);

        assertThat(slice.inTransit()).isTrue();
        assertThat(slice.nodes()).extracting(NodeSnapshot::id).containsExactly("kitchen", "A", "B");
        assertThat(slice.objectStates()).isEmpty();
        assertThat(Perception.validTargetsFor(slice, graph).isEmpty()).isTrue();
    }

    @Test
    void describesSceneByName() {
        assertThat(Perception.describe(Perception.sliceFor(state, "A", 0), "Ada"))
                .isEqualTo("Ada is at Kitchen with Bob, Fridge.");
    }
}

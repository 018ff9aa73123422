package org.latticeville.runtime.objects;

import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.latticeville.runtime.action.Verb;
import org.latticeville.test.utils.WorldFixtures;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TransitionTableTest {

    private final TransitionTable fridge = WorldFixtures.fridgeTable();

    @Test
    void firstMatchingRuleWins() {
        TransitionOutcome outcome = fridge.resolve(Map.of("items", "1", "door", "closed"), Verb.TAKE);

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.nextState()).containsEntry("items", "0").containsEntry("door", "closed");
        assertThat(outcome.narrationKey()).isEqualTo("fridge.take");
    }

    @Test
    void explicitFailureKeepsState() {
        TransitionOutcome outcome = fridge.resolve(Map.of("items", "0"), Verb.TAKE);

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.nextState()).containsExactly(Map.entry("items", "0"));
        assertThat(outcome.narrationKey()).isEqualTo("fridge.empty");
    }

    @Test
    void defaultKeysDependOnOutcome() {
        assertThat(fridge.resolve(Map.of("items", "0"), Verb.DROP).narrationKey()).isEqualTo("fridge.drop.succeeded");
        assertThat(fridge.resolve(Map.of("items", "1"), Verb.OPEN).narrationKey()).isEqualTo("fridge.open.failed");
    }

    @Test
    void resolvingIsDeterministic() {
        Map<String, String> state = Map.of("items", "1");

        assertThat(fridge.resolve(state, Verb.TAKE)).isEqualTo(fridge.resolve(state, Verb.TAKE));
    }
}

package org.latticeville.runtime.objects;

import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.latticeville.runtime.action.Verb;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TransitionTableLoaderTest {

    @Test
    void parsesRulesWithStringifiedAttributes() {
        Config config = ConfigFactory.parseString("""
                door {
                  rules = [
                    { verb = open, when { open = false }, set { open = true } }
                    { verb = CLOSE, when { open = true }, set { open = false }, narration = "door.shut" }
                    { verb = OPEN, when { locked = 1 }, success = false, narration = "door.locked" }
                  ]
                }
                rock {}
                """);

        Map<String, TransitionTable> tables = TransitionTableLoader.fromConfig(config);

        assertThat(tables).containsOnlyKeys("door", "rock");
        assertThat(tables.get("rock").getRules()).isEmpty();
        TransitionTable door = tables.get("door");
        assertThat(door.getRules()).hasSize(3);
        assertThat(door.getRules().get(0).verb()).isEqualTo(Verb.OPEN);
        assertThat(door.getRules().get(0).when()).containsEntry("open", "false");
        assertThat(door.getRules().get(2).success()).isFalse();

        TransitionOutcome closed = door.resolve(Map.of("open", "true"), Verb.CLOSE);
        assertThat(closed.nextState()).containsEntry("open", "false");
        assertThat(closed.narrationKey()).isEqualTo("door.shut");
    }

    @Test
    void rejectsUnknownVerbs() {
        Config config = ConfigFactory.parseString("door { rules = [ { verb = KICK } ] }");

        assertThatThrownBy(() -> TransitionTableLoader.fromConfig(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("KICK");
    }
}

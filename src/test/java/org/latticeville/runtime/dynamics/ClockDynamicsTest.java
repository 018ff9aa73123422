package org.latticeville.runtime.dynamics;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.latticeville.runtime.event.Event;
import org.latticeville.runtime.internal.services.SeededRandomProvider;
import org.latticeville.runtime.model.CanonicalWorldState;
import org.latticeville.runtime.spi.DynamicsContext;
import org.latticeville.runtime.spi.WorldDefinition;
import org.latticeville.test.utils.WorldFixtures;

import com.typesafe.config.ConfigFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ClockDynamicsTest {

    private final WorldDefinition definition = WorldFixtures.twoAreas();
    private final CanonicalWorldState world = new CanonicalWorldState(definition.tree(), definition.objectTypes(),
            definition.objectStates(), definition.ambient());

    @Test
    void advancesFromConfiguredStartEveryTick() {
        ClockDynamics clock = new ClockDynamics(new SeededRandomProvider(1),
                ConfigFactory.parseString("start = \"07:30\", minutesPerTick = 15"));
        List<Event> events = new ArrayList<>();

        clock.apply(new DynamicsContext(0, world, events));
        clock.apply(new DynamicsContext(1, world, events));

        assertThat(events).containsExactly(new Event.TimeAdvanced("07:30", "07:45"),
                new Event.TimeAdvanced("07:45", "08:00"));
        assertThat(world.getAmbient(ClockDynamics.AMBIENT_KEY)).isEqualTo("08:00");
    }

    @Test
    void wrapsAtMidnight() {
        world.setAmbient(ClockDynamics.AMBIENT_KEY, "23:50");
        List<Event> events = new ArrayList<>();

        new ClockDynamics(LocalTime.of(8, 0), 20).apply(new DynamicsContext(0, world, events));

        assertThat(events).containsExactly(new Event.TimeAdvanced("23:50", "00:10"));
    }
}

package org.latticeville.runtime.dynamics;

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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class WeatherDynamicsTest {

    private static CanonicalWorldState newWorld() {
        WorldDefinition definition = WorldFixtures.twoAreas();
        return new CanonicalWorldState(definition.tree(), definition.objectTypes(), definition.objectStates(),
                definition.ambient());
    }

    private static List<String> run(WeatherDynamics weather, CanonicalWorldState world, int ticks) {
        List<String> history = new ArrayList<>();
        for (int tick = 0; tick < ticks; tick++) {
            weather.apply(new DynamicsContext(tick, world, new ArrayList<>()));
            history.add(world.getAmbient(WeatherDynamics.AMBIENT_KEY));
        }
        return history;
    }

    @Test
    void seedsMissingWeatherWithoutEvent() {
        CanonicalWorldState world = newWorld();
        List<Event> events = new ArrayList<>();
        WeatherDynamics weather = new WeatherDynamics(new SeededRandomProvider(1), List.of("fog", "sun"), 0.0);

        weather.apply(new DynamicsContext(0, world, events));

        assertThat(world.getAmbient(WeatherDynamics.AMBIENT_KEY)).isEqualTo("fog");
        assertThat(events).isEmpty();
    }

    @Test
    void certainChangeAlwaysPicksAnotherState() {
        CanonicalWorldState world = newWorld();
        world.setAmbient(WeatherDynamics.AMBIENT_KEY, "fog");
        List<Event> events = new ArrayList<>();
        WeatherDynamics weather = new WeatherDynamics(new SeededRandomProvider(1), List.of("fog", "sun"), 1.0);

        weather.apply(new DynamicsContext(0, world, events));
        weather.apply(new DynamicsContext(1, world, events));

        assertThat(events).containsExactly(new Event.WeatherChanged("fog", "sun"), new Event.WeatherChanged("sun", "fog"));
    }

    @Test
    void historyIsReproducibleForASeed() {
        List<String> first = run(new WeatherDynamics(new SeededRandomProvider(42), ConfigFactory.parseString(
                "changeProbability = 0.5")), newWorld(), 50);
        List<String> second = run(new WeatherDynamics(new SeededRandomProvider(42), ConfigFactory.parseString(
                "changeProbability = 0.5")), newWorld(), 50);

        assertThat(first).isEqualTo(second);
        assertThat(first).containsAnyOf("cloudy", "rain");
        assertThat(first).allSatisfy(w -> assertThat(w).isIn("clear", "cloudy", "rain"));
    }

    @Test
    void rejectsInvalidOptions() {
        SeededRandomProvider random = new SeededRandomProvider(1);
        assertThatThrownBy(() -> new WeatherDynamics(random, List.of(), 0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WeatherDynamics(random, List.of("sun"), 1.5)).isInstanceOf(IllegalArgumentException.class);
    }
}

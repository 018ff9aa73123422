package org.latticeville.runtime.dynamics;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.latticeville.runtime.event.Event;
import org.latticeville.runtime.spi.DynamicsContext;
import org.latticeville.runtime.spi.IRandomProvider;
import org.latticeville.runtime.spi.IWorldDynamics;

import com.typesafe.config.Config;

/**
 * Random-walk weather over a fixed list of conditions.
 * <p>
 * Each tick the weather changes with probability {@code changeProbability} to one of the
 * other conditions, drawn uniformly. The draw sequence depends only on the seed, so the
 * weather history is reproducible.
 *
 * <h2>Configuration</h2>
 * <pre>{@code
 * {
 *   className = "org.latticeville.runtime.dynamics.WeatherDynamics"
 *   options {
 *     states = ["clear", "cloudy", "rain"]
 *     changeProbability = 0.1
 *   }
 * }
 * }</pre>
 */
public class WeatherDynamics implements IWorldDynamics {

    public static final String AMBIENT_KEY = "weather";

    private final Random random;
    private final List<String> states;
    private final double changeProbability;

    /**
     * @param randomProvider Source of randomness.
     * @param config         Options containing {@code states} and {@code changeProbability}.
     */
    public WeatherDynamics(IRandomProvider randomProvider, Config config) {
        this(randomProvider,
                config.hasPath("states") ? config.getStringList("states") : List.of("clear", "cloudy", "rain"),
                config.hasPath("changeProbability") ? config.getDouble("changeProbability") : 0.1);
    }

    WeatherDynamics(IRandomProvider randomProvider, List<String> states, double changeProbability) {
        if (states.isEmpty()) {
            throw new IllegalArgumentException("Weather needs at least one state");
        }
        if (changeProbability < 0.0 || changeProbability > 1.0) {
            throw new IllegalArgumentException("changeProbability must be in [0.0, 1.0], got: " + changeProbability);
        }
        this.random = randomProvider.asJavaRandom();
        this.states = List.copyOf(states);
        this.changeProbability = changeProbability;
    }

    @Override
    public void apply(DynamicsContext context) {
        String current = context.getAmbient(AMBIENT_KEY);
        if (current == null) {
            current = states.get(0);
            context.setAmbient(AMBIENT_KEY, current);
        }
        if (random.nextDouble() >= changeProbability) {
            return;
        }
        List<String> others = new ArrayList<>(states);
        others.remove(current);
        if (others.isEmpty()) {
            return;
        }
        String next = others.get(random.nextInt(others.size()));
        context.setAmbient(AMBIENT_KEY, next);
        context.emit(new Event.WeatherChanged(current, next));
    }
}

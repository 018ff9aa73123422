package org.latticeville.runtime.dynamics;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

import org.latticeville.runtime.event.Event;
import org.latticeville.runtime.spi.DynamicsContext;
import org.latticeville.runtime.spi.IRandomProvider;
import org.latticeville.runtime.spi.IWorldDynamics;

import com.typesafe.config.Config;

/**
 * Advances the in-world time of day by a fixed step per tick, wrapping at midnight.
 * The clock is kept in ambient state as {@code HH:mm}.
 *
 * <h2>Configuration</h2>
 * <pre>{@code
 * {
 *   className = "org.latticeville.runtime.dynamics.ClockDynamics"
 *   options {
 *     start = "08:00"
 *     minutesPerTick = 10
 *   }
 * }
 * }</pre>
 */
public class ClockDynamics implements IWorldDynamics {

    public static final String AMBIENT_KEY = "clock";
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final LocalTime start;
    private final int minutesPerTick;

    /**
     * @param randomProvider Source of randomness (unused, required by plugin interface).
     * @param config         Options containing {@code start} and {@code minutesPerTick}.
     */
    public ClockDynamics(IRandomProvider randomProvider, Config config) {
        this(LocalTime.parse(config.hasPath("start") ? config.getString("start") : "08:00", FORMAT),
                config.hasPath("minutesPerTick") ? config.getInt("minutesPerTick") : 10);
    }

    ClockDynamics(LocalTime start, int minutesPerTick) {
        if (minutesPerTick < 1) {
            throw new IllegalArgumentException("minutesPerTick must be >= 1, got: " + minutesPerTick);
        }
        this.start = start;
        this.minutesPerTick = minutesPerTick;
    }

    @Override
    public void apply(DynamicsContext context) {
        String current = context.getAmbient(AMBIENT_KEY);
        LocalTime from = current != null ? LocalTime.parse(current, FORMAT) : start;
        String fromText = from.format(FORMAT);
        String toText = from.plusMinutes(minutesPerTick).format(FORMAT);
        context.setAmbient(AMBIENT_KEY, toText);
        context.emit(new Event.TimeAdvanced(fromText, toText));
    }
}

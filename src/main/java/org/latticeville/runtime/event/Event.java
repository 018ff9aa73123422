package org.latticeville.runtime.event;

import java.util.Map;

import org.latticeville.runtime.action.Verb;
import org.latticeville.runtime.model.FrozenMaps;

/**
 * Something that happened during a tick. Immutable once emitted.
 * <p>
 * Within one tick, events appear in agent processing order (ascending agent id), followed
 * by the events of world dynamics.
 */
public sealed interface Event permits Event.Moved, Event.ObjectStateChanged, Event.Said,
        Event.WeatherChanged, Event.TimeAdvanced {

    /**
     * @return The event kind.
     */
    EventKind kind();

    /**
     * An agent arrived at the end of a journey. Emitted once, on arrival.
     *
     * @param agentId The agent.
     * @param from    Where the journey started.
     * @param to      The destination reached.
     */
    record Moved(String agentId, String from, String to) implements Event {
        @Override
        public EventKind kind() {
            return EventKind.MOVE;
        }
    }

    /**
     * Outcome of an interaction with an object. Emitted for failures too, in which case
     * {@code fromState} and {@code toState} are equal.
     *
     * @param agentId      The acting agent.
     * @param objectId     The object.
     * @param verb         The verb applied.
     * @param fromState    Attributes before the interaction.
     * @param toState      Attributes after the interaction.
     * @param success      Whether the transition table accepted the verb.
     * @param narrationKey Template key describing the outcome.
     */
    record ObjectStateChanged(String agentId, String objectId, Verb verb, Map<String, String> fromState,
                              Map<String, String> toState, boolean success, String narrationKey) implements Event {

        public ObjectStateChanged {
            fromState = FrozenMaps.copyOf(fromState);
            toState = FrozenMaps.copyOf(toState);
        }

        @Override
        public EventKind kind() {
            return EventKind.OBJECT_STATE_CHANGED;
        }
    }

    /**
     * An agent spoke to another agent in the same area.
     *
     * @param fromAgentId The speaker.
     * @param toAgentId   The addressee.
     * @param utterance   What was said.
     */
    record Said(String fromAgentId, String toAgentId, String utterance) implements Event {
        @Override
        public EventKind kind() {
            return EventKind.SAY;
        }
    }

    /**
     * The weather changed.
     *
     * @param oldWeather The previous weather.
     * @param newWeather The new weather.
     */
    record WeatherChanged(String oldWeather, String newWeather) implements Event {
        @Override
        public EventKind kind() {
            return EventKind.WEATHER_CHANGED;
        }
    }

    /**
     * The world clock moved forward.
     *
     * @param fromTime Clock value before the tick.
     * @param toTime   Clock value after the tick.
     */
    record TimeAdvanced(String fromTime, String toTime) implements Event {
        @Override
        public EventKind kind() {
            return EventKind.TIME_ADVANCED;
        }
    }
}

package org.latticeville.runtime.event;

import java.util.List;

/**
 * The immutable unit published once per committed tick.
 *
 * @param tick   The tick number, starting at 0.
 * @param state  The state after the tick was committed.
 * @param events Events of the tick in emission order.
 */
public record TickPayload(long tick, StateSnapshot state, List<Event> events) {

    public TickPayload {
        events = events == null ? List.of() : List.copyOf(events);
    }
}

package org.latticeville.runtime.spi;

import java.util.List;

import org.latticeville.runtime.event.Event;
import org.latticeville.runtime.model.CanonicalWorldState;

/**
 * The narrow view of a tick that world dynamics get: ambient reads and writes plus an
 * event buffer.
 */
public final class DynamicsContext {

    private final long tick;
    private final CanonicalWorldState working;
    private final List<Event> events;

    /**
     * @param tick    The tick being applied.
     * @param working The tick's working copy.
     * @param events  The tick's event list; emitted events are appended to it.
     */
    public DynamicsContext(long tick, CanonicalWorldState working, List<Event> events) {
        this.tick = tick;
        this.working = working;
        this.events = events;
    }

    public long getTick() {
        return tick;
    }

    public String getAmbient(String key) {
        return working.getAmbient(key);
    }

    public void setAmbient(String key, String value) {
        working.setAmbient(key, value);
    }

    public void emit(Event event) {
        events.add(event);
    }
}

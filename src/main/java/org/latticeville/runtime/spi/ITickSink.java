package org.latticeville.runtime.spi;

import org.latticeville.runtime.event.TickPayload;

/**
 * Consumer of published ticks, e.g. a renderer or a replay log.
 * <p>
 * Each sink is fed from its own delivery thread, in tick order. A slow sink delays only
 * itself, never the simulation.
 */
public interface ITickSink {

    void onTick(TickPayload payload) throws Exception;

    /**
     * Called once after the last payload was delivered.
     */
    default void close() throws Exception {
    }
}

package org.latticeville.runtime.spi;

import org.latticeville.runtime.memory.MemoryView;

/**
 * Notified of every memory record appended, on the simulation thread and in append order.
 */
@FunctionalInterface
public interface IMemoryListener {

    void onMemory(String agentId, MemoryView record) throws Exception;
}

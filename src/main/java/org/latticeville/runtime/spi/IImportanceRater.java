package org.latticeville.runtime.spi;

import org.latticeville.runtime.memory.MemoryKind;

/**
 * Rates how poignant a memory is, from 1 (mundane) to 10 (life-changing).
 * Values outside that range are clamped by the caller.
 */
@FunctionalInterface
public interface IImportanceRater {

    int rate(String description, MemoryKind kind) throws Exception;
}

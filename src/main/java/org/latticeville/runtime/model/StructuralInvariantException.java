package org.latticeville.runtime.model;

/**
 * Thrown when a world tree violates its structural invariants (cycle, dangling parent,
 * inconsistent parent/child links, missing root).
 * <p>
 * This is fatal: a tick that detects it is never committed and the simulation halts,
 * since determinism of any later tick could no longer be guaranteed.
 */
public class StructuralInvariantException extends RuntimeException {

    public StructuralInvariantException(String message) {
        super(message);
    }
}

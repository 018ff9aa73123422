package org.latticeville.runtime.spi;

/**
 * Deterministic process that evolves ambient state once per tick, such as weather or the
 * time of day.
 * <p>
 * Dynamics run after all agent actions have been applied to the working copy and before
 * it is committed. They see only ambient state and the tick number, never agent actions.
 * Events they emit are appended after all agent events of the tick.
 * </p>
 * <p>
 * Implementations must provide a constructor with signature:
 * {@code (IRandomProvider rng, com.typesafe.config.Config options)}
 * </p>
 */
public interface IWorldDynamics {

    void apply(DynamicsContext context);
}

package org.latticeville.runtime.spi;

import org.latticeville.runtime.action.Action;

/**
 * Chooses one action per agent per tick.
 * <p>
 * Calls for different agents run concurrently on the decision worker pool, so
 * implementations must be thread-safe. A call that throws, returns {@code null} or
 * overruns the configured timeout is treated as {@link Action#IDLE}. Returned actions are
 * validated afterwards; the policy does not have to restrict itself to valid targets.
 */
@FunctionalInterface
public interface IDecisionPolicy {

    /**
     * @param request The agent's view of the world.
     * @return The proposed action.
     * @throws Exception if the decision cannot be made.
     */
    Action decide(DecisionRequest request) throws Exception;
}

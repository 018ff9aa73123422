package org.latticeville.runtime.spi;

import java.util.List;

import org.latticeville.runtime.action.ValidTargets;
import org.latticeville.runtime.memory.MemoryView;
import org.latticeville.runtime.model.BeliefSnapshot;
import org.latticeville.runtime.perception.PerceptionSlice;

/**
 * Everything a decision policy may look at for one agent in one tick.
 *
 * @param agentId      The deciding agent.
 * @param agentName    Display name of the agent.
 * @param goal         The agent's current goal, possibly empty.
 * @param planStep     The plan step active this tick, possibly empty.
 * @param tick         The tick being decided.
 * @param perception   What the agent sees right now.
 * @param beliefs      What the agent remembers of the world.
 * @param memories     Retrieved memory excerpt, best first.
 * @param validTargets Arguments the scheduler will accept this tick.
 */
public record DecisionRequest(
        String agentId,
        String agentName,
        String goal,
        String planStep,
        long tick,
        PerceptionSlice perception,
        BeliefSnapshot beliefs,
        List<MemoryView> memories,
        ValidTargets validTargets) {

    public DecisionRequest {
        memories = List.copyOf(memories);
        goal = goal != null ? goal : "";
        planStep = planStep != null ? planStep : "";
    }
}

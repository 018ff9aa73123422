package org.latticeville.runtime.spi;

import java.util.List;

/**
 * Drafts an agent's day plan and breaks it into the steps the agent works through.
 * <p>
 * The scheduler asks for a plan once per agent, on the agent's first tick. The day plan
 * items are remembered as plan memories; the step active at a tick is handed to the
 * decision policy and joins the retrieval query.
 */
public interface IPlanner {

    /**
     * One plan entry covering the ticks {@code [startTick, endTick)}.
     *
     * @param startTick   First tick of the entry.
     * @param endTick     First tick after the entry.
     * @param locationId  Where the agent means to be.
     * @param description What the agent means to do.
     */
    record PlanItem(long startTick, long endTick, String locationId, String description) {
        public PlanItem {
            if (endTick <= startTick) {
                throw new IllegalArgumentException("Plan item must end after it starts: ["
                        + startTick + ", " + endTick + ")");
            }
        }

        public boolean isActiveAt(long tick) {
            return startTick <= tick && tick < endTick;
        }
    }

    /**
     * @param agentId      The planning agent.
     * @param agentName    Display name of the agent.
     * @param locationId   Where the agent stands when planning.
     * @param locationName Display name of that location.
     * @param startTick    The tick the plan starts at.
     * @return The day plan, in time order.
     * @throws Exception if planning fails.
     */
    List<PlanItem> planDay(String agentId, String agentName, String locationId, String locationName,
                           long startTick) throws Exception;

    /**
     * @param dayPlan The day plan returned by {@link #planDay}.
     * @return Finer-grained steps covering the same ticks, in time order.
     * @throws Exception if decomposition fails.
     */
    List<PlanItem> decompose(List<PlanItem> dayPlan) throws Exception;
}

package org.latticeville.runtime.internal.services;

import java.util.ArrayList;
import java.util.List;

import org.latticeville.runtime.spi.IPlanner;

import com.typesafe.config.Config;

/**
 * Plans the same five-part routine for every agent, anchored at where the agent starts.
 * <p>
 * Each part lasts {@code item-ticks}; decomposition cuts every part into steps of
 * {@code step-ticks}, the last step of a part being shorter if needed.
 *
 * <h2>Configuration</h2>
 * <pre>{@code
 * planning {
 *   item-ticks = 4
 *   step-ticks = 1
 * }
 * }</pre>
 */
public class RoutineDayPlanner implements IPlanner {

    private static final List<String> ROUTINE = List.of(
            "%s starts the day and checks the surroundings at %s.",
            "%s spends time at %s and observes activity.",
            "%s takes a short walk and reflects.",
            "%s does a short errand and returns to %s.",
            "%s wraps up the day at %s.");

    private final int itemTicks;
    private final int stepTicks;

    public RoutineDayPlanner() {
        this(4, 1);
    }

    /**
     * @param config The {@code planning} block.
     */
    public RoutineDayPlanner(Config config) {
        this(config.hasPath("item-ticks") ? config.getInt("item-ticks") : 4,
                config.hasPath("step-ticks") ? config.getInt("step-ticks") : 1);
    }

    RoutineDayPlanner(int itemTicks, int stepTicks) {
        if (itemTicks < 1 || stepTicks < 1) {
            throw new IllegalArgumentException("planning.item-ticks and planning.step-ticks must be >= 1, got "
                    + itemTicks + " and " + stepTicks);
        }
        this.itemTicks = itemTicks;
        this.stepTicks = stepTicks;
    }

    @Override
    public List<PlanItem> planDay(String agentId, String agentName, String locationId, String locationName,
                                  long startTick) {
        List<PlanItem> plan = new ArrayList<>(ROUTINE.size());
        long start = startTick;
        for (String template : ROUTINE) {
            plan.add(new PlanItem(start, start + itemTicks, locationId,
                    String.format(template, agentName, locationName)));
            start += itemTicks;
        }
        return plan;
    }

    @Override
    public List<PlanItem> decompose(List<PlanItem> dayPlan) {
        List<PlanItem> steps = new ArrayList<>();
        for (PlanItem item : dayPlan) {
            long count = (item.endTick() - item.startTick() + stepTicks - 1) / stepTicks;
            int index = 1;
            for (long start = item.startTick(); start < item.endTick(); start += stepTicks) {
                long end = Math.min(start + stepTicks, item.endTick());
                steps.add(new PlanItem(start, end, item.locationId(),
                        item.description() + " (step " + index++ + " of " + count + ")"));
            }
        }
        return steps;
    }
}

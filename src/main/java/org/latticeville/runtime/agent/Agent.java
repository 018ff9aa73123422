package org.latticeville.runtime.agent;

import java.util.List;
import java.util.Optional;

import org.latticeville.runtime.memory.MemorySettings;
import org.latticeville.runtime.memory.MemoryStream;
import org.latticeville.runtime.memory.ReflectionTrigger;
import org.latticeville.runtime.model.BeliefState;
import org.latticeville.runtime.spi.IPlanner.PlanItem;

/**
 * Per-agent kernel state: beliefs, memories, the reflection window and the plan steps.
 * <p>
 * Every piece is written only by the scheduler on this agent's behalf.
 */
public class Agent {

    private final String id;
    private final String name;
    private final BeliefState beliefs;
    private final MemoryStream memory;
    private final ReflectionTrigger reflection;
    private String goal;
    private List<PlanItem> planSteps;

    public Agent(String id, String name, MemorySettings settings) {
        this.id = id;
        this.name = name != null ? name : id;
        this.beliefs = new BeliefState(id);
        this.memory = new MemoryStream(settings.recencyDecay());
        this.reflection = new ReflectionTrigger(settings.reflectionThreshold());
        this.goal = "";
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public BeliefState getBeliefs() {
        return beliefs;
    }

    public MemoryStream getMemory() {
        return memory;
    }

    public ReflectionTrigger getReflection() {
        return reflection;
    }

    public String getGoal() {
        return goal;
    }

    /**
     * @param goal Free-text goal used in retrieval queries.
     */
    public void setGoal(String goal) {
        this.goal = goal != null ? goal : "";
    }

    /**
     * @return Whether the agent has planned its day, even if the plan came out empty.
     */
    public boolean hasPlanned() {
        return planSteps != null;
    }

    /**
     * @return The plan steps in time order; empty before the agent has planned.
     */
    public List<PlanItem> getPlanSteps() {
        return planSteps != null ? planSteps : List.of();
    }

    public void setPlanSteps(List<PlanItem> steps) {
        this.planSteps = List.copyOf(steps);
    }

    /**
     * @param tick A tick.
     * @return The first plan step covering the tick, if any.
     */
    public Optional<PlanItem> activePlanStep(long tick) {
        for (PlanItem step : getPlanSteps()) {
            if (step.isActiveAt(tick)) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "Agent{" + id + "}";
    }
}

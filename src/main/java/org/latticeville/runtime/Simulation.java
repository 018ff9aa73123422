package org.latticeville.runtime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.latticeville.runtime.action.Action;
import org.latticeville.runtime.action.ActionValidator;
import org.latticeville.runtime.action.ValidTargets;
import org.latticeville.runtime.agent.Agent;
import org.latticeville.runtime.dynamics.WorldDynamicsManager;
import org.latticeville.runtime.event.Event;
import org.latticeville.runtime.event.StateSnapshot;
import org.latticeville.runtime.event.TickPayload;
import org.latticeville.runtime.internal.services.HashingEmbedder;
import org.latticeville.runtime.internal.services.KeywordImportanceRater;
import org.latticeville.runtime.internal.services.RoutineDayPlanner;
import org.latticeville.runtime.internal.services.SeededRandomProvider;
import org.latticeville.runtime.internal.services.SummarizingInsightGenerator;
import org.latticeville.runtime.internal.services.TemplateNarrationRenderer;
import org.latticeville.runtime.memory.MemoryKind;
import org.latticeville.runtime.memory.MemoryRecord;
import org.latticeville.runtime.memory.MemoryService;
import org.latticeville.runtime.memory.MemorySettings;
import org.latticeville.runtime.memory.MemoryView;
import org.latticeville.runtime.model.BeliefSnapshot;
import org.latticeville.runtime.model.CanonicalWorldState;
import org.latticeville.runtime.model.IWorldReader;
import org.latticeville.runtime.model.LocationGraph;
import org.latticeville.runtime.model.NodeKind;
import org.latticeville.runtime.model.NodeSnapshot;
import org.latticeville.runtime.model.StructuralInvariantException;
import org.latticeville.runtime.model.WorldStateSnapshot;
import org.latticeville.runtime.objects.ObjectExecutor;
import org.latticeville.runtime.perception.Perception;
import org.latticeville.runtime.perception.PerceptionSlice;
import org.latticeville.runtime.spi.DecisionRequest;
import org.latticeville.runtime.spi.DynamicsContext;
import org.latticeville.runtime.spi.IDecisionPolicy;
import org.latticeville.runtime.spi.IMemoryListener;
import org.latticeville.runtime.spi.INarrationRenderer;
import org.latticeville.runtime.spi.IPlanner;
import org.latticeville.runtime.spi.IPlanner.PlanItem;
import org.latticeville.runtime.spi.IRandomProvider;
import org.latticeville.runtime.spi.ITickSink;
import org.latticeville.runtime.spi.IWorldDynamics;
import org.latticeville.runtime.spi.IWorldLoader;
import org.latticeville.runtime.spi.WorldDefinition;
import org.latticeville.runtime.transit.TransitStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * The tick scheduler. Owns the canonical world state and every agent's beliefs and
 * memories, and advances them one discrete tick at a time.
 * <p>
 * A tick runs these phases in strict sequence:
 * <ol>
 *   <li>Freeze an immutable snapshot of the state left by the previous tick.</li>
 *   <li>Perceive: build every agent's slice and valid targets from the snapshot. Agents
 *       that have not planned yet draft their day plan.</li>
 *   <li>Retrieve each agent's memory excerpt, then decide all agents concurrently.</li>
 *   <li>Validate: anything outside the valid targets becomes IDLE.</li>
 *   <li>Execute validated actions on a working copy in ascending agent id.</li>
 *   <li>Apply world dynamics to the working copy and check structural invariants.</li>
 *   <li>Commit the working copy, then merge beliefs from the pre-tick slices.</li>
 *   <li>Append memories and new day plans, reflect, publish the payload, increment the tick.</li>
 * </ol>
 * Only the decide phase leaves the simulation thread. Given the same world, config, seed
 * and policy outputs, every run produces the same states and events.
 * <p>
 * A structural invariant violation aborts the tick before commit and halts the
 * simulation; every later {@link #tick()} fails with {@link IllegalStateException}, as does
 * every tick after {@link #shutdown()}.
 */
public class Simulation {

    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);

    private CanonicalWorldState world;
    private final LocationGraph graph;
    private final TransitStateMachine transit;
    private final ObjectExecutor objectExecutor;
    private final Map<String, Agent> agents = new TreeMap<>();
    private final DecisionWorkerPool decisionPool;
    private final TickPublisher publisher = new TickPublisher();
    private final List<IMemoryListener> memoryListeners = new ArrayList<>();
    private final WorldDynamicsManager dynamics;
    private final IRandomProvider randomProvider;
    private final MemorySettings memorySettings;
    private final long decisionTimeoutMs;
    private final int effectiveParallelism;

    private IDecisionPolicy decisionPolicy = request -> Action.IDLE;
    private MemoryService memoryService;
    private INarrationRenderer narrationRenderer;
    private IPlanner planner;
    private volatile boolean stopped;
    private long currentTick = 0L;
    private StructuralInvariantException haltCause;

    /**
     * Constructs a new Simulation.
     *
     * @param definition The initial world.
     * @param config     The {@code latticeville} configuration block. Keys missing here fall
     *                   back to the defaults in {@code reference.conf}.
     * @throws StructuralInvariantException if the world is malformed.
     */
    public Simulation(WorldDefinition definition, Config config) {
        Config resolved = config.withFallback(ConfigFactory.defaultReference().getConfig("latticeville"));
        Config simulationConfig = resolved.getConfig("simulation");

        this.world = new CanonicalWorldState(definition.tree(), definition.objectTypes(),
                definition.objectStates(), definition.ambient());
        this.graph = LocationGraph.build(world.getTree(), definition.edges());
        this.transit = new TransitStateMachine(graph, simulationConfig.getInt("ticks-per-edge"));
        this.objectExecutor = new ObjectExecutor(definition.transitionTables());
        this.decisionTimeoutMs = simulationConfig.getLong("decision-timeout-ms");
        this.effectiveParallelism = resolveParallelism(simulationConfig.getInt("parallelism"));
        this.randomProvider = new SeededRandomProvider(simulationConfig.getLong("seed"));
        this.memorySettings = MemorySettings.fromConfig(resolved);

        this.memoryService = new MemoryService(new KeywordImportanceRater(), new HashingEmbedder(),
                new SummarizingInsightGenerator(), memorySettings);
        this.narrationRenderer = new TemplateNarrationRenderer(resolved.getConfig("narration"));
        this.planner = new RoutineDayPlanner(resolved.getConfig("planning"));
        this.dynamics = new WorldDynamicsManager(randomProvider, resolved.getConfigList("dynamics"));

        for (String agentId : world.agentIds()) {
            agents.put(agentId, new Agent(agentId, world.nameOf(agentId), memorySettings));
        }
        this.decisionPool = new DecisionWorkerPool(effectiveParallelism);
        LOG.info("Simulation created: {} nodes, {} locations, {} agents, parallelism {}",
                world.getTree().size(), graph.locations().size(), agents.size(), effectiveParallelism);
    }

    /**
     * Loads a world and creates a simulation configured from the classpath
     * ({@code application.conf} over {@code reference.conf}).
     *
     * @param loader The world loader.
     * @return The simulation.
     */
    public static Simulation create(IWorldLoader loader) {
        return create(loader, ConfigFactory.load().getConfig("latticeville"));
    }

    /**
     * @param loader The world loader.
     * @param config The {@code latticeville} configuration block.
     * @return The simulation.
     */
    public static Simulation create(IWorldLoader loader, Config config) {
        return new Simulation(loader.load(), config);
    }

    private static int resolveParallelism(int configured) {
        if (configured < 0) {
            throw new IllegalArgumentException("simulation.parallelism must be >= 0, got " + configured);
        }
        if (configured == 0) {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 2);
        }
        return configured;
    }

    /**
     * Sets the policy that decides every agent's actions.
     * @param policy The decision policy.
     */
    public void setDecisionPolicy(IDecisionPolicy policy) {
        this.decisionPolicy = policy;
    }

    /**
     * Replaces the memory collaborators (rater, embedder, insight generator).
     * @param service The memory service.
     */
    public void setMemoryService(MemoryService service) {
        this.memoryService = service;
    }

    public void setNarrationRenderer(INarrationRenderer renderer) {
        this.narrationRenderer = renderer;
    }

    /**
     * Replaces the day planner. Agents that have already planned keep their plan.
     * @param planner The planner.
     */
    public void setPlanner(IPlanner planner) {
        this.planner = planner;
    }

    /**
     * Adds world dynamics after the configured ones.
     * @param plugin The dynamics plugin.
     */
    public void addWorldDynamics(IWorldDynamics plugin) {
        dynamics.add(plugin);
    }

    /**
     * Adds a sink that receives every tick published from now on.
     * @param sink The sink.
     */
    public void addTickSink(ITickSink sink) {
        publisher.addSink(sink);
    }

    /**
     * Adds a listener for appended memory records, e.g. a memory log.
     * @param listener The listener.
     */
    public void addMemoryListener(IMemoryListener listener) {
        memoryListeners.add(listener);
    }

    /**
     * Executes a single simulation tick.
     *
     * @return The published payload.
     * @throws StructuralInvariantException if the tick would break the world's structure.
     * @throws IllegalStateException        if the simulation was halted by an earlier fatal error
     *                                      or has been shut down.
     */
    public TickPayload tick() {
        if (stopped) {
            throw new IllegalStateException("Simulation was shut down at tick " + currentTick);
        }
        if (haltCause != null) {
            throw new IllegalStateException("Simulation halted at tick " + currentTick + ": " + haltCause.getMessage(),
                    haltCause);
        }
        long tick = currentTick;
        WorldStateSnapshot frozen = world.snapshot();

        Map<String, PerceptionSlice> slices = new TreeMap<>();
        Map<String, ValidTargets> targets = new TreeMap<>();
        Map<String, List<PlanItem>> newPlans = new TreeMap<>();
        List<DecisionRequest> requests = new ArrayList<>(agents.size());
        for (Agent agent : agents.values()) {
            PerceptionSlice slice = Perception.sliceFor(frozen, agent.getId(), tick);
            ValidTargets valid = Perception.validTargetsFor(slice, graph);
            slices.put(agent.getId(), slice);
            targets.put(agent.getId(), valid);
            if (!agent.hasPlanned()) {
                newPlans.put(agent.getId(), plan(agent, slice, tick));
            }
            String planStep = agent.activePlanStep(tick).map(PlanItem::description).orElse("");
            List<MemoryView> memories = memoryService.retrieve(agent.getMemory(), query(agent, slice, planStep),
                    tick);
            requests.add(new DecisionRequest(agent.getId(), agent.getName(), agent.getGoal(), planStep, tick,
                    slice, agent.getBeliefs().snapshot(), memories, valid));
        }

        Map<String, Action> proposed = requests.isEmpty()
                ? Map.of()
                : decisionPool.decideAll(decisionPolicy, requests, decisionTimeoutMs);

        CanonicalWorldState working = world.copy();
        List<Event> events = new ArrayList<>();
        try {
            for (String agentId : agents.keySet()) {
                Action action = ActionValidator.validate(agentId, proposed.get(agentId), targets.get(agentId));
                execute(working, agentId, action, events);
            }
            dynamics.applyAll(new DynamicsContext(tick, working, events));
            working.validate();
        } catch (StructuralInvariantException e) {
            haltCause = e;
            LOG.error("Structural invariant violated at tick {}, halting: {}", tick, e.getMessage());
            throw e;
        }
        world = working;

        Map<String, Set<String>> changedBeliefs = new TreeMap<>();
        for (Agent agent : agents.values()) {
            changedBeliefs.put(agent.getId(), agent.getBeliefs().merge(slices.get(agent.getId()), tick));
        }

        for (Agent agent : agents.values()) {
            recordMemories(agent, changedBeliefs.get(agent.getId()), slices.get(agent.getId()), events,
                    newPlans.getOrDefault(agent.getId(), List.of()), tick);
        }

        Map<String, BeliefSnapshot> beliefs = new LinkedHashMap<>();
        for (Agent agent : agents.values()) {
            beliefs.put(agent.getId(), agent.getBeliefs().snapshot());
        }
        TickPayload payload = new TickPayload(tick, new StateSnapshot(world.snapshot(), beliefs), events);
        publisher.publish(payload);
        LOG.debug("Tick {} committed with {} events", tick, events.size());
        currentTick++;
        return payload;
    }

    private void execute(CanonicalWorldState working, String agentId, Action action, List<Event> events) {
        if (working.getTransit(agentId).isInTransit()) {
            transit.advance(working, agentId).ifPresent(events::add);
            return;
        }
        if (action instanceof Action.Move move) {
            transit.begin(working, agentId, move.toLocationId());
        } else if (action instanceof Action.Interact interact) {
            events.add(objectExecutor.execute(working, agentId, interact.objectId(), interact.verb()));
        } else if (action instanceof Action.Say say) {
            events.add(new Event.Said(agentId, say.toAgentId(), say.utterance()));
        }
    }

    private List<PlanItem> plan(Agent agent, PerceptionSlice slice, long tick) {
        List<PlanItem> dayPlan;
        List<PlanItem> steps;
        try {
            dayPlan = List.copyOf(planner.planDay(agent.getId(), agent.getName(), slice.location().id(),
                    slice.location().name(), tick));
            steps = List.copyOf(planner.decompose(dayPlan));
        } catch (Exception e) {
            LOG.warn("Planner failed for agent {} at tick {}, continuing without a plan: {}",
                    agent.getId(), tick, e.getMessage());
            dayPlan = List.of();
            steps = List.of();
        }
        agent.setPlanSteps(steps);
        return dayPlan;
    }

    private void recordMemories(Agent agent, Set<String> changed, PerceptionSlice slice, List<Event> events,
                                List<PlanItem> dayPlan, long tick) {
        for (String nodeId : changed) {
            if (nodeId.equals(agent.getId())) {
                continue;
            }
            remember(agent, describeObservation(agent, nodeId, slice), MemoryKind.OBSERVATION, tick);
        }
        for (Event event : events) {
            if (agent.getId().equals(actorOf(event))) {
                remember(agent, narrate(event), MemoryKind.ACTION, tick);
            } else if (event instanceof Event.Said said && agent.getId().equals(said.toAgentId())) {
                remember(agent, narrate(event), MemoryKind.OBSERVATION, tick);
            }
        }
        for (PlanItem item : dayPlan) {
            remember(agent, item.description(), MemoryKind.PLAN, tick);
        }
        for (MemoryRecord reflection : memoryService.reflectIfDue(agent.getMemory(), agent.getReflection(), tick)) {
            notifyMemoryListeners(agent, reflection);
        }
    }

    private void remember(Agent agent, String description, MemoryKind kind, long tick) {
        notifyMemoryListeners(agent,
                memoryService.remember(agent.getMemory(), agent.getReflection(), description, kind, tick));
    }

    private void notifyMemoryListeners(Agent agent, MemoryRecord record) {
        for (IMemoryListener listener : memoryListeners) {
            try {
                listener.onMemory(agent.getId(), record.view());
            } catch (Exception e) {
                LOG.warn("Memory listener '{}' failed for agent {}: {}",
                        listener.getClass().getSimpleName(), agent.getId(), e.getMessage());
            }
        }
    }

    private static String actorOf(Event event) {
        if (event instanceof Event.Moved moved) {
            return moved.agentId();
        } else if (event instanceof Event.ObjectStateChanged changed) {
            return changed.agentId();
        } else if (event instanceof Event.Said said) {
            return said.fromAgentId();
        }
        return null;
    }

    private String narrate(Event event) {
        try {
            return narrationRenderer.narrate(event, world);
        } catch (Exception e) {
            LOG.warn("Narration failed for {}: {}", event.kind(), e.getMessage());
            return event.toString();
        }
    }

    private String describeObservation(Agent agent, String nodeId, PerceptionSlice slice) {
        NodeSnapshot node = null;
        for (NodeSnapshot candidate : slice.nodes()) {
            if (candidate.id().equals(nodeId)) {
                node = candidate;
                break;
            }
        }
        if (node == null) {
            return agent.getName() + " noticed " + nodeId + ".";
        }
        if (node.kind() == NodeKind.AREA) {
            return agent.getName() + " is at " + node.name() + ".";
        }
        if (node.kind() == NodeKind.OBJECT) {
            Map<String, String> attributes = slice.objectStates().getOrDefault(nodeId, Map.of());
            return attributes.isEmpty()
                    ? agent.getName() + " sees the " + node.name() + "."
                    : agent.getName() + " sees the " + node.name() + " " + attributes + ".";
        }
        return agent.getName() + " sees " + node.name() + " at " + slice.location().name() + ".";
    }

    private static String query(Agent agent, PerceptionSlice slice, String planStep) {
        StringBuilder query = new StringBuilder(Perception.describe(slice, agent.getName()));
        if (!agent.getGoal().isEmpty()) {
            query.append(' ').append(agent.getGoal());
        }
        if (!planStep.isEmpty()) {
            query.append(' ').append(planStep);
        }
        return query.toString();
    }

    /**
     * Stops the decision workers and drains all sinks. Idempotent.
     */
    public void shutdown() {
        stopped = true;
        decisionPool.shutdown();
        publisher.close(5000);
        LOG.info("Simulation stopped at tick {}", currentTick);
    }

    /**
     * @return The number of the next tick to run; equals the number of ticks run so far.
     */
    public long getCurrentTick() {
        return currentTick;
    }

    /**
     * @return The committed world state. Read-only; only the scheduler mutates it.
     */
    public IWorldReader getWorld() {
        return world;
    }

    public WorldStateSnapshot snapshot() {
        return world.snapshot();
    }

    public Agent getAgent(String agentId) {
        return agents.get(agentId);
    }

    public Collection<Agent> getAgents() {
        return Collections.unmodifiableCollection(agents.values());
    }

    public LocationGraph getGraph() {
        return graph;
    }

    public IRandomProvider getRandomProvider() {
        return randomProvider;
    }

    public MemorySettings getMemorySettings() {
        return memorySettings;
    }

    public boolean isHalted() {
        return haltCause != null;
    }

    public int getEffectiveParallelism() {
        return effectiveParallelism;
    }
}

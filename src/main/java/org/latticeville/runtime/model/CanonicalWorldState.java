package org.latticeville.runtime.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import org.latticeville.runtime.transit.TransitState;

/**
 * The single ground-truth world representation.
 * <p>
 * Owns the node tree, the per-object attributes and type names, each agent's location
 * and movement state, and the ambient state driven by world dynamics. Exclusively
 * mutated by the simulation, which works on a {@link #copy()} during a tick and swaps
 * it in on commit.
 * <p>
 * Agent locations are kept in lockstep with the tree: an agent's node is always a child
 * of the area stored as its location.
 */
public class CanonicalWorldState implements IWorldReader {

    private final WorldTree tree;
    private final Map<String, String> objectTypes;
    private final Map<String, Map<String, String>> objectStates;
    private final Map<String, String> agentLocations;
    private final Map<String, TransitState.InTransit> transits;
    private final Map<String, String> ambient;

    /**
     * Creates the canonical state from loader input and validates it.
     *
     * @param tree         The world tree (agents must be children of areas).
     * @param objectTypes  Object id to transition table type name.
     * @param objectStates Object id to initial attributes.
     * @param ambient      Initial ambient values.
     * @throws StructuralInvariantException if the input is malformed.
     */
    public CanonicalWorldState(WorldTree tree, Map<String, String> objectTypes,
                               Map<String, ? extends Map<String, String>> objectStates, Map<String, String> ambient) {
        tree.validate();
        this.tree = tree;
        this.objectTypes = new LinkedHashMap<>();
        this.objectStates = new LinkedHashMap<>();
        this.agentLocations = new TreeMap<>();
        this.transits = new TreeMap<>();
        this.ambient = new TreeMap<>(ambient);

        for (WorldNode node : tree.getNodes()) {
            switch (node.getKind()) {
                case OBJECT -> {
                    Map<String, String> initial = objectStates.get(node.getId());
                    this.objectStates.put(node.getId(), initial != null ? new LinkedHashMap<>(initial) : new LinkedHashMap<>());
                    String type = objectTypes.get(node.getId());
                    if (type != null) {
                        this.objectTypes.put(node.getId(), type);
                    }
                }
                case AGENT -> this.agentLocations.put(node.getId(), node.getParentId());
                case AREA -> { }
            }
        }
        for (String objectId : objectStates.keySet()) {
            WorldNode node = tree.getNode(objectId);
            if (node == null || node.getKind() != NodeKind.OBJECT) {
                throw new StructuralInvariantException("State given for '" + objectId + "' which is not an object node");
            }
        }
        validate();
    }

    private CanonicalWorldState(CanonicalWorldState other) {
        this.tree = other.tree.copy();
        this.objectTypes = new LinkedHashMap<>(other.objectTypes);
        this.objectStates = new LinkedHashMap<>();
        other.objectStates.forEach((id, attributes) -> this.objectStates.put(id, new LinkedHashMap<>(attributes)));
        this.agentLocations = new TreeMap<>(other.agentLocations);
        this.transits = new TreeMap<>(other.transits);
        this.ambient = new TreeMap<>(other.ambient);
    }

    /**
     * @return A deep, independent working copy.
     */
    public CanonicalWorldState copy() {
        return new CanonicalWorldState(this);
    }

    /**
     * @return An immutable snapshot of the current state.
     */
    public WorldStateSnapshot snapshot() {
        return new WorldStateSnapshot(tree.getRootId(), tree.snapshot(), objectTypes, objectStates,
                agentLocations, transits, ambient);
    }

    /**
     * Checks the tree invariants and that every agent sits in the area recorded as its location.
     *
     * @throws StructuralInvariantException on the first violation.
     */
    public void validate() {
        tree.validate();
        for (Map.Entry<String, String> entry : agentLocations.entrySet()) {
            WorldNode agent = tree.requireNode(entry.getKey());
            WorldNode location = tree.getNode(entry.getValue());
            if (location == null || location.getKind() != NodeKind.AREA) {
                throw new StructuralInvariantException("Agent '" + entry.getKey() + "' is not located in an area");
            }
            if (!entry.getValue().equals(agent.getParentId())) {
                throw new StructuralInvariantException("Agent '" + entry.getKey() + "' location '" + entry.getValue()
                        + "' disagrees with its tree parent '" + agent.getParentId() + "'");
            }
        }
    }

    /**
     * Moves an agent to another area, re-parenting its node.
     *
     * @param agentId    The agent.
     * @param locationId The destination area.
     */
    public void moveAgent(String agentId, String locationId) {
        if (!agentLocations.containsKey(agentId)) {
            throw new StructuralInvariantException("Unknown agent '" + agentId + "'");
        }
        WorldNode location = tree.requireNode(locationId);
        if (location.getKind() != NodeKind.AREA) {
            throw new StructuralInvariantException("Agent '" + agentId + "' cannot move into non-area '" + locationId + "'");
        }
        tree.moveNode(agentId, locationId);
        agentLocations.put(agentId, locationId);
    }

    /**
     * @param agentId The agent.
     * @param transit The new movement state; {@link TransitState#STATIONARY} clears it.
     */
    public void setTransit(String agentId, TransitState transit) {
        if (transit instanceof TransitState.InTransit inTransit) {
            transits.put(agentId, inTransit);
        } else {
            transits.remove(agentId);
        }
    }

    /**
     * Replaces an object's attributes.
     *
     * @param objectId   The object.
     * @param attributes The new attributes.
     */
    public void setObjectState(String objectId, Map<String, String> attributes) {
        if (!objectStates.containsKey(objectId)) {
            throw new StructuralInvariantException("Unknown object '" + objectId + "'");
        }
        objectStates.put(objectId, new LinkedHashMap<>(attributes));
    }

    /**
     * @param key   The ambient key.
     * @param value The new value.
     */
    public void setAmbient(String key, String value) {
        ambient.put(key, value);
    }

    public WorldTree getTree() {
        return tree;
    }

    /**
     * @return Agent ids in ascending order.
     */
    public Iterable<String> agentIds() {
        return agentLocations.keySet();
    }

    @Override
    public String getRootId() {
        return tree.getRootId();
    }

    @Override
    public NodeSnapshot getNode(String id) {
        WorldNode node = tree.getNode(id);
        return node != null ? node.snapshot() : null;
    }

    @Override
    public Map<String, String> getObjectState(String objectId) {
        Map<String, String> attributes = objectStates.get(objectId);
        return attributes != null ? FrozenMaps.copyOf(attributes) : Map.of();
    }

    @Override
    public String getObjectType(String objectId) {
        return objectTypes.get(objectId);
    }

    @Override
    public String getAgentLocation(String agentId) {
        return agentLocations.get(agentId);
    }

    @Override
    public TransitState getTransit(String agentId) {
        TransitState.InTransit transit = transits.get(agentId);
        return transit != null ? transit : TransitState.STATIONARY;
    }

    @Override
    public String getAmbient(String key) {
        return ambient.get(key);
    }
}

package org.latticeville.runtime.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The canonical containment hierarchy of areas, objects and agents.
 * <p>
 * Implemented as an arena of {@link WorldNode}s indexed by id. Insertion order is kept so
 * that iteration (and therefore snapshots and serialized payloads) is reproducible.
 * <p>
 * Invariants, checked by {@link #validate()}:
 * <ul>
 *   <li>exactly one root, which has no parent</li>
 *   <li>every other node has exactly one parent that exists in the arena</li>
 *   <li>a parent's children list contains the child and the child points back at it</li>
 *   <li>no cycles: every node reaches the root by following parents</li>
 * </ul>
 */
public class WorldTree {

    private final Map<String, WorldNode> nodes;
    private String rootId;

    public WorldTree() {
        this.nodes = new LinkedHashMap<>();
    }

    private WorldTree(String rootId, Map<String, WorldNode> nodes) {
        this.rootId = rootId;
        this.nodes = nodes;
    }

    /**
     * Rebuilds a tree from snapshots and validates it.
     *
     * @param rootId The root id.
     * @param snapshots The node snapshots in iteration order.
     * @return The rebuilt tree.
     * @throws StructuralInvariantException if the nodes do not form a valid tree.
     */
    public static WorldTree fromSnapshots(String rootId, Collection<NodeSnapshot> snapshots) {
        Map<String, WorldNode> rebuilt = new LinkedHashMap<>();
        for (NodeSnapshot snapshot : snapshots) {
            rebuilt.put(snapshot.id(), WorldNode.fromSnapshot(snapshot));
        }
        WorldTree tree = new WorldTree(rootId, rebuilt);
        tree.validate();
        return tree;
    }

    /**
     * Adds the root node. Must be called exactly once, before any other node is added.
     *
     * @param root The root node.
     */
    public void addRoot(WorldNode root) {
        if (rootId != null) {
            throw new StructuralInvariantException("Tree already has root '" + rootId + "', cannot add '" + root.getId() + "'");
        }
        if (nodes.containsKey(root.getId())) {
            throw new StructuralInvariantException("Duplicate node id '" + root.getId() + "'");
        }
        root.setParentId(null);
        nodes.put(root.getId(), root);
        rootId = root.getId();
    }

    /**
     * Adds a node below an existing parent.
     *
     * @param node     The node to add.
     * @param parentId The id of an existing parent.
     * @throws StructuralInvariantException on duplicate ids or unknown parents.
     */
    public void addNode(WorldNode node, String parentId) {
        if (nodes.containsKey(node.getId())) {
            throw new StructuralInvariantException("Duplicate node id '" + node.getId() + "'");
        }
        WorldNode parent = nodes.get(parentId);
        if (parent == null) {
            throw new StructuralInvariantException("Parent '" + parentId + "' of node '" + node.getId() + "' does not exist");
        }
        node.setParentId(parentId);
        nodes.put(node.getId(), node);
        parent.addChild(node.getId());
    }

    /**
     * Re-parents a node, keeping both children lists consistent.
     *
     * @param nodeId      The node to move.
     * @param newParentId The new parent.
     * @throws StructuralInvariantException if either node is unknown, the node is the root,
     *                                      or the move would create a cycle.
     */
    public void moveNode(String nodeId, String newParentId) {
        WorldNode node = requireNode(nodeId);
        WorldNode newParent = requireNode(newParentId);
        if (nodeId.equals(rootId)) {
            throw new StructuralInvariantException("Cannot move the root node '" + nodeId + "'");
        }
        if (isAncestorOrSelf(nodeId, newParentId)) {
            throw new StructuralInvariantException("Moving '" + nodeId + "' under '" + newParentId + "' would create a cycle");
        }
        String oldParentId = node.getParentId();
        if (newParentId.equals(oldParentId)) {
            return;
        }
        WorldNode oldParent = nodes.get(oldParentId);
        if (oldParent != null) {
            oldParent.removeChild(nodeId);
        }
        newParent.addChild(nodeId);
        node.setParentId(newParentId);
    }

    private boolean isAncestorOrSelf(String candidateAncestor, String nodeId) {
        String current = nodeId;
        int guard = nodes.size();
        while (current != null && guard-- >= 0) {
            if (current.equals(candidateAncestor)) {
                return true;
            }
            WorldNode node = nodes.get(current);
            current = node != null ? node.getParentId() : null;
        }
        return false;
    }

    /**
     * Checks every structural invariant of the tree.
     *
     * @throws StructuralInvariantException describing the first violation found.
     */
    public void validate() {
        if (rootId == null || !nodes.containsKey(rootId)) {
            throw new StructuralInvariantException("Tree has no root node");
        }
        for (WorldNode node : nodes.values()) {
            String parentId = node.getParentId();
            if (node.getId().equals(rootId)) {
                if (parentId != null) {
                    throw new StructuralInvariantException("Root '" + rootId + "' must not have a parent");
                }
            } else {
                if (parentId == null) {
                    throw new StructuralInvariantException("Node '" + node.getId() + "' has no parent but is not the root");
                }
                WorldNode parent = nodes.get(parentId);
                if (parent == null) {
                    throw new StructuralInvariantException("Node '" + node.getId() + "' references missing parent '" + parentId + "'");
                }
                if (!parent.getChildren().contains(node.getId())) {
                    throw new StructuralInvariantException("Parent '" + parentId + "' does not list child '" + node.getId() + "'");
                }
            }
            Set<String> seen = new HashSet<>();
            for (String childId : node.getChildren()) {
                if (!seen.add(childId)) {
                    throw new StructuralInvariantException("Node '" + node.getId() + "' lists child '" + childId + "' twice");
                }
                WorldNode child = nodes.get(childId);
                if (child == null) {
                    throw new StructuralInvariantException("Node '" + node.getId() + "' lists missing child '" + childId + "'");
                }
                if (!node.getId().equals(child.getParentId())) {
                    throw new StructuralInvariantException("Child '" + childId + "' does not point back at parent '" + node.getId() + "'");
                }
            }
        }
        for (String id : nodes.keySet()) {
            if (!reachesRoot(id)) {
                throw new StructuralInvariantException("Node '" + id + "' is part of a cycle");
            }
        }
    }

    private boolean reachesRoot(String nodeId) {
        String current = nodeId;
        for (int steps = 0; steps <= nodes.size(); steps++) {
            if (current == null) {
                return false;
            }
            if (current.equals(rootId)) {
                return true;
            }
            current = nodes.get(current).getParentId();
        }
        return false;
    }

    public String getRootId() {
        return rootId;
    }

    /**
     * @param id The node id.
     * @return The node, or {@code null} if unknown.
     */
    public WorldNode getNode(String id) {
        return nodes.get(id);
    }

    /**
     * @param id The node id.
     * @return The node.
     * @throws StructuralInvariantException if the node is unknown.
     */
    public WorldNode requireNode(String id) {
        WorldNode node = nodes.get(id);
        if (node == null) {
            throw new StructuralInvariantException("Unknown node '" + id + "'");
        }
        return node;
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    /**
     * @return The nodes in insertion order.
     */
    public Collection<WorldNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /**
     * @param kind The kind to filter by.
     * @return The ids of all nodes of the given kind, in insertion order.
     */
    public List<String> idsOfKind(NodeKind kind) {
        List<String> ids = new ArrayList<>();
        for (WorldNode node : nodes.values()) {
            if (node.getKind() == kind) {
                ids.add(node.getId());
            }
        }
        return ids;
    }

    /**
     * @return A deep copy of this tree.
     */
    public WorldTree copy() {
        Map<String, WorldNode> copied = new LinkedHashMap<>();
        for (WorldNode node : nodes.values()) {
            copied.put(node.getId(), node.copy());
        }
        return new WorldTree(rootId, copied);
    }

    /**
     * @return Immutable snapshots of all nodes, keyed by id in insertion order.
     */
    public Map<String, NodeSnapshot> snapshot() {
        Map<String, NodeSnapshot> snapshots = new LinkedHashMap<>();
        for (WorldNode node : nodes.values()) {
            snapshots.put(node.getId(), node.snapshot());
        }
        return Collections.unmodifiableMap(snapshots);
    }

    public int size() {
        return nodes.size();
    }
}

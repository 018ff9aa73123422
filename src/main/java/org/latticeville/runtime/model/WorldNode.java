package org.latticeville.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A mutable node of a {@link WorldTree}. Parent and children are stored as ids, the tree
 * itself is an arena keyed by id.
 * <p>
 * Structural mutators are package-private: only {@link WorldTree} may rewire links so that
 * parent and children stay consistent.
 */
public class WorldNode {

    private final String id;
    private final String name;
    private final NodeKind kind;
    private String parentId;
    private final List<String> children;

    /**
     * Creates a detached node without parent or children.
     *
     * @param id   The unique, stable id.
     * @param name The display name.
     * @param kind The node kind.
     */
    public WorldNode(String id, String name, NodeKind kind) {
        this(id, name, kind, null, new ArrayList<>());
    }

    private WorldNode(String id, String name, NodeKind kind, String parentId, List<String> children) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Node kind must not be null for node " + id);
        }
        this.id = id;
        this.name = name != null ? name : id;
        this.kind = kind;
        this.parentId = parentId;
        this.children = children;
    }

    /**
     * Rebuilds a mutable node from an immutable snapshot.
     *
     * @param snapshot The snapshot.
     * @return A fresh node carrying the same links.
     */
    public static WorldNode fromSnapshot(NodeSnapshot snapshot) {
        return new WorldNode(snapshot.id(), snapshot.name(), snapshot.kind(),
                snapshot.parentId(), new ArrayList<>(snapshot.children()));
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public NodeKind getKind() {
        return kind;
    }

    /**
     * @return The parent id, or {@code null} for the root.
     */
    public String getParentId() {
        return parentId;
    }

    /**
     * @return An unmodifiable view of the ordered child ids.
     */
    public List<String> getChildren() {
        return Collections.unmodifiableList(children);
    }

    void setParentId(String parentId) {
        this.parentId = parentId;
    }

    void addChild(String childId) {
        if (!children.contains(childId)) {
            children.add(childId);
        }
    }

    void removeChild(String childId) {
        children.remove(childId);
    }

    /**
     * @return A deep copy of this node.
     */
    public WorldNode copy() {
        return new WorldNode(id, name, kind, parentId, new ArrayList<>(children));
    }

    /**
     * @return An immutable snapshot of this node.
     */
    public NodeSnapshot snapshot() {
        return new NodeSnapshot(id, name, kind, parentId, List.copyOf(children));
    }

    @Override
    public String toString() {
        return kind + ":" + id;
    }
}

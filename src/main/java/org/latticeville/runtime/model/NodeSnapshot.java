package org.latticeville.runtime.model;

import java.util.List;

/**
 * Immutable view of a single tree node, as frozen at a tick boundary.
 *
 * @param id       The unique node id.
 * @param name     The display name.
 * @param kind     The node kind.
 * @param parentId The parent id, {@code null} only for the root.
 * @param children The ordered child ids.
 */
public record NodeSnapshot(String id, String name, NodeKind kind, String parentId, List<String> children) {

    public NodeSnapshot {
        children = children == null ? List.of() : List.copyOf(children);
    }
}

package org.latticeville.runtime.memory;

import java.util.List;

/**
 * Immutable copy of a {@link MemoryRecord} as handed to collaborators and sinks.
 *
 * @param id             Position of the record in its stream.
 * @param description    Natural-language content.
 * @param createdAt      Tick of creation.
 * @param lastAccessedAt Tick of the last retrieval, or creation.
 * @param importance     Rating in [1, 10].
 * @param kind           Origin of the record.
 * @param links          Supporting record ids (reflections only).
 */
public record MemoryView(long id, String description, long createdAt, long lastAccessedAt, int importance,
                         MemoryKind kind, List<Long> links) {

    public MemoryView {
        links = links != null ? List.copyOf(links) : List.of();
    }
}

package org.latticeville.runtime.memory;

import java.util.List;

/**
 * One entry of a memory stream. Only {@code lastAccessedAt} changes after creation.
 */
public final class MemoryRecord {

    public static final int MIN_IMPORTANCE = 1;
    public static final int MAX_IMPORTANCE = 10;

    private final long id;
    private final String description;
    private final long createdAt;
    private final int importance;
    private final MemoryKind kind;
    private final List<Long> links;
    private final float[] embedding;
    private long lastAccessedAt;

    MemoryRecord(long id, String description, long createdAt, int importance, MemoryKind kind,
                 List<Long> links, float[] embedding) {
        if (importance < MIN_IMPORTANCE || importance > MAX_IMPORTANCE) {
            throw new IllegalArgumentException("Importance must be in [1, 10], got " + importance);
        }
        this.id = id;
        this.description = description;
        this.createdAt = createdAt;
        this.lastAccessedAt = createdAt;
        this.importance = importance;
        this.kind = kind;
        this.links = links != null ? List.copyOf(links) : List.of();
        this.embedding = embedding != null ? embedding.clone() : new float[0];
    }

    /**
     * @param raw Any rating.
     * @return The rating clamped to [1, 10].
     */
    public static int clampImportance(int raw) {
        return Math.max(MIN_IMPORTANCE, Math.min(MAX_IMPORTANCE, raw));
    }

    public long getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getLastAccessedAt() {
        return lastAccessedAt;
    }

    void touch(long tick) {
        this.lastAccessedAt = tick;
    }

    public int getImportance() {
        return importance;
    }

    public MemoryKind getKind() {
        return kind;
    }

    public List<Long> getLinks() {
        return links;
    }

    float[] embedding() {
        return embedding;
    }

    public MemoryView view() {
        return new MemoryView(id, description, createdAt, lastAccessedAt, importance, kind, links);
    }

    @Override
    public String toString() {
        return "MemoryRecord{" + id + ", " + kind + ", '" + description + "'}";
    }
}

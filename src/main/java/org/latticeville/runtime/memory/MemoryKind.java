package org.latticeville.runtime.memory;

/**
 * Origin of a memory record.
 */
public enum MemoryKind {
    OBSERVATION,
    PLAN,
    REFLECTION,
    ACTION;

    /**
     * @return Importance used when the rater is unavailable.
     */
    public int fallbackImportance() {
        return switch (this) {
            case OBSERVATION -> 2;
            case ACTION, REFLECTION -> 3;
            case PLAN -> 1;
        };
    }
}

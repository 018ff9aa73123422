package org.latticeville.runtime.memory;

/**
 * Accumulates importance since an agent's last reflection.
 * <p>
 * The accumulated sum only grows until {@link #reset(long)} is called at a trigger. The
 * trigger fires when the sum reaches the threshold, including the record that pushed it
 * there.
 */
public class ReflectionTrigger {

    private final int threshold;
    private long accumulated;
    private long firstUnreflectedId;

    /**
     * @param threshold Importance sum at which a reflection is due. Must be positive.
     */
    public ReflectionTrigger(int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Reflection threshold must be >= 1, got " + threshold);
        }
        this.threshold = threshold;
    }

    public void record(int importance) {
        accumulated += importance;
    }

    public boolean isDue() {
        return accumulated >= threshold;
    }

    /**
     * Starts a new accumulation window.
     *
     * @param nextRecordId Id of the first record that belongs to the new window.
     */
    public void reset(long nextRecordId) {
        accumulated = 0;
        firstUnreflectedId = nextRecordId;
    }

    public long getAccumulated() {
        return accumulated;
    }

    /**
     * @return Id of the oldest record not yet covered by a reflection.
     */
    public long getFirstUnreflectedId() {
        return firstUnreflectedId;
    }

    public int getThreshold() {
        return threshold;
    }
}

package org.latticeville.runtime.memory;

import com.typesafe.config.Config;

/**
 * Tunables of memory retrieval and reflection.
 *
 * @param recencyDecay        Decay rate per tick of the recency component.
 * @param retrievalK          Maximum records per retrieval.
 * @param contextBudgetChars  Maximum total description length per retrieval.
 * @param reflectionThreshold Importance sum that triggers a reflection.
 * @param maxInsights         Maximum reflection records appended per trigger.
 */
public record MemorySettings(double recencyDecay, int retrievalK, int contextBudgetChars, int reflectionThreshold,
                             int maxInsights) {

    public static final MemorySettings DEFAULTS = new MemorySettings(0.01, 3, 2000, 10, 5);

    public MemorySettings {
        if (retrievalK < 0) {
            throw new IllegalArgumentException("retrieval-k must be non-negative, got " + retrievalK);
        }
        if (contextBudgetChars < 0) {
            throw new IllegalArgumentException("context-budget-chars must be non-negative, got " + contextBudgetChars);
        }
        if (maxInsights < 1) {
            throw new IllegalArgumentException("max-insights must be >= 1, got " + maxInsights);
        }
    }

    /**
     * Reads {@code memory} and {@code reflection} blocks; missing keys keep their defaults.
     *
     * @param config The {@code latticeville} block.
     * @return The settings.
     */
    public static MemorySettings fromConfig(Config config) {
        Config memory = config.hasPath("memory") ? config.getConfig("memory") : null;
        Config reflection = config.hasPath("reflection") ? config.getConfig("reflection") : null;
        double decay = memory != null && memory.hasPath("recency-decay")
                ? memory.getDouble("recency-decay") : DEFAULTS.recencyDecay();
        int k = memory != null && memory.hasPath("retrieval-k")
                ? memory.getInt("retrieval-k") : DEFAULTS.retrievalK();
        int budget = memory != null && memory.hasPath("context-budget-chars")
                ? memory.getInt("context-budget-chars") : DEFAULTS.contextBudgetChars();
        int threshold = reflection != null && reflection.hasPath("threshold")
                ? reflection.getInt("threshold") : DEFAULTS.reflectionThreshold();
        int maxInsights = reflection != null && reflection.hasPath("max-insights")
                ? reflection.getInt("max-insights") : DEFAULTS.maxInsights();
        return new MemorySettings(decay, k, budget, threshold, maxInsights);
    }
}

package org.latticeville.runtime.spi;

import java.util.List;

import org.latticeville.runtime.memory.MemoryView;

/**
 * Synthesizes higher-level insights from an agent's recent memories.
 */
@FunctionalInterface
public interface IInsightGenerator {

    /**
     * One synthesized insight.
     *
     * @param text          The insight.
     * @param supportingIds Ids of the memories it was drawn from.
     */
    record Insight(String text, List<Long> supportingIds) {
        public Insight {
            supportingIds = supportingIds != null ? List.copyOf(supportingIds) : List.of();
        }
    }

    /**
     * @param records Memories since the previous reflection, oldest first.
     * @return Insights; only the first five are kept.
     * @throws Exception if generation fails.
     */
    List<Insight> reflect(List<MemoryView> records) throws Exception;
}

package org.latticeville.runtime.memory;

/**
 * A retrieved record with its score breakdown. All components are min-max normalized
 * over the candidates of the same query.
 *
 * @param record     The record, as of after the access refresh.
 * @param recency    Normalized recency.
 * @param relevance  Normalized relevance.
 * @param importance Normalized importance.
 */
public record RetrievalResult(MemoryView record, double recency, double relevance, double importance) {

    public double score() {
        return recency + relevance + importance;
    }
}

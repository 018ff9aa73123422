package org.latticeville.runtime.memory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntComparator;

/**
 * Append-only experience log of one agent, with scored retrieval.
 * <p>
 * Records are never removed. Record ids are their stream positions, so they are stable and
 * reproducible across runs.
 * <p>
 * <b>Retrieval:</b> every record is a candidate. Three raw components are computed:
 * <ul>
 *   <li>recency: {@code exp(-decay * (tick - lastAccessedAt))}</li>
 *   <li>relevance: cosine similarity of query and record embeddings (0 if either is empty)</li>
 *   <li>importance: {@code (importance - 1) / 9}</li>
 * </ul>
 * Each component is min-max normalized across the candidates; a component whose values
 * are all equal contributes 0 for everyone. The score is the unweighted sum. Records are
 * ranked by score, then stream order, and taken greedily: a record whose description does
 * not fit into the remaining character budget is skipped and ranking continues, until
 * {@code k} records were taken. Selected records have their {@code lastAccessedAt}
 * refreshed to the current tick.
 * <p>
 * Not thread-safe; the scheduler is the only writer.
 */
public class MemoryStream {

    private final List<MemoryRecord> records = new ArrayList<>();
    private final double recencyDecay;

    /**
     * @param recencyDecay Exponential decay rate per tick. Must be non-negative.
     */
    public MemoryStream(double recencyDecay) {
        if (recencyDecay < 0.0) {
            throw new IllegalArgumentException("recency-decay must be non-negative, got " + recencyDecay);
        }
        this.recencyDecay = recencyDecay;
    }

    /**
     * Appends a record at the end of the stream.
     *
     * @param description Natural-language content.
     * @param tick        Current tick; becomes {@code createdAt} and {@code lastAccessedAt}.
     * @param importance  Rating, clamped to [1, 10].
     * @param kind        Origin of the record.
     * @param links       Supporting record ids, for reflections.
     * @param embedding   Cached embedding; may be empty.
     * @return The new record.
     */
    public MemoryRecord append(String description, long tick, int importance, MemoryKind kind,
                               List<Long> links, float[] embedding) {
        MemoryRecord record = new MemoryRecord(records.size(), description, tick,
                MemoryRecord.clampImportance(importance), kind, links, embedding);
        records.add(record);
        return record;
    }

    /**
     * @param queryEmbedding Embedding of the query.
     * @param tick           Current tick.
     * @param k              Maximum number of records.
     * @param budgetChars    Maximum total description length of the selection.
     * @return Selected records, best first.
     */
    public List<RetrievalResult> retrieve(float[] queryEmbedding, long tick, int k, int budgetChars) {
        int n = records.size();
        if (n == 0 || k <= 0) {
            return List.of();
        }
        double[] recency = new double[n];
        double[] relevance = new double[n];
        double[] importance = new double[n];
        for (int i = 0; i < n; i++) {
            MemoryRecord record = records.get(i);
            recency[i] = Math.exp(-recencyDecay * (tick - record.getLastAccessedAt()));
            relevance[i] = cosineSimilarity(queryEmbedding, record.embedding());
            importance[i] = (record.getImportance() - 1) / 9.0;
        }
        normalize(recency);
        normalize(relevance);
        normalize(importance);

        IntArrayList order = new IntArrayList(n);
        for (int i = 0; i < n; i++) {
            order.add(i);
        }
        IntComparator byScoreThenOrder = (a, b) -> {
            int byScore = Double.compare(recency[b] + relevance[b] + importance[b],
                    recency[a] + relevance[a] + importance[a]);
            return byScore != 0 ? byScore : Integer.compare(a, b);
        };
        order.sort(byScoreThenOrder);

        List<RetrievalResult> selected = new ArrayList<>();
        int remaining = budgetChars;
        for (int i = 0; i < n && selected.size() < k; i++) {
            int index = order.getInt(i);
            MemoryRecord record = records.get(index);
            int length = record.getDescription().length();
            if (length > remaining) {
                continue;
            }
            remaining -= length;
            record.touch(tick);
            selected.add(new RetrievalResult(record.view(), recency[index], relevance[index], importance[index]));
        }
        return selected;
    }

    static void normalize(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        double range = max - min;
        for (int i = 0; i < values.length; i++) {
            values[i] = range == 0.0 ? 0.0 : (values[i] - min) / range;
        }
    }

    static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || b.length == 0) {
            return 0.0;
        }
        int length = Math.min(a.length, b.length);
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * @param id A record id.
     * @return Whether the stream holds a record with that id.
     */
    public boolean contains(long id) {
        return id >= 0 && id < records.size();
    }

    /**
     * @param fromId First id to include.
     * @return Views of all records from {@code fromId} on, oldest first.
     */
    public List<MemoryView> since(long fromId) {
        List<MemoryView> views = new ArrayList<>();
        for (int i = (int) Math.max(0, fromId); i < records.size(); i++) {
            views.add(records.get(i).view());
        }
        return views;
    }

    public List<MemoryView> views() {
        return since(0);
    }

    public List<MemoryRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public int size() {
        return records.size();
    }

    public double getRecencyDecay() {
        return recencyDecay;
    }
}

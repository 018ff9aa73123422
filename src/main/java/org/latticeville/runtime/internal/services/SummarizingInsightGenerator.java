package org.latticeville.runtime.internal.services;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.latticeville.runtime.memory.MemoryView;
import org.latticeville.runtime.spi.IInsightGenerator;

/**
 * Rule-based insight generator for runs without a language model.
 * <p>
 * Any non-empty window yields exactly three insights: a pattern over the oldest records,
 * the single most important experience (oldest wins ties), and a follow-through on the
 * newest records. On windows of one or two records their supporting ids overlap.
 */
public class SummarizingInsightGenerator implements IInsightGenerator {

    @Override
    public List<Insight> reflect(List<MemoryView> records) {
        if (records.isEmpty()) {
            return List.of();
        }
        List<Insight> insights = new ArrayList<>(3);
        List<MemoryView> oldest = records.subList(0, Math.min(2, records.size()));
        insights.add(new Insight("I noticed a pattern in recent events: " + oldest.get(0).description(), ids(oldest)));

        MemoryView strongest = records.stream()
                .max(Comparator.comparingInt(MemoryView::importance))
                .orElseThrow();
        insights.add(new Insight("The most significant thing lately: " + strongest.description(),
                List.of(strongest.id())));

        List<MemoryView> newest = records.subList(Math.max(0, records.size() - 2), records.size());
        insights.add(new Insight("I should follow through on: " + newest.get(newest.size() - 1).description(),
                ids(newest)));
        return insights;
    }

    private static List<Long> ids(List<MemoryView> views) {
        return views.stream().map(MemoryView::id).toList();
    }
}

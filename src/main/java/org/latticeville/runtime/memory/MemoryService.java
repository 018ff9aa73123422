package org.latticeville.runtime.memory;

import java.util.ArrayList;
import java.util.List;

import org.latticeville.runtime.spi.IEmbedder;
import org.latticeville.runtime.spi.IImportanceRater;
import org.latticeville.runtime.spi.IInsightGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connects memory streams to their external collaborators.
 * <p>
 * Collaborator failures never reach the scheduler. A failing rater yields the kind's
 * fallback importance, a failing embedder an empty embedding (relevance 0), and a failing
 * insight generator no reflections. Each failure is logged at WARN, as is a reflection that
 * yields fewer than {@value #MIN_INSIGHTS} usable insights.
 */
public class MemoryService {

    private static final Logger LOG = LoggerFactory.getLogger(MemoryService.class);

    /**
     * Number of reflection records a trigger is expected to produce at least.
     */
    public static final int MIN_INSIGHTS = 3;

    private final IImportanceRater rater;
    private final IEmbedder embedder;
    private final IInsightGenerator insightGenerator;
    private final MemorySettings settings;

    public MemoryService(IImportanceRater rater, IEmbedder embedder, IInsightGenerator insightGenerator,
                         MemorySettings settings) {
        this.rater = rater;
        this.embedder = embedder;
        this.insightGenerator = insightGenerator;
        this.settings = settings;
    }

    /**
     * Rates, embeds and appends a record, and adds its importance to the trigger.
     *
     * @param stream      The agent's stream.
     * @param trigger     The agent's reflection trigger.
     * @param description Natural-language content.
     * @param kind        Origin of the record.
     * @param tick        Current tick.
     * @return The new record.
     */
    public MemoryRecord remember(MemoryStream stream, ReflectionTrigger trigger, String description,
                                 MemoryKind kind, long tick) {
        return append(stream, trigger, description, kind, List.of(), tick);
    }

    private MemoryRecord append(MemoryStream stream, ReflectionTrigger trigger, String description,
                                MemoryKind kind, List<Long> links, long tick) {
        MemoryRecord record = stream.append(description, tick, rate(description, kind), kind, links,
                embed(description));
        trigger.record(record.getImportance());
        return record;
    }

    /**
     * @param stream The agent's stream.
     * @param query  Retrieval query text.
     * @param tick   Current tick.
     * @return The memory excerpt, best first.
     */
    public List<MemoryView> retrieve(MemoryStream stream, String query, long tick) {
        List<RetrievalResult> results = stream.retrieve(embed(query), tick, settings.retrievalK(),
                settings.contextBudgetChars());
        List<MemoryView> views = new ArrayList<>(results.size());
        for (RetrievalResult result : results) {
            views.add(result.record());
        }
        return views;
    }

    /**
     * Reflects if enough importance has accumulated.
     * <p>
     * The window is reset as soon as the trigger fires, so reflection records appended
     * here count toward the next trigger, and a failing generator does not cause a retry
     * on every following tick.
     *
     * @param stream  The agent's stream.
     * @param trigger The agent's reflection trigger.
     * @param tick    Current tick.
     * @return The reflection records appended; empty if the trigger was not due.
     */
    public List<MemoryRecord> reflectIfDue(MemoryStream stream, ReflectionTrigger trigger, long tick) {
        if (!trigger.isDue()) {
            return List.of();
        }
        List<MemoryView> window = stream.since(trigger.getFirstUnreflectedId());
        LOG.debug("Reflection due at tick {}: accumulated {} over {} records", tick, trigger.getAccumulated(),
                window.size());
        trigger.reset(stream.size());

        List<IInsightGenerator.Insight> insights;
        try {
            insights = insightGenerator.reflect(window);
        } catch (Exception e) {
            LOG.warn("Insight generator failed at tick {}, skipping reflection: {}", tick, e.getMessage());
            return List.of();
        }
        if (insights == null) {
            return List.of();
        }

        List<MemoryRecord> appended = new ArrayList<>();
        for (IInsightGenerator.Insight insight : insights) {
            if (appended.size() >= settings.maxInsights()) {
                break;
            }
            if (insight == null || insight.text() == null || insight.text().isBlank()) {
                continue;
            }
            List<Long> links = new ArrayList<>();
            for (Long id : insight.supportingIds()) {
                if (id != null && stream.contains(id) && !links.contains(id)) {
                    links.add(id);
                }
            }
            appended.add(append(stream, trigger, insight.text(), MemoryKind.REFLECTION, links, tick));
        }
        if (appended.size() < Math.min(MIN_INSIGHTS, settings.maxInsights())) {
            LOG.warn("Insight generator produced {} usable insights at tick {}, expected at least {}",
                    appended.size(), tick, Math.min(MIN_INSIGHTS, settings.maxInsights()));
        }
        return appended;
    }

    private int rate(String description, MemoryKind kind) {
        try {
            return MemoryRecord.clampImportance(rater.rate(description, kind));
        } catch (Exception e) {
            LOG.warn("Importance rater failed for {} memory, using fallback {}: {}", kind,
                    kind.fallbackImportance(), e.getMessage());
            return kind.fallbackImportance();
        }
    }

    private float[] embed(String text) {
        try {
            float[] embedding = embedder.embed(text);
            return embedding != null ? embedding : new float[0];
        } catch (Exception e) {
            LOG.warn("Embedder failed, relevance will be 0: {}", e.getMessage());
            return new float[0];
        }
    }

    public MemorySettings getSettings() {
        return settings;
    }
}

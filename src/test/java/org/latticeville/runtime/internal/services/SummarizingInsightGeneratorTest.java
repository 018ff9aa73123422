package org.latticeville.runtime.internal.services;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.latticeville.runtime.memory.MemoryKind;
import org.latticeville.runtime.memory.MemoryView;
import org.latticeville.runtime.spi.IInsightGenerator.Insight;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SummarizingInsightGeneratorTest {

    private final SummarizingInsightGenerator generator = new SummarizingInsightGenerator();

    private static MemoryView view(long id, String text, int importance) {
        return new MemoryView(id, text, id, id, importance, MemoryKind.OBSERVATION, List.of());
    }

    @Test
    void derivesThreeInsightsFromALongerWindow() {
        List<Insight> insights = generator.reflect(List.of(
                view(4, "Ada is at Square.", 2),
                view(5, "The fridge is empty.", 7),
                view(6, "Bob says hello.", 7),
                view(7, "Ada waits.", 1)));

        assertThat(insights).hasSize(3);
        assertThat(insights.get(0).text()).isEqualTo("I noticed a pattern in recent events: Ada is at Square.");
        assertThat(insights.get(0).supportingIds()).containsExactly(4L, 5L);
        assertThat(insights.get(1).text()).isEqualTo("The most significant thing lately: The fridge is empty.");
        assertThat(insights.get(1).supportingIds()).containsExactly(5L);
        assertThat(insights.get(2).text()).isEqualTo("I should follow through on: Ada waits.");
        assertThat(insights.get(2).supportingIds()).containsExactly(6L, 7L);
    }

    @Test
    void singleRecordWindowStillYieldsThreeInsights() {
        List<Insight> insights = generator.reflect(List.of(view(0, "Bob says hello.", 5)));

        assertThat(insights).hasSize(3);
        assertThat(insights).allSatisfy(i -> assertThat(i.supportingIds()).containsExactly(0L));
        assertThat(insights.get(2).text()).isEqualTo("I should follow through on: Bob says hello.");
    }

    @Test
    void emptyWindowYieldsNothing() {
        assertThat(generator.reflect(List.of())).isEmpty();
    }
}

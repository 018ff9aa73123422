package org.latticeville.runtime.memory;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class MemoryStreamTest {

    private static final float[] NONE = new float[0];

    @Test
    void normalizeMapsToUnitRangeAndFlattensConstants() {
        double[] spread = {1.0, 3.0, 5.0};
        double[] flat = {2.0, 2.0, 2.0};

        MemoryStream.normalize(spread);
        MemoryStream.normalize(flat);

        assertThat(spread).containsExactly(0.0, 0.5, 1.0);
        assertThat(flat).containsExactly(0.0, 0.0, 0.0);
    }

    @Test
    void cosineSimilarityIgnoresMissingEmbeddings() {
        assertThat(MemoryStream.cosineSimilarity(new float[] {1f, 0f}, new float[] {2f, 0f})).isCloseTo(1.0, within(1e-9));
        assertThat(MemoryStream.cosineSimilarity(new float[] {1f, 0f}, new float[] {0f, 1f})).isCloseTo(0.0, within(1e-9));
        assertThat(MemoryStream.cosineSimilarity(NONE, new float[] {1f})).isZero();
        assertThat(MemoryStream.cosineSimilarity(new float[] {0f, 0f}, new float[] {1f, 1f})).isZero();
    }

    @Test
    void idsAreStreamPositions() {
        MemoryStream stream = new MemoryStream(0.01);

        MemoryRecord first = stream.append("first", 0, 3, MemoryKind.OBSERVATION, List.of(), NONE);
        MemoryRecord second = stream.append("second", 1, 42, MemoryKind.ACTION, List.of(), NONE);

        assertThat(first.getId()).isZero();
        assertThat(second.getId()).isEqualTo(1L);
        assertThat(second.getImportance()).isEqualTo(10);
        assertThat(stream.contains(1)).isTrue();
        assertThat(stream.contains(2)).isFalse();
        assertThat(stream.since(1)).extracting(MemoryView::description).containsExactly("second");
    }

    @Test
    void equalScoresFallBackToStreamOrder() {
        MemoryStream stream = new MemoryStream(0.01);
        stream.append("one", 0, 5, MemoryKind.OBSERVATION, List.of(), NONE);
        stream.append("two", 0, 5, MemoryKind.OBSERVATION, List.of(), NONE);
        stream.append("three", 0, 5, MemoryKind.OBSERVATION, List.of(), NONE);

        List<RetrievalResult> results = stream.retrieve(NONE, 0, 2, 1000);

        assertThat(results).extracting(r -> r.record().id()).containsExactly(0L, 1L);
        assertThat(results).allSatisfy(r -> assertThat(r.score()).isZero());
    }

    @Test
    void ranksByImportanceAndRelevance() {
        MemoryStream stream = new MemoryStream(0.01);
        stream.append("dull", 0, 1, MemoryKind.OBSERVATION, List.of(), new float[] {0f, 1f});
        stream.append("vital", 0, 10, MemoryKind.OBSERVATION, List.of(), new float[] {0f, 1f});
        stream.append("related", 0, 1, MemoryKind.OBSERVATION, List.of(), new float[] {1f, 0f});

        List<RetrievalResult> results = stream.retrieve(new float[] {1f, 0f}, 0, 3, 1000);

        assertThat(results).extracting(r -> r.record().description()).containsExactly("vital", "related", "dull");
        assertThat(results.get(0).importance()).isEqualTo(1.0);
        assertThat(results.get(1).relevance()).isEqualTo(1.0);
    }

    @Test
    void skipsRecordsThatDoNotFitTheBudget() {
        MemoryStream stream = new MemoryStream(0.01);
        stream.append("a long description", 0, 9, MemoryKind.OBSERVATION, List.of(), NONE);
        stream.append("bb", 0, 5, MemoryKind.OBSERVATION, List.of(), NONE);
        stream.append("c", 0, 1, MemoryKind.OBSERVATION, List.of(), NONE);

        List<RetrievalResult> results = stream.retrieve(NONE, 0, 3, 5);

        assertThat(results).extracting(r -> r.record().description()).containsExactly("bb", "c");
    }

    @Test
    void retrievalRefreshesOnlySelectedRecords() {
        MemoryStream stream = new MemoryStream(0.01);
        stream.append("kept", 0, 9, MemoryKind.OBSERVATION, List.of(), NONE);
        stream.append("ignored", 0, 1, MemoryKind.OBSERVATION, List.of(), NONE);

        List<RetrievalResult> results = stream.retrieve(NONE, 10, 1, 1000);

        assertThat(results.get(0).record().lastAccessedAt()).isEqualTo(10L);
        assertThat(stream.getRecords().get(0).getLastAccessedAt()).isEqualTo(10L);
        assertThat(stream.getRecords().get(1).getLastAccessedAt()).isZero();
        assertThat(stream.getRecords().get(0).getCreatedAt()).isZero();
    }

    @Test
    void emptyStreamOrZeroKRetrievesNothing() {
        MemoryStream stream = new MemoryStream(0.01);
        assertThat(stream.retrieve(NONE, 0, 3, 100)).isEmpty();

        stream.append("x", 0, 5, MemoryKind.PLAN, List.of(), NONE);
        assertThat(stream.retrieve(NONE, 0, 0, 100)).isEmpty();
    }

    @Test
    void rejectsNegativeDecay() {
        assertThatThrownBy(() -> new MemoryStream(-0.1)).isInstanceOf(IllegalArgumentException.class);
    }
}

package org.latticeville.runtime.internal.services;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class HashingEmbedderTest {

    private final HashingEmbedder embedder = new HashingEmbedder();

    @Test
    void sameTextEmbedsIdentically() {
        float[] first = embedder.embed("Ada is at Kitchen.");

        assertThat(first).hasSize(HashingEmbedder.DEFAULT_DIMENSION);
        assertThat(embedder.embed("Ada is at Kitchen.")).containsExactly(first);
        assertThat(embedder.embed("Bob is at Kitchen.")).isNotEqualTo(first);
    }

    @Test
    void componentsStayInUnitRange() {
        for (float component : new HashingEmbedder(40).embed("anything")) {
            assertThat(component).isBetween(-1f, 1f);
        }
    }

    @Test
    void rejectsEmptyDimension() {
        assertThatThrownBy(() -> new HashingEmbedder(0)).isInstanceOf(IllegalArgumentException.class);
    }
}

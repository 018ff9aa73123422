package org.latticeville.runtime.internal.services;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.latticeville.runtime.spi.IRandomProvider;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SeededRandomProviderTest {

    @Test
    void derivedStreamsAreStableAndDistinct() {
        IRandomProvider root = new SeededRandomProvider(42);

        IRandomProvider first = root.deriveFor("dynamics", 0);
        IRandomProvider again = new SeededRandomProvider(42).deriveFor("dynamics", 0);
        IRandomProvider sibling = root.deriveFor("dynamics", 1);

        assertThat(first.getSeed()).isEqualTo(again.getSeed());
        assertThat(first.getSeed()).isNotEqualTo(sibling.getSeed());
        assertThat(first.getSeed()).isNotEqualTo(root.deriveFor("agent", 0).getSeed());
        assertThat(first.asJavaRandom().nextLong()).isEqualTo(again.asJavaRandom().nextLong());
    }

    @Test
    void derivingDoesNotConsumeTheParentStream() {
        IRandomProvider a = new SeededRandomProvider(9);
        IRandomProvider b = new SeededRandomProvider(9);

        a.deriveFor("dynamics", 0);

        assertThat(a.asJavaRandom().nextInt()).isEqualTo(b.asJavaRandom().nextInt());
    }
}

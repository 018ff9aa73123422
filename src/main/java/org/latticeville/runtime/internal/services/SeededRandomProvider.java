package org.latticeville.runtime.internal.services;

import java.util.Random;

import org.latticeville.runtime.spi.IRandomProvider;

/**
 * {@link IRandomProvider} backed by {@link Random}, deriving child seeds with a
 * SplitMix64 finalizer so sibling streams are decorrelated.
 */
public class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Random random;

    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    @Override
    public Random asJavaRandom() {
        return random;
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        long mixed = mix(seed ^ mix(scope.hashCode()) ^ mix(key + 0x9E3779B97F4A7C15L));
        return new SeededRandomProvider(mixed);
    }

    @Override
    public long getSeed() {
        return seed;
    }

    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}

package org.latticeville.runtime.spi;

import java.util.Random;

/**
 * Source of deterministic randomness.
 * <p>
 * Every consumer obtains its own stream through {@link #deriveFor(String, long)}, so the
 * values one plugin draws never depend on how many values another plugin drew.
 */
public interface IRandomProvider {

    /**
     * @return A {@link Random} backed by this provider's stream.
     */
    Random asJavaRandom();

    /**
     * @param scope A namespace such as {@code "dynamics"} or {@code "agent"}.
     * @param key   A key within the scope.
     * @return An independent provider seeded from this one, the scope and the key.
     */
    IRandomProvider deriveFor(String scope, long key);

    /**
     * @return The seed this provider was created with.
     */
    long getSeed();
}

package org.latticeville.runtime.spi;

/**
 * Maps text to a vector for relevance scoring. Must be deterministic for the retrieval
 * ranking to be reproducible.
 */
@FunctionalInterface
public interface IEmbedder {

    float[] embed(String text) throws Exception;
}

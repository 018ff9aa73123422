package org.latticeville.runtime.internal.services;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.latticeville.runtime.spi.IEmbedder;

/**
 * Deterministic stand-in for a learned embedding: the SHA-256 digest of the text, one byte
 * per dimension mapped into [-1, 1]. Identical texts embed identically; similar texts do not
 * embed similarly.
 */
public class HashingEmbedder implements IEmbedder {

    public static final int DEFAULT_DIMENSION = 8;

    private final int dimension;

    public HashingEmbedder() {
        this(DEFAULT_DIMENSION);
    }

    public HashingEmbedder(int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("Embedding dimension must be >= 1, got " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        byte[] digest = sha256(text != null ? text : "");
        float[] vector = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            int unsigned = digest[i % digest.length] & 0xFF;
            vector[i] = (float) ((unsigned / 255.0) * 2.0 - 1.0);
        }
        return vector;
    }

    private static byte[] sha256(String text) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public int getDimension() {
        return dimension;
    }
}

package dev.resumematcher.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable fixed-length embedding of a normalized text.
 */
public final class EmbeddingVector {

    private final float[] values;

    public EmbeddingVector(float[] values) {
        this.values = Objects.requireNonNull(values, "values").clone();
    }

    public static EmbeddingVector zero(int dimension) {
        return new EmbeddingVector(new float[dimension]);
    }

    public float[] values() {
        return values.clone();
    }

    public int dimension() {
        return values.length;
    }

    public boolean isZero() {
        for (float v : values) {
            if (v != 0.0f) {
                return false;
            }
        }
        return true;
    }

    public double norm() {
        double sum = 0.0;
        for (float v : values) {
            sum += (double) v * v;
        }
        return Math.sqrt(sum);
    }

    public double dot(EmbeddingVector other) {
        if (other.values.length != values.length) {
            throw new IllegalArgumentException(
                    "Dimension mismatch: " + values.length + " vs " + other.values.length);
        }
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += (double) values[i] * other.values[i];
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof EmbeddingVector that && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "EmbeddingVector[dimension=" + values.length + ", zero=" + isZero() + "]";
    }
}

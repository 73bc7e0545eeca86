package com.purchasingpower.tendermatch.scoring;

import java.util.List;

/**
 * Cosine similarity between embedding vectors.
 *
 * <p>Returns {@code dot(a, b) / (|a| * |b|)} in [-1, 1]. Degenerate input (null,
 * empty, different dimensions, a null component, or a zero-norm vector) yields
 * 0.0 instead of an exception.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    public static double between(List<Double> a, List<Double> b) {
        if (a == null || b == null || a.isEmpty() || a.size() != b.size()) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.size(); i++) {
            Double x = a.get(i);
            Double y = b.get(i);
            if (x == null || y == null) {
                return 0.0;
            }
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        double normProduct = Math.sqrt(normA) * Math.sqrt(normB);
        if (normProduct == 0.0 || Double.isNaN(normProduct)) {
            return 0.0;
        }
        return dot / normProduct;
    }

    /**
     * Euclidean norm, 0.0 for null or empty vectors.
     */
    public static double norm(List<Double> vector) {
        if (vector == null) {
            return 0.0;
        }
        double sum = 0.0;
        for (Double value : vector) {
            if (value != null) {
                sum += value * value;
            }
        }
        return Math.sqrt(sum);
    }
}

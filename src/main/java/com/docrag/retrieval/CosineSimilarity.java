package com.docrag.retrieval;

/**
 * {@code dot(a, b) / (|a| * |b|)}. Returns 0 when the dimensions differ or either vector has zero
 * norm; callers decide whether to log the mismatch.
 */
public final class CosineSimilarity {
    private CosineSimilarity() {
    }

    public static double compute(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        double denominator = Math.sqrt(normA) * Math.sqrt(normB);
        return denominator > 0.0 ? dot / denominator : 0.0;
    }

    public static boolean dimensionsMatch(float[] a, float[] b) {
        return a != null && b != null && a.length == b.length;
    }
}

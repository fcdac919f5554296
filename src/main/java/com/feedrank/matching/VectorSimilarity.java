package com.feedrank.matching;

/**
 * Cosine similarity over embedding vectors produced by an external generator.
 *
 * Malformed input (missing, empty, different lengths, zero magnitude or
 * non-finite components) yields 0 instead of an error.
 */
public final class VectorSimilarity {

    private VectorSimilarity() {
    }

    public static double cosine(double[] a, double[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }

        // cosine is scale-invariant; normalizing by the largest component keeps the sums finite
        double scaleA = maxAbs(a);
        double scaleB = maxAbs(b);
        if (!Double.isFinite(scaleA) || !Double.isFinite(scaleB) || scaleA == 0.0 || scaleB == 0.0) {
            return 0.0;
        }

        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            double x = a[i] / scaleA;
            double y = b[i] / scaleB;
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }

        double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Double.isFinite(similarity) ? similarity : 0.0;
    }

    private static double maxAbs(double[] vector) {
        double max = 0.0;
        for (double component : vector) {
            if (!Double.isFinite(component)) {
                return Double.NaN;
            }
            max = Math.max(max, Math.abs(component));
        }
        return max;
    }
}

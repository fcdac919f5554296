package com.feedrank.matching;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VectorSimilarityTest {

    @Test
    void identicalDirection_isOne() {
        assertEquals(1.0, VectorSimilarity.cosine(new double[]{1, 2, 3}, new double[]{2, 4, 6}), 1e-12);
    }

    @Test
    void orthogonal_isZero() {
        assertEquals(0.0, VectorSimilarity.cosine(new double[]{1, 0}, new double[]{0, 1}), 1e-12);
    }

    @Test
    void opposite_isMinusOne() {
        assertEquals(-1.0, VectorSimilarity.cosine(new double[]{1, 1}, new double[]{-1, -1}), 1e-12);
    }

    @Test
    void malformedInput_yieldsZero() {
        assertEquals(0.0, VectorSimilarity.cosine(null, new double[]{1}));
        assertEquals(0.0, VectorSimilarity.cosine(new double[]{}, new double[]{}));
        assertEquals(0.0, VectorSimilarity.cosine(new double[]{1, 2}, new double[]{1, 2, 3}));
        assertEquals(0.0, VectorSimilarity.cosine(new double[]{0, 0}, new double[]{1, 2}));
        assertEquals(0.0, VectorSimilarity.cosine(new double[]{Double.NaN, 1}, new double[]{1, 2}));
    }

    @Test
    void extremeMagnitudes_doNotOverflowOrUnderflow() {
        double[] huge = {1e200, 2e200, 3e200};
        double[] tiny = {1e-200, 2e-200, 3e-200};

        assertEquals(1.0, VectorSimilarity.cosine(huge, huge), 1e-12);
        assertEquals(1.0, VectorSimilarity.cosine(tiny, tiny), 1e-12);
        assertEquals(1.0, VectorSimilarity.cosine(huge, tiny), 1e-12);
    }

    @Test
    void infiniteComponent_yieldsZero() {
        assertEquals(0.0, VectorSimilarity.cosine(new double[]{Double.POSITIVE_INFINITY, 1}, new double[]{1, 2}));
    }
}

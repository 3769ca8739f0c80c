package com.github.trinity.recovery.util;

import static org.junit.jupiter.api.Assertions.*;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.MersenneTwister;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SignRectifierTest {

    @ParameterizedTest
    @ValueSource(doubles = {1.0, -1.0})
    void testRecoversTruthUpToSign(double c) {
        RealMatrix truth = MatrixOps.gaussianMatrix(4, 3, new MersenneTwister(19));
        Rectification r = SignRectifier.rectify(truth.scalarMultiply(c), truth);
        assertEquals(0.0, r.getError(), 1e-12);
        assertEquals(0.0, r.getAligned().subtract(truth).getFrobeniusNorm(), 1e-12);
        assertEquals(c < 0, r.isFlipped());
    }

    @Test
    void testPicksSmallerOfBothErrors() {
        RealMatrix truth = MatrixOps.reshape(new double[]{3, 4}, 2, 1);
        RealMatrix estimate = MatrixOps.reshape(new double[]{-3, -3}, 2, 1);
        Rectification r = SignRectifier.rectify(estimate, truth);
        assertTrue(r.isFlipped());
        assertEquals(1.0 / 5.0, r.getError(), 1e-12);
        assertArrayEquals(new double[]{3, 3}, MatrixOps.vectorize(r.getAligned()), 0.0);
    }

    @Test
    void testTieKeepsEstimate() {
        RealMatrix truth = MatrixOps.reshape(new double[]{1, 0}, 2, 1);
        RealMatrix estimate = MatrixOps.reshape(new double[]{0, 1}, 2, 1);
        Rectification r = SignRectifier.rectify(estimate, truth);
        assertFalse(r.isFlipped());
        assertSame(estimate, r.getAligned());
    }

    @Test
    void testZeroTruthReportsAbsoluteError() {
        RealMatrix truth = MatrixOps.zeros(2, 2);
        RealMatrix estimate = MatrixOps.reshape(new double[]{0, 3, 4, 0}, 2, 2);
        assertEquals(5.0, SignRectifier.error(estimate, truth), 1e-12);
    }
}

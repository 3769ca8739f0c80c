package com.github.trinity.recovery.util;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.FastMath;

/**
 * Weighting f(y) applied to the measurements before they enter the spectral covariance
 * (1/m) sum_i f(y_i) A_i A_i^T of the power method.
 *
 * @author Sean Phillips
 */
public enum Preprocessing {
    IDENTITY,
    SQUARE,
    /**
     * Keeps measurements inside [1/sqrt(m), 5/sqrt(m)] and zeroes the rest, which removes the
     * heavy tail of the squared weights.
     */
    TRUNCATED;

    public RealVector apply(RealVector y) {
        int m = y.getDimension();
        double[] out = new double[m];
        double lower = 1.0 / FastMath.sqrt(m);
        double upper = 5.0 / FastMath.sqrt(m);
        for (int i = 0; i < m; i++) {
            double v = y.getEntry(i);
            switch (this) {
                case SQUARE:
                    out[i] = v * v;
                    break;
                case TRUNCATED:
                    out[i] = (v < lower || v > upper) ? 0.0 : v;
                    break;
                default:
                    out[i] = v;
            }
        }
        return new ArrayRealVector(out, false);
    }
}

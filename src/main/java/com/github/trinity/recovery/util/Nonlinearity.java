package com.github.trinity.recovery.util;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;

/**
 * Element-wise map applied to the clean linear measurements A(x*)/sqrt(m).
 *
 * @author Sean Phillips
 */
public enum Nonlinearity {
    IDENTITY {
        @Override
        public double apply(double z) {
            return z;
        }
    },
    /** Phase retrieval. */
    ABSOLUTE_VALUE {
        @Override
        public double apply(double z) {
            return Math.abs(z);
        }
    },
    SQUARE {
        @Override
        public double apply(double z) {
            return z * z;
        }
    },
    SIGN {
        @Override
        public double apply(double z) {
            return Math.signum(z);
        }
    };

    public abstract double apply(double z);

    public RealVector apply(RealVector z) {
        double[] out = new double[z.getDimension()];
        for (int i = 0; i < out.length; i++) {
            out[i] = apply(z.getEntry(i));
        }
        return new ArrayRealVector(out, false);
    }

    /**
     * True when f(z) = f(-z), i.e. the measurements carry a global sign ambiguity and errors
     * must be rectified.
     */
    public boolean isSignInvariant() {
        return this == ABSOLUTE_VALUE || this == SQUARE;
    }
}

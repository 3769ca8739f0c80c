package com.github.trinity.recovery.util;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Result of aligning an estimate with a reference up to a global sign.
 *
 * @author Sean Phillips
 */
public final class Rectification {

    private final double error;
    private final RealMatrix aligned;
    private final boolean flipped;

    Rectification(double error, RealMatrix aligned, boolean flipped) {
        this.error = error;
        this.aligned = aligned;
        this.flipped = flipped;
    }

    /** Relative error of the better of the two sign alignments. */
    public double getError() {
        return error;
    }

    /** The estimate multiplied by the sign that achieves {@link #getError()}. */
    public RealMatrix getAligned() {
        return aligned;
    }

    public boolean isFlipped() {
        return flipped;
    }
}

package com.github.trinity.recovery.init;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * A starting estimate with the history of how it was produced.
 *
 * @author Sean Phillips
 */
public final class InitResult {

    private final RealMatrix estimate;
    private final InitHistory history;

    public InitResult(RealMatrix estimate, InitHistory history) {
        this.estimate = estimate;
        this.history = history;
    }

    public RealMatrix getEstimate() {
        return estimate;
    }

    public InitHistory getHistory() {
        return history;
    }
}

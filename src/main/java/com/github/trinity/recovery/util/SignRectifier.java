package com.github.trinity.recovery.util;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Magnitude measurements cannot tell x from -x since |A(x)| = |A(-x)|. Error reporting for
 * those problems therefore uses
 * <pre>
 *   min(||x - x*||, ||x + x*||) / ||x*||
 * </pre>
 * and hands back whichever sign of the estimate achieves the minimum.
 *
 * @author Sean Phillips
 */
public final class SignRectifier {

    private SignRectifier() {
    }

    public static Rectification rectify(RealMatrix estimate, RealMatrix truth) {
        double positive = estimate.subtract(truth).getFrobeniusNorm();
        double negative = estimate.add(truth).getFrobeniusNorm();
        double reference = truth.getFrobeniusNorm();
        double scale = reference > 0 ? reference : 1.0;
        if (positive <= negative) {
            return new Rectification(positive / scale, estimate, false);
        }
        return new Rectification(negative / scale, estimate.scalarMultiply(-1.0), true);
    }

    public static double error(RealMatrix estimate, RealMatrix truth) {
        return rectify(estimate, truth).getError();
    }
}

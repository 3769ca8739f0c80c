package com.github.trinity.recovery.solver;

import com.github.trinity.recovery.operator.LinearOperator;
import com.github.trinity.recovery.util.MatrixOps;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Gradient and loss of the amplitude objective {@code (1/2m) sum_i (y_i - |z_i|)^2} with
 * {@code z = forward(x) / sqrt(m)}. The objective is not differentiable where z_i = 0; there the
 * sign is replaced by the guarded sign of {@link MatrixOps#guardedSign}.
 *
 * @author Sean Phillips
 */
final class AmplitudeGradient {

    private AmplitudeGradient() {
    }

    /**
     * {@code c_i = (y_i - |z_i|) * sgn(z_i)}.
     */
    static RealVector coefficients(RealVector z, RealVector y, double epsilon) {
        int m = z.getDimension();
        double[] c = new double[m];
        for (int i = 0; i < m; i++) {
            double zi = z.getEntry(i);
            c[i] = (y.getEntry(i) - Math.abs(zi)) * MatrixOps.guardedSign(zi, epsilon);
        }
        return new ArrayRealVector(c, false);
    }

    /**
     * {@code -adjoint(c) / sqrt(m)}.
     */
    static RealMatrix gradient(LinearOperator operator, RealVector z, RealVector y, double epsilon, double sqrtM) {
        return operator.adjoint(coefficients(z, y, epsilon)).scalarMultiply(-1.0 / sqrtM);
    }

    static double loss(RealVector z, RealVector y) {
        int m = z.getDimension();
        double sum = 0.0;
        for (int i = 0; i < m; i++) {
            double r = y.getEntry(i) - Math.abs(z.getEntry(i));
            sum += r * r;
        }
        return sum / (2.0 * m);
    }
}

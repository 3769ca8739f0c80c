package com.github.trinity.recovery.init;

/**
 * What an initializer recorded on the way: per-iteration errors, norms and losses for the
 * iterative methods, the spectrum for the spectral one, and the error of the returned estimate.
 * Arrays that do not apply to a method are empty; errors are NaN without ground truth.
 *
 * @author Sean Phillips
 */
public final class InitHistory {

    private static final double[] NONE = new double[0];

    private final String method;
    private final double[] errors;
    private final double[] norms;
    private final double[] losses;
    private final double[] singularValues;
    private final double finalError;

    private InitHistory(Builder b) {
        this.method = b.method;
        this.errors = b.errors;
        this.norms = b.norms;
        this.losses = b.losses;
        this.singularValues = b.singularValues;
        this.finalError = b.finalError;
    }

    static Builder builder(String method) {
        return new Builder(method);
    }

    public String getMethod() {
        return method;
    }

    public double[] getErrors() {
        return errors.clone();
    }

    public double[] getNorms() {
        return norms.clone();
    }

    public double[] getLosses() {
        return losses.clone();
    }

    public double[] getSingularValues() {
        return singularValues.clone();
    }

    public double getFinalError() {
        return finalError;
    }

    @Override
    public String toString() {
        return "InitHistory{method=" + method
            + ", iterations=" + Math.max(errors.length, norms.length)
            + ", finalError=" + finalError + '}';
    }

    static final class Builder {
        private final String method;
        private double[] errors = NONE;
        private double[] norms = NONE;
        private double[] losses = NONE;
        private double[] singularValues = NONE;
        private double finalError = Double.NaN;

        private Builder(String method) {
            this.method = method;
        }

        Builder errors(double[] errors) {
            this.errors = errors.clone();
            return this;
        }

        Builder norms(double[] norms) {
            this.norms = norms.clone();
            return this;
        }

        Builder losses(double[] losses) {
            this.losses = losses.clone();
            return this;
        }

        Builder singularValues(double[] singularValues) {
            this.singularValues = singularValues.clone();
            return this;
        }

        Builder finalError(double finalError) {
            this.finalError = finalError;
            return this;
        }

        InitHistory build() {
            return new InitHistory(this);
        }
    }
}

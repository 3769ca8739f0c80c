package com.github.trinity.recovery.solver;

import com.github.trinity.recovery.exception.ConfigurationException;
import com.github.trinity.recovery.projection.Projection;
import com.github.trinity.recovery.util.Nonlinearity;

/**
 * Hyperparameters shared by all solvers. Instances are immutable and validated once in
 * {@link Builder#build()}; a rank or sparsity of 0 means "not set". Each solver checks in its
 * constructor that the fields it needs are present.
 *
 * @author Sean Phillips
 */
public final class SolverConfig {

    public static final int DEFAULT_ITERATIONS = 200;
    public static final double DEFAULT_STEP_SIZE = 0.1;
    public static final int DEFAULT_INNER_ITERATIONS = 10;
    public static final double DEFAULT_DIVERGENCE_THRESHOLD = 1e3;
    public static final double DEFAULT_EPSILON = 1e-12;
    public static final double DEFAULT_STEP_DECAY = 0.95;

    private final int iterations;
    private final double stepSize;
    private final int rank;
    private final int sparsity;
    private final double regularization;
    private final Projection projection;
    private final int innerIterations;
    private final double divergenceThreshold;
    private final double epsilon;
    private final double stepDecay;
    private final Nonlinearity nonlinearity;

    private SolverConfig(Builder b) {
        this.iterations = b.iterations;
        this.stepSize = b.stepSize;
        this.rank = b.rank;
        this.sparsity = b.sparsity;
        this.regularization = b.regularization;
        this.projection = b.projection;
        this.innerIterations = b.innerIterations;
        this.divergenceThreshold = b.divergenceThreshold;
        this.epsilon = b.epsilon;
        this.stepDecay = b.stepDecay;
        this.nonlinearity = b.nonlinearity;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .iterations(iterations)
            .stepSize(stepSize)
            .rank(rank)
            .sparsity(sparsity)
            .regularization(regularization)
            .projection(projection)
            .innerIterations(innerIterations)
            .divergenceThreshold(divergenceThreshold)
            .epsilon(epsilon)
            .stepDecay(stepDecay)
            .nonlinearity(nonlinearity);
    }

    public int getIterations() {
        return iterations;
    }

    public double getStepSize() {
        return stepSize;
    }

    public int getRank() {
        return rank;
    }

    public boolean hasRank() {
        return rank > 0;
    }

    public int getSparsity() {
        return sparsity;
    }

    public double getRegularization() {
        return regularization;
    }

    /** @return the structural projection, or {@code null} when none was configured */
    public Projection getProjection() {
        return projection;
    }

    public int getInnerIterations() {
        return innerIterations;
    }

    public double getDivergenceThreshold() {
        return divergenceThreshold;
    }

    public double getEpsilon() {
        return epsilon;
    }

    public double getStepDecay() {
        return stepDecay;
    }

    /** Nonlinearity applied to the predictions in the AP loss; amplitude by default. */
    public Nonlinearity getNonlinearity() {
        return nonlinearity;
    }

    Projection requireProjection(String solver) {
        if (projection == null) {
            throw new ConfigurationException(solver + " needs a projection");
        }
        return projection;
    }

    int requireRank(String solver) {
        if (rank < 1) {
            throw new ConfigurationException(solver + " needs a target rank >= 1");
        }
        return rank;
    }

    @Override
    public String toString() {
        return "SolverConfig{iterations=" + iterations
            + ", stepSize=" + stepSize
            + ", rank=" + rank
            + ", sparsity=" + sparsity
            + ", regularization=" + regularization
            + ", projection=" + (projection == null ? "none" : projection.getClass().getSimpleName())
            + ", innerIterations=" + innerIterations
            + ", nonlinearity=" + nonlinearity + '}';
    }

    public static final class Builder {
        private int iterations = DEFAULT_ITERATIONS;
        private double stepSize = DEFAULT_STEP_SIZE;
        private int rank;
        private int sparsity;
        private double regularization;
        private Projection projection;
        private int innerIterations = DEFAULT_INNER_ITERATIONS;
        private double divergenceThreshold = DEFAULT_DIVERGENCE_THRESHOLD;
        private double epsilon = DEFAULT_EPSILON;
        private double stepDecay = DEFAULT_STEP_DECAY;
        private Nonlinearity nonlinearity = Nonlinearity.ABSOLUTE_VALUE;

        private Builder() {
        }

        public Builder iterations(int iterations) {
            this.iterations = iterations;
            return this;
        }

        public Builder stepSize(double stepSize) {
            this.stepSize = stepSize;
            return this;
        }

        public Builder rank(int rank) {
            this.rank = rank;
            return this;
        }

        public Builder sparsity(int sparsity) {
            this.sparsity = sparsity;
            return this;
        }

        public Builder regularization(double regularization) {
            this.regularization = regularization;
            return this;
        }

        public Builder projection(Projection projection) {
            this.projection = projection;
            return this;
        }

        public Builder innerIterations(int innerIterations) {
            this.innerIterations = innerIterations;
            return this;
        }

        public Builder divergenceThreshold(double divergenceThreshold) {
            this.divergenceThreshold = divergenceThreshold;
            return this;
        }

        public Builder epsilon(double epsilon) {
            this.epsilon = epsilon;
            return this;
        }

        public Builder stepDecay(double stepDecay) {
            this.stepDecay = stepDecay;
            return this;
        }

        public Builder nonlinearity(Nonlinearity nonlinearity) {
            this.nonlinearity = nonlinearity;
            return this;
        }

        public SolverConfig build() {
            if (iterations < 1) {
                throw new ConfigurationException("iterations must be >= 1, got " + iterations);
            }
            if (!(stepSize > 0) || Double.isInfinite(stepSize)) {
                throw new ConfigurationException("stepSize must be positive and finite, got " + stepSize);
            }
            if (rank < 0 || sparsity < 0) {
                throw new ConfigurationException(String.format(
                    "rank and sparsity must be >= 0 (0 = unset), got %d and %d", rank, sparsity));
            }
            if (!(regularization >= 0) || Double.isInfinite(regularization)) {
                throw new ConfigurationException("regularization must be >= 0, got " + regularization);
            }
            if (innerIterations < 1) {
                throw new ConfigurationException("innerIterations must be >= 1, got " + innerIterations);
            }
            if (!(divergenceThreshold > 0)) {
                throw new ConfigurationException("divergenceThreshold must be positive, got " + divergenceThreshold);
            }
            if (!(epsilon > 0)) {
                throw new ConfigurationException("epsilon must be positive, got " + epsilon);
            }
            if (!(stepDecay > 0 && stepDecay <= 1)) {
                throw new ConfigurationException("stepDecay must lie in (0, 1], got " + stepDecay);
            }
            if (nonlinearity == null) {
                throw new ConfigurationException("nonlinearity must not be null");
            }
            return new SolverConfig(this);
        }
    }
}

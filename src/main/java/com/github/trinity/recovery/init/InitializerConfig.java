package com.github.trinity.recovery.init;

import com.github.trinity.recovery.exception.ConfigurationException;
import com.github.trinity.recovery.projection.Projection;
import com.github.trinity.recovery.util.Preprocessing;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Settings for the initializers; each initializer reads only the fields it needs and checks
 * the required ones when it is constructed. A rank or sparsity of 0 means "not set", and a NaN
 * tensor step size selects 0.5 / d^2 for the problem at hand.
 *
 * @author Sean Phillips
 */
public final class InitializerConfig {

    public static final double DEFAULT_SCALE = 0.1;
    public static final int DEFAULT_POWER_ITERATIONS = 40;
    public static final int DEFAULT_TENSOR_ITERATIONS = 10;
    public static final int DEFAULT_REFINEMENT_ITERATIONS = 20;

    private final int rank;
    private final int sparsity;
    private final double scale;
    private final int powerIterations;
    private final Preprocessing preprocessing;
    private final Projection projection;
    private final RealMatrix seed;
    private final int tensorIterations;
    private final double tensorStepSize;
    private final int refinementIterations;
    private final ExtractionMethod extraction;

    private InitializerConfig(Builder b) {
        this.rank = b.rank;
        this.sparsity = b.sparsity;
        this.scale = b.scale;
        this.powerIterations = b.powerIterations;
        this.preprocessing = b.preprocessing;
        this.projection = b.projection;
        this.seed = b.seed;
        this.tensorIterations = b.tensorIterations;
        this.tensorStepSize = b.tensorStepSize;
        this.refinementIterations = b.refinementIterations;
        this.extraction = b.extraction;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .rank(rank)
            .sparsity(sparsity)
            .scale(scale)
            .powerIterations(powerIterations)
            .preprocessing(preprocessing)
            .projection(projection)
            .seed(seed)
            .tensorIterations(tensorIterations)
            .tensorStepSize(tensorStepSize)
            .refinementIterations(refinementIterations)
            .extraction(extraction);
    }

    public int getRank() {
        return rank;
    }

    public int getSparsity() {
        return sparsity;
    }

    public double getScale() {
        return scale;
    }

    public int getPowerIterations() {
        return powerIterations;
    }

    public Preprocessing getPreprocessing() {
        return preprocessing;
    }

    /** @return the projection applied after each power step, or {@code null} */
    public Projection getProjection() {
        return projection;
    }

    /** @return the power method's starting point, or {@code null} for the all-ones start */
    public RealMatrix getSeed() {
        return seed;
    }

    public int getTensorIterations() {
        return tensorIterations;
    }

    /**
     * Step size of the lifted solver for side length {@code d}.
     */
    public double tensorStepSizeFor(int d) {
        return Double.isNaN(tensorStepSize) ? 0.5 / ((double) d * d) : tensorStepSize;
    }

    public int getRefinementIterations() {
        return refinementIterations;
    }

    public ExtractionMethod getExtraction() {
        return extraction;
    }

    int requireRank(String initializer) {
        if (rank < 1) {
            throw new ConfigurationException(initializer + " initialization needs a target rank >= 1");
        }
        return rank;
    }

    int requireSparsity(String initializer) {
        if (sparsity < 1) {
            throw new ConfigurationException(initializer + " initialization needs a target sparsity >= 1");
        }
        return sparsity;
    }

    public static final class Builder {
        private int rank;
        private int sparsity;
        private double scale = DEFAULT_SCALE;
        private int powerIterations = DEFAULT_POWER_ITERATIONS;
        private Preprocessing preprocessing = Preprocessing.SQUARE;
        private Projection projection;
        private RealMatrix seed;
        private int tensorIterations = DEFAULT_TENSOR_ITERATIONS;
        private double tensorStepSize = Double.NaN;
        private int refinementIterations = DEFAULT_REFINEMENT_ITERATIONS;
        private ExtractionMethod extraction = ExtractionMethod.EIG;

        private Builder() {
        }

        public Builder rank(int rank) {
            this.rank = rank;
            return this;
        }

        public Builder sparsity(int sparsity) {
            this.sparsity = sparsity;
            return this;
        }

        public Builder scale(double scale) {
            this.scale = scale;
            return this;
        }

        public Builder powerIterations(int powerIterations) {
            this.powerIterations = powerIterations;
            return this;
        }

        public Builder preprocessing(Preprocessing preprocessing) {
            this.preprocessing = preprocessing;
            return this;
        }

        public Builder projection(Projection projection) {
            this.projection = projection;
            return this;
        }

        public Builder seed(RealMatrix seed) {
            this.seed = seed;
            return this;
        }

        public Builder tensorIterations(int tensorIterations) {
            this.tensorIterations = tensorIterations;
            return this;
        }

        public Builder tensorStepSize(double tensorStepSize) {
            this.tensorStepSize = tensorStepSize;
            return this;
        }

        public Builder refinementIterations(int refinementIterations) {
            this.refinementIterations = refinementIterations;
            return this;
        }

        public Builder extraction(ExtractionMethod extraction) {
            this.extraction = extraction;
            return this;
        }

        public InitializerConfig build() {
            if (rank < 0 || sparsity < 0) {
                throw new ConfigurationException(String.format(
                    "rank and sparsity must be >= 0 (0 = unset), got %d and %d", rank, sparsity));
            }
            if (!(scale > 0) || Double.isInfinite(scale)) {
                throw new ConfigurationException("scale must be positive and finite, got " + scale);
            }
            if (powerIterations < 1 || tensorIterations < 1 || refinementIterations < 0) {
                throw new ConfigurationException(String.format(
                    "iteration counts out of range: power %d, tensor %d, refinement %d",
                    powerIterations, tensorIterations, refinementIterations));
            }
            if (!Double.isNaN(tensorStepSize) && !(tensorStepSize > 0)) {
                throw new ConfigurationException("tensorStepSize must be positive, got " + tensorStepSize);
            }
            if (preprocessing == null || extraction == null) {
                throw new ConfigurationException("preprocessing and extraction must not be null");
            }
            return new InitializerConfig(this);
        }
    }
}

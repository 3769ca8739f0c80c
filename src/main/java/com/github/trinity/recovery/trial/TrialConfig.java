package com.github.trinity.recovery.trial;

import com.github.trinity.recovery.exception.ConfigurationException;
import com.github.trinity.recovery.init.Initializer;
import com.github.trinity.recovery.init.InitializerConfig;
import com.github.trinity.recovery.init.InitializerType;
import com.github.trinity.recovery.operator.SensingModel;
import com.github.trinity.recovery.operator.SignalShape;
import com.github.trinity.recovery.solver.Solver;
import com.github.trinity.recovery.solver.SolverConfig;
import com.github.trinity.recovery.solver.SolverType;
import com.github.trinity.recovery.util.Nonlinearity;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * One point of an experiment: what to recover, how it is measured, and which initializer and
 * solver to run. Built once and shared by value across trials, so the solver and initializer
 * held here must be thread-safe (all the built-in ones are).
 *
 * @author Sean Phillips
 */
public final class TrialConfig {

    public static final double DEFAULT_SUCCESS_THRESHOLD = 1e-2;

    private final SignalModel signalModel;
    private final SignalShape shape;
    private final int rank;
    private final int sparsity;
    private final double conditionNumber;
    private final RealMatrix groundTruth;
    private final SensingModel sensingModel;
    private final int measurements;
    private final Nonlinearity nonlinearity;
    private final Initializer initializer;
    private final Solver solver;
    private final double successThreshold;

    private TrialConfig(Builder b) {
        this.signalModel = b.signalModel;
        this.shape = b.shape;
        this.rank = b.rank;
        this.sparsity = b.sparsity;
        this.conditionNumber = b.conditionNumber;
        this.groundTruth = b.groundTruth;
        this.sensingModel = b.sensingModel;
        this.measurements = b.measurements;
        this.nonlinearity = b.nonlinearity;
        this.initializer = b.initializer;
        this.solver = b.solver;
        this.successThreshold = b.successThreshold;
    }

    public static Builder builder() {
        return new Builder();
    }

    public SignalModel getSignalModel() {
        return signalModel;
    }

    public SignalShape getShape() {
        return shape;
    }

    public int getRank() {
        return rank;
    }

    public int getSparsity() {
        return sparsity;
    }

    public double getConditionNumber() {
        return conditionNumber;
    }

    /** @return the fixed ground truth, or {@code null} when each trial draws its own */
    public RealMatrix getGroundTruth() {
        return groundTruth;
    }

    public SensingModel getSensingModel() {
        return sensingModel;
    }

    public int getMeasurements() {
        return measurements;
    }

    public Nonlinearity getNonlinearity() {
        return nonlinearity;
    }

    public Initializer getInitializer() {
        return initializer;
    }

    public Solver getSolver() {
        return solver;
    }

    public double getSuccessThreshold() {
        return successThreshold;
    }

    /** Rank for matrix models, sparsity for vectors. */
    int structuralBudget() {
        return signalModel == SignalModel.SPARSE_VECTOR ? sparsity : rank;
    }

    @Override
    public String toString() {
        return "TrialConfig{" + signalModel + " " + shape
            + ", rank=" + rank + ", sparsity=" + sparsity
            + ", m=" + measurements + ", sensing=" + sensingModel
            + ", nonlinearity=" + nonlinearity
            + ", initializer=" + initializer.getClass().getSimpleName()
            + ", solver=" + solver.getClass().getSimpleName() + '}';
    }

    public static final class Builder {
        private SignalModel signalModel = SignalModel.LOW_RANK;
        private SignalShape shape;
        private int rank;
        private int sparsity;
        private double conditionNumber = 1.0;
        private RealMatrix groundTruth;
        private SensingModel sensingModel = SensingModel.GAUSSIAN;
        private int measurements;
        private Nonlinearity nonlinearity = Nonlinearity.IDENTITY;
        private Initializer initializer;
        private Solver solver;
        private double successThreshold = DEFAULT_SUCCESS_THRESHOLD;

        private Builder() {
        }

        public Builder signalModel(SignalModel signalModel) {
            this.signalModel = signalModel;
            return this;
        }

        public Builder shape(SignalShape shape) {
            this.shape = shape;
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

        public Builder conditionNumber(double conditionNumber) {
            this.conditionNumber = conditionNumber;
            return this;
        }

        /** Uses the same signal in every trial instead of drawing a fresh one. */
        public Builder groundTruth(RealMatrix groundTruth) {
            this.groundTruth = groundTruth;
            return this;
        }

        public Builder sensingModel(SensingModel sensingModel) {
            this.sensingModel = sensingModel;
            return this;
        }

        public Builder measurements(int measurements) {
            this.measurements = measurements;
            return this;
        }

        public Builder nonlinearity(Nonlinearity nonlinearity) {
            this.nonlinearity = nonlinearity;
            return this;
        }

        public Builder initializer(Initializer initializer) {
            this.initializer = initializer;
            return this;
        }

        public Builder initializer(InitializerType type, InitializerConfig config) {
            return initializer(type.create(config));
        }

        public Builder solver(Solver solver) {
            this.solver = solver;
            return this;
        }

        public Builder solver(SolverType type, SolverConfig config) {
            return solver(type.create(config));
        }

        public Builder successThreshold(double successThreshold) {
            this.successThreshold = successThreshold;
            return this;
        }

        public TrialConfig build() {
            if (signalModel == null || sensingModel == null || nonlinearity == null) {
                throw new ConfigurationException("signal model, sensing model and nonlinearity are required");
            }
            if (shape == null) {
                throw new ConfigurationException("signal shape is required");
            }
            if (measurements < 1) {
                throw new ConfigurationException("measurement count must be >= 1, got " + measurements);
            }
            if (initializer == null || solver == null) {
                throw new ConfigurationException("an initializer and a solver are required");
            }
            if (!(successThreshold > 0)) {
                throw new ConfigurationException("success threshold must be positive, got " + successThreshold);
            }
            if (!(conditionNumber >= 1)) {
                throw new ConfigurationException("condition number must be >= 1, got " + conditionNumber);
            }
            if (groundTruth != null) {
                shape.check(groundTruth);
            } else {
                switch (signalModel) {
                    case SPARSE_VECTOR:
                        if (!shape.isVector() || sparsity < 1) {
                            throw new ConfigurationException("sparse vectors need a d x 1 shape and sparsity >= 1");
                        }
                        break;
                    case SYMMETRIC_PSD:
                        shape.requireSquare("PSD ground truth");
                        // fall through
                    default:
                        if (rank < 1) {
                            throw new ConfigurationException("matrix signals need rank >= 1");
                        }
                }
            }
            return new TrialConfig(this);
        }
    }
}

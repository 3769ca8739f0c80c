package com.github.trinity.recovery.solver;

/**
 * Selects a solver implementation by name.
 *
 * @author Sean Phillips
 */
public enum SolverType {
    GD {
        @Override
        public Solver create(SolverConfig config) {
            return new FactoredGradientDescent(config);
        }
    },
    SUB_GD {
        @Override
        public Solver create(SolverConfig config) {
            return new SubgradientDescent(config);
        }
    },
    SGD {
        @Override
        public Solver create(SolverConfig config) {
            return new StochasticGradientDescent(config);
        }
    },
    RGD {
        @Override
        public Solver create(SolverConfig config) {
            return new RiemannianGradientDescent(config);
        }
    },
    PGD {
        @Override
        public Solver create(SolverConfig config) {
            return new ProjectedGradientDescent(config);
        }
    },
    PGD_AMPLITUDE {
        @Override
        public Solver create(SolverConfig config) {
            return new AmplitudeProjectedGradientDescent(config);
        }
    },
    PGD_SYMMETRIC_TENSOR {
        @Override
        public Solver create(SolverConfig config) {
            return new SymmetricTensorProjectedGradientDescent(config);
        }
    },
    AP {
        @Override
        public Solver create(SolverConfig config) {
            return new AlternatingProjection(config);
        }
    },
    ISTA {
        @Override
        public Solver create(SolverConfig config) {
            return new SoftThresholdingSolver(config);
        }
    };

    public abstract Solver create(SolverConfig config);
}

package com.github.trinity.recovery.init;

/**
 * Selects an initializer implementation by name.
 *
 * @author Sean Phillips
 */
public enum InitializerType {
    SPECTRAL {
        @Override
        public Initializer create(InitializerConfig config) {
            return new SpectralInitializer(config);
        }
    },
    RANDOM {
        @Override
        public Initializer create(InitializerConfig config) {
            return new RandomInitializer(config);
        }
    },
    POWER_METHOD {
        @Override
        public Initializer create(InitializerConfig config) {
            return new PowerMethodInitializer(config);
        }
    },
    TENSOR_LIFT {
        @Override
        public Initializer create(InitializerConfig config) {
            return new TensorLiftInitializer(config);
        }
    },
    ZERO {
        @Override
        public Initializer create(InitializerConfig config) {
            return new ZeroInitializer();
        }
    },
    MATCHING_PURSUIT {
        @Override
        public Initializer create(InitializerConfig config) {
            return new MatchingPursuitInitializer(config);
        }
    },
    LEAST_SQUARES {
        @Override
        public Initializer create(InitializerConfig config) {
            return new LeastSquaresInitializer(config);
        }
    };

    public abstract Initializer create(InitializerConfig config);
}

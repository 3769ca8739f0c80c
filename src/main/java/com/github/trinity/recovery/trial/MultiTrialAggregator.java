package com.github.trinity.recovery.trial;

import java.util.Arrays;
import java.util.stream.IntStream;
import com.github.trinity.recovery.exception.ConfigurationException;
import com.github.trinity.recovery.solver.Diagnostics;
import org.apache.commons.math3.random.MersenneTwister;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repeats a trial with independent randomness and folds the results into running sums. Trial
 * seeds are drawn up front from a master {@link MersenneTwister}, so the set of trials depends
 * only on the seed and never on scheduling; the reduction is a commutative sum, so parallel and
 * sequential runs agree up to floating-point reassociation.
 *
 * @author Sean Phillips
 */
public class MultiTrialAggregator {
    private static final Logger LOG = LoggerFactory.getLogger(MultiTrialAggregator.class);

    private final TrialRunner runner;
    private final boolean parallel;

    public MultiTrialAggregator() {
        this(new TrialRunner(), true);
    }

    public MultiTrialAggregator(TrialRunner runner, boolean parallel) {
        this.runner = runner;
        this.parallel = parallel;
    }

    public AggregateResult aggregate(TrialConfig config, int trials, long seed) {
        if (trials < 1) {
            throw new ConfigurationException("Number of trials must be >= 1, got " + trials);
        }
        MersenneTwister master = new MersenneTwister(seed);
        long[] seeds = new long[trials];
        for (int i = 0; i < trials; i++) {
            seeds[i] = master.nextLong();
        }
        long start = System.currentTimeMillis();
        IntStream indices = IntStream.range(0, trials);
        if (parallel) {
            indices = indices.parallel();
        }
        Accumulator sum = indices
            .mapToObj(i -> runner.run(config, new MersenneTwister(seeds[i])))
            .collect(Accumulator::new, Accumulator::add, Accumulator::combine);
        AggregateResult result = sum.toResult();
        LOG.info("{} trials of {} in {} ms: success probability {}, final mean error {}",
            trials, config, System.currentTimeMillis() - start,
            String.format("%.3f", result.getSuccessProbability()),
            String.format("%.4e", result.finalMeanError()));
        return result;
    }

    /**
     * Mutable container for {@code Stream.collect}: running sums of the error and loss
     * trajectories with per-index counts.
     */
    static final class Accumulator {
        private double[] errorSums = new double[0];
        private double[] lossSums = new double[0];
        private int[] counts = new int[0];
        private int successes;
        private int failures;
        private int trials;

        void add(TrialResult result) {
            trials++;
            if (result.isSuccess()) {
                successes++;
            }
            if (result.isFailed()) {
                failures++;
            }
            Diagnostics d = result.getDiagnostics();
            ensureLength(d.length());
            for (int k = 0; k < d.length(); k++) {
                errorSums[k] += d.getError(k);
                lossSums[k] += d.getLoss(k);
                counts[k]++;
            }
        }

        void combine(Accumulator other) {
            ensureLength(other.counts.length);
            for (int k = 0; k < other.counts.length; k++) {
                errorSums[k] += other.errorSums[k];
                lossSums[k] += other.lossSums[k];
                counts[k] += other.counts[k];
            }
            successes += other.successes;
            failures += other.failures;
            trials += other.trials;
        }

        private void ensureLength(int length) {
            if (length > counts.length) {
                errorSums = Arrays.copyOf(errorSums, length);
                lossSums = Arrays.copyOf(lossSums, length);
                counts = Arrays.copyOf(counts, length);
            }
        }

        AggregateResult toResult() {
            int n = counts.length;
            double[] meanErrors = new double[n];
            double[] meanLosses = new double[n];
            for (int k = 0; k < n; k++) {
                meanErrors[k] = errorSums[k] / counts[k];
                meanLosses[k] = lossSums[k] / counts[k];
            }
            return new AggregateResult(meanErrors, meanLosses, counts.clone(), successes, failures, trials);
        }
    }
}

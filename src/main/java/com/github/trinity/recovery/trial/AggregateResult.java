package com.github.trinity.recovery.trial;

/**
 * Element-wise mean trajectories and success statistics over a batch of trials. Index k of a
 * mean trajectory averages only the trials whose diagnostics reached index k; the count of those
 * trials is kept alongside.
 *
 * @author Sean Phillips
 */
public final class AggregateResult {

    private final double[] meanErrors;
    private final double[] meanLosses;
    private final int[] counts;
    private final int successCount;
    private final int failureCount;
    private final int trialCount;

    AggregateResult(double[] meanErrors, double[] meanLosses, int[] counts,
                    int successCount, int failureCount, int trialCount) {
        this.meanErrors = meanErrors;
        this.meanLosses = meanLosses;
        this.counts = counts;
        this.successCount = successCount;
        this.failureCount = failureCount;
        this.trialCount = trialCount;
    }

    public double[] getMeanErrors() {
        return meanErrors.clone();
    }

    public double[] getMeanLosses() {
        return meanLosses.clone();
    }

    public int[] getCounts() {
        return counts.clone();
    }

    public int getSuccessCount() {
        return successCount;
    }

    /** Trials that ended with an exception rather than a solver result. */
    public int getFailureCount() {
        return failureCount;
    }

    public int getTrialCount() {
        return trialCount;
    }

    public double getSuccessProbability() {
        return trialCount == 0 ? 0.0 : (double) successCount / trialCount;
    }

    public double finalMeanError() {
        return meanErrors.length == 0 ? Double.NaN : meanErrors[meanErrors.length - 1];
    }

    @Override
    public String toString() {
        return "AggregateResult{trials=" + trialCount
            + ", successes=" + successCount
            + ", failures=" + failureCount
            + ", successProbability=" + String.format("%.3f", getSuccessProbability())
            + ", finalMeanError=" + String.format("%.4e", finalMeanError()) + '}';
    }
}

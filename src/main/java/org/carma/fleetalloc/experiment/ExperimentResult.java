package org.carma.fleetalloc.experiment;

import org.carma.fleetalloc.model.TrialOutcome;

import java.util.*;

/**
 * Outcomes of every trial of an experiment, with summary statistics.
 *
 * Standard deviations are sample (n − 1) deviations and are reported as 0
 * when fewer than two trials ran. Uplift is the relative difference of the
 * mean totals, in percent, and is NaN when the baseline mean is 0.
 */
public class ExperimentResult {

    public static final List<String> TABLE_COLUMNS = List.of("allocator_total", "baseline_total", "diff");

    private final String name;
    private final List<TrialOutcome> outcomes;
    private final long elapsedMs;

    public ExperimentResult(String name, List<TrialOutcome> outcomes, long elapsedMs) {
        this.name = name;
        this.outcomes = List.copyOf(outcomes);
        this.elapsedMs = elapsedMs;
    }

    // ========================================================================
    // Per-trial data
    // ========================================================================

    public String getName() {
        return name;
    }

    public List<TrialOutcome> getOutcomes() {
        return outcomes;
    }

    public int getTrialCount() {
        return outcomes.size();
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public double[] getAllocatorTotals() {
        return outcomes.stream().mapToDouble(TrialOutcome::allocatorTotal).toArray();
    }

    public double[] getBaselineTotals() {
        return outcomes.stream().mapToDouble(TrialOutcome::baselineTotal).toArray();
    }

    public double[] getDiffs() {
        return outcomes.stream().mapToDouble(TrialOutcome::diff).toArray();
    }

    /**
     * Trial table, one row per trial in {@link #TABLE_COLUMNS} order.
     */
    public List<double[]> toTable() {
        List<double[]> rows = new ArrayList<>(outcomes.size());
        for (TrialOutcome outcome : outcomes) {
            rows.add(new double[] {outcome.allocatorTotal(), outcome.baselineTotal(), outcome.diff()});
        }
        return rows;
    }

    // ========================================================================
    // Summary Statistics
    // ========================================================================

    public double getAllocatorMean() {
        return mean(getAllocatorTotals());
    }

    public double getBaselineMean() {
        return mean(getBaselineTotals());
    }

    public double getAllocatorStdDev() {
        return sampleStdDev(getAllocatorTotals());
    }

    public double getBaselineStdDev() {
        return sampleStdDev(getBaselineTotals());
    }

    public double getMeanDiff() {
        return mean(getDiffs());
    }

    /**
     * Fraction of trials in which the allocator earned strictly more.
     */
    public double getWinRate() {
        if (outcomes.isEmpty()) return 0.0;
        long wins = outcomes.stream().filter(TrialOutcome::allocatorWins).count();
        return (double) wins / outcomes.size();
    }

    /**
     * (mean allocator total / mean baseline total − 1) × 100.
     */
    public double getUpliftPercent() {
        double baseline = getBaselineMean();
        if (baseline == 0.0) return Double.NaN;
        return (getAllocatorMean() / baseline - 1.0) * 100.0;
    }

    static double mean(double[] values) {
        return Arrays.stream(values).average().orElse(0.0);
    }

    static double sampleStdDev(double[] values) {
        if (values.length < 2) return 0.0;
        double avg = mean(values);
        double sumSq = Arrays.stream(values).map(v -> (v - avg) * (v - avg)).sum();
        return Math.sqrt(sumSq / (values.length - 1));
    }

    // ========================================================================
    // Reporting
    // ========================================================================

    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Experiment Summary: ").append(name).append("\n");
        sb.append(String.format("  Trials: %d (%.2f seconds)\n", getTrialCount(), elapsedMs / 1000.0));
        sb.append(String.format("  %-12s %18s %18s\n", "Strategy", "Mean total", "Std total"));
        sb.append(String.format("  %-12s %18.4f %18.4f\n", "Allocator", getAllocatorMean(), getAllocatorStdDev()));
        sb.append(String.format("  %-12s %18.4f %18.4f\n", "Random", getBaselineMean(), getBaselineStdDev()));
        sb.append(String.format("  Win rate (allocator > random): %.2f%%\n", getWinRate() * 100));
        sb.append(String.format("  Average uplift: %.2f%%\n", getUpliftPercent()));
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("ExperimentResult[%s, %d trials, winRate=%.3f, uplift=%.2f%%]",
            name, getTrialCount(), getWinRate(), getUpliftPercent());
    }
}

package org.carma.fleetalloc.model;

/**
 * Total revenue earned by each strategy over one full simulated horizon.
 */
public record TrialOutcome(int trial, double allocatorTotal, double baselineTotal) {

    public double diff() {
        return allocatorTotal - baselineTotal;
    }

    public boolean allocatorWins() {
        return allocatorTotal > baselineTotal;
    }
}

package org.carma.fleetalloc.mechanism;

import org.carma.fleetalloc.model.CongestionModel;

import java.util.Arrays;
import java.util.Objects;

/**
 * Greedy capacity allocator over zones.
 *
 * Places drivers one at a time into the zone with the largest marginal
 * gain under the configured congestion model:
 *
 *   k* = argmaxₖ [ r(cₖ + 1, Rₖ) − r(cₖ, Rₖ) ]
 *
 * Ties go to the lowest zone index. For concave models (saturation) the
 * marginal gains of each zone are non-increasing, so the greedy result
 * maximizes the macro revenue. For the split model it is a coverage
 * heuristic: every positive-revenue zone is covered before any zone
 * receives a second driver.
 *
 * Complexity: O(numDrivers × K).
 */
public class GreedyAllocator {

    private final CongestionModel model;

    public GreedyAllocator(CongestionModel model) {
        this.model = Objects.requireNonNull(model, "Congestion model cannot be null");
    }

    public CongestionModel getModel() {
        return model;
    }

    /**
     * Result of one allocation: target count per zone and the macro
     * revenue those counts realize.
     */
    public record AllocationPlan(int[] counts, double macroRevenue) {

        public int totalDrivers() {
            return Arrays.stream(counts).sum();
        }

        @Override
        public String toString() {
            return String.format("AllocationPlan[counts=%s, macro=%.4f]", Arrays.toString(counts), macroRevenue);
        }
    }

    /**
     * Compute target counts per zone.
     *
     * @param numDrivers Drivers to place, non-negative
     * @param revenues Base revenue per zone
     * @return counts summing to {@code numDrivers}
     */
    public int[] allocate(int numDrivers, double[] revenues) {
        if (numDrivers < 0) {
            throw new IllegalArgumentException("Driver count cannot be negative: " + numDrivers);
        }
        if (revenues.length == 0) {
            throw new IllegalArgumentException("Revenue vector cannot be empty");
        }

        int[] counts = new int[revenues.length];
        for (int placed = 0; placed < numDrivers; placed++) {
            int bestZone = 0;
            double bestGain = Double.NEGATIVE_INFINITY;
            for (int k = 0; k < revenues.length; k++) {
                double gain = model.marginalGain(counts[k], revenues[k]);
                // Strict comparison keeps the first (lowest) zone on ties
                if (gain > bestGain) {
                    bestGain = gain;
                    bestZone = k;
                }
            }
            counts[bestZone]++;
        }
        return counts;
    }

    /**
     * Allocate and evaluate in one call.
     */
    public AllocationPlan plan(int numDrivers, double[] revenues) {
        int[] counts = allocate(numDrivers, revenues);
        return new AllocationPlan(counts, model.computeMacro(counts, revenues));
    }

    @Override
    public String toString() {
        return "GreedyAllocator[" + model + "]";
    }
}

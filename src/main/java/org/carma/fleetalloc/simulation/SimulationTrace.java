package org.carma.fleetalloc.simulation;

import org.carma.fleetalloc.model.RevenueContext;
import org.carma.fleetalloc.model.TrialOutcome;

import java.util.*;

/**
 * Slot-by-slot history of one paired simulation.
 *
 * Slot revenues are always tracked for both strategies. Full slot records
 * (zone snapshots for animation) are kept only when requested, since the
 * experiment runner needs nothing but the totals.
 */
public class SimulationTrace {

    private final RevenueContext startContext;
    private final boolean keepRecords;
    private final List<Double> allocatorRevenue;
    private final List<Double> baselineRevenue;
    private final List<SlotRecord> allocatorRecords;
    private final List<SlotRecord> baselineRecords;

    public SimulationTrace(RevenueContext startContext, boolean keepRecords) {
        this.startContext = startContext;
        this.keepRecords = keepRecords;
        this.allocatorRevenue = new ArrayList<>();
        this.baselineRevenue = new ArrayList<>();
        this.allocatorRecords = new ArrayList<>();
        this.baselineRecords = new ArrayList<>();
    }

    // ========================================================================
    // Recording
    // ========================================================================

    public void recordSlot(SlotRecord allocator, SlotRecord baseline) {
        allocatorRevenue.add(allocator.revenue());
        baselineRevenue.add(baseline.revenue());
        if (keepRecords) {
            allocatorRecords.add(allocator);
            baselineRecords.add(baseline);
        }
    }

    // ========================================================================
    // Analysis
    // ========================================================================

    public int getSlotCount() {
        return allocatorRevenue.size();
    }

    public double getAllocatorTotal() {
        return allocatorRevenue.stream().mapToDouble(Double::doubleValue).sum();
    }

    public double getBaselineTotal() {
        return baselineRevenue.stream().mapToDouble(Double::doubleValue).sum();
    }

    /**
     * Slots in which the allocator earned strictly more than the baseline.
     */
    public int getAllocatorSlotWins() {
        int wins = 0;
        for (int i = 0; i < allocatorRevenue.size(); i++) {
            if (allocatorRevenue.get(i) > baselineRevenue.get(i)) wins++;
        }
        return wins;
    }

    public TrialOutcome toOutcome(int trial) {
        return new TrialOutcome(trial, getAllocatorTotal(), getBaselineTotal());
    }

    // ========================================================================
    // History Access
    // ========================================================================

    public RevenueContext getStartContext() {
        return startContext;
    }

    public boolean isKeepingRecords() {
        return keepRecords;
    }

    public List<Double> getAllocatorRevenueHistory() {
        return new ArrayList<>(allocatorRevenue);
    }

    public List<Double> getBaselineRevenueHistory() {
        return new ArrayList<>(baselineRevenue);
    }

    /**
     * Per-slot records of the allocator-driven strategy; empty unless
     * slot recording was enabled.
     */
    public List<SlotRecord> getAllocatorRecords() {
        return Collections.unmodifiableList(allocatorRecords);
    }

    public List<SlotRecord> getBaselineRecords() {
        return Collections.unmodifiableList(baselineRecords);
    }

    // ========================================================================
    // Reporting
    // ========================================================================

    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Simulation Trace Summary:\n");
        sb.append(String.format("  Start: %s\n", startContext));
        sb.append(String.format("  Slots: %d (%.1f hours)\n",
            getSlotCount(), getSlotCount() * StrategySimulation.SLOT_HOURS));
        sb.append(String.format("  Allocator total: %.4f\n", getAllocatorTotal()));
        sb.append(String.format("  Baseline total:  %.4f\n", getBaselineTotal()));
        sb.append(String.format("  Difference: %.4f\n", getAllocatorTotal() - getBaselineTotal()));
        sb.append(String.format("  Slots won by allocator: %d/%d\n", getAllocatorSlotWins(), getSlotCount()));
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("SimulationTrace[%d slots, allocator=%.4f, baseline=%.4f]",
            getSlotCount(), getAllocatorTotal(), getBaselineTotal());
    }
}

package org.carma.fleetalloc.simulation;

import org.carma.fleetalloc.mechanism.AssignmentPolicy;
import org.carma.fleetalloc.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Advances one strategy's driver population one slot at a time.
 *
 * Per slot:
 * 1. Select the active drivers; with none, the slot earns nothing
 * 2. Ask the assignment policy for a target zone per active driver
 * 3. Split them into stayers (target == current zone) and movers
 * 4. Earn the macro revenue of the stayers' zones only
 * 5. Relocate movers; they can earn from the next slot on
 * 6. Take one slot of shift time off every active driver
 *
 * The population is owned exclusively by this instance for the whole trial.
 */
public class StrategySimulation {

    private static final Logger log = LoggerFactory.getLogger(StrategySimulation.class);

    /** Slot length in simulated hours; moving between zones takes one slot */
    public static final double SLOT_HOURS = 0.5;

    private final AssignmentPolicy policy;
    private final CongestionModel model;
    private final List<Driver> drivers;
    private final int zoneCount;
    private final Random random;

    private double totalRevenue;
    private int slotsRun;

    /**
     * @param policy How targets are chosen
     * @param model Congestion model used to score the stayers
     * @param drivers Population to advance; taken over, not copied
     * @param zoneCount Number of zones K
     * @param random Random source for policies that draw
     */
    public StrategySimulation(AssignmentPolicy policy, CongestionModel model,
            List<Driver> drivers, int zoneCount, Random random) {
        if (zoneCount < 1) {
            throw new IllegalArgumentException("Zone count must be at least 1, got " + zoneCount);
        }
        this.policy = Objects.requireNonNull(policy, "Policy cannot be null");
        this.model = Objects.requireNonNull(model, "Congestion model cannot be null");
        this.drivers = new ArrayList<>(drivers);
        this.zoneCount = zoneCount;
        this.random = Objects.requireNonNull(random, "Random cannot be null");
        for (Driver driver : this.drivers) {
            if (driver.getZone() >= zoneCount) {
                throw new IllegalArgumentException("Driver zone " + driver.getZone()
                    + " outside [0, " + zoneCount + ")");
            }
        }
    }

    // ========================================================================
    // Slot Transition
    // ========================================================================

    /**
     * Run one slot.
     *
     * @param context Context the revenues were resolved for
     * @param revenues Base revenue per zone, length K
     * @return record of the slot
     */
    public SlotRecord step(RevenueContext context, double[] revenues) {
        if (revenues.length != zoneCount) {
            throw new IllegalArgumentException("Revenue vector length " + revenues.length
                + " does not match zone count " + zoneCount);
        }
        int slot = slotsRun++;
        int[] before = zones();

        List<Driver> active = drivers.stream().filter(Driver::isActive).toList();
        if (active.isEmpty()) {
            return new SlotRecord(slot, context, before, before.clone(), 0, 0, 0, drivers.size(), 0.0);
        }

        int[] targets = policy.chooseTargets(active, revenues, random);
        if (targets.length != active.size()) {
            throw new IllegalStateException(policy.getName() + " returned " + targets.length
                + " targets for " + active.size() + " active drivers");
        }

        int[] stayerZones = new int[active.size()];
        int stayers = 0;
        List<Driver> movers = new ArrayList<>();
        List<Integer> moverTargets = new ArrayList<>();
        for (int i = 0; i < active.size(); i++) {
            Driver driver = active.get(i);
            int target = targets[i];
            if (target < 0 || target >= zoneCount) {
                throw new IllegalStateException(policy.getName() + " chose zone " + target
                    + " outside [0, " + zoneCount + ")");
            }
            if (target == driver.getZone()) {
                stayerZones[stayers++] = driver.getZone();
            } else {
                movers.add(driver);
                moverTargets.add(target);
            }
        }

        double revenue = model.computeMacroForZones(Arrays.copyOf(stayerZones, stayers), revenues);

        for (int i = 0; i < movers.size(); i++) {
            movers.get(i).moveTo(moverTargets.get(i));
        }
        for (Driver driver : active) {
            driver.consume(SLOT_HOURS);
        }

        totalRevenue += revenue;
        int inactiveAfter = (int) drivers.stream().filter(d -> !d.isActive()).count();

        if (log.isDebugEnabled()) {
            log.debug("{} slot {}: active={}, stayers={}, movers={}, revenue={}",
                policy.getName(), slot, active.size(), stayers, movers.size(),
                String.format("%.4f", revenue));
        }

        return new SlotRecord(slot, context, before, zones(), active.size(),
            stayers, movers.size(), inactiveAfter, revenue);
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public int[] zones() {
        int[] zones = new int[drivers.size()];
        for (int i = 0; i < zones.length; i++) {
            zones[i] = drivers.get(i).getZone();
        }
        return zones;
    }

    public List<Driver> getDrivers() {
        return Collections.unmodifiableList(drivers);
    }

    public int getActiveCount() {
        return (int) drivers.stream().filter(Driver::isActive).count();
    }

    public double getTotalRevenue() {
        return totalRevenue;
    }

    public int getSlotsRun() {
        return slotsRun;
    }

    public AssignmentPolicy getPolicy() {
        return policy;
    }

    @Override
    public String toString() {
        return String.format("StrategySimulation[%s, %d drivers, %d active, %d slots, total=%.4f]",
            policy.getName(), drivers.size(), getActiveCount(), slotsRun, totalRevenue);
    }
}

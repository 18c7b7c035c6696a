package org.carma.fleetalloc.simulation;

import org.carma.fleetalloc.mechanism.AssignmentPolicy;
import org.carma.fleetalloc.mechanism.RevenueOracle;
import org.carma.fleetalloc.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Runs the allocator-driven strategy and the random baseline side by side
 * over one horizon.
 *
 * Both strategies start from independent copies of the same population and
 * see the same context, hence the same revenue vector, in every slot. Only
 * their assignment decisions differ.
 *
 * Random draws happen in a fixed order: start day, start time, each driver's
 * zone and shift length, then the baseline's per-slot target draws. The
 * allocator never consumes randomness.
 */
public class PairedSimulation {

    private static final Logger log = LoggerFactory.getLogger(PairedSimulation.class);

    private final SimulationSettings settings;
    private final RevenueOracle oracle;
    private final Random random;
    private final AssignmentPolicy allocatorPolicy;
    private final AssignmentPolicy baselinePolicy;

    /**
     * @param settings Simulation parameters
     * @param oracle Revenue lookup shared by both strategies
     * @param random Random source owned by this trial
     */
    public PairedSimulation(SimulationSettings settings, RevenueOracle oracle, Random random) {
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null");
        this.oracle = Objects.requireNonNull(oracle, "Oracle cannot be null");
        this.random = Objects.requireNonNull(random, "Random cannot be null");
        this.allocatorPolicy = new AssignmentPolicy.GreedyPolicy(settings.getModel());
        this.baselinePolicy = new AssignmentPolicy.RandomPolicy();
    }

    // ========================================================================
    // Initialization
    // ========================================================================

    /**
     * Draw the start context, using fixed values where the settings have them.
     */
    public RevenueContext drawStartContext() {
        int day = settings.getStartDay() != null
            ? settings.getStartDay()
            : random.nextInt(7);
        double time = settings.getStartTime() != null
            ? settings.getStartTime()
            : random.nextDouble() * 24.0;
        return new RevenueContext(day, time, settings.getWeather());
    }

    /**
     * Draw the initial population: uniform zone, whole-hour shift length
     * uniform in the configured inclusive range.
     */
    public List<Driver> drawPopulation() {
        int span = settings.getMaxInitialHours() - settings.getMinInitialHours() + 1;
        List<Driver> drivers = new ArrayList<>(settings.getDrivers());
        for (int i = 0; i < settings.getDrivers(); i++) {
            int zone = random.nextInt(settings.getZones());
            int hours = settings.getMinInitialHours() + random.nextInt(span);
            drivers.add(new Driver(zone, hours));
        }
        return drivers;
    }

    // ========================================================================
    // Simulation Execution
    // ========================================================================

    public SimulationTrace run() {
        RevenueContext start = drawStartContext();
        List<Driver> population = drawPopulation();
        return run(start, population);
    }

    /**
     * Run from an explicit start context and population. The population is
     * copied for each strategy and left untouched.
     */
    public SimulationTrace run(RevenueContext start, List<Driver> population) {
        StrategySimulation allocator = new StrategySimulation(
            allocatorPolicy, settings.getModel(), copyOf(population), settings.getZones(), random);
        StrategySimulation baseline = new StrategySimulation(
            baselinePolicy, settings.getModel(), copyOf(population), settings.getZones(), random);

        SimulationTrace trace = new SimulationTrace(start, settings.isRecordSlots());
        int slots = settings.slotCount();
        log.debug("Running {} slots from {} with {} drivers", slots, start, population.size());

        RevenueContext context = start;
        for (int slot = 0; slot < slots; slot++) {
            double[] revenues = oracle.lookup(context, settings.getZones());
            SlotRecord allocatorSlot = allocator.step(context, revenues);
            SlotRecord baselineSlot = baseline.step(context, revenues);
            trace.recordSlot(allocatorSlot, baselineSlot);
            context = context.advance(StrategySimulation.SLOT_HOURS);
        }

        log.debug("Finished: {}", trace);
        return trace;
    }

    private static List<Driver> copyOf(List<Driver> population) {
        List<Driver> copy = new ArrayList<>(population.size());
        for (Driver driver : population) {
            copy.add(driver.copy());
        }
        return copy;
    }

    public SimulationSettings getSettings() {
        return settings;
    }
}

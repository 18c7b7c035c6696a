package org.carma.fleetalloc.simulation;

import org.carma.fleetalloc.mechanism.RevenueOracle;
import org.carma.fleetalloc.model.Driver;
import org.carma.fleetalloc.model.RevenueContext;
import org.carma.fleetalloc.model.RevenueTable;
import org.carma.fleetalloc.model.RevenueTableGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PairedSimulationTest {

    private RevenueOracle oracle;

    @BeforeEach
    void setUp() {
        RevenueTable table = new RevenueTableGenerator(21L).generate(4);
        oracle = new RevenueOracle(table);
    }

    private static SimulationSettings.Builder settings() {
        return SimulationSettings.builder()
            .drivers(12)
            .zones(4)
            .horizonHours(3.0)
            .recordSlots(true);
    }

    @Test
    void run_bothStrategiesStartFromSamePopulation() {
        var sim = new PairedSimulation(settings().build(), oracle, new Random(3));

        SimulationTrace trace = sim.run();

        SlotRecord allocatorFirst = trace.getAllocatorRecords().get(0);
        SlotRecord baselineFirst = trace.getBaselineRecords().get(0);
        assertArrayEquals(allocatorFirst.zonesBefore(), baselineFirst.zonesBefore());
        assertEquals(allocatorFirst.activeDrivers(), baselineFirst.activeDrivers());
    }

    @Test
    void run_bothStrategiesSeeSameContextEachSlot() {
        var sim = new PairedSimulation(settings().build(), oracle, new Random(3));

        SimulationTrace trace = sim.run();

        for (int slot = 0; slot < trace.getSlotCount(); slot++) {
            assertEquals(trace.getAllocatorRecords().get(slot).context(),
                trace.getBaselineRecords().get(slot).context());
        }
        assertEquals(trace.getStartContext(), trace.getAllocatorRecords().get(0).context());
    }

    @Test
    void run_horizonRoundsUpToWholeSlots() {
        var sim = new PairedSimulation(settings().horizonHours(1.2).build(), oracle, new Random(3));

        assertEquals(3, sim.run().getSlotCount());
    }

    @Test
    void run_fixedStartContextRollsIntoNextDay() {
        var fixed = settings().startDay(6).startTime(23.5).weather("Rain").build();
        var sim = new PairedSimulation(fixed, oracle, new Random(3));

        SimulationTrace trace = sim.run();

        assertEquals(new RevenueContext(6, 23.5, "rain"), trace.getStartContext());
        RevenueContext second = trace.getAllocatorRecords().get(1).context();
        assertEquals(0, second.day());
        assertEquals(0.0, second.time(), 1e-9);
    }

    @Test
    void run_sameSeedReproducesTotals() {
        SimulationTrace first = new PairedSimulation(settings().build(), oracle, new Random(77)).run();
        SimulationTrace second = new PairedSimulation(settings().build(), oracle, new Random(77)).run();

        assertEquals(first.getAllocatorTotal(), second.getAllocatorTotal());
        assertEquals(first.getBaselineTotal(), second.getBaselineTotal());
        assertEquals(first.getBaselineRevenueHistory(), second.getBaselineRevenueHistory());
    }

    @Test
    void run_leavesSuppliedPopulationUntouched() {
        var sim = new PairedSimulation(settings().build(), oracle, new Random(3));
        List<Driver> population = List.of(new Driver(0, 2.0), new Driver(3, 1.0), new Driver(1, 4.0));

        sim.run(new RevenueContext(1, 9.0, "clear"), population);

        assertEquals(0, population.get(0).getZone());
        assertEquals(2.0, population.get(0).getHoursLeft());
        assertEquals(4.0, population.get(2).getHoursLeft());
    }

    @Test
    void drawPopulation_respectsZoneAndHourRanges() {
        var sim = new PairedSimulation(settings().drivers(200).initialHours(2, 5).build(), oracle, new Random(9));

        List<Driver> population = sim.drawPopulation();

        assertEquals(200, population.size());
        for (Driver driver : population) {
            assertTrue(driver.getZone() >= 0 && driver.getZone() < 4);
            assertTrue(driver.getHoursLeft() >= 2.0 && driver.getHoursLeft() <= 5.0);
            assertEquals(Math.rint(driver.getHoursLeft()), driver.getHoursLeft());
        }
    }

    @Test
    void run_withoutRecordingKeepsOnlyRevenueHistory() {
        var sim = new PairedSimulation(settings().recordSlots(false).build(), oracle, new Random(3));

        SimulationTrace trace = sim.run();

        assertTrue(trace.getAllocatorRecords().isEmpty());
        assertEquals(6, trace.getAllocatorRevenueHistory().size());
        assertEquals(trace.getAllocatorTotal(), trace.toOutcome(0).allocatorTotal());
    }
}

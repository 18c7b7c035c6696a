package org.carma.fleetalloc.experiment;

import org.carma.fleetalloc.model.TrialOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExperimentResultTest {

    private static final double EPS = 1e-9;

    private static ExperimentResult threeTrials() {
        return new ExperimentResult("stats", List.of(
            new TrialOutcome(0, 10.0, 5.0),
            new TrialOutcome(1, 20.0, 25.0),
            new TrialOutcome(2, 30.0, 15.0)), 3L);
    }

    @Test
    void means_andDiff() {
        ExperimentResult result = threeTrials();

        assertEquals(20.0, result.getAllocatorMean(), EPS);
        assertEquals(15.0, result.getBaselineMean(), EPS);
        assertEquals(5.0, result.getMeanDiff(), EPS);
        assertArrayEquals(new double[] {5.0, -5.0, 15.0}, result.getDiffs(), EPS);
    }

    @Test
    void stdDev_usesSampleCorrection() {
        ExperimentResult result = threeTrials();

        assertEquals(10.0, result.getAllocatorStdDev(), EPS);
        assertEquals(10.0, result.getBaselineStdDev(), EPS);
    }

    @Test
    void winRate_countsStrictWinsOnly() {
        ExperimentResult result = new ExperimentResult("ties", List.of(
            new TrialOutcome(0, 10.0, 5.0),
            new TrialOutcome(1, 7.0, 7.0),
            new TrialOutcome(2, 1.0, 3.0),
            new TrialOutcome(3, 4.0, 2.0)), 0L);

        assertEquals(0.5, result.getWinRate(), EPS);
        assertEquals(2.0 / 3.0, threeTrials().getWinRate(), EPS);
    }

    @Test
    void uplift_isRatioOfMeans() {
        assertEquals(100.0 / 3.0, threeTrials().getUpliftPercent(), EPS);
    }

    @Test
    void uplift_undefinedForZeroBaseline() {
        ExperimentResult result = new ExperimentResult("zero", List.of(
            new TrialOutcome(0, 4.0, 0.0),
            new TrialOutcome(1, 2.0, 0.0)), 0L);

        assertTrue(Double.isNaN(result.getUpliftPercent()));
        assertEquals(1.0, result.getWinRate(), EPS);
    }

    @Test
    void singleTrial_hasZeroStdDev() {
        ExperimentResult result = new ExperimentResult("one", List.of(new TrialOutcome(0, 9.0, 4.0)), 0L);

        assertEquals(0.0, result.getAllocatorStdDev());
        assertEquals(0.0, result.getBaselineStdDev());
    }

    @Test
    void summary_mentionsNameAndTrials() {
        String summary = threeTrials().getSummary();

        assertTrue(summary.contains("stats"));
        assertTrue(summary.contains("3"));
    }

    @Test
    void accessors_exposeNameAndElapsedTime() {
        ExperimentResult result = threeTrials();

        assertEquals("stats", result.getName());
        assertEquals(3L, result.getElapsedMs());
        assertArrayEquals(new double[] {10.0, 20.0, 30.0}, result.getAllocatorTotals(), EPS);
    }
}

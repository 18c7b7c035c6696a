package org.carma.fleetalloc.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CongestionModelTest {

    private static final double EPS = 1e-9;

    @Test
    void saturation_zeroDriversEarnNothing() {
        var model = CongestionModel.saturation(0.6);

        assertEquals(0.0, model.realized(0, 10.0), EPS);
        assertEquals(0.0, model.realized(-1, 10.0), EPS);
    }

    @Test
    void saturation_isNonDecreasingAndBoundedByBaseRevenue() {
        var model = CongestionModel.saturation(0.6);
        double previous = 0.0;

        for (int n = 0; n <= 50; n++) {
            double value = model.realized(n, 10.0);
            assertTrue(value >= previous, "Revenue must not drop when adding driver " + n);
            assertTrue(value <= 10.0, "Revenue must stay below the zone's base revenue");
            previous = value;
        }
    }

    @Test
    void saturation_marginalGainsShrink() {
        var model = CongestionModel.saturation(0.6);

        for (int n = 0; n < 20; n++) {
            assertTrue(model.marginalGain(n + 1, 10.0) <= model.marginalGain(n, 10.0));
        }
    }

    @Test
    void saturation_matchesClosedForm() {
        var model = CongestionModel.saturation(0.6);

        assertEquals(10.0 * (1 - Math.exp(-1.2)), model.realized(2, 10.0), EPS);
    }

    @Test
    void saturation_rejectsNonPositiveAlpha() {
        assertThrows(IllegalArgumentException.class, () -> CongestionModel.saturation(0.0));
        assertThrows(IllegalArgumentException.class, () -> CongestionModel.saturation(-0.5));
        assertThrows(IllegalArgumentException.class, () -> CongestionModel.saturation(Double.NaN));
    }

    @Test
    void split_capturesFullRevenueFromFirstDriver() {
        var model = CongestionModel.split();

        assertEquals(0.0, model.realized(0, 7.5), EPS);
        for (int n = 1; n <= 10; n++) {
            assertEquals(7.5, model.realized(n, 7.5), EPS);
        }
        assertEquals(0.0, model.marginalGain(1, 7.5), EPS);
    }

    @Test
    void fromName_resolvesCaseInsensitively() {
        assertEquals(CongestionModel.Type.SATURATION, CongestionModel.fromName(" Saturation ", 0.6).getType());
        assertEquals(CongestionModel.Type.SPLIT, CongestionModel.fromName("SPLIT", 0.0).getType());
    }

    @Test
    void fromName_unknownModelIsRejected() {
        var e = assertThrows(IllegalArgumentException.class, () -> CongestionModel.fromName("linear", 0.6));
        assertTrue(e.getMessage().contains("linear"));
    }

    @Test
    void computeMacro_sumsRealizedRevenuePerZone() {
        var model = CongestionModel.saturation(0.6);
        double[] revenues = {10.0, 4.0, 0.0};

        double expected = model.realized(2, 10.0) + model.realized(1, 4.0);
        assertEquals(expected, model.computeMacro(new int[] {2, 1, 3}, revenues), EPS);
        assertEquals(expected, model.computeMacroForZones(new int[] {1, 0, 2, 0, 2, 2}, revenues), EPS);
    }

    @Test
    void computeMacro_rejectsLengthMismatch() {
        var model = CongestionModel.split();

        assertThrows(IllegalArgumentException.class,
            () -> model.computeMacro(new int[] {1, 1}, new double[] {1.0, 2.0, 3.0}));
    }

    @Test
    void countByZone_rejectsZonesOutOfRange() {
        assertArrayEquals(new int[] {2, 0, 1}, CongestionModel.countByZone(new int[] {0, 2, 0}, 3));
        assertThrows(IllegalArgumentException.class, () -> CongestionModel.countByZone(new int[] {3}, 3));
    }

    @Test
    void describe_listsModelParameters() {
        var saturation = CongestionModel.saturation(0.4);

        assertEquals(0.4, saturation.getAlpha(), EPS);
        assertEquals("saturation", saturation.describe().get("model"));
        assertEquals(0.4, (Double) saturation.describe().get("alpha"), EPS);
        assertEquals("split", CongestionModel.split().describe().get("model"));
        assertTrue(CongestionModel.Type.SATURATION.isStrictlyIncreasing());
        assertFalse(CongestionModel.Type.SPLIT.isStrictlyIncreasing());
    }
}

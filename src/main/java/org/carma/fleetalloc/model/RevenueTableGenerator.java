package org.carma.fleetalloc.model;

import java.util.*;

/**
 * Generates synthetic revenue tables for experiments and tests.
 *
 * Every zone receives a base revenue drawn uniformly from configurable
 * bounds, modulated by a sinusoidal time-of-day factor and a day-of-week
 * factor. Tables cover all seven days at one-hour granularity, once per
 * configured weather label.
 *
 * Generation is reproducible through the seed given at construction.
 */
public class RevenueTableGenerator {

    private final Random random;
    private final long seed;

    private double minBaseRevenue = 8.0;
    private double maxBaseRevenue = 25.0;
    private double timeOfDayAmplitude = 0.2;
    private double dayOfWeekAmplitude = 0.1;
    private List<String> weathers = List.of(RevenueContext.DEFAULT_WEATHER);
    private final Map<Integer, Double> zoneMultipliers = new HashMap<>();

    public RevenueTableGenerator(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    /**
     * Create a generator with the default seed (12345).
     */
    public RevenueTableGenerator() {
        this(12345L);
    }

    // ========================================================================
    // Configuration Methods
    // ========================================================================

    public RevenueTableGenerator setBaseRevenueBounds(double min, double max) {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid base revenue bounds [" + min + ", " + max + "]");
        }
        this.minBaseRevenue = min;
        this.maxBaseRevenue = max;
        return this;
    }

    public RevenueTableGenerator setTimeOfDayAmplitude(double amplitude) {
        if (!(amplitude >= 0 && amplitude <= 1)) {
            throw new IllegalArgumentException("Amplitude must be in [0, 1], got " + amplitude);
        }
        this.timeOfDayAmplitude = amplitude;
        return this;
    }

    public RevenueTableGenerator setDayOfWeekAmplitude(double amplitude) {
        if (!(amplitude >= 0 && amplitude <= 1)) {
            throw new IllegalArgumentException("Amplitude must be in [0, 1], got " + amplitude);
        }
        this.dayOfWeekAmplitude = amplitude;
        return this;
    }

    public RevenueTableGenerator setWeathers(List<String> weathers) {
        if (weathers.isEmpty()) {
            throw new IllegalArgumentException("At least one weather label required");
        }
        this.weathers = List.copyOf(weathers);
        return this;
    }

    /**
     * Scale one zone's base revenue, e.g. to build a table that heavily
     * favors a single zone.
     */
    public RevenueTableGenerator setZoneMultiplier(int zone, double multiplier) {
        if (multiplier < 0) {
            throw new IllegalArgumentException("Multiplier cannot be negative");
        }
        zoneMultipliers.put(zone, multiplier);
        return this;
    }

    public long getSeed() {
        return seed;
    }

    // ========================================================================
    // Generation
    // ========================================================================

    public RevenueTable generate(int zoneCount) {
        if (zoneCount < 1) {
            throw new IllegalArgumentException("Zone count must be at least 1, got " + zoneCount);
        }
        double[] base = new double[zoneCount];
        for (int k = 0; k < zoneCount; k++) {
            double draw = minBaseRevenue + random.nextDouble() * (maxBaseRevenue - minBaseRevenue);
            base[k] = draw * zoneMultipliers.getOrDefault(k, 1.0);
        }

        RevenueTable.Builder builder = RevenueTable.builder().zoneCount(zoneCount);
        for (String weather : weathers) {
            for (int day = 0; day < 7; day++) {
                double dayFactor = 1.0 + dayOfWeekAmplitude * Math.sin(day / 7.0 * 2 * Math.PI);
                for (int hour = 0; hour < 24; hour++) {
                    double todFactor = 1.0 + timeOfDayAmplitude * Math.sin(hour / 24.0 * 2 * Math.PI);
                    for (int k = 0; k < zoneCount; k++) {
                        builder.add(day, hour, weather, k, base[k] * todFactor * dayFactor);
                    }
                }
            }
        }
        return builder.build();
    }
}

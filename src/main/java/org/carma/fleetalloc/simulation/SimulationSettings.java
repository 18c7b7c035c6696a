package org.carma.fleetalloc.simulation;

import org.carma.fleetalloc.model.CongestionModel;
import org.carma.fleetalloc.model.RevenueContext;

import java.util.Locale;
import java.util.Objects;

/**
 * Parameters of one paired simulation (allocator vs. random baseline).
 *
 * Start day and start time are optional; when absent each trial draws
 * them uniformly. Settings are immutable and safe to share across trials.
 */
public class SimulationSettings {

    private final int drivers;
    private final int zones;
    private final double horizonHours;
    private final Integer startDay;
    private final Double startTime;
    private final String weather;
    private final CongestionModel model;
    private final int minInitialHours;
    private final int maxInitialHours;
    private final boolean recordSlots;

    private SimulationSettings(Builder builder) {
        this.drivers = builder.drivers;
        this.zones = builder.zones;
        this.horizonHours = builder.horizonHours;
        this.startDay = builder.startDay;
        this.startTime = builder.startTime;
        this.weather = builder.weather;
        this.model = builder.model;
        this.minInitialHours = builder.minInitialHours;
        this.maxInitialHours = builder.maxInitialHours;
        this.recordSlots = builder.recordSlots;
    }

    public int getDrivers() { return drivers; }
    public int getZones() { return zones; }
    public double getHorizonHours() { return horizonHours; }
    public Integer getStartDay() { return startDay; }
    public Double getStartTime() { return startTime; }
    public String getWeather() { return weather; }
    public CongestionModel getModel() { return model; }
    public int getMinInitialHours() { return minInitialHours; }
    public int getMaxInitialHours() { return maxInitialHours; }
    public boolean isRecordSlots() { return recordSlots; }

    /**
     * Number of slots covering the horizon, ceil(horizon / slot length).
     */
    public int slotCount() {
        return (int) Math.ceil(horizonHours / StrategySimulation.SLOT_HOURS);
    }

    public Builder toBuilder() {
        return new Builder()
            .drivers(drivers)
            .zones(zones)
            .horizonHours(horizonHours)
            .startDay(startDay)
            .startTime(startTime)
            .weather(weather)
            .model(model)
            .initialHours(minInitialHours, maxInitialHours)
            .recordSlots(recordSlots);
    }

    @Override
    public String toString() {
        return String.format("SimulationSettings[drivers=%d, zones=%d, horizon=%.1fh, start=%s@%s, weather=%s, %s]",
            drivers, zones, horizonHours,
            startDay != null ? startDay : "random",
            startTime != null ? String.format("%.2f", startTime) : "random",
            weather, model);
    }

    // ==========================================================================
    // Builder
    // ==========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int drivers = 30;
        private int zones = 6;
        private double horizonHours = 6.0;
        private Integer startDay;
        private Double startTime;
        private String weather = RevenueContext.DEFAULT_WEATHER;
        private CongestionModel model = CongestionModel.saturation(0.6);
        private int minInitialHours = 1;
        private int maxInitialHours = 8;
        private boolean recordSlots = false;

        public Builder drivers(int drivers) {
            this.drivers = drivers;
            return this;
        }

        public Builder zones(int zones) {
            this.zones = zones;
            return this;
        }

        public Builder horizonHours(double hours) {
            this.horizonHours = hours;
            return this;
        }

        /**
         * Fix the start day; {@code null} draws one per trial.
         */
        public Builder startDay(Integer day) {
            this.startDay = day;
            return this;
        }

        /**
         * Fix the start time; {@code null} draws one per trial.
         */
        public Builder startTime(Double time) {
            this.startTime = time;
            return this;
        }

        public Builder weather(String weather) {
            this.weather = weather;
            return this;
        }

        public Builder model(CongestionModel model) {
            this.model = model;
            return this;
        }

        /**
         * Inclusive bounds of the whole-hour shift length drawn per driver.
         */
        public Builder initialHours(int min, int max) {
            this.minInitialHours = min;
            this.maxInitialHours = max;
            return this;
        }

        public Builder recordSlots(boolean record) {
            this.recordSlots = record;
            return this;
        }

        public SimulationSettings build() {
            if (drivers < 0) {
                throw new IllegalArgumentException("Driver count cannot be negative: " + drivers);
            }
            if (zones < 1) {
                throw new IllegalArgumentException("Zone count must be at least 1, got " + zones);
            }
            if (!(horizonHours > 0) || Double.isInfinite(horizonHours)) {
                throw new IllegalArgumentException("Horizon must be positive and finite, got " + horizonHours);
            }
            if (minInitialHours < 1 || maxInitialHours < minInitialHours) {
                throw new IllegalArgumentException("Invalid initial hours range ["
                    + minInitialHours + ", " + maxInitialHours + "]");
            }
            Objects.requireNonNull(model, "Congestion model cannot be null");
            weather = weather == null || weather.isBlank()
                ? RevenueContext.DEFAULT_WEATHER
                : weather.trim().toLowerCase(Locale.ROOT);
            return new SimulationSettings(this);
        }
    }
}

package org.carma.fleetalloc.model;

import java.util.Locale;

/**
 * Temporal and weather context used to look up expected zone revenue.
 *
 * @param day Day of week, 0 = Monday .. 6 = Sunday
 * @param time Hour of day in [0, 24), fractional
 * @param weather Lowercase weather label
 */
public record RevenueContext(int day, double time, String weather) {

    public static final String DEFAULT_WEATHER = "clear";

    public RevenueContext {
        day = Math.floorMod(day, 7);
        time = normalizeTime(time);
        weather = normalizeWeather(weather);
    }

    /**
     * Advance the clock by {@code hours}. The day rolls over exactly when the
     * time reaches or passes midnight.
     */
    public RevenueContext advance(double hours) {
        double raw = time + hours;
        int daysPassed = (int) Math.floor(raw / 24.0);
        return new RevenueContext(day + daysPassed, raw, weather);
    }

    /**
     * Distance between two hours of day on a 24h clock.
     */
    public static double circularDistance(double a, double b) {
        double delta = Math.abs(a - b);
        return Math.min(delta, 24.0 - delta);
    }

    static double normalizeTime(double time) {
        if (Double.isNaN(time) || Double.isInfinite(time)) {
            throw new IllegalArgumentException("Time must be finite, got " + time);
        }
        double t = time % 24.0;
        if (t < 0) {
            t += 24.0;
        }
        // -1e-17 % 24 + 24 rounds to 24.0
        return t >= 24.0 ? 0.0 : t;
    }

    static String normalizeWeather(String weather) {
        if (weather == null || weather.isBlank()) {
            return DEFAULT_WEATHER;
        }
        return weather.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return String.format("RevenueContext[day=%d, time=%.2f, weather=%s]", day, time, weather);
    }
}

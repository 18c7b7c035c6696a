package org.carma.fleetalloc.model;

/**
 * One observed (context, zone) row of the revenue table.
 *
 * Negative and missing (NaN) revenue is stored as zero.
 */
public record RevenueRecord(int day, double time, String weather, int zoneId, double expectedRevenue) {

    public RevenueRecord {
        if (zoneId < 0) {
            throw new IllegalArgumentException("Zone id cannot be negative: " + zoneId);
        }
        day = Math.floorMod(day, 7);
        time = RevenueContext.normalizeTime(time);
        weather = RevenueContext.normalizeWeather(weather);
        if (Double.isNaN(expectedRevenue) || expectedRevenue < 0) {
            expectedRevenue = 0.0;
        }
    }

    public boolean matches(int day, String weather) {
        return this.day == day && this.weather.equals(weather);
    }
}

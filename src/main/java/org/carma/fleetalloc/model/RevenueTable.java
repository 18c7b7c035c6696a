package org.carma.fleetalloc.model;

import java.util.*;

/**
 * Expected revenue observations, one row per (day, time, weather, zone).
 *
 * Row order is preserved; the revenue oracle relies on it to break ties
 * between equally near rows. Per-zone means over the whole table are
 * computed once at construction and serve as the oracle's fill values.
 */
public class RevenueTable {

    private final List<RevenueRecord> records;
    private final int zoneCount;
    private final double[] zoneMeans;
    private final boolean[] zonePresent;
    private final double globalMean;

    public RevenueTable(List<RevenueRecord> records) {
        this(records, inferZoneCount(records));
    }

    /**
     * @param records Table rows in their natural order
     * @param zoneCount Number of zones K; rows with zone ids outside [0, K) are kept
     *                  for statistics but never selected by the oracle
     */
    public RevenueTable(List<RevenueRecord> records, int zoneCount) {
        if (zoneCount < 1) {
            throw new IllegalArgumentException("Zone count must be at least 1, got " + zoneCount);
        }
        this.records = List.copyOf(records);
        this.zoneCount = zoneCount;
        this.zoneMeans = new double[zoneCount];
        this.zonePresent = new boolean[zoneCount];

        Map<Integer, DoubleSummaryStatistics> byZone = new TreeMap<>();
        for (RevenueRecord record : this.records) {
            byZone.computeIfAbsent(record.zoneId(), k -> new DoubleSummaryStatistics())
                .accept(record.expectedRevenue());
        }
        for (var entry : byZone.entrySet()) {
            int zone = entry.getKey();
            if (zone < zoneCount) {
                zoneMeans[zone] = entry.getValue().getAverage();
                zonePresent[zone] = true;
            }
        }
        // Mean of the per-zone means, over every zone that has data
        this.globalMean = byZone.values().stream()
            .mapToDouble(DoubleSummaryStatistics::getAverage)
            .average()
            .orElse(0.0);
    }

    private static int inferZoneCount(List<RevenueRecord> records) {
        int max = records.stream().mapToInt(RevenueRecord::zoneId).max().orElse(-1);
        if (max < 0) {
            throw new IllegalArgumentException("Cannot infer zone count from an empty revenue table");
        }
        return max + 1;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public List<RevenueRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int getZoneCount() {
        return zoneCount;
    }

    /**
     * Mean revenue of a zone across the whole table.
     *
     * @return the zone mean, or empty if the zone never appears
     */
    public OptionalDouble getZoneMean(int zone) {
        if (zone < 0 || zone >= zoneCount || !zonePresent[zone]) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(zoneMeans[zone]);
    }

    /**
     * Mean of the per-zone means; 0 for an empty table.
     */
    public double getGlobalMean() {
        return globalMean;
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<RevenueRecord> records = new ArrayList<>();
        private Integer zoneCount;

        public Builder add(int day, double time, String weather, int zoneId, double expectedRevenue) {
            records.add(new RevenueRecord(day, time, weather, zoneId, expectedRevenue));
            return this;
        }

        public Builder add(RevenueRecord record) {
            records.add(Objects.requireNonNull(record, "Record cannot be null"));
            return this;
        }

        public Builder zoneCount(int zoneCount) {
            this.zoneCount = zoneCount;
            return this;
        }

        public RevenueTable build() {
            return zoneCount != null ? new RevenueTable(records, zoneCount) : new RevenueTable(records);
        }
    }

    @Override
    public String toString() {
        return String.format("RevenueTable[%d rows, %d zones, globalMean=%.2f]",
            records.size(), zoneCount, globalMean);
    }
}

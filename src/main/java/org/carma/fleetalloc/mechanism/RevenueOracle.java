package org.carma.fleetalloc.mechanism;

import org.carma.fleetalloc.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Resolves the expected base revenue of every zone for a revenue context.
 *
 * Resolution order (first non-empty subset wins):
 * 1. Rows with the exact day and weather
 * 2. Rows with the same day, any weather
 * 3. The whole table
 *
 * Within the subset each zone takes the row whose time is nearest to the
 * query time on a 24h circle; among equally near rows the first in table
 * order wins. Zones left without a value are filled with their mean over
 * the whole table, or with the table's global mean if the zone never
 * appears. Data gaps never raise.
 */
public class RevenueOracle {

    private static final Logger log = LoggerFactory.getLogger(RevenueOracle.class);

    /**
     * Which subset of rows a lookup was answered from.
     */
    public enum Tier {
        EXACT,
        SAME_DAY,
        WHOLE_TABLE
    }

    private final RevenueTable table;
    private final boolean zeroMeansMissing;

    /**
     * Oracle that treats a resolved revenue of exactly zero as missing and
     * fills it like an absent zone.
     */
    public RevenueOracle(RevenueTable table) {
        this(table, true);
    }

    private RevenueOracle(RevenueTable table, boolean zeroMeansMissing) {
        this.table = Objects.requireNonNull(table, "Revenue table cannot be null");
        this.zeroMeansMissing = zeroMeansMissing;
    }

    /**
     * Oracle that only fills zones with no matching row at all, keeping
     * observed zero revenue as zero.
     */
    public static RevenueOracle withExplicitMissingness(RevenueTable table) {
        return new RevenueOracle(table, false);
    }

    public RevenueTable getTable() {
        return table;
    }

    public boolean isZeroMeansMissing() {
        return zeroMeansMissing;
    }

    /**
     * Revenue vector over the table's own zone count.
     */
    public double[] lookup(RevenueContext context) {
        return lookup(context, table.getZoneCount());
    }

    /**
     * @param context Day, time and weather to resolve
     * @param zoneCount Length K of the returned vector
     * @return K non-negative revenues indexed by zone id
     */
    public double[] lookup(RevenueContext context, int zoneCount) {
        if (zoneCount < 1) {
            throw new IllegalArgumentException("Zone count must be at least 1, got " + zoneCount);
        }

        List<RevenueRecord> subset = new ArrayList<>();
        Tier tier = selectRows(context, subset);

        RevenueRecord[] nearest = new RevenueRecord[zoneCount];
        double[] nearestDistance = new double[zoneCount];
        for (RevenueRecord record : subset) {
            int zone = record.zoneId();
            if (zone >= zoneCount) continue;
            double distance = RevenueContext.circularDistance(record.time(), context.time());
            if (nearest[zone] == null || distance < nearestDistance[zone]) {
                nearest[zone] = record;
                nearestDistance[zone] = distance;
            }
        }

        double[] revenues = new double[zoneCount];
        int filled = 0;
        for (int k = 0; k < zoneCount; k++) {
            boolean missing = nearest[k] == null
                || (zeroMeansMissing && nearest[k].expectedRevenue() == 0.0);
            if (missing) {
                revenues[k] = table.getZoneMean(k).orElse(table.getGlobalMean());
                filled++;
            } else {
                revenues[k] = nearest[k].expectedRevenue();
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Resolved {} from {} rows ({}), {} zone(s) filled from means",
                context, subset.size(), tier, filled);
        }
        if (filled == zoneCount && !table.isEmpty()) {
            log.warn("No revenue rows resolved any zone for {}; using table means", context);
        }
        return revenues;
    }

    /**
     * Select the candidate rows for a context into {@code out}.
     *
     * @return the tier the rows came from
     */
    Tier selectRows(RevenueContext context, List<RevenueRecord> out) {
        for (RevenueRecord record : table.getRecords()) {
            if (record.matches(context.day(), context.weather())) {
                out.add(record);
            }
        }
        if (!out.isEmpty()) return Tier.EXACT;

        for (RevenueRecord record : table.getRecords()) {
            if (record.day() == context.day()) {
                out.add(record);
            }
        }
        if (!out.isEmpty()) return Tier.SAME_DAY;

        out.addAll(table.getRecords());
        return Tier.WHOLE_TABLE;
    }

    @Override
    public String toString() {
        return String.format("RevenueOracle[%s, zeroMeansMissing=%s]", table, zeroMeansMissing);
    }
}

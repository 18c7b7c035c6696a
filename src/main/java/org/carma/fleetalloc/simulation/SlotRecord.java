package org.carma.fleetalloc.simulation;

import org.carma.fleetalloc.model.RevenueContext;

import java.util.Arrays;
import java.util.Objects;

/**
 * What one strategy did in one slot.
 *
 * {@code zonesBefore} holds every driver's zone at the start of the slot and
 * {@code zonesAfter} the zone after the slot's decisions; they differ exactly
 * for the movers. Inactive drivers appear unchanged in both. Both arrays are
 * copied on the way in and out, and compared by content.
 */
public record SlotRecord(
    int slot,
    RevenueContext context,
    int[] zonesBefore,
    int[] zonesAfter,
    int activeDrivers,
    int stayers,
    int movers,
    int inactiveAfter,
    double revenue
) {

    public SlotRecord {
        zonesBefore = zonesBefore.clone();
        zonesAfter = zonesAfter.clone();
    }

    @Override
    public int[] zonesBefore() {
        return zonesBefore.clone();
    }

    @Override
    public int[] zonesAfter() {
        return zonesAfter.clone();
    }

    public int totalDrivers() {
        return zonesBefore.length;
    }

    /**
     * Indices of drivers that changed zone in this slot.
     */
    public int[] moverIndices() {
        int[] result = new int[movers];
        int pos = 0;
        for (int i = 0; i < zonesBefore.length; i++) {
            if (zonesBefore[i] != zonesAfter[i]) {
                result[pos++] = i;
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SlotRecord)) return false;
        SlotRecord other = (SlotRecord) o;
        return slot == other.slot
            && activeDrivers == other.activeDrivers
            && stayers == other.stayers
            && movers == other.movers
            && inactiveAfter == other.inactiveAfter
            && Double.compare(revenue, other.revenue) == 0
            && context.equals(other.context)
            && Arrays.equals(zonesBefore, other.zonesBefore)
            && Arrays.equals(zonesAfter, other.zonesAfter);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(slot, context, activeDrivers, stayers, movers, inactiveAfter, revenue);
        result = 31 * result + Arrays.hashCode(zonesBefore);
        return 31 * result + Arrays.hashCode(zonesAfter);
    }

    @Override
    public String toString() {
        return String.format("SlotRecord[slot=%d, %s, active=%d, stay=%d, move=%d, revenue=%.4f, after=%s]",
            slot, context, activeDrivers, stayers, movers, revenue, Arrays.toString(zonesAfter));
    }
}

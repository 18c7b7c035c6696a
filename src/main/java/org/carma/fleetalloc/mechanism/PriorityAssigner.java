package org.carma.fleetalloc.mechanism;

import org.carma.fleetalloc.model.Driver;

import java.util.*;

/**
 * Turns zone counts into a concrete target zone per driver.
 *
 * The counts are expanded into a flat list of zone slots in zone order
 * (zone 0 repeated counts[0] times, then zone 1, ...). Drivers are ranked
 * by remaining hours, longest first, with ties kept in their original
 * order, and the i-th ranked driver takes the i-th slot.
 */
public class PriorityAssigner {

    /**
     * @param drivers Active drivers
     * @param counts Target count per zone, summing to {@code drivers.size()}
     * @return target zone per driver, index-aligned with {@code drivers}
     */
    public int[] assign(List<Driver> drivers, int[] counts) {
        int[] slots = expand(counts);
        if (slots.length != drivers.size()) {
            throw new IllegalArgumentException("Counts place " + slots.length
                + " drivers but " + drivers.size() + " are active");
        }

        List<Integer> order = rankByHoursLeft(drivers);
        int[] targets = new int[drivers.size()];
        for (int rank = 0; rank < order.size(); rank++) {
            targets[order.get(rank)] = slots[rank];
        }
        return targets;
    }

    /**
     * Driver indices ordered by hours left, descending. List.sort is stable,
     * so equal hours keep their population order.
     */
    List<Integer> rankByHoursLeft(List<Driver> drivers) {
        List<Integer> order = new ArrayList<>(drivers.size());
        for (int i = 0; i < drivers.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble((Integer i) -> drivers.get(i).getHoursLeft())
            .reversed());
        return order;
    }

    static int[] expand(int[] counts) {
        int total = 0;
        for (int c : counts) {
            if (c < 0) throw new IllegalArgumentException("Counts cannot be negative");
            total += c;
        }
        int[] slots = new int[total];
        int pos = 0;
        for (int k = 0; k < counts.length; k++) {
            for (int j = 0; j < counts[k]; j++) {
                slots[pos++] = k;
            }
        }
        return slots;
    }
}

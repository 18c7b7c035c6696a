package org.carma.fleetalloc.model;

/**
 * A driver in one strategy's population.
 *
 * Each driver has:
 * - Current zone (0..K-1)
 * - Remaining active hours
 *
 * A driver whose remaining hours reach zero is inactive for the rest of the
 * run. Drivers are never removed from a population, only deactivated.
 */
public class Driver {

    private int zone;
    private double hoursLeft;

    public Driver(int zone, double hoursLeft) {
        if (zone < 0) throw new IllegalArgumentException("Zone cannot be negative");
        if (hoursLeft < 0) throw new IllegalArgumentException("Hours left cannot be negative");
        this.zone = zone;
        this.hoursLeft = hoursLeft;
    }

    public int getZone() {
        return zone;
    }

    public void moveTo(int zone) {
        if (zone < 0) throw new IllegalArgumentException("Zone cannot be negative");
        this.zone = zone;
    }

    public double getHoursLeft() {
        return hoursLeft;
    }

    public boolean isActive() {
        return hoursLeft > 0;
    }

    /**
     * Spend one slot of shift time, flooring at zero.
     */
    public void consume(double hours) {
        hoursLeft = Math.max(0.0, hoursLeft - hours);
    }

    /**
     * Independent copy, so two strategies never share driver state.
     */
    public Driver copy() {
        return new Driver(zone, hoursLeft);
    }

    @Override
    public String toString() {
        return String.format("Driver[zone=%d, hoursLeft=%.1f]", zone, hoursLeft);
    }
}

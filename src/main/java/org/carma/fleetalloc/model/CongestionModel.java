package org.carma.fleetalloc.model;

import java.util.*;

/**
 * Congestion models mapping the number of drivers placed in a zone to the
 * revenue actually realized there.
 *
 * Two variants are supported:
 * - Saturation: concave, diminishing returns per additional driver
 * - Split: coverage indicator, only the first driver in a zone counts
 *
 * Mathematical Foundation:
 *
 * Saturation:  r(n, R) = R · (1 − e^(−α·n))   for n > 0, else 0
 * Split:       r(n, R) = R                    for n > 0, else 0
 * Macro:       M(c, R) = Σₖ r(cₖ, Rₖ)
 *
 * Both models are non-decreasing in n with non-increasing marginal gains,
 * which is what makes greedy allocation well behaved.
 *
 * @author CARMA Arbitration Platform
 */
public abstract class CongestionModel {

    /**
     * Type of congestion model.
     */
    public enum Type {
        SATURATION("saturation", "r = R·(1 − e^(−α·n))", true),
        SPLIT("split", "r = R·[n > 0]", false);

        private final String configName;
        private final String formula;
        private final boolean strictlyIncreasing;

        Type(String configName, String formula, boolean strictlyIncreasing) {
            this.configName = configName;
            this.formula = formula;
            this.strictlyIncreasing = strictlyIncreasing;
        }

        public String getConfigName() { return configName; }
        public String getFormula() { return formula; }
        public boolean isStrictlyIncreasing() { return strictlyIncreasing; }

        /**
         * Resolve a type from its configuration name (case-insensitive).
         *
         * @throws IllegalArgumentException for unknown names
         */
        public static Type fromConfigName(String name) {
            if (name == null) {
                throw new IllegalArgumentException("Congestion model name cannot be null");
            }
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (Type type : values()) {
                if (type.configName.equals(normalized)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown congestion model: " + name
                + " (expected one of " + Arrays.toString(configNames()) + ")");
        }

        private static String[] configNames() {
            return Arrays.stream(values()).map(Type::getConfigName).toArray(String[]::new);
        }
    }

    protected final Type type;

    protected CongestionModel(Type type) {
        this.type = type;
    }

    /**
     * Revenue realized in one zone holding {@code n} drivers when the
     * zone's base revenue is {@code baseRevenue}.
     */
    public abstract double realized(int n, double baseRevenue);

    /**
     * Incremental revenue from adding one more driver to a zone already
     * holding {@code n} drivers.
     */
    public double marginalGain(int n, double baseRevenue) {
        return realized(n + 1, baseRevenue) - realized(n, baseRevenue);
    }

    /**
     * Aggregate realized revenue across all zones for a count vector.
     *
     * @param counts Drivers per zone
     * @param revenues Base revenue per zone, same length as counts
     */
    public double computeMacro(int[] counts, double[] revenues) {
        if (counts.length != revenues.length) {
            throw new IllegalArgumentException("Count vector length " + counts.length
                + " does not match revenue vector length " + revenues.length);
        }
        double total = 0.0;
        for (int k = 0; k < counts.length; k++) {
            total += realized(counts[k], revenues[k]);
        }
        return total;
    }

    /**
     * Aggregate realized revenue for a multiset of occupied zones.
     *
     * @param zones Zone id of each earning driver
     * @param revenues Base revenue per zone
     */
    public double computeMacroForZones(int[] zones, double[] revenues) {
        return computeMacro(countByZone(zones, revenues.length), revenues);
    }

    public Type getType() {
        return type;
    }

    /**
     * Parameters for reporting and config round-trips.
     */
    public Map<String, Object> describe() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("model", type.getConfigName());
        addExtraParams(result);
        return result;
    }

    protected void addExtraParams(Map<String, Object> params) {
        // Override in subclasses to add extra parameters
    }

    /**
     * Bin zone ids into a count vector of the given length.
     */
    public static int[] countByZone(int[] zones, int zoneCount) {
        int[] counts = new int[zoneCount];
        for (int zone : zones) {
            if (zone < 0 || zone >= zoneCount) {
                throw new IllegalArgumentException("Zone " + zone + " outside [0, " + zoneCount + ")");
            }
            counts[zone]++;
        }
        return counts;
    }

    // ========================================================================
    // Factory Methods
    // ========================================================================

    /**
     * Create a saturation model.
     *
     * @param alpha Curvature; larger values saturate a zone with fewer drivers
     */
    public static SaturationModel saturation(double alpha) {
        return new SaturationModel(alpha);
    }

    /**
     * Create a split (coverage) model.
     */
    public static SplitModel split() {
        return new SplitModel();
    }

    /**
     * Create a model from its configuration name. {@code alpha} is ignored
     * by models that have no curvature parameter.
     */
    public static CongestionModel fromName(String name, double alpha) {
        switch (Type.fromConfigName(name)) {
            case SATURATION:
                return saturation(alpha);
            case SPLIT:
                return split();
            default:
                throw new IllegalArgumentException("Unsupported congestion model: " + name);
        }
    }

    // ========================================================================
    // Saturation: r = R·(1 − e^(−α·n))
    // ========================================================================

    public static class SaturationModel extends CongestionModel {
        private final double alpha;

        public SaturationModel(double alpha) {
            super(Type.SATURATION);
            if (!(alpha > 0) || Double.isInfinite(alpha)) {
                throw new IllegalArgumentException("Saturation alpha must be positive and finite, got " + alpha);
            }
            this.alpha = alpha;
        }

        @Override
        public double realized(int n, double baseRevenue) {
            if (n <= 0) {
                return 0.0;
            }
            return baseRevenue * (1.0 - Math.exp(-alpha * n));
        }

        public double getAlpha() {
            return alpha;
        }

        @Override
        protected void addExtraParams(Map<String, Object> params) {
            params.put("alpha", alpha);
        }

        @Override
        public String toString() {
            return String.format("SaturationModel[alpha=%.3f]", alpha);
        }
    }

    // ========================================================================
    // Split: r = R·[n > 0]
    // ========================================================================

    public static class SplitModel extends CongestionModel {

        public SplitModel() {
            super(Type.SPLIT);
        }

        @Override
        public double realized(int n, double baseRevenue) {
            return n > 0 ? baseRevenue : 0.0;
        }

        @Override
        public String toString() {
            return "SplitModel";
        }
    }
}

package org.carma.fleetalloc.mechanism;

import org.carma.fleetalloc.model.CongestionModel;
import org.carma.fleetalloc.model.Driver;

import java.util.*;

/**
 * Decides the target zone of every active driver for one slot.
 * The strategy state machine is parameterized by one of these, so the
 * allocator-driven strategy and the random baseline share a single loop.
 */
public interface AssignmentPolicy {

    /**
     * Choose target zones for this slot.
     *
     * @param active Active drivers, in population order
     * @param revenues Base revenue per zone for the current context
     * @param random Random source owned by the calling trial
     * @return target zone per active driver, index-aligned with {@code active}
     */
    int[] chooseTargets(List<Driver> active, double[] revenues, Random random);

    /**
     * Get policy name for reporting.
     */
    String getName();

    /**
     * Get short code for tables.
     */
    default String getCode() {
        return getName().substring(0, 1).toUpperCase(Locale.ROOT);
    }

    // ==========================================================================
    // POLICY IMPLEMENTATIONS
    // ==========================================================================

    /**
     * Greedy Policy: allocates zone counts greedily under the congestion
     * model, then hands the slots out by remaining hours.
     * Never consumes randomness.
     */
    class GreedyPolicy implements AssignmentPolicy {
        private final GreedyAllocator allocator;
        private final PriorityAssigner assigner;

        public GreedyPolicy(CongestionModel model) {
            this(new GreedyAllocator(model), new PriorityAssigner());
        }

        public GreedyPolicy(GreedyAllocator allocator, PriorityAssigner assigner) {
            this.allocator = Objects.requireNonNull(allocator, "Allocator cannot be null");
            this.assigner = Objects.requireNonNull(assigner, "Assigner cannot be null");
        }

        @Override
        public int[] chooseTargets(List<Driver> active, double[] revenues, Random random) {
            int[] counts = allocator.allocate(active.size(), revenues);
            return assigner.assign(active, counts);
        }

        public GreedyAllocator getAllocator() {
            return allocator;
        }

        @Override
        public String getName() {
            return "Allocator";
        }

        @Override
        public String getCode() {
            return "G";
        }
    }

    /**
     * Random Policy: every active driver draws a uniform zone,
     * independently, in population order. The comparison baseline.
     */
    class RandomPolicy implements AssignmentPolicy {

        @Override
        public int[] chooseTargets(List<Driver> active, double[] revenues, Random random) {
            int[] targets = new int[active.size()];
            for (int i = 0; i < targets.length; i++) {
                targets[i] = random.nextInt(revenues.length);
            }
            return targets;
        }

        @Override
        public String getName() {
            return "Random";
        }

        @Override
        public String getCode() {
            return "R";
        }
    }
}

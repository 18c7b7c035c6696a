package org.carma.fleetalloc.experiment;

import org.carma.fleetalloc.mechanism.RevenueOracle;
import org.carma.fleetalloc.model.RevenueTable;
import org.carma.fleetalloc.model.TrialOutcome;
import org.carma.fleetalloc.simulation.PairedSimulation;
import org.carma.fleetalloc.simulation.SimulationSettings;
import org.carma.fleetalloc.simulation.SimulationTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;

/**
 * Repeats the paired simulation over independent trials and aggregates
 * the totals.
 *
 * Trial i draws from its own random source derived from the base seed and
 * i, so results do not depend on execution order. With parallelism above 1
 * trials run on a fixed thread pool; outcomes are still reported in trial
 * order and match a sequential run exactly.
 */
public class ExperimentRunner {

    private static final Logger log = LoggerFactory.getLogger(ExperimentRunner.class);

    private final String name;
    private final int trials;
    private final long seed;
    private final int parallelism;
    private final SimulationSettings settings;

    public ExperimentRunner(Builder builder) {
        this.name = builder.name;
        this.trials = builder.trials;
        this.seed = builder.seed;
        this.parallelism = builder.parallelism;
        this.settings = builder.settings;
    }

    // ==========================================================================
    // Main Execution
    // ==========================================================================

    public ExperimentResult run(RevenueTable table) {
        return run(new RevenueOracle(table));
    }

    public ExperimentResult run(RevenueOracle oracle) {
        if (oracle.getTable().getZoneCount() != settings.getZones()) {
            log.warn("Revenue table has {} zones but the simulation uses {}",
                oracle.getTable().getZoneCount(), settings.getZones());
        }
        log.info("Starting experiment '{}': {} trials, seed={}, parallelism={}, {}",
            name, trials, seed, parallelism, settings);

        long start = System.currentTimeMillis();
        List<TrialOutcome> outcomes = parallelism == 1
            ? runSequential(oracle)
            : runParallel(oracle);
        ExperimentResult result = new ExperimentResult(name, outcomes, System.currentTimeMillis() - start);

        log.info("Experiment '{}' complete: winRate={}, uplift={}%", name,
            String.format("%.3f", result.getWinRate()), String.format("%.2f", result.getUpliftPercent()));
        return result;
    }

    /**
     * Re-run a single trial with its own seed. The returned trace carries
     * full slot records when the settings ask for them.
     */
    public SimulationTrace runTrial(RevenueOracle oracle, int trialIndex) {
        Random random = SeedSequence.trialRandom(seed, trialIndex);
        return new PairedSimulation(settings, oracle, random).run();
    }

    private List<TrialOutcome> runSequential(RevenueOracle oracle) {
        List<TrialOutcome> outcomes = new ArrayList<>(trials);
        for (int i = 0; i < trials; i++) {
            outcomes.add(runTrial(oracle, i).toOutcome(i));
            if ((i + 1) % 100 == 0) {
                log.debug("  Trial {}/{} complete", i + 1, trials);
            }
        }
        return outcomes;
    }

    private List<TrialOutcome> runParallel(RevenueOracle oracle) {
        ExecutorService executor = Executors.newFixedThreadPool(parallelism);
        try {
            List<Future<TrialOutcome>> futures = new ArrayList<>(trials);
            for (int i = 0; i < trials; i++) {
                final int trial = i;
                futures.add(executor.submit(() -> runTrial(oracle, trial).toOutcome(trial)));
            }
            List<TrialOutcome> outcomes = new ArrayList<>(trials);
            for (Future<TrialOutcome> future : futures) {
                outcomes.add(future.get());
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Experiment '" + name + "' interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Trial failed in experiment '" + name + "'", cause);
        } finally {
            shutdown(executor);
        }
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ==========================================================================
    // Accessors
    // ==========================================================================

    public String getName() { return name; }
    public int getTrials() { return trials; }
    public long getSeed() { return seed; }
    public int getParallelism() { return parallelism; }
    public SimulationSettings getSettings() { return settings; }

    // ==========================================================================
    // Builder
    // ==========================================================================

    public static class Builder {
        private String name = "experiment";
        private int trials = 1000;
        private long seed = 12345L;
        private int parallelism = 1;
        private SimulationSettings settings = SimulationSettings.builder().build();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder trials(int trials) {
            this.trials = trials;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder settings(SimulationSettings settings) {
            this.settings = settings;
            return this;
        }

        public ExperimentRunner build() {
            if (trials < 1) {
                throw new IllegalArgumentException("At least one trial required, got " + trials);
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("Parallelism must be at least 1, got " + parallelism);
            }
            Objects.requireNonNull(settings, "Settings cannot be null");
            return new ExperimentRunner(this);
        }
    }
}

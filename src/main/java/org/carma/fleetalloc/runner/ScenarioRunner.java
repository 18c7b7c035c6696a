package org.carma.fleetalloc.runner;

import org.carma.fleetalloc.config.ExperimentConfigLoader;
import org.carma.fleetalloc.config.ExperimentConfigLoader.ExperimentConfig;
import org.carma.fleetalloc.experiment.ExperimentResult;
import org.carma.fleetalloc.experiment.ExperimentRunner;
import org.carma.fleetalloc.mechanism.RevenueOracle;
import org.carma.fleetalloc.model.CongestionModel;
import org.carma.fleetalloc.model.RevenueTable;
import org.carma.fleetalloc.simulation.SimulationTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Executes experiments described by scenario directories.
 *
 * Key features:
 * - Loads and validates experiment.yaml
 * - Builds the synthetic revenue table, or takes one from the caller
 * - Runs the configured number of trials
 * - Reports the summary
 *
 * Usage:
 * <pre>
 * ScenarioRunner runner = new ScenarioRunner();
 * ScenarioResult result = runner.run(Paths.get("config/scenarios/downtown-saturation"));
 * System.out.println(result.experiment().getSummary());
 * </pre>
 */
public class ScenarioRunner {

    private static final Logger log = LoggerFactory.getLogger(ScenarioRunner.class);

    private final ExperimentConfigLoader loader;

    private boolean verbose = true;

    public ScenarioRunner() {
        this.loader = new ExperimentConfigLoader();
    }

    public ScenarioRunner verbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    /**
     * Configuration and outcome of one scenario run.
     */
    public record ScenarioResult(ExperimentConfig config, RevenueTable table, ExperimentResult experiment) {}

    // ========================================================================
    // MAIN EXECUTION
    // ========================================================================

    /**
     * Run a scenario whose revenue source is synthetic.
     *
     * @param scenarioDir Directory containing experiment.yaml
     */
    public ScenarioResult run(Path scenarioDir) throws IOException {
        ExperimentConfig config = loadConfig(scenarioDir);
        RevenueTable table = loader.buildSyntheticTable(config);
        report("Generated synthetic revenue table: " + table);
        return execute(config, table);
    }

    /**
     * Run a scenario against a revenue table loaded by the caller.
     */
    public ScenarioResult run(Path scenarioDir, RevenueTable table) throws IOException {
        Objects.requireNonNull(table, "Revenue table cannot be null");
        ExperimentConfig config = loadConfig(scenarioDir);
        report("Using supplied revenue table: " + table);
        return execute(config, table);
    }

    /**
     * Re-run one trial of a scenario with slot recording on, for inspection
     * or animation of the drivers' moves.
     */
    public SimulationTrace traceTrial(Path scenarioDir, RevenueTable table, int trialIndex) throws IOException {
        ExperimentConfig config = loadConfig(scenarioDir);
        ExperimentRunner runner = new ExperimentRunner.Builder()
            .name(config.name)
            .trials(1)
            .seed(config.seed)
            .settings(loader.buildSettings(config).toBuilder().recordSlots(true).build())
            .build();
        return runner.runTrial(new RevenueOracle(table), trialIndex);
    }

    private ExperimentConfig loadConfig(Path scenarioDir) throws IOException {
        report("Loading scenario from: " + scenarioDir);
        ExperimentConfig config = loader.loadExperiment(scenarioDir);
        report("Scenario: " + config.name);
        if (!config.description.isEmpty()) {
            report("Description: " + config.description);
        }
        return config;
    }

    private ScenarioResult execute(ExperimentConfig config, RevenueTable table) {
        ExperimentRunner runner = loader.buildRunner(config);
        report("Settings: " + runner.getSettings());
        CongestionModel model = runner.getSettings().getModel();
        report("Congestion: " + model.describe() + ", " + model.getType().getFormula());
        ExperimentResult result = runner.run(table);
        if (verbose) {
            for (String line : result.getSummary().split("\n")) {
                log.info(line);
            }
        }
        return new ScenarioResult(config, table, result);
    }

    private void report(String message) {
        if (verbose) {
            log.info(message);
        } else {
            log.debug(message);
        }
    }
}

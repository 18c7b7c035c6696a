package org.carma.fleetalloc.config;

import org.carma.fleetalloc.config.ExperimentConfigLoader.ConfigValidationException;
import org.carma.fleetalloc.config.ExperimentConfigLoader.ExperimentConfig;
import org.carma.fleetalloc.model.CongestionModel;
import org.carma.fleetalloc.model.RevenueTable;
import org.carma.fleetalloc.simulation.SimulationSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExperimentConfigLoaderTest {

    private final ExperimentConfigLoader loader = new ExperimentConfigLoader();

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static Path writeScenario(Path root, String name, String text) throws IOException {
        Path dir = Files.createDirectories(root.resolve("scenarios").resolve(name));
        Files.writeString(dir.resolve(ExperimentConfigLoader.EXPERIMENT_FILE), text);
        return dir;
    }

    @Test
    void loadExperiment_readsAllSections(@TempDir Path root) throws IOException {
        Path dir = writeScenario(root, "evening-rain", String.join("\n",
            "description: Evening rush in the rain",
            "seed: 7",
            "trials: 50",
            "parallelism: 2",
            "simulation:",
            "  drivers: 12",
            "  zones: 8",
            "  horizonHours: 4",
            "  startDay: 4",
            "  startTime: 18.0",
            "  weather: Rain",
            "  minInitialHours: 2",
            "  maxInitialHours: 6",
            "congestion:",
            "  model: split",
            "revenue:",
            "  source: table",
            ""));

        ExperimentConfig config = loader.loadExperiment(dir);

        assertEquals("evening-rain", config.name);
        assertEquals(7L, config.seed);
        assertEquals(50, config.trials);
        assertEquals(4, config.simulation.startDay.intValue());
        assertEquals(18.0, config.simulation.startTime.doubleValue());
        assertEquals(4.0, config.simulation.horizonHours);
        assertFalse(config.revenue.isSynthetic());

        SimulationSettings settings = loader.buildSettings(config);
        assertEquals(CongestionModel.Type.SPLIT, settings.getModel().getType());
        assertEquals("rain", settings.getWeather());
        assertEquals(8, settings.slotCount());
        assertEquals(2, settings.getMinInitialHours());
    }

    @Test
    void loadExperiment_emptyFileUsesDefaults() {
        ExperimentConfig config = loader.loadExperiment(yaml(""), "defaults");

        assertEquals("defaults", config.name);
        assertEquals(1000, config.trials);
        assertEquals(30, config.simulation.drivers);
        assertNull(config.simulation.startDay);
        assertEquals("saturation", config.congestion.model);
        assertTrue(config.revenue.isSynthetic());
    }

    @Test
    void loadExperiment_reportsEveryRangeError() {
        var e = assertThrows(ConfigValidationException.class, () -> loader.loadExperiment(yaml(String.join("\n",
            "name: broken",
            "trials: 0",
            "simulation:",
            "  zones: 0",
            "congestion:",
            "  model: bogus",
            "")), "broken"));

        assertEquals("broken", e.getSource());
        assertEquals(3, e.getErrors().size());
        assertTrue(e.getMessage().contains("trials"));
        assertTrue(e.getMessage().contains("bogus"));
    }

    @Test
    void loadExperiment_reportsTypeErrors() {
        var e = assertThrows(ConfigValidationException.class, () -> loader.loadExperiment(yaml(String.join("\n",
            "trials: many",
            "simulation:",
            "  horizonHours: long",
            "")), "typed"));

        assertEquals(2, e.getErrors().size());
    }

    @Test
    void loadExperiment_integerOverflowIsReportedNotWrapped() {
        var e = assertThrows(ConfigValidationException.class,
            () -> loader.loadExperiment(yaml("trials: 4294967297\n"), "overflow"));

        assertEquals(1, e.getErrors().size());
        assertTrue(e.getErrors().get(0).contains("trials is out of integer range"));
    }

    @Test
    void loadExperiment_infiniteValuesAreAggregated() {
        var e = assertThrows(ConfigValidationException.class, () -> loader.loadExperiment(yaml(String.join("\n",
            "simulation:",
            "  horizonHours: .inf",
            "congestion:",
            "  model: saturation",
            "  alpha: .inf",
            "")), "infinite"));

        assertEquals(2, e.getErrors().size());
        assertTrue(e.getMessage().contains("horizonHours"));
        assertTrue(e.getMessage().contains("alpha"));
    }

    @Test
    void buildSyntheticTable_appliesGeneratorSettings() {
        ExperimentConfig config = loader.loadExperiment(yaml(String.join("\n",
            "simulation:",
            "  zones: 2",
            "revenue:",
            "  weathers: [clear, Rain]",
            "  minBaseRevenue: 10.0",
            "  maxBaseRevenue: 10.0",
            "  timeOfDayAmplitude: 0",
            "  dayOfWeekAmplitude: 0",
            "")), "flat");

        RevenueTable table = loader.buildSyntheticTable(config);

        assertEquals(7 * 24 * 2 * 2, table.size());
        assertTrue(table.getRecords().stream().allMatch(r -> r.expectedRevenue() == 10.0));
        assertTrue(table.getRecords().stream().anyMatch(r -> r.weather().equals("rain")));
    }

    @Test
    void loadExperiment_rejectsInvalidGeneratorSettings() {
        var e = assertThrows(ConfigValidationException.class, () -> loader.loadExperiment(yaml(String.join("\n",
            "revenue:",
            "  weathers: []",
            "  minBaseRevenue: 30.0",
            "  maxBaseRevenue: 10.0",
            "  timeOfDayAmplitude: 1.5",
            "")), "bad-generator"));

        assertEquals(3, e.getErrors().size());
    }

    @Test
    void loadExperiment_rejectsDuplicateKeys() {
        assertThrows(YAMLException.class, () -> loader.loadExperiment(yaml("trials: 5\ntrials: 6\n"), "dup"));
    }

    @Test
    void loadExperiment_missingFileIsAnIOException(@TempDir Path root) {
        assertThrows(IOException.class, () -> loader.loadExperiment(root));
    }

    @Test
    void loadExperiment_classpathScenario() throws IOException {
        try (InputStream is = getClass().getResourceAsStream("/scenarios/skewed-demand/experiment.yaml")) {
            assertNotNull(is);
            ExperimentConfig config = loader.loadExperiment(is, "skewed-demand");

            assertEquals(200, config.trials);
            assertEquals(8.0, config.revenue.zoneMultipliers.get(2).doubleValue());

            RevenueTable table = loader.buildSyntheticTable(config);
            assertEquals(5, table.getZoneCount());
            assertEquals(2, loader.buildRunner(config).getParallelism());
        }
    }

    @Test
    void buildSyntheticTable_refusesTableSource() {
        ExperimentConfig config = loader.loadExperiment(yaml("revenue:\n  source: table\n"), "external");

        assertThrows(IllegalStateException.class, () -> loader.buildSyntheticTable(config));
    }

    @Test
    void buildSyntheticTable_revenueZonesOverrideSimulationZones() {
        ExperimentConfig config = loader.loadExperiment(yaml("simulation:\n  zones: 3\nrevenue:\n  zones: 5\n"), "wide");

        assertEquals(5, loader.buildSyntheticTable(config).getZoneCount());
    }

    @Test
    void listScenarios_findsDirectoriesWithExperimentFile(@TempDir Path root) throws IOException {
        writeScenario(root, "zeta", "trials: 1\n");
        writeScenario(root, "alpha", "trials: 1\n");
        Files.createDirectories(root.resolve("scenarios").resolve("empty"));

        assertEquals(List.of("alpha", "zeta"), loader.listScenarios(root));
        assertEquals(List.of(), loader.listScenarios(root.resolve("missing")));
    }
}

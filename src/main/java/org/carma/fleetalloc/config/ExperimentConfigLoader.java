package org.carma.fleetalloc.config;

import org.carma.fleetalloc.experiment.ExperimentRunner;
import org.carma.fleetalloc.model.*;
import org.carma.fleetalloc.simulation.SimulationSettings;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.*;
import java.math.BigInteger;
import java.nio.file.*;
import java.util.*;

/**
 * Loads experiment configurations from YAML files.
 *
 * An experiment consists of:
 * - Trial count, base seed and parallelism
 * - Simulation parameters (fleet size, zones, horizon, start context)
 * - Congestion model selection
 * - Revenue source (synthetic, or a table supplied by the caller)
 *
 * Directory structure:
 * <pre>
 * scenarios/
 *   downtown-saturation/
 *     experiment.yaml       # Experiment config
 * </pre>
 *
 * Example:
 * <pre>
 * name: downtown-saturation
 * seed: 12345
 * trials: 500
 * simulation:
 *   drivers: 30
 *   zones: 6
 *   horizonHours: 6.0
 *   weather: clear
 * congestion:
 *   model: saturation
 *   alpha: 0.6
 * revenue:
 *   source: synthetic
 * </pre>
 */
public class ExperimentConfigLoader {

    public static final String EXPERIMENT_FILE = "experiment.yaml";

    // ========================================================================
    // CONFIGURATION DATA CLASSES
    // ========================================================================

    /**
     * Root configuration for an experiment.
     */
    public static class ExperimentConfig {
        public String name;
        public String description;
        public long seed = 12345L;
        public int trials = 1000;
        public int parallelism = 1;
        public SimulationSection simulation = new SimulationSection();
        public CongestionSection congestion = new CongestionSection();
        public RevenueSection revenue = new RevenueSection();

        @Override
        public String toString() {
            return String.format("ExperimentConfig[name=%s, trials=%d, model=%s]",
                name, trials, congestion.model);
        }
    }

    /**
     * Simulation parameters; null start day/time means drawn per trial.
     */
    public static class SimulationSection {
        public int drivers = 30;
        public int zones = 6;
        public double horizonHours = 6.0;
        public Integer startDay;
        public Double startTime;
        public String weather = RevenueContext.DEFAULT_WEATHER;
        public int minInitialHours = 1;
        public int maxInitialHours = 8;
    }

    public static class CongestionSection {
        public String model = "saturation";
        public double alpha = 0.6;
    }

    /**
     * Where revenue comes from. {@code table} means the caller supplies a
     * {@link RevenueTable} loaded elsewhere.
     */
    public static class RevenueSection {
        public String source = "synthetic";
        public Integer zones;
        public long seed = 12345L;
        public Map<Integer, Double> zoneMultipliers = new LinkedHashMap<>();
        public List<String> weathers = new ArrayList<>(List.of(RevenueContext.DEFAULT_WEATHER));
        public double minBaseRevenue = 8.0;
        public double maxBaseRevenue = 25.0;
        public double timeOfDayAmplitude = 0.2;
        public double dayOfWeekAmplitude = 0.1;

        public boolean isSynthetic() {
            return "synthetic".equalsIgnoreCase(source);
        }
    }

    /**
     * Thrown when a configuration parses but holds invalid values.
     */
    public static class ConfigValidationException extends RuntimeException {
        private final String source;
        private final List<String> errors;

        public ConfigValidationException(String source, List<String> errors) {
            super("Invalid experiment configuration '" + source + "':\n  - "
                + String.join("\n  - ", errors));
            this.source = source;
            this.errors = List.copyOf(errors);
        }

        public String getSource() { return source; }
        public List<String> getErrors() { return errors; }
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    private final Yaml yaml;

    public ExperimentConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
    }

    /**
     * Load an experiment from a scenario directory.
     *
     * @param scenarioDir Directory containing experiment.yaml
     */
    public ExperimentConfig loadExperiment(Path scenarioDir) throws IOException {
        Path experimentFile = scenarioDir.resolve(EXPERIMENT_FILE);
        if (!Files.exists(experimentFile)) {
            throw new IOException(EXPERIMENT_FILE + " not found in: " + scenarioDir);
        }
        try (InputStream is = Files.newInputStream(experimentFile)) {
            return loadExperiment(is, scenarioDir.getFileName().toString());
        }
    }

    /**
     * Load an experiment from a stream.
     *
     * @param defaultName Name used when the file does not declare one
     */
    public ExperimentConfig loadExperiment(InputStream is, String defaultName) {
        Object raw = yaml.load(is);
        if (raw == null) {
            raw = new HashMap<String, Object>();
        }
        if (!(raw instanceof Map)) {
            throw new ConfigValidationException(defaultName, List.of("Top level must be a mapping"));
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) raw;
        ExperimentConfig config = parseExperimentConfig(map, defaultName);
        List<String> errors = validate(config);
        if (!errors.isEmpty()) {
            throw new ConfigValidationException(config.name, errors);
        }
        return config;
    }

    /**
     * Parse raw YAML into ExperimentConfig.
     */
    @SuppressWarnings("unchecked")
    private ExperimentConfig parseExperimentConfig(Map<String, Object> raw, String defaultName) {
        List<String> errors = new ArrayList<>();
        ExperimentConfig config = new ExperimentConfig();

        config.name = getString(raw, "name", defaultName);
        config.description = getString(raw, "description", "");
        config.seed = getLong(raw, "seed", config.seed, errors);
        config.trials = getInt(raw, "trials", config.trials, errors);
        config.parallelism = getInt(raw, "parallelism", config.parallelism, errors);

        Map<String, Object> simMap = getSection(raw, "simulation", errors);
        if (simMap != null) {
            SimulationSection sim = config.simulation;
            sim.drivers = getInt(simMap, "drivers", sim.drivers, errors);
            sim.zones = getInt(simMap, "zones", sim.zones, errors);
            sim.horizonHours = getDouble(simMap, "horizonHours", sim.horizonHours, errors);
            sim.startDay = simMap.get("startDay") != null ? getInt(simMap, "startDay", 0, errors) : null;
            sim.startTime = simMap.get("startTime") != null ? getDouble(simMap, "startTime", 0.0, errors) : null;
            sim.weather = getString(simMap, "weather", sim.weather);
            sim.minInitialHours = getInt(simMap, "minInitialHours", sim.minInitialHours, errors);
            sim.maxInitialHours = getInt(simMap, "maxInitialHours", sim.maxInitialHours, errors);
        }

        Map<String, Object> congestionMap = getSection(raw, "congestion", errors);
        if (congestionMap != null) {
            config.congestion.model = getString(congestionMap, "model", config.congestion.model);
            config.congestion.alpha = getDouble(congestionMap, "alpha", config.congestion.alpha, errors);
        }

        Map<String, Object> revenueMap = getSection(raw, "revenue", errors);
        if (revenueMap != null) {
            RevenueSection rev = config.revenue;
            rev.source = getString(revenueMap, "source", rev.source);
            rev.zones = revenueMap.get("zones") != null ? getInt(revenueMap, "zones", 0, errors) : null;
            rev.seed = getLong(revenueMap, "seed", rev.seed, errors);
            rev.minBaseRevenue = getDouble(revenueMap, "minBaseRevenue", rev.minBaseRevenue, errors);
            rev.maxBaseRevenue = getDouble(revenueMap, "maxBaseRevenue", rev.maxBaseRevenue, errors);
            rev.timeOfDayAmplitude = getDouble(revenueMap, "timeOfDayAmplitude", rev.timeOfDayAmplitude, errors);
            rev.dayOfWeekAmplitude = getDouble(revenueMap, "dayOfWeekAmplitude", rev.dayOfWeekAmplitude, errors);
            Object weathers = revenueMap.get("weathers");
            if (weathers instanceof List) {
                rev.weathers = new ArrayList<>();
                for (Object weather : (List<Object>) weathers) {
                    rev.weathers.add(String.valueOf(weather));
                }
            } else if (weathers != null) {
                errors.add("revenue.weathers must be a list");
            }
            Object multipliers = revenueMap.get("zoneMultipliers");
            if (multipliers instanceof Map) {
                for (var entry : ((Map<Object, Object>) multipliers).entrySet()) {
                    try {
                        int zone = Integer.parseInt(entry.getKey().toString());
                        rev.zoneMultipliers.put(zone, ((Number) entry.getValue()).doubleValue());
                    } catch (NumberFormatException | ClassCastException e) {
                        errors.add("revenue.zoneMultipliers entry '" + entry.getKey() + "' must map a zone id to a number");
                    }
                }
            } else if (multipliers != null) {
                errors.add("revenue.zoneMultipliers must be a mapping");
            }
        }

        if (!errors.isEmpty()) {
            throw new ConfigValidationException(config.name, errors);
        }
        return config;
    }

    /**
     * Check value ranges. Returns all problems found, empty if valid.
     */
    public List<String> validate(ExperimentConfig config) {
        List<String> errors = new ArrayList<>();
        if (config.trials < 1) errors.add("trials must be at least 1, got " + config.trials);
        if (config.parallelism < 1) errors.add("parallelism must be at least 1, got " + config.parallelism);

        SimulationSection sim = config.simulation;
        if (sim.drivers < 0) errors.add("simulation.drivers cannot be negative, got " + sim.drivers);
        if (sim.zones < 1) errors.add("simulation.zones must be at least 1, got " + sim.zones);
        if (!(sim.horizonHours > 0) || !Double.isFinite(sim.horizonHours)) {
            errors.add("simulation.horizonHours must be positive and finite, got " + sim.horizonHours);
        }
        if (sim.startDay != null && (sim.startDay < 0 || sim.startDay > 6)) {
            errors.add("simulation.startDay must be in [0, 6], got " + sim.startDay);
        }
        if (sim.startTime != null && !(sim.startTime >= 0 && sim.startTime < 24)) {
            errors.add("simulation.startTime must be in [0, 24), got " + sim.startTime);
        }
        if (sim.minInitialHours < 1 || sim.maxInitialHours < sim.minInitialHours) {
            errors.add("simulation initial hours range [" + sim.minInitialHours + ", "
                + sim.maxInitialHours + "] is invalid");
        }

        try {
            CongestionModel.Type type = CongestionModel.Type.fromConfigName(config.congestion.model);
            if (type == CongestionModel.Type.SATURATION
                    && (!(config.congestion.alpha > 0) || !Double.isFinite(config.congestion.alpha))) {
                errors.add("congestion.alpha must be positive and finite for the saturation model, got "
                    + config.congestion.alpha);
            }
        } catch (IllegalArgumentException e) {
            errors.add("congestion.model: " + e.getMessage());
        }

        RevenueSection rev = config.revenue;
        if (!rev.isSynthetic() && !"table".equalsIgnoreCase(rev.source)) {
            errors.add("revenue.source must be 'synthetic' or 'table', got '" + rev.source + "'");
        }
        if (rev.zones != null && rev.zones < 1) {
            errors.add("revenue.zones must be at least 1, got " + rev.zones);
        }
        for (var entry : rev.zoneMultipliers.entrySet()) {
            if (!(entry.getValue() >= 0) || !Double.isFinite(entry.getValue())) {
                errors.add("revenue.zoneMultipliers[" + entry.getKey() + "] must be non-negative and finite");
            }
        }
        if (!(rev.minBaseRevenue >= 0) || !Double.isFinite(rev.maxBaseRevenue)
                || !(rev.maxBaseRevenue >= rev.minBaseRevenue)) {
            errors.add("revenue base bounds [" + rev.minBaseRevenue + ", " + rev.maxBaseRevenue + "] are invalid");
        }
        if (!(rev.timeOfDayAmplitude >= 0 && rev.timeOfDayAmplitude <= 1)) {
            errors.add("revenue.timeOfDayAmplitude must be in [0, 1], got " + rev.timeOfDayAmplitude);
        }
        if (!(rev.dayOfWeekAmplitude >= 0 && rev.dayOfWeekAmplitude <= 1)) {
            errors.add("revenue.dayOfWeekAmplitude must be in [0, 1], got " + rev.dayOfWeekAmplitude);
        }
        if (rev.weathers.isEmpty()) {
            errors.add("revenue.weathers cannot be empty");
        }
        return errors;
    }

    // ========================================================================
    // BUILDING
    // ========================================================================

    public CongestionModel buildModel(ExperimentConfig config) {
        return CongestionModel.fromName(config.congestion.model, config.congestion.alpha);
    }

    public SimulationSettings buildSettings(ExperimentConfig config) {
        SimulationSection sim = config.simulation;
        return SimulationSettings.builder()
            .drivers(sim.drivers)
            .zones(sim.zones)
            .horizonHours(sim.horizonHours)
            .startDay(sim.startDay)
            .startTime(sim.startTime)
            .weather(sim.weather)
            .model(buildModel(config))
            .initialHours(sim.minInitialHours, sim.maxInitialHours)
            .build();
    }

    public ExperimentRunner buildRunner(ExperimentConfig config) {
        return new ExperimentRunner.Builder()
            .name(config.name)
            .trials(config.trials)
            .seed(config.seed)
            .parallelism(config.parallelism)
            .settings(buildSettings(config))
            .build();
    }

    /**
     * Generate the synthetic revenue table the config describes.
     *
     * @throws IllegalStateException if the config expects a caller-supplied table
     */
    public RevenueTable buildSyntheticTable(ExperimentConfig config) {
        if (!config.revenue.isSynthetic()) {
            throw new IllegalStateException("Experiment '" + config.name + "' expects a supplied revenue table");
        }
        RevenueSection rev = config.revenue;
        RevenueTableGenerator generator = new RevenueTableGenerator(rev.seed)
            .setBaseRevenueBounds(rev.minBaseRevenue, rev.maxBaseRevenue)
            .setTimeOfDayAmplitude(rev.timeOfDayAmplitude)
            .setDayOfWeekAmplitude(rev.dayOfWeekAmplitude)
            .setWeathers(rev.weathers);
        for (var entry : rev.zoneMultipliers.entrySet()) {
            generator.setZoneMultiplier(entry.getKey(), entry.getValue());
        }
        int zones = config.revenue.zones != null ? config.revenue.zones : config.simulation.zones;
        return generator.generate(zones);
    }

    // ========================================================================
    // UTILITY METHODS
    // ========================================================================

    /**
     * List all available scenarios in the config/scenarios directory.
     */
    public List<String> listScenarios(Path configRoot) throws IOException {
        Path scenariosDir = configRoot.resolve("scenarios");
        if (!Files.exists(scenariosDir)) {
            return Collections.emptyList();
        }

        List<String> scenarios = new ArrayList<>();
        try (var stream = Files.list(scenariosDir)) {
            stream.filter(Files::isDirectory)
                  .filter(p -> Files.exists(p.resolve(EXPERIMENT_FILE)))
                  .map(p -> p.getFileName().toString())
                  .sorted()
                  .forEach(scenarios::add);
        }
        return scenarios;
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    @SuppressWarnings("unchecked")
    private Map<String, Object> getSection(Map<String, Object> map, String key, List<String> errors) {
        Object value = map.get(key);
        if (value == null) return null;
        if (value instanceof Map) return (Map<String, Object>) value;
        errors.add(key + " must be a mapping");
        return null;
    }

    private String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue, List<String> errors) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Integer) {
            return (Integer) value;
        }
        if (value instanceof Long || value instanceof BigInteger) {
            errors.add(key + " is out of integer range: " + value);
            return defaultValue;
        }
        errors.add(key + " must be an integer, got '" + value + "'");
        return defaultValue;
    }

    private long getLong(Map<String, Object> map, String key, long defaultValue, List<String> errors) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger) {
            errors.add(key + " is out of long range: " + value);
            return defaultValue;
        }
        errors.add(key + " must be an integer, got '" + value + "'");
        return defaultValue;
    }

    private double getDouble(Map<String, Object> map, String key, double defaultValue, List<String> errors) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        errors.add(key + " must be a number, got '" + value + "'");
        return defaultValue;
    }
}

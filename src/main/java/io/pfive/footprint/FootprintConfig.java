// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint;

import io.pfive.footprint.exception.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.OptionalLong;
import java.util.Properties;
import java.util.Set;

/// Tuning constants for footprint computation, read from a properties file. The defaults ship in
/// the footprint.properties classpath resource and give the standard footprint method.
public final class FootprintConfig {

    private static final String DEFAULTS_RESOURCE = "/footprint.properties";

    static final String EPOCH_BOUNDARIES = "epoch-boundaries-minutes";
    static final String BANDWIDTH_CALIBRATION = "bandwidth-calibration";
    static final String BANDWIDTH_FLOOR_DIVISOR = "bandwidth-floor-divisor";
    static final String KERNEL_TRUNCATION_SIGMAS = "kernel-truncation-sigmas";
    static final String BOOTSTRAP_ITERATIONS = "bootstrap-iterations";
    static final String BOOTSTRAP_SAMPLE_SIZE = "bootstrap-sample-size";
    static final String WORKER_THREADS = "worker-threads";
    static final String RANDOM_SEED = "random-seed";

    private static final Set<String> KNOWN_KEYS = Set.of(
          EPOCH_BOUNDARIES, BANDWIDTH_CALIBRATION, BANDWIDTH_FLOOR_DIVISOR, KERNEL_TRUNCATION_SIGMAS,
          BOOTSTRAP_ITERATIONS, BOOTSTRAP_SAMPLE_SIZE, WORKER_THREADS, RANDOM_SEED
    );

    private final double[] epochBoundariesMinutes;
    public final double bandwidthCalibration;
    public final double bandwidthFloorDivisor;
    public final double kernelTruncationSigmas;
    public final int bootstrapIterations;
    public final int bootstrapSampleSize;
    /// Zero selects a count based on the available processors, see workerThreads().
    public final int workerThreads;
    public final OptionalLong randomSeed;

    private FootprintConfig (Properties properties) {
        for (String key : properties.stringPropertyNames()) {
            if (!KNOWN_KEYS.contains(key)) throw new ConfigurationException("Unknown configuration key: " + key);
        }
        epochBoundariesMinutes = doubleListVal(properties, EPOCH_BOUNDARIES);
        bandwidthCalibration = positiveDoubleVal(properties, BANDWIDTH_CALIBRATION);
        bandwidthFloorDivisor = positiveDoubleVal(properties, BANDWIDTH_FLOOR_DIVISOR);
        kernelTruncationSigmas = positiveDoubleVal(properties, KERNEL_TRUNCATION_SIGMAS);
        bootstrapIterations = intVal(properties, BOOTSTRAP_ITERATIONS);
        bootstrapSampleSize = intVal(properties, BOOTSTRAP_SAMPLE_SIZE);
        workerThreads = intVal(properties, WORKER_THREADS);
        randomSeed = optionalLongVal(properties, RANDOM_SEED);
        if (bootstrapIterations < 1) throw invalid(BOOTSTRAP_ITERATIONS, "must be at least 1");
        if (bootstrapSampleSize < 2) throw invalid(BOOTSTRAP_SAMPLE_SIZE, "must be at least 2");
        if (workerThreads < 0) throw invalid(WORKER_THREADS, "must not be negative");
    }

    public static FootprintConfig defaults () {
        return new FootprintConfig(defaultProperties());
    }

    /// Values in the given file override the defaults.
    public static FootprintConfig load (Path path) {
        Properties properties = defaultProperties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + path, e);
        }
        return new FootprintConfig(properties);
    }

    /// Values in the given properties override the defaults.
    public static FootprintConfig withOverrides (Properties overrides) {
        Properties properties = defaultProperties();
        properties.putAll(overrides);
        return new FootprintConfig(properties);
    }

    private static Properties defaultProperties () {
        Properties properties = new Properties();
        try (InputStream in = FootprintConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) throw new ConfigurationException("Missing classpath resource " + DEFAULTS_RESOURCE);
            properties.load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read classpath resource " + DEFAULTS_RESOURCE, e);
        }
        return properties;
    }

    public double[] epochBoundariesMinutes () {
        return epochBoundariesMinutes.clone();
    }

    /// The number of threads to use, resolving zero to half the available processors. Do not use
    /// the "hyperthreading" cores, leaving capacity for garbage collection and other receptors
    /// running in the same JVM.
    public int workerThreads () {
        if (workerThreads > 0) return workerThreads;
        return Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
    }

    private static ConfigurationException invalid (String key, String problem) {
        return new ConfigurationException(String.format("Configuration key '%s' %s.", key, problem));
    }

    private static String stringVal (Properties properties, String key) {
        String val = properties.getProperty(key);
        if (val == null) throw new ConfigurationException("Missing configuration key: " + key);
        return val.trim();
    }

    private static int intVal (Properties properties, String key) {
        String val = stringVal(properties, key);
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as integer.", val, key);
            throw new ConfigurationException(message, e);
        }
    }

    private static double positiveDoubleVal (Properties properties, String key) {
        String val = stringVal(properties, key);
        double d;
        try {
            d = Double.parseDouble(val);
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as a number.", val, key);
            throw new ConfigurationException(message, e);
        }
        if (!(d > 0) || Double.isInfinite(d)) throw invalid(key, "must be a positive finite number");
        return d;
    }

    private static double[] doubleListVal (Properties properties, String key) {
        String val = stringVal(properties, key);
        try {
            double[] values = Arrays.stream(val.split(",")).map(String::trim).mapToDouble(Double::parseDouble).toArray();
            for (int i = 0; i < values.length; i++) {
                if (!(values[i] > 0) || (i > 0 && values[i] <= values[i - 1])) {
                    throw invalid(key, "must be positive and strictly increasing");
                }
            }
            return values;
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as numbers.", val, key);
            throw new ConfigurationException(message, e);
        }
    }

    private static OptionalLong optionalLongVal (Properties properties, String key) {
        String val = properties.getProperty(key);
        if (val == null || val.isBlank()) return OptionalLong.empty();
        try {
            return OptionalLong.of(Long.parseLong(val.trim()));
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as integer.", val, key);
            throw new ConfigurationException(message, e);
        }
    }

    @Override
    public String toString () {
        return String.format("FootprintConfig(epochs=%s, calibration=%s, floorDivisor=%s, truncation=%s, " +
                    "bootstrap=%dx%d, workers=%d)",
              Arrays.toString(epochBoundariesMinutes), bandwidthCalibration, bandwidthFloorDivisor,
              kernelTruncationSigmas, bootstrapIterations, bootstrapSampleSize, workerThreads);
    }
}

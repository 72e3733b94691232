package org.boc.config;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.boc.BocException;
import org.boc.belief.DecayCurve;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;

/**
 * Settings of the belief store, read from a properties file with the keys in {@link BocParams}.
 * Keys that are absent keep their built-in default.
 */
public final class BocConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(BocConfiguration.class);

    public static final DecayCurve DEFAULT_DECAY_CURVE = DecayCurve.EXPONENTIAL;
    public static final double DEFAULT_DECAY_RATE = 0.1;
    public static final Duration DEFAULT_DECAY_PERIOD = Duration.ofHours(1);
    public static final double DEFAULT_CONFLICT_PENALTY = 0.3;
    public static final double DEFAULT_CONFLICT_HIGH_FACTOR = 0.5;
    public static final double DEFAULT_CONFLICT_MODERATE_FACTOR = 0.8;

    private final DecayCurve decayCurve;
    private final double decayRate;
    private final Duration decayPeriod;
    private final double conflictPenalty;
    private final double conflictHighFactor;
    private final double conflictModerateFactor;

    BocConfiguration(Configuration config) {
        try {
            this.decayCurve = DecayCurve.fromName(config.getString(BocParams.DECAY_CURVE, DEFAULT_DECAY_CURVE.name()));
            this.decayRate = config.getDouble(BocParams.DECAY_RATE, DEFAULT_DECAY_RATE);
            this.decayPeriod = Duration.parse(config.getString(BocParams.DECAY_PERIOD, DEFAULT_DECAY_PERIOD.toString()));
            this.conflictPenalty = config.getDouble(BocParams.CONFLICT_PENALTY, DEFAULT_CONFLICT_PENALTY);
            this.conflictHighFactor = config.getDouble(BocParams.CONFLICT_HIGH_FACTOR, DEFAULT_CONFLICT_HIGH_FACTOR);
            this.conflictModerateFactor = config.getDouble(BocParams.CONFLICT_MODERATE_FACTOR, DEFAULT_CONFLICT_MODERATE_FACTOR);
        } catch (DateTimeParseException e) {
            throw new BocException("Invalid " + BocParams.DECAY_PERIOD + ": " + e.getParsedString(), e);
        } catch (RuntimeException e) {
            // ConversionException for malformed numbers, ValueException for an unknown curve
            throw new BocException("Invalid BOC configuration: " + e.getMessage(), e);
        }
        if (decayPeriod.isZero() || decayPeriod.isNegative()) {
            throw new BocException(BocParams.DECAY_PERIOD + " must be positive, got " + decayPeriod);
        }
    }

    public static BocConfiguration defaults() {
        return new BocConfiguration(new PropertiesConfiguration());
    }

    /**
     * Reads {@value BocParams#DEFAULT_RESOURCE} from the classpath, falling back to the defaults
     * when the resource is missing.
     */
    public static BocConfiguration load() {
        return loadResource(BocParams.DEFAULT_RESOURCE);
    }

    public static BocConfiguration loadResource(String resourceName) {
        InputStream input = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourceName);
        if (input == null) {
            LOG.info("No {} on the classpath, using default configuration", resourceName);
            return defaults();
        }
        LOG.info("Loading configuration from classpath resource: {}", resourceName);
        try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
            return new BocConfiguration(read(reader));
        } catch (IOException | ConfigurationException e) {
            throw new BocException("Failed to read configuration resource: " + resourceName, e);
        }
    }

    public static BocConfiguration loadFile(Path path) {
        LOG.info("Loading configuration from file: {}", path.toAbsolutePath());
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return new BocConfiguration(read(reader));
        } catch (IOException | ConfigurationException e) {
            throw new BocException("Failed to read configuration file: " + path, e);
        }
    }

    private static Configuration read(Reader reader) throws ConfigurationException, IOException {
        PropertiesConfiguration config = new PropertiesConfiguration();
        config.read(reader);
        return config;
    }

    public DecayCurve getDecayCurve() {
        return decayCurve;
    }

    public double getDecayRate() {
        return decayRate;
    }

    public Duration getDecayPeriod() {
        return decayPeriod;
    }

    public double getConflictPenalty() {
        return conflictPenalty;
    }

    public double getConflictHighFactor() {
        return conflictHighFactor;
    }

    public double getConflictModerateFactor() {
        return conflictModerateFactor;
    }

    @Override
    public String toString() {
        return String.format("BocConfiguration{decay=%s %s per %s, conflict penalty=%s, factors=%s/%s}",
                decayCurve, decayRate, decayPeriod, conflictPenalty, conflictHighFactor, conflictModerateFactor);
    }
}

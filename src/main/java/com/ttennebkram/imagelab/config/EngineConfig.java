package com.ttennebkram.imagelab.config;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.ttennebkram.imagelab.ValidationException;
import com.ttennebkram.imagelab.processing.EqualizationMode;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Engine settings, read from the classpath resource {@value #RESOURCE} when present.
 *
 * <pre>
 * {
 *   "history_limit": 0,
 *   "equalization_mode": "per_channel",
 *   "random_seed": 42
 * }
 * </pre>
 */
public final class EngineConfig {

    public static final String RESOURCE = "imagelab.json";

    private static final Logger LOG = Logger.getLogger(EngineConfig.class.getName());

    private static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();

    // Gson populates these by reflection; absent fields keep their defaults
    private int historyLimit = 0;
    private String equalizationMode = EqualizationMode.PER_CHANNEL.wireName();
    private Long randomSeed = null;

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * Load {@value #RESOURCE} from the context class loader, or return defaults if it is missing.
     */
    public static EngineConfig load() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = EngineConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                LOG.fine("No " + RESOURCE + " on the classpath, using defaults");
                return defaults();
            }
            return fromJson(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    public static EngineConfig fromJson(Reader reader) {
        EngineConfig config;
        try {
            config = GSON.fromJson(reader, EngineConfig.class);
        } catch (JsonParseException e) {
            throw new ValidationException("Invalid engine configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            return defaults();
        }
        config.validate();
        return config;
    }

    private void validate() {
        if (historyLimit < 0) {
            throw new ValidationException("history_limit must be >= 0, got " + historyLimit);
        }
        if (equalizationMode == null) {
            equalizationMode = EqualizationMode.PER_CHANNEL.wireName();
        }
        // Fails fast on an unknown mode
        EqualizationMode.fromWireName(equalizationMode);
    }

    // ===== Copy-on-write setters =====

    public EngineConfig withHistoryLimit(int limit) {
        EngineConfig copy = copy();
        copy.historyLimit = limit;
        copy.validate();
        return copy;
    }

    public EngineConfig withEqualizationMode(EqualizationMode mode) {
        EngineConfig copy = copy();
        copy.equalizationMode = mode.wireName();
        return copy;
    }

    public EngineConfig withRandomSeed(long seed) {
        EngineConfig copy = copy();
        copy.randomSeed = seed;
        return copy;
    }

    private EngineConfig copy() {
        EngineConfig copy = new EngineConfig();
        copy.historyLimit = historyLimit;
        copy.equalizationMode = equalizationMode;
        copy.randomSeed = randomSeed;
        return copy;
    }

    // ===== Accessors =====

    /** Maximum undo depth per session; 0 means unbounded. */
    public int getHistoryLimit() {
        return historyLimit;
    }

    public EqualizationMode getEqualizationMode() {
        return EqualizationMode.fromWireName(equalizationMode);
    }

    public boolean hasRandomSeed() {
        return randomSeed != null;
    }

    /**
     * Random source for noise synthesis: seeded when a seed is configured.
     */
    public Random newRandom() {
        return randomSeed != null ? new Random(randomSeed) : new Random();
    }

    @Override
    public String toString() {
        return "EngineConfig{historyLimit=" + historyLimit
                + ", equalizationMode=" + equalizationMode
                + ", randomSeed=" + randomSeed + "}";
    }
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Immutable pipeline configuration.
 *
 * <p>Built once at process start by {@link #load()} (or by one of the factory methods in tests)
 * and handed to every component factory. Components never read system properties or the
 * environment themselves.</p>
 *
 * <p>Resolution order for {@link #load()}:</p>
 * <ol>
 *   <li>Properties file named by {@code -Dsk.config.path} or the {@code SK_CONFIG_PATH} environment variable.</li>
 *   <li>Well-known deployment environment variables (see {@link #ENV_ALIASES}), which win over the file.</li>
 * </ol>
 */
public final class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String CONFIG_PATH_PROPERTY = "sk.config.path";
    public static final String CONFIG_PATH_ENV = "SK_CONFIG_PATH";

    /**
     * Environment variable name -> configuration key.
     */
    public static final Map<String, String> ENV_ALIASES;

    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("API_BASE_URL", "source.rest.url");
        m.put("MONGO_URI", "mongodb.uri");
        m.put("MONGO_DB", "mongodb.database");
        m.put("MONGO_RAW_COLLECTION", "mongodb.collection");
        m.put("POSTGRES_HOST", "postgres.host");
        m.put("POSTGRES_PORT", "postgres.port");
        m.put("POSTGRES_DB", "postgres.database");
        m.put("POSTGRES_USER", "postgres.username");
        m.put("POSTGRES_PASSWORD", "postgres.password");
        m.put("POSTGRES_STAGING_TABLE", "postgres.staging.table");
        ENV_ALIASES = Collections.unmodifiableMap(m);
    }

    private final Map<String, String> values;

    private PipelineConfig(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
    }

    // --- FACTORIES ---

    /**
     * Reads the process configuration (file + environment). Call once from {@code main}.
     */
    public static PipelineConfig load() {
        String path = System.getProperty(CONFIG_PATH_PROPERTY);
        if (path == null || path.isBlank()) {
            path = System.getenv(CONFIG_PATH_ENV);
        }
        return load(path == null || path.isBlank() ? null : Path.of(path), System.getenv());
    }

    /**
     * Visible for tests: explicit file and environment snapshot.
     *
     * @param file properties file, or {@code null} to rely on the environment only
     * @param environment environment variables to overlay
     */
    public static PipelineConfig load(Path file, Map<String, String> environment) {
        Map<String, String> merged = new HashMap<>();

        if (file != null) {
            Properties props = new Properties();
            try (InputStream is = Files.newInputStream(file)) {
                props.load(is);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load configuration file: " + file, e);
            }
            for (String name : props.stringPropertyNames()) {
                merged.put(name, props.getProperty(name));
            }
            log.info("Loaded {} properties from {}", props.size(), file);
        } else {
            log.warn("No configuration file specified (-D{} or {}). Using environment only.",
                    CONFIG_PATH_PROPERTY, CONFIG_PATH_ENV);
        }

        if (environment != null) {
            for (Map.Entry<String, String> alias : ENV_ALIASES.entrySet()) {
                String v = environment.get(alias.getKey());
                if (v != null && !v.isBlank()) {
                    merged.put(alias.getValue(), v);
                    log.debug("Config key '{}' taken from environment variable {}", alias.getValue(), alias.getKey());
                }
            }
        }
        return new PipelineConfig(merged);
    }

    public static PipelineConfig fromProperties(Properties props) {
        Map<String, String> map = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return new PipelineConfig(map);
    }

    public static PipelineConfig fromMap(Map<String, String> map) {
        return new PipelineConfig(map);
    }

    /**
     * Returns a copy with one key replaced.
     */
    public PipelineConfig with(String key, String value) {
        Map<String, String> copy = new HashMap<>(values);
        copy.put(key, value);
        return new PipelineConfig(copy);
    }

    // --- ACCESSORS ---

    public String getString(String key, String defaultValue) {
        String v = values.get(key);
        return v == null ? defaultValue : v;
    }

    /**
     * @throws IllegalArgumentException if the key is missing or blank
     */
    public String require(String key) {
        String v = values.get(key);
        if (v == null) {
            throw new IllegalArgumentException("Missing required configuration key: " + key);
        }
        String s = v.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Blank value for required configuration key: " + key);
        }
        return s;
    }

    public int getInt(String key, int defaultValue) {
        String val = values.get(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Config key '{}' is not an int ('{}'). Using default {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = values.get(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Config key '{}' is not a long ('{}'). Using default {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = values.get(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    /**
     * Comma separated list; blank entries are dropped.
     */
    public List<String> getList(String key, List<String> defaultValue) {
        String val = values.get(key);
        if (val == null || val.isBlank()) return defaultValue;
        List<String> out = new ArrayList<>();
        for (String part : val.split(",")) {
            String s = part.trim();
            if (!s.isEmpty()) out.add(s);
        }
        return Collections.unmodifiableList(out);
    }

    public boolean hasPath(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.config;

import com.intuitivedesigns.saleskernel.core.CanonicalRecord;
import com.intuitivedesigns.saleskernel.core.OutputSink;
import com.intuitivedesigns.saleskernel.core.PipelineOrchestrator;
import com.intuitivedesigns.saleskernel.core.RawStore;
import com.intuitivedesigns.saleskernel.core.SourceConnector;
import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;
import com.intuitivedesigns.saleskernel.spi.*;
import com.intuitivedesigns.saleskernel.store.InMemoryRawStorePlugin;
import com.intuitivedesigns.saleskernel.transform.BatchTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

public final class PipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    // Config keys
    public static final String KEY_SOURCE_TYPE = "source.type";
    public static final String KEY_RAWSTORE_TYPE = "rawstore.type";
    public static final String KEY_SINK_TYPE = "sink.type";

    // Defaults
    private static final String DEFAULT_SOURCE = "REST";
    private static final String DEFAULT_RAWSTORE = InMemoryRawStorePlugin.ID;
    private static final String DEFAULT_SINK = "POSTGRES";

    private final PluginCatalog catalog;

    public PipelineFactory() {
        this(new PluginCatalog(resolveClassLoader()));
    }

    public PipelineFactory(PluginCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    // --- FACTORY METHODS ---

    @SuppressWarnings("unchecked")
    public SourceConnector<Map<String, Object>> createSource(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = normalizeId(config.getString(KEY_SOURCE_TYPE, DEFAULT_SOURCE), DEFAULT_SOURCE);
        final SourcePlugin plugin = catalog.sources().require(id, KEY_SOURCE_TYPE);
        return (SourceConnector<Map<String, Object>>) createSafe(plugin, config, metrics, "Source");
    }

    @SuppressWarnings("unchecked")
    public RawStore<Map<String, Object>> createRawStore(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = normalizeId(config.getString(KEY_RAWSTORE_TYPE, DEFAULT_RAWSTORE), DEFAULT_RAWSTORE);
        final RawStorePlugin plugin = catalog.rawStores().require(id, KEY_RAWSTORE_TYPE);
        return (RawStore<Map<String, Object>>) createSafe(plugin, config, metrics, "Raw Store");
    }

    @SuppressWarnings("unchecked")
    public OutputSink<CanonicalRecord> createSink(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = normalizeId(config.getString(KEY_SINK_TYPE, DEFAULT_SINK), DEFAULT_SINK);
        final SinkPlugin plugin = catalog.sinks().require(id, KEY_SINK_TYPE);
        return (OutputSink<CanonicalRecord>) createSafe(plugin, config, metrics, "Sink");
    }

    /**
     * Wires a complete pipeline. Components built before a failing one are closed.
     */
    public PipelineOrchestrator createPipeline(PipelineConfig config, MetricsRuntime metrics) {
        final SourceConnector<Map<String, Object>> source = createSource(config, metrics);
        final RawStore<Map<String, Object>> rawStore = createRawStore(config, metrics);
        final OutputSink<CanonicalRecord> sink;
        try {
            sink = createSink(config, metrics);
        } catch (RuntimeException e) {
            closeQuietly(rawStore, e);
            throw e;
        }
        return new PipelineOrchestrator(source, rawStore, new BatchTransformer(metrics), sink, metrics);
    }

    // --- UTILITIES ---

    public void logAvailablePlugins() {
        log.info("Plugin Catalog Loaded:");
        log.info("  Sources:    {}", catalog.sources().availableIds());
        log.info("  Raw Stores: {}", catalog.rawStores().availableIds());
        log.info("  Sinks:      {}", catalog.sinks().availableIds());
    }

    private static String normalizeId(String raw, String fallback) {
        if (raw == null) return fallback;
        final String s = raw.trim();
        return s.isEmpty() ? fallback : s;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : PipelineFactory.class.getClassLoader();
    }

    private static void closeQuietly(AutoCloseable c, Exception primary) {
        try {
            c.close();
        } catch (Exception suppressed) {
            primary.addSuppressed(suppressed);
        }
    }

    private static <T> T createSafe(PipelinePlugin<T> plugin,
                                    PipelineConfig config,
                                    MetricsRuntime metrics,
                                    String typeName) {
        Objects.requireNonNull(plugin, "plugin");
        try {
            return plugin.create(config, metrics);
        } catch (Exception e) {
            throw new IllegalStateException("Failed creating " + typeName + " [" + plugin.id() + "]", e);
        }
    }
}

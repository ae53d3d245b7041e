/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.core;

import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one batch end to end:
 * schema, extract, raw store, raw read, transform, staging load, warehouse population.
 *
 * <p>Stages run strictly in order. The first failing stage ends the run; the failure is
 * logged and reported through {@link PipelineResult}, never thrown.</p>
 */
public class PipelineOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final SourceConnector<Map<String, Object>> source;
    private final RawStore<Map<String, Object>> rawStore;
    private final Transformer<Map<String, Object>, CanonicalRecord> transformer;
    private final OutputSink<CanonicalRecord> sink;
    private final MetricsRuntime metrics;

    public PipelineOrchestrator(SourceConnector<Map<String, Object>> source,
                                RawStore<Map<String, Object>> rawStore,
                                Transformer<Map<String, Object>, CanonicalRecord> transformer,
                                OutputSink<CanonicalRecord> sink,
                                MetricsRuntime metrics) {
        this.source = Objects.requireNonNull(source, "source");
        this.rawStore = Objects.requireNonNull(rawStore, "rawStore");
        this.transformer = Objects.requireNonNull(transformer, "transformer");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public PipelineResult run() {
        log.info("🚀 Starting ETL pipeline: source={} rawStore={} sink={}",
                source.getClass().getSimpleName(), rawStore.id(), sink.id());
        final long startNs = System.nanoTime();

        PipelineStage stage = PipelineStage.SCHEMA;
        int extracted = 0;
        int loaded = 0;

        try {
            sink.prepare();

            stage = PipelineStage.EXTRACT;
            final List<Map<String, Object>> fetched = extract();
            extracted = fetched.size();
            if (extracted == 0) {
                return fail(stage, "No records extracted from source", extracted, loaded);
            }
            log.info("Extracted {} records", extracted);

            stage = PipelineStage.RAW_STORE;
            final int stored = rawStore.replaceAll(fetched);
            log.info("Stored {} raw records in {}", stored, rawStore.id());

            stage = PipelineStage.RAW_READ;
            final List<Map<String, Object>> raw = rawStore.readAll();
            if (raw == null || raw.isEmpty()) {
                return fail(stage, "Raw store returned no records", extracted, loaded);
            }

            stage = PipelineStage.TRANSFORM;
            final List<CanonicalRecord> records = transformer.transform(raw);

            stage = PipelineStage.STAGING;
            loaded = sink.write(records);

            stage = PipelineStage.WAREHOUSE;
            sink.complete();

        } catch (Exception e) {
            log.error("❌ Pipeline failed at stage {}: {}", stage, e.getMessage(), e);
            return PipelineResult.failure(stage, describe(e), extracted, loaded);
        } finally {
            metrics.timer("pipeline.run.latency", (System.nanoTime() - startNs) / 1_000_000L);
        }

        log.info("✅ ETL pipeline completed: extracted={} loaded={}", extracted, loaded);
        return PipelineResult.success(extracted, loaded);
    }

    private List<Map<String, Object>> extract() throws Exception {
        source.connect();
        try {
            final List<Map<String, Object>> fetched = source.fetchAll();
            return (fetched == null) ? List.of() : fetched;
        } finally {
            safeDisconnectSource();
        }
    }

    private PipelineResult fail(PipelineStage stage, String message, int extracted, int loaded) {
        log.error("❌ Pipeline failed at stage {}: {}", stage, message);
        return PipelineResult.failure(stage, message, extracted, loaded);
    }

    @Override
    public void close() {
        safeClose(transformer, "transformer");
        safeClose(rawStore, "rawStore");
        safeClose(sink, "sink");
    }

    // --- Helpers ---

    private static String describe(Exception e) {
        final String msg = e.getMessage();
        return (msg == null || msg.isBlank()) ? e.getClass().getSimpleName() : msg;
    }

    private void safeDisconnectSource() {
        try {
            source.disconnect();
        } catch (Exception e) {
            log.warn("Error disconnecting source", e);
        }
    }

    private void safeClose(AutoCloseable c, String name) {
        try {
            c.close();
        } catch (Exception e) {
            log.warn("Error closing {}", name, e);
        }
    }
}

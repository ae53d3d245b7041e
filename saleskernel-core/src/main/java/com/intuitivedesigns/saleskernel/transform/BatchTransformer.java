/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.transform;

import com.intuitivedesigns.saleskernel.core.CanonicalRecord;
import com.intuitivedesigns.saleskernel.core.Transformer;
import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;
import com.intuitivedesigns.saleskernel.normalize.RecordNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies {@link RecordNormalizer} to a whole batch.
 *
 * <ul>
 *   <li>The batch is copied before normalization; the caller's maps are never touched.</li>
 *   <li>Output order equals input order and output size equals input size.</li>
 *   <li>Every record of one call carries the same {@code etl_load_timestamp}, captured once
 *       and truncated to microseconds so it survives a round-trip through the warehouse.</li>
 * </ul>
 */
public final class BatchTransformer implements Transformer<Map<String, Object>, CanonicalRecord> {

    private static final Logger log = LoggerFactory.getLogger(BatchTransformer.class);

    private final RecordNormalizer normalizer;
    private final Clock clock;
    private final MetricsRuntime metrics;

    public BatchTransformer(MetricsRuntime metrics) {
        this(new RecordNormalizer(metrics), Clock.systemUTC(), metrics);
    }

    public BatchTransformer(RecordNormalizer normalizer, Clock clock, MetricsRuntime metrics) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public List<CanonicalRecord> transform(List<Map<String, Object>> batch) {
        if (batch == null || batch.isEmpty()) {
            log.warn("No data received for transformation.");
            return List.of();
        }

        log.info("Transforming batch of {} records...", batch.size());
        final List<Map<String, Object>> working = isolate(batch);
        final Instant batchTimestamp = clock.instant().truncatedTo(ChronoUnit.MICROS);

        final List<CanonicalRecord> out = new ArrayList<>(working.size());
        for (Map<String, Object> raw : working) {
            out.add(normalizer.normalize(raw, batchTimestamp));
        }

        log.info("✅ Transformation completed: {} records (etl_load_timestamp={})", out.size(), batchTimestamp);
        return Collections.unmodifiableList(out);
    }

    private List<Map<String, Object>> isolate(List<Map<String, Object>> batch) {
        try {
            return RawRecordCopier.copyBatch(batch);
        } catch (IllegalArgumentException e) {
            log.warn("Deep copy of batch failed ({}). Falling back to per-record shallow copy.", e.getMessage());
            metrics.counter("transform.copy.fallback");
            final List<Map<String, Object>> shallow = new ArrayList<>(batch.size());
            for (Map<String, Object> item : batch) {
                shallow.add(item == null ? null : new LinkedHashMap<>(item));
            }
            return shallow;
        }
    }
}

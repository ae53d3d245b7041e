/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.metrics;

import com.intuitivedesigns.saleskernel.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    public static final String KEY_ENABLED = "metrics.enabled";

    private MetricsFactory() {}

    public static MetricsRuntime fromConfig(PipelineConfig config) {
        Objects.requireNonNull(config, "config");

        if (!config.getBoolean(KEY_ENABLED, true)) {
            log.info("Metrics disabled ({}=false). NOOP active.", KEY_ENABLED);
            return NoopMetricsRuntime.INSTANCE;
        }
        log.info("📊 Metrics Runtime Initialized (Type: MICROMETER)");
        return new MicrometerMetricsRuntime();
    }
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.output;

import com.intuitivedesigns.saleskernel.config.PipelineConfig;
import com.intuitivedesigns.saleskernel.core.OutputSink;
import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;
import com.intuitivedesigns.saleskernel.spi.SinkPlugin;

/**
 * ID: POSTGRES
 */
public final class PostgresSinkPlugin implements SinkPlugin {

    public static final String ID = "POSTGRES";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public OutputSink<?> create(PipelineConfig config, MetricsRuntime metrics) {
        return PostgresStagingSink.fromConfig(config, metrics);
    }
}

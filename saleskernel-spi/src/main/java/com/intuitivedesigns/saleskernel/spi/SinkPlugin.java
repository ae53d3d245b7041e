/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.spi;

import com.intuitivedesigns.saleskernel.config.PipelineConfig;
import com.intuitivedesigns.saleskernel.core.OutputSink;
import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;

/**
 * SPI Definition for Pipeline Sinks (Destinations).
 *
 * <p><b>Generics Note:</b> {@code OutputSink<?>} allows sinks to accept
 * specific data types. The factory checks the type the pipeline needs.</p>
 */
public interface SinkPlugin extends PipelinePlugin<OutputSink<?>> {

    @Override
    default PluginKind kind() {
        return PluginKind.SINK;
    }

    @Override
    OutputSink<?> create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}

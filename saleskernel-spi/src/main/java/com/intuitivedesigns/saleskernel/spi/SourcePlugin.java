/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.spi;

import com.intuitivedesigns.saleskernel.config.PipelineConfig;
import com.intuitivedesigns.saleskernel.core.SourceConnector;
import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;

/**
 * SPI Definition for Pipeline Sources.
 */
public interface SourcePlugin extends PipelinePlugin<SourceConnector<?>> {

    @Override
    default PluginKind kind() {
        return PluginKind.SOURCE;
    }

    @Override
    SourceConnector<?> create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}

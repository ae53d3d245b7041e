/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.sources;

import com.intuitivedesigns.saleskernel.config.PipelineConfig;
import com.intuitivedesigns.saleskernel.core.SourceConnector;
import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;
import com.intuitivedesigns.saleskernel.spi.SourcePlugin;

/**
 * ID: REST
 */
public final class RestSourcePlugin implements SourcePlugin {

    public static final String ID = "REST";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public SourceConnector<?> create(PipelineConfig config, MetricsRuntime metrics) {
        return RestSourceConnector.fromConfig(config, metrics);
    }
}

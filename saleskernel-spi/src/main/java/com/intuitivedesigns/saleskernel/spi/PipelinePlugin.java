/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.spi;

import com.intuitivedesigns.saleskernel.config.PipelineConfig;
import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;

/**
 * Base contract for every component discovered through {@link java.util.ServiceLoader}.
 *
 * @param <T> the component type this plugin builds
 */
public interface PipelinePlugin<T> {

    String id(); // e.g. "REST", "MONGO", "POSTGRES"

    PluginKind kind();

    T create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}

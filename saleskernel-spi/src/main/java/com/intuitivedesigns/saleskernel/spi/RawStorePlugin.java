/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.spi;

import com.intuitivedesigns.saleskernel.config.PipelineConfig;
import com.intuitivedesigns.saleskernel.core.RawStore;
import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;

/**
 * SPI Definition for raw-record buffers (e.g. "MONGO", "MEMORY").
 */
public interface RawStorePlugin extends PipelinePlugin<RawStore<?>> {

    @Override
    default PluginKind kind() {
        return PluginKind.RAW_STORE;
    }

    @Override
    RawStore<?> create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.spi;

/**
 * The central registry for all loaded plugins.
 */
public final class PluginCatalog {

    private final ServicePluginRegistry<SourcePlugin> sources;
    private final ServicePluginRegistry<RawStorePlugin> rawStores;
    private final ServicePluginRegistry<SinkPlugin> sinks;

    public PluginCatalog(ClassLoader cl) {
        this(new ServicePluginRegistry<>(SourcePlugin.class, cl),
                new ServicePluginRegistry<>(RawStorePlugin.class, cl),
                new ServicePluginRegistry<>(SinkPlugin.class, cl));
    }

    public PluginCatalog(ServicePluginRegistry<SourcePlugin> sources,
                         ServicePluginRegistry<RawStorePlugin> rawStores,
                         ServicePluginRegistry<SinkPlugin> sinks) {
        this.sources = sources;
        this.rawStores = rawStores;
        this.sinks = sinks;
    }

    public ServicePluginRegistry<SourcePlugin> sources() {
        return sources;
    }

    public ServicePluginRegistry<RawStorePlugin> rawStores() {
        return rawStores;
    }

    public ServicePluginRegistry<SinkPlugin> sinks() {
        return sinks;
    }
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.app;

import com.intuitivedesigns.saleskernel.config.PipelineConfig;
import com.intuitivedesigns.saleskernel.config.PipelineFactory;
import com.intuitivedesigns.saleskernel.core.PipelineOrchestrator;
import com.intuitivedesigns.saleskernel.core.PipelineResult;
import com.intuitivedesigns.saleskernel.metrics.MetricsFactory;
import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-shot ETL run: extract, buffer raw, transform, stage, populate the warehouse, exit.
 * Exit status is 0 on success and 1 on any failure.
 */
public final class SalesKernelApp {

    private static final Logger log = LoggerFactory.getLogger(SalesKernelApp.class);

    private SalesKernelApp() {}

    public static void main(String[] args) {
        log.info("=== Booting SalesKernel (e-commerce sales ETL) ===");

        final PipelineConfig config;
        try {
            config = PipelineConfig.load();
        } catch (RuntimeException e) {
            log.error("Unable to load configuration", e);
            System.exit(1);
            return;
        }
        System.exit(run(config));
    }

    static int run(PipelineConfig config) {
        MetricsRuntime metrics = null;
        PipelineOrchestrator pipeline = null;

        try {
            metrics = MetricsFactory.fromConfig(config);

            final PipelineFactory factory = new PipelineFactory();
            factory.logAvailablePlugins();

            pipeline = factory.createPipeline(config, metrics);
            final PipelineResult result = pipeline.run();

            if (result.success()) {
                log.info("🏁 Done: extracted={} loaded={}", result.recordsExtracted(), result.recordsLoaded());
                return 0;
            }
            log.error("Run failed at {}: {}", result.failedStage(), result.message());
            return 1;
        } catch (Throwable t) {
            log.error("Fatal application error", t);
            return 1;
        } finally {
            closeQuietly(pipeline);
            closeQuietly(metrics);
        }
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Error closing {}", resource.getClass().getSimpleName(), e);
        }
    }
}

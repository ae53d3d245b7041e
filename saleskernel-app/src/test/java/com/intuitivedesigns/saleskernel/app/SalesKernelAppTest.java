/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.app;

import com.intuitivedesigns.saleskernel.config.PipelineConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SalesKernelAppTest {

    @Test
    void missingSourceUrlExitsWithFailure() {
        final PipelineConfig config = PipelineConfig.fromMap(Map.of(
                "source.type", "REST",
                "metrics.enabled", "false"));

        assertEquals(1, SalesKernelApp.run(config));
    }

    @Test
    void unknownSinkTypeExitsWithFailure() {
        final PipelineConfig config = PipelineConfig.fromMap(Map.of(
                "source.rest.url", "http://localhost:1/data",
                "rawstore.type", "MEMORY",
                "sink.type", "NOPE",
                "metrics.enabled", "false"));

        assertEquals(1, SalesKernelApp.run(config));
    }
}

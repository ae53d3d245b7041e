/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.core;

import java.util.Objects;

/**
 * Outcome of {@link PipelineOrchestrator#run()}.
 *
 * @param success true only if every stage completed
 * @param failedStage the stage that failed, {@code null} on success
 * @param message failure description, {@code null} on success
 * @param recordsExtracted records returned by the source
 * @param recordsLoaded rows committed to staging
 */
public record PipelineResult(boolean success,
                             PipelineStage failedStage,
                             String message,
                             int recordsExtracted,
                             int recordsLoaded) {

    public static PipelineResult success(int recordsExtracted, int recordsLoaded) {
        return new PipelineResult(true, null, null, recordsExtracted, recordsLoaded);
    }

    public static PipelineResult failure(PipelineStage stage, String message, int recordsExtracted, int recordsLoaded) {
        Objects.requireNonNull(stage, "stage");
        return new PipelineResult(false, stage, message, recordsExtracted, recordsLoaded);
    }
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.core;

/**
 * Stages of one batch run, in execution order.
 */
public enum PipelineStage {
    SCHEMA,
    EXTRACT,
    RAW_STORE,
    RAW_READ,
    TRANSFORM,
    STAGING,
    WAREHOUSE
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.spi;

public enum PluginKind {
    SOURCE,
    RAW_STORE,
    SINK
}

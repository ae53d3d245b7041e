/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.output;

/**
 * Lifecycle of one {@link TransactionScope}:
 * {@code DISCONNECTED -> CONNECTED -> [TRUNCATED -> LOADED] -> COMMITTED | ROLLED_BACK -> DISCONNECTED}.
 */
public enum TransactionState {
    DISCONNECTED,
    CONNECTED,
    TRUNCATED,
    LOADED,
    COMMITTED,
    ROLLED_BACK;

    boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK;
    }

    boolean isActive() {
        return this == CONNECTED || this == TRUNCATED || this == LOADED;
    }
}

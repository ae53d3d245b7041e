/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.store;

/**
 * The raw document store rejected a read or write.
 */
public class RawStoreException extends Exception {

    public RawStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

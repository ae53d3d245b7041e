/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.output;

import java.sql.SQLException;

/**
 * The database could not be reached. Not retried.
 */
public class StagingConnectionException extends SQLException {

    public static final String SQL_STATE = "08001";

    public StagingConnectionException(String reason, Throwable cause) {
        super(reason, SQL_STATE, cause);
    }
}

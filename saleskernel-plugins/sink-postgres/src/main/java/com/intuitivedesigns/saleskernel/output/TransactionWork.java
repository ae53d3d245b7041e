/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.output;

import java.sql.SQLException;

/**
 * Body of a {@link TransactionScope#execute} call.
 */
@FunctionalInterface
public interface TransactionWork<T> {

    T execute(TransactionScope scope) throws SQLException;
}

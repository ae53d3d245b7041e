/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.core;

import java.util.List;

/**
 * A pluggable producer of raw records for one batch run.
 *
 * @param <T> Raw data type produced by this source.
 */
public interface SourceConnector<T> {

    void connect();

    void disconnect();

    /**
     * Fetches the complete batch. Implementations do not retry.
     *
     * @return every record available upstream, never {@code null}
     * @throws Exception if the upstream cannot be reached or returns an unusable payload
     */
    List<T> fetchAll() throws Exception;
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.output;

import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * One connection, one transaction.
 *
 * <p>{@link #open} acquires a connection with auto-commit off. {@link #close()} always releases it
 * and rolls back first unless the transaction already reached {@link TransactionState#COMMITTED} or
 * {@link TransactionState#ROLLED_BACK}. Use with try-with-resources, or through
 * {@link #execute(DataSource, MetricsRuntime, TransactionWork)} which commits when the body returns
 * normally.</p>
 *
 * Not thread-safe.
 */
public final class TransactionScope implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TransactionScope.class);

    private final Connection connection;
    private final MetricsRuntime metrics;
    private TransactionState state;

    private TransactionScope(Connection connection, MetricsRuntime metrics) {
        this.connection = connection;
        this.metrics = metrics;
        this.state = TransactionState.CONNECTED;
    }

    /**
     * @throws StagingConnectionException if no connection can be acquired
     */
    public static TransactionScope open(DataSource dataSource, MetricsRuntime metrics) throws SQLException {
        Objects.requireNonNull(dataSource, "dataSource");
        Objects.requireNonNull(metrics, "metrics");

        final Connection c;
        try {
            c = dataSource.getConnection();
        } catch (SQLException e) {
            log.error("❌ Could not connect to database: {}", e.getMessage());
            throw new StagingConnectionException("Could not connect to database: " + e.getMessage(), e);
        }

        try {
            if (c.getAutoCommit()) {
                c.setAutoCommit(false);
            }
        } catch (SQLException e) {
            try {
                c.close();
            } catch (SQLException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
        log.debug("Transaction opened");
        return new TransactionScope(c, metrics);
    }

    /**
     * Runs {@code work} in a fresh transaction: commit on normal return, rollback on any exception.
     */
    public static <T> T execute(DataSource dataSource, MetricsRuntime metrics, TransactionWork<T> work) throws SQLException {
        Objects.requireNonNull(work, "work");
        try (TransactionScope scope = open(dataSource, metrics)) {
            final T result = work.execute(scope);
            scope.commit();
            return result;
        }
    }

    public Connection connection() {
        if (!state.isActive()) {
            throw new IllegalStateException("Transaction is not active (state=" + state + ")");
        }
        return connection;
    }

    public TransactionState state() {
        return state;
    }

    /**
     * Records progress of the staging load. Only forward moves within an active transaction are allowed.
     */
    void advance(TransactionState next) {
        if (!state.isActive() || !next.isActive() || next.ordinal() < state.ordinal()) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next);
        }
        state = next;
    }

    /**
     * A failing commit is followed by a best-effort rollback before the error is rethrown.
     */
    public void commit() throws SQLException {
        connection();
        try {
            connection.commit();
            state = TransactionState.COMMITTED;
            metrics.counter("staging.transactions.committed");
            log.debug("Transaction committed");
        } catch (SQLException e) {
            log.error("Commit failed, attempting rollback: {}", e.getMessage());
            try {
                connection.rollback();
            } catch (SQLException rollbackError) {
                e.addSuppressed(rollbackError);
            }
            markRolledBack();
            throw e;
        }
    }

    public void rollback() throws SQLException {
        connection();
        try {
            connection.rollback();
        } finally {
            markRolledBack();
        }
    }

    @Override
    public void close() throws SQLException {
        if (state == TransactionState.DISCONNECTED) return;

        SQLException failure = null;
        if (!state.isTerminal()) {
            log.warn("Transaction not committed (state={}). Rolling back.", state);
            try {
                rollback();
            } catch (SQLException e) {
                failure = e;
            }
        }

        try {
            connection.close();
        } catch (SQLException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        } finally {
            state = TransactionState.DISCONNECTED;
        }

        if (failure != null) {
            throw failure;
        }
    }

    private void markRolledBack() {
        state = TransactionState.ROLLED_BACK;
        metrics.counter("staging.transactions.rolled_back");
        log.info("↩ Transaction rolled back");
    }
}

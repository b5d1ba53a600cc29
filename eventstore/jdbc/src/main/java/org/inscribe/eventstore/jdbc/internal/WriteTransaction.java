/*
 * Copyright 2026 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.inscribe.eventstore.jdbc.internal;

import org.inscribe.eventstore.api.CancellationSignal;
import org.inscribe.eventstore.api.PushCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;

import static java.util.Objects.requireNonNull;

/**
 * The connection of an ongoing append transaction together with the caller's {@link CancellationSignal}. Statements
 * executed through {@link #execute(Statement, SqlCall)} are cancelled on the backend when the signal fires.
 */
public final class WriteTransaction {
    private static final Logger log = LoggerFactory.getLogger(WriteTransaction.class);

    private final Connection connection;
    private final CancellationSignal cancellationSignal;
    private final int queryTimeoutSeconds;

    public WriteTransaction(Connection connection, CancellationSignal cancellationSignal, int queryTimeoutSeconds) {
        this.connection = requireNonNull(connection, Connection.class.getSimpleName() + " cannot be null");
        this.cancellationSignal = requireNonNull(cancellationSignal, CancellationSignal.class.getSimpleName() + " cannot be null");
        if (queryTimeoutSeconds < 0) {
            throw new IllegalArgumentException("Query timeout cannot be negative");
        }
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    public Connection connection() {
        return connection;
    }

    public PreparedStatement prepareStatement(String sql) throws SQLException {
        PreparedStatement statement = connection.prepareStatement(sql);
        if (queryTimeoutSeconds > 0) {
            statement.setQueryTimeout(queryTimeoutSeconds);
        }
        return statement;
    }

    /**
     * Run {@code call}, which executes {@code statement}, and cancel the statement if the push is cancelled meanwhile.
     */
    public <T> T execute(Statement statement, SqlCall<T> call) throws SQLException {
        throwIfCancelled();
        try (CancellationSignal.Registration ignored = cancellationSignal.onCancel(() -> cancel(statement))) {
            return call.call();
        }
    }

    public boolean isCancelled() {
        return cancellationSignal.isCancelled() || Thread.currentThread().isInterrupted();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new PushCancelledException("Push was cancelled");
        }
    }

    private static void cancel(Statement statement) {
        try {
            statement.cancel();
        } catch (SQLException e) {
            log.debug("Failed to cancel statement, it has probably completed already", e);
        }
    }

    @FunctionalInterface
    public interface SqlCall<T> {
        T call() throws SQLException;
    }
}

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

package org.inscribe.eventstore.jdbc;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Scope;
import org.inscribe.eventstore.api.*;
import org.inscribe.eventstore.api.blocking.EventStore;
import org.inscribe.eventstore.jdbc.internal.*;
import org.inscribe.eventstore.jdbc.internal.AppendOutcome.Appended;
import org.inscribe.eventstore.jdbc.internal.AppendOutcome.NotProvisioned;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;
import static org.inscribe.eventstore.api.TransactionException.Phase.ACQUIRE_CONNECTION;
import static org.inscribe.eventstore.api.TransactionException.Phase.BEGIN;

/**
 * An {@link EventStore} that appends events to PostgreSQL (or a PostgreSQL compatible database) using plain JDBC.
 * <p>
 * Each push runs in its own read committed transaction on a connection of its own. Within that transaction the events
 * are inserted with a single call to the {@code eventstore.push} function, the write conditions of the commands are
 * verified, the unique constraints are reserved or released and the field projections are updated. If anything fails
 * the transaction is rolled back and nothing of the batch is visible.
 * <p>
 * If the database lacks the push function (i.e. {@link JdbcEventStoreSchema#createPushFunction(DataSource)} has not
 * been executed) the batch is retried once, appending the events one statement at a time.
 * <p>
 * The event store has no mutable state and can be shared by any number of threads.
 */
public class JdbcEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private final DataSource dataSource;
    private final JdbcEventStoreConfig config;
    private final CommandTranslator translator;
    private final AppendStrategy pushFunction;
    private final AppendStrategy statements;
    private final UniqueConstraintEnforcer uniqueConstraintEnforcer;
    private final FieldProjectionUpdater fieldProjectionUpdater;

    /**
     * Create a new instance of {@code JdbcEventStore} with the default {@link JdbcEventStoreConfig}.
     *
     * @param dataSource The data source that the {@code JdbcEventStore} will get its connections from
     */
    public JdbcEventStore(DataSource dataSource) {
        this(dataSource, JdbcEventStoreConfig.defaultConfig());
    }

    /**
     * Create a new instance of {@code JdbcEventStore}
     *
     * @param dataSource The data source that the {@code JdbcEventStore} will get its connections from
     * @param config     The {@link JdbcEventStoreConfig} that will be used
     */
    public JdbcEventStore(DataSource dataSource, JdbcEventStoreConfig config) {
        this.dataSource = requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
        this.config = requireNonNull(config, JdbcEventStoreConfig.class.getSimpleName() + " cannot be null");
        this.translator = new CommandTranslator(config.objectMapper);
        this.pushFunction = new PushFunctionAppendStrategy(new CapabilityProber());
        this.statements = new StatementAppendStrategy();
        this.uniqueConstraintEnforcer = new UniqueConstraintEnforcer();
        this.fieldProjectionUpdater = new FieldProjectionUpdater();
    }

    @Override
    public List<Event> push(CancellationSignal cancellationSignal, List<Command> commands) {
        requireNonNull(cancellationSignal, CancellationSignal.class.getSimpleName() + " cannot be null");
        requireNonNull(commands, "Commands cannot be null");
        if (commands.isEmpty()) {
            return Collections.emptyList();
        }

        Span span = config.tracer.spanBuilder("eventstore.push")
                .setAttribute("eventstore.batch.size", commands.size())
                .startSpan();
        return traced(span, () -> {
            AppendOutcome outcome = append(pushFunction, cancellationSignal, commands);
            if (outcome instanceof NotProvisioned notProvisioned) {
                log.warn("The event store push function is missing ({}), appending {} events one statement at a time instead. Make sure the event store setup has been executed.",
                        notProvisioned.cause().getMessage(), commands.size());
                span.addEvent("eventstore.fallback");
                outcome = append(statements, cancellationSignal, commands);
            }

            if (outcome instanceof Appended appended) {
                return appended.events();
            }
            throw new BackendNotProvisionedException("The event store is not set up, couldn't append events", ((NotProvisioned) outcome).cause());
        });
    }

    private AppendOutcome append(AppendStrategy strategy, CancellationSignal cancellationSignal, List<Command> commands) {
        Span span = config.tracer.spanBuilder("eventstore.write_events")
                .setAttribute("eventstore.append.strategy", strategy.name())
                .startSpan();
        return traced(span, () -> {
            AppendOutcome outcome = writeEvents(strategy, cancellationSignal, commands);
            if (outcome instanceof NotProvisioned notProvisioned) {
                span.setStatus(StatusCode.ERROR, "Event store is not set up");
                span.recordException(notProvisioned.cause());
            }
            return outcome;
        });
    }

    private AppendOutcome writeEvents(AppendStrategy strategy, CancellationSignal cancellationSignal, List<Command> commands) {
        TranslatedBatch batch = translator.translate(commands);
        if (cancellationSignal.isCancelled()) {
            throw new PushCancelledException("Push was cancelled before it started");
        }

        Connection connection = acquireConnection();
        try {
            return writeEvents(connection, strategy, new WriteTransaction(connection, cancellationSignal, config.queryTimeoutSeconds()), batch);
        } finally {
            close(connection);
        }
    }

    private AppendOutcome writeEvents(Connection connection, AppendStrategy strategy, WriteTransaction transaction, TranslatedBatch batch) {
        try {
            strategy.prepare(connection);
        } catch (SQLException e) {
            if (SqlErrors.isSetupNotExecuted(e)) {
                return new NotProvisioned(e);
            }
            throw new EventStoreWriteException("Failed to prepare connection for appending events", SqlErrors.sqlState(e), e);
        }

        begin(connection);
        boolean appended = false;
        try {
            transaction.throwIfCancelled();
            strategy.append(transaction, batch);
            appended = true;
            verifyWriteConditions(batch);
            uniqueConstraintEnforcer.enforce(transaction, batch);
            if (config.storageBackend.requiresMultipleModificationsOptIn()) {
                transaction.throwIfCancelled();
                config.storageBackend.allowMultipleModificationsOfSameTable(connection);
            }
            fieldProjectionUpdater.apply(transaction, batch);
            transaction.throwIfCancelled();
        } catch (SQLException e) {
            rollback(connection, e);
            if (transaction.isCancelled()) {
                throw new PushCancelledException("Push was cancelled", e);
            } else if (!appended && SqlErrors.isSetupNotExecuted(e)) {
                return new NotProvisioned(e);
            }
            throw new EventStoreWriteException("Failed to append " + batch.size() + " events", SqlErrors.sqlState(e), e);
        } catch (RuntimeException e) {
            rollback(connection, e);
            throw e;
        }
        return commit(connection, batch);
    }

    private static void verifyWriteConditions(TranslatedBatch batch) {
        for (PendingEvent event : batch.events()) {
            WriteCondition writeCondition = event.command().writeCondition();
            long currentSequence = event.sequence() - 1;
            if (!writeCondition.isFulfilledBy(currentSequence)) {
                throw new WriteConditionNotFulfilledException(event.command().aggregate(), currentSequence, writeCondition);
            }
        }
    }

    private Connection acquireConnection() {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            throw new TransactionException(ACQUIRE_CONNECTION, "Failed to acquire a connection", e);
        }
    }

    private static void begin(Connection connection) {
        try {
            connection.setReadOnly(false);
            connection.setTransactionIsolation(Connection.TRANSACTION_READ_COMMITTED);
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            throw new TransactionException(BEGIN, "Failed to begin transaction", e);
        }
    }

    private AppendOutcome commit(Connection connection, TranslatedBatch batch) {
        List<Event> events = batch.toEvents();
        try {
            connection.commit();
        } catch (SQLException e) {
            if (config.commitFailurePolicy == CommitFailurePolicy.FAIL_WITH_AMBIGUOUS_OUTCOME) {
                throw new AmbiguousCommitOutcomeException(events, e);
            }
            log.warn("Failed to commit transaction after all {} events were written, they may or may not be durable", events.size(), e);
        }
        return new Appended(events);
    }

    private static void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            log.warn("Failed to roll back transaction after: {}", cause.getMessage(), e);
        }
    }

    private static void close(Connection connection) {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            log.warn("Failed to restore auto-commit before closing connection", e);
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection", e);
        }
    }

    private static <T> T traced(Span span, Supplier<T> work) {
        try (Scope ignored = span.makeCurrent()) {
            return work.get();
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}

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

import org.inscribe.eventstore.api.Aggregate;
import org.inscribe.eventstore.api.Command;
import org.inscribe.eventstore.api.EventStoreWriteException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.OffsetDateTime;

/**
 * Appends the events one statement at a time without relying on the {@code eventstore.push} function or the
 * {@value CommandRecord#TYPE_NAME} type. It takes the same lock as the push function, so the sequences and positions
 * it assigns are equivalent. Only used when the database hasn't been fully set up.
 */
public class StatementAppendStrategy implements AppendStrategy {
    static final String LOCK = "SELECT pg_advisory_xact_lock(hashtext('eventstore.push'))";
    static final String INSERT_EVENT = "INSERT INTO eventstore.events (aggregate_type, aggregate_id, owner, event_type, revision, creator, payload, \"sequence\", created_at, \"position\", in_tx_order) " +
            "SELECT ?, ?, ?, ?, ?, ?, CAST(? AS JSONB), COALESCE(MAX(e.\"sequence\"), 0) + 1, now(), nextval('eventstore.event_positions'), ? " +
            "FROM eventstore.events e WHERE e.aggregate_type = ? AND e.aggregate_id = ? " +
            "RETURNING created_at, \"sequence\", \"position\"";

    @Override
    public String name() {
        return "statements";
    }

    @Override
    public void prepare(Connection connection) {
    }

    @Override
    public void append(WriteTransaction transaction, TranslatedBatch batch) throws SQLException {
        try (PreparedStatement lock = transaction.prepareStatement(LOCK)) {
            transaction.execute(lock, () -> {
                try (ResultSet ignored = lock.executeQuery()) {
                    return null;
                }
            });
        }

        try (PreparedStatement insert = transaction.prepareStatement(INSERT_EVENT)) {
            for (PendingEvent event : batch.events()) {
                bind(insert, event);
                transaction.execute(insert, () -> {
                    try (ResultSet row = insert.executeQuery()) {
                        if (!row.next()) {
                            throw new EventStoreWriteException("No row was returned when inserting event " + event.index() + " of aggregate " + event.command().aggregate());
                        }
                        event.assign(row.getObject(1, OffsetDateTime.class), row.getLong(2), row.getLong(3));
                    }
                    return null;
                });
            }
        }
    }

    private static void bind(PreparedStatement insert, PendingEvent event) throws SQLException {
        Command command = event.command();
        Aggregate aggregate = command.aggregate();
        insert.setString(1, aggregate.type());
        insert.setString(2, aggregate.id());
        setNullableString(insert, 3, aggregate.owner());
        insert.setString(4, command.type());
        insert.setShort(5, command.revision());
        setNullableString(insert, 6, command.creator());
        setNullableString(insert, 7, event.payload());
        insert.setInt(8, event.index() + 1);
        insert.setString(9, aggregate.type());
        insert.setString(10, aggregate.id());
    }

    private static void setNullableString(PreparedStatement statement, int parameterIndex, String value) throws SQLException {
        if (value == null) {
            statement.setNull(parameterIndex, Types.VARCHAR);
        } else {
            statement.setString(parameterIndex, value);
        }
    }
}

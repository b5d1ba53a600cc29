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

import org.inscribe.eventstore.api.EventStoreWriteException;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Appends the whole batch with a single call to the {@code eventstore.push} function, passing all commands as one
 * {@value CommandRecord#TYPE_NAME} array.
 */
public class PushFunctionAppendStrategy implements AppendStrategy {
    static final String PUSH = "SELECT event_created_at, event_sequence, event_position FROM eventstore.push(?)";

    private final CapabilityProber capabilityProber;

    public PushFunctionAppendStrategy(CapabilityProber capabilityProber) {
        this.capabilityProber = requireNonNull(capabilityProber, CapabilityProber.class.getSimpleName() + " cannot be null");
    }

    @Override
    public String name() {
        return "push_function";
    }

    @Override
    public void prepare(Connection connection) throws SQLException {
        capabilityProber.probe(connection);
    }

    @Override
    public void append(WriteTransaction transaction, TranslatedBatch batch) throws SQLException {
        Array commands = transaction.connection().createArrayOf(CommandRecord.TYPE_NAME, batch.records());
        try (PreparedStatement statement = transaction.prepareStatement(PUSH)) {
            statement.setArray(1, commands);
            transaction.execute(statement, () -> {
                try (ResultSet rows = statement.executeQuery()) {
                    scatter(rows, batch.events());
                }
                return null;
            });
        } finally {
            commands.free();
        }
    }

    private static void scatter(ResultSet rows, List<PendingEvent> events) throws SQLException {
        int row = 0;
        while (rows.next()) {
            if (row >= events.size()) {
                throw new EventStoreWriteException("The push function returned more rows than the " + events.size() + " commands that were pushed");
            }
            events.get(row).assign(rows.getObject(1, OffsetDateTime.class), rows.getLong(2), rows.getLong(3));
            row++;
        }
        if (row != events.size()) {
            throw new EventStoreWriteException("The push function returned " + row + " rows but " + events.size() + " commands were pushed");
        }
    }
}

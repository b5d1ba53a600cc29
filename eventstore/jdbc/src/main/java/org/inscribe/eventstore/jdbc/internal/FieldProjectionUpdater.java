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
import org.inscribe.eventstore.api.FieldOperation;
import org.inscribe.eventstore.jdbc.internal.PendingEvent.EncodedFieldOperation;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Applies the field operations of a batch to the {@code eventstore.fields} table within the append transaction. The
 * operations are applied one by one in submission order, so the last operation on an (entity, field) pair wins.
 */
public class FieldProjectionUpdater {
    static final String SET = "INSERT INTO eventstore.fields (entity_type, entity_id, field_name, value, aggregate_type, aggregate_id, \"position\") " +
            "VALUES (?, ?, ?, CAST(? AS JSONB), ?, ?, ?) " +
            "ON CONFLICT (entity_type, entity_id, field_name) DO UPDATE SET value = EXCLUDED.value, aggregate_type = EXCLUDED.aggregate_type, " +
            "aggregate_id = EXCLUDED.aggregate_id, \"position\" = EXCLUDED.\"position\"";
    static final String REMOVE = "DELETE FROM eventstore.fields WHERE entity_type = ? AND entity_id = ? AND field_name = ?";
    static final String REMOVE_ENTITY = "DELETE FROM eventstore.fields WHERE entity_type = ? AND entity_id = ?";

    public void apply(WriteTransaction transaction, TranslatedBatch batch) throws SQLException {
        for (PendingEvent event : batch.events()) {
            for (EncodedFieldOperation encoded : event.fieldOperations()) {
                transaction.throwIfCancelled();
                apply(transaction, event, encoded);
            }
        }
    }

    private static void apply(WriteTransaction transaction, PendingEvent event, EncodedFieldOperation encoded) throws SQLException {
        FieldOperation operation = encoded.operation();
        if (operation instanceof FieldOperation.Set set) {
            Aggregate aggregate = event.command().aggregate();
            try (PreparedStatement statement = transaction.prepareStatement(SET)) {
                statement.setString(1, set.entityType());
                statement.setString(2, set.entityId());
                statement.setString(3, set.fieldName());
                statement.setString(4, encoded.value());
                statement.setString(5, aggregate.type());
                statement.setString(6, aggregate.id());
                statement.setLong(7, event.position());
                transaction.execute(statement, statement::executeUpdate);
            }
        } else if (operation instanceof FieldOperation.Remove remove) {
            try (PreparedStatement statement = transaction.prepareStatement(REMOVE)) {
                statement.setString(1, remove.entityType());
                statement.setString(2, remove.entityId());
                statement.setString(3, remove.fieldName());
                transaction.execute(statement, statement::executeUpdate);
            }
        } else if (operation instanceof FieldOperation.RemoveEntity removeEntity) {
            try (PreparedStatement statement = transaction.prepareStatement(REMOVE_ENTITY)) {
                statement.setString(1, removeEntity.entityType());
                statement.setString(2, removeEntity.entityId());
                transaction.execute(statement, statement::executeUpdate);
            }
        } else {
            throw new IllegalStateException("Unsupported field operation: " + operation);
        }
    }
}

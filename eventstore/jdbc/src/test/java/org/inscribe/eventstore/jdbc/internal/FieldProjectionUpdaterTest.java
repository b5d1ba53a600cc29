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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.inscribe.domain.Users;
import org.inscribe.eventstore.api.CancellationSignal;
import org.inscribe.eventstore.api.Command;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;

import static org.inscribe.eventstore.api.Aggregate.aggregate;
import static org.inscribe.eventstore.api.FieldOperation.*;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

class FieldProjectionUpdaterTest {

    private final FieldProjectionUpdater updater = new FieldProjectionUpdater();
    private final CommandTranslator translator = new CommandTranslator(new ObjectMapper());

    private Connection connection;
    private PreparedStatement setStatement;
    private PreparedStatement removeStatement;
    private PreparedStatement removeEntityStatement;
    private WriteTransaction transaction;

    @BeforeEach
    void create_mocks() throws SQLException {
        connection = mock(Connection.class);
        setStatement = mock(PreparedStatement.class);
        removeStatement = mock(PreparedStatement.class);
        removeEntityStatement = mock(PreparedStatement.class);
        given(connection.prepareStatement(FieldProjectionUpdater.SET)).willReturn(setStatement);
        given(connection.prepareStatement(FieldProjectionUpdater.REMOVE)).willReturn(removeStatement);
        given(connection.prepareStatement(FieldProjectionUpdater.REMOVE_ENTITY)).willReturn(removeEntityStatement);
        transaction = new WriteTransaction(connection, CancellationSignal.none(), 0);
    }

    @Test
    void set_upserts_json_value_together_with_aggregate_and_event_position() throws SQLException {
        // Given
        TranslatedBatch batch = translator.translate(List.of(Users.register("1", "jane@example.com", "Jane")));
        batch.events().get(0).assign(OffsetDateTime.now(), 1, 12);

        // When
        updater.apply(transaction, batch);

        // Then
        verify(setStatement, times(2)).setString(1, "user");
        verify(setStatement, times(2)).setString(2, "1");
        verify(setStatement).setString(3, "email");
        verify(setStatement).setString(4, "\"jane@example.com\"");
        verify(setStatement).setString(3, "name");
        verify(setStatement).setString(4, "\"Jane\"");
        verify(setStatement, times(2)).setString(5, "user");
        verify(setStatement, times(2)).setString(6, "1");
        verify(setStatement, times(2)).setLong(7, 12L);
        verify(setStatement, times(2)).executeUpdate();
    }

    @Test
    void operations_are_applied_in_submission_order_across_commands() throws SQLException {
        // Given
        Command first = Command.builder(aggregate("user", "1"), "NameChanged").fieldOperation(set("user", "1", "name", "Jane")).build();
        Command second = Command.builder(aggregate("user", "1"), "NameRemoved").fieldOperation(remove("user", "1", "name")).build();
        Command third = Command.builder(aggregate("user", "1"), "UserUnregistered").fieldOperation(removeEntity("user", "1")).build();
        TranslatedBatch batch = translator.translate(List.of(first, second, third));
        batch.events().get(0).assign(OffsetDateTime.now(), 1, 1);
        batch.events().get(1).assign(OffsetDateTime.now(), 2, 2);
        batch.events().get(2).assign(OffsetDateTime.now(), 3, 3);

        // When
        updater.apply(transaction, batch);

        // Then
        InOrder inOrder = inOrder(setStatement, removeStatement, removeEntityStatement);
        inOrder.verify(setStatement).executeUpdate();
        inOrder.verify(removeStatement).executeUpdate();
        inOrder.verify(removeEntityStatement).executeUpdate();
        verify(removeStatement).setString(3, "name");
        verify(removeEntityStatement).setString(1, "user");
        verify(removeEntityStatement).setString(2, "1");
    }
}

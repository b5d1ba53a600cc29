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

import org.postgresql.PGConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

/**
 * Makes sure that a connection knows the {@value CommandRecord#TYPE_NAME} type before the push function is called.
 * The type map of the connection ({@link Connection#getTypeMap()}) keeps track of whether registration has been done,
 * so registration happens once per physical connection.
 * <p>
 * Not thread-safe per connection, but a connection is only ever used by one push at a time.
 */
public class CapabilityProber {
    private static final Logger log = LoggerFactory.getLogger(CapabilityProber.class);

    static final String FIND_COMMAND_TYPE = "SELECT t.oid FROM pg_catalog.pg_type t JOIN pg_catalog.pg_namespace n ON n.oid = t.typnamespace WHERE n.nspname = ? AND t.typname = ?";

    /**
     * Register the command type on {@code connection} unless that has been done already.
     *
     * @throws SQLException With SQL state {@value SqlErrors#UNDEFINED_OBJECT} if the type doesn't exist in the database
     */
    public void probe(Connection connection) throws SQLException {
        if (isCapable(connection)) {
            return;
        }
        register(connection);
    }

    public boolean isCapable(Connection connection) throws SQLException {
        Map<String, Class<?>> typeMap = connection.getTypeMap();
        return typeMap != null && typeMap.containsKey(CommandRecord.TYPE_NAME);
    }

    private void register(Connection connection) throws SQLException {
        long oid = findCommandType(connection);
        if (connection.isWrapperFor(PGConnection.class)) {
            connection.unwrap(PGConnection.class).addDataType(CommandRecord.TYPE_NAME, CommandRecord.class);
        }
        Map<String, Class<?>> typeMap = connection.getTypeMap();
        Map<String, Class<?>> newTypeMap = typeMap == null ? new HashMap<>() : new HashMap<>(typeMap);
        newTypeMap.put(CommandRecord.TYPE_NAME, CommandRecord.class);
        connection.setTypeMap(newTypeMap);
        log.debug("Registered type {} (oid {}) on connection", CommandRecord.TYPE_NAME, oid);
    }

    private static long findCommandType(Connection connection) throws SQLException {
        String[] schemaAndName = CommandRecord.TYPE_NAME.split("\\.");
        try (PreparedStatement statement = connection.prepareStatement(FIND_COMMAND_TYPE)) {
            statement.setString(1, schemaAndName[0]);
            statement.setString(2, schemaAndName[1]);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    throw new SQLException("type \"" + CommandRecord.TYPE_NAME + "\" does not exist", SqlErrors.UNDEFINED_OBJECT);
                }
                return resultSet.getLong(1);
            }
        }
    }
}

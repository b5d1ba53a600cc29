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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Creates the database objects used by the {@link JdbcEventStore}. All scripts are idempotent and can be applied
 * on every start-up.
 * <ul>
 *     <li>{@link #createTables(DataSource)} creates the {@code eventstore} schema with the events, unique constraints and fields tables.</li>
 *     <li>{@link #createPushFunction(DataSource)} creates the {@code eventstore.command} type and the {@code eventstore.push} function
 *     that the event store uses to append a whole batch in one round-trip.</li>
 * </ul>
 * The event store still works if only the tables exist, but then it appends the events one statement at a time.
 */
public class JdbcEventStoreSchema {
    private static final Logger log = LoggerFactory.getLogger(JdbcEventStoreSchema.class);

    static final String TABLES_SCRIPT = "tables.sql";
    static final String PUSH_FUNCTION_SCRIPT = "push-function.sql";

    private JdbcEventStoreSchema() {
    }

    /**
     * Create all tables, types and functions.
     *
     * @param dataSource The data source of the database to initialize
     */
    public static void initialize(DataSource dataSource) {
        createTables(dataSource);
        createPushFunction(dataSource);
    }

    public static void createTables(DataSource dataSource) {
        executeScript(dataSource, TABLES_SCRIPT);
    }

    public static void createPushFunction(DataSource dataSource) {
        executeScript(dataSource, PUSH_FUNCTION_SCRIPT);
    }

    private static void executeScript(DataSource dataSource, String scriptName) {
        requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
        String script = readScript(scriptName);
        try (Connection connection = dataSource.getConnection(); Statement statement = connection.createStatement()) {
            statement.execute(script);
            if (!connection.getAutoCommit()) {
                connection.commit();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to execute event store script " + scriptName, e);
        }
        log.info("Applied event store script {}", scriptName);
    }

    static String readScript(String scriptName) {
        try (InputStream inputStream = JdbcEventStoreSchema.class.getResourceAsStream(scriptName)) {
            if (inputStream == null) {
                throw new IllegalStateException("Couldn't find event store script " + scriptName + " on the classpath");
            }
            return new String(inputStream.readAllBytes(), UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read event store script " + scriptName, e);
        }
    }
}

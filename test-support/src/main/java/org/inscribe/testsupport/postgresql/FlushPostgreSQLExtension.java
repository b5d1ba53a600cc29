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


package org.inscribe.testsupport.postgresql;

import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Removes all events, unique constraints and fields before each test. Tables that don't exist (yet) are ignored.
 */
public class FlushPostgreSQLExtension implements BeforeEachCallback {
    private static final Logger log = LoggerFactory.getLogger(FlushPostgreSQLExtension.class);

    static final String FLUSH = "DO $$ BEGIN " +
            "IF to_regclass('eventstore.events') IS NOT NULL THEN " +
            "TRUNCATE eventstore.events, eventstore.unique_constraints, eventstore.fields; " +
            "ALTER SEQUENCE eventstore.event_positions RESTART; " +
            "END IF; END $$";

    private final Supplier<DataSource> dataSource;

    public FlushPostgreSQLExtension(Supplier<DataSource> dataSource) {
        this.dataSource = requireNonNull(dataSource, "DataSource supplier cannot be null");
    }

    @Override
    public void beforeEach(ExtensionContext extensionContext) throws SQLException {
        try (Connection connection = dataSource.get().getConnection(); Statement statement = connection.createStatement()) {
            statement.execute(FLUSH);
        }
        log.debug("Flushed event store tables before {}", extensionContext.getDisplayName());
    }
}

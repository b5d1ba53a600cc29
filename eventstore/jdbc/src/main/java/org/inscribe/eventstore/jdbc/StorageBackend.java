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

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * The flavor of the PostgreSQL compatible database that the {@link JdbcEventStore} writes to.
 */
public sealed interface StorageBackend {

    /**
     * PostgreSQL
     */
    static StorageBackend standard() {
        return new Standard();
    }

    /**
     * A distributed SQL database speaking the PostgreSQL protocol, such as CockroachDB. These refuse to modify the same
     * table more than once in a transaction using {@code ON CONFLICT} unless the session opts in.
     */
    static StorageBackend distributed() {
        return new Distributed();
    }

    /**
     * @return {@code true} if {@link #allowMultipleModificationsOfSameTable(Connection)} must be called before a
     * transaction modifies the same table several times
     */
    boolean requiresMultipleModificationsOptIn();

    /**
     * Allow the current transaction of {@code connection} to modify the same table more than once.
     */
    void allowMultipleModificationsOfSameTable(Connection connection) throws SQLException;

    record Standard() implements StorageBackend {
        @Override
        public boolean requiresMultipleModificationsOptIn() {
            return false;
        }

        @Override
        public void allowMultipleModificationsOfSameTable(Connection connection) {
        }

        @Override
        public String toString() {
            return "standard";
        }
    }

    record Distributed() implements StorageBackend {
        static final String ENABLE_MULTIPLE_MODIFICATIONS = "SET enable_multiple_modifications_of_table = on";

        @Override
        public boolean requiresMultipleModificationsOptIn() {
            return true;
        }

        @Override
        public void allowMultipleModificationsOfSameTable(Connection connection) throws SQLException {
            try (Statement statement = connection.createStatement()) {
                statement.execute(ENABLE_MULTIPLE_MODIFICATIONS);
            }
        }

        @Override
        public String toString() {
            return "distributed";
        }
    }
}

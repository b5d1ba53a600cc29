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

import org.jspecify.annotations.Nullable;

import java.sql.SQLException;

/**
 * SQL states that the event store treats specially.
 */
public final class SqlErrors {
    /**
     * The function doesn't exist (or doesn't accept the given argument types)
     */
    public static final String UNDEFINED_FUNCTION = "42883";
    /**
     * A type (or another object) doesn't exist
     */
    public static final String UNDEFINED_OBJECT = "42704";
    public static final String UNIQUE_VIOLATION = "23505";
    public static final String QUERY_CANCELED = "57014";

    private SqlErrors() {
    }

    /**
     * @return {@code true} if {@code e}, or one of its causes, signals that the push function or its argument type is
     * missing, which means that the setup of the database has not been executed
     */
    public static boolean isSetupNotExecuted(@Nullable Throwable e) {
        String sqlState = sqlState(e);
        return UNDEFINED_FUNCTION.equals(sqlState) || UNDEFINED_OBJECT.equals(sqlState);
    }

    public static boolean isQueryCanceled(@Nullable Throwable e) {
        return QUERY_CANCELED.equals(sqlState(e));
    }

    /**
     * @return The first SQL state found in the cause chain of {@code e}, or {@code null}
     */
    public static @Nullable String sqlState(@Nullable Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SQLException sqlException && sqlException.getSQLState() != null) {
                return sqlException.getSQLState();
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }
}

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

package org.inscribe.eventstore.api;

import org.jspecify.annotations.Nullable;

/**
 * The backend failed while appending the events, checking unique constraints or updating field projections.
 * The transaction has been rolled back.
 */
public class EventStoreWriteException extends EventStoreException {
    private final @Nullable String sqlState;

    public EventStoreWriteException(String message, @Nullable String sqlState, Throwable cause) {
        super(sqlState == null ? message : message + " (SQL state " + sqlState + ")", cause);
        this.sqlState = sqlState;
    }

    public EventStoreWriteException(String message) {
        super(message);
        this.sqlState = null;
    }

    /**
     * @return The SQL state reported by the backend, or {@code null} if unknown
     */
    public @Nullable String getSqlState() {
        return sqlState;
    }
}

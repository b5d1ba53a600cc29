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

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A way of inserting the events of a batch into the events table. The strategy assigns the creation time, sequence and
 * position returned by the backend to every {@link PendingEvent} of the batch, in order.
 */
public interface AppendStrategy {

    /**
     * @return A short name used in logs and traces
     */
    String name();

    /**
     * Prepare {@code connection} before the transaction begins.
     */
    void prepare(Connection connection) throws SQLException;

    /**
     * Insert the events of {@code batch} within {@code transaction} and assign their ordering values.
     */
    void append(WriteTransaction transaction, TranslatedBatch batch) throws SQLException;
}

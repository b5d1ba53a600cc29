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

import org.inscribe.eventstore.api.Event;

import java.sql.SQLException;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of one attempt to append a batch with an {@link AppendStrategy}. Failures other than a missing database
 * setup are thrown rather than returned.
 */
public sealed interface AppendOutcome {

    record Appended(List<Event> events) implements AppendOutcome {
        public Appended {
            events = List.copyOf(events);
        }
    }

    /**
     * The backend lacks the push function or its argument type, nothing was written.
     */
    record NotProvisioned(SQLException cause) implements AppendOutcome {
        public NotProvisioned {
            requireNonNull(cause, "Cause cannot be null");
        }
    }
}

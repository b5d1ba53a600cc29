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

import java.util.List;

/**
 * Every write of the batch succeeded but the commit failed. The events may or may not be durable, the caller must find
 * out by reading them back before acting on the outcome.
 */
public class AmbiguousCommitOutcomeException extends TransactionException {
    private final transient List<Event> events;

    public AmbiguousCommitOutcomeException(List<Event> events, Throwable cause) {
        super(Phase.COMMIT, "Commit failed after all events were written, the outcome of the batch is unknown", cause);
        this.events = List.copyOf(events);
    }

    /**
     * @return The events as they would look if the commit actually went through
     */
    public List<Event> getEvents() {
        return events;
    }
}

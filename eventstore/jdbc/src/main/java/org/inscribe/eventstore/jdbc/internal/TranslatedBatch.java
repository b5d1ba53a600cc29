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

import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * The result of translating a batch of commands: the event placeholders and the array argument of the push function,
 * both in the order of the commands.
 */
public final class TranslatedBatch {
    private final List<PendingEvent> events;
    private final List<CommandRecord> records;

    TranslatedBatch(List<PendingEvent> events, List<CommandRecord> records) {
        requireNonNull(events, "Events cannot be null");
        requireNonNull(records, "Records cannot be null");
        if (events.size() != records.size()) {
            throw new IllegalArgumentException("Expected as many records as events but got " + records.size() + " records and " + events.size() + " events");
        }
        this.events = List.copyOf(events);
        this.records = List.copyOf(records);
    }

    public List<PendingEvent> events() {
        return events;
    }

    public CommandRecord[] records() {
        return records.toArray(new CommandRecord[0]);
    }

    public int size() {
        return events.size();
    }

    /**
     * @return The immutable events, only valid after every placeholder has been assigned
     */
    public List<Event> toEvents() {
        return events.stream().map(PendingEvent::toEvent).collect(Collectors.toUnmodifiableList());
    }
}

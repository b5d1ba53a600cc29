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

import org.inscribe.eventstore.api.Command;
import org.inscribe.eventstore.api.Event;
import org.inscribe.eventstore.api.FieldOperation;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * The in-memory placeholder of an {@link Event} while the batch is being written. The ordering fields are assigned
 * exactly once, from the row that the backend returned for the command, and the placeholder is turned into an
 * {@link Event} after commit.
 */
@NullMarked
public final class PendingEvent {
    private final int index;
    private final Command command;
    private final @Nullable String payload;
    private final List<EncodedFieldOperation> fieldOperations;

    private @Nullable OffsetDateTime createdAt;
    private long sequence;
    private long position;

    PendingEvent(int index, Command command, @Nullable String payload, List<EncodedFieldOperation> fieldOperations) {
        this.index = index;
        this.command = requireNonNull(command, Command.class.getSimpleName() + " cannot be null");
        this.payload = payload;
        this.fieldOperations = List.copyOf(fieldOperations);
    }

    /**
     * @return The position of the command in the batch
     */
    public int index() {
        return index;
    }

    public Command command() {
        return command;
    }

    public @Nullable String payload() {
        return payload;
    }

    public List<EncodedFieldOperation> fieldOperations() {
        return fieldOperations;
    }

    public boolean isAssigned() {
        return createdAt != null;
    }

    public long sequence() {
        requireAssigned();
        return sequence;
    }

    public long position() {
        requireAssigned();
        return position;
    }

    /**
     * Assign the values that the backend generated for this event.
     *
     * @throws IllegalStateException if the values have already been assigned
     */
    public void assign(OffsetDateTime createdAt, long sequence, long position) {
        requireNonNull(createdAt, "Creation time cannot be null");
        if (isAssigned()) {
            throw new IllegalStateException("Ordering of event " + index + " (" + command.aggregate() + ") has already been assigned");
        }
        this.createdAt = createdAt;
        this.sequence = sequence;
        this.position = position;
    }

    Event toEvent() {
        requireAssigned();
        return new Event(command, payload, requireNonNull(createdAt), sequence, position);
    }

    private void requireAssigned() {
        if (!isAssigned()) {
            throw new IllegalStateException("Ordering of event " + index + " (" + command.aggregate() + ") has not been assigned");
        }
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", PendingEvent.class.getSimpleName() + "[", "]")
                .add("index=" + index)
                .add("aggregate=" + command.aggregate())
                .add("type='" + command.type() + "'")
                .add("sequence=" + sequence)
                .add("position=" + position)
                .toString();
    }

    /**
     * A {@link FieldOperation} with its value serialized to JSON.
     *
     * @param operation The operation
     * @param value     The JSON value for {@link FieldOperation.Set}, otherwise {@code null}
     */
    public record EncodedFieldOperation(FieldOperation operation, @Nullable String value) {
        public EncodedFieldOperation {
            requireNonNull(operation, FieldOperation.class.getSimpleName() + " cannot be null");
        }
    }
}

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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * An immutable fact that has been appended to the event store. It's created from exactly one {@link Command} and is only
 * handed out once the transaction that appended it has been committed, which means that {@link #createdAt()},
 * {@link #sequence()} and {@link #position()} are always assigned.
 */
@NullMarked
public final class Event {
    private final Command command;
    private final @Nullable String payload;
    private final OffsetDateTime createdAt;
    private final long sequence;
    private final long position;

    public Event(Command command, @Nullable String payload, OffsetDateTime createdAt, long sequence, long position) {
        this.command = requireNonNull(command, Command.class.getSimpleName() + " cannot be null");
        this.createdAt = requireNonNull(createdAt, "Creation time cannot be null");
        if (sequence < 1) {
            throw new IllegalArgumentException("Sequence must be greater than zero, was " + sequence);
        }
        if (position < 1) {
            throw new IllegalArgumentException("Position must be greater than zero, was " + position);
        }
        this.payload = payload;
        this.sequence = sequence;
        this.position = position;
    }

    /**
     * @return The command that this event was created from
     */
    public Command command() {
        return command;
    }

    public Aggregate aggregate() {
        return command.aggregate();
    }

    public String type() {
        return command.type();
    }

    public short revision() {
        return command.revision();
    }

    public @Nullable String creator() {
        return command.creator();
    }

    /**
     * @return The payload as it was stored, i.e. serialized as JSON, or {@code null} if the command had no payload
     */
    public @Nullable String payload() {
        return payload;
    }

    /**
     * @return The time the event was created, assigned by the backend
     */
    public OffsetDateTime createdAt() {
        return createdAt;
    }

    /**
     * @return The sequence number of the event within its aggregate, starting at 1 and without gaps
     */
    public long sequence() {
        return sequence;
    }

    /**
     * @return The store-wide position of the event, increasing in commit order
     */
    public long position() {
        return position;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Event)) return false;
        Event event = (Event) o;
        return sequence == event.sequence && position == event.position && command.equals(event.command)
                && Objects.equals(payload, event.payload) && createdAt.equals(event.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(command, payload, createdAt, sequence, position);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", Event.class.getSimpleName() + "[", "]")
                .add("aggregate=" + command.aggregate())
                .add("type='" + command.type() + "'")
                .add("sequence=" + sequence)
                .add("position=" + position)
                .add("createdAt=" + createdAt)
                .toString();
    }
}

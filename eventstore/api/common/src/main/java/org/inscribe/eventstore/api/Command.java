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
import org.jspecify.annotations.NullUnmarked;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * A request to record one fact (event) against one {@link Aggregate}. A command is immutable, it's turned into an
 * {@link Event} once the batch it belongs to has been appended to the event store.
 */
@NullMarked
public final class Command {
    public static final short DEFAULT_REVISION = 1;

    private final Aggregate aggregate;
    private final String type;
    private final short revision;
    private final @Nullable String creator;
    private final @Nullable Object payload;
    private final WriteCondition writeCondition;
    private final List<UniqueConstraint> uniqueConstraints;
    private final List<FieldOperation> fieldOperations;

    private Command(Builder builder) {
        this.aggregate = requireNonNull(builder.aggregate, "Aggregate cannot be null");
        this.type = requireNonNull(builder.type, "Command type cannot be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("Command type cannot be blank");
        }
        if (builder.revision < 1) {
            throw new IllegalArgumentException("Revision must be greater than zero, was " + builder.revision);
        }
        this.revision = builder.revision;
        this.creator = builder.creator;
        this.payload = builder.payload;
        this.writeCondition = requireNonNull(builder.writeCondition, WriteCondition.class.getSimpleName() + " cannot be null");
        this.uniqueConstraints = Collections.unmodifiableList(new ArrayList<>(builder.uniqueConstraints));
        this.fieldOperations = Collections.unmodifiableList(new ArrayList<>(builder.fieldOperations));
    }

    public static Builder builder(Aggregate aggregate, String type) {
        return new Builder(aggregate, type);
    }

    public Aggregate aggregate() {
        return aggregate;
    }

    /**
     * @return The type of the command, which becomes the type of the event, for example {@code user.added}
     */
    public String type() {
        return type;
    }

    /**
     * @return The schema revision of the payload
     */
    public short revision() {
        return revision;
    }

    public @Nullable String creator() {
        return creator;
    }

    public @Nullable Object payload() {
        return payload;
    }

    public WriteCondition writeCondition() {
        return writeCondition;
    }

    public List<UniqueConstraint> uniqueConstraints() {
        return uniqueConstraints;
    }

    public List<FieldOperation> fieldOperations() {
        return fieldOperations;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Command)) return false;
        Command command = (Command) o;
        return revision == command.revision && aggregate.equals(command.aggregate) && type.equals(command.type)
                && Objects.equals(creator, command.creator) && Objects.equals(payload, command.payload)
                && writeCondition.equals(command.writeCondition) && uniqueConstraints.equals(command.uniqueConstraints)
                && fieldOperations.equals(command.fieldOperations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregate, type, revision, creator, payload, writeCondition, uniqueConstraints, fieldOperations);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", Command.class.getSimpleName() + "[", "]")
                .add("aggregate=" + aggregate)
                .add("type='" + type + "'")
                .add("revision=" + revision)
                .add("creator='" + creator + "'")
                .add("writeCondition=" + writeCondition)
                .add("uniqueConstraints=" + uniqueConstraints)
                .add("fieldOperations=" + fieldOperations)
                .toString();
    }

    @NullUnmarked
    public static final class Builder {
        private final Aggregate aggregate;
        private final String type;
        private short revision = DEFAULT_REVISION;
        private String creator;
        private Object payload;
        private WriteCondition writeCondition = WriteCondition.anySequence();
        private final List<UniqueConstraint> uniqueConstraints = new ArrayList<>();
        private final List<FieldOperation> fieldOperations = new ArrayList<>();

        private Builder(Aggregate aggregate, String type) {
            this.aggregate = aggregate;
            this.type = type;
        }

        /**
         * @param revision The schema revision of the payload, defaults to {@value #DEFAULT_REVISION}
         * @return The builder instance
         */
        public Builder revision(short revision) {
            this.revision = revision;
            return this;
        }

        /**
         * @param creator The user or system that issued the command. May be {@code null}.
         * @return The builder instance
         */
        public Builder creator(String creator) {
            this.creator = creator;
            return this;
        }

        /**
         * @param payload The body of the event. It's serialized to JSON when the command is appended. May be {@code null}.
         * @return The builder instance
         */
        public Builder payload(Object payload) {
            this.payload = payload;
            return this;
        }

        /**
         * @param writeCondition The condition the aggregate sequence must fulfill for the event to be appended
         * @return The builder instance
         */
        @NullMarked
        public Builder writeCondition(WriteCondition writeCondition) {
            this.writeCondition = requireNonNull(writeCondition, WriteCondition.class.getSimpleName() + " cannot be null");
            return this;
        }

        @NullMarked
        public Builder uniqueConstraint(UniqueConstraint uniqueConstraint) {
            this.uniqueConstraints.add(requireNonNull(uniqueConstraint, UniqueConstraint.class.getSimpleName() + " cannot be null"));
            return this;
        }

        @NullMarked
        public Builder fieldOperation(FieldOperation fieldOperation) {
            this.fieldOperations.add(requireNonNull(fieldOperation, FieldOperation.class.getSimpleName() + " cannot be null"));
            return this;
        }

        @NullMarked
        public Command build() {
            return new Command(this);
        }
    }
}

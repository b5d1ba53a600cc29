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

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Thrown when the payload of a command, or the value of one of its field operations, cannot be serialized into the format
 * expected by the backend. Nothing has been written when this exception is thrown.
 */
public class TranslationException extends EventStoreException {
    private final int commandIndex;
    private final Aggregate aggregate;
    private final String commandType;

    public TranslationException(int commandIndex, Aggregate aggregate, String commandType, String details, Throwable cause) {
        super(String.format("Failed to translate command %d (type %s, aggregate %s): %s", commandIndex, commandType, aggregate, details), cause);
        this.commandIndex = commandIndex;
        this.aggregate = aggregate;
        this.commandType = commandType;
    }

    /**
     * @return The index of the offending command in the batch
     */
    public int getCommandIndex() {
        return commandIndex;
    }

    public Aggregate getAggregate() {
        return aggregate;
    }

    public String getCommandType() {
        return commandType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TranslationException)) return false;
        TranslationException that = (TranslationException) o;
        return commandIndex == that.commandIndex && Objects.equals(aggregate, that.aggregate) && Objects.equals(commandType, that.commandType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commandIndex, aggregate, commandType);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", TranslationException.class.getSimpleName() + "[", "]")
                .add("commandIndex=" + commandIndex)
                .add("aggregate=" + aggregate)
                .add("commandType='" + commandType + "'")
                .add("message=" + getMessage())
                .toString();
    }
}

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
 * The write condition of a command was not fulfilled so no events of the batch have been written to the event store.
 * In a typical scenario, if an application reads and writes aggregate A from two different places at the same time,
 * this is effectively the same as an optimistic locking exception and a retry is appropriate.
 */
public class WriteConditionNotFulfilledException extends EventStoreException {
    private final Aggregate aggregate;
    private final long currentSequence;
    private final WriteCondition writeCondition;

    public WriteConditionNotFulfilledException(Aggregate aggregate, long currentSequence, WriteCondition writeCondition) {
        super(String.format("%s of aggregate %s was not fulfilled. Expected sequence %s but was %s.", WriteCondition.class.getSimpleName(), aggregate, writeCondition, currentSequence));
        this.aggregate = aggregate;
        this.currentSequence = currentSequence;
        this.writeCondition = writeCondition;
    }

    public Aggregate getAggregate() {
        return aggregate;
    }

    public long getCurrentSequence() {
        return currentSequence;
    }

    public WriteCondition getWriteCondition() {
        return writeCondition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WriteConditionNotFulfilledException)) return false;
        WriteConditionNotFulfilledException that = (WriteConditionNotFulfilledException) o;
        return currentSequence == that.currentSequence && Objects.equals(aggregate, that.aggregate) && Objects.equals(writeCondition, that.writeCondition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregate, currentSequence, writeCondition);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", WriteConditionNotFulfilledException.class.getSimpleName() + "[", "]")
                .add("aggregate=" + aggregate)
                .add("currentSequence=" + currentSequence)
                .add("writeCondition=" + writeCondition)
                .add("message=" + getMessage())
                .toString();
    }
}

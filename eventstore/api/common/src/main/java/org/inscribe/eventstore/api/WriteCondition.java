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

import org.inscribe.eventstore.api.condition.Condition;

import static java.util.Objects.requireNonNull;
import static org.inscribe.eventstore.api.condition.Condition.eq;

/**
 * A write condition may be attached to a {@link Command}. It's evaluated against the sequence of the command's aggregate
 * just before the command's event is appended (i.e. the sequence of the previous event of the aggregate, {@code 0} for
 * a new aggregate). If it's not fulfilled the whole batch is rolled back.
 */
public sealed interface WriteCondition {

    /**
     * The aggregate sequence doesn't matter, essentially the same as an unconditional write.
     *
     * @return A {@link WriteCondition} with the behavior specified above.
     */
    static WriteCondition anySequence() {
        return SequenceWriteCondition.any();
    }

    /**
     * The aggregate must be at exactly {@code sequence} in order for the event to be appended. Use {@code 0} to
     * require that the aggregate doesn't exist yet.
     *
     * @return A {@link WriteCondition} with the behavior specified above.
     */
    static WriteCondition sequenceEq(long sequence) {
        return sequence(eq(sequence));
    }

    /**
     * The aggregate sequence must match the specified {@link Condition} in order for the event to be appended.
     *
     * @return A {@link WriteCondition} with the behavior specified above.
     */
    static WriteCondition sequence(Condition<Long> condition) {
        return SequenceWriteCondition.sequence(condition);
    }

    /**
     * @param currentSequence The sequence of the aggregate before the event is appended
     * @return {@code true} if the condition is fulfilled
     */
    boolean isFulfilledBy(long currentSequence);

    default boolean isAnySequence() {
        return this instanceof SequenceWriteCondition && ((SequenceWriteCondition) this).isAny();
    }

    record SequenceWriteCondition(Condition<Long> condition) implements WriteCondition {

        public static SequenceWriteCondition sequence(Condition<Long> condition) {
            requireNonNull(condition, "Sequence condition cannot be null");
            return new SequenceWriteCondition(condition);
        }

        public static SequenceWriteCondition any() {
            return new SequenceWriteCondition(null);
        }

        @Override
        public boolean isFulfilledBy(long currentSequence) {
            return condition == null || condition.test(currentSequence);
        }

        public boolean isAny() {
            return condition == null;
        }

        @Override
        public String toString() {
            return condition == null ? "any" : condition.description();
        }
    }
}

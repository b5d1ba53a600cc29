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

import static java.util.Objects.requireNonNull;

/**
 * The transaction that was supposed to append the batch could not be established or completed.
 */
public class TransactionException extends EventStoreException {
    private final Phase phase;

    public enum Phase {
        ACQUIRE_CONNECTION, BEGIN, COMMIT
    }

    public TransactionException(Phase phase, String message, Throwable cause) {
        super(message, cause);
        this.phase = requireNonNull(phase, "Phase cannot be null");
    }

    /**
     * @return The phase of the transaction that failed
     */
    public Phase getPhase() {
        return phase;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransactionException)) return false;
        TransactionException that = (TransactionException) o;
        return phase == that.phase && Objects.equals(getMessage(), that.getMessage());
    }

    @Override
    public int hashCode() {
        return Objects.hash(phase, getMessage());
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", getClass().getSimpleName() + "[", "]")
                .add("phase=" + phase)
                .add("message=" + getMessage())
                .toString();
    }
}

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
 * A key of a {@link UniqueConstraint} is already reserved by another aggregate. The whole batch has been rolled back,
 * resubmitting the same batch will fail again unless the key is released in the meantime.
 */
public class UniqueConstraintViolationException extends EventStoreException {
    private final String namespace;
    private final String key;
    private final Aggregate aggregate;

    public UniqueConstraintViolationException(String namespace, String key, Aggregate aggregate, String message) {
        super(message);
        this.namespace = namespace;
        this.key = key;
        this.aggregate = aggregate;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getKey() {
        return key;
    }

    /**
     * @return The aggregate that tried to reserve the key
     */
    public Aggregate getAggregate() {
        return aggregate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UniqueConstraintViolationException)) return false;
        UniqueConstraintViolationException that = (UniqueConstraintViolationException) o;
        return Objects.equals(namespace, that.namespace) && Objects.equals(key, that.key) && Objects.equals(aggregate, that.aggregate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, key, aggregate);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", UniqueConstraintViolationException.class.getSimpleName() + "[", "]")
                .add("namespace='" + namespace + "'")
                .add("key='" + key + "'")
                .add("aggregate=" + aggregate)
                .add("message=" + getMessage())
                .toString();
    }
}

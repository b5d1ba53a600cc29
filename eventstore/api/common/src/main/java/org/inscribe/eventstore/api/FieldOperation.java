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

import static java.util.Objects.requireNonNull;

/**
 * A mutation of a denormalized (entity, field) value that is kept in sync with the event stream. Field operations of a
 * batch are applied in the order they were submitted, so the last operation on an (entity, field) pair wins.
 */
@NullMarked
public sealed interface FieldOperation {

    String entityType();

    String entityId();

    /**
     * Set {@code fieldName} of the entity to {@code value}. The value is serialized to JSON.
     */
    static FieldOperation set(String entityType, String entityId, String fieldName, @Nullable Object value) {
        return new Set(entityType, entityId, fieldName, value);
    }

    /**
     * Remove {@code fieldName} of the entity.
     */
    static FieldOperation remove(String entityType, String entityId, String fieldName) {
        return new Remove(entityType, entityId, fieldName);
    }

    /**
     * Remove all fields of the entity.
     */
    static FieldOperation removeEntity(String entityType, String entityId) {
        return new RemoveEntity(entityType, entityId);
    }

    record Set(String entityType, String entityId, String fieldName, @Nullable Object value) implements FieldOperation {
        public Set {
            requireNonNull(entityType, "Entity type cannot be null");
            requireNonNull(entityId, "Entity id cannot be null");
            requireNonNull(fieldName, "Field name cannot be null");
        }
    }

    record Remove(String entityType, String entityId, String fieldName) implements FieldOperation {
        public Remove {
            requireNonNull(entityType, "Entity type cannot be null");
            requireNonNull(entityId, "Entity id cannot be null");
            requireNonNull(fieldName, "Field name cannot be null");
        }
    }

    record RemoveEntity(String entityType, String entityId) implements FieldOperation {
        public RemoveEntity {
            requireNonNull(entityType, "Entity type cannot be null");
            requireNonNull(entityId, "Entity id cannot be null");
        }
    }
}

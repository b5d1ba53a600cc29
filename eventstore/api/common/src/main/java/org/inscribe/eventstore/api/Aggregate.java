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
 * Identifies the aggregate instance that owns a sequence of events.
 *
 * @param type  The aggregate type, for example {@code user}
 * @param id    The id of the aggregate instance, unique within {@code type}
 * @param owner The owner of the aggregate (e.g. an organization), may be {@code null}
 */
@NullMarked
public record Aggregate(String type, String id, @Nullable String owner) {

    public Aggregate {
        requireNonNull(type, "Aggregate type cannot be null");
        requireNonNull(id, "Aggregate id cannot be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("Aggregate type cannot be blank");
        }
        if (id.isBlank()) {
            throw new IllegalArgumentException("Aggregate id cannot be blank");
        }
    }

    public static Aggregate aggregate(String type, String id) {
        return new Aggregate(type, id, null);
    }

    public static Aggregate aggregate(String type, String id, String owner) {
        return new Aggregate(type, id, requireNonNull(owner, "Owner cannot be null"));
    }

    @Override
    public String toString() {
        return type + ":" + id;
    }
}

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
 * A store-level uniqueness rule attached to a {@link Command}. The aggregate of the command is the owner of the key.
 * Constraints are applied in the same transaction as the events of the batch, a violation rolls back the whole batch.
 */
@NullMarked
public sealed interface UniqueConstraint {

    /**
     * Reserve {@code key} in {@code namespace}, for example reserve an e-mail address in the namespace {@code user_email}.
     */
    static UniqueConstraint reserve(String namespace, String key) {
        return new Reserve(namespace, key, null);
    }

    /**
     * Reserve {@code key} in {@code namespace} and use {@code errorMessage} as the message of the
     * {@link UniqueConstraintViolationException} if the key is already taken.
     */
    static UniqueConstraint reserve(String namespace, String key, String errorMessage) {
        return new Reserve(namespace, key, requireNonNull(errorMessage, "Error message cannot be null"));
    }

    /**
     * Release a previously reserved {@code key} in {@code namespace}.
     */
    static UniqueConstraint release(String namespace, String key) {
        return new Release(namespace, key);
    }

    /**
     * Release every key owned by the aggregate of the command, typically when the aggregate is removed.
     */
    static UniqueConstraint releaseAll() {
        return new ReleaseAll();
    }

    record Reserve(String namespace, String key, @Nullable String errorMessage) implements UniqueConstraint {
        public Reserve {
            requireNonNull(namespace, "Namespace cannot be null");
            requireNonNull(key, "Key cannot be null");
        }
    }

    record Release(String namespace, String key) implements UniqueConstraint {
        public Release {
            requireNonNull(namespace, "Namespace cannot be null");
            requireNonNull(key, "Key cannot be null");
        }
    }

    record ReleaseAll() implements UniqueConstraint {
    }
}

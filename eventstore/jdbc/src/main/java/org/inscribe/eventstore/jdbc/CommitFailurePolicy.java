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

package org.inscribe.eventstore.jdbc;

import org.inscribe.eventstore.api.AmbiguousCommitOutcomeException;

/**
 * What the {@link JdbcEventStore} does when the commit fails after every write of the batch succeeded. At that point
 * the events may already be durable, so neither "success" nor "failure" is certain.
 */
public enum CommitFailurePolicy {
    /**
     * Log a warning and return the events as if the commit succeeded.
     */
    LOG_AND_IGNORE,
    /**
     * Throw an {@link AmbiguousCommitOutcomeException} that carries the events.
     */
    FAIL_WITH_AMBIGUOUS_OUTCOME
}

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

package org.inscribe.eventstore.api.blocking;

import org.inscribe.eventstore.api.CancellationSignal;
import org.inscribe.eventstore.api.Command;
import org.inscribe.eventstore.api.Event;

import java.util.Arrays;
import java.util.List;

/**
 * An event store that appends batches of {@link Command}s as {@link Event}s in a blocking fashion.
 * <p>
 * A batch is atomic: either every command becomes an event, and all of their unique constraints and field operations
 * are applied, or nothing is written at all.
 */
public interface EventStore {

    /**
     * Append {@code commands} as one atomic batch.
     *
     * @param commands The commands to append, in order
     * @return One event per command, in the same order as {@code commands}
     */
    default List<Event> push(List<Command> commands) {
        return push(CancellationSignal.none(), commands);
    }

    /**
     * Append {@code commands} as one atomic batch.
     *
     * @param commands The commands to append, in order
     * @return One event per command, in the same order as {@code commands}
     */
    default List<Event> push(Command... commands) {
        return push(Arrays.asList(commands));
    }

    /**
     * Append {@code commands} as one atomic batch. The push can be aborted by cancelling {@code cancellationSignal}, in
     * which case nothing is written and a {@link org.inscribe.eventstore.api.PushCancelledException} is thrown.
     *
     * @param cancellationSignal The signal that aborts the push when cancelled
     * @param commands           The commands to append, in order
     * @return One event per command, in the same order as {@code commands}. An empty batch returns an empty list
     * without contacting the backend.
     */
    List<Event> push(CancellationSignal cancellationSignal, List<Command> commands);
}

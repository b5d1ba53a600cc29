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


package org.inscribe.eventstore.jdbc.internal;

import org.inscribe.eventstore.api.Command;
import org.inscribe.eventstore.api.Event;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.inscribe.eventstore.api.Aggregate.aggregate;

class PendingEventTest {

    private final Command command = Command.builder(aggregate("user", "1"), "UserRegistered").build();

    @Test
    void ordering_can_only_be_assigned_once() {
        // Given
        PendingEvent event = new PendingEvent(0, command, null, List.of());
        event.assign(OffsetDateTime.now(), 1, 1);

        // When
        Throwable throwable = catchThrowable(() -> event.assign(OffsetDateTime.now(), 2, 2));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class);
        assertThat(event.sequence()).isEqualTo(1);
    }

    @Test
    void unassigned_event_cannot_become_an_event() {
        // Given
        PendingEvent event = new PendingEvent(0, command, null, List.of());

        // When
        Throwable throwable = catchThrowable(event::toEvent);

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class);
    }

    @Test
    void assigned_event_becomes_an_immutable_event() {
        // Given
        OffsetDateTime now = OffsetDateTime.now();
        PendingEvent pendingEvent = new PendingEvent(0, command, "{}", List.of());
        pendingEvent.assign(now, 3, 17);

        // When
        Event event = pendingEvent.toEvent();

        // Then
        assertThat(event.command()).isEqualTo(command);
        assertThat(event.payload()).isEqualTo("{}");
        assertThat(event.createdAt()).isEqualTo(now);
        assertThat(event.sequence()).isEqualTo(3);
        assertThat(event.position()).isEqualTo(17);
    }
}

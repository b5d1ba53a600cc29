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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.inscribe.domain.UserRegistered;
import org.inscribe.eventstore.api.*;
import org.inscribe.testsupport.postgresql.FlushPostgreSQLExtension;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.postgresql.ds.PGSimpleDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.inscribe.domain.Users.*;
import static org.inscribe.eventstore.api.Aggregate.aggregate;

@Timeout(30)
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("jdbc event store with postgresql")
class JdbcEventStorePostgreSQLTest {

    @Container
    private static final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:16-alpine");

    @RegisterExtension
    FlushPostgreSQLExtension flushPostgreSQLExtension = new FlushPostgreSQLExtension(JdbcEventStorePostgreSQLTest::dataSource);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private DataSource dataSource;
    private JdbcEventStore eventStore;

    @BeforeEach
    void create_jdbc_event_store() {
        dataSource = dataSource();
        JdbcEventStoreSchema.initialize(dataSource);
        eventStore = new JdbcEventStore(dataSource, new JdbcEventStoreConfig.Builder().objectMapper(objectMapper).build());
    }

    @Nested
    @DisplayName("events")
    class Events {

        @Test
        void sequences_are_assigned_per_aggregate_and_positions_increase_within_the_batch() {
            // When
            List<Event> events = eventStore.push(
                    register("1", "jane@example.com", "Jane"),
                    register("2", "john@example.com", "John"),
                    changeEmail("1", 1, "jane@example.com", "jane.doe@example.com"));

            // Then
            assertThat(events).extracting(Event::aggregate).containsExactly(user("1"), user("2"), user("1"));
            assertThat(events).extracting(Event::sequence).containsExactly(1L, 1L, 2L);
            assertThat(events.get(0).position()).isLessThan(events.get(1).position());
            assertThat(events.get(1).position()).isLessThan(events.get(2).position());
            assertThat(events).extracting(Event::createdAt).doesNotContainNull();
        }

        @Test
        void sequences_continue_across_pushes() {
            // Given
            List<Event> first = eventStore.push(register("1", "jane@example.com", "Jane"));

            // When
            List<Event> second = eventStore.push(changeEmail("1", 1, "jane@example.com", "jane.doe@example.com"));

            // Then
            assertThat(second.get(0).sequence()).isEqualTo(2L);
            assertThat(second.get(0).position()).isGreaterThan(first.get(0).position());
        }

        @Test
        void events_are_persisted_with_all_their_attributes() throws Exception {
            // Given
            Command command = Command.builder(aggregate("user", "1", "tenant"), "UserRegistered")
                    .revision((short) 3)
                    .creator("admin")
                    .payload(new UserRegistered("1", "jane@example.com", "Jane \"JD\" Doe"))
                    .build();

            // When
            Event event = eventStore.push(command).get(0);

            // Then
            try (Connection connection = dataSource.getConnection();
                 PreparedStatement statement = connection.prepareStatement("SELECT owner, event_type, revision, creator, payload::text, created_at, \"position\", in_tx_order FROM eventstore.events WHERE aggregate_type = 'user' AND aggregate_id = '1'");
                 ResultSet row = statement.executeQuery()) {
                assertThat(row.next()).isTrue();
                assertThat(row.getString(1)).isEqualTo("tenant");
                assertThat(row.getString(2)).isEqualTo("UserRegistered");
                assertThat(row.getShort(3)).isEqualTo((short) 3);
                assertThat(row.getString(4)).isEqualTo("admin");
                assertThat(objectMapper.readTree(row.getString(5))).isEqualTo(objectMapper.readTree(event.payload()));
                assertThat(row.getObject(6, OffsetDateTime.class).toInstant()).isEqualTo(event.createdAt().toInstant());
                assertThat(row.getLong(7)).isEqualTo(event.position());
                assertThat(row.getInt(8)).isEqualTo(1);
                assertThat(row.next()).isFalse();
            }
            JsonNode payload = objectMapper.readTree(event.payload());
            assertThat(payload.get("name").asText()).isEqualTo("Jane \"JD\" Doe");
        }

        @Test
        void command_without_payload_is_stored_with_null_payload() throws SQLException {
            // When
            Event event = eventStore.push(Command.builder(user("1"), "UserPinged").build()).get(0);

            // Then
            assertThat(event.payload()).isNull();
            assertThat(queryString("SELECT payload::text FROM eventstore.events WHERE aggregate_id = '1'")).isEmpty();
        }

        @Test
        void batch_is_rolled_back_when_a_write_condition_is_not_fulfilled() throws SQLException {
            // Given
            eventStore.push(register("1", "jane@example.com", "Jane"));

            // When
            Throwable throwable = catchThrowable(() -> eventStore.push(
                    register("2", "john@example.com", "John"),
                    changeEmail("1", 0, "jane@example.com", "jane.doe@example.com")));

            // Then
            assertThat(throwable).isExactlyInstanceOf(WriteConditionNotFulfilledException.class);
            assertThat(((WriteConditionNotFulfilledException) throwable).getCurrentSequence()).isEqualTo(1L);
            assertThat(countEvents()).isEqualTo(1);
            assertThat(ownerOf("john@example.com")).isEmpty();
            assertThat(field("2", "email")).isEmpty();
        }
    }

    @Nested
    @DisplayName("unique constraints")
    class UniqueConstraints {

        @Test
        void reserved_key_cannot_be_reserved_by_another_aggregate() throws SQLException {
            // Given
            eventStore.push(register("1", "jane@example.com", "Jane"));

            // When
            Throwable throwable = catchThrowable(() -> eventStore.push(register("2", "jane@example.com", "Jane Two")));

            // Then
            assertThat(throwable).isExactlyInstanceOf(UniqueConstraintViolationException.class).hasMessage("Email jane@example.com is already in use");
            assertThat(countEvents()).isEqualTo(1);
            assertThat(field("2", "name")).isEmpty();
            assertThat(ownerOf("jane@example.com")).hasValue("1");
        }

        @Test
        void released_key_can_be_reserved_by_another_aggregate() throws SQLException {
            // Given
            eventStore.push(register("1", "jane@example.com", "Jane"));
            eventStore.push(changeEmail("1", 1, "jane@example.com", "jane.doe@example.com"));

            // When
            eventStore.push(register("2", "jane@example.com", "Jane Two"));

            // Then
            assertThat(ownerOf("jane@example.com")).hasValue("2");
            assertThat(ownerOf("jane.doe@example.com")).hasValue("1");
        }

        @Test
        void release_all_frees_every_key_of_the_aggregate() throws SQLException {
            // Given
            eventStore.push(register("1", "jane@example.com", "Jane"));

            // When
            eventStore.push(unregister("1"));

            // Then
            assertThat(ownerOf("jane@example.com")).isEmpty();
            eventStore.push(register("2", "jane@example.com", "Jane Two"));
            assertThat(ownerOf("jane@example.com")).hasValue("2");
        }

        @Test
        void only_one_of_two_concurrent_reservations_of_the_same_key_succeeds() throws Exception {
            // Given
            CyclicBarrier barrier = new CyclicBarrier(2);
            ExecutorService executor = Executors.newFixedThreadPool(2);

            // When
            List<Future<List<Event>>> results = new ArrayList<>();
            for (String userId : List.of("1", "2")) {
                results.add(executor.submit(() -> {
                    barrier.await();
                    return eventStore.push(register(userId, "jane@example.com", "Jane " + userId));
                }));
            }
            executor.shutdown();

            // Then
            List<Throwable> failures = new ArrayList<>();
            int successes = 0;
            for (Future<List<Event>> result : results) {
                try {
                    result.get();
                    successes++;
                } catch (ExecutionException e) {
                    failures.add(e.getCause());
                }
            }
            assertThat(successes).isEqualTo(1);
            assertThat(failures).singleElement().isInstanceOf(UniqueConstraintViolationException.class);
            assertThat(countEvents()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("field projections")
    class FieldProjections {

        @Test
        void set_fields_are_stored_as_json_with_the_position_of_the_event() throws SQLException {
            // When
            Event event = eventStore.push(register("1", "jane@example.com", "Jane")).get(0);

            // Then
            assertThat(field("1", "email")).hasValue("\"jane@example.com\"");
            assertThat(field("1", "name")).hasValue("\"Jane\"");
            assertThat(queryString("SELECT \"position\"::text FROM eventstore.fields WHERE entity_id = '1' AND field_name = 'email'")).hasValue(String.valueOf(event.position()));
        }

        @Test
        void last_operation_on_a_field_wins() throws SQLException {
            // When
            eventStore.push(
                    register("1", "jane@example.com", "Jane"),
                    changeEmail("1", 1, "jane@example.com", "jane.doe@example.com"));

            // Then
            assertThat(field("1", "email")).hasValue("\"jane.doe@example.com\"");
        }

        @Test
        void removing_an_entity_removes_all_its_fields() throws SQLException {
            // Given
            eventStore.push(register("1", "jane@example.com", "Jane"));

            // When
            eventStore.push(unregister("1"));

            // Then
            assertThat(field("1", "email")).isEmpty();
            assertThat(field("1", "name")).isEmpty();
        }

        @Test
        void batch_is_rolled_back_when_a_field_cannot_be_stored() throws SQLException {
            // Given
            Command unstorableName = Command.builder(user("2"), "NameChanged")
                    .fieldOperation(FieldOperation.set(ENTITY_TYPE, "2", "name", "nul\u0000"))
                    .build();

            // When
            Throwable throwable = catchThrowable(() -> eventStore.push(register("1", "jane@example.com", "Jane"), unstorableName));

            // Then
            assertThat(throwable).isExactlyInstanceOf(EventStoreWriteException.class);
            assertThat(countEvents()).isZero();
            assertThat(ownerOf("jane@example.com")).isEmpty();
            assertThat(field("1", "email")).isEmpty();
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        void concurrent_pushes_to_the_same_aggregate_get_unique_consecutive_sequences() throws Exception {
            // Given
            int numberOfPushes = 10;
            CyclicBarrier barrier = new CyclicBarrier(numberOfPushes);
            ExecutorService executor = Executors.newFixedThreadPool(numberOfPushes);

            // When
            List<Future<List<Event>>> results = IntStream.range(0, numberOfPushes)
                    .mapToObj(i -> executor.submit(() -> {
                        barrier.await();
                        return eventStore.push(Command.builder(user("1"), "UserPinged").build());
                    }))
                    .collect(Collectors.toList());
            executor.shutdown();

            // Then
            List<Event> events = new ArrayList<>();
            for (Future<List<Event>> result : results) {
                events.addAll(result.get());
            }
            assertThat(events).extracting(Event::sequence).containsExactlyInAnyOrderElementsOf(LongStream.rangeClosed(1, numberOfPushes).boxed().collect(Collectors.toList()));
            assertThat(events).extracting(Event::position).doesNotHaveDuplicates();
            List<Event> bySequence = events.stream().sorted(Comparator.comparingLong(Event::sequence)).collect(Collectors.toList());
            assertThat(bySequence).extracting(Event::position).isSorted();
        }
    }

    @Nested
    @DisplayName("when the push function is missing")
    class WhenPushFunctionIsMissing {

        @Test
        void events_are_still_appended_when_only_the_function_is_missing() throws SQLException {
            // Given
            execute("DROP FUNCTION eventstore.push(eventstore.command[])");

            // When
            List<Event> events = eventStore.push(
                    register("1", "jane@example.com", "Jane"),
                    changeEmail("1", 1, "jane@example.com", "jane.doe@example.com"));

            // Then
            assertThat(events).extracting(Event::sequence).containsExactly(1L, 2L);
            assertThat(events.get(0).position()).isLessThan(events.get(1).position());
            assertThat(field("1", "email")).hasValue("\"jane.doe@example.com\"");
            assertThat(ownerOf("jane.doe@example.com")).hasValue("1");
        }

        @Test
        void events_are_still_appended_when_the_command_type_is_missing() throws SQLException {
            // Given
            execute("DROP TYPE eventstore.command CASCADE");

            // When
            List<Event> events = eventStore.push(register("1", "jane@example.com", "Jane"), register("2", "john@example.com", "John"));

            // Then
            assertThat(events).extracting(Event::sequence).containsExactly(1L, 1L);
            assertThat(countEvents()).isEqualTo(2);
        }

        @Test
        void unique_constraints_are_enforced_by_the_fallback_as_well() throws SQLException {
            // Given
            execute("DROP FUNCTION eventstore.push(eventstore.command[])");
            eventStore.push(register("1", "jane@example.com", "Jane"));

            // When
            Throwable throwable = catchThrowable(() -> eventStore.push(register("2", "jane@example.com", "Jane Two")));

            // Then
            assertThat(throwable).isExactlyInstanceOf(UniqueConstraintViolationException.class);
            assertThat(countEvents()).isEqualTo(1);
        }
    }

    @Test
    void event_store_fails_with_sql_state_when_tables_are_missing() throws SQLException {
        // Given
        execute("DROP SCHEMA eventstore CASCADE");

        // When
        Throwable throwable = catchThrowable(() -> eventStore.push(register("1", "jane@example.com", "Jane")));

        // Then
        assertThat(throwable).isExactlyInstanceOf(EventStoreWriteException.class);
        assertThat(((EventStoreWriteException) throwable).getSqlState()).isEqualTo("42P01");
    }

    private static DataSource dataSource() {
        PGSimpleDataSource dataSource = new PGSimpleDataSource();
        dataSource.setUrl(postgreSQLContainer.getJdbcUrl());
        dataSource.setUser(postgreSQLContainer.getUsername());
        dataSource.setPassword(postgreSQLContainer.getPassword());
        return dataSource;
    }

    private void execute(String sql) throws SQLException {
        try (Connection connection = dataSource.getConnection(); Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }

    private long countEvents() throws SQLException {
        return queryString("SELECT count(*)::text FROM eventstore.events").map(Long::parseLong).orElse(0L);
    }

    private Optional<String> ownerOf(String email) throws SQLException {
        return queryString("SELECT aggregate_id FROM eventstore.unique_constraints WHERE namespace = '" + EMAIL_NAMESPACE + "' AND unique_key = '" + email + "'");
    }

    private Optional<String> field(String userId, String fieldName) throws SQLException {
        return queryString("SELECT value::text FROM eventstore.fields WHERE entity_type = '" + ENTITY_TYPE + "' AND entity_id = '" + userId + "' AND field_name = '" + fieldName + "'");
    }

    private Optional<String> queryString(String sql) throws SQLException {
        try (Connection connection = dataSource.getConnection(); Statement statement = connection.createStatement(); ResultSet resultSet = statement.executeQuery(sql)) {
            if (!resultSet.next()) {
                return Optional.empty();
            }
            return Optional.ofNullable(resultSet.getString(1));
        }
    }
}

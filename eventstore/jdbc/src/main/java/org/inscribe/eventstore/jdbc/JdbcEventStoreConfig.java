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

import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;
import static java.util.Objects.requireNonNullElse;
import static java.util.Objects.requireNonNullElseGet;

/**
 * Configuration for the {@link JdbcEventStore}
 */
@NullMarked
public class JdbcEventStoreConfig {
    static final String INSTRUMENTATION_SCOPE = "org.inscribe.eventstore.jdbc";

    public final StorageBackend storageBackend;
    public final ObjectMapper objectMapper;
    public final CommitFailurePolicy commitFailurePolicy;
    public final Duration queryTimeout;
    public final Tracer tracer;

    private JdbcEventStoreConfig(StorageBackend storageBackend, ObjectMapper objectMapper, CommitFailurePolicy commitFailurePolicy, Duration queryTimeout, Tracer tracer) {
        this.storageBackend = requireNonNull(storageBackend, StorageBackend.class.getSimpleName() + " cannot be null");
        this.objectMapper = requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        this.commitFailurePolicy = requireNonNull(commitFailurePolicy, CommitFailurePolicy.class.getSimpleName() + " cannot be null");
        this.queryTimeout = requireNonNull(queryTimeout, "Query timeout cannot be null");
        if (queryTimeout.isNegative()) {
            throw new IllegalArgumentException("Query timeout cannot be negative");
        }
        this.tracer = requireNonNull(tracer, Tracer.class.getSimpleName() + " cannot be null");
    }

    /**
     * Create an {@link JdbcEventStoreConfig} with default settings, i.e. a standard PostgreSQL backend, a default Jackson
     * {@link ObjectMapper}, {@link CommitFailurePolicy#LOG_AND_IGNORE}, no query timeout and the global OpenTelemetry tracer.
     */
    public static JdbcEventStoreConfig defaultConfig() {
        return new Builder().build();
    }

    /**
     * @return The query timeout in whole seconds, as expected by {@link java.sql.Statement#setQueryTimeout(int)}. {@code 0} means no timeout.
     */
    public int queryTimeoutSeconds() {
        long seconds = queryTimeout.toSeconds();
        if (seconds == 0 && !queryTimeout.isZero()) {
            return 1;
        }
        return (int) Math.min(seconds, Integer.MAX_VALUE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JdbcEventStoreConfig)) return false;
        JdbcEventStoreConfig that = (JdbcEventStoreConfig) o;
        return Objects.equals(storageBackend, that.storageBackend) && Objects.equals(objectMapper, that.objectMapper)
                && commitFailurePolicy == that.commitFailurePolicy && Objects.equals(queryTimeout, that.queryTimeout)
                && Objects.equals(tracer, that.tracer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(storageBackend, objectMapper, commitFailurePolicy, queryTimeout, tracer);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", JdbcEventStoreConfig.class.getSimpleName() + "[", "]")
                .add("storageBackend=" + storageBackend)
                .add("commitFailurePolicy=" + commitFailurePolicy)
                .add("queryTimeout=" + queryTimeout)
                .toString();
    }

    @NullUnmarked
    public static final class Builder {
        private StorageBackend storageBackend;
        private ObjectMapper objectMapper;
        private CommitFailurePolicy commitFailurePolicy;
        private Duration queryTimeout;
        private Tracer tracer;

        /**
         * @param storageBackend The flavor of database that events are written to. Defaults to {@link StorageBackend#standard()}.
         * @return The builder instance
         */
        public Builder storageBackend(StorageBackend storageBackend) {
            this.storageBackend = storageBackend;
            return this;
        }

        /**
         * @param objectMapper The Jackson {@link ObjectMapper} used to serialize command payloads and field values
         * @return The builder instance
         */
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * @param commitFailurePolicy What to do if the commit fails after all writes succeeded. Defaults to {@link CommitFailurePolicy#LOG_AND_IGNORE}.
         * @return The builder instance
         */
        public Builder commitFailurePolicy(CommitFailurePolicy commitFailurePolicy) {
            this.commitFailurePolicy = commitFailurePolicy;
            return this;
        }

        /**
         * @param queryTimeout The maximum time each statement may run, rounded up to whole seconds. {@link Duration#ZERO} (default) means no timeout.
         * @return The builder instance
         */
        public Builder queryTimeout(Duration queryTimeout) {
            this.queryTimeout = queryTimeout;
            return this;
        }

        /**
         * @param tracer The OpenTelemetry tracer used for the push spans. Defaults to the tracer of {@link GlobalOpenTelemetry}.
         * @return The builder instance
         */
        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        @NullMarked
        public JdbcEventStoreConfig build() {
            return new JdbcEventStoreConfig(
                    requireNonNullElseGet(storageBackend, StorageBackend::standard),
                    requireNonNullElseGet(objectMapper, ObjectMapper::new),
                    requireNonNullElse(commitFailurePolicy, CommitFailurePolicy.LOG_AND_IGNORE),
                    requireNonNullElse(queryTimeout, Duration.ZERO),
                    requireNonNullElseGet(tracer, () -> GlobalOpenTelemetry.getTracer(INSTRUMENTATION_SCOPE)));
        }
    }
}

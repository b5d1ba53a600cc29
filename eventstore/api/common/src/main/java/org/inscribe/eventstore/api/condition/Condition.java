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

package org.inscribe.eventstore.api.condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;
import static org.inscribe.eventstore.api.condition.Condition.Comparison.*;
import static org.inscribe.eventstore.api.condition.Condition.Composition.*;

/**
 * A condition on a comparable value, for example the sequence an aggregate must have reached before a command
 * is allowed to append its event.
 *
 * @param <T> The type of the value in the condition
 */
public sealed interface Condition<T extends Comparable<T>> {

    String description();

    /**
     * @param value The value to test
     * @return {@code true} if {@code value} fulfills this condition
     */
    boolean test(T value);

    enum Comparison {
        EQ, NE, LT, GT, LTE, GTE
    }

    enum Composition {
        AND, OR, NOT
    }

    record Compare<T extends Comparable<T>>(Comparison comparison, T operand, String description) implements Condition<T> {

        public Compare {
            requireNonNull(comparison, "Comparison cannot be null");
            requireNonNull(operand, "Operand cannot be null");
            requireNonNull(description, "Description cannot be null");
        }

        @Override
        public boolean test(T value) {
            requireNonNull(value, "Value cannot be null");
            int result = value.compareTo(operand);
            return switch (comparison) {
                case EQ -> result == 0;
                case NE -> result != 0;
                case LT -> result < 0;
                case GT -> result > 0;
                case LTE -> result <= 0;
                case GTE -> result >= 0;
            };
        }

        @Override
        public String toString() {
            return description;
        }
    }

    record Composite<T extends Comparable<T>>(Composition composition, List<Condition<T>> conditions, String description) implements Condition<T> {

        public Composite {
            requireNonNull(composition, "Composition cannot be null");
            requireNonNull(conditions, "Conditions cannot be null");
            requireNonNull(description, "Description cannot be null");
            conditions = List.copyOf(conditions);
        }

        @Override
        public boolean test(T value) {
            return switch (composition) {
                case AND -> conditions.stream().allMatch(c -> c.test(value));
                case OR -> conditions.stream().anyMatch(c -> c.test(value));
                case NOT -> conditions.stream().noneMatch(c -> c.test(value));
            };
        }

        @Override
        public String toString() {
            return description;
        }
    }

    static <T extends Comparable<T>> Condition<T> eq(T t) {
        return new Compare<>(EQ, t, String.format("to be equal to %s", t));
    }

    static <T extends Comparable<T>> Condition<T> ne(T t) {
        return new Compare<>(NE, t, String.format("to not be equal to %s", t));
    }

    static <T extends Comparable<T>> Condition<T> lt(T t) {
        return new Compare<>(LT, t, String.format("to be less than %s", t));
    }

    static <T extends Comparable<T>> Condition<T> gt(T t) {
        return new Compare<>(GT, t, String.format("to be greater than %s", t));
    }

    static <T extends Comparable<T>> Condition<T> lte(T t) {
        return new Compare<>(LTE, t, String.format("to be less than or equal to %s", t));
    }

    static <T extends Comparable<T>> Condition<T> gte(T t) {
        return new Compare<>(GTE, t, String.format("to be greater than or equal to %s", t));
    }

    @SafeVarargs
    static <T extends Comparable<T>> Condition<T> and(Condition<T> first, Condition<T> second, Condition<T>... additional) {
        List<Condition<T>> conditions = listOf(first, second, additional);
        return new Composite<>(AND, conditions, conditions.stream().map(Condition::description).collect(Collectors.joining(" and ")));
    }

    @SafeVarargs
    static <T extends Comparable<T>> Condition<T> or(Condition<T> first, Condition<T> second, Condition<T>... additional) {
        List<Condition<T>> conditions = listOf(first, second, additional);
        return new Composite<>(OR, conditions, conditions.stream().map(Condition::description).collect(Collectors.joining(" or ")));
    }

    static <T extends Comparable<T>> Condition<T> not(Condition<T> condition) {
        requireNonNull(condition, "Condition cannot be null");
        return new Composite<>(NOT, Collections.singletonList(condition), "not " + condition.description());
    }

    @SafeVarargs
    private static <T extends Comparable<T>> List<Condition<T>> listOf(Condition<T> first, Condition<T> second, Condition<T>... additional) {
        requireNonNull(first, "First condition cannot be null");
        requireNonNull(second, "Second condition cannot be null");
        List<Condition<T>> conditions = new ArrayList<>(2 + (additional == null ? 0 : additional.length));
        conditions.add(first);
        conditions.add(second);
        if (additional != null) {
            Collections.addAll(conditions, additional);
        }
        return conditions;
    }
}

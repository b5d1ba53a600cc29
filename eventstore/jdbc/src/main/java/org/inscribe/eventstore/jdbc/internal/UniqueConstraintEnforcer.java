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

import org.inscribe.eventstore.api.Aggregate;
import org.inscribe.eventstore.api.UniqueConstraint;
import org.inscribe.eventstore.api.UniqueConstraint.Release;
import org.inscribe.eventstore.api.UniqueConstraint.ReleaseAll;
import org.inscribe.eventstore.api.UniqueConstraint.Reserve;
import org.inscribe.eventstore.api.UniqueConstraintViolationException;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reserves and releases the unique constraint keys of a batch within the append transaction. Constraints are applied in
 * the order of the commands. A constraint that repeats the one right before it for the same aggregate is only applied
 * once.
 */
public class UniqueConstraintEnforcer {
    static final String RESERVE = "INSERT INTO eventstore.unique_constraints (namespace, unique_key, aggregate_type, aggregate_id) VALUES (?, ?, ?, ?) ON CONFLICT (namespace, unique_key) DO NOTHING";
    static final String FIND_OWNER = "SELECT aggregate_type, aggregate_id FROM eventstore.unique_constraints WHERE namespace = ? AND unique_key = ?";
    static final String RELEASE = "DELETE FROM eventstore.unique_constraints WHERE namespace = ? AND unique_key = ?";
    static final String RELEASE_ALL = "DELETE FROM eventstore.unique_constraints WHERE aggregate_type = ? AND aggregate_id = ?";

    public void enforce(WriteTransaction transaction, TranslatedBatch batch) throws SQLException {
        for (OwnedConstraint constraint : constraintsOf(batch)) {
            transaction.throwIfCancelled();
            if (constraint.constraint() instanceof Reserve reserve) {
                reserve(transaction, reserve, constraint.owner());
            } else if (constraint.constraint() instanceof Release release) {
                update(transaction, RELEASE, release.namespace(), release.key());
            } else if (constraint.constraint() instanceof ReleaseAll) {
                update(transaction, RELEASE_ALL, constraint.owner().type(), constraint.owner().id());
            } else {
                throw new IllegalStateException("Unsupported unique constraint: " + constraint.constraint());
            }
        }
    }

    private static List<OwnedConstraint> constraintsOf(TranslatedBatch batch) {
        List<OwnedConstraint> constraints = new ArrayList<>();
        for (PendingEvent event : batch.events()) {
            Aggregate owner = owner(event.command().aggregate());
            for (UniqueConstraint constraint : event.command().uniqueConstraints()) {
                OwnedConstraint owned = new OwnedConstraint(constraint, owner);
                // Only a direct repeat is redundant, a release in between must not be skipped
                if (constraints.isEmpty() || !constraints.get(constraints.size() - 1).equals(owned)) {
                    constraints.add(owned);
                }
            }
        }
        return constraints;
    }

    // The owner of an aggregate is irrelevant for key ownership
    private static Aggregate owner(Aggregate aggregate) {
        return Aggregate.aggregate(aggregate.type(), aggregate.id());
    }

    private void reserve(WriteTransaction transaction, Reserve reserve, Aggregate aggregate) throws SQLException {
        // A conflicting row may be deleted by a concurrent transaction between the insert and the lookup, then we try once more
        for (int attempt = 0; attempt < 2; attempt++) {
            if (insert(transaction, reserve, aggregate) == 1) {
                return;
            }
            Optional<Aggregate> currentOwner = findOwner(transaction, reserve);
            if (currentOwner.isPresent()) {
                if (currentOwner.get().equals(aggregate)) {
                    return;
                }
                break;
            }
        }
        String message = reserve.errorMessage() == null ?
                String.format("Unique constraint violated: key '%s' in namespace '%s' is already taken", reserve.key(), reserve.namespace()) :
                reserve.errorMessage();
        throw new UniqueConstraintViolationException(reserve.namespace(), reserve.key(), aggregate, message);
    }

    private static int insert(WriteTransaction transaction, Reserve reserve, Aggregate aggregate) throws SQLException {
        try (PreparedStatement statement = transaction.prepareStatement(RESERVE)) {
            statement.setString(1, reserve.namespace());
            statement.setString(2, reserve.key());
            statement.setString(3, aggregate.type());
            statement.setString(4, aggregate.id());
            return transaction.execute(statement, statement::executeUpdate);
        }
    }

    private static Optional<Aggregate> findOwner(WriteTransaction transaction, Reserve reserve) throws SQLException {
        try (PreparedStatement statement = transaction.prepareStatement(FIND_OWNER)) {
            statement.setString(1, reserve.namespace());
            statement.setString(2, reserve.key());
            return transaction.execute(statement, () -> {
                try (ResultSet resultSet = statement.executeQuery()) {
                    if (!resultSet.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(Aggregate.aggregate(resultSet.getString(1), resultSet.getString(2)));
                }
            });
        }
    }

    private static void update(WriteTransaction transaction, String sql, String first, String second) throws SQLException {
        try (PreparedStatement statement = transaction.prepareStatement(sql)) {
            statement.setString(1, first);
            statement.setString(2, second);
            transaction.execute(statement, statement::executeUpdate);
        }
    }

    private record OwnedConstraint(UniqueConstraint constraint, Aggregate owner) {
    }
}

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


package org.inscribe.domain;

import org.inscribe.eventstore.api.Aggregate;
import org.inscribe.eventstore.api.Command;

import static org.inscribe.eventstore.api.FieldOperation.removeEntity;
import static org.inscribe.eventstore.api.FieldOperation.set;
import static org.inscribe.eventstore.api.UniqueConstraint.*;
import static org.inscribe.eventstore.api.WriteCondition.sequenceEq;

/**
 * A small user domain where the email of a user must be unique. Each function returns the command that records
 * the decision.
 */
public class Users {
    public static final String AGGREGATE_TYPE = "user";
    public static final String EMAIL_NAMESPACE = "user_email";
    public static final String ENTITY_TYPE = "user";

    public static Aggregate user(String userId) {
        return Aggregate.aggregate(AGGREGATE_TYPE, userId);
    }

    public static Command register(String userId, String email, String name) {
        return Command.builder(user(userId), "UserRegistered")
                .payload(new UserRegistered(userId, email, name))
                .writeCondition(sequenceEq(0))
                .uniqueConstraint(reserve(EMAIL_NAMESPACE, email, "Email " + email + " is already in use"))
                .fieldOperation(set(ENTITY_TYPE, userId, "email", email))
                .fieldOperation(set(ENTITY_TYPE, userId, "name", name))
                .build();
    }

    public static Command changeEmail(String userId, long currentSequence, String previousEmail, String email) {
        return Command.builder(user(userId), "EmailChanged")
                .payload(new EmailChanged(userId, previousEmail, email))
                .writeCondition(sequenceEq(currentSequence))
                .uniqueConstraint(release(EMAIL_NAMESPACE, previousEmail))
                .uniqueConstraint(reserve(EMAIL_NAMESPACE, email, "Email " + email + " is already in use"))
                .fieldOperation(set(ENTITY_TYPE, userId, "email", email))
                .build();
    }

    public static Command unregister(String userId) {
        return Command.builder(user(userId), "UserUnregistered")
                .uniqueConstraint(releaseAll())
                .fieldOperation(removeEntity(ENTITY_TYPE, userId))
                .build();
    }
}

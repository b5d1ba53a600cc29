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

import java.util.Objects;

public class EmailChanged {

    private String userId;
    private String previousEmail;
    private String email;

    @SuppressWarnings("unused")
    EmailChanged() {
    }

    public EmailChanged(String userId, String previousEmail, String email) {
        this.userId = userId;
        this.previousEmail = previousEmail;
        this.email = email;
    }

    public String getUserId() {
        return userId;
    }

    public String getPreviousEmail() {
        return previousEmail;
    }

    public String getEmail() {
        return email;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmailChanged)) return false;
        EmailChanged that = (EmailChanged) o;
        return Objects.equals(userId, that.userId) &&
                Objects.equals(previousEmail, that.previousEmail) &&
                Objects.equals(email, that.email);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, previousEmail, email);
    }

    @Override
    public String toString() {
        return "EmailChanged{" +
                "userId='" + userId + '\'' +
                ", previousEmail='" + previousEmail + '\'' +
                ", email='" + email + '\'' +
                '}';
    }
}

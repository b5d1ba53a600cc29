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

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

class SqlErrorsTest {

    @ParameterizedTest
    @CsvSource({"42883,true", "42704,true", "42P01,false", "23505,false", "57014,false"})
    void setup_is_not_executed_when_function_or_type_is_missing(String sqlState, boolean expected) {
        SQLException exception = new SQLException("error", sqlState);

        assertThat(SqlErrors.isSetupNotExecuted(exception)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"42883,true", "XX000,false"})
    void sql_state_is_found_in_the_cause_chain(String sqlState, boolean expected) {
        RuntimeException exception = new RuntimeException(new IllegalStateException(new SQLException("error", sqlState)));

        assertThat(SqlErrors.sqlState(exception)).isEqualTo(sqlState);
        assertThat(SqlErrors.isSetupNotExecuted(exception)).isEqualTo(expected);
    }
}

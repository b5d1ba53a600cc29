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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommandRecordTest {

    @Test
    void null_fields_are_left_empty_and_other_fields_are_quoted() {
        assertThat(CommandRecord.compositeLiteral("a", null, "")).isEqualTo("(\"a\",,\"\")");
    }

    @Test
    void quotes_and_backslashes_are_escaped() {
        assertThat(CommandRecord.compositeLiteral("say \"hi\"", "C:\\temp")).isEqualTo("(\"say \\\"hi\\\"\",\"C:\\\\temp\")");
    }

    @Test
    void record_created_by_the_driver_has_the_command_type() {
        assertThat(new CommandRecord().getType()).isEqualTo(CommandRecord.TYPE_NAME);
    }
}

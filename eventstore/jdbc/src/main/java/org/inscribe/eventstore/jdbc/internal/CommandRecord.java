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
import org.postgresql.util.PGobject;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * One element of the array argument of the {@code eventstore.push} function, i.e. a value of the composite type
 * {@code eventstore.command} in its text form.
 */
public class CommandRecord extends PGobject {
    public static final String TYPE_NAME = "eventstore.command";

    private static final long serialVersionUID = 1L;

    /**
     * Used by the driver when it reads values of {@value #TYPE_NAME}.
     */
    public CommandRecord() {
        this.type = TYPE_NAME;
    }

    CommandRecord(Command command, String payload) {
        this();
        this.value = compositeLiteral(
                command.aggregate().type(),
                command.aggregate().id(),
                command.aggregate().owner(),
                command.type(),
                Short.toString(command.revision()),
                command.creator(),
                payload);
    }

    static String compositeLiteral(String... fields) {
        return Arrays.stream(fields)
                .map(CommandRecord::quote)
                .collect(Collectors.joining(",", "(", ")"));
    }

    // An unquoted empty field is NULL, a quoted one is the empty string
    private static String quote(String field) {
        if (field == null) {
            return "";
        }
        return '"' + field.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}

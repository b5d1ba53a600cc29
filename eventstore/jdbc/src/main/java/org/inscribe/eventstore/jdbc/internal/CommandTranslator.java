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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.inscribe.eventstore.api.Command;
import org.inscribe.eventstore.api.FieldOperation;
import org.inscribe.eventstore.api.TranslationException;
import org.inscribe.eventstore.jdbc.internal.PendingEvent.EncodedFieldOperation;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Translates commands into event placeholders and push function records. Payloads and field values are serialized
 * with Jackson. Translation doesn't do any I/O.
 */
public class CommandTranslator {
    private final ObjectMapper objectMapper;

    public CommandTranslator(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
    }

    public TranslatedBatch translate(List<Command> commands) {
        requireNonNull(commands, "Commands cannot be null");
        List<PendingEvent> events = new ArrayList<>(commands.size());
        List<CommandRecord> records = new ArrayList<>(commands.size());
        for (int index = 0; index < commands.size(); index++) {
            Command command = requireNonNull(commands.get(index), "Command at index " + index + " cannot be null");
            String payload = command.payload() == null ? null : serialize(index, command, command.payload(), "payload");
            events.add(new PendingEvent(index, command, payload, encodeFieldOperations(index, command)));
            records.add(new CommandRecord(command, payload));
        }
        return new TranslatedBatch(events, records);
    }

    private List<EncodedFieldOperation> encodeFieldOperations(int index, Command command) {
        List<EncodedFieldOperation> encoded = new ArrayList<>(command.fieldOperations().size());
        for (FieldOperation operation : command.fieldOperations()) {
            final String value;
            if (operation instanceof FieldOperation.Set set) {
                value = serialize(index, command, set.value(), "value of field " + set.fieldName());
            } else {
                value = null;
            }
            encoded.add(new EncodedFieldOperation(operation, value));
        }
        return encoded;
    }

    private String serialize(int index, Command command, Object value, String what) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new TranslationException(index, command.aggregate(), command.type(), "couldn't serialize " + what + " to JSON: " + e.getOriginalMessage(), e);
        }
    }
}

package me.golemcore.gateway.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Library-independent JSON value used by the agent stream parser.
 *
 * <p>
 * Exactly one of the nested record types represents any value. Extraction
 * rules are written against this shape instead of a particular JSON library's
 * node classes.
 */
public interface JsonValue {

    JsonValue NULL = new Null();

    Kind kind();

    enum Kind {
        NULL, STRING, NUMBER, BOOLEAN, SEQUENCE, OBJECT
    }

    static JsonValue string(String value) {
        return value == null ? NULL : new Str(value);
    }

    static JsonValue sequence(List<JsonValue> items) {
        return new Seq(List.copyOf(items));
    }

    static JsonValue object(Map<String, JsonValue> fields) {
        return new Obj(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    record Null() implements JsonValue {
        @Override
        public Kind kind() {
            return Kind.NULL;
        }
    }

    record Str(String value) implements JsonValue {
        @Override
        public Kind kind() {
            return Kind.STRING;
        }
    }

    record Num(String literal) implements JsonValue {
        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }
    }

    record Bool(boolean value) implements JsonValue {
        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }
    }

    record Seq(List<JsonValue> items) implements JsonValue {
        @Override
        public Kind kind() {
            return Kind.SEQUENCE;
        }
    }

    record Obj(Map<String, JsonValue> fields) implements JsonValue {
        @Override
        public Kind kind() {
            return Kind.OBJECT;
        }

        public boolean has(String key) {
            return fields.containsKey(key);
        }

        public JsonValue get(String key) {
            return fields.getOrDefault(key, NULL);
        }

        /**
         * Returns the field as a string when it holds a JSON string.
         */
        public Optional<String> string(String key) {
            if (get(key) instanceof Str str) {
                return Optional.of(str.value());
            }
            return Optional.empty();
        }

        public Optional<Obj> object(String key) {
            if (get(key) instanceof Obj obj) {
                return Optional.of(obj);
            }
            return Optional.empty();
        }
    }
}

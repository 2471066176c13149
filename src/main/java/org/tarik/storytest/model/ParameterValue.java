/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
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
 */
package org.tarik.storytest.model;

import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Collections.unmodifiableMap;
import static java.util.Optional.empty;
import static java.util.stream.Collectors.joining;
import static org.tarik.storytest.utils.CommonUtils.parseStringAsDouble;

/**
 * Typed value of a step parameter, step data entry, scenario configuration or test data entry.
 * Serialized as the plain JSON value it wraps.
 */
public sealed interface ParameterValue permits ParameterValue.StringValue, ParameterValue.NumberValue,
        ParameterValue.BooleanValue, ParameterValue.ListValue, ParameterValue.MapValue {

    /**
     * Returns the wrapped value as a plain Java object (String, Number, Boolean, List or Map).
     */
    @JsonValue
    Object toPlainValue();

    /**
     * Returns a textual rendering suitable for typing into a field or comparing with page content.
     */
    @NotNull
    String asText();

    default Optional<Double> asNumber() {
        return parseStringAsDouble(asText());
    }

    static ParameterValue of(@NotNull String value) {
        return new StringValue(value);
    }

    static ParameterValue of(@NotNull Number value) {
        return new NumberValue(value);
    }

    static ParameterValue of(boolean value) {
        return new BooleanValue(value);
    }

    /**
     * Converts a plain Java object into its typed counterpart. Unknown object types are kept as their string form.
     */
    static ParameterValue from(Object raw) {
        if (raw instanceof ParameterValue parameterValue) {
            return parameterValue;
        } else if (raw instanceof Number number) {
            return new NumberValue(number);
        } else if (raw instanceof Boolean bool) {
            return new BooleanValue(bool);
        } else if (raw instanceof List<?> list) {
            return new ListValue(list.stream().map(ParameterValue::from).toList());
        } else if (raw instanceof Map<?, ?> map) {
            Map<String, ParameterValue> values = new LinkedHashMap<>();
            map.forEach((key, value) -> values.put(String.valueOf(key), from(value)));
            return new MapValue(values);
        } else {
            return new StringValue(raw == null ? "" : raw.toString());
        }
    }

    record StringValue(@NotNull String value) implements ParameterValue {
        @Override
        public Object toPlainValue() {
            return value;
        }

        @Override
        public @NotNull String asText() {
            return value;
        }
    }

    record NumberValue(@NotNull Number value) implements ParameterValue {
        @Override
        public Object toPlainValue() {
            return value;
        }

        @Override
        public @NotNull String asText() {
            return value.toString();
        }

        @Override
        public Optional<Double> asNumber() {
            return Optional.of(value.doubleValue());
        }
    }

    record BooleanValue(boolean value) implements ParameterValue {
        @Override
        public Object toPlainValue() {
            return value;
        }

        @Override
        public @NotNull String asText() {
            return String.valueOf(value);
        }

        @Override
        public Optional<Double> asNumber() {
            return empty();
        }
    }

    record ListValue(@NotNull List<ParameterValue> values) implements ParameterValue {
        public ListValue {
            values = List.copyOf(values);
        }

        @Override
        public Object toPlainValue() {
            return values.stream().map(ParameterValue::toPlainValue).toList();
        }

        @Override
        public @NotNull String asText() {
            return values.stream().map(ParameterValue::asText).collect(joining(", "));
        }

        @Override
        public Optional<Double> asNumber() {
            return empty();
        }
    }

    record MapValue(@NotNull Map<String, ParameterValue> values) implements ParameterValue {
        public MapValue {
            values = unmodifiableMap(new LinkedHashMap<>(values));
        }

        @Override
        public Object toPlainValue() {
            Map<String, Object> plain = new LinkedHashMap<>();
            values.forEach((key, value) -> plain.put(key, value.toPlainValue()));
            return plain;
        }

        @Override
        public @NotNull String asText() {
            return values.entrySet().stream()
                    .map(entry -> "%s=%s".formatted(entry.getKey(), entry.getValue().asText()))
                    .collect(joining(", ", "{", "}"));
        }

        @Override
        public Optional<Double> asNumber() {
            return empty();
        }
    }
}

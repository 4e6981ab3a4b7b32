/*
 * Licensed to Crate.io GmbH ("Crate") under one or more contributor
 * license agreements.  See the NOTICE file distributed with this work for
 * additional information regarding copyright ownership.  Crate licenses
 * this file to you under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.  You may
 * obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.  See the
 * License for the specific language governing permissions and limitations
 * under the License.
 *
 * However, if you have executed another commercial license agreement
 * with Crate these terms will supersede the license and you may use the
 * software solely pursuant to the terms of the relevant commercial agreement.
 */

package io.quarry.settings;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

import io.quarry.types.DataType;
import io.quarry.types.DataTypes;

/**
 * A typed option with a key, a default and a parser which turns the raw string value of
 * {@link Settings} into the option value.
 */
public final class Setting<T> {

    private final String key;
    private final T defaultValue;
    private final DataType<T> dataType;
    private final Function<String, T> parser;

    private Setting(String key, T defaultValue, DataType<T> dataType, Function<String, T> parser) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.defaultValue = defaultValue;
        this.dataType = dataType;
        this.parser = parser;
    }

    public static Setting<Boolean> boolSetting(String key, boolean defaultValue) {
        return new Setting<>(key, defaultValue, DataTypes.BOOLEAN, value -> parseBoolean(key, value));
    }

    public static Setting<Integer> intSetting(String key, int defaultValue, int minValue) {
        if (defaultValue < minValue) {
            throw new IllegalArgumentException(
                "Default value of setting [" + key + "] must be >= " + minValue + " but was " + defaultValue);
        }
        return new Setting<>(key, defaultValue, DataTypes.INTEGER, value -> parseInt(key, value, minValue));
    }

    public String getKey() {
        return key;
    }

    public T getDefault() {
        return defaultValue;
    }

    public DataType<T> dataType() {
        return dataType;
    }

    /**
     * Returns the value of this setting within {@code settings} or the default if it isn't set.
     *
     * @throws IllegalArgumentException if the raw value cannot be parsed or is out of range
     */
    public T get(Settings settings) {
        String raw = settings.get(key);
        if (raw == null) {
            return defaultValue;
        }
        return parser.apply(raw);
    }

    public boolean exists(Settings settings) {
        return settings.get(key) != null;
    }

    private static boolean parseBoolean(String key, String value) {
        switch (value.trim().toLowerCase(Locale.ENGLISH)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new IllegalArgumentException(
                    "Failed to parse value [" + value + "] as only [true] or [false] are allowed for setting [" + key + "]");
        }
    }

    private static int parseInt(String key, String value, int minValue) {
        int intValue;
        try {
            intValue = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Failed to parse value [" + value + "] for setting [" + key + "]", e);
        }
        if (intValue < minValue) {
            throw new IllegalArgumentException(
                "Failed to parse value [" + value + "] for setting [" + key + "] must be >= " + minValue);
        }
        return intValue;
    }

    @Override
    public String toString() {
        return "Setting{key=" + key + ", default=" + defaultValue + '}';
    }
}

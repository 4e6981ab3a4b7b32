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

import java.util.Map;
import java.util.Set;

import org.jetbrains.annotations.Nullable;

import com.google.common.collect.ImmutableMap;

/**
 * An immutable bag of raw string options, e.g. the hints attached to a plan node.
 * Values are interpreted by {@link Setting}.
 */
public final class Settings {

    public static final Settings EMPTY = new Settings(ImmutableMap.of());

    private final ImmutableMap<String, String> settings;

    private Settings(ImmutableMap<String, String> settings) {
        this.settings = settings;
    }

    public static Settings of(Map<String, String> settings) {
        return new Settings(ImmutableMap.copyOf(settings));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Nullable
    public String get(String key) {
        return settings.get(key);
    }

    public Set<String> keySet() {
        return settings.keySet();
    }

    public boolean isEmpty() {
        return settings.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return settings.equals(((Settings) o).settings);
    }

    @Override
    public int hashCode() {
        return settings.hashCode();
    }

    @Override
    public String toString() {
        return settings.toString();
    }

    public static class Builder {

        private final ImmutableMap.Builder<String, String> map = ImmutableMap.builder();

        private Builder() {
        }

        public Builder put(String key, String value) {
            map.put(key, value);
            return this;
        }

        public Builder put(String key, int value) {
            return put(key, Integer.toString(value));
        }

        public Builder put(String key, boolean value) {
            return put(key, Boolean.toString(value));
        }

        public Builder put(Map<String, String> values) {
            map.putAll(values);
            return this;
        }

        public Settings build() {
            return new Settings(map.buildKeepingLast());
        }
    }
}

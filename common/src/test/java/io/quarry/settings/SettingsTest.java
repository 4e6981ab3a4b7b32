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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.Test;

public class SettingsTest {

    private static final Setting<Integer> LIMIT = Setting.intSetting("limit", 10, 1);
    private static final Setting<Boolean> ENABLED = Setting.boolSetting("enabled", false);

    @Test
    public void test_defaults_are_used_for_missing_keys() {
        assertThat(LIMIT.get(Settings.EMPTY)).isEqualTo(10);
        assertThat(ENABLED.get(Settings.EMPTY)).isFalse();
        assertThat(LIMIT.exists(Settings.EMPTY)).isFalse();
    }

    @Test
    public void test_values_are_parsed() {
        Settings settings = Settings.builder()
            .put("limit", " 42 ")
            .put("enabled", "TRUE")
            .build();
        assertThat(LIMIT.get(settings)).isEqualTo(42);
        assertThat(ENABLED.get(settings)).isTrue();
        assertThat(LIMIT.exists(settings)).isTrue();
    }

    @Test
    public void test_later_values_override_earlier_ones() {
        Settings settings = Settings.builder()
            .put("limit", 5)
            .put(Map.of("limit", "7"))
            .build();
        assertThat(LIMIT.get(settings)).isEqualTo(7);
    }

    @Test
    public void test_invalid_int_value_is_rejected() {
        assertThatThrownBy(() -> LIMIT.get(Settings.of(Map.of("limit", "ten"))))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("Failed to parse value [ten] for setting [limit]");
    }

    @Test
    public void test_int_value_below_minimum_is_rejected() {
        assertThatThrownBy(() -> LIMIT.get(Settings.builder().put("limit", 0).build()))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be >= 1");
    }

    @Test
    public void test_invalid_boolean_value_is_rejected() {
        assertThatThrownBy(() -> ENABLED.get(Settings.of(Map.of("enabled", "yes"))))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("only [true] or [false] are allowed");
    }

    @Test
    public void test_default_below_minimum_is_rejected() {
        assertThatThrownBy(() -> Setting.intSetting("foo", 0, 1))
            .isExactlyInstanceOf(IllegalArgumentException.class);
    }
}

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

package io.quarry.execution.engine.aggregation.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

import io.quarry.execution.engine.aggregation.AggregationFunction;
import io.quarry.execution.engine.aggregation.AggregationTestCase;
import io.quarry.types.DataTypes;

public class CountDistinctAggregationTest extends AggregationTestCase {

    @Test
    public void test_counts_distinct_non_null_values() {
        AggregationFunction<Object, Object> countDistinct = function("count_distinct", DataTypes.STRING);
        assertThat(executeAggregation(countDistinct, "a", "b", "a", null, "c", "b")).isEqualTo(3L);
        assertThat(executeAggregation(countDistinct)).isEqualTo(0L);
    }

    @Test
    public void test_is_not_mergeable() {
        AggregationFunction<Object, Object> countDistinct = function("count_distinct", DataTypes.LONG);
        assertThat(countDistinct.isMergeable()).isFalse();
        assertThatThrownBy(() -> countDistinct.reduce(countDistinct.newState(), countDistinct.newState()))
            .isExactlyInstanceOf(UnsupportedOperationException.class)
            .hasMessageContaining("cannot be merged");
    }
}

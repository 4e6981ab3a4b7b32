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

import java.util.List;

import org.jetbrains.annotations.Nullable;

import io.quarry.execution.engine.aggregation.AggregationFunction;
import io.quarry.execution.engine.aggregation.AggregationFunctions;
import io.quarry.types.DataType;
import io.quarry.types.DataTypes;

/**
 * {@code count(*)} counts rows, {@code count(x)} counts the rows where {@code x} is not NULL.
 */
public final class CountAggregation extends AggregationFunction<Long, Long> {

    public static final String NAME = "count";

    public static void register(AggregationFunctions.Builder builder) {
        builder.register(new CountAggregation(null));
        for (DataType<?> type : DataTypes.PRIMITIVE_TYPES) {
            builder.register(new CountAggregation(type));
        }
    }

    @Nullable
    private final DataType<?> argumentType;

    private CountAggregation(@Nullable DataType<?> argumentType) {
        this.argumentType = argumentType;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<DataType<?>> argumentTypes() {
        return argumentType == null ? List.of() : List.of(argumentType);
    }

    @Override
    public DataType<Long> returnType() {
        return DataTypes.LONG;
    }

    @Override
    public Long newState() {
        return 0L;
    }

    @Override
    public Long iterate(Long state, @Nullable Object value) {
        if (argumentType == null) {
            return state + 1;
        }
        return sanitize(argumentType, value) == null ? state : state + 1;
    }

    @Override
    public Long reduce(@Nullable Long state1, @Nullable Long state2) {
        long count1 = state1 == null ? 0L : state1;
        long count2 = state2 == null ? 0L : state2;
        return count1 + count2;
    }

    @Override
    public Long terminatePartial(@Nullable Long state) {
        return state == null ? 0L : state;
    }

    @Override
    public Long readPartial(@Nullable Object value) {
        return sanitize(DataTypes.LONG, value);
    }
}

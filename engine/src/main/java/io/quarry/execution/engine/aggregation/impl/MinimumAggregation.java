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

public final class MinimumAggregation<T> extends AggregationFunction<T, T> {

    public static final String NAME = "min";

    public static void register(AggregationFunctions.Builder builder) {
        for (DataType<?> type : DataTypes.PRIMITIVE_TYPES) {
            builder.register(new MinimumAggregation<>(type));
        }
    }

    private final DataType<T> type;

    private MinimumAggregation(DataType<T> type) {
        this.type = type;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<DataType<?>> argumentTypes() {
        return List.of(type);
    }

    @Override
    public DataType<T> returnType() {
        return type;
    }

    @Nullable
    @Override
    public T newState() {
        return null;
    }

    @Override
    public T iterate(@Nullable T state, @Nullable Object value) {
        return reduce(state, sanitize(type, value));
    }

    @Override
    public T reduce(@Nullable T state1, @Nullable T state2) {
        if (state1 == null) {
            return state2;
        }
        if (state2 == null) {
            return state1;
        }
        return type.compare(state1, state2) <= 0 ? state1 : state2;
    }

    @Override
    public T terminatePartial(@Nullable T state) {
        return state;
    }

    @Override
    public T readPartial(@Nullable Object value) {
        return sanitize(type, value);
    }
}

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

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.jetbrains.annotations.Nullable;

import io.quarry.execution.engine.aggregation.AggregationFunction;
import io.quarry.execution.engine.aggregation.AggregationFunctions;
import io.quarry.types.DataType;
import io.quarry.types.DataTypes;

/**
 * {@code count_distinct(x)}: the exact number of distinct non-null values.
 *
 * The partial state holds every distinct value seen and is never shipped between stages,
 * so all rows of a group have to be aggregated by a single operator instance.
 */
public final class CountDistinctAggregation extends AggregationFunction<Set<Object>, Long> {

    public static final String NAME = "count_distinct";

    public static void register(AggregationFunctions.Builder builder) {
        for (DataType<?> type : DataTypes.PRIMITIVE_TYPES) {
            builder.register(new CountDistinctAggregation(type));
        }
    }

    private final DataType<?> argumentType;

    private CountDistinctAggregation(DataType<?> argumentType) {
        this.argumentType = argumentType;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<DataType<?>> argumentTypes() {
        return List.of(argumentType);
    }

    @Override
    public DataType<Long> returnType() {
        return DataTypes.LONG;
    }

    @Override
    public boolean isMergeable() {
        return false;
    }

    @Override
    public Set<Object> newState() {
        return new HashSet<>();
    }

    @Override
    public Set<Object> iterate(Set<Object> state, @Nullable Object value) {
        Object distinctValue = sanitize(argumentType, value);
        if (distinctValue != null) {
            state.add(distinctValue);
        }
        return state;
    }

    @Override
    public Set<Object> reduce(@Nullable Set<Object> state1, @Nullable Set<Object> state2) {
        throw new UnsupportedOperationException(String.format(
            Locale.ENGLISH,
            "Partial states of `%s` cannot be merged, all rows of a group must be aggregated in one place",
            NAME
        ));
    }

    @Override
    public Long terminatePartial(@Nullable Set<Object> state) {
        return state == null ? 0L : (long) state.size();
    }

    @Override
    @SuppressWarnings("unchecked")
    public Set<Object> readPartial(@Nullable Object value) {
        return castPartial(Set.class, value);
    }
}

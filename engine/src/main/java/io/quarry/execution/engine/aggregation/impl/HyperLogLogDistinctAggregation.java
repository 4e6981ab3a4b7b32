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

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.jetbrains.annotations.Nullable;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import io.quarry.execution.engine.aggregation.AggregationFunction;
import io.quarry.execution.engine.aggregation.AggregationFunctions;
import io.quarry.types.DataType;
import io.quarry.types.DataTypes;

/**
 * {@code approx_count_distinct(x)}: estimates the number of distinct non-null values with a {@link HyperLogLogSketch}.
 * Sketches of different partitions are merged register-wise, which makes the estimate independent of how rows
 * are distributed over the leaf stages.
 */
public final class HyperLogLogDistinctAggregation extends AggregationFunction<HyperLogLogSketch, Long> {

    public static final String NAME = "approx_count_distinct";

    private static final HashFunction MURMUR3 = Hashing.murmur3_128();

    public static void register(AggregationFunctions.Builder builder) {
        for (DataType<?> type : DataTypes.PRIMITIVE_TYPES) {
            builder.register(new HyperLogLogDistinctAggregation(type));
        }
    }

    private final DataType<?> argumentType;

    private HyperLogLogDistinctAggregation(DataType<?> argumentType) {
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
    public HyperLogLogSketch newState() {
        return new HyperLogLogSketch(HyperLogLogSketch.DEFAULT_PRECISION);
    }

    @Override
    public HyperLogLogSketch iterate(HyperLogLogSketch state, @Nullable Object value) {
        Object distinctValue = sanitize(argumentType, value);
        if (distinctValue != null) {
            state.collect(hash(distinctValue));
        }
        return state;
    }

    @Override
    public HyperLogLogSketch reduce(@Nullable HyperLogLogSketch state1, @Nullable HyperLogLogSketch state2) {
        if (state1 == null) {
            return state2;
        }
        if (state2 == null) {
            return state1;
        }
        state1.merge(state2);
        return state1;
    }

    @Override
    public Long terminatePartial(@Nullable HyperLogLogSketch state) {
        return state == null ? 0L : state.cardinality();
    }

    @Override
    public HyperLogLogSketch readPartial(@Nullable Object value) {
        return castPartial(HyperLogLogSketch.class, value);
    }

    private static long hash(Object value) {
        if (value instanceof String) {
            return MURMUR3.hashString((String) value, StandardCharsets.UTF_8).asLong();
        } else if (value instanceof Double) {
            return MURMUR3.hashLong(Double.doubleToLongBits((Double) value)).asLong();
        } else if (value instanceof Number) {
            return MURMUR3.hashLong(((Number) value).longValue()).asLong();
        } else if (value instanceof Boolean) {
            return MURMUR3.hashInt((Boolean) value ? 1 : 0).asLong();
        }
        throw new IllegalArgumentException("Cannot hash value of class " + value.getClass().getSimpleName());
    }
}

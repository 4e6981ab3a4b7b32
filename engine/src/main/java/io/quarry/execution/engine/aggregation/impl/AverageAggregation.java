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
import java.util.Objects;

import org.jetbrains.annotations.Nullable;

import io.quarry.execution.engine.aggregation.AggregationFunction;
import io.quarry.execution.engine.aggregation.AggregationFunctions;
import io.quarry.types.DataType;
import io.quarry.types.DataTypes;

public final class AverageAggregation extends AggregationFunction<AverageAggregation.AverageState, Double> {

    public static final String NAME = "avg";

    public static void register(AggregationFunctions.Builder builder) {
        for (DataType<?> type : DataTypes.NUMERIC_PRIMITIVE_TYPES) {
            builder.register(new AverageAggregation(type));
        }
    }

    public static final class AverageState {

        private double sum = 0;
        private long count = 0;

        public AverageState() {
        }

        public AverageState(double sum, long count) {
            this.sum = sum;
            this.count = count;
        }

        public double sum() {
            return sum;
        }

        public long count() {
            return count;
        }

        @Nullable
        Double value() {
            if (count > 0) {
                return sum / count;
            }
            return null;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            AverageState that = (AverageState) o;
            return Double.compare(that.sum, sum) == 0 && count == that.count;
        }

        @Override
        public int hashCode() {
            return Objects.hash(sum, count);
        }

        @Override
        public String toString() {
            return "AverageState{sum=" + sum + ", count=" + count + '}';
        }
    }

    private final DataType<?> argumentType;

    private AverageAggregation(DataType<?> argumentType) {
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
    public DataType<Double> returnType() {
        return DataTypes.DOUBLE;
    }

    @Override
    public AverageState newState() {
        return new AverageState();
    }

    @Override
    public AverageState iterate(AverageState state, @Nullable Object value) {
        Number number = (Number) sanitize(argumentType, value);
        if (number != null) {
            state.sum += number.doubleValue();
            state.count++;
        }
        return state;
    }

    @Override
    public AverageState reduce(@Nullable AverageState state1, @Nullable AverageState state2) {
        if (state1 == null) {
            return state2;
        }
        if (state2 == null) {
            return state1;
        }
        state1.sum += state2.sum;
        state1.count += state2.count;
        return state1;
    }

    @Override
    public Double terminatePartial(@Nullable AverageState state) {
        return state == null ? null : state.value();
    }

    @Override
    public AverageState readPartial(@Nullable Object value) {
        return castPartial(AverageState.class, value);
    }
}

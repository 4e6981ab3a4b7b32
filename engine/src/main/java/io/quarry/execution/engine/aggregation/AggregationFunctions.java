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

package io.quarry.execution.engine.aggregation;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import com.google.common.collect.ImmutableMap;

import io.quarry.exceptions.UnsupportedFunctionException;
import io.quarry.execution.engine.aggregation.impl.AverageAggregation;
import io.quarry.execution.engine.aggregation.impl.CountAggregation;
import io.quarry.execution.engine.aggregation.impl.CountDistinctAggregation;
import io.quarry.execution.engine.aggregation.impl.HyperLogLogDistinctAggregation;
import io.quarry.execution.engine.aggregation.impl.MaximumAggregation;
import io.quarry.execution.engine.aggregation.impl.MinimumAggregation;
import io.quarry.execution.engine.aggregation.impl.SumAggregation;
import io.quarry.types.DataType;

/**
 * Catalog of aggregation functions, looked up by name and argument types while planning.
 */
public final class AggregationFunctions {

    private static final AggregationFunctions DEFAULT = builder()
        .register(SumAggregation::register)
        .register(CountAggregation::register)
        .register(MinimumAggregation::register)
        .register(MaximumAggregation::register)
        .register(AverageAggregation::register)
        .register(CountDistinctAggregation::register)
        .register(HyperLogLogDistinctAggregation::register)
        .build();

    private final Map<String, Map<List<DataType<?>>, AggregationFunction<?, ?>>> functions;

    private AggregationFunctions(Map<String, Map<List<DataType<?>>, AggregationFunction<?, ?>>> functions) {
        this.functions = functions;
    }

    /**
     * @return the registry containing all built-in aggregation functions
     */
    public static AggregationFunctions defaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves the implementation of {@code name} for the given argument types.
     *
     * @throws UnsupportedFunctionException if there is no such function or it doesn't accept the argument types
     */
    public AggregationFunction<?, ?> get(String name, List<DataType<?>> argumentTypes) {
        Map<List<DataType<?>>, AggregationFunction<?, ?>> candidates = functions.get(name.toLowerCase(Locale.ENGLISH));
        if (candidates != null) {
            AggregationFunction<?, ?> function = candidates.get(argumentTypes);
            if (function != null) {
                return function;
            }
        }
        throw UnsupportedFunctionException.of(name, argumentTypes);
    }

    public Set<String> functionNames() {
        return functions.keySet();
    }

    public static class Builder {

        private final Map<String, Map<List<DataType<?>>, AggregationFunction<?, ?>>> functions = new HashMap<>();

        private Builder() {
        }

        public Builder register(AggregationFunction<?, ?> function) {
            Map<List<DataType<?>>, AggregationFunction<?, ?>> byArgs =
                functions.computeIfAbsent(function.name(), k -> new HashMap<>());
            AggregationFunction<?, ?> previous = byArgs.putIfAbsent(function.argumentTypes(), function);
            if (previous != null) {
                throw new IllegalArgumentException("Function " + function + " is already registered");
            }
            return this;
        }

        public Builder register(Consumer<Builder> registration) {
            registration.accept(this);
            return this;
        }

        public AggregationFunctions build() {
            ImmutableMap.Builder<String, Map<List<DataType<?>>, AggregationFunction<?, ?>>> result = ImmutableMap.builder();
            for (var entry : functions.entrySet()) {
                result.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
            }
            return new AggregationFunctions(result.build());
        }
    }
}

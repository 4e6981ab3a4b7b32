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

import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.jetbrains.annotations.Nullable;

import io.quarry.data.Row;
import io.quarry.exceptions.TypeMismatchException;
import io.quarry.types.DataTypes;

/**
 * One aggregation of an aggregate operator: the resolved function, the input column it reads and an optional
 * boolean filter column ({@code count(*) FILTER (WHERE x)}).
 *
 * For operators consuming raw rows {@code inputIndex} points to the argument column of the function.
 * For operators merging partial results it points to the column holding the partial state.
 */
public final class AggregateCall {

    public static final int NO_INPUT = -1;

    private final AggregationFunction<?, ?> function;
    private final int inputIndex;
    private final int filterIndex;

    public AggregateCall(AggregationFunction<?, ?> function, int inputIndex, int filterIndex) {
        this.function = Objects.requireNonNull(function, "function must not be null");
        if (inputIndex < NO_INPUT || filterIndex < NO_INPUT) {
            throw new IllegalArgumentException("Invalid input or filter index for " + function);
        }
        this.inputIndex = inputIndex;
        this.filterIndex = filterIndex;
    }

    public AggregateCall(AggregationFunction<?, ?> function, int inputIndex) {
        this(function, inputIndex, NO_INPUT);
    }

    public static AggregateCall countStar(AggregationFunctions functions) {
        return new AggregateCall(functions.get("count", List.of()), NO_INPUT);
    }

    public AggregationFunction<?, ?> function() {
        return function;
    }

    public String name() {
        return function.name();
    }

    public int inputIndex() {
        return inputIndex;
    }

    public boolean hasInput() {
        return inputIndex != NO_INPUT;
    }

    public int filterIndex() {
        return filterIndex;
    }

    @Nullable
    Object input(Row row) {
        return inputIndex == NO_INPUT ? null : row.get(inputIndex);
    }

    /**
     * @return true if the row passes the filter of this call; always true if there is no filter
     */
    boolean accepts(Row row) {
        if (filterIndex == NO_INPUT) {
            return true;
        }
        Object value = row.get(filterIndex);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new TypeMismatchException(function.name() + " filter", DataTypes.BOOLEAN, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AggregateCall that = (AggregateCall) o;
        return inputIndex == that.inputIndex &&
               filterIndex == that.filterIndex &&
               function.equals(that.function);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, inputIndex, filterIndex);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(function.name()).append('(');
        if (inputIndex == NO_INPUT) {
            sb.append(function.argumentTypes().isEmpty() ? "*" : "");
        } else {
            sb.append(String.format(Locale.ENGLISH, "INPUT(%d)", inputIndex));
        }
        sb.append(')');
        if (filterIndex != NO_INPUT) {
            sb.append(String.format(Locale.ENGLISH, " FILTER (WHERE INPUT(%d))", filterIndex));
        }
        return sb.toString();
    }
}

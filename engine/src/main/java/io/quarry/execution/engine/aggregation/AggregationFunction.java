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

import org.jetbrains.annotations.Nullable;

import io.quarry.exceptions.TypeMismatchException;
import io.quarry.types.DataType;

/**
 * An aggregation function. Implementations are stateless and shared by all groups of an operator;
 * all progress is kept in the partial state objects created by {@link #newState()}.
 *
 * <pre>
 *  leaf stage:          newState -> iterate* -> partial state emitted
 *  intermediate stage:  newState -> reduce*  -> partial state emitted
 *  final stage:         newState -> reduce*  -> terminatePartial
 *  single stage:        newState -> iterate* -> terminatePartial
 * </pre>
 *
 * @param <TPartial> the type of the partial state
 * @param <TFinal>   the type of the final result
 */
public abstract class AggregationFunction<TPartial, TFinal> {

    public abstract String name();

    public abstract List<DataType<?>> argumentTypes();

    public abstract DataType<?> returnType();

    /**
     * Creates the initial state. The result of {@code terminatePartial(newState())} is the value of the
     * aggregation over zero rows.
     */
    @Nullable
    public abstract TPartial newState();

    /**
     * Adds one raw input value to the state.
     *
     * @param value the argument value of the current row, null for functions without argument.
     * @return the new state; may be the same instance as {@code state}.
     * @throws TypeMismatchException if the value is not of the argument type
     */
    @Nullable
    public abstract TPartial iterate(@Nullable TPartial state, @Nullable Object value) throws TypeMismatchException;

    /**
     * Combines two partial states created by this function. Must be associative and commutative.
     *
     * @return the combined state; may be one of the given instances.
     * @throws UnsupportedOperationException if the function is not {@link #isMergeable()}
     */
    @Nullable
    public abstract TPartial reduce(@Nullable TPartial state1, @Nullable TPartial state2);

    /**
     * Converts the partial state into the final, user visible, result.
     */
    @Nullable
    public abstract TFinal terminatePartial(@Nullable TPartial state);

    /**
     * Interprets a value received from an upstream operator as partial state of this function.
     *
     * @throws TypeMismatchException if the value is no partial state of this function
     */
    @Nullable
    public abstract TPartial readPartial(@Nullable Object value) throws TypeMismatchException;

    /**
     * @return false if partial states cannot be combined with {@link #reduce(Object, Object)}.
     *         All rows of a group must then be aggregated by the same operator instance.
     */
    public boolean isMergeable() {
        return true;
    }

    /**
     * Sanitizes {@code value} to {@code type}, translating cast failures into a {@link TypeMismatchException}.
     */
    protected <T> T sanitize(DataType<T> type, Object value) {
        try {
            return type.sanitizeValue(value);
        } catch (ClassCastException e) {
            throw new TypeMismatchException(name(), type, value);
        }
    }

    /**
     * Casts a partial state received from an upstream stage, failing with a {@link TypeMismatchException}.
     */
    protected <T> T castPartial(Class<T> stateClass, @Nullable Object value) {
        if (value == null) {
            return null;
        }
        if (stateClass.isInstance(value)) {
            return stateClass.cast(value);
        }
        throw new TypeMismatchException(name(), value, stateClass);
    }

    @Override
    public String toString() {
        return name() + argumentTypes();
    }
}

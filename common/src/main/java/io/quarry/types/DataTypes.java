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

package io.quarry.types;

import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

public final class DataTypes {

    private DataTypes() {
    }

    public static final UndefinedType UNDEFINED = UndefinedType.INSTANCE;
    public static final BooleanType BOOLEAN = BooleanType.INSTANCE;
    public static final StringType STRING = StringType.INSTANCE;
    public static final IntegerType INTEGER = IntegerType.INSTANCE;
    public static final LongType LONG = LongType.INSTANCE;
    public static final DoubleType DOUBLE = DoubleType.INSTANCE;

    /**
     * Types a column can carry. Aggregation functions register one signature per applicable entry.
     */
    public static final List<DataType<?>> PRIMITIVE_TYPES = List.of(BOOLEAN, STRING, INTEGER, LONG, DOUBLE);

    public static final List<DataType<?>> NUMERIC_PRIMITIVE_TYPES = PRIMITIVE_TYPES.stream()
        .filter(DataType::isNumeric)
        .collect(ImmutableList.toImmutableList());

    private static final Map<Integer, DataType<?>> TYPES_BY_ID = Maps.uniqueIndex(
        ImmutableList.<DataType<?>>builder().add(UNDEFINED).addAll(PRIMITIVE_TYPES).build(),
        DataType::id
    );

    private static final Map<Class<?>, DataType<?>> TYPES_BY_CLASS = ImmutableMap.<Class<?>, DataType<?>>builder()
        .put(Boolean.class, BOOLEAN)
        .put(String.class, STRING)
        .put(Byte.class, INTEGER)
        .put(Short.class, INTEGER)
        .put(Integer.class, INTEGER)
        .put(Long.class, LONG)
        .put(Float.class, DOUBLE)
        .put(Double.class, DOUBLE)
        .build();

    public static DataType<?> fromId(int id) {
        DataType<?> type = TYPES_BY_ID.get(id);
        if (type == null) {
            throw new IllegalArgumentException("No type with id " + id);
        }
        return type;
    }

    /**
     * Returns the type which best describes the given java value, {@link #UNDEFINED} for null.
     *
     * @throws IllegalArgumentException if the value has no corresponding type
     */
    public static DataType<?> guessType(@Nullable Object value) {
        if (value == null) {
            return UNDEFINED;
        }
        DataType<?> type = TYPES_BY_CLASS.get(value.getClass());
        if (type == null) {
            throw new IllegalArgumentException("Cannot detect the type of the value: " + value);
        }
        return type;
    }
}

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

import java.util.Comparator;

import org.jetbrains.annotations.Nullable;

/**
 * Type of a column value.
 * <p>
 * Each type is a singleton identified by its {@link #id()}. It knows which java values are valid
 * representations of it and how two non-null values order.
 */
public abstract class DataType<T> implements Comparator<T> {

    private final int id;
    private final String name;

    protected DataType(int id, String name) {
        this.id = id;
        this.name = name;
    }

    public final int id() {
        return id;
    }

    public final String getName() {
        return name;
    }

    /**
     * Normalizes {@code value} to the java representation of this type.
     * Narrower representations are widened, for example a {@link Short} passed as bigint.
     *
     * @throws ClassCastException if {@code value} cannot represent a value of this type
     */
    @Nullable
    public abstract T sanitizeValue(@Nullable Object value);

    public boolean isNumeric() {
        return false;
    }

    protected final ClassCastException cannotSanitize(Object value) {
        return new ClassCastException("Can't cast '" + value + "' to " + name);
    }

    @Override
    public final int hashCode() {
        return id;
    }

    @Override
    public final boolean equals(Object o) {
        return o instanceof DataType && ((DataType<?>) o).id == id;
    }

    @Override
    public String toString() {
        return name;
    }
}

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

import java.util.Arrays;

/**
 * The identity of a group: the values of the group-by columns of a row, in group-by order.
 *
 * Keys are compared value-wise; two NULL values are considered equal.
 * Instances are immutable and cache their hash code.
 */
public final class GroupKey {

    /**
     * The single key of an aggregation without group-by columns.
     */
    public static final GroupKey EMPTY = new GroupKey(new Object[0]);

    private final Object[] values;
    private final int hashCode;

    GroupKey(Object[] values) {
        this.values = values;
        this.hashCode = Arrays.deepHashCode(values);
    }

    public static GroupKey of(Object... values) {
        if (values.length == 0) {
            return EMPTY;
        }
        return new GroupKey(values.clone());
    }

    public int size() {
        return values.length;
    }

    public Object get(int index) {
        return values[index];
    }

    /**
     * Copies the key values into {@code target}, starting at position 0.
     */
    void copyInto(Object[] target) {
        System.arraycopy(values, 0, target, 0, values.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GroupKey that = (GroupKey) o;
        return hashCode == that.hashCode && Arrays.deepEquals(values, that.values);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "GroupKey" + Arrays.deepToString(values);
    }
}

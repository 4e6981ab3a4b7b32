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

package io.quarry.data;

/**
 * Positional view of one record flowing between operators.
 * <p>
 * Producers may re-use a single instance and swap its values on every {@link BatchIterator#moveNext()},
 * so consumers that keep values past the current position have to copy them via {@link #materialize()}.
 */
public abstract class Row {

    public abstract int numColumns();

    /**
     * @throws IndexOutOfBoundsException if {@code index} is not a column of this row
     */
    public abstract Object get(int index);

    /**
     * Copies the current values into a new array.
     */
    public Object[] materialize() {
        Object[] result = new Object[numColumns()];
        for (int i = 0; i < result.length; i++) {
            result[i] = get(i);
        }
        return result;
    }
}

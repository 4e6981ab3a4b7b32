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

import java.util.Arrays;

/**
 * A row backed by an array of cells. The cells can be swapped to re-use the instance for the rows of a result.
 */
public final class RowN extends Row {

    private final int numColumns;
    private Object[] cells;

    /**
     * Creates a row without cells, they must be set with {@link #cells(Object[])} before the row is read.
     */
    public RowN(int numColumns) {
        this.numColumns = numColumns;
    }

    public RowN(Object ... cells) {
        this.numColumns = cells.length;
        this.cells = cells;
    }

    /**
     * @param cells the new cells; at least {@link #numColumns()} long. The array is not copied.
     */
    public void cells(Object[] cells) {
        assert cells.length >= numColumns : "row needs " + numColumns + " cells but got " + cells.length;
        this.cells = cells;
    }

    @Override
    public int numColumns() {
        return numColumns;
    }

    @Override
    public Object get(int index) {
        assert cells != null : "cells of RowN must be set before it is read";
        return cells[index];
    }

    @Override
    public Object[] materialize() {
        return Arrays.copyOf(cells, numColumns);
    }

    @Override
    public String toString() {
        return "RowN" + Arrays.toString(cells);
    }
}

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

import io.quarry.data.Row;

/**
 * Reads the group-by columns of a row into a {@link GroupKey}.
 */
public final class GroupKeyExtractor {

    private final int[] groupByIndexes;

    /**
     * @param groupByIndexes 0-based positions of the group-by columns in the input rows;
     *                       empty for an aggregation without group by.
     */
    public GroupKeyExtractor(int[] groupByIndexes) {
        for (int index : groupByIndexes) {
            if (index < 0) {
                throw new IllegalArgumentException("group by index must not be negative: " + index);
            }
        }
        this.groupByIndexes = groupByIndexes.clone();
    }

    public GroupKey extract(Row row) {
        if (groupByIndexes.length == 0) {
            return GroupKey.EMPTY;
        }
        Object[] values = new Object[groupByIndexes.length];
        for (int i = 0; i < groupByIndexes.length; i++) {
            values[i] = row.get(groupByIndexes[i]);
        }
        return new GroupKey(values);
    }

    public boolean isGlobal() {
        return groupByIndexes.length == 0;
    }

    public int numKeys() {
        return groupByIndexes.length;
    }

    public int[] groupByIndexes() {
        return groupByIndexes.clone();
    }

    @Override
    public String toString() {
        return "GroupKeyExtractor{" + Arrays.toString(groupByIndexes) + '}';
    }
}

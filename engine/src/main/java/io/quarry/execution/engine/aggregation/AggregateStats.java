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

import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableMap;

/**
 * Statistics of one aggregate operator, available once it emitted all rows.
 */
public final class AggregateStats {

    private final long executionTimeMs;
    private final long emittedRows;
    private final boolean numGroupsLimitReached;
    private final long droppedRows;

    public AggregateStats(long executionTimeMs, long emittedRows, boolean numGroupsLimitReached, long droppedRows) {
        this.executionTimeMs = executionTimeMs;
        this.emittedRows = emittedRows;
        this.numGroupsLimitReached = numGroupsLimitReached;
        this.droppedRows = droppedRows;
    }

    /**
     * Time spent within the operator, summed over all threads which drove it.
     * Time spent waiting for upstream batches is not included.
     */
    public long executionTimeMs() {
        return executionTimeMs;
    }

    public long emittedRows() {
        return emittedRows;
    }

    /**
     * True if at least one group was not created because of {@code num_groups_limit}; the result is partial.
     */
    public boolean numGroupsLimitReached() {
        return numGroupsLimitReached;
    }

    /**
     * Number of input rows which were dropped because their group could not be created.
     */
    public long droppedRows() {
        return droppedRows;
    }

    public Map<String, Object> mapRepresentation() {
        return ImmutableMap.<String, Object>builder()
            .put("executionTimeMs", executionTimeMs)
            .put("emittedRows", emittedRows)
            .put("numGroupsLimitReached", numGroupsLimitReached)
            .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AggregateStats that = (AggregateStats) o;
        return executionTimeMs == that.executionTimeMs &&
               emittedRows == that.emittedRows &&
               numGroupsLimitReached == that.numGroupsLimitReached &&
               droppedRows == that.droppedRows;
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionTimeMs, emittedRows, numGroupsLimitReached, droppedRows);
    }

    @Override
    public String toString() {
        return "AggregateStats{" +
               "executionTimeMs=" + executionTimeMs +
               ", emittedRows=" + emittedRows +
               ", numGroupsLimitReached=" + numGroupsLimitReached +
               ", droppedRows=" + droppedRows +
               '}';
    }
}

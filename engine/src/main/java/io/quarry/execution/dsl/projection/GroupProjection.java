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

package io.quarry.execution.dsl.projection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableMap;

import io.quarry.data.BatchIterator;
import io.quarry.data.Row;
import io.quarry.execution.engine.aggregation.AggregateCall;
import io.quarry.execution.engine.aggregation.AggregateOperator;
import io.quarry.execution.engine.aggregation.AggregateStrategy;
import io.quarry.execution.engine.aggregation.AggregationStage;
import io.quarry.execution.engine.aggregation.GroupByOptions;
import io.quarry.settings.Settings;

/**
 * Plan node of a group-by aggregation. Holds everything needed to instantiate an {@link AggregateOperator}
 * and to describe it in an explain output without executing it.
 */
public final class GroupProjection {

    private final AggregationStage stage;
    private final int[] groupByIndexes;
    private final List<AggregateCall> aggregations;
    private final GroupByOptions options;

    public GroupProjection(AggregationStage stage,
                           int[] groupByIndexes,
                           List<AggregateCall> aggregations,
                           Settings hints) {
        this(stage, groupByIndexes, aggregations, GroupByOptions.fromSettings(hints));
    }

    public GroupProjection(AggregationStage stage,
                           int[] groupByIndexes,
                           List<AggregateCall> aggregations,
                           GroupByOptions options) {
        this.stage = Objects.requireNonNull(stage, "stage must not be null");
        this.groupByIndexes = groupByIndexes.clone();
        this.aggregations = List.copyOf(aggregations);
        this.options = options;
    }

    public AggregationStage stage() {
        return stage;
    }

    public int[] groupByIndexes() {
        return groupByIndexes.clone();
    }

    public List<AggregateCall> aggregations() {
        return aggregations;
    }

    public GroupByOptions options() {
        return options;
    }

    public AggregateStrategy strategy() {
        return AggregateStrategy.select(stage, options, groupByIndexes.length == 0, aggregations);
    }

    public AggregateOperator newOperator(BatchIterator<Row> source) {
        return new AggregateOperator(source, stage, groupByIndexes, aggregations, options);
    }

    public Map<String, Object> mapRepresentation() {
        List<String> keys = new ArrayList<>(groupByIndexes.length);
        for (int index : groupByIndexes) {
            keys.add("INPUT(" + index + ")");
        }
        List<String> aggregates = new ArrayList<>(aggregations.size());
        for (AggregateCall aggregation : aggregations) {
            aggregates.add(aggregation.toString());
        }
        return ImmutableMap.<String, Object>builder()
            .put("type", "GroupProjection")
            .put("stage", stage.name())
            .put("strategy", strategy().toString())
            .put("keys", keys)
            .put("aggregations", aggregates)
            .put("numGroupsLimit", options.numGroupsLimit())
            .put("partitionedByGroupByKeys", options.partitionedByGroupByKeys())
            .put("skipLeafStageGroupBy", options.skipLeafStageGroupBy())
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
        GroupProjection that = (GroupProjection) o;
        return stage == that.stage &&
               Arrays.equals(groupByIndexes, that.groupByIndexes) &&
               aggregations.equals(that.aggregations) &&
               options.equals(that.options);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(stage, aggregations, options);
        result = 31 * result + Arrays.hashCode(groupByIndexes);
        return result;
    }

    @Override
    public String toString() {
        return "GroupProjection{" +
               "stage=" + stage +
               ", keys=" + Arrays.toString(groupByIndexes) +
               ", aggregations=" + aggregations +
               '}';
    }
}

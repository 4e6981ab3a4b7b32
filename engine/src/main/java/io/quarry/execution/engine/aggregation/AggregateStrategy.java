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
import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * Decides how an aggregate operator processes its input, based on its stage, its options and its aggregations.
 *
 * <pre>
 *  stage         skip   partitioned   execution      mode
 *  LEAF          no     -             GROUP          ITER_PARTIAL
 *  LEAF          yes    -             PASS_THROUGH   -
 *  INTERMEDIATE  no     no            GROUP          PARTIAL_PARTIAL
 *  INTERMEDIATE  no     yes           PER_ROW        PARTIAL_PARTIAL
 *  INTERMEDIATE  yes    -             PASS_THROUGH   -
 *  FINAL         no     no            GROUP          PARTIAL_FINAL
 *  FINAL         no     yes           PER_ROW        PARTIAL_FINAL
 *  FINAL         yes    -             GROUP          ITER_FINAL
 *  DIRECT        -      -             GROUP          ITER_FINAL
 * </pre>
 *
 * "skip" is set if the leaf stage group by is skipped by option or because an aggregation is not mergeable.
 * In both cases raw rows flow through to the final stage, which iterates them instead of merging partial states.
 * A global aggregation (no group-by columns) is never executed per row.
 */
public final class AggregateStrategy {

    public enum Execution {

        /**
         * Rows are grouped in a {@link GroupByResultHolder} and the groups are emitted once all input is consumed.
         */
        GROUP,

        /**
         * Every input row is a complete group; its partial states are emitted (finalized if the mode says so)
         * without merging them with other rows of the same key.
         */
        PER_ROW,

        /**
         * Input rows are emitted unchanged.
         */
        PASS_THROUGH
    }

    private final Execution execution;
    @Nullable
    private final AggregateMode mode;

    private AggregateStrategy(Execution execution, @Nullable AggregateMode mode) {
        this.execution = execution;
        this.mode = mode;
    }

    public static AggregateStrategy select(AggregationStage stage,
                                           GroupByOptions options,
                                           boolean globalAggregation,
                                           List<AggregateCall> aggregations) {
        boolean skipLeafGroupBy = options.skipLeafStageGroupBy() || hasNonMergeable(aggregations);
        boolean perRow = options.partitionedByGroupByKeys() && globalAggregation == false;
        switch (stage) {
            case LEAF:
                return skipLeafGroupBy
                    ? new AggregateStrategy(Execution.PASS_THROUGH, null)
                    : new AggregateStrategy(Execution.GROUP, AggregateMode.ITER_PARTIAL);

            case INTERMEDIATE:
                if (skipLeafGroupBy) {
                    return new AggregateStrategy(Execution.PASS_THROUGH, null);
                }
                return new AggregateStrategy(perRow ? Execution.PER_ROW : Execution.GROUP, AggregateMode.PARTIAL_PARTIAL);

            case FINAL:
                if (skipLeafGroupBy) {
                    return new AggregateStrategy(Execution.GROUP, AggregateMode.ITER_FINAL);
                }
                return new AggregateStrategy(perRow ? Execution.PER_ROW : Execution.GROUP, AggregateMode.PARTIAL_FINAL);

            case DIRECT:
                return new AggregateStrategy(Execution.GROUP, AggregateMode.ITER_FINAL);

            default:
                throw new IllegalArgumentException("Unknown aggregation stage: " + stage);
        }
    }

    private static boolean hasNonMergeable(List<AggregateCall> aggregations) {
        for (AggregateCall aggregation : aggregations) {
            if (aggregation.function().isMergeable() == false) {
                return true;
            }
        }
        return false;
    }

    public Execution execution() {
        return execution;
    }

    /**
     * @return the aggregate mode; null for {@link Execution#PASS_THROUGH}
     */
    @Nullable
    public AggregateMode mode() {
        return mode;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AggregateStrategy that = (AggregateStrategy) o;
        return execution == that.execution && mode == that.mode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(execution, mode);
    }

    @Override
    public String toString() {
        return mode == null ? execution.toString() : execution + "(" + mode + ")";
    }
}

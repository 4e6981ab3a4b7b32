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

import static io.quarry.testing.TestingBatchIterators.ofRows;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import io.quarry.data.BatchIterator;
import io.quarry.data.CompositeBatchIterator;
import io.quarry.data.Row;
import io.quarry.exceptions.TypeMismatchException;
import io.quarry.execution.engine.aggregation.impl.AverageAggregation.AverageState;
import io.quarry.testing.FailingBatchIterator;
import io.quarry.testing.TestingBatchIterators;
import io.quarry.testing.TestingRowConsumer;
import io.quarry.types.DataType;
import io.quarry.types.DataTypes;

public class AggregateOperatorTest {

    private static final AggregationFunctions FUNCTIONS = AggregationFunctions.defaults();
    private static final int[] GROUP_BY_FIRST = new int[] {0};
    private static final int[] NO_GROUP_BY = new int[0];
    private static final Object[][] ROWS = new Object[][] {
        new Object[] {"a", 1L},
        new Object[] {"a", 2L},
        new Object[] {"b", 3L}
    };

    private static AggregateCall call(String name, DataType<?> argumentType, int inputIndex) {
        return new AggregateCall(FUNCTIONS.get(name, List.of(argumentType)), inputIndex);
    }

    private static List<Object[]> execute(BatchIterator<Row> it) throws Exception {
        TestingRowConsumer consumer = new TestingRowConsumer();
        consumer.accept(it, null);
        return consumer.getResult();
    }

    /**
     * key, bigint value, nullable bigint value
     */
    private static List<Object[]> rows(int numRows) {
        List<Object[]> rows = new ArrayList<>(numRows);
        for (int i = 0; i < numRows; i++) {
            rows.add(new Object[] {"k" + (i % 7), (long) i, i % 3 == 0 ? null : (long) (i % 11)});
        }
        return rows;
    }

    private static List<AggregateCall> rawCalls() {
        return List.of(
            call("sum", DataTypes.LONG, 2),
            AggregateCall.countStar(FUNCTIONS),
            call("count", DataTypes.LONG, 2),
            call("avg", DataTypes.LONG, 2),
            call("min", DataTypes.LONG, 1),
            call("max", DataTypes.LONG, 2),
            call("approx_count_distinct", DataTypes.LONG, 2)
        );
    }

    /**
     * Calls reading the partial states emitted by an upstream operator with the given calls.
     */
    private static List<AggregateCall> mergeCalls(List<AggregateCall> upstreamCalls, int numKeys) {
        List<AggregateCall> calls = new ArrayList<>(upstreamCalls.size());
        for (int i = 0; i < upstreamCalls.size(); i++) {
            calls.add(new AggregateCall(upstreamCalls.get(i).function(), numKeys + i));
        }
        return calls;
    }

    private static List<List<Object[]>> partition(List<Object[]> rows, int numPartitions) {
        List<List<Object[]>> partitions = new ArrayList<>(numPartitions);
        for (int i = 0; i < numPartitions; i++) {
            partitions.add(new ArrayList<>());
        }
        for (int i = 0; i < rows.size(); i++) {
            partitions.get(i % numPartitions).add(rows.get(i));
        }
        return partitions;
    }

    private static AggregateOperator leaf(List<Object[]> rows, List<AggregateCall> calls, GroupByOptions options) {
        return new AggregateOperator(
            TestingBatchIterators.batched(rows, 5), AggregationStage.LEAF, GROUP_BY_FIRST, calls, options);
    }

    @Test
    public void test_sum_grouped_by_key() throws Exception {
        AggregateOperator operator = new AggregateOperator(
            ofRows(ROWS), AggregationStage.DIRECT, GROUP_BY_FIRST, List.of(call("sum", DataTypes.LONG, 1)),
            GroupByOptions.DEFAULT);

        assertThat(execute(operator)).containsExactlyInAnyOrder(
            new Object[] {"a", 3L},
            new Object[] {"b", 3L}
        );
        AggregateStats stats = operator.stats();
        assertThat(stats.emittedRows()).isEqualTo(2L);
        assertThat(stats.numGroupsLimitReached()).isFalse();
        assertThat(stats.droppedRows()).isEqualTo(0L);
        assertThat(stats.executionTimeMs()).isGreaterThanOrEqualTo(0L);
    }

    @Test
    public void test_group_limit_keeps_first_groups_and_flags_partial_result() throws Exception {
        AggregateOperator operator = new AggregateOperator(
            ofRows(ROWS), AggregationStage.DIRECT, GROUP_BY_FIRST, List.of(call("sum", DataTypes.LONG, 1)),
            new GroupByOptions(1, false, false, 10));

        assertThat(execute(operator)).containsExactly(new Object[] {"a", 3L});
        AggregateStats stats = operator.stats();
        assertThat(stats.numGroupsLimitReached()).isTrue();
        assertThat(stats.droppedRows()).isEqualTo(1L);
        assertThat(stats.emittedRows()).isEqualTo(1L);
    }

    @Test
    public void test_multiple_group_by_columns_and_null_keys() throws Exception {
        AggregateOperator operator = new AggregateOperator(
            ofRows(
                new Object[] {"a", null, 1L},
                new Object[] {"a", null, 2L},
                new Object[] {"a", "x", 4L},
                new Object[] {null, null, 8L}
            ),
            AggregationStage.DIRECT,
            new int[] {0, 1},
            List.of(call("sum", DataTypes.LONG, 2)),
            GroupByOptions.DEFAULT);

        assertThat(execute(operator)).containsExactlyInAnyOrder(
            new Object[] {"a", null, 3L},
            new Object[] {"a", "x", 4L},
            new Object[] {null, null, 8L}
        );
    }

    @Test
    public void test_global_aggregation_over_no_rows_emits_one_row() throws Exception {
        AggregateOperator operator = new AggregateOperator(
            ofRows(), AggregationStage.DIRECT, NO_GROUP_BY,
            List.of(AggregateCall.countStar(FUNCTIONS), call("sum", DataTypes.LONG, 0)),
            GroupByOptions.DEFAULT);

        assertThat(execute(operator)).containsExactly(new Object[] {0L, null});
        assertThat(operator.stats().emittedRows()).isEqualTo(1L);
    }

    @Test
    public void test_global_aggregation_without_aggregations_emits_one_empty_row() throws Exception {
        AggregateOperator operator = new AggregateOperator(
            ofRows(ROWS), AggregationStage.DIRECT, NO_GROUP_BY, List.of(), GroupByOptions.DEFAULT);

        assertThat(execute(operator)).containsExactly(new Object[0]);
    }

    @Test
    public void test_group_by_without_aggregations_emits_distinct_keys() throws Exception {
        AggregateOperator operator = new AggregateOperator(
            ofRows(ROWS), AggregationStage.DIRECT, GROUP_BY_FIRST, List.of(), GroupByOptions.DEFAULT);

        assertThat(execute(operator)).containsExactlyInAnyOrder(new Object[] {"a"}, new Object[] {"b"});
    }

    @Test
    public void test_leaf_stage_global_aggregation_over_no_rows_emits_initial_states() throws Exception {
        AggregateOperator operator = new AggregateOperator(
            ofRows(), AggregationStage.LEAF, NO_GROUP_BY,
            List.of(AggregateCall.countStar(FUNCTIONS), call("avg", DataTypes.LONG, 0)),
            GroupByOptions.DEFAULT);

        assertThat(execute(operator)).containsExactly(new Object[] {0L, new AverageState(0, 0)});
    }

    @Test
    public void test_grouped_aggregation_over_no_rows_emits_nothing() throws Exception {
        AggregateOperator operator = new AggregateOperator(
            ofRows(), AggregationStage.DIRECT, GROUP_BY_FIRST, List.of(call("sum", DataTypes.LONG, 1)),
            GroupByOptions.DEFAULT);

        assertThat(execute(operator)).isEmpty();
        assertThat(operator.stats().emittedRows()).isEqualTo(0L);
    }

    @Test
    public void test_leaf_stage_emits_partial_states() throws Exception {
        AggregateOperator operator = new AggregateOperator(
            ofRows(ROWS), AggregationStage.LEAF, GROUP_BY_FIRST, List.of(call("avg", DataTypes.LONG, 1)),
            GroupByOptions.DEFAULT);

        assertThat(execute(operator)).containsExactlyInAnyOrder(
            new Object[] {"a", new AverageState(3, 2)},
            new Object[] {"b", new AverageState(3, 1)}
        );
    }

    @Test
    public void test_leaf_and_final_stage_compute_same_result_as_single_stage() throws Exception {
        List<Object[]> rows = rows(200);
        List<AggregateCall> rawCalls = rawCalls();
        List<Object[]> expected = execute(new AggregateOperator(
            ofRows(rows), AggregationStage.DIRECT, GROUP_BY_FIRST, rawCalls, GroupByOptions.DEFAULT));

        List<List<Object[]>> partitions = partition(rows, 3);
        BatchIterator<Row> leafOutputs = new CompositeBatchIterator<>(
            leaf(partitions.get(0), rawCalls, GroupByOptions.DEFAULT),
            leaf(partitions.get(1), rawCalls, GroupByOptions.DEFAULT),
            leaf(partitions.get(2), rawCalls, GroupByOptions.DEFAULT)
        );
        AggregateOperator finalStage = new AggregateOperator(
            leafOutputs, AggregationStage.FINAL, GROUP_BY_FIRST, mergeCalls(rawCalls, 1), GroupByOptions.DEFAULT);

        assertThat(expected).hasSize(7);
        assertThat(execute(finalStage)).containsExactlyInAnyOrderElementsOf(expected);
    }

    @Test
    public void test_intermediate_stage_merges_partial_states_without_finalizing() throws Exception {
        List<Object[]> rows = rows(300);
        List<AggregateCall> rawCalls = rawCalls();
        List<Object[]> expected = execute(new AggregateOperator(
            ofRows(rows), AggregationStage.DIRECT, GROUP_BY_FIRST, rawCalls, GroupByOptions.DEFAULT));

        List<AggregateCall> mergeCalls = mergeCalls(rawCalls, 1);
        List<List<Object[]>> partitions = partition(rows, 4);
        AggregateOperator intermediate1 = new AggregateOperator(
            new CompositeBatchIterator<>(
                leaf(partitions.get(0), rawCalls, GroupByOptions.DEFAULT),
                leaf(partitions.get(1), rawCalls, GroupByOptions.DEFAULT)),
            AggregationStage.INTERMEDIATE, GROUP_BY_FIRST, mergeCalls, GroupByOptions.DEFAULT);
        AggregateOperator intermediate2 = new AggregateOperator(
            new CompositeBatchIterator<>(
                leaf(partitions.get(2), rawCalls, GroupByOptions.DEFAULT),
                leaf(partitions.get(3), rawCalls, GroupByOptions.DEFAULT)),
            AggregationStage.INTERMEDIATE, GROUP_BY_FIRST, mergeCalls, GroupByOptions.DEFAULT);
        AggregateOperator finalStage = new AggregateOperator(
            new CompositeBatchIterator<>(intermediate1, intermediate2),
            AggregationStage.FINAL, GROUP_BY_FIRST, mergeCalls, GroupByOptions.DEFAULT);

        assertThat(execute(finalStage)).containsExactlyInAnyOrderElementsOf(expected);
    }

    @Test
    public void test_result_does_not_depend_on_row_order_or_batching() throws Exception {
        List<Object[]> rows = rows(500);
        List<Object[]> expected = execute(new AggregateOperator(
            ofRows(rows), AggregationStage.DIRECT, GROUP_BY_FIRST, rawCalls(), GroupByOptions.DEFAULT));

        List<Object[]> shuffled = new ArrayList<>(rows);
        Collections.shuffle(shuffled, new Random(42));
        for (int batchSize : new int[] {1, 3, 64, 1_000}) {
            AggregateOperator operator = new AggregateOperator(
                TestingBatchIterators.batched(shuffled, batchSize),
                AggregationStage.DIRECT, GROUP_BY_FIRST, rawCalls(), GroupByOptions.DEFAULT);
            assertThat(execute(operator)).containsExactlyInAnyOrderElementsOf(expected);
        }
    }

    @Test
    public void test_partitioned_final_stage_does_not_merge_rows_of_same_key() throws Exception {
        Object[][] partialRows = new Object[][] {
            new Object[] {"a", 1L},
            new Object[] {"a", 1L}
        };
        List<AggregateCall> calls = List.of(call("sum", DataTypes.LONG, 1));

        AggregateOperator partitioned = new AggregateOperator(
            ofRows(partialRows), AggregationStage.FINAL, GROUP_BY_FIRST, calls, new GroupByOptions(100, true, false, 10));
        assertThat(execute(partitioned)).containsExactly(
            new Object[] {"a", 1L},
            new Object[] {"a", 1L}
        );

        AggregateOperator merging = new AggregateOperator(
            ofRows(partialRows), AggregationStage.FINAL, GROUP_BY_FIRST, calls, GroupByOptions.DEFAULT);
        assertThat(execute(merging)).containsExactly(new Object[] {"a", 2L});
    }

    @Test
    public void test_partitioned_final_stage_finalizes_each_row_and_ignores_group_limit() throws Exception {
        AggregateOperator operator = new AggregateOperator(
            ofRows(
                new Object[] {"a", new AverageState(3, 2)},
                new Object[] {"b", new AverageState(4, 1)}
            ),
            AggregationStage.FINAL, GROUP_BY_FIRST, List.of(call("avg", DataTypes.LONG, 1)),
            new GroupByOptions(1, true, false, 10));

        assertThat(execute(operator)).containsExactly(
            new Object[] {"a", 1.5d},
            new Object[] {"b", 4.0d}
        );
        assertThat(operator.stats().numGroupsLimitReached()).isFalse();
        assertThat(operator.stats().emittedRows()).isEqualTo(2L);
    }

    @Test
    public void test_partitioned_intermediate_stage_forwards_partial_states() throws Exception {
        AverageState state = new AverageState(3, 2);
        AggregateOperator operator = new AggregateOperator(
            ofRows(new Object[] {"a", state}, new Object[] {"b", null}),
            AggregationStage.INTERMEDIATE, GROUP_BY_FIRST, List.of(call("avg", DataTypes.LONG, 1)),
            new GroupByOptions(100, true, false, 10));

        assertThat(execute(operator)).containsExactly(
            new Object[] {"a", new AverageState(3, 2)},
            new Object[] {"b", null}
        );
    }

    @Test
    public void test_skipped_leaf_stage_passes_rows_through_to_final_stage() throws Exception {
        GroupByOptions skip = new GroupByOptions(100, false, true, 10);
        List<AggregateCall> calls = List.of(call("sum", DataTypes.LONG, 1));

        AggregateOperator leafStage = new AggregateOperator(
            ofRows(ROWS), AggregationStage.LEAF, GROUP_BY_FIRST, calls, skip);
        assertThat(execute(leafStage)).containsExactly(ROWS);
        assertThat(leafStage.stats().emittedRows()).isEqualTo(3L);
        assertThat(leafStage.stats().numGroupsLimitReached()).isFalse();

        AggregateOperator finalStage = new AggregateOperator(
            new CompositeBatchIterator<>(
                leaf(List.of(ROWS[0], ROWS[2]), calls, skip),
                leaf(List.<Object[]>of(ROWS[1]), calls, skip)),
            AggregationStage.FINAL, GROUP_BY_FIRST, calls, skip);
        assertThat(execute(finalStage)).containsExactlyInAnyOrder(
            new Object[] {"a", 3L},
            new Object[] {"b", 3L}
        );
    }

    @Test
    public void test_non_mergeable_aggregation_is_computed_from_raw_rows() throws Exception {
        List<AggregateCall> calls = List.of(
            call("count_distinct", DataTypes.STRING, 1),
            call("sum", DataTypes.LONG, 2)
        );
        AggregateOperator finalStage = new AggregateOperator(
            new CompositeBatchIterator<>(
                leaf(List.of(new Object[] {"a", "x", 1L}, new Object[] {"a", "y", 2L}), calls, GroupByOptions.DEFAULT),
                leaf(List.of(new Object[] {"a", "x", 3L}, new Object[] {"b", "z", 4L}), calls, GroupByOptions.DEFAULT)),
            AggregationStage.FINAL, GROUP_BY_FIRST, calls, GroupByOptions.DEFAULT);

        assertThat(finalStage.strategy().mode()).isEqualTo(AggregateMode.ITER_FINAL);
        assertThat(execute(finalStage)).containsExactlyInAnyOrder(
            new Object[] {"a", 2L, 6L},
            new Object[] {"b", 1L, 4L}
        );
    }

    @Test
    public void test_filtered_aggregation_only_sees_matching_rows() throws Exception {
        List<AggregateCall> calls = List.of(
            new AggregateCall(FUNCTIONS.get("count", List.of()), AggregateCall.NO_INPUT, 2),
            call("sum", DataTypes.LONG, 1)
        );
        AggregateOperator operator = new AggregateOperator(
            ofRows(
                new Object[] {"a", 1L, true},
                new Object[] {"a", 2L, false},
                new Object[] {"b", 3L, null}
            ),
            AggregationStage.DIRECT, GROUP_BY_FIRST, calls, GroupByOptions.DEFAULT);

        assertThat(execute(operator)).containsExactlyInAnyOrder(
            new Object[] {"a", 1L, 3L},
            new Object[] {"b", 0L, 3L}
        );
    }

    @Test
    public void test_value_of_wrong_type_fails_with_type_mismatch() {
        AggregateOperator operator = new AggregateOperator(
            ofRows(new Object[] {"a", 1L}, new Object[] {"a", "foo"}),
            AggregationStage.DIRECT, GROUP_BY_FIRST, List.of(call("sum", DataTypes.LONG, 1)),
            GroupByOptions.DEFAULT);

        assertThatThrownBy(() -> execute(operator))
            .isExactlyInstanceOf(TypeMismatchException.class)
            .hasMessageContaining("foo");
    }

    @Test
    public void test_upstream_load_failure_is_propagated_unchanged() {
        IllegalStateException failure = new IllegalStateException("Upstream failed");
        AggregateOperator operator = new AggregateOperator(
            FailingBatchIterator.failOnLoadNextBatch(ofRows(ROWS), 2, failure),
            AggregationStage.DIRECT, GROUP_BY_FIRST, List.of(call("sum", DataTypes.LONG, 1)),
            GroupByOptions.DEFAULT);

        assertThatThrownBy(() -> execute(operator)).isSameAs(failure);
        assertThat(operator.loadNextBatch().toCompletableFuture()).isCompletedExceptionally();
    }

    @Test
    public void test_upstream_row_failure_is_propagated_unchanged() {
        IllegalStateException failure = new IllegalStateException("Upstream failed");
        AggregateOperator operator = new AggregateOperator(
            FailingBatchIterator.failOnMoveNext(ofRows(ROWS), 1, failure),
            AggregationStage.DIRECT, GROUP_BY_FIRST, List.of(call("sum", DataTypes.LONG, 1)),
            GroupByOptions.DEFAULT);

        assertThatThrownBy(() -> execute(operator)).isSameAs(failure);
    }

    @Test
    public void test_kill_aborts_pending_consumption() {
        @SuppressWarnings("unchecked")
        BatchIterator<Row> source = mock(BatchIterator.class);
        CompletableFuture<Void> neverLoaded = new CompletableFuture<>();
        when(source.moveNext()).thenReturn(false);
        when(source.allLoaded()).thenReturn(false);
        doReturn(neverLoaded).when(source).loadNextBatch();

        AggregateOperator operator = new AggregateOperator(
            source, AggregationStage.DIRECT, GROUP_BY_FIRST, List.of(AggregateCall.countStar(FUNCTIONS)),
            GroupByOptions.DEFAULT);
        CompletableFuture<?> loading = operator.loadNextBatch().toCompletableFuture();
        assertThat(loading).isNotDone();

        InterruptedException reason = new InterruptedException("Job killed");
        operator.kill(reason);

        assertThat(loading).isCompletedExceptionally();
        verify(source).kill(reason);
        assertThatThrownBy(operator::moveNext).isSameAs(reason);
        assertThat(operator.loadNextBatch().toCompletableFuture()).isCompletedExceptionally();

        neverLoaded.complete(null);
        assertThat(operator.state()).isEqualTo(AggregateOperator.State.CONSUMING);
        assertThatThrownBy(operator::stats).isExactlyInstanceOf(IllegalStateException.class);
    }

    @Test
    public void test_states_and_stats_follow_consumption() throws Exception {
        AggregateOperator operator = new AggregateOperator(
            ofRows(ROWS), AggregationStage.DIRECT, GROUP_BY_FIRST, List.of(call("sum", DataTypes.LONG, 1)),
            GroupByOptions.DEFAULT);

        assertThat(operator.state()).isEqualTo(AggregateOperator.State.CONSUMING);
        assertThat(operator.allLoaded()).isFalse();
        assertThat(operator.moveNext()).isFalse();
        assertThatThrownBy(operator::stats).isExactlyInstanceOf(IllegalStateException.class);

        operator.loadNextBatch().toCompletableFuture().get(5, TimeUnit.SECONDS);
        assertThat(operator.state()).isEqualTo(AggregateOperator.State.DRAINING);
        assertThat(operator.allLoaded()).isTrue();
        assertThatThrownBy(operator::stats).isExactlyInstanceOf(IllegalStateException.class);

        assertThat(operator.moveNext()).isTrue();
        assertThat(operator.currentElement().materialize()).containsExactly("a", 3L);
        assertThat(operator.moveNext()).isTrue();
        assertThat(operator.currentElement().materialize()).containsExactly("b", 3L);
        assertThat(operator.moveNext()).isFalse();
        assertThat(operator.state()).isEqualTo(AggregateOperator.State.EXHAUSTED);
        assertThat(operator.moveNext()).isFalse();

        assertThat(operator.stats().emittedRows()).isEqualTo(2L);
        assertThat(operator.loadNextBatch().toCompletableFuture()).isCompletedExceptionally();
    }

    @Test
    public void test_load_next_batch_while_loading_fails() {
        @SuppressWarnings("unchecked")
        BatchIterator<Row> source = mock(BatchIterator.class);
        when(source.moveNext()).thenReturn(false);
        when(source.allLoaded()).thenReturn(false);
        doReturn(new CompletableFuture<>()).when(source).loadNextBatch();

        AggregateOperator operator = new AggregateOperator(
            source, AggregationStage.DIRECT, NO_GROUP_BY, List.of(AggregateCall.countStar(FUNCTIONS)),
            GroupByOptions.DEFAULT);
        assertThat(operator.loadNextBatch().toCompletableFuture()).isNotDone();
        assertThat(operator.loadNextBatch().toCompletableFuture()).isCompletedExceptionally();
    }

    @Test
    public void test_operator_cannot_be_moved_to_start() {
        AggregateOperator operator = new AggregateOperator(
            ofRows(ROWS), AggregationStage.DIRECT, GROUP_BY_FIRST, List.of(), GroupByOptions.DEFAULT);
        assertThatThrownBy(operator::moveToStart).isExactlyInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    public void test_close_closes_source_and_prevents_further_use() {
        @SuppressWarnings("unchecked")
        BatchIterator<Row> source = mock(BatchIterator.class);
        AggregateOperator operator = new AggregateOperator(
            source, AggregationStage.DIRECT, GROUP_BY_FIRST, List.of(), GroupByOptions.DEFAULT);

        operator.close();
        operator.close();

        verify(source).close();
        assertThatThrownBy(operator::moveNext).isExactlyInstanceOf(IllegalStateException.class);
        assertThat(operator.loadNextBatch().toCompletableFuture()).isCompletedExceptionally();
    }

    @Test
    public void test_explain_metadata_is_available_without_execution() {
        List<AggregateCall> calls = List.of(AggregateCall.countStar(FUNCTIONS), call("max", DataTypes.STRING, 3));
        AggregateOperator operator = new AggregateOperator(
            ofRows(), AggregationStage.FINAL, new int[] {2, 0}, calls, GroupByOptions.DEFAULT);

        assertThat(operator.groupByIndexes()).containsExactly(2, 0);
        assertThat(operator.aggregations()).containsExactlyElementsOf(calls);
        assertThat(operator.aggregations().get(1)).hasToString("max(INPUT(3))");
        assertThat(operator.state()).isEqualTo(AggregateOperator.State.CONSUMING);
    }
}

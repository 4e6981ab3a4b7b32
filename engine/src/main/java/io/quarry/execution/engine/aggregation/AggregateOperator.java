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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import io.quarry.data.BatchIterator;
import io.quarry.data.Row;
import io.quarry.data.RowN;
import io.quarry.exceptions.Exceptions;

/**
 * Groups the rows of a source {@link BatchIterator} and emits one row per group:
 * the group-by values followed by one value per aggregation.
 *
 * <p>
 * The operator is blocking: the first {@link #loadNextBatch()} consumes the whole source, as any row may still
 * contribute to any group. Only afterwards the groups can be read via {@link #moveNext()}.
 * </p>
 *
 * <pre>
 *   CONSUMING --(source exhausted)--> DRAINING --(all groups emitted)--> EXHAUSTED
 * </pre>
 *
 * In {@link AggregateStrategy.Execution#PASS_THROUGH} the source rows are streamed through unchanged and the
 * operator moves from CONSUMING to EXHAUSTED once the source is exhausted.
 *
 * <p>
 * An instance is single use: it cannot be moved to start and must be driven by one thread at a time.
 * {@link #kill(Throwable)} may be called from any thread; it aborts the consumption at the next pull from the source.
 * </p>
 */
public final class AggregateOperator implements BatchIterator<Row> {

    private static final Logger LOGGER = LogManager.getLogger(AggregateOperator.class);

    enum State {
        CONSUMING,
        DRAINING,
        EXHAUSTED
    }

    private final BatchIterator<Row> source;
    private final GroupKeyExtractor keyExtractor;
    private final List<AggregateCall> aggregations;
    private final AggregateCall[] calls;
    private final AggregationFunction<Object, Object>[] functions;
    private final AggregateStrategy strategy;
    private final GroupByOptions options;

    @Nullable
    private final GroupByResultHolder resultHolder;
    @Nullable
    private final List<Object[]> perRowResults;
    private final RowN outputRow;

    private State state = State.CONSUMING;
    private boolean closed = false;
    private Iterator<Object[]> output = null;
    private Row current = null;

    private volatile Throwable killed = null;
    private volatile CompletableFuture<Void> pendingLoad = null;
    private Throwable failure = null;

    private long executionTimeNanos = 0;
    private long emittedRows = 0;
    private long droppedRows = 0;

    public AggregateOperator(BatchIterator<Row> source,
                             AggregationStage stage,
                             int[] groupByIndexes,
                             List<AggregateCall> aggregations,
                             GroupByOptions options) {
        this.source = source;
        this.keyExtractor = new GroupKeyExtractor(groupByIndexes);
        this.aggregations = List.copyOf(aggregations);
        this.calls = this.aggregations.toArray(new AggregateCall[0]);
        this.functions = functions(calls);
        this.options = options;
        this.strategy = AggregateStrategy.select(stage, options, keyExtractor.isGlobal(), this.aggregations);
        this.outputRow = new RowN(keyExtractor.numKeys() + calls.length);
        switch (strategy.execution()) {
            case GROUP:
                resultHolder = new GroupByResultHolder(
                    functions, options.numGroupsLimit(), options.maxInitialResultHolderCapacity());
                perRowResults = null;
                break;

            case PER_ROW:
                resultHolder = null;
                perRowResults = new ArrayList<>();
                break;

            default:
                resultHolder = null;
                perRowResults = null;
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Created aggregate operator stage={} strategy={} groupBy={} aggregations={} options={}",
                stage, strategy, keyExtractor, this.aggregations, options);
        }
    }

    @SuppressWarnings("unchecked")
    private static AggregationFunction<Object, Object>[] functions(AggregateCall[] calls) {
        AggregationFunction<Object, Object>[] functions = new AggregationFunction[calls.length];
        for (int i = 0; i < calls.length; i++) {
            functions[i] = (AggregationFunction<Object, Object>) calls[i].function();
        }
        return functions;
    }

    public int[] groupByIndexes() {
        return keyExtractor.groupByIndexes();
    }

    public List<AggregateCall> aggregations() {
        return aggregations;
    }

    public AggregateStrategy strategy() {
        return strategy;
    }

    public GroupByOptions options() {
        return options;
    }

    State state() {
        return state;
    }

    /**
     * @throws IllegalStateException if the operator has not yet emitted all rows
     */
    public AggregateStats stats() {
        if (state != State.EXHAUSTED) {
            throw new IllegalStateException("Stats are only available once all rows have been emitted");
        }
        return new AggregateStats(
            TimeUnit.NANOSECONDS.toMillis(executionTimeNanos),
            emittedRows,
            resultHolder != null && resultHolder.limitReached(),
            droppedRows
        );
    }

    /**
     * @return the current row or null if the operator is not positioned on a row.
     *         The row instance is re-used on subsequent {@link #moveNext()} calls.
     */
    @Override
    public Row currentElement() {
        return current;
    }

    @Override
    public void moveToStart() {
        raiseIfClosedOrKilled();
        throw new UnsupportedOperationException("AggregateOperator can only be consumed once");
    }

    @Override
    public boolean moveNext() {
        raiseIfClosedOrKilled();
        long startNanos = System.nanoTime();
        try {
            if (strategy.execution() == AggregateStrategy.Execution.PASS_THROUGH) {
                return passThroughNext();
            }
            if (state != State.DRAINING) {
                current = null;
                return false;
            }
            if (output == null) {
                output = resultHolder == null ? perRowResults.iterator() : resultHolder.drain(strategy.mode().finalOutput());
            }
            if (output.hasNext()) {
                outputRow.cells(output.next());
                current = outputRow;
                emittedRows++;
                return true;
            }
            current = null;
            output = Collections.emptyIterator();
            state = State.EXHAUSTED;
            LOGGER.debug("Aggregate operator emitted {} rows", emittedRows);
            return false;
        } finally {
            executionTimeNanos += System.nanoTime() - startNanos;
        }
    }

    private boolean passThroughNext() {
        if (state != State.CONSUMING) {
            current = null;
            return false;
        }
        if (source.moveNext()) {
            current = source.currentElement();
            emittedRows++;
            return true;
        }
        current = null;
        if (source.allLoaded()) {
            state = State.EXHAUSTED;
        }
        return false;
    }

    @Override
    public void close() {
        if (closed == false) {
            closed = true;
            source.close();
        }
    }

    @Override
    public CompletionStage<?> loadNextBatch() {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Iterator is closed"));
        }
        Throwable err = killed;
        if (err != null) {
            return CompletableFuture.failedFuture(err);
        }
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        if (strategy.execution() == AggregateStrategy.Execution.PASS_THROUGH) {
            if (state != State.CONSUMING || source.allLoaded()) {
                return CompletableFuture.failedFuture(new IllegalStateException("BatchIterator already fully loaded"));
            }
            return source.loadNextBatch();
        }
        if (state != State.CONSUMING) {
            return CompletableFuture.failedFuture(new IllegalStateException("BatchIterator already fully loaded"));
        }
        if (pendingLoad != null) {
            return CompletableFuture.failedFuture(new IllegalStateException("BatchIterator is already loading"));
        }
        CompletableFuture<Void> result = new CompletableFuture<>();
        pendingLoad = result;
        result.whenComplete((r, t) -> {
            pendingLoad = null;
            if (t != null) {
                failure = t;
            }
        });
        consume(result);
        return result;
    }

    /**
     * Consumes all rows of the source which are currently loaded, then either finishes
     * or suspends until the source loaded its next batch.
     */
    private void consume(CompletableFuture<Void> result) {
        long startNanos = System.nanoTime();
        try {
            Throwable err = killed;
            if (err != null) {
                result.completeExceptionally(err);
                return;
            }
            while (source.moveNext()) {
                onRow(source.currentElement());
            }
            if (source.allLoaded()) {
                finishConsumption();
                result.complete(null);
                return;
            }
        } catch (Throwable t) {
            result.completeExceptionally(t);
            return;
        } finally {
            executionTimeNanos += System.nanoTime() - startNanos;
        }

        Throwable err = killed;
        if (err != null) {
            result.completeExceptionally(err);
            return;
        }
        source.loadNextBatch().whenComplete((r, t) -> {
            if (t == null) {
                consume(result);
            } else {
                result.completeExceptionally(Exceptions.unwrap(t));
            }
        });
    }

    private void onRow(Row row) {
        if (resultHolder == null) {
            onPartitionedRow(row);
            return;
        }
        int groupId = resultHolder.getOrCreate(keyExtractor.extract(row));
        if (groupId == GroupByResultHolder.REJECTED) {
            if (droppedRows == 0) {
                LOGGER.warn("Reached num_groups_limit of {} groups, rows of further groups are dropped",
                    options.numGroupsLimit());
            }
            droppedRows++;
            return;
        }
        Object[] states = resultHolder.states(groupId);
        if (strategy.mode().iterInput()) {
            for (int i = 0; i < calls.length; i++) {
                AggregateCall call = calls[i];
                if (call.accepts(row)) {
                    states[i] = functions[i].iterate(states[i], call.input(row));
                }
            }
        } else {
            for (int i = 0; i < calls.length; i++) {
                states[i] = functions[i].reduce(states[i], functions[i].readPartial(calls[i].input(row)));
            }
        }
    }

    /**
     * Input is partitioned by the group keys, so each partial row already holds the complete states of its group.
     */
    private void onPartitionedRow(Row row) {
        GroupKey key = keyExtractor.extract(row);
        Object[] cells = new Object[key.size() + calls.length];
        key.copyInto(cells);
        boolean finalOutput = strategy.mode().finalOutput();
        for (int i = 0; i < calls.length; i++) {
            Object partial = functions[i].readPartial(calls[i].input(row));
            cells[key.size() + i] = finalOutput ? functions[i].terminatePartial(partial) : partial;
        }
        perRowResults.add(cells);
    }

    private void finishConsumption() {
        if (resultHolder != null && keyExtractor.isGlobal() && resultHolder.numGroups() == 0) {
            // a global aggregation emits one row also if there was no input
            resultHolder.getOrCreate(GroupKey.EMPTY);
        }
        state = State.DRAINING;
        source.close();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Aggregate operator consumed its source, groups={} droppedRows={}",
                resultHolder == null ? perRowResults.size() : resultHolder.numGroups(), droppedRows);
        }
    }

    @Override
    public boolean allLoaded() {
        if (strategy.execution() == AggregateStrategy.Execution.PASS_THROUGH) {
            return state != State.CONSUMING || source.allLoaded();
        }
        return state != State.CONSUMING;
    }

    @Override
    public boolean involvesIO() {
        return source.involvesIO();
    }

    @Override
    public void kill(Throwable throwable) {
        killed = throwable;
        source.kill(throwable);
        CompletableFuture<Void> load = pendingLoad;
        if (load != null) {
            load.completeExceptionally(throwable);
        }
    }

    private void raiseIfClosedOrKilled() {
        Throwable err = killed;
        if (err != null) {
            Exceptions.rethrowUnchecked(err);
        }
        if (closed) {
            throw new IllegalStateException("Iterator is closed");
        }
    }

    @Override
    public String toString() {
        return "AggregateOperator{" +
               "strategy=" + strategy +
               ", groupBy=" + keyExtractor +
               ", aggregations=" + aggregations +
               ", state=" + state +
               '}';
    }
}

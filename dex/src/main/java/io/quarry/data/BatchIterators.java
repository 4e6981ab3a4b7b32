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

import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.stream.Collector;

public final class BatchIterators {

    private BatchIterators() {
    }

    /**
     * Use a {@link Collector} to consume all elements of the given {@link BatchIterator}.
     * The iterator is not closed.
     *
     * @return a future which is completed with the collector result once all elements have been consumed,
     *         or completed exceptionally if loading or consuming the iterator failed.
     */
    public static <T, A, R> CompletableFuture<R> collect(BatchIterator<T> it, Collector<T, A, R> collector) {
        CompletableFuture<R> result = new CompletableFuture<>();
        A state;
        try {
            state = collector.supplier().get();
        } catch (Throwable t) {
            result.completeExceptionally(t);
            return result;
        }
        collect(it, state, collector.accumulator(), collector.finisher(), result);
        return result;
    }

    private static <T, A, R> void collect(BatchIterator<T> it,
                                          A state,
                                          BiConsumer<A, T> accumulator,
                                          Function<A, R> finisher,
                                          CompletableFuture<R> result) {
        try {
            while (it.moveNext()) {
                accumulator.accept(state, it.currentElement());
            }
            if (it.allLoaded()) {
                result.complete(finisher.apply(state));
            } else {
                it.loadNextBatch().whenComplete((r, t) -> {
                    if (t == null) {
                        collect(it, state, accumulator, finisher, result);
                    } else {
                        result.completeExceptionally(t);
                    }
                });
            }
        } catch (Throwable t) {
            result.completeExceptionally(t);
        }
    }
}

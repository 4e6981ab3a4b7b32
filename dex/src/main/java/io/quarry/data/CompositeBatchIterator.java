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

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Union of several iterators, e.g. the outputs of all upstream operators feeding one merge stage.
 * The iterators are consumed one after another, so a repeated consumption yields the elements in the same order.
 */
public class CompositeBatchIterator<T> implements BatchIterator<T> {

    private final List<BatchIterator<T>> iterators;
    private int current = 0;

    @SafeVarargs
    public CompositeBatchIterator(BatchIterator<T>... iterators) {
        this(List.of(iterators));
    }

    public CompositeBatchIterator(List<BatchIterator<T>> iterators) {
        if (iterators.isEmpty()) {
            throw new IllegalArgumentException("CompositeBatchIterator requires at least one iterator");
        }
        this.iterators = iterators;
    }

    @Override
    public T currentElement() {
        return iterators.get(current).currentElement();
    }

    @Override
    public void moveToStart() {
        iterators.forEach(BatchIterator::moveToStart);
        current = 0;
    }

    @Override
    public boolean moveNext() {
        for (; current < iterators.size(); current++) {
            BatchIterator<T> it = iterators.get(current);
            if (it.moveNext()) {
                return true;
            }
            if (it.allLoaded() == false) {
                // the current iterator needs to load its next batch first
                return false;
            }
        }
        current = iterators.size() - 1;
        return false;
    }

    @Override
    public void close() {
        iterators.forEach(BatchIterator::close);
    }

    @Override
    public CompletionStage<?> loadNextBatch() {
        for (BatchIterator<T> it : iterators) {
            if (it.allLoaded() == false) {
                return it.loadNextBatch();
            }
        }
        return CompletableFuture.failedFuture(new IllegalStateException("All iterators are already loaded"));
    }

    @Override
    public boolean allLoaded() {
        return iterators.stream().allMatch(BatchIterator::allLoaded);
    }

    @Override
    public boolean involvesIO() {
        return iterators.stream().anyMatch(BatchIterator::involvesIO);
    }

    @Override
    public void kill(Throwable throwable) {
        for (BatchIterator<T> it : iterators) {
            it.kill(throwable);
        }
    }
}

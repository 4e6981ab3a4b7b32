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

import java.util.Collections;
import java.util.Iterator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import org.jetbrains.annotations.Nullable;

import com.google.common.annotations.VisibleForTesting;

/**
 * Serves the elements of an {@link Iterable} as one single block which is available right away.
 * Used for inputs which are already materialized, e.g. buffered rows of an upstream stage.
 */
public class InMemoryBatchIterator<T> implements BatchIterator<T> {

    private final Iterable<? extends T> items;
    @Nullable
    private final T sentinel;
    private final boolean involvesIO;

    private Iterator<? extends T> it;
    @Nullable
    private T current;

    public static <T> BatchIterator<T> empty(@Nullable T sentinel) {
        return of(Collections.emptyList(), sentinel, false);
    }

    public static <T> BatchIterator<T> of(T item, @Nullable T sentinel) {
        return of(Collections.singletonList(item), sentinel, false);
    }

    /**
     * @param items the elements; must be iterable repeatedly if {@link #moveToStart()} is used
     * @param sentinel returned by {@link #currentElement()} while the iterator isn't positioned on an element
     * @param involvesIO whether iterating {@code items} reads from disk or network
     */
    public static <T> BatchIterator<T> of(Iterable<? extends T> items, @Nullable T sentinel, boolean involvesIO) {
        return new CloseAssertingBatchIterator<>(new InMemoryBatchIterator<>(items, sentinel, involvesIO));
    }

    @VisibleForTesting
    InMemoryBatchIterator(Iterable<? extends T> items, @Nullable T sentinel, boolean involvesIO) {
        this.items = items;
        this.sentinel = sentinel;
        this.involvesIO = involvesIO;
        moveToStart();
    }

    @Override
    public T currentElement() {
        return current;
    }

    @Override
    public void moveToStart() {
        it = items.iterator();
        current = sentinel;
    }

    @Override
    public boolean moveNext() {
        boolean hasNext = it.hasNext();
        current = hasNext ? it.next() : sentinel;
        return hasNext;
    }

    @Override
    public void close() {
    }

    @Override
    public CompletionStage<?> loadNextBatch() {
        return CompletableFuture.failedFuture(new IllegalStateException("InMemoryBatchIterator has only one batch"));
    }

    @Override
    public boolean allLoaded() {
        return true;
    }

    @Override
    public boolean involvesIO() {
        return involvesIO;
    }

    @Override
    public void kill(Throwable throwable) {
        // close and kill checks are done by the CloseAssertingBatchIterator wrapper
    }
}

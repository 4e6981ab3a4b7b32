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

import java.util.concurrent.CompletionStage;

/**
 * Pull based cursor over the output of an operator. Rows arrive in blocks: the rows of the current block are
 * visited with {@link #moveNext()}, the next block is requested with {@link #loadNextBatch()}.
 * An operator consumes its upstream operator with the following loop:
 *
 * <pre>
 *     while (it.moveNext()) {
 *         // process it.currentElement()
 *     }
 *     if (it.allLoaded()) {
 *         // end of input
 *     } else {
 *         it.loadNextBatch().whenComplete((r, t) -> {
 *             // t == null: resume the loop; otherwise the upstream failed
 *         });
 *     }
 * </pre>
 *
 * Only one thread may move or load an iterator at a time. {@link #kill(Throwable)} is the exception,
 * it may be called concurrently to cancel the consumption.
 */
public interface BatchIterator<T> extends Killable {

    /**
     * The element of the last successful {@link #moveNext()} call.
     * Implementations may re-use the element instance for the following elements.
     */
    T currentElement();

    /**
     * Repositions the iterator before the first element.
     *
     * @throws IllegalStateException if the iterator is closed
     * @throws UnsupportedOperationException if the elements can be visited only once
     */
    void moveToStart();

    /**
     * @return true if positioned on the next element of the current block. false if the block is consumed;
     *         the input is then either exhausted ({@link #allLoaded()}) or the next block must be loaded.
     * @throws IllegalStateException if the iterator is closed
     */
    boolean moveNext();

    /**
     * Releases the resources of the iterator and of its upstream iterators. Idempotent.
     * Afterwards moving the iterator raises and {@link #loadNextBatch()} returns a failed stage.
     */
    void close();

    /**
     * Requests the next block of elements. Must not be called while a previous load is pending.
     * The iterator must not be moved until the returned stage completes.
     *
     * @return a stage completed once the block is available. The stage fails if loading failed,
     *         if everything is already loaded or if the iterator is closed or killed; this method itself never raises.
     */
    CompletionStage<?> loadNextBatch();

    /**
     * @return true if there are no further blocks to load
     */
    boolean allLoaded();

    /**
     * @return true if producing the elements involves disk or network IO
     */
    boolean involvesIO();
}

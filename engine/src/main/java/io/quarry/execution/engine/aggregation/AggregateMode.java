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

/**
 * Describes what an aggregate operator reads and what it emits per aggregation.
 *
 * ITER: raw argument values which are fed into {@link AggregationFunction#iterate(Object, Object)}
 * PARTIAL: partial states which are combined with {@link AggregationFunction#reduce(Object, Object)}
 * FINAL: the result of {@link AggregationFunction#terminatePartial(Object)}
 */
public enum AggregateMode {

    ITER_PARTIAL(true, false),
    ITER_FINAL(true, true),
    PARTIAL_PARTIAL(false, false),
    PARTIAL_FINAL(false, true);

    private final boolean iterInput;
    private final boolean finalOutput;

    AggregateMode(boolean iterInput, boolean finalOutput) {
        this.iterInput = iterInput;
        this.finalOutput = finalOutput;
    }

    public boolean iterInput() {
        return iterInput;
    }

    public boolean finalOutput() {
        return finalOutput;
    }
}

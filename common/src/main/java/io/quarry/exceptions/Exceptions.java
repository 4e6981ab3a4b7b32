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

package io.quarry.exceptions;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.jetbrains.annotations.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.util.concurrent.UncheckedExecutionException;

public final class Exceptions {

    private Exceptions() {
    }

    /**
     * Removes wrapper exceptions like {@link CompletionException}
     */
    public static Throwable unwrap(Throwable t) {
        int counter = 0;
        Throwable result = t;
        while (result instanceof CompletionException ||
               result instanceof UncheckedExecutionException ||
               result instanceof ExecutionException) {
            Throwable cause = result.getCause();
            if (cause == null) {
                return result;
            }
            if (cause == result) {
                return result;
            }
            if (counter > 10) {
                return result;
            }
            counter++;
            result = cause;
        }
        return result;
    }

    public static String messageOf(@Nullable Throwable t) {
        if (t == null) {
            return "Unknown";
        }
        Throwable unwrappedT = unwrap(t);
        return MoreObjects.firstNonNull(unwrappedT.getMessage(), unwrappedT.toString());
    }

    /**
     * Rethrows the given throwable without wrapping it, also if it is a checked exception.
     */
    public static void rethrowUnchecked(Throwable t) {
        Exceptions.<RuntimeException>rethrow(t);
    }

    @SuppressWarnings("unchecked")
    private static <T extends Throwable> void rethrow(final Throwable t) throws T {
        throw (T) t;
    }

    /**
     * Returns {@code second} if {@code first} is null, otherwise adds {@code second} as suppressed to {@code first}.
     */
    public static <T extends Throwable> T useOrSuppress(@Nullable T first, T second) {
        if (first == null) {
            return second;
        }
        if (first != second) {
            first.addSuppressed(second);
        }
        return first;
    }
}

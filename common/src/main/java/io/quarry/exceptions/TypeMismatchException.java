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

import java.util.Locale;

import io.quarry.types.DataType;

/**
 * Raised if a function receives a value which cannot be interpreted as the argument type it was resolved for.
 * Aborts the query.
 */
public class TypeMismatchException extends IllegalArgumentException {

    public TypeMismatchException(String functionName, DataType<?> expectedType, Object value) {
        super(String.format(
            Locale.ENGLISH,
            "Function `%s` expects an argument of type `%s` but received value `%s` of class `%s`",
            functionName,
            expectedType,
            value,
            value.getClass().getSimpleName()
        ));
    }

    public TypeMismatchException(String functionName, Object state, Class<?> expectedStateClass) {
        super(String.format(
            Locale.ENGLISH,
            "Function `%s` expects a partial state of class `%s` but received `%s` of class `%s`",
            functionName,
            expectedStateClass.getSimpleName(),
            state,
            state.getClass().getSimpleName()
        ));
    }
}

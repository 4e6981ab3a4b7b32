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

package io.quarry.types;

public final class IntegerType extends DataType<Integer> {

    public static final int ID = 9;
    public static final IntegerType INSTANCE = new IntegerType();

    private IntegerType() {
        super(ID, "integer");
    }

    @Override
    public boolean isNumeric() {
        return true;
    }

    /**
     * Accepts {@link Short} and {@link Byte} besides {@link Integer}. A {@link Long} is rejected even if it
     * would fit, the aggregation of bigint values is declared on {@link LongType}.
     */
    @Override
    public Integer sanitizeValue(Object value) {
        if (value == null || value instanceof Integer) {
            return (Integer) value;
        }
        if (value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        throw cannotSanitize(value);
    }

    @Override
    public int compare(Integer val1, Integer val2) {
        return Integer.compare(val1, val2);
    }
}

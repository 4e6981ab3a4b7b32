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

package io.quarry.execution.engine.aggregation.impl;

import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * Dense HyperLogLog cardinality sketch over 64 bit hashes.
 *
 * Uses {@code 2^precision} one byte registers; the first {@code precision} bits of a hash select the register,
 * the register keeps the maximum rank (position of the first one-bit) of the remaining bits.
 * Small cardinalities are estimated with linear counting.
 */
public final class HyperLogLogSketch {

    public static final int MIN_PRECISION = 4;
    public static final int MAX_PRECISION = 18;
    public static final int DEFAULT_PRECISION = 14;

    private final int precision;
    private final byte[] registers;

    public HyperLogLogSketch(int precision) {
        Preconditions.checkArgument(
            precision >= MIN_PRECISION && precision <= MAX_PRECISION,
            "precision must be between %s and %s, got %s", MIN_PRECISION, MAX_PRECISION, precision);
        this.precision = precision;
        this.registers = new byte[1 << precision];
    }

    public int precision() {
        return precision;
    }

    public void collect(long hash) {
        int index = (int) (hash >>> (Long.SIZE - precision));
        // the sentinel bit bounds the rank to Long.SIZE - precision + 1
        long remaining = (hash << precision) | (1L << (precision - 1));
        byte rank = (byte) (Long.numberOfLeadingZeros(remaining) + 1);
        if (rank > registers[index]) {
            registers[index] = rank;
        }
    }

    /**
     * Merges the registers of {@code other} into this sketch.
     */
    public void merge(HyperLogLogSketch other) {
        Preconditions.checkArgument(
            other.precision == precision,
            "Cannot merge sketches with different precision: %s and %s", precision, other.precision);
        for (int i = 0; i < registers.length; i++) {
            if (other.registers[i] > registers[i]) {
                registers[i] = other.registers[i];
            }
        }
    }

    public long cardinality() {
        int m = registers.length;
        double sum = 0;
        int zeroRegisters = 0;
        for (byte register : registers) {
            sum += 1.0 / (1L << register);
            if (register == 0) {
                zeroRegisters++;
            }
        }
        double estimate = alpha(m) * m * m / sum;
        if (estimate <= 2.5 * m && zeroRegisters > 0) {
            estimate = m * Math.log((double) m / zeroRegisters);
        }
        return Math.round(estimate);
    }

    private static double alpha(int m) {
        switch (m) {
            case 16:
                return 0.673;
            case 32:
                return 0.697;
            case 64:
                return 0.709;
            default:
                return 0.7213 / (1 + 1.079 / m);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        HyperLogLogSketch that = (HyperLogLogSketch) o;
        return precision == that.precision && Arrays.equals(registers, that.registers);
    }

    @Override
    public int hashCode() {
        return 31 * precision + Arrays.hashCode(registers);
    }

    @Override
    public String toString() {
        return "HyperLogLogSketch{precision=" + precision + ", cardinality=" + cardinality() + '}';
    }
}

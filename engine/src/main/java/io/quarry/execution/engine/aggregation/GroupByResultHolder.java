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

import java.util.Arrays;
import java.util.Iterator;

import com.carrotsearch.hppc.ObjectIntHashMap;
import com.google.common.collect.AbstractIterator;

/**
 * Bounded mapping from {@link GroupKey} to the partial states of the aggregations of that group.
 *
 * States are kept in an arena indexed by a dense group id; a separate hash index maps keys to ids.
 * At most {@code numGroupsLimit} groups are created. Once the limit is hit further new keys are rejected
 * while existing groups continue to accumulate, and {@link #limitReached()} stays true.
 *
 * Not thread-safe.
 */
public final class GroupByResultHolder {

    public static final int REJECTED = -1;

    private final AggregationFunction<Object, Object>[] functions;
    private final int numGroupsLimit;
    private final ObjectIntHashMap<GroupKey> groupIds;

    private GroupKey[] keys;
    private Object[][] states;
    private int numGroups = 0;
    private boolean limitReached = false;
    private boolean drained = false;

    /**
     * @param initialCapacity sizing hint for the number of groups; capped to {@code numGroupsLimit}
     */
    public GroupByResultHolder(AggregationFunction<?, ?>[] functions, int numGroupsLimit, int initialCapacity) {
        if (numGroupsLimit < 1) {
            throw new IllegalArgumentException("numGroupsLimit must be >= 1 but was " + numGroupsLimit);
        }
        this.functions = unchecked(functions);
        this.numGroupsLimit = numGroupsLimit;
        int capacity = Math.max(0, Math.min(initialCapacity, numGroupsLimit));
        this.groupIds = new ObjectIntHashMap<>(capacity);
        this.keys = new GroupKey[capacity];
        this.states = new Object[capacity][];
    }

    @SuppressWarnings("unchecked")
    private static AggregationFunction<Object, Object>[] unchecked(AggregationFunction<?, ?>[] functions) {
        return (AggregationFunction<Object, Object>[]) functions.clone();
    }

    /**
     * Looks up the group of {@code key}, creating it with fresh states if it doesn't exist yet.
     *
     * @return the id of the group, to be used with {@link #states(int)},
     *         or {@link #REJECTED} if the group doesn't exist and the group limit is reached.
     */
    public int getOrCreate(GroupKey key) {
        ensureNotDrained();
        int slot = groupIds.indexOf(key);
        if (groupIds.indexExists(slot)) {
            return groupIds.indexGet(slot);
        }
        if (numGroups >= numGroupsLimit) {
            limitReached = true;
            return REJECTED;
        }
        int groupId = numGroups;
        if (groupId == keys.length) {
            grow();
        }
        Object[] groupStates = new Object[functions.length];
        for (int i = 0; i < functions.length; i++) {
            groupStates[i] = functions[i].newState();
        }
        keys[groupId] = key;
        states[groupId] = groupStates;
        groupIds.indexInsert(slot, key, groupId);
        numGroups++;
        return groupId;
    }

    private void grow() {
        int newCapacity = (int) Math.min((long) numGroupsLimit, Math.max(16L, keys.length * 2L));
        keys = Arrays.copyOf(keys, newCapacity);
        states = Arrays.copyOf(states, newCapacity);
    }

    /**
     * Returns the partial states of a group, one slot per aggregation in declaration order.
     * Callers replace slots with the state returned by iterate or reduce.
     */
    public Object[] states(int groupId) {
        ensureNotDrained();
        return states[groupId];
    }

    public int numGroups() {
        return numGroups;
    }

    public boolean limitReached() {
        return limitReached;
    }

    /**
     * Emits every group once as an array of the key values followed by one value per aggregation.
     * The groups are released while iterating; the holder can't be used afterwards.
     *
     * @param terminate true to emit {@link AggregationFunction#terminatePartial(Object)} of the states,
     *                  false to emit the partial states themselves.
     */
    public Iterator<Object[]> drain(boolean terminate) {
        ensureNotDrained();
        drained = true;
        groupIds.release();
        return new AbstractIterator<>() {

            private int groupId = 0;

            @Override
            protected Object[] computeNext() {
                if (groupId >= numGroups) {
                    keys = null;
                    states = null;
                    return endOfData();
                }
                GroupKey key = keys[groupId];
                Object[] groupStates = states[groupId];
                keys[groupId] = null;
                states[groupId] = null;
                groupId++;

                Object[] cells = new Object[key.size() + functions.length];
                key.copyInto(cells);
                for (int i = 0; i < functions.length; i++) {
                    cells[key.size() + i] = terminate
                        ? functions[i].terminatePartial(groupStates[i])
                        : groupStates[i];
                }
                return cells;
            }
        };
    }

    private void ensureNotDrained() {
        if (drained) {
            throw new IllegalStateException("GroupByResultHolder is already drained");
        }
    }
}

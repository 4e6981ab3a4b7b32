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

import java.util.List;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.quarry.settings.Setting;
import io.quarry.settings.Settings;

/**
 * The options of a group-by aggregation, resolved once per operator from the hints of the plan node.
 */
public final class GroupByOptions {

    private static final Logger LOGGER = LogManager.getLogger(GroupByOptions.class);

    /**
     * Maximum number of distinct groups a single operator instance materializes.
     * Rows of further groups are dropped and the result is flagged as partial.
     */
    public static final Setting<Integer> NUM_GROUPS_LIMIT =
        Setting.intSetting("num_groups_limit", 100_000, 1);

    /**
     * Set if the input of a merge stage is partitioned by the group-by keys, so no two upstream operators
     * emit the same group. Partial rows are then finalized one by one without merging.
     * This is not verified: if the input is not partitioned the results are wrong.
     */
    public static final Setting<Boolean> IS_PARTITIONED_BY_GROUP_BY_KEYS =
        Setting.boolSetting("is_partitioned_by_group_by_keys", false);

    /**
     * Set to skip the aggregation in the leaf stage and ship raw rows to the merge stage.
     */
    public static final Setting<Boolean> IS_SKIP_LEAF_STAGE_GROUP_BY =
        Setting.boolSetting("is_skip_leaf_stage_group_by", false);

    /**
     * Initial capacity of the group hash table. Only a sizing hint.
     */
    public static final Setting<Integer> MAX_INITIAL_RESULT_HOLDER_CAPACITY =
        Setting.intSetting("max_initial_result_holder_capacity", 10_000, 0);

    public static final List<Setting<?>> SETTINGS = List.of(
        NUM_GROUPS_LIMIT,
        IS_PARTITIONED_BY_GROUP_BY_KEYS,
        IS_SKIP_LEAF_STAGE_GROUP_BY,
        MAX_INITIAL_RESULT_HOLDER_CAPACITY
    );

    public static final GroupByOptions DEFAULT = fromSettings(Settings.EMPTY);

    private final int numGroupsLimit;
    private final boolean partitionedByGroupByKeys;
    private final boolean skipLeafStageGroupBy;
    private final int maxInitialResultHolderCapacity;

    public GroupByOptions(int numGroupsLimit,
                          boolean partitionedByGroupByKeys,
                          boolean skipLeafStageGroupBy,
                          int maxInitialResultHolderCapacity) {
        if (numGroupsLimit < 1) {
            throw new IllegalArgumentException("num_groups_limit must be >= 1 but was " + numGroupsLimit);
        }
        if (maxInitialResultHolderCapacity < 0) {
            throw new IllegalArgumentException(
                "max_initial_result_holder_capacity must be >= 0 but was " + maxInitialResultHolderCapacity);
        }
        this.numGroupsLimit = numGroupsLimit;
        this.partitionedByGroupByKeys = partitionedByGroupByKeys;
        this.skipLeafStageGroupBy = skipLeafStageGroupBy;
        this.maxInitialResultHolderCapacity = maxInitialResultHolderCapacity;
    }

    /**
     * Resolves the options from hints. Unknown hints are ignored.
     *
     * @throws IllegalArgumentException if a hint value cannot be parsed or is out of range
     */
    public static GroupByOptions fromSettings(Settings settings) {
        if (LOGGER.isDebugEnabled()) {
            for (String key : settings.keySet()) {
                if (SETTINGS.stream().noneMatch(s -> s.getKey().equals(key))) {
                    LOGGER.debug("Ignoring unknown group by hint [{}]", key);
                }
            }
        }
        return new GroupByOptions(
            NUM_GROUPS_LIMIT.get(settings),
            IS_PARTITIONED_BY_GROUP_BY_KEYS.get(settings),
            IS_SKIP_LEAF_STAGE_GROUP_BY.get(settings),
            MAX_INITIAL_RESULT_HOLDER_CAPACITY.get(settings)
        );
    }

    public int numGroupsLimit() {
        return numGroupsLimit;
    }

    public boolean partitionedByGroupByKeys() {
        return partitionedByGroupByKeys;
    }

    public boolean skipLeafStageGroupBy() {
        return skipLeafStageGroupBy;
    }

    public int maxInitialResultHolderCapacity() {
        return maxInitialResultHolderCapacity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GroupByOptions that = (GroupByOptions) o;
        return numGroupsLimit == that.numGroupsLimit &&
               partitionedByGroupByKeys == that.partitionedByGroupByKeys &&
               skipLeafStageGroupBy == that.skipLeafStageGroupBy &&
               maxInitialResultHolderCapacity == that.maxInitialResultHolderCapacity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(numGroupsLimit, partitionedByGroupByKeys, skipLeafStageGroupBy, maxInitialResultHolderCapacity);
    }

    @Override
    public String toString() {
        return "GroupByOptions{" +
               "numGroupsLimit=" + numGroupsLimit +
               ", partitionedByGroupByKeys=" + partitionedByGroupByKeys +
               ", skipLeafStageGroupBy=" + skipLeafStageGroupBy +
               ", maxInitialResultHolderCapacity=" + maxInitialResultHolderCapacity +
               '}';
    }
}

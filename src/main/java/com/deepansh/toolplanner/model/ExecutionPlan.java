package com.deepansh.toolplanner.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of planning one batch: the ordered groups plus the edges that produced them.
 *
 * Groups run strictly in list order. Calls inside one group may run concurrently;
 * group k+1 must not start before every call of group k has finished.
 */
@Value
@Builder
public class ExecutionPlan {

    List<List<ToolCall>> groups;

    /** call id → ids it depends on, in batch order */
    Map<String, List<String>> dependencies;

    /** True when the sequential fallback was used for part of the batch */
    boolean cycleDetected;

    public int groupCount() {
        return groups.size();
    }

    public int maxParallelism() {
        return groups.stream().mapToInt(List::size).max().orElse(0);
    }
}

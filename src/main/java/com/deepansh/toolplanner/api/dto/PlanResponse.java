package com.deepansh.toolplanner.api.dto;

import com.deepansh.toolplanner.model.DependencyType;
import com.deepansh.toolplanner.model.ExecutionPlan;
import com.deepansh.toolplanner.model.ToolCall;
import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wire form of an {@link ExecutionPlan}: groups as lists of call ids.
 */
@Data
@Builder
public class PlanResponse {

    private List<List<String>> groups;
    private Map<String, List<String>> dependencies;
    private Map<String, Map<String, DependencyType>> dependencyTypes;
    private int groupCount;
    private int maxParallelism;
    private boolean cycleDetected;

    public static PlanResponse from(ExecutionPlan plan) {
        Map<String, Map<String, DependencyType>> types = new LinkedHashMap<>();
        plan.getGroups().stream()
                .flatMap(List::stream)
                .filter(call -> !call.getDependencyTypes().isEmpty())
                .forEach(call -> types.put(call.getId(), new LinkedHashMap<>(call.getDependencyTypes())));

        return PlanResponse.builder()
                .groups(plan.getGroups().stream()
                        .map(group -> group.stream().map(ToolCall::getId).toList())
                        .toList())
                .dependencies(plan.getDependencies())
                .dependencyTypes(types)
                .groupCount(plan.groupCount())
                .maxParallelism(plan.maxParallelism())
                .cycleDetected(plan.isCycleDetected())
                .build();
    }
}

package com.deepansh.toolplanner.scheduling;

import com.deepansh.toolplanner.dependency.DependencyGraphBuilder;
import com.deepansh.toolplanner.model.ExecutionPlan;
import com.deepansh.toolplanner.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a batch of tool calls into ordered groups of concurrently runnable calls.
 *
 * Layered (Kahn-style) topological sort: each round takes every remaining call whose
 * dependencies have all been scheduled in earlier rounds. If a round makes no progress
 * the remainder is cyclic, and it is scheduled one call per group in batch order.
 * Grouping never throws for a cycle.
 *
 * Within a group calls currently keep batch order; callers must not depend on that.
 */
@Slf4j
public class ParallelGrouper {

    private final DependencyGraphBuilder graphBuilder;

    public ParallelGrouper(DependencyGraphBuilder graphBuilder) {
        this.graphBuilder = graphBuilder;
    }

    public List<List<ToolCall>> group(List<ToolCall> calls) {
        return plan(calls).getGroups();
    }

    /**
     * Analyzes the batch (mutating its calls, see {@link DependencyGraphBuilder#analyze})
     * and groups it.
     */
    public ExecutionPlan plan(List<ToolCall> calls) {
        Map<String, List<String>> dependencies = graphBuilder.analyze(calls);

        List<List<ToolCall>> groups = new ArrayList<>();
        List<ToolCall> remaining = new ArrayList<>(calls);
        Set<String> completed = new HashSet<>();
        boolean cycleDetected = false;

        // Every productive round schedules at least one call, so this bound is never hit early
        for (int round = 0; round < calls.size() && !remaining.isEmpty(); round++) {
            List<ToolCall> ready = new ArrayList<>();
            for (ToolCall call : remaining) {
                if (completed.containsAll(call.getDependsOn())) {
                    ready.add(call);
                }
            }

            if (ready.isEmpty()) {
                cycleDetected = true;
                break;
            }

            groups.add(ready);
            Set<ToolCall> scheduled = Collections.newSetFromMap(new IdentityHashMap<>());
            scheduled.addAll(ready);
            remaining.removeIf(scheduled::contains);
            ready.forEach(call -> completed.add(call.getId()));
        }

        if (!remaining.isEmpty()) {
            cycleDetected = true;
            log.error("Dependency cycle detected among tools {}, scheduling {} calls sequentially",
                    remaining.stream().map(ToolCall::getToolName).toList(), remaining.size());
            remaining.forEach(call -> groups.add(List.of(call)));
        }

        ExecutionPlan plan = ExecutionPlan.builder()
                .groups(groups)
                .dependencies(dependencies)
                .cycleDetected(cycleDetected)
                .build();

        log.info("Planned {} tool calls into {} groups [maxParallelism={}, cycle={}]",
                calls.size(), plan.groupCount(), plan.maxParallelism(), cycleDetected);
        return plan;
    }

    /**
     * Cheap yes/no for two specific calls without running the batch algorithm.
     */
    public boolean canParallelize(ToolCall earlier, ToolCall later) {
        return graphBuilder.getClassifier().canParallelize(earlier, later);
    }
}

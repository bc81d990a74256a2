package com.deepansh.toolplanner.service;

import com.deepansh.toolplanner.exception.InvalidBatchException;
import com.deepansh.toolplanner.llm.OpenAiToolCallParser;
import com.deepansh.toolplanner.model.ExecutionPlan;
import com.deepansh.toolplanner.model.ToolCall;
import com.deepansh.toolplanner.scheduling.ParallelGrouper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point for callers outside the planner core.
 *
 * The grouper assumes a well-formed batch. This service is the caller that
 * guarantees it: every call has an id and a tool name, and ids are unique.
 */
@Service
@Slf4j
public class PlanningService {

    private final ParallelGrouper grouper;
    private final OpenAiToolCallParser openAiParser;

    public PlanningService(ParallelGrouper grouper, OpenAiToolCallParser openAiParser) {
        this.grouper = grouper;
        this.openAiParser = openAiParser;
    }

    public ExecutionPlan plan(List<ToolCall> calls) {
        validate(calls);
        return grouper.plan(calls);
    }

    public ExecutionPlan planAssistantMessage(Map<String, Object> assistantMessage) {
        return plan(openAiParser.parse(assistantMessage));
    }

    public boolean canParallelize(ToolCall earlier, ToolCall later) {
        return grouper.canParallelize(earlier, later);
    }

    private void validate(List<ToolCall> calls) {
        List<String> problems = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < calls.size(); i++) {
            ToolCall call = calls.get(i);
            if (call.getId() == null || call.getId().isBlank()) {
                problems.add("call " + i + " has no id");
            } else if (!seen.add(call.getId())) {
                problems.add("duplicate id '" + call.getId() + "'");
            }
            if (call.getToolName() == null || call.getToolName().isBlank()) {
                problems.add("call " + i + " has no tool name");
            }
            if (!call.getDependsOn().isEmpty()) {
                problems.add("call '" + call.getId() + "' already carries dependencies from a previous run");
            }
        }

        if (!problems.isEmpty()) {
            log.warn("Rejected tool-call batch of {} calls: {}", calls.size(), problems);
            throw new InvalidBatchException(problems);
        }
    }
}

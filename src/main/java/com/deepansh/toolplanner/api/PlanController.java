package com.deepansh.toolplanner.api;

import com.deepansh.toolplanner.api.dto.PlanRequest;
import com.deepansh.toolplanner.api.dto.PlanResponse;
import com.deepansh.toolplanner.api.dto.ToolCallRequest;
import com.deepansh.toolplanner.model.ToolCall;
import com.deepansh.toolplanner.service.PlanningService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Planning endpoints.
 *
 * POST /api/v1/plan          : batch of {id, toolName, arguments}
 * POST /api/v1/plan/openai   : raw OpenAI assistant message with tool_calls
 * GET  /api/v1/plan/health
 */
@RestController
@RequestMapping("/api/v1/plan")
@RequiredArgsConstructor
@Slf4j
public class PlanController {

    private final PlanningService planningService;

    @PostMapping
    public ResponseEntity<PlanResponse> plan(@Valid @RequestBody PlanRequest request) {
        List<ToolCall> calls = request.getToolCalls().stream()
                .map(ToolCallRequest::toToolCall)
                .toList();

        log.info("Plan request [calls={}]", calls.size());
        return ResponseEntity.ok(PlanResponse.from(planningService.plan(calls)));
    }

    @PostMapping("/openai")
    public ResponseEntity<PlanResponse> planOpenAi(@RequestBody Map<String, Object> assistantMessage) {
        log.info("Plan request from OpenAI assistant message");
        return ResponseEntity.ok(PlanResponse.from(planningService.planAssistantMessage(assistantMessage)));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}

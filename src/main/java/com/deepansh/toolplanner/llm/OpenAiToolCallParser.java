package com.deepansh.toolplanner.llm;

import com.deepansh.toolplanner.exception.PlanningException;
import com.deepansh.toolplanner.model.ToolCall;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a tool-call batch from an OpenAI chat-completions assistant message.
 *
 * Expected shape:
 * { "role": "assistant", "tool_calls": [ { "id": "call_1", "type": "function",
 *   "function": { "name": "read_file", "arguments": "{\"path\":\"/tmp/a.txt\"}" } } ] }
 *
 * OpenAI sends {@code arguments} as a JSON string; an already-decoded object is accepted too.
 */
@Component
@Slf4j
public class OpenAiToolCallParser {

    private static final TypeReference<LinkedHashMap<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public OpenAiToolCallParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the calls in message order; empty if the message requests no tools
     */
    public List<ToolCall> parse(Map<String, Object> assistantMessage) {
        Object toolCalls = assistantMessage.get("tool_calls");
        if (toolCalls == null) {
            return List.of();
        }
        if (!(toolCalls instanceof List<?> entries)) {
            throw new PlanningException("'tool_calls' must be an array");
        }

        List<ToolCall> batch = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            batch.add(parseEntry(entries.get(i), i));
        }
        log.debug("Parsed {} tool calls from assistant message", batch.size());
        return batch;
    }

    private ToolCall parseEntry(Object entry, int index) {
        if (!(entry instanceof Map<?, ?> toolCall)) {
            throw new PlanningException("tool_calls[" + index + "] must be an object");
        }
        if (!(toolCall.get("function") instanceof Map<?, ?> function)) {
            throw new PlanningException("tool_calls[" + index + "].function is missing");
        }

        Object id = toolCall.get("id");
        Object name = function.get("name");
        return ToolCall.builder()
                .id(id != null ? id.toString() : null)
                .toolName(name != null ? name.toString() : null)
                .arguments(parseArguments(function.get("arguments"), index))
                .build();
    }

    private Map<String, Object> parseArguments(Object raw, int index) {
        if (raw == null) {
            return new LinkedHashMap<>();
        }
        if (raw instanceof Map<?, ?> decoded) {
            Map<String, Object> arguments = new LinkedHashMap<>();
            decoded.forEach((k, v) -> arguments.put(String.valueOf(k), v));
            return arguments;
        }

        String json = raw.toString();
        if (json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, ARGUMENTS_TYPE);
        } catch (JsonProcessingException e) {
            throw new PlanningException("Failed to parse arguments of tool_calls[" + index + "]", e);
        }
    }
}

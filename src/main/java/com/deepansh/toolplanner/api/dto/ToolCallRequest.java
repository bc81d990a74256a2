package com.deepansh.toolplanner.api.dto;

import com.deepansh.toolplanner.model.ToolCall;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCallRequest {

    @NotBlank(message = "id must not be blank")
    private String id;

    @NotBlank(message = "toolName must not be blank")
    private String toolName;

    private Map<String, Object> arguments;

    public ToolCall toToolCall() {
        return ToolCall.builder()
                .id(id)
                .toolName(toolName)
                .arguments(arguments != null ? new LinkedHashMap<>(arguments) : new LinkedHashMap<>())
                .build();
    }
}

package com.deepansh.toolplanner.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlanRequest {

    /** The batch in the order the LLM emitted it; order matters for edge detection */
    @NotNull(message = "toolCalls must not be null")
    private List<@NotNull(message = "toolCalls must not contain null entries") @Valid ToolCallRequest> toolCalls;
}

package com.deepansh.toolplanner.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One pending tool invocation inside a batch.
 *
 * The dependency fields start empty and are filled in place by
 * {@link com.deepansh.toolplanner.dependency.DependencyGraphBuilder}.
 * They can only grow through {@link #addDependency(String, DependencyType)},
 * which keeps {@code dependencyTypes} keyed by exactly the ids in {@code dependsOn}.
 * The id, tool name and arguments are fixed once the call is built.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ToolCall {

    /** ID assigned by the LLM layer, stable for the lifetime of the batch */
    private final String id;

    private final String toolName;

    private final Map<String, Object> arguments;

    @Getter(AccessLevel.NONE)
    private final List<String> dependsOn = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final Map<String, DependencyType> dependencyTypes = new LinkedHashMap<>();

    @Builder
    public ToolCall(String id, String toolName, Map<String, Object> arguments) {
        this.id = id;
        this.toolName = toolName;
        this.arguments = arguments;
    }

    /**
     * Records that this call must run after {@code callId}.
     *
     * @return false if the edge was already present (the original type is kept)
     */
    public boolean addDependency(String callId, DependencyType type) {
        if (dependencyTypes.containsKey(callId)) {
            return false;
        }
        dependsOn.add(callId);
        dependencyTypes.put(callId, type);
        return true;
    }

    public List<String> getDependsOn() {
        return Collections.unmodifiableList(dependsOn);
    }

    public Map<String, DependencyType> getDependencyTypes() {
        return Collections.unmodifiableMap(dependencyTypes);
    }

    /** Never null, so rules don't have to guard every lookup */
    public Map<String, Object> getArguments() {
        return arguments != null ? arguments : Map.of();
    }
}

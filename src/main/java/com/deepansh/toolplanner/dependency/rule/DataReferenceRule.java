package com.deepansh.toolplanner.dependency.rule;

import com.deepansh.toolplanner.model.DependencyType;
import com.deepansh.toolplanner.model.ToolCall;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Producer → consumer link: the later call's arguments mention the earlier call's id.
 * Nested maps and lists are searched too.
 */
public class DataReferenceRule implements DependencyRule {

    @Override
    public Optional<DependencyType> evaluate(ToolCall earlier, ToolCall later) {
        String producerId = earlier.getId();
        if (producerId == null || producerId.isBlank()) {
            return Optional.empty();
        }
        for (Object value : later.getArguments().values()) {
            if (mentions(value, producerId)) {
                return Optional.of(DependencyType.DATA);
            }
        }
        return Optional.empty();
    }

    static boolean mentions(Object value, String needle) {
        if (value == null) {
            return false;
        }
        if (value instanceof Map<?, ?> map) {
            return map.values().stream().anyMatch(v -> mentions(v, needle));
        }
        if (value instanceof Collection<?> items) {
            return items.stream().anyMatch(v -> mentions(v, needle));
        }
        return value.toString().contains(needle);
    }
}

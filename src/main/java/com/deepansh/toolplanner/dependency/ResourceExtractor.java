package com.deepansh.toolplanner.dependency;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Pulls the resource a tool call touches (usually a path) out of its arguments.
 *
 * Implementations must not throw for missing or odd-shaped arguments; return
 * {@link Optional#empty()} and the call is treated as having no resource.
 */
@FunctionalInterface
public interface ResourceExtractor {

    Optional<String> extract(Map<String, Object> arguments);

    /**
     * Extractor that returns the first of {@code keys} holding a non-blank scalar value.
     */
    static ResourceExtractor argument(String... keys) {
        return arguments -> {
            for (String key : keys) {
                Object value = arguments.get(key);
                if (value == null || value instanceof Map || value instanceof Collection) {
                    continue;
                }
                String text = value.toString().trim();
                if (!text.isEmpty()) {
                    return Optional.of(text);
                }
            }
            return Optional.empty();
        };
    }
}

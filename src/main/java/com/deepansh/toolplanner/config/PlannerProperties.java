package com.deepansh.toolplanner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strongly-typed planner configuration, bound from application.yml under "planner".
 * Everything here extends the built-in tables; nothing can remove a built-in entry.
 */
@ConfigurationProperties(prefix = "planner")
@Data
public class PlannerProperties {

    /**
     * Serialize writes against calls whose resource cannot be extracted.
     * Off by default: unknown tools run in parallel with writes.
     */
    private boolean conservativeUnresolvedResources = false;

    private Tools tools = new Tools();

    /** Extra words that mark a shell command as state-changing */
    private List<String> stateVerbs = new ArrayList<>();

    /** tool name → argument key holding its resource; use "[tool_name]" keys in YAML */
    private Map<String, String> extractors = new LinkedHashMap<>();

    @Data
    public static class Tools {
        private List<String> write = new ArrayList<>();
        private List<String> read = new ArrayList<>();
        private List<String> state = new ArrayList<>();
    }
}

package com.deepansh.toolplanner.dependency.rule;

import com.deepansh.toolplanner.dependency.ResourceExtractorRegistry;
import com.deepansh.toolplanner.dependency.ToolCategories;
import com.deepansh.toolplanner.model.DependencyType;
import com.deepansh.toolplanner.model.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class UnresolvedResourceRuleTest {

    private final UnresolvedResourceRule rule =
            new UnresolvedResourceRule(new ResourceExtractorRegistry(), ToolCategories.defaults());

    @Test
    void writeThenUnresolvable_isResource() {
        ToolCall write = call("a", "write_file", Map.of("path", "/tmp/a.txt"));
        ToolCall unknown = call("b", "upload_blob", Map.of("file", "/tmp/a.txt"));
        assertThat(rule.evaluate(write, unknown)).contains(DependencyType.RESOURCE);
    }

    @Test
    void unresolvableThenWrite_isResource() {
        ToolCall unknown = call("a", "upload_blob", Map.of("file", "/tmp/a.txt"));
        ToolCall write = call("b", "write_file", Map.of("path", "/tmp/b.txt"));
        assertThat(rule.evaluate(unknown, write)).contains(DependencyType.RESOURCE);
    }

    @Test
    void bothResolved_leavesDecisionToOverlapRules() {
        ToolCall write = call("a", "write_file", Map.of("path", "/tmp/a.txt"));
        ToolCall read = call("b", "read_file", Map.of("path", "/tmp/b.txt"));
        assertThat(rule.evaluate(write, read)).isEmpty();
    }

    @Test
    void noWriteInvolved_isEmpty() {
        ToolCall unknown = call("a", "upload_blob", Map.of());
        ToolCall read = call("b", "read_file", Map.of("path", "/tmp/b.txt"));
        assertThat(rule.evaluate(unknown, read)).isEmpty();
    }

    private static ToolCall call(String id, String toolName, Map<String, Object> args) {
        return ToolCall.builder().id(id).toolName(toolName).arguments(args).build();
    }
}

package com.deepansh.toolplanner.dependency.rule;

import com.deepansh.toolplanner.dependency.ResourceExtractorRegistry;
import com.deepansh.toolplanner.dependency.ToolCategories;
import com.deepansh.toolplanner.model.DependencyType;
import com.deepansh.toolplanner.model.ToolCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StateChangeRuleTest {

    private StateChangeRule rule;

    @BeforeEach
    void setUp() {
        rule = new StateChangeRule(new ResourceExtractorRegistry(), ToolCategories.defaults());
    }

    @Test
    void nonStateTool_neverFires() {
        ToolCall read = call("a", "read_file", Map.of("path", "/tmp/x"));
        ToolCall write = call("b", "write_file", Map.of("path", "/tmp/x/y"));
        assertThat(rule.evaluate(read, write)).isEmpty();
    }

    @Test
    void createDirectory_thenWriteInside_isOrder() {
        ToolCall mkdir = call("a", "create_directory", Map.of("path", "/tmp/x"));
        ToolCall write = call("b", "write_file", Map.of("path", "/tmp/x/out.txt"));
        assertThat(rule.evaluate(mkdir, write)).contains(DependencyType.ORDER);
    }

    @Test
    void createDirectory_thenShellMentioningIt_isOrder() {
        ToolCall mkdir = call("a", "create_directory", Map.of("path", "/tmp/build"));
        ToolCall shell = call("b", "execute_command", Map.of("command", "ls /tmp/build"));
        assertThat(rule.evaluate(mkdir, shell)).contains(DependencyType.ORDER);
    }

    @Test
    void createDirectory_thenUnrelatedWrite_isNotOrder() {
        ToolCall mkdir = call("a", "create_directory", Map.of("path", "/tmp/x"));
        ToolCall write = call("b", "write_file", Map.of("path", "/var/log/out.txt"));
        assertThat(rule.evaluate(mkdir, write)).isEmpty();
    }

    @Test
    void createDirectoryWithoutPath_isNotOrder() {
        ToolCall mkdir = call("a", "create_directory", Map.of());
        ToolCall write = call("b", "write_file", Map.of("path", "/tmp/x/out.txt"));
        assertThat(rule.evaluate(mkdir, write)).isEmpty();
    }

    @Test
    void shellWithMutatingVerb_ordersEveryLaterCall() {
        ToolCall shell = call("a", "execute_command", Map.of("command", "git checkout main"));
        ToolCall read = call("b", "read_file", Map.of("path", "/repo/README.md"));
        assertThat(rule.evaluate(shell, read)).contains(DependencyType.ORDER);
    }

    @Test
    void shellWithCmdArgument_isChecked() {
        ToolCall shell = call("a", "run_shell", Map.of("cmd", "npm install"));
        ToolCall other = call("b", "web_search", Map.of("query", "x"));
        assertThat(rule.evaluate(shell, other)).contains(DependencyType.ORDER);
    }

    @Test
    void shellWithArgvListCommand_isChecked() {
        ToolCall shell = call("a", "execute_command", Map.of("command", List.of("git", "commit", "-m", "wip")));
        ToolCall read = call("b", "read_file", Map.of("path", "/repo/README.md"));
        assertThat(rule.evaluate(shell, read)).contains(DependencyType.ORDER);
    }

    @Test
    void shellWithReadOnlyArgvList_isNotOrder() {
        ToolCall shell = call("a", "execute_command", Map.of("command", List.of("ls", "-la", "/repo")));
        ToolCall read = call("b", "read_file", Map.of("path", "/repo/README.md"));
        assertThat(rule.evaluate(shell, read)).isEmpty();
    }

    @Test
    void readOnlyShellCommand_isNotOrder() {
        ToolCall shell = call("a", "execute_command", Map.of("command", "ls -la /repo"));
        ToolCall read = call("b", "read_file", Map.of("path", "/repo/README.md"));
        assertThat(rule.evaluate(shell, read)).isEmpty();
    }

    @Test
    void serviceManagement_thenStateTool_isOrder() {
        ToolCall restart = call("a", "restart_service", Map.of("service", "nginx"));
        ToolCall shell = call("b", "execute_command", Map.of("command", "curl localhost"));
        assertThat(rule.evaluate(restart, shell)).contains(DependencyType.ORDER);
    }

    @Test
    void serviceManagement_thenCallMentioningService_isOrder() {
        ToolCall restart = call("a", "manage_service", Map.of("service", "redis", "action", "restart"));
        ToolCall read = call("b", "read_file", Map.of("path", "/var/log/redis/redis.log"));
        assertThat(rule.evaluate(restart, read)).contains(DependencyType.ORDER);
    }

    @Test
    void serviceManagement_thenUnrelatedRead_isNotOrder() {
        ToolCall restart = call("a", "manage_service", Map.of("service", "redis", "action", "restart"));
        ToolCall read = call("b", "read_file", Map.of("path", "/tmp/a.txt"));
        assertThat(rule.evaluate(restart, read)).isEmpty();
    }

    @Test
    void configuredStateTool_ordersEveryLaterCall() {
        StateChangeRule withDeploy = new StateChangeRule(new ResourceExtractorRegistry(),
                new ToolCategories(List.of(), List.of(), List.of("deploy"), List.of()));
        ToolCall deploy = call("a", "deploy", Map.of("env", "staging"));
        ToolCall check = call("b", "http_get", Map.of("url", "https://staging.example.com/health"));

        assertThat(withDeploy.evaluate(deploy, check)).contains(DependencyType.ORDER);
    }

    private static ToolCall call(String id, String toolName, Map<String, Object> args) {
        return ToolCall.builder().id(id).toolName(toolName).arguments(args).build();
    }
}

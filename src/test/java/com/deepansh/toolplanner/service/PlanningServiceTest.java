package com.deepansh.toolplanner.service;

import com.deepansh.toolplanner.dependency.DependencyClassifier;
import com.deepansh.toolplanner.dependency.DependencyGraphBuilder;
import com.deepansh.toolplanner.dependency.ResourceExtractorRegistry;
import com.deepansh.toolplanner.dependency.ToolCategories;
import com.deepansh.toolplanner.exception.InvalidBatchException;
import com.deepansh.toolplanner.llm.OpenAiToolCallParser;
import com.deepansh.toolplanner.model.DependencyType;
import com.deepansh.toolplanner.model.ExecutionPlan;
import com.deepansh.toolplanner.model.ToolCall;
import com.deepansh.toolplanner.scheduling.ParallelGrouper;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class PlanningServiceTest {

    private ParallelGrouper grouper;
    private PlanningService service;

    @BeforeEach
    void setUp() {
        grouper = spy(new ParallelGrouper(new DependencyGraphBuilder(DependencyClassifier.withDefaultRules(
                new ResourceExtractorRegistry(), ToolCategories.defaults()))));
        service = new PlanningService(grouper, new OpenAiToolCallParser(new ObjectMapper()));
    }

    @Test
    void plan_validBatch_delegatesToGrouper() {
        List<ToolCall> batch = List.of(
                call("r1", "read_file", Map.of("path", "/tmp/a.txt")),
                call("e1", "edit_file", Map.of("path", "/tmp/a.txt")));

        ExecutionPlan plan = service.plan(batch);

        assertThat(plan.groupCount()).isEqualTo(2);
        verify(grouper).plan(batch);
    }

    @Test
    void plan_duplicateIds_rejectedBeforePlanning() {
        List<ToolCall> batch = List.of(
                call("c1", "read_file", Map.of("path", "/a")),
                call("c1", "read_file", Map.of("path", "/b")));

        assertThatThrownBy(() -> service.plan(batch))
                .isInstanceOf(InvalidBatchException.class)
                .hasMessageContaining("duplicate id 'c1'");
        verify(grouper, never()).plan(any());
    }

    @Test
    void plan_missingIdAndToolName_reportsAllProblems() {
        List<ToolCall> batch = List.of(ToolCall.builder().arguments(Map.of()).build());

        assertThatThrownBy(() -> service.plan(batch))
                .isInstanceOf(InvalidBatchException.class)
                .satisfies(e -> assertThat(((InvalidBatchException) e).getProblems())
                        .containsExactly("call 0 has no id", "call 0 has no tool name"));
    }

    @Test
    void plan_staleDependencies_rejected() {
        ToolCall stale = call("c2", "read_file", Map.of("path", "/a"));
        stale.addDependency("c1", DependencyType.RESOURCE);

        assertThatThrownBy(() -> service.plan(List.of(call("c1", "write_file", Map.of("path", "/a")), stale)))
                .isInstanceOf(InvalidBatchException.class)
                .hasMessageContaining("previous run");
    }

    @Test
    void planAssistantMessage_parsesAndPlans() {
        Map<String, Object> message = Map.of("tool_calls", List.of(
                Map.of("id", "call_1", "function", Map.of("name", "create_directory", "arguments", "{\"path\":\"/tmp/x\"}")),
                Map.of("id", "call_2", "function", Map.of("name", "write_file", "arguments", "{\"path\":\"/tmp/x/out.txt\"}"))));

        ExecutionPlan plan = service.planAssistantMessage(message);

        assertThat(plan.getGroups()).hasSize(2);
        assertThat(plan.getDependencies()).containsEntry("call_2", List.of("call_1"));
    }

    @Test
    void canParallelize_delegates() {
        ParallelGrouper mockGrouper = mock(ParallelGrouper.class);
        PlanningService withMock = new PlanningService(mockGrouper, new OpenAiToolCallParser(new ObjectMapper()));
        ToolCall a = call("a1", "read_file", Map.of("path", "/a"));
        ToolCall b = call("b1", "read_file", Map.of("path", "/b"));

        withMock.canParallelize(a, b);

        verify(mockGrouper).canParallelize(a, b);
    }

    private static ToolCall call(String id, String toolName, Map<String, Object> args) {
        return ToolCall.builder().id(id).toolName(toolName).arguments(args).build();
    }
}

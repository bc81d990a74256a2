package com.deepansh.toolplanner.dependency.rule;

import com.deepansh.toolplanner.dependency.ResourceExtractor;
import com.deepansh.toolplanner.dependency.ResourceExtractorRegistry;
import com.deepansh.toolplanner.dependency.ResourcePaths;
import com.deepansh.toolplanner.dependency.ToolCategories;
import com.deepansh.toolplanner.model.DependencyType;
import com.deepansh.toolplanner.model.ToolCall;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The earlier call changes ambient state (filesystem layout, services, repo or
 * package state) that the later call may implicitly rely on.
 *
 * Heuristics per kind of state tool:
 * - create_directory: the later call touches or mentions something inside the new directory
 * - shell: the command contains a state-mutating verb (mkdir, rm, git, ...); every later call waits
 * - service management: the later call is itself a state tool or mentions the service
 * - any other configured state tool: every later call waits
 */
public class StateChangeRule implements DependencyRule {

    private static final List<String> COMMAND_KEYS = List.of("command", "cmd", "script");
    private static final ResourceExtractor SERVICE = ResourceExtractor.argument("service", "name");

    private final ResourceExtractorRegistry extractors;
    private final ToolCategories categories;

    public StateChangeRule(ResourceExtractorRegistry extractors, ToolCategories categories) {
        this.extractors = extractors;
        this.categories = categories;
    }

    @Override
    public Optional<DependencyType> evaluate(ToolCall earlier, ToolCall later) {
        String toolName = earlier.getToolName();
        if (!categories.isState(toolName)) {
            return Optional.empty();
        }

        boolean dependent;
        if (categories.isDirectoryCreation(toolName)) {
            dependent = writesIntoCreatedDirectory(earlier, later);
        } else if (categories.isShell(toolName)) {
            dependent = commandText(earlier.getArguments())
                    .map(categories::mutatesState)
                    .orElse(false);
        } else if (categories.isServiceManagement(toolName)) {
            dependent = categories.isState(later.getToolName()) || mentionsService(earlier, later);
        } else {
            dependent = true;
        }
        return dependent ? Optional.of(DependencyType.ORDER) : Optional.empty();
    }

    private boolean writesIntoCreatedDirectory(ToolCall mkdir, ToolCall later) {
        Optional<String> directory = extractors.extract(mkdir);
        if (directory.isEmpty()) {
            return false;
        }
        Optional<String> target = extractors.extract(later);
        if (target.isPresent() && ResourcePaths.isWithin(target.get(), directory.get())) {
            return true;
        }
        return later.getArguments().values().stream()
                .anyMatch(v -> DataReferenceRule.mentions(v, directory.get()));
    }

    private boolean mentionsService(ToolCall serviceCall, ToolCall later) {
        return SERVICE.extract(serviceCall.getArguments())
                .map(service -> later.getArguments().values().stream()
                        .anyMatch(v -> DataReferenceRule.mentions(v, service)))
                .orElse(false);
    }

    /** The command as one string; an argv-style list is joined with spaces */
    static Optional<String> commandText(Map<String, Object> arguments) {
        for (String key : COMMAND_KEYS) {
            Object value = arguments.get(key);
            if (value instanceof Collection<?> parts) {
                String joined = parts.stream()
                        .filter(Objects::nonNull)
                        .map(Object::toString)
                        .collect(Collectors.joining(" "))
                        .trim();
                if (!joined.isEmpty()) {
                    return Optional.of(joined);
                }
            } else if (value != null && !(value instanceof Map)) {
                String text = value.toString().trim();
                if (!text.isEmpty()) {
                    return Optional.of(text);
                }
            }
        }
        return Optional.empty();
    }
}

package com.deepansh.toolplanner.dependency;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Read / write / state classification of tool names.
 *
 * The built-in sets are fixed; configuration can add names but never remove them.
 * A tool can be in none of the sets, in which case only the DATA rule applies to it.
 */
public class ToolCategories {

    static final Set<String> BUILT_IN_WRITE_TOOLS = Set.of(
            "write_file", "edit_file", "append_file", "create_file", "delete_file",
            "move_file", "rename_file", "kv_set", "kv_delete");

    static final Set<String> BUILT_IN_READ_TOOLS = Set.of(
            "read_file", "read_text_file", "read_media_file",
            "get_file_info", "list_directory", "list_directory_with_sizes", "directory_tree",
            "grep", "search_files", "kv_get");

    static final Set<String> SHELL_TOOLS = Set.of("execute_command", "run_shell", "shell");

    static final Set<String> SERVICE_TOOLS = Set.of(
            "manage_service", "restart_service", "start_service", "stop_service");

    static final String DIRECTORY_CREATION_TOOL = "create_directory";

    static final List<String> BUILT_IN_STATE_VERBS = List.of(
            "mkdir", "rm", "mv", "cp", "touch", "git", "npm", "pip");

    private final Set<String> writeTools;
    private final Set<String> readTools;
    private final Set<String> stateTools;
    private final Set<String> stateVerbs;
    private final Pattern stateVerbPattern;

    public ToolCategories(Collection<String> extraWriteTools,
                          Collection<String> extraReadTools,
                          Collection<String> extraStateTools,
                          Collection<String> extraStateVerbs) {
        this.writeTools = union(BUILT_IN_WRITE_TOOLS, extraWriteTools);
        this.readTools = union(BUILT_IN_READ_TOOLS, extraReadTools);

        Set<String> state = new LinkedHashSet<>(SHELL_TOOLS);
        state.addAll(SERVICE_TOOLS);
        state.add(DIRECTORY_CREATION_TOOL);
        this.stateTools = union(state, extraStateTools);

        this.stateVerbs = union(BUILT_IN_STATE_VERBS, extraStateVerbs);
        this.stateVerbPattern = buildVerbPattern(this.stateVerbs);
    }

    public static ToolCategories defaults() {
        return new ToolCategories(List.of(), List.of(), List.of(), List.of());
    }

    public boolean isWrite(String toolName) {
        return toolName != null && writeTools.contains(toolName);
    }

    public boolean isRead(String toolName) {
        return toolName != null && readTools.contains(toolName);
    }

    public boolean isState(String toolName) {
        return toolName != null && stateTools.contains(toolName);
    }

    public boolean isShell(String toolName) {
        return SHELL_TOOLS.contains(toolName);
    }

    public boolean isServiceManagement(String toolName) {
        return SERVICE_TOOLS.contains(toolName);
    }

    public boolean isDirectoryCreation(String toolName) {
        return DIRECTORY_CREATION_TOOL.equals(toolName);
    }

    /**
     * True if {@code command} contains one of the state-mutating verbs as a
     * standalone word ("git status" matches, "digit" does not).
     */
    public boolean mutatesState(String command) {
        return command != null && stateVerbPattern.matcher(command).find();
    }

    public Set<String> getWriteTools() {
        return writeTools;
    }

    public Set<String> getReadTools() {
        return readTools;
    }

    public Set<String> getStateTools() {
        return stateTools;
    }

    public Set<String> getStateVerbs() {
        return stateVerbs;
    }

    private static Set<String> union(Collection<String> builtIn, Collection<String> extra) {
        Set<String> result = new LinkedHashSet<>(builtIn);
        if (extra != null) {
            extra.stream()
                    .map(String::trim)
                    .filter(s -> !s.isBlank())
                    .forEach(result::add);
        }
        return Collections.unmodifiableSet(result);
    }

    private static Pattern buildVerbPattern(Set<String> verbs) {
        String alternation = verbs.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("(?<![\\w.-])(?:" + alternation + ")(?![\\w.-])");
    }
}

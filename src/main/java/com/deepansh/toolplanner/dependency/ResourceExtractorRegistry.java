package com.deepansh.toolplanner.dependency;

import com.deepansh.toolplanner.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Map.entry;

/**
 * Two-tier lookup from tool name to {@link ResourceExtractor}.
 *
 * Extractors registered on this instance win over the built-in table. Overrides
 * live on the instance, so two planners with different registrations never see
 * each other's entries.
 *
 * A tool with no extractor (or whose extractor finds nothing) has no resource
 * and can never produce a RESOURCE dependency.
 */
@Slf4j
public class ResourceExtractorRegistry {

    private static final ResourceExtractor FILE_PATH =
            ResourceExtractor.argument("path", "file_path", "filename");
    private static final ResourceExtractor MOVE_SOURCE =
            ResourceExtractor.argument("source", "path");
    private static final ResourceExtractor DIRECTORY =
            ResourceExtractor.argument("path", "directory");
    private static final ResourceExtractor KEY =
            ResourceExtractor.argument("key");

    static final Map<String, ResourceExtractor> BUILT_IN = Map.ofEntries(
            entry("read_file", FILE_PATH),
            entry("read_text_file", FILE_PATH),
            entry("read_media_file", FILE_PATH),
            entry("write_file", FILE_PATH),
            entry("edit_file", FILE_PATH),
            entry("append_file", FILE_PATH),
            entry("create_file", FILE_PATH),
            entry("delete_file", FILE_PATH),
            entry("get_file_info", FILE_PATH),
            entry("move_file", MOVE_SOURCE),
            entry("rename_file", MOVE_SOURCE),
            entry("list_directory", DIRECTORY),
            entry("list_directory_with_sizes", DIRECTORY),
            entry("directory_tree", DIRECTORY),
            entry("create_directory", DIRECTORY),
            entry("grep", DIRECTORY),
            entry("search_files", DIRECTORY),
            entry("kv_get", KEY),
            entry("kv_set", KEY),
            entry("kv_delete", KEY)
    );

    private final Map<String, ResourceExtractor> overrides = new ConcurrentHashMap<>();

    /**
     * Installs an extractor for {@code toolName}, replacing any earlier registration
     * or built-in entry for that name.
     */
    public void register(String toolName, ResourceExtractor extractor) {
        ResourceExtractor previous = overrides.put(toolName, extractor);
        if (previous != null || BUILT_IN.containsKey(toolName)) {
            log.debug("Overriding resource extractor for tool [{}]", toolName);
        } else {
            log.debug("Registered resource extractor for tool [{}]", toolName);
        }
    }

    public boolean hasExtractor(String toolName) {
        return overrides.containsKey(toolName) || BUILT_IN.containsKey(toolName);
    }

    /**
     * Resolves the resource a call touches. Empty when the tool is unknown or
     * the arguments carry nothing usable.
     */
    public Optional<String> extract(ToolCall call) {
        String toolName = call.getToolName();
        if (toolName == null) {
            return Optional.empty();
        }
        ResourceExtractor extractor = overrides.getOrDefault(toolName, BUILT_IN.get(toolName));
        if (extractor == null) {
            return Optional.empty();
        }

        Optional<String> resource;
        try {
            resource = extractor.extract(call.getArguments());
        } catch (RuntimeException e) {
            // A broken caller-supplied extractor must not take the whole batch down
            log.warn("Resource extractor for tool [{}] failed on call [{}], treating as no resource",
                    toolName, call.getId(), e);
            return Optional.empty();
        }
        return resource == null ? Optional.empty() : resource.filter(r -> !r.isBlank());
    }
}

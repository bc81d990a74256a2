package com.deepansh.toolplanner.dependency.rule;

import com.deepansh.toolplanner.dependency.ResourceExtractorRegistry;
import com.deepansh.toolplanner.dependency.ResourcePaths;
import com.deepansh.toolplanner.dependency.ToolCategories;
import com.deepansh.toolplanner.model.DependencyType;
import com.deepansh.toolplanner.model.ToolCall;

import java.util.Optional;

/**
 * A write must not start while an earlier read of the same resource may still be running.
 */
public class ReadBeforeWriteRule implements DependencyRule {

    private final ResourceExtractorRegistry extractors;
    private final ToolCategories categories;

    public ReadBeforeWriteRule(ResourceExtractorRegistry extractors, ToolCategories categories) {
        this.extractors = extractors;
        this.categories = categories;
    }

    @Override
    public Optional<DependencyType> evaluate(ToolCall earlier, ToolCall later) {
        if (!categories.isRead(earlier.getToolName()) || !categories.isWrite(later.getToolName())) {
            return Optional.empty();
        }
        Optional<String> read = extractors.extract(earlier);
        Optional<String> written = extractors.extract(later);
        if (read.isPresent() && written.isPresent()
                && ResourcePaths.overlaps(read.get(), written.get())) {
            return Optional.of(DependencyType.RESOURCE);
        }
        return Optional.empty();
    }
}

package com.deepansh.toolplanner.dependency.rule;

import com.deepansh.toolplanner.dependency.ResourceExtractorRegistry;
import com.deepansh.toolplanner.dependency.ResourcePaths;
import com.deepansh.toolplanner.dependency.ToolCategories;
import com.deepansh.toolplanner.model.DependencyType;
import com.deepansh.toolplanner.model.ToolCall;

import java.util.Optional;

/**
 * A write followed by anything touching an overlapping resource.
 */
public class WriteOverlapRule implements DependencyRule {

    private final ResourceExtractorRegistry extractors;
    private final ToolCategories categories;

    public WriteOverlapRule(ResourceExtractorRegistry extractors, ToolCategories categories) {
        this.extractors = extractors;
        this.categories = categories;
    }

    @Override
    public Optional<DependencyType> evaluate(ToolCall earlier, ToolCall later) {
        if (!categories.isWrite(earlier.getToolName())) {
            return Optional.empty();
        }
        Optional<String> written = extractors.extract(earlier);
        Optional<String> touched = extractors.extract(later);
        if (written.isPresent() && touched.isPresent()
                && ResourcePaths.overlaps(written.get(), touched.get())) {
            return Optional.of(DependencyType.RESOURCE);
        }
        return Optional.empty();
    }
}

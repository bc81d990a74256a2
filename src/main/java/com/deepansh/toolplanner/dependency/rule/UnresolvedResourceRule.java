package com.deepansh.toolplanner.dependency.rule;

import com.deepansh.toolplanner.dependency.ResourceExtractorRegistry;
import com.deepansh.toolplanner.dependency.ToolCategories;
import com.deepansh.toolplanner.model.DependencyType;
import com.deepansh.toolplanner.model.ToolCall;

import java.util.Optional;

/**
 * Conservative policy for calls whose resource cannot be extracted: such a call is
 * serialized against every write on the other side of the pair.
 *
 * Only part of the chain when {@code planner.conservative-unresolved-resources} is on.
 */
public class UnresolvedResourceRule implements DependencyRule {

    private final ResourceExtractorRegistry extractors;
    private final ToolCategories categories;

    public UnresolvedResourceRule(ResourceExtractorRegistry extractors, ToolCategories categories) {
        this.extractors = extractors;
        this.categories = categories;
    }

    @Override
    public Optional<DependencyType> evaluate(ToolCall earlier, ToolCall later) {
        boolean earlierWrites = categories.isWrite(earlier.getToolName());
        boolean laterWrites = categories.isWrite(later.getToolName());
        if (!earlierWrites && !laterWrites) {
            return Optional.empty();
        }
        if ((earlierWrites && extractors.extract(later).isEmpty())
                || (laterWrites && extractors.extract(earlier).isEmpty())) {
            return Optional.of(DependencyType.RESOURCE);
        }
        return Optional.empty();
    }
}

package com.deepansh.toolplanner.dependency.rule;

import com.deepansh.toolplanner.model.DependencyType;
import com.deepansh.toolplanner.model.ToolCall;

import java.util.Optional;

/**
 * One heuristic in the classifier's rule chain.
 *
 * Rules are pure: they look at the two calls and nothing else, and never mutate them.
 * {@code earlier} always precedes {@code later} in the batch.
 */
@FunctionalInterface
public interface DependencyRule {

    /**
     * @return the dependency type if this rule fires, empty to let the next rule decide
     */
    Optional<DependencyType> evaluate(ToolCall earlier, ToolCall later);

    default String name() {
        return getClass().getSimpleName();
    }
}

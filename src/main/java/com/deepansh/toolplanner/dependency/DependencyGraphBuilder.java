package com.deepansh.toolplanner.dependency;

import com.deepansh.toolplanner.model.DependencyType;
import com.deepansh.toolplanner.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the classifier over every ordered pair of a batch and records the edges.
 *
 * Side effect: each {@link ToolCall} in the batch gets its {@code dependsOn} and
 * {@code dependencyTypes} filled in place. Existing edges are kept and never
 * duplicated, so analyzing the same batch twice is harmless.
 */
@Slf4j
public class DependencyGraphBuilder {

    private final DependencyClassifier classifier;

    public DependencyGraphBuilder(DependencyClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * @param calls the batch in caller order; only pairs (i, j) with i &lt; j are evaluated
     * @return call id → ids it depends on, for every call in batch order
     */
    public Map<String, List<String>> analyze(List<ToolCall> calls) {
        int added = 0;
        for (int j = 1; j < calls.size(); j++) {
            ToolCall later = calls.get(j);
            for (int i = 0; i < j; i++) {
                ToolCall earlier = calls.get(i);
                DependencyType type = classifier.classify(earlier, later);
                if (type != DependencyType.NONE && later.addDependency(earlier.getId(), type)) {
                    added++;
                    log.debug("Dependency [{}:{}] -> [{}:{}] ({})",
                            later.getId(), later.getToolName(),
                            earlier.getId(), earlier.getToolName(), type);
                }
            }
        }

        Map<String, List<String>> graph = new LinkedHashMap<>();
        for (ToolCall call : calls) {
            graph.put(call.getId(), new ArrayList<>(call.getDependsOn()));
        }

        log.debug("Analyzed batch of {} calls, {} new edges", calls.size(), added);
        return graph;
    }

    public DependencyClassifier getClassifier() {
        return classifier;
    }
}

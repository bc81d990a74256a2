package com.deepansh.toolplanner.dependency;

import com.deepansh.toolplanner.dependency.rule.DataReferenceRule;
import com.deepansh.toolplanner.dependency.rule.DependencyRule;
import com.deepansh.toolplanner.dependency.rule.ReadBeforeWriteRule;
import com.deepansh.toolplanner.dependency.rule.StateChangeRule;
import com.deepansh.toolplanner.dependency.rule.UnresolvedResourceRule;
import com.deepansh.toolplanner.dependency.rule.WriteOverlapRule;
import com.deepansh.toolplanner.model.DependencyType;
import com.deepansh.toolplanner.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a later call in a batch has to wait for an earlier one.
 *
 * Rules run in order and the first one that fires wins. The default chain is:
 * write→any overlap, read→write overlap, state-changing predecessor, textual id reference.
 */
@Slf4j
public class DependencyClassifier {

    private final List<DependencyRule> rules;

    public DependencyClassifier(List<DependencyRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static DependencyClassifier withDefaultRules(ResourceExtractorRegistry extractors,
                                                        ToolCategories categories) {
        return withDefaultRules(extractors, categories, false);
    }

    /**
     * @param conservativeUnresolved also serialize writes against calls whose resource
     *                               cannot be extracted
     */
    public static DependencyClassifier withDefaultRules(ResourceExtractorRegistry extractors,
                                                        ToolCategories categories,
                                                        boolean conservativeUnresolved) {
        List<DependencyRule> chain = new ArrayList<>();
        chain.add(new WriteOverlapRule(extractors, categories));
        chain.add(new ReadBeforeWriteRule(extractors, categories));
        if (conservativeUnresolved) {
            chain.add(new UnresolvedResourceRule(extractors, categories));
        }
        chain.add(new StateChangeRule(extractors, categories));
        chain.add(new DataReferenceRule());
        return new DependencyClassifier(chain);
    }

    /**
     * Classifies the pair; {@code earlier} must precede {@code later} in the batch.
     *
     * @return the type from the first matching rule, or {@link DependencyType#NONE}
     */
    public DependencyType classify(ToolCall earlier, ToolCall later) {
        for (DependencyRule rule : rules) {
            Optional<DependencyType> match = rule.evaluate(earlier, later);
            if (match.isPresent() && match.get() != DependencyType.NONE) {
                log.trace("Rule {} matched [{} -> {}]: {}",
                        rule.name(), earlier.getId(), later.getId(), match.get());
                return match.get();
            }
        }
        return DependencyType.NONE;
    }

    public boolean canParallelize(ToolCall earlier, ToolCall later) {
        return classify(earlier, later) == DependencyType.NONE;
    }

    public List<DependencyRule> getRules() {
        return rules;
    }
}

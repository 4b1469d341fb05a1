package com.powerflow.tree.service.graph;

import com.powerflow.tree.model.Branch;
import com.powerflow.tree.model.EquipmentNode;
import com.powerflow.tree.model.graph.EquipmentOccurrence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Named, ordered table of consolidation rules. The first rule that applies wins;
 * {@link StandardConsolidationRule#KEEP_FIRST_SEEN} runs when none does.
 */
public class ConsolidationPolicy {

    private final String name;
    private final List<ConsolidationRule> rules;

    public ConsolidationPolicy(String name, List<? extends ConsolidationRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("Consolidation policy " + name + " needs at least one rule");
        }
        this.name = name;
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    /**
     * Convergence points first, then closer path, then secondary on a level tie.
     */
    public static ConsolidationPolicy standard() {
        return new ConsolidationPolicy("standard", List.of(
                StandardConsolidationRule.CONVERGENCE_POINT_PREFERS_PRIMARY,
                StandardConsolidationRule.CLOSER_PATH_WINS,
                StandardConsolidationRule.SECONDARY_WINS_LEVEL_TIE,
                StandardConsolidationRule.KEEP_FIRST_SEEN));
    }

    /**
     * Apply the first matching rule to {@code existing}.
     *
     * @return the rule that was applied
     */
    public ConsolidationRule resolve(EquipmentNode existing, EquipmentOccurrence candidate, Branch candidateBranch) {
        for (ConsolidationRule rule : rules) {
            if (rule.applies(existing, candidate, candidateBranch)) {
                rule.apply(existing, candidate, candidateBranch);
                return rule;
            }
        }
        StandardConsolidationRule.KEEP_FIRST_SEEN.apply(existing, candidate, candidateBranch);
        return StandardConsolidationRule.KEEP_FIRST_SEEN;
    }

    public String getName() {
        return name;
    }

    public List<ConsolidationRule> getRules() {
        return rules;
    }

    @Override
    public String toString() {
        return name + rules.stream().map(ConsolidationRule::name).collect(Collectors.joining(" > ", "[", "]"));
    }
}

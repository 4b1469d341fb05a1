package com.powerflow.tree.service.graph;

import com.powerflow.tree.model.Branch;
import com.powerflow.tree.model.EquipmentNode;
import com.powerflow.tree.model.graph.EquipmentOccurrence;

/**
 * One precedence rule for merging a repeated sighting into the canonical equipment node.
 */
public interface ConsolidationRule {

    String name();

    /**
     * @param existing        canonical node, sources and parent ids already unioned with the candidate
     * @param candidate       the repeated sighting
     * @param candidateBranch branch the sighting would bring, may be null
     */
    boolean applies(EquipmentNode existing, EquipmentOccurrence candidate, Branch candidateBranch);

    void apply(EquipmentNode existing, EquipmentOccurrence candidate, Branch candidateBranch);
}

package com.powerflow.tree.service.graph;

import com.powerflow.tree.model.Branch;
import com.powerflow.tree.model.EquipmentNode;
import com.powerflow.tree.model.graph.EquipmentOccurrence;

import java.util.ArrayList;

/**
 * Built-in consolidation rules, listed in their default precedence.
 */
public enum StandardConsolidationRule implements ConsolidationRule {

    /** Utilities, generators and switchgear fed from both sides stay on the primary side. */
    CONVERGENCE_POINT_PREFERS_PRIMARY {
        @Override
        public boolean applies(EquipmentNode existing, EquipmentOccurrence candidate, Branch candidateBranch) {
            return EquipmentTypes.isConvergencePoint(candidate.getType())
                    && existing.getSources().contains(Branch.PRIMARY.getSourceLabel())
                    && existing.getSources().contains(Branch.SECONDARY.getSourceLabel());
        }

        @Override
        public void apply(EquipmentNode existing, EquipmentOccurrence candidate, Branch candidateBranch) {
            existing.setBranch(Branch.PRIMARY);
            existing.setSourceLabel(Branch.PRIMARY.getSourceLabel());
        }
    },

    /** A sighting at a lower level replaces the canonical path. */
    CLOSER_PATH_WINS {
        @Override
        public boolean applies(EquipmentNode existing, EquipmentOccurrence candidate, Branch candidateBranch) {
            return candidate.getLevel() < existing.getLevel();
        }

        @Override
        public void apply(EquipmentNode existing, EquipmentOccurrence candidate, Branch candidateBranch) {
            adopt(existing, candidate, candidateBranch);
        }
    },

    /** Same level, conflicting branch: the secondary sighting becomes canonical. */
    SECONDARY_WINS_LEVEL_TIE {
        @Override
        public boolean applies(EquipmentNode existing, EquipmentOccurrence candidate, Branch candidateBranch) {
            return candidate.getLevel() == existing.getLevel()
                    && candidateBranch == Branch.SECONDARY
                    && existing.getBranch() != null
                    && existing.getBranch() != Branch.SECONDARY;
        }

        @Override
        public void apply(EquipmentNode existing, EquipmentOccurrence candidate, Branch candidateBranch) {
            adopt(existing, candidate, candidateBranch);
        }
    },

    /** Keep the canonical path; only fill in a missing branch or pull it back to primary. */
    KEEP_FIRST_SEEN {
        @Override
        public boolean applies(EquipmentNode existing, EquipmentOccurrence candidate, Branch candidateBranch) {
            return true;
        }

        @Override
        public void apply(EquipmentNode existing, EquipmentOccurrence candidate, Branch candidateBranch) {
            if (existing.getBranch() == null && candidateBranch != null) {
                existing.setBranch(candidateBranch);
            } else if (candidateBranch == Branch.PRIMARY) {
                existing.setBranch(Branch.PRIMARY);
            }
        }
    };

    private static void adopt(EquipmentNode existing, EquipmentOccurrence candidate, Branch candidateBranch) {
        existing.setLevel(candidate.getLevel());
        existing.setParentId(candidate.getParentId());
        existing.setPath(candidate.getPath() != null ? new ArrayList<>(candidate.getPath()) : new ArrayList<>());
        if (candidate.getSourceLabel() != null) {
            existing.setSourceLabel(candidate.getSourceLabel());
        }
        if (candidateBranch != null) {
            existing.setBranch(candidateBranch);
        }
        if (candidate.getClassification() != null) {
            existing.setClassification(candidate.getClassification());
        }
    }
}

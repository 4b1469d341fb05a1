package com.powerflow.tree.service.graph;

import com.powerflow.tree.model.AlternateParent;
import com.powerflow.tree.model.Branch;
import com.powerflow.tree.model.ConnectionType;
import com.powerflow.tree.model.EquipmentNode;
import com.powerflow.tree.model.graph.EquipmentOccurrence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges repeated sightings of the same equipment into one node.
 *
 * Source labels and parent ids are always unioned, and every non-normal sighting is kept as an
 * alternate parent. Which sighting becomes canonical is decided by a {@link ConsolidationPolicy}.
 */
@Service
@Slf4j
public class EquipmentConsolidator {

    /**
     * Consolidate occurrences in discovery order. The result keeps first-seen order.
     */
    public List<EquipmentNode> consolidate(List<EquipmentOccurrence> occurrences, ConsolidationPolicy policy) {
        Map<String, EquipmentNode> equipmentById = new LinkedHashMap<>();
        Map<String, Integer> ruleHits = new LinkedHashMap<>();

        for (EquipmentOccurrence occurrence : occurrences) {
            Branch candidateBranch = candidateBranch(occurrence);
            EquipmentNode existing = equipmentById.get(occurrence.getId());

            if (existing == null) {
                equipmentById.put(occurrence.getId(), firstSighting(occurrence, candidateBranch));
                continue;
            }

            if (occurrence.getSourceLabel() != null) {
                existing.getSources().add(occurrence.getSourceLabel());
            }
            if (occurrence.getParentId() != null) {
                existing.getParentIds().add(occurrence.getParentId());
            }
            recordAlternateParent(existing, occurrence);

            ConsolidationRule applied = policy.resolve(existing, occurrence, candidateBranch);
            ruleHits.merge(applied.name(), 1, Integer::sum);
            log.debug("Merged {} via {} from parent {} (level {})",
                    occurrence.getId(), applied.name(), occurrence.getParentId(), occurrence.getLevel());
        }

        log.info("Consolidated {} occurrences into {} equipment using policy {} (rule hits: {})",
                occurrences.size(), equipmentById.size(), policy.getName(), ruleHits);
        return new ArrayList<>(equipmentById.values());
    }

    // ========================= HELPERS =========================

    private EquipmentNode firstSighting(EquipmentOccurrence occurrence, Branch candidateBranch) {
        Set<String> sources = new LinkedHashSet<>();
        sources.add(occurrence.getSourceLabel() != null
                ? occurrence.getSourceLabel()
                : Branch.PRIMARY.getSourceLabel());

        Set<String> parentIds = new LinkedHashSet<>();
        if (occurrence.getParentId() != null) {
            parentIds.add(occurrence.getParentId());
        }

        EquipmentNode node = EquipmentNode.builder()
                .id(occurrence.getId())
                .name(occurrence.getName())
                .type(occurrence.getType())
                .level(occurrence.getLevel())
                .parentId(occurrence.getParentId())
                .sourceLabel(occurrence.getSourceLabel())
                .branch(candidateBranch)
                .classification(occurrence.getClassification() != null
                        ? occurrence.getClassification()
                        : ConnectionType.NORMAL)
                .sequence(occurrence.getSequence())
                .sources(sources)
                .parentIds(parentIds)
                .path(occurrence.getPath() != null ? new ArrayList<>(occurrence.getPath()) : new ArrayList<>())
                .build();
        recordAlternateParent(node, occurrence);
        return node;
    }

    private void recordAlternateParent(EquipmentNode node, EquipmentOccurrence occurrence) {
        ConnectionType classification = occurrence.getClassification();
        if (classification == null || !classification.isAlternate() || occurrence.getParentId() == null) {
            return;
        }

        boolean known = node.getAlternateParents().stream()
                .anyMatch(alt -> alt.getId().equals(occurrence.getParentId())
                        && alt.getClassification() == classification);
        if (!known) {
            node.getAlternateParents().add(AlternateParent.builder()
                    .id(occurrence.getParentId())
                    .sourceLabel(occurrence.getSourceLabel() != null
                            ? occurrence.getSourceLabel()
                            : Branch.PRIMARY.getSourceLabel())
                    .classification(classification)
                    .build());
        }
    }

    /**
     * Label of the relation that reached this sighting, falling back to the branch inherited
     * along the path.
     */
    private Branch candidateBranch(EquipmentOccurrence occurrence) {
        Branch fromRelation = Branch.fromSourceLabel(occurrence.getSourceLabel());
        if (fromRelation != null) {
            return fromRelation;
        }
        return occurrence.getBranch();
    }
}

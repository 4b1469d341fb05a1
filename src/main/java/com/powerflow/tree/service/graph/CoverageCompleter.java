package com.powerflow.tree.service.graph;

import com.powerflow.tree.dto.graph.DiagnosticCode;
import com.powerflow.tree.dto.graph.LayoutDiagnostics;
import com.powerflow.tree.model.Branch;
import com.powerflow.tree.model.ConnectionType;
import com.powerflow.tree.model.EquipmentNode;
import com.powerflow.tree.model.graph.ConnectionMap;
import com.powerflow.tree.model.graph.ConnectionRelation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Restores upstream ancestors that consolidation dropped because the same id was already
 * found on a closer path.
 *
 * Walks the original adjacency breadth-first from the selected equipment. Missing ancestors
 * are synthesized, known ones get their parent and source sets unioned. Loop members are
 * resolved to the representative that absorbed them.
 */
@Service
@Slf4j
public class CoverageCompleter {

    public static final String UNKNOWN_NAME = "Unknown Equipment";
    public static final String UNKNOWN_TYPE = "UNKNOWN";

    public List<EquipmentNode> complete(EquipmentNode root, List<EquipmentNode> upstream,
                                        ConnectionMap connectionMap, int maxDepth,
                                        LayoutDiagnostics diagnostics) {
        Map<String, EquipmentNode> equipmentById = new LinkedHashMap<>();
        upstream.forEach(node -> equipmentById.put(node.getId(), node));

        List<EquipmentNode> completed = new ArrayList<>(upstream);
        long nextSequence = upstream.stream().mapToLong(EquipmentNode::getSequence).max().orElse(-1) + 1;
        int restored = 0;

        Deque<QueuedEquipment> queue = new ArrayDeque<>();
        queue.add(new QueuedEquipment(root.getId(), root.getLevel()));
        Set<String> visited = new HashSet<>();

        while (!queue.isEmpty()) {
            QueuedEquipment current = queue.poll();
            if (!visited.add(current.id)) continue;

            String childId = resolve(current.id, equipmentById);
            int parentLevel = current.level + 1;

            for (ConnectionRelation relation : connectionMap.upstreamOf(current.id)) {
                if (relation.getId().equals(root.getId())) continue;

                if (parentLevel - root.getLevel() > maxDepth) {
                    log.debug("Coverage walk stops at {}: ceiling {} reached", current.id, maxDepth);
                    continue;
                }

                EquipmentNode existing = equipmentById.get(relation.getId());
                if (existing == null) {
                    EquipmentNode inferred = synthesize(relation, childId, parentLevel, nextSequence++);
                    completed.add(inferred);
                    equipmentById.put(inferred.getId(), inferred);
                    restored++;
                    log.debug("Restored ancestor {} ({}) above {}", inferred.getName(), inferred.getId(), childId);
                    diagnostics.info(DiagnosticCode.ANCESTOR_RESTORED, inferred.getId(),
                            "Restored ancestor " + inferred.getName() + " above " + childId);
                    queue.add(new QueuedEquipment(relation.getId(), parentLevel));
                    continue;
                }

                EquipmentNode target = existing.isAbsorbed() && equipmentById.containsKey(existing.getAbsorbedBy())
                        ? equipmentById.get(existing.getAbsorbedBy())
                        : existing;
                if (!target.getId().equals(childId)) {
                    union(target, childId, relation);
                }
                queue.add(new QueuedEquipment(relation.getId(), parentLevel));
            }
        }

        log.info("Coverage completion restored {} ancestors ({} upstream equipment total)",
                restored, completed.size());
        return completed;
    }

    // ========================= HELPERS =========================

    private String resolve(String id, Map<String, EquipmentNode> equipmentById) {
        EquipmentNode node = equipmentById.get(id);
        if (node != null && node.isAbsorbed() && equipmentById.containsKey(node.getAbsorbedBy())) {
            return node.getAbsorbedBy();
        }
        return id;
    }

    private EquipmentNode synthesize(ConnectionRelation relation, String childId, int level, long sequence) {
        String sourceLabel = relation.getSourceLabel();
        Set<String> sources = new LinkedHashSet<>();
        sources.add(sourceLabel != null ? sourceLabel : Branch.PRIMARY.getSourceLabel());
        Set<String> parentIds = new LinkedHashSet<>();
        parentIds.add(childId);
        List<String> path = new ArrayList<>();
        path.add(childId);

        return EquipmentNode.builder()
                .id(relation.getId())
                .name(isBlank(relation.getName()) ? UNKNOWN_NAME : relation.getName())
                .type(isBlank(relation.getType()) ? UNKNOWN_TYPE : relation.getType())
                .level(level)
                .parentId(childId)
                .sourceLabel(sourceLabel)
                .branch(Branch.orPrimary(Branch.fromSourceLabel(sourceLabel)))
                .classification(relation.getClassification() != null
                        ? relation.getClassification()
                        : ConnectionType.NORMAL)
                .sequence(sequence)
                .sources(sources)
                .parentIds(parentIds)
                .path(path)
                .synthesized(true)
                .build();
    }

    private void union(EquipmentNode target, String childId, ConnectionRelation relation) {
        target.getParentIds().add(childId);
        if (relation.getSourceLabel() != null) {
            target.getSources().add(relation.getSourceLabel());
        }
        if (target.getParentId() == null) {
            target.setParentId(childId);
        }
        if (target.getBranch() == null) {
            target.setBranch(Branch.fromSourceLabel(relation.getSourceLabel()));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class QueuedEquipment {

        private final String id;
        private final int level;

        private QueuedEquipment(String id, int level) {
            this.id = id;
            this.level = level;
        }
    }
}

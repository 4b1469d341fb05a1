package com.powerflow.tree.service.graph;

import com.powerflow.tree.dto.graph.DiagnosticCode;
import com.powerflow.tree.dto.graph.LayoutDiagnostics;
import com.powerflow.tree.model.Branch;
import com.powerflow.tree.model.ConnectionType;
import com.powerflow.tree.model.graph.ConnectionMap;
import com.powerflow.tree.model.graph.ConnectionRelation;
import com.powerflow.tree.model.graph.Direction;
import com.powerflow.tree.model.graph.EquipmentOccurrence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cycle-safe expansion of the connection map from a start id in one direction.
 *
 * Each path carries its own visited set, so the same equipment may be reached through
 * different routes. A node that has a bypass relation in the walk direction may be revisited,
 * and a bypass relation continues with a copy of the visited set that leaves the current node
 * out. The walk stops at the configured hop ceiling.
 */
@Service
@Slf4j
public class EquipmentWalker {

    /**
     * Walk from {@code startId} and return every occurrence in discovery order.
     * The start id itself is never part of the result; unknown ids yield an empty list.
     */
    public List<EquipmentOccurrence> walk(String startId, Direction direction, ConnectionMap connectionMap,
                                          int maxDepth, LayoutDiagnostics diagnostics) {
        if (!connectionMap.contains(startId)) {
            log.debug("No connections recorded for {}, nothing to walk {}", startId, direction);
            return Collections.emptyList();
        }

        WalkContext context = new WalkContext(connectionMap, direction, maxDepth, diagnostics);
        List<EquipmentOccurrence> occurrences = new ArrayList<>();
        expand(startId, new HashSet<>(), 1, Collections.emptyList(), null, context, occurrences);

        List<EquipmentOccurrence> result = occurrences.stream()
                .filter(occurrence -> !occurrence.getId().equals(startId))
                .collect(Collectors.toList());

        log.info("Walked {} from {}: {} occurrences", direction, startId, result.size());
        return result;
    }

    private void expand(String equipmentId, Set<String> visited, int level, List<String> path,
                        Branch branch, WalkContext context, List<EquipmentOccurrence> out) {
        List<ConnectionRelation> relations = context.connectionMap.relations(equipmentId, context.direction);

        if (level > context.maxDepth) {
            if (!relations.isEmpty()) {
                context.reportCeiling(equipmentId);
            }
            return;
        }

        boolean bypassPath = !path.isEmpty() && relations.stream()
                .anyMatch(relation -> relation.getClassification() == ConnectionType.BYPASS);
        if (visited.contains(equipmentId) && !bypassPath) {
            return;
        }

        List<String> currentPath = new ArrayList<>(path);
        currentPath.add(equipmentId);

        for (ConnectionRelation relation : relations) {
            ConnectionType classification = relation.getClassification() != null
                    ? relation.getClassification()
                    : ConnectionType.NORMAL;

            Branch currentBranch = null;
            if (context.direction == Direction.UPSTREAM) {
                currentBranch = branch != null
                        ? branch
                        : Branch.orPrimary(Branch.fromSourceLabel(relation.getSourceLabel()));
            }

            Set<String> nextVisited = new HashSet<>(visited);
            if (classification != ConnectionType.BYPASS) {
                nextVisited.add(equipmentId);
            }

            out.add(EquipmentOccurrence.builder()
                    .id(relation.getId())
                    .name(relation.getName())
                    .type(relation.getType())
                    .level(level)
                    .parentId(equipmentId)
                    .sourceLabel(relation.getSourceLabel())
                    .path(currentPath)
                    .branch(currentBranch)
                    .classification(classification)
                    .sequence(context.nextSequence())
                    .build());

            expand(relation.getId(), nextVisited, level + 1, currentPath, currentBranch, context, out);
        }
    }

    private static final class WalkContext {

        private final ConnectionMap connectionMap;
        private final Direction direction;
        private final int maxDepth;
        private final LayoutDiagnostics diagnostics;
        private final Set<String> truncatedAt = new HashSet<>();
        private long sequence;

        private WalkContext(ConnectionMap connectionMap, Direction direction, int maxDepth,
                            LayoutDiagnostics diagnostics) {
            this.connectionMap = connectionMap;
            this.direction = direction;
            this.maxDepth = maxDepth;
            this.diagnostics = diagnostics;
        }

        private long nextSequence() {
            return sequence++;
        }

        private void reportCeiling(String equipmentId) {
            if (truncatedAt.add(equipmentId)) {
                log.warn("Depth ceiling {} reached {} of {}, further equipment omitted",
                        maxDepth, direction, equipmentId);
                diagnostics.warn(DiagnosticCode.DEPTH_CEILING_REACHED, equipmentId,
                        "Traversal truncated at " + maxDepth + " hops");
            }
        }
    }
}

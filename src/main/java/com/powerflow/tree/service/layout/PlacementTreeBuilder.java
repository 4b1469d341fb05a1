package com.powerflow.tree.service.layout;

import com.powerflow.tree.dto.graph.DiagnosticCode;
import com.powerflow.tree.dto.graph.LayoutDiagnostics;
import com.powerflow.tree.model.Branch;
import com.powerflow.tree.model.EquipmentNode;
import com.powerflow.tree.model.graph.ConnectionMap;
import com.powerflow.tree.model.graph.ConnectionRelation;
import com.powerflow.tree.model.layout.LateralDirection;
import com.powerflow.tree.model.layout.LayoutInfo;
import com.powerflow.tree.model.layout.PlacementNode;
import com.powerflow.tree.model.layout.PlacementTree;
import com.powerflow.tree.service.graph.EquipmentTypes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Classifies upstream equipment for layout and derives a strict placement tree rooted at the
 * selected equipment.
 *
 * The tree is built breadth-first over upstream relations. Loop members are replaced by their
 * representative, whose upstream is the union of its members'. Every id is attached once, to
 * the node that discovered it first, into one of three child groups: primary, secondary or
 * lateral.
 */
@Service
@Slf4j
public class PlacementTreeBuilder {

    public PlacementTree build(EquipmentNode root, List<EquipmentNode> upstream, ConnectionMap connectionMap,
                               LayoutDiagnostics diagnostics) {
        Map<String, String> representativeOf = representatives(upstream);
        Map<String, LayoutInfo> infos = classify(root, upstream);
        Map<String, String> typeById = new HashMap<>();
        infos.forEach((id, info) -> typeById.put(id, info.getEquipment().getType()));

        Map<String, PlacementNode> nodes = new LinkedHashMap<>();
        nodes.put(root.getId(), new PlacementNode(root.getId(), infos.get(root.getId())));

        Deque<String> queue = new ArrayDeque<>();
        queue.add(root.getId());

        while (!queue.isEmpty()) {
            String id = queue.poll();
            PlacementNode node = nodes.get(id);

            for (ConnectionRelation relation : upstreamRelations(id, infos.get(id), connectionMap)) {
                String neighbourId = representativeOf.getOrDefault(relation.getId(), relation.getId());
                LayoutInfo neighbour = infos.get(neighbourId);
                if (neighbour == null || neighbourId.equals(id) || nodes.containsKey(neighbourId)) {
                    continue;
                }

                PlacementNode child = new PlacementNode(neighbourId, neighbour);
                child.setParentId(id);
                neighbour.setParentId(id);
                markLateral(neighbour, id, typeById, connectionMap, representativeOf);
                nodes.put(neighbourId, child);

                if (neighbour.isLateral()) {
                    node.getLateralChildren().add(neighbourId);
                } else if (neighbour.getBranch() == Branch.SECONDARY) {
                    node.getSecondaryChildren().add(neighbourId);
                } else {
                    node.getPrimaryChildren().add(neighbourId);
                }
                // Laterals keep their ancestors visible
                queue.add(neighbourId);
            }
        }

        infos.keySet().stream()
                .filter(id -> !nodes.containsKey(id))
                .forEach(id -> {
                    log.warn("Equipment {} is not reachable from {} in the placement tree", id, root.getId());
                    diagnostics.warn(DiagnosticCode.UNREACHABLE_NODE, id,
                            "Not reachable from the selected equipment, left out of the layout");
                });

        log.info("Placement tree for {} has {} nodes ({} classified)", root.getId(), nodes.size(), infos.size());
        return new PlacementTree(root.getId(), nodes);
    }

    // ========================= CLASSIFICATION =========================

    /**
     * Branch and type category of every rendered node. Laterality is settled once the node's
     * placement parent is known.
     */
    Map<String, LayoutInfo> classify(EquipmentNode root, List<EquipmentNode> upstream) {
        Map<String, LayoutInfo> infos = new LinkedHashMap<>();
        infos.put(root.getId(), LayoutInfo.builder()
                .equipment(root)
                .branch(Branch.PRIMARY)
                .typeCategory(EquipmentTypes.categorize(root.getType()))
                .level(root.getLevel())
                .lateral(false)
                .build());

        for (EquipmentNode node : upstream) {
            if (node.isAbsorbed() || node.getId().equals(root.getId())) continue;

            infos.put(node.getId(), LayoutInfo.builder()
                    .equipment(node)
                    .branch(determineBranch(node))
                    .typeCategory(EquipmentTypes.categorize(node.getType()))
                    .level(node.getLevel())
                    .lateral(false)
                    .parentId(node.getParentId())
                    .build());
        }
        return infos;
    }

    /**
     * Canonical branch, then canonical source label, then secondary if any source was secondary.
     */
    static Branch determineBranch(EquipmentNode node) {
        if (node.getBranch() != null) return node.getBranch();
        Branch fromLabel = Branch.fromSourceLabel(node.getSourceLabel());
        if (fromLabel != null) return fromLabel;
        if (node.getSources().contains(Branch.SECONDARY.getSourceLabel())) return Branch.SECONDARY;
        return Branch.PRIMARY;
    }

    private void markLateral(LayoutInfo info, String parentId, Map<String, String> typeById,
                             ConnectionMap connectionMap, Map<String, String> representativeOf) {
        if (!isLateral(info.getEquipment(), parentId, typeById, connectionMap, representativeOf)) {
            return;
        }
        info.setLateral(true);
        // Power storage always pairs on the left of the equipment it serves
        info.setLateralDirection(EquipmentTypes.isPowerStorage(info.getEquipment().getType())
                || info.getBranch() != Branch.SECONDARY
                ? LateralDirection.LEFT
                : LateralDirection.RIGHT);
    }

    /**
     * Power storage that both feeds and is fed by the parent it is placed under, or power
     * storage placed under a distribution switch.
     */
    private boolean isLateral(EquipmentNode node, String parentId, Map<String, String> typeById,
                              ConnectionMap connectionMap, Map<String, String> representativeOf) {
        if (!EquipmentTypes.isPowerStorage(node.getType()) || parentId == null) {
            return false;
        }

        boolean returnsToParent = connectionMap.downstreamOf(node.getId()).stream()
                .anyMatch(relation -> parentId.equals(representativeOf.getOrDefault(relation.getId(), relation.getId())));
        boolean fedByParent = connectionMap.upstreamOf(node.getId()).stream()
                .anyMatch(relation -> parentId.equals(representativeOf.getOrDefault(relation.getId(), relation.getId())));
        if (returnsToParent && fedByParent) {
            return true;
        }

        return EquipmentTypes.isDistributionSwitch(typeById.get(parentId));
    }

    // ========================= HELPERS =========================

    private Map<String, String> representatives(List<EquipmentNode> upstream) {
        Map<String, String> representativeOf = new HashMap<>();
        for (EquipmentNode node : upstream) {
            if (node.isLoopGroup() && node.getLoopGroupData() != null) {
                node.getLoopGroupData().getMembers()
                        .forEach(member -> representativeOf.put(member.getId(), node.getId()));
            }
        }
        return representativeOf;
    }

    /**
     * Upstream relations of a node; a loop representative collects those of its members.
     */
    private List<ConnectionRelation> upstreamRelations(String id, LayoutInfo info, ConnectionMap connectionMap) {
        if (info == null || !info.isLoopGroup() || info.getEquipment().getLoopGroupData() == null) {
            return connectionMap.upstreamOf(id);
        }
        List<ConnectionRelation> relations = new ArrayList<>();
        for (EquipmentNode member : info.getEquipment().getLoopGroupData().getMembers()) {
            relations.addAll(connectionMap.upstreamOf(member.getId()));
        }
        return relations;
    }
}

package com.powerflow.tree.service;

import com.powerflow.tree.dto.graph.EdgeKind;
import com.powerflow.tree.dto.graph.LayoutEdge;
import com.powerflow.tree.dto.graph.PositionedNode;
import com.powerflow.tree.model.AlternateParent;
import com.powerflow.tree.model.Branch;
import com.powerflow.tree.model.ConnectionType;
import com.powerflow.tree.model.EquipmentNode;
import com.powerflow.tree.model.graph.ConnectionMap;
import com.powerflow.tree.model.graph.ConnectionRelation;
import com.powerflow.tree.model.graph.Direction;
import com.powerflow.tree.model.layout.LayoutFrame;
import com.powerflow.tree.model.layout.LayoutInfo;
import com.powerflow.tree.model.layout.PlacementNode;
import com.powerflow.tree.model.layout.PlacementTree;
import com.powerflow.tree.model.layout.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Converts a finished layout into renderable nodes and classified edges.
 * Output order is deterministic: the selected equipment, then upstream in placement order,
 * then downstream row by row.
 */
@Service
@Slf4j
public class TreeElementGenerator {

    // ========================= NODES =========================

    public List<PositionedNode> generateNodes(EquipmentNode root, PlacementTree tree, LayoutFrame frame,
                                              List<EquipmentNode> downstream, List<String> downstreamPlaced) {
        List<PositionedNode> nodes = new ArrayList<>();
        nodes.add(toNode(root, frame.position(root.getId()), PositionedNode.STYLE_SELECTED));

        for (PlacementNode node : tree.nodes()) {
            if (node.getId().equals(root.getId()) || !frame.isPlaced(node.getId())) continue;
            nodes.add(toNode(node.getInfo().getEquipment(), frame.position(node.getId()), styleOf(node.getInfo())));
        }

        Map<String, EquipmentNode> downstreamById = indexById(downstream);
        for (String id : downstreamPlaced) {
            EquipmentNode node = downstreamById.get(id);
            if (node != null) {
                nodes.add(toNode(node, frame.position(id), PositionedNode.STYLE_DOWNSTREAM));
            }
        }

        log.debug("Generated {} positioned nodes", nodes.size());
        return nodes;
    }

    private PositionedNode toNode(EquipmentNode equipment, Position position, String styleClass) {
        return PositionedNode.builder()
                .id(equipment.getId())
                .x(position.getX())
                .y(position.getY())
                .label(equipment.getName() + "\n" + equipment.getType())
                .styleClass(styleClass)
                .name(equipment.getName())
                .type(equipment.getType())
                .build();
    }

    private String styleOf(LayoutInfo info) {
        if (info.isLoopGroup()) return PositionedNode.STYLE_LOOP_GROUP;
        return info.getBranch() == Branch.SECONDARY ? PositionedNode.STYLE_SECONDARY : PositionedNode.STYLE_PRIMARY;
    }

    // ========================= EDGES =========================

    public List<LayoutEdge> generateEdges(EquipmentNode root, PlacementTree tree, LayoutFrame frame,
                                          List<EquipmentNode> downstream, List<String> downstreamPlaced,
                                          ConnectionMap connectionMap) {
        List<LayoutEdge> edges = new ArrayList<>();
        Set<String> rendered = new HashSet<>(frame.placedIds());

        for (PlacementNode node : tree.nodes()) {
            if (node.getId().equals(root.getId()) || !rendered.contains(node.getId())) continue;
            addTreeEdges(node, tree, connectionMap, edges);
        }

        Map<String, EquipmentNode> downstreamById = indexById(downstream);
        for (String id : downstreamPlaced) {
            EquipmentNode node = downstreamById.get(id);
            String parentId = node == null ? null : node.getParentId();
            if (parentId == null || !rendered.contains(parentId)) continue;

            ConnectionRelation relation = connectionMap.findRelation(parentId, Direction.DOWNSTREAM, id).orElse(null);
            edges.add(LayoutEdge.builder()
                    .id(parentId + "-" + id)
                    .sourceId(parentId)
                    .targetId(id)
                    .classification(relation != null && relation.getClassification() != null
                            ? relation.getClassification() : ConnectionType.NORMAL)
                    .sourceLabel(relation != null ? relation.getSourceLabel() : node.getSourceLabel())
                    .kind(EdgeKind.DOWNSTREAM)
                    .build());
        }

        addDirectEdges(root.getId(), connectionMap, rendered, edges);

        List<LayoutEdge> deduplicated = deduplicate(edges);
        log.debug("Generated {} edges ({} before de-duplication)", deduplicated.size(), edges.size());
        return deduplicated;
    }

    private void addTreeEdges(PlacementNode node, PlacementTree tree, ConnectionMap connectionMap,
                              List<LayoutEdge> edges) {
        String id = node.getId();
        String parentId = node.getParentId();
        LayoutInfo info = node.getInfo();

        if (parentId != null) {
            ConnectionRelation relation = lookupRelation(parentId, id, tree, connectionMap);
            edges.add(LayoutEdge.builder()
                    .id(parentId + "-" + id)
                    .sourceId(parentId)
                    .targetId(id)
                    .classification(relation != null && relation.getClassification() != null
                            ? relation.getClassification() : ConnectionType.NORMAL)
                    .sourceLabel(relation != null ? relation.getSourceLabel() : info.getEquipment().getSourceLabel())
                    .kind(EdgeKind.TREE)
                    .build());

            if (info.isLateral()) {
                String returnId = "lateral-return-" + id + "-" + parentId;
                if (edges.stream().noneMatch(edge -> edge.getId().equals(returnId))) {
                    edges.add(LayoutEdge.builder()
                            .id(returnId)
                            .sourceId(id)
                            .targetId(parentId)
                            .classification(ConnectionType.NORMAL)
                            .kind(EdgeKind.LATERAL_RETURN)
                            .build());
                }
            }
        }

        List<AlternateParent> alternates = info.getEquipment().getAlternateParents();
        for (int i = 0; i < alternates.size(); i++) {
            AlternateParent alternate = alternates.get(i);
            if (!tree.contains(alternate.getId()) || joined(alternate.getId(), id, edges)) continue;

            ConnectionType classification = alternate.getClassification() != null
                    ? alternate.getClassification() : ConnectionType.BYPASS;
            edges.add(LayoutEdge.builder()
                    .id("bypass-" + alternate.getId() + "-" + id + "-" + classification.getValue() + "-" + i)
                    .sourceId(alternate.getId())
                    .targetId(id)
                    .classification(classification)
                    .sourceLabel(alternate.getSourceLabel())
                    .kind(EdgeKind.ALTERNATE)
                    .build());
        }
    }

    /**
     * Relation through which {@code upstreamId} feeds {@code childId}. Loop groups are looked up
     * through their members on either side.
     */
    private ConnectionRelation lookupRelation(String childId, String upstreamId, PlacementTree tree,
                                              ConnectionMap connectionMap) {
        for (String child : memberIds(childId, tree)) {
            for (String upstream : memberIds(upstreamId, tree)) {
                Optional<ConnectionRelation> relation = connectionMap.findRelation(child, Direction.UPSTREAM, upstream);
                if (relation.isPresent()) return relation.get();
            }
        }
        return null;
    }

    private List<String> memberIds(String id, PlacementTree tree) {
        PlacementNode node = tree.node(id);
        if (node == null || !node.getInfo().isLoopGroup() || node.getInfo().getEquipment().getLoopGroupData() == null) {
            return List.of(id);
        }
        List<String> ids = new ArrayList<>();
        ids.add(id);
        node.getInfo().getEquipment().getLoopGroupData().getMembers().forEach(member -> ids.add(member.getId()));
        return ids;
    }

    /**
     * Edges between the selected equipment and its neighbours, drawn only when some neighbour
     * both feeds and is fed by it.
     */
    private void addDirectEdges(String rootId, ConnectionMap connectionMap, Set<String> rendered,
                                List<LayoutEdge> edges) {
        List<ConnectionRelation> upstream = connectionMap.upstreamOf(rootId);
        List<ConnectionRelation> downstream = connectionMap.downstreamOf(rootId);
        boolean bidirectional = upstream.stream()
                .anyMatch(up -> downstream.stream().anyMatch(down -> down.getId().equals(up.getId())));
        if (!bidirectional) return;

        for (ConnectionRelation relation : upstream) {
            if (rendered.contains(relation.getId()) && !hasEdge(relation.getId(), rootId, edges)) {
                edges.add(directEdge(relation.getId(), rootId, relation));
            }
        }
        for (ConnectionRelation relation : downstream) {
            if (rendered.contains(relation.getId()) && !hasEdge(rootId, relation.getId(), edges)) {
                edges.add(directEdge(rootId, relation.getId(), relation));
            }
        }
    }

    private LayoutEdge directEdge(String sourceId, String targetId, ConnectionRelation relation) {
        return LayoutEdge.builder()
                .id(sourceId + "-" + targetId)
                .sourceId(sourceId)
                .targetId(targetId)
                .classification(relation.getClassification() != null
                        ? relation.getClassification() : ConnectionType.NORMAL)
                .sourceLabel(relation.getSourceLabel())
                .kind(EdgeKind.DIRECT)
                .build();
    }

    // ========================= HELPERS =========================

    /**
     * One edge per (source, target) pair in first-seen order; an alternate edge replaces a
     * plain edge for the same pair.
     */
    private List<LayoutEdge> deduplicate(List<LayoutEdge> edges) {
        Map<String, LayoutEdge> byPair = new LinkedHashMap<>();
        for (LayoutEdge edge : edges) {
            String key = edge.getSourceId() + "->" + edge.getTargetId();
            LayoutEdge existing = byPair.get(key);
            if (existing == null
                    || (edge.getKind() == EdgeKind.ALTERNATE && existing.getKind() != EdgeKind.ALTERNATE)) {
                byPair.put(key, edge);
            }
        }
        return new ArrayList<>(byPair.values());
    }

    private boolean hasEdge(String sourceId, String targetId, List<LayoutEdge> edges) {
        return edges.stream().anyMatch(edge -> edge.getSourceId().equals(sourceId)
                && edge.getTargetId().equals(targetId));
    }

    private boolean joined(String firstId, String secondId, List<LayoutEdge> edges) {
        return hasEdge(firstId, secondId, edges) || hasEdge(secondId, firstId, edges);
    }

    private Map<String, EquipmentNode> indexById(List<EquipmentNode> equipment) {
        Map<String, EquipmentNode> byId = new HashMap<>();
        equipment.forEach(node -> byId.putIfAbsent(node.getId(), node));
        return byId;
    }
}

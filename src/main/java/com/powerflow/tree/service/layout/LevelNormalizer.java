package com.powerflow.tree.service.layout;

import com.powerflow.tree.model.Branch;
import com.powerflow.tree.model.LayoutSettings;
import com.powerflow.tree.model.layout.LateralDirection;
import com.powerflow.tree.model.layout.LayoutFrame;
import com.powerflow.tree.model.layout.LayoutInfo;
import com.powerflow.tree.model.layout.PlacementNode;
import com.powerflow.tree.model.layout.PlacementTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Re-orders and re-spaces every row by branch lineage.
 *
 * Nodes of a row are grouped by their parent. Parent groups are ordered by the branch of the
 * nearest loop group found within {@link #ANCESTOR_TRACE_LIMIT} hops above the parent, then by
 * the parent's own branch, then by name. Inside a group primary nodes come before secondary
 * ones. Each node reserves slots next to it for its laterals, and the row is spread evenly at
 * one centre spacing and centred on the configured centre x.
 */
@Service
@Slf4j
public class LevelNormalizer {

    /** Ancestor hops searched for a loop group when ordering parent groups. */
    public static final int ANCESTOR_TRACE_LIMIT = 6;

    public void normalize(PlacementTree tree, LayoutFrame frame, LayoutSettings settings) {
        Map<Integer, List<String>> rows = new TreeMap<>();
        for (PlacementNode node : tree.nodes()) {
            if (node.getInfo().isLateral() || !frame.isPlaced(node.getId())) continue;
            rows.computeIfAbsent(frame.row(node.getId()), row -> new ArrayList<>()).add(node.getId());
        }

        rows.forEach((row, ids) -> {
            List<String> slots = slotOrder(ids, tree);
            double spacing = settings.centerSpacing();
            double startX = settings.getCenterX() - (slots.size() - 1) * spacing / 2;

            // The root's row keeps the root on the centre line
            int rootSlot = slots.indexOf(tree.getRootId());
            if (rootSlot >= 0) {
                startX = settings.getCenterX() - rootSlot * spacing;
            }

            for (int i = 0; i < slots.size(); i++) {
                String id = slots.get(i);
                if (!tree.node(id).getInfo().isLateral()) {
                    frame.move(id, frame.position(id).withX(startX + i * spacing));
                }
            }
            log.debug("Row {} normalized: {} nodes over {} slots", row, ids.size(), slots.size());
        });

        log.info("Normalized {} rows", rows.size());
    }

    /**
     * Branch that decides where a parent group goes: the branch of the first loop group within
     * the trace limit above the parent, otherwise the parent's own branch.
     */
    public Branch lineageBranch(String parentId, PlacementTree tree) {
        String currentId = parentId;
        for (int hop = 0; hop < ANCESTOR_TRACE_LIMIT && currentId != null; hop++) {
            PlacementNode current = tree.node(currentId);
            if (current == null) break;
            if (current.getInfo().isLoopGroup()) {
                return Branch.orPrimary(current.getInfo().getBranch());
            }
            currentId = current.getParentId();
        }
        return branchOf(parentId, tree);
    }

    // ========================= ORDERING =========================

    private List<String> slotOrder(List<String> ids, PlacementTree tree) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (String id : ids) {
            String parentId = tree.node(id).getParentId();
            groups.computeIfAbsent(parentId == null ? "" : parentId, key -> new ArrayList<>()).add(id);
        }

        List<String> parents = new ArrayList<>(groups.keySet());
        parents.sort(parentGroupOrder(tree));

        Comparator<String> byName = Comparator.comparing((String id) -> nameOf(id, tree)).thenComparing(id -> id);
        List<String> slots = new ArrayList<>();
        for (String parentId : parents) {
            List<String> members = groups.get(parentId);
            members.stream()
                    .filter(id -> tree.node(id).getInfo().getBranch() != Branch.SECONDARY)
                    .sorted(byName)
                    .forEach(id -> addWithLaterals(id, tree, slots));
            members.stream()
                    .filter(id -> tree.node(id).getInfo().getBranch() == Branch.SECONDARY)
                    .sorted(byName)
                    .forEach(id -> addWithLaterals(id, tree, slots));
        }
        return slots;
    }

    private Comparator<String> parentGroupOrder(PlacementTree tree) {
        return Comparator.comparing((String parentId) -> lineageBranch(parentId, tree))
                .thenComparing(parentId -> branchOf(parentId, tree))
                .thenComparing(parentId -> nameOf(parentId, tree))
                .thenComparing(parentId -> parentId);
    }

    /**
     * Left laterals take the slots immediately left of their node, right laterals those to its right.
     */
    private void addWithLaterals(String id, PlacementTree tree, List<String> slots) {
        List<String> left = new ArrayList<>();
        List<String> right = new ArrayList<>();
        for (String lateralId : tree.node(id).getLateralChildren()) {
            LayoutInfo info = tree.node(lateralId).getInfo();
            if (info.getLateralDirection() == LateralDirection.RIGHT) {
                right.add(lateralId);
            } else {
                left.add(lateralId);
            }
        }
        Collections.reverse(left);
        slots.addAll(left);
        slots.add(id);
        slots.addAll(right);
    }

    private Branch branchOf(String id, PlacementTree tree) {
        PlacementNode node = tree.node(id);
        return node == null ? Branch.PRIMARY : Branch.orPrimary(node.getInfo().getBranch());
    }

    private String nameOf(String id, PlacementTree tree) {
        PlacementNode node = tree.node(id);
        if (node == null || node.getInfo().name() == null) return id;
        return node.getInfo().name();
    }
}

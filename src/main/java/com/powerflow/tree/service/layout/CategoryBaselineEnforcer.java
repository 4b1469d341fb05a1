package com.powerflow.tree.service.layout;

import com.powerflow.tree.dto.graph.DiagnosticCode;
import com.powerflow.tree.dto.graph.LayoutDiagnostics;
import com.powerflow.tree.model.layout.LayoutFrame;
import com.powerflow.tree.model.layout.LayoutInfo;
import com.powerflow.tree.model.layout.LevelBaselines;
import com.powerflow.tree.model.layout.PlacementNode;
import com.powerflow.tree.model.layout.PlacementTree;
import com.powerflow.tree.model.layout.Position;
import com.powerflow.tree.model.layout.TypeCategory;
import com.powerflow.tree.service.graph.EquipmentTypes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Snaps equipment families onto shared rows so that, for example, every utility feed of a
 * site lines up regardless of the path it was reached through.
 */
@Service
@Slf4j
public class CategoryBaselineEnforcer {

    /**
     * Alignment families and their row offset from the root, negative offsets upwards.
     * Paired power storage has no fixed offset; it follows its partner.
     */
    public enum AlignmentKey {
        LOOP_GROUP(-2),
        POWER_STORAGE_PAIRED(0),
        DISTRIBUTION_SWITCH(-3),
        GENERATOR(-4),
        TRANSFORMER(-4),
        UTILITY(-5);

        private final int rowOffset;

        AlignmentKey(int rowOffset) {
            this.rowOffset = rowOffset;
        }

        public int getRowOffset() {
            return rowOffset;
        }
    }

    public int enforce(PlacementTree tree, LayoutFrame frame, LevelBaselines baselines,
                       LayoutDiagnostics diagnostics) {
        List<PlacementNode> paired = new ArrayList<>();
        int snapped = 0;

        for (PlacementNode node : tree.nodes()) {
            if (node.getId().equals(tree.getRootId()) || !frame.isPlaced(node.getId())) continue;

            AlignmentKey key = frame.partnerOf(node.getId()) != null
                    ? AlignmentKey.POWER_STORAGE_PAIRED
                    : alignmentKey(node, tree);
            if (key == null) continue;
            if (key == AlignmentKey.POWER_STORAGE_PAIRED) {
                // Partners settle first
                paired.add(node);
                continue;
            }

            int row = baselines.rowForOffset(key.getRowOffset());
            double targetY = baselines.yFor(row);
            if (snap(node.getId(), targetY, row, frame)) {
                snapped++;
                diagnostics.info(DiagnosticCode.CATEGORY_SNAPPED, node.getId(),
                        "Snapped to " + key + " row " + row);
            }
        }

        for (PlacementNode node : paired) {
            String partnerId = frame.partnerOf(node.getId()) != null
                    ? frame.partnerOf(node.getId())
                    : node.getParentId();
            if (partnerId == null || !frame.isPlaced(partnerId)) continue;

            Position partner = frame.position(partnerId);
            if (snap(node.getId(), partner.getY(), frame.row(partnerId), frame)) {
                snapped++;
                diagnostics.info(DiagnosticCode.CATEGORY_SNAPPED, node.getId(),
                        "Snapped to partner " + partnerId);
            }
        }

        log.info("Category alignment snapped {} nodes", snapped);
        return snapped;
    }

    /**
     * Alignment family of a node, or null when the node keeps its level baseline.
     */
    AlignmentKey alignmentKey(PlacementNode node, PlacementTree tree) {
        LayoutInfo info = node.getInfo();
        String type = info.getEquipment().getType();

        if (info.isLoopGroup()) return AlignmentKey.LOOP_GROUP;
        if (info.isLateral()) return AlignmentKey.POWER_STORAGE_PAIRED;
        if (EquipmentTypes.isPowerStorage(type) && node.getParentId() != null) {
            PlacementNode parent = tree.node(node.getParentId());
            if (parent != null && EquipmentTypes.isDistributionSwitch(parent.getInfo().getEquipment().getType())) {
                return AlignmentKey.POWER_STORAGE_PAIRED;
            }
        }
        if (EquipmentTypes.isDistributionSwitch(type)) return AlignmentKey.DISTRIBUTION_SWITCH;

        TypeCategory category = info.getTypeCategory() != null
                ? info.getTypeCategory()
                : EquipmentTypes.categorize(type);
        switch (category) {
            case GENERATOR:
                return AlignmentKey.GENERATOR;
            case TRANSFORMER:
                return AlignmentKey.TRANSFORMER;
            case UTILITY:
                return AlignmentKey.UTILITY;
            default:
                return null;
        }
    }

    private boolean snap(String id, double targetY, int row, LayoutFrame frame) {
        Position current = frame.position(id);
        boolean changed = current.getY() != targetY || frame.row(id) != row;
        frame.move(id, current.withY(targetY));
        frame.assignRow(id, row);
        if (changed) {
            log.debug("Snapped {} to y {} (row {})", id, targetY, row);
        }
        return changed;
    }
}

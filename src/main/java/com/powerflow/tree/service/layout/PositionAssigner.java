package com.powerflow.tree.service.layout;

import com.powerflow.tree.model.LayoutSettings;
import com.powerflow.tree.model.layout.LateralDirection;
import com.powerflow.tree.model.layout.LayoutFrame;
import com.powerflow.tree.model.layout.LayoutInfo;
import com.powerflow.tree.model.layout.LayoutMetrics;
import com.powerflow.tree.model.layout.LevelBaselines;
import com.powerflow.tree.model.layout.PlacementNode;
import com.powerflow.tree.model.layout.PlacementTree;
import com.powerflow.tree.model.layout.Position;
import com.powerflow.tree.model.layout.SubtreeSpan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pre-order coordinate assignment from subtree spans and level baselines.
 *
 * The root sits at the configured centre. Primary children get a block left of their parent,
 * secondary children a block to the right; a lone child with no opposite branch stays centred
 * under its parent. Every node lands on the baseline of its level.
 */
@Service
@Slf4j
public class PositionAssigner {

    private static final double SPLIT_WIDTH_FACTOR = 0.4;

    public LevelBaselines createBaselines(PlacementTree tree, LayoutSettings settings) {
        int rootLevel = tree.node(tree.getRootId()).getInfo().getLevel();
        LevelBaselines baselines = new LevelBaselines(settings.getCenterY(), rootLevel, settings.getLevelSpacing());
        tree.nodes().forEach(node -> baselines.yFor(node.getInfo().getLevel()));
        return baselines;
    }

    public LayoutMetrics computeMetrics(PlacementTree tree, LayoutSettings settings) {
        Map<Integer, Integer> levelCounts = new HashMap<>();
        Integer firstSplitLevel = null;

        for (PlacementNode node : tree.nodes()) {
            LayoutInfo info = node.getInfo();
            if (!info.isLateral()) {
                levelCounts.merge(info.getLevel(), 1, Integer::sum);
            }
            if (node.hasPrimaryChildren() && node.hasSecondaryChildren()
                    && (firstSplitLevel == null || info.getLevel() < firstSplitLevel)) {
                firstSplitLevel = info.getLevel();
            }
        }

        int maxRowCount = Math.max(1, levelCounts.values().stream().mapToInt(Integer::intValue).max().orElse(1));
        double maxRowWidth = maxRowCount <= 1
                ? settings.getNodeWidth()
                : settings.centerSpacing() * (maxRowCount - 1);
        return new LayoutMetrics(maxRowWidth, maxRowCount, firstSplitLevel);
    }

    public LayoutFrame assign(PlacementTree tree, Map<String, SubtreeSpan> spans, LevelBaselines baselines,
                              LayoutMetrics metrics, LayoutSettings settings) {
        LayoutFrame frame = new LayoutFrame();
        PlacementNode root = tree.node(tree.getRootId());
        place(root, settings.getCenterX(), root.getInfo().getLevel(), tree, spans, baselines, metrics, settings,
                frame, new HashSet<>());

        log.info("Assigned initial positions to {} of {} nodes (max row count {}, first split level {})",
                frame.placedIds().size(), tree.size(), metrics.getMaxRowCount(), metrics.getFirstSplitLevel());
        return frame;
    }

    private void place(PlacementNode node, double x, int row, PlacementTree tree, Map<String, SubtreeSpan> spans,
                       LevelBaselines baselines, LayoutMetrics metrics, LayoutSettings settings,
                       LayoutFrame frame, Set<String> visited) {
        if (!visited.add(node.getId())) return;

        frame.place(node.getId(), Position.of(x, baselines.yFor(row)), row);

        boolean hasPrimary = node.hasPrimaryChildren();
        boolean hasSecondary = node.hasSecondaryChildren();

        List<Double> primarySlots = computeGroupSlots(x, spansOf(node.getPrimaryChildren(), spans, settings), -1,
                hasSecondary, computeBranchOffset(node.getInfo(), levelsOf(node.getPrimaryChildren(), tree, node),
                        metrics, settings), settings);
        List<Double> secondarySlots = computeGroupSlots(x, spansOf(node.getSecondaryChildren(), spans, settings), 1,
                hasPrimary, computeBranchOffset(node.getInfo(), levelsOf(node.getSecondaryChildren(), tree, node),
                        metrics, settings), settings);

        for (int i = 0; i < node.getPrimaryChildren().size(); i++) {
            PlacementNode child = tree.node(node.getPrimaryChildren().get(i));
            place(child, primarySlots.get(i), child.getInfo().getLevel(), tree, spans, baselines, metrics, settings,
                    frame, visited);
        }
        for (int i = 0; i < node.getSecondaryChildren().size(); i++) {
            PlacementNode child = tree.node(node.getSecondaryChildren().get(i));
            place(child, secondarySlots.get(i), child.getInfo().getLevel(), tree, spans, baselines, metrics,
                    settings, frame, visited);
        }

        // Provisional slot beside the parent so ancestors above a lateral get positions too
        int left = 0;
        int right = 0;
        for (String lateralId : node.getLateralChildren()) {
            PlacementNode lateral = tree.node(lateralId);
            LateralDirection direction = lateral.getInfo().getLateralDirection() != null
                    ? lateral.getInfo().getLateralDirection()
                    : LateralDirection.LEFT;
            int steps = direction == LateralDirection.LEFT ? ++left : ++right;
            double lateralX = x + direction.sign() * steps * settings.pairingDistance();
            place(lateral, lateralX, row, tree, spans, baselines, metrics, settings, frame, visited);
        }
    }

    /**
     * Horizontal distance between a parent and the near edge of a branch block. Grows with
     * the depth of the branch and widens to a share of the widest row once the tree has split.
     */
    double computeBranchOffset(LayoutInfo info, List<Integer> childLevels, LayoutMetrics metrics,
                               LayoutSettings settings) {
        if (childLevels.isEmpty()) return settings.getBranchOffset();

        int maxChildLevel = Collections.max(childLevels);
        int depthSteps = Math.max(1, maxChildLevel - info.getLevel());
        double offset = settings.getBranchOffset() + depthSteps * settings.getBranchSpreadIncrement();

        if (metrics.getFirstSplitLevel() != null) {
            int relativeLevel = info.getLevel() - metrics.getFirstSplitLevel();
            if (relativeLevel >= 0) {
                double widened = metrics.getMaxRowWidth() * SPLIT_WIDTH_FACTOR
                        + relativeLevel * settings.getBranchSpreadIncrement();
                offset = Math.max(offset, widened);
            }
        }
        return offset;
    }

    /**
     * Centre x of each child in a branch block.
     *
     * @param direction -1 for the primary block left of the parent, 1 for the secondary block
     */
    List<Double> computeGroupSlots(double parentX, List<SubtreeSpan> spans, int direction,
                                   boolean hasOppositeBranch, double branchOffset, LayoutSettings settings) {
        if (spans.isEmpty()) return Collections.emptyList();

        if (spans.size() == 1) {
            if (!hasOppositeBranch) {
                return List.of(parentX);
            }
            double effectiveWidth = Math.min(spans.get(0).getWidth(), settings.centerSpacing());
            return List.of(parentX + direction * (branchOffset + effectiveWidth / 2));
        }

        double groupWidth = SubtreeSpanCalculator.groupWidth(spans, settings);
        double start;
        if (!hasOppositeBranch) {
            start = parentX - groupWidth / 2;
        } else if (direction < 0) {
            start = parentX - branchOffset - groupWidth;
        } else {
            start = parentX + branchOffset;
        }

        List<Double> slots = new ArrayList<>(spans.size());
        double cursor = start;
        for (int i = 0; i < spans.size(); i++) {
            SubtreeSpan span = spans.get(i);
            slots.add(cursor + span.getLeftBias());
            cursor += span.getWidth();
            if (i < spans.size() - 1) {
                cursor += settings.getMinimumGap();
            }
        }
        return slots;
    }

    private List<SubtreeSpan> spansOf(List<String> childIds, Map<String, SubtreeSpan> spans, LayoutSettings settings) {
        return childIds.stream()
                .map(id -> spans.getOrDefault(id, SubtreeSpan.centered(settings.getNodeWidth())))
                .collect(Collectors.toList());
    }

    private List<Integer> levelsOf(List<String> childIds, PlacementTree tree, PlacementNode parent) {
        return childIds.stream()
                .map(id -> tree.contains(id) ? tree.node(id).getInfo().getLevel() : parent.getInfo().getLevel() + 1)
                .collect(Collectors.toList());
    }
}

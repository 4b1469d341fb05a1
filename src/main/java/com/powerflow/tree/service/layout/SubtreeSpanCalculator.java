package com.powerflow.tree.service.layout;

import com.powerflow.tree.dto.graph.DiagnosticCode;
import com.powerflow.tree.dto.graph.LayoutDiagnostics;
import com.powerflow.tree.model.LayoutSettings;
import com.powerflow.tree.model.layout.PlacementNode;
import com.powerflow.tree.model.layout.PlacementTree;
import com.powerflow.tree.model.layout.SubtreeSpan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Post-order computation of the horizontal room each subtree needs.
 *
 * Primary children reserve room left of the node, secondary children room to the right.
 * Lateral children do not contribute; they are paired beside their parent later.
 */
@Service
@Slf4j
public class SubtreeSpanCalculator {

    /** Deepest recursion stack tolerated before falling back to a single node width. */
    public static final int SPAN_VISITED_LIMIT = 50;

    public Map<String, SubtreeSpan> compute(PlacementTree tree, LayoutSettings settings,
                                            LayoutDiagnostics diagnostics) {
        Map<String, SubtreeSpan> spans = new HashMap<>();
        span(tree.getRootId(), tree, settings, spans, new LinkedHashSet<>(), diagnostics);

        // Subtrees hanging off laterals are not reached through the primary/secondary groups
        for (PlacementNode node : tree.nodes()) {
            if (!spans.containsKey(node.getId())) {
                span(node.getId(), tree, settings, spans, new LinkedHashSet<>(), diagnostics);
            }
        }

        log.info("Computed subtree spans for {} nodes, root width {}", spans.size(),
                spans.get(tree.getRootId()).getWidth());
        return spans;
    }

    /**
     * Combined footprint of sibling spans including the gaps between them.
     */
    public static double groupWidth(List<SubtreeSpan> spans, LayoutSettings settings) {
        if (spans.isEmpty()) return 0;
        double total = spans.stream().mapToDouble(SubtreeSpan::getWidth).sum();
        return total + (spans.size() - 1) * settings.getMinimumGap();
    }

    private SubtreeSpan span(String nodeId, PlacementTree tree, LayoutSettings settings,
                             Map<String, SubtreeSpan> spans, Set<String> visiting,
                             LayoutDiagnostics diagnostics) {
        SubtreeSpan known = spans.get(nodeId);
        if (known != null) return known;

        SubtreeSpan single = SubtreeSpan.centered(settings.getNodeWidth());
        PlacementNode node = tree.node(nodeId);
        if (node == null) {
            spans.put(nodeId, single);
            return single;
        }

        if (visiting.contains(nodeId) || visiting.size() >= SPAN_VISITED_LIMIT) {
            log.warn("Span recursion guard hit at {} (stack depth {}), using a single node width",
                    nodeId, visiting.size());
            diagnostics.warn(DiagnosticCode.SPAN_RECURSION_GUARD, nodeId,
                    "Span recursion guard hit, fallback footprint used");
            spans.put(nodeId, single);
            return single;
        }

        visiting.add(nodeId);
        double primaryWidth = groupWidth(childSpans(node.getPrimaryChildren(), tree, settings, spans, visiting,
                diagnostics), settings);
        double secondaryWidth = groupWidth(childSpans(node.getSecondaryChildren(), tree, settings, spans, visiting,
                diagnostics), settings);
        visiting.remove(nodeId);

        double halfNode = settings.getNodeWidth() / 2;
        SubtreeSpan span;
        if (node.getInfo().isLoopGroup()) {
            double constrained = Math.max(settings.getNodeWidth(),
                    Math.min(settings.getNodeWidth() * 3, Math.max(primaryWidth, secondaryWidth)));
            span = SubtreeSpan.centered(constrained);
        } else {
            span = SubtreeSpan.of(Math.max(halfNode, primaryWidth), Math.max(halfNode, secondaryWidth));
        }

        spans.put(nodeId, span);
        log.debug("Span of {}: width {} (left {}, right {})", nodeId, span.getWidth(), span.getLeftBias(),
                span.getRightBias());
        return span;
    }

    private List<SubtreeSpan> childSpans(List<String> childIds, PlacementTree tree, LayoutSettings settings,
                                         Map<String, SubtreeSpan> spans, Set<String> visiting,
                                         LayoutDiagnostics diagnostics) {
        return childIds.stream()
                .map(childId -> span(childId, tree, settings, spans, visiting, diagnostics))
                .collect(Collectors.toList());
    }
}

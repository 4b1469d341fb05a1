package com.powerflow.tree.service;

import com.powerflow.tree.dto.graph.EquipmentSummary;
import com.powerflow.tree.dto.graph.LayoutDiagnostics;
import com.powerflow.tree.dto.graph.LayoutEdge;
import com.powerflow.tree.dto.graph.PositionedNode;
import com.powerflow.tree.dto.graph.PowerFlowTreeResponse;
import com.powerflow.tree.dto.graph.ValidationReport;
import com.powerflow.tree.exception.EquipmentNotFoundException;
import com.powerflow.tree.exception.InvalidLayoutConfigurationException;
import com.powerflow.tree.model.ConnectionRecord;
import com.powerflow.tree.model.EquipmentNode;
import com.powerflow.tree.model.LayoutSettings;
import com.powerflow.tree.model.graph.ConnectionMap;
import com.powerflow.tree.model.graph.Direction;
import com.powerflow.tree.model.graph.EquipmentOccurrence;
import com.powerflow.tree.model.layout.LayoutFrame;
import com.powerflow.tree.model.layout.LayoutMetrics;
import com.powerflow.tree.model.layout.LevelBaselines;
import com.powerflow.tree.model.layout.PlacementTree;
import com.powerflow.tree.model.layout.SubtreeSpan;
import com.powerflow.tree.service.graph.ConnectionGraphBuilder;
import com.powerflow.tree.service.graph.ConsolidationPolicy;
import com.powerflow.tree.service.graph.CoverageCompleter;
import com.powerflow.tree.service.graph.EquipmentCatalog;
import com.powerflow.tree.service.graph.EquipmentConsolidator;
import com.powerflow.tree.service.graph.EquipmentWalker;
import com.powerflow.tree.service.graph.LoopGroupDetector;
import com.powerflow.tree.service.layout.CategoryBaselineEnforcer;
import com.powerflow.tree.service.layout.CollisionResolver;
import com.powerflow.tree.service.layout.DownstreamRowLayout;
import com.powerflow.tree.service.layout.LateralPlacer;
import com.powerflow.tree.service.layout.LayoutValidator;
import com.powerflow.tree.service.layout.LevelNormalizer;
import com.powerflow.tree.service.layout.PlacementTreeBuilder;
import com.powerflow.tree.service.layout.PositionAssigner;
import com.powerflow.tree.service.layout.StoragePairTightener;
import com.powerflow.tree.service.layout.SubtreeSpanCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Entry point of the layout engine: turns connection records and a selected equipment id into
 * a positioned, classified power flow tree.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PowerFlowTreeService {

    private final ConnectionGraphBuilder connectionGraphBuilder;
    private final EquipmentWalker equipmentWalker;
    private final EquipmentConsolidator equipmentConsolidator;
    private final LoopGroupDetector loopGroupDetector;
    private final CoverageCompleter coverageCompleter;
    private final EquipmentCatalog equipmentCatalog;
    private final PlacementTreeBuilder placementTreeBuilder;
    private final SubtreeSpanCalculator subtreeSpanCalculator;
    private final PositionAssigner positionAssigner;
    private final LevelNormalizer levelNormalizer;
    private final LateralPlacer lateralPlacer;
    private final CollisionResolver collisionResolver;
    private final StoragePairTightener storagePairTightener;
    private final CategoryBaselineEnforcer categoryBaselineEnforcer;
    private final DownstreamRowLayout downstreamRowLayout;
    private final LayoutValidator layoutValidator;
    private final TreeElementGenerator treeElementGenerator;
    private final LayoutSettings layoutSettings;
    private final ConsolidationPolicy consolidationPolicy;

    /**
     * Generate the tree with the configured layout settings.
     */
    public PowerFlowTreeResponse generateTree(String equipmentId, List<ConnectionRecord> records) {
        return generateTree(equipmentId, records, layoutSettings);
    }

    /**
     * Generate the tree for {@code equipmentId}.
     *
     * @throws InvalidLayoutConfigurationException when a spacing constant is not positive
     * @throws EquipmentNotFoundException          when no record mentions the id
     */
    public PowerFlowTreeResponse generateTree(String equipmentId, List<ConnectionRecord> records,
                                              LayoutSettings settings) {
        log.info("Generating power flow tree for equipment: {}", equipmentId);
        try {
            settings.validate();
            LayoutDiagnostics diagnostics = new LayoutDiagnostics();

            // ---- graph ----
            List<ConnectionRecord> sanitized = connectionGraphBuilder.sanitize(records, diagnostics);
            ConnectionMap connectionMap = connectionGraphBuilder.build(sanitized);
            EquipmentNode root = connectionGraphBuilder.findEquipment(equipmentId, sanitized);

            List<EquipmentOccurrence> upstreamOccurrences = equipmentWalker.walk(equipmentId, Direction.UPSTREAM,
                    connectionMap, settings.getMaxTraversalDepth(), diagnostics);
            List<EquipmentOccurrence> downstreamOccurrences = equipmentWalker.walk(equipmentId,
                    Direction.DOWNSTREAM, connectionMap, settings.getMaxTraversalDepth(), diagnostics);

            List<EquipmentNode> upstream = equipmentConsolidator.consolidate(upstreamOccurrences, consolidationPolicy);
            List<EquipmentNode> downstream = equipmentConsolidator.consolidate(downstreamOccurrences,
                    consolidationPolicy);

            upstream = loopGroupDetector.detect(upstream, connectionMap, equipmentId, diagnostics);
            downstream = loopGroupDetector.detect(downstream, connectionMap, equipmentId, diagnostics);
            upstream = coverageCompleter.complete(root, upstream, connectionMap, settings.getMaxTraversalDepth(),
                    diagnostics);

            // ---- layout ----
            PlacementTree tree = placementTreeBuilder.build(root, upstream, connectionMap, diagnostics);
            Map<String, SubtreeSpan> spans = subtreeSpanCalculator.compute(tree, settings, diagnostics);
            LayoutMetrics metrics = positionAssigner.computeMetrics(tree, settings);
            LevelBaselines baselines = positionAssigner.createBaselines(tree, settings);

            LayoutFrame frame = positionAssigner.assign(tree, spans, baselines, metrics, settings);
            levelNormalizer.normalize(tree, frame, settings);
            lateralPlacer.place(tree, frame, settings);

            frame.captureAnchors();
            collisionResolver.resolve(tree, frame, settings, diagnostics);
            if (storagePairTightener.tighten(tree, frame, connectionMap, settings) > 0) {
                collisionResolver.resolve(tree, frame, settings, diagnostics);
            }
            lateralPlacer.place(tree, frame, settings);
            categoryBaselineEnforcer.enforce(tree, frame, baselines, diagnostics);
            collisionResolver.separateResidualOverlaps(tree, frame, settings, diagnostics);

            List<String> downstreamPlaced = downstreamRowLayout.layout(downstream, frame, baselines, settings,
                    diagnostics);
            ValidationReport report = layoutValidator.validate(frame, baselines, settings, diagnostics);

            // ---- output ----
            List<PositionedNode> nodes = treeElementGenerator.generateNodes(root, tree, frame, downstream,
                    downstreamPlaced);
            List<LayoutEdge> edges = treeElementGenerator.generateEdges(root, tree, frame, downstream,
                    downstreamPlaced, connectionMap);

            log.info("Power flow tree for {} generated: {} nodes, {} edges, {} upstream, {} downstream, valid={}",
                    equipmentId, nodes.size(), edges.size(), upstream.size(), downstream.size(), report.isValid());

            return PowerFlowTreeResponse.builder()
                    .nodes(nodes)
                    .edges(edges)
                    .selectedEquipment(root)
                    .upstream(upstream)
                    .downstream(downstream)
                    .diagnostics(diagnostics)
                    .build();
        } catch (EquipmentNotFoundException | InvalidLayoutConfigurationException ex) {
            log.warn("Cannot generate power flow tree for {}: {}", equipmentId, ex.getMessage());
            throw ex;
        } catch (Exception ex) {
            log.error("Unexpected error generating power flow tree for {}", equipmentId, ex);
            throw ex;
        }
    }

    public List<EquipmentSummary> listEquipment(List<ConnectionRecord> records) {
        return equipmentCatalog.listEquipment(records);
    }
}

package com.powerflow.tree.service;

import com.powerflow.tree.ConnectionFixtures;
import com.powerflow.tree.dto.graph.DiagnosticCode;
import com.powerflow.tree.dto.graph.EdgeKind;
import com.powerflow.tree.dto.graph.LayoutEdge;
import com.powerflow.tree.dto.graph.PositionedNode;
import com.powerflow.tree.dto.graph.PowerFlowTreeResponse;
import com.powerflow.tree.exception.EquipmentNotFoundException;
import com.powerflow.tree.model.ConnectionRecord;
import com.powerflow.tree.model.ConnectionType;
import com.powerflow.tree.model.EquipmentNode;
import com.powerflow.tree.model.LayoutSettings;
import com.powerflow.tree.model.layout.Position;
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
import com.powerflow.tree.service.layout.LayoutGeometry;
import com.powerflow.tree.service.layout.LayoutValidator;
import com.powerflow.tree.service.layout.LevelNormalizer;
import com.powerflow.tree.service.layout.PlacementTreeBuilder;
import com.powerflow.tree.service.layout.PositionAssigner;
import com.powerflow.tree.service.layout.StoragePairTightener;
import com.powerflow.tree.service.layout.SubtreeSpanCalculator;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Whole-pipeline runs over small sites, wired without a Spring context.
 */
class PowerFlowTreeScenarioTest {

    private final LayoutSettings settings = LayoutSettings.defaults();

    private final PowerFlowTreeService service = new PowerFlowTreeService(
            new ConnectionGraphBuilder(),
            new EquipmentWalker(),
            new EquipmentConsolidator(),
            new LoopGroupDetector(),
            new CoverageCompleter(),
            new EquipmentCatalog(),
            new PlacementTreeBuilder(),
            new SubtreeSpanCalculator(),
            new PositionAssigner(),
            new LevelNormalizer(),
            new LateralPlacer(),
            new CollisionResolver(),
            new StoragePairTightener(),
            new CategoryBaselineEnforcer(),
            new DownstreamRowLayout(),
            new LayoutValidator(),
            new TreeElementGenerator(),
            settings,
            ConsolidationPolicy.standard());

    @Test
    void splitsPrimaryAndSecondaryFeedsAroundSelectedEquipment() {
        List<ConnectionRecord> records = ConnectionFixtures.site()
                .feed("P1", "PANEL", "R", "PDU", "S1")
                .feed("P2", "PANEL", "R", "PDU", "S2")
                .records();

        PowerFlowTreeResponse response = service.generateTree("R", records);

        Map<String, PositionedNode> nodes = byId(response.getNodes());
        assertThat(nodes.keySet()).containsExactly("R", "P1", "P2");
        assertThat(position(nodes.get("R"))).isEqualTo(Position.of(400, 300));
        assertThat(position(nodes.get("P1"))).isEqualTo(Position.of(210, 150));
        assertThat(position(nodes.get("P2"))).isEqualTo(Position.of(590, 150));
        assertThat(nodes.get("R").getStyleClass()).isEqualTo(PositionedNode.STYLE_SELECTED);
        assertThat(nodes.get("P1").getStyleClass()).isEqualTo(PositionedNode.STYLE_PRIMARY);
        assertThat(nodes.get("P2").getStyleClass()).isEqualTo(PositionedNode.STYLE_SECONDARY);
        assertThat(nodes.get("P1").getLabel()).isEqualTo("P1\nPANEL");

        Map<String, LayoutEdge> edges = edgesById(response.getEdges());
        assertThat(edges.keySet()).containsExactly("R-P1", "R-P2");
        assertThat(edges.get("R-P1").getSourceLabel()).isEqualTo("S1");
        assertThat(edges.get("R-P2").getClassification()).isEqualTo(ConnectionType.REDUNDANT);
        assertThat(response.getDiagnostics().getValidation().isValid()).isTrue();
    }

    @Test
    void pairsUpsBesideTheSwitchItServes() {
        List<ConnectionRecord> records = ConnectionFixtures.site()
                .feed("MDS-1", "MDS", "R", "PDU", "S1")
                .feed("UPS-1", "UPS", "MDS-1", "MDS", "S1")
                .feed("U-1", "UTILITY", "UPS-1", "UPS", "S1")
                .records();

        PowerFlowTreeResponse response = service.generateTree("R", records);

        Map<String, PositionedNode> nodes = byId(response.getNodes());
        PositionedNode mds = nodes.get("MDS-1");
        PositionedNode ups = nodes.get("UPS-1");
        assertThat(ups.getX()).isEqualTo(mds.getX() - settings.pairingDistance());
        assertThat(ups.getY()).isEqualTo(mds.getY());
        assertThat(mds.getY()).isEqualTo(300 - 3 * 150);
        assertThat(nodes.get("U-1").getY()).isEqualTo(300 - 5 * 150);

        assertThat(response.getEdges())
                .filteredOn(edge -> edge.getKind() == EdgeKind.LATERAL_RETURN)
                .extracting(LayoutEdge::getId)
                .containsExactly("lateral-return-UPS-1-MDS-1");
    }

    @Test
    void pullsStorageBesideTheSwitchFeedingIt_whenTheTreeDidNotPairThem() {
        List<ConnectionRecord> records = ConnectionFixtures.site()
                .feed("UPS-1", "UPS", "R", "PDU", "S1")
                .feed("MDS-1", "MDS", "UPS-1", "UPS", "S1")
                .feed("U-1", "UTILITY", "MDS-1", "MDS", "S1")
                .records();

        PowerFlowTreeResponse response = service.generateTree("R", records);

        Map<String, PositionedNode> nodes = byId(response.getNodes());
        PositionedNode mds = nodes.get("MDS-1");
        PositionedNode ups = nodes.get("UPS-1");
        assertThat(mds.getY()).isEqualTo(300 - 3 * 150);
        assertThat(ups.getY()).isEqualTo(mds.getY());
        assertThat(ups.getX()).isEqualTo(mds.getX() - settings.pairingDistance());
        assertThat(response.getDiagnostics().getValidation().isValid()).isTrue();
        assertNoCollisions(response);
    }

    @Test
    void keepsPanelsWhoseNamesMerelyContainRingApart() {
        List<ConnectionRecord> records = ConnectionFixtures.site()
                .feed("MONITORING-PNL-1", "PANEL", "PDU-1", "PDU", "S1")
                .feed("MONITORING-PNL-2", "PANEL", "PDU-1", "PDU", "S2")
                .records();

        PowerFlowTreeResponse response = service.generateTree("PDU-1", records);

        assertThat(byId(response.getNodes()).keySet())
                .containsExactly("PDU-1", "MONITORING-PNL-1", "MONITORING-PNL-2");
        assertThat(response.getUpstream()).noneMatch(EquipmentNode::isLoopGroup);
    }

    @Test
    void collapsesRingMembersIntoOneLoopNode() {
        List<ConnectionRecord> records = ConnectionFixtures.site()
                .feed("SW", "SWBD", "R", "PDU", "S1")
                .feed("RING-A-1", "RMU", "SW", "SWBD", "S1")
                .feed("RING-A-3", "RMU", "SW", "SWBD", "S2")
                .records();

        PowerFlowTreeResponse response = service.generateTree("R", records);

        Map<String, PositionedNode> nodes = byId(response.getNodes());
        assertThat(nodes.keySet()).containsExactly("R", "SW", "loop-RING-A");
        PositionedNode loop = nodes.get("loop-RING-A");
        assertThat(loop.getLabel()).isEqualTo("RING-A-1 ↔ RING-A-3\nRING BUS");
        assertThat(loop.getStyleClass()).isEqualTo(PositionedNode.STYLE_LOOP_GROUP);
        assertThat(loop.getY()).isEqualTo(300 - 2 * 150);

        assertThat(response.getUpstream())
                .filteredOn(EquipmentNode::isAbsorbed)
                .extracting(EquipmentNode::getId)
                .containsExactlyInAnyOrder("RING-A-1", "RING-A-3");
        assertThat(edgesById(response.getEdges())).containsKey("SW-loop-RING-A");
    }

    @Test
    void stopsTraversalAtTenHops() {
        ConnectionFixtures site = ConnectionFixtures.site().feed("N1", "PANEL", "R", "PDU", "S1");
        for (int i = 2; i <= 11; i++) {
            site.feed("N" + i, "PANEL", "N" + (i - 1), "PANEL", "S1");
        }

        PowerFlowTreeResponse response = service.generateTree("R", site.records());

        Map<String, PositionedNode> nodes = byId(response.getNodes());
        assertThat(nodes).containsKey("N10").doesNotContainKey("N11");
        assertThat(nodes.get("N10").getY()).isEqualTo(300 - 10 * 150);
        assertThat(response.getDiagnostics().eventsWith(DiagnosticCode.DEPTH_CEILING_REACHED))
                .extracting(event -> event.getSubjectId())
                .containsExactly("N10");
    }

    @Test
    void keepsBothAncestriesOfABypassedUps_andDrawsTheBypassEdge() {
        List<ConnectionRecord> records = ConnectionFixtures.site()
                .feed("A", "UPS", "R", "PDU", "S1")
                .feed("B", "PANEL", "R", "PDU", "S2")
                .feed("A", "UPS", "B", "PANEL", "S2")
                .feed("UA", "UTILITY", "A", "UPS", "S1")
                .feed("UB", "UTILITY", "B", "PANEL", "S1")
                .records();

        PowerFlowTreeResponse response = service.generateTree("R", records);

        assertThat(response.getUpstream()).extracting(EquipmentNode::getId).contains("A", "B", "UA", "UB");
        Map<String, PositionedNode> nodes = byId(response.getNodes());
        assertThat(nodes.get("UA").getY()).isEqualTo(nodes.get("UB").getY());

        LayoutEdge bypass = edgesById(response.getEdges()).get("bypass-B-A-bypass-0");
        assertThat(bypass).isNotNull();
        assertThat(bypass.getKind()).isEqualTo(EdgeKind.ALTERNATE);
        assertThat(bypass.getClassification()).isEqualTo(ConnectionType.BYPASS);
        assertThat(bypass.getSourceId()).isEqualTo("B");
        assertThat(bypass.getTargetId()).isEqualTo("A");
        assertNoCollisions(response);
    }

    @Test
    void laysOutSiteWithoutCollisions_andReportsDegradedRecords() {
        PowerFlowTreeResponse response = service.generateTree("PDU-1", ConnectionFixtures.load("/fixtures/site-a.json"));

        Map<String, PositionedNode> nodes = byId(response.getNodes());
        assertThat(response.getNodes().get(0).getId()).isEqualTo("PDU-1");
        assertThat(nodes).containsKey("loop-RING-A").doesNotContainKeys("RING-A-1", "RING-A-3");

        assertThat(nodes.get("UPS-M").getX()).isEqualTo(nodes.get("MDS-A").getX() - settings.pairingDistance());
        assertThat(nodes.get("UPS-M").getY()).isEqualTo(nodes.get("MDS-A").getY());
        assertThat(nodes.get("UPS-B").getY()).isEqualTo(nodes.get("MDS-B").getY());
        assertThat(nodes.get("UTIL-1").getY())
                .isEqualTo(nodes.get("UTIL-2").getY())
                .isEqualTo(nodes.get("UTIL-3").getY());

        assertThat(response.getNodes())
                .filteredOn(node -> PositionedNode.STYLE_DOWNSTREAM.equals(node.getStyleClass()))
                .extracting(PositionedNode::getId)
                .containsExactlyInAnyOrder("RPP-1", "RPP-2", "RACK-1", "RACK-2");
        assertThat(nodes.get("RPP-1").getY()).isEqualTo(450);
        assertThat(nodes.get("RACK-1").getY()).isEqualTo(600);
        assertThat(edgesById(response.getEdges()).get("PDU-1-RPP-1").getKind()).isEqualTo(EdgeKind.DOWNSTREAM);

        assertThat(response.getDiagnostics().eventsWith(DiagnosticCode.MALFORMED_RECORD))
                .extracting(event -> event.getSubjectId())
                .containsExactly("c-16");
        assertThat(response.getDiagnostics().getValidation().isValid()).isTrue();
        assertNoCollisions(response);
    }

    @Test
    void producesIdenticalOutputForIdenticalInput() {
        PowerFlowTreeResponse first = service.generateTree("PDU-1", ConnectionFixtures.load("/fixtures/site-a.json"));
        PowerFlowTreeResponse second = service.generateTree("PDU-1", ConnectionFixtures.load("/fixtures/site-a.json"));

        assertThat(second.getNodes()).isEqualTo(first.getNodes());
        assertThat(second.getEdges()).isEqualTo(first.getEdges());
    }

    @Test
    void failsForUnknownEquipment() {
        List<ConnectionRecord> records = ConnectionFixtures.load("/fixtures/site-a.json");

        assertThatThrownBy(() -> service.generateTree("NOPE", records))
                .isInstanceOf(EquipmentNotFoundException.class)
                .hasMessage("Equipment with ID NOPE not found");
    }

    private void assertNoCollisions(PowerFlowTreeResponse response) {
        Map<String, Position> positions = new LinkedHashMap<>();
        response.getNodes().forEach(node -> positions.put(node.getId(), position(node)));
        assertThat(LayoutGeometry.findAllCollisions(positions, settings)).isEmpty();
    }

    private static Position position(PositionedNode node) {
        return Position.of(node.getX(), node.getY());
    }

    private static Map<String, PositionedNode> byId(List<PositionedNode> nodes) {
        return nodes.stream().collect(Collectors.toMap(PositionedNode::getId, node -> node,
                (a, b) -> a, LinkedHashMap::new));
    }

    private static Map<String, LayoutEdge> edgesById(List<LayoutEdge> edges) {
        return edges.stream().collect(Collectors.toMap(LayoutEdge::getId, edge -> edge,
                (a, b) -> a, LinkedHashMap::new));
    }
}

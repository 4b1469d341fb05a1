package com.powerflow.tree.service.graph;

import com.powerflow.tree.ConnectionFixtures;
import com.powerflow.tree.dto.graph.DiagnosticCode;
import com.powerflow.tree.dto.graph.LayoutDiagnostics;
import com.powerflow.tree.model.EquipmentNode;
import com.powerflow.tree.model.graph.ConnectionMap;
import com.powerflow.tree.model.graph.ConnectionRelation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CoverageCompleterTest {

    private final ConnectionGraphBuilder graphBuilder = new ConnectionGraphBuilder();
    private final CoverageCompleter completer = new CoverageCompleter();

    private final EquipmentNode root = EquipmentNode.builder().id("R").name("R").type("PANEL").level(0).build();

    @Test
    void restoresAncestorMissingFromTraversal() {
        ConnectionMap map = graphBuilder.build(ConnectionFixtures.site()
                .feed("A", "PANEL", "R", "PANEL", "S1")
                .feed("U", "UTILITY", "A", "PANEL", "S2")
                .records());
        EquipmentNode a = EquipmentNode.builder().id("A").name("A").type("PANEL").level(1).parentId("R").build();
        LayoutDiagnostics diagnostics = new LayoutDiagnostics();

        List<EquipmentNode> completed = completer.complete(root, new ArrayList<>(List.of(a)), map, 10, diagnostics);

        EquipmentNode restored = find(completed, "U").orElseThrow();
        assertThat(restored.isSynthesized()).isTrue();
        assertThat(restored.getName()).isEqualTo("U");
        assertThat(restored.getLevel()).isEqualTo(2);
        assertThat(restored.getParentId()).isEqualTo("A");
        assertThat(restored.getSourceLabel()).isEqualTo("S2");
        assertThat(diagnostics.eventsWith(DiagnosticCode.ANCESTOR_RESTORED))
                .extracting(event -> event.getSubjectId()).containsExactly("U");
    }

    @Test
    void unionsParentsIntoExistingEquipment() {
        ConnectionMap map = graphBuilder.build(ConnectionFixtures.site()
                .feed("A", "PANEL", "R", "PANEL", "S1")
                .feed("B", "PANEL", "R", "PANEL", "S2")
                .feed("U", "UTILITY", "A", "PANEL", "S1")
                .feed("U", "UTILITY", "B", "PANEL", "S2")
                .records());
        EquipmentNode a = EquipmentNode.builder().id("A").name("A").type("PANEL").level(1).parentId("R").build();
        EquipmentNode b = EquipmentNode.builder().id("B").name("B").type("PANEL").level(1).parentId("R").build();
        EquipmentNode u = EquipmentNode.builder().id("U").name("U").type("UTILITY").level(2).parentId("A").build();

        List<EquipmentNode> completed = completer.complete(root, new ArrayList<>(List.of(a, b, u)), map, 10,
                new LayoutDiagnostics());

        assertThat(completed).hasSize(3);
        assertThat(u.getParentIds()).containsExactly("A", "B");
        assertThat(u.getSources()).contains("S1", "S2");
        assertThat(u.getParentId()).isEqualTo("A");
    }

    @Test
    void honoursDepthCeiling() {
        ConnectionMap map = graphBuilder.build(ConnectionFixtures.site()
                .feed("A", "PANEL", "R", "PANEL", "S1")
                .feed("B", "PANEL", "A", "PANEL", "S1")
                .feed("C", "PANEL", "B", "PANEL", "S1")
                .records());

        List<EquipmentNode> completed = completer.complete(root, new ArrayList<>(), map, 2, new LayoutDiagnostics());

        assertThat(completed).extracting(EquipmentNode::getId).containsExactly("A", "B");
    }

    @Test
    void synthesizedPlaceholdersUseUnknownNames_whenRelationHasNone() {
        ConnectionMap map = new ConnectionMap();
        map.getOrCreate("R").getUpstream().add(ConnectionRelation.builder()
                .id("Q")
                .sourceLabel("S1")
                .build());

        List<EquipmentNode> completed = completer.complete(root, new ArrayList<>(), map, 10, new LayoutDiagnostics());

        assertThat(completed).hasSize(1);
        assertThat(completed.get(0).getName()).isEqualTo(CoverageCompleter.UNKNOWN_NAME);
        assertThat(completed.get(0).getType()).isEqualTo(CoverageCompleter.UNKNOWN_TYPE);
    }

    private static Optional<EquipmentNode> find(List<EquipmentNode> nodes, String id) {
        return nodes.stream().filter(node -> node.getId().equals(id)).findFirst();
    }
}

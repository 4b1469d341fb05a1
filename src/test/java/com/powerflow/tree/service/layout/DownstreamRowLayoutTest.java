package com.powerflow.tree.service.layout;

import com.powerflow.tree.dto.graph.DiagnosticCode;
import com.powerflow.tree.dto.graph.LayoutDiagnostics;
import com.powerflow.tree.model.EquipmentNode;
import com.powerflow.tree.model.LayoutSettings;
import com.powerflow.tree.model.layout.LayoutFrame;
import com.powerflow.tree.model.layout.LevelBaselines;
import com.powerflow.tree.model.layout.Position;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DownstreamRowLayoutTest {

    private final DownstreamRowLayout layout = new DownstreamRowLayout();
    private final LayoutSettings settings = LayoutSettings.defaults();
    private final LevelBaselines baselines = new LevelBaselines(300, 0, 150);

    @Test
    void centresEachRowBelowTheSelectedEquipment() {
        LayoutFrame frame = new LayoutFrame();
        frame.place("R", Position.of(400, 300), 0);
        List<EquipmentNode> downstream = List.of(
                node("D1", 1, "R"), node("D2", 1, "R"), node("D3", 2, "D1"));

        List<String> placed = layout.layout(downstream, frame, baselines, settings, new LayoutDiagnostics());

        assertThat(placed).containsExactly("D1", "D2", "D3");
        assertThat(frame.position("D1")).isEqualTo(Position.of(210, 450));
        assertThat(frame.position("D2")).isEqualTo(Position.of(590, 450));
        assertThat(frame.position("D3")).isEqualTo(Position.of(400, 600));
        assertThat(frame.row("D3")).isEqualTo(-2);
    }

    @Test
    void skipsNodesAlreadyRenderedAbove_andAbsorbedMembers() {
        LayoutFrame frame = new LayoutFrame();
        frame.place("R", Position.of(400, 300), 0);
        frame.place("P", Position.of(400, 150), 1);
        EquipmentNode absorbed = node("RING-A-1", 1, "R");
        absorbed.setAbsorbedBy("loop-RING-A");
        LayoutDiagnostics diagnostics = new LayoutDiagnostics();

        List<String> placed = layout.layout(List.of(node("P", 1, "R"), absorbed, node("D1", 1, "R")), frame,
                baselines, settings, diagnostics);

        assertThat(placed).containsExactly("D1");
        assertThat(frame.position("P")).isEqualTo(Position.of(400, 150));
        assertThat(frame.position("D1")).isEqualTo(Position.of(400, 450));
        assertThat(diagnostics.eventsWith(DiagnosticCode.DUPLICATE_NODE_SKIPPED)).hasSize(1);
    }

    private EquipmentNode node(String id, int level, String parentId) {
        return EquipmentNode.builder()
                .id(id)
                .name(id)
                .type("RPP")
                .level(level)
                .parentId(parentId)
                .build();
    }
}

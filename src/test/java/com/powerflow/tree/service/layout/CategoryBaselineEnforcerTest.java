package com.powerflow.tree.service.layout;

import com.powerflow.tree.dto.graph.DiagnosticCode;
import com.powerflow.tree.dto.graph.LayoutDiagnostics;
import com.powerflow.tree.model.Branch;
import com.powerflow.tree.model.layout.LateralDirection;
import com.powerflow.tree.model.layout.LayoutFrame;
import com.powerflow.tree.model.layout.LevelBaselines;
import com.powerflow.tree.model.layout.PlacementTree;
import com.powerflow.tree.model.layout.Position;
import com.powerflow.tree.service.layout.CategoryBaselineEnforcer.AlignmentKey;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CategoryBaselineEnforcerTest {

    private final CategoryBaselineEnforcer enforcer = new CategoryBaselineEnforcer();
    private final LevelBaselines baselines = new LevelBaselines(300, 0, 150);

    @Test
    void snapsUtilityToItsFamilyRow_whateverItsDepth() {
        PlacementTree tree = TestTrees.rootedAt("R", "PDU")
                .primary("R", "U-1", "UTILITY")
                .build();
        LayoutFrame frame = new LayoutFrame();
        frame.place("R", Position.of(400, 300), 0);
        frame.place("U-1", Position.of(400, 150), 1);
        LayoutDiagnostics diagnostics = new LayoutDiagnostics();

        int snapped = enforcer.enforce(tree, frame, baselines, diagnostics);

        assertThat(snapped).isEqualTo(1);
        assertThat(frame.row("U-1")).isEqualTo(5);
        assertThat(frame.position("U-1")).isEqualTo(Position.of(400, -450));
        assertThat(diagnostics.eventsWith(DiagnosticCode.CATEGORY_SNAPPED)).hasSize(1);
    }

    @Test
    void neverMovesTheRoot() {
        PlacementTree tree = TestTrees.rootedAt("U-0", "UTILITY").build();
        LayoutFrame frame = new LayoutFrame();
        frame.place("U-0", Position.of(400, 300), 0);

        enforcer.enforce(tree, frame, baselines, new LayoutDiagnostics());

        assertThat(frame.position("U-0")).isEqualTo(Position.of(400, 300));
        assertThat(frame.row("U-0")).isZero();
    }

    @Test
    void pairedStorageFollowsItsPartner() {
        PlacementTree tree = TestTrees.rootedAt("R", "PDU")
                .primary("R", "MDS-1", "MDS")
                .lateral("MDS-1", "UPS-1", "UPS", LateralDirection.LEFT)
                .build();
        LayoutFrame frame = new LayoutFrame();
        frame.place("R", Position.of(400, 300), 0);
        frame.place("MDS-1", Position.of(400, 150), 1);
        frame.place("UPS-1", Position.of(20, 150), 1);

        enforcer.enforce(tree, frame, baselines, new LayoutDiagnostics());

        assertThat(frame.position("MDS-1").getY()).isEqualTo(-150);
        assertThat(frame.row("MDS-1")).isEqualTo(3);
        assertThat(frame.position("UPS-1")).isEqualTo(Position.of(20, -150));
        assertThat(frame.row("UPS-1")).isEqualTo(3);
    }

    @Test
    void storagePairedOutsideTheTreeFollowsItsSwitch() {
        PlacementTree tree = TestTrees.rootedAt("R", "PDU")
                .primary("R", "UPS-1", "UPS")
                .primary("UPS-1", "MDS-1", "MDS")
                .build();
        LayoutFrame frame = new LayoutFrame();
        frame.place("R", Position.of(400, 300), 0);
        frame.place("MDS-1", Position.of(400, 0), 2);
        frame.place("UPS-1", Position.of(20, 0), 2);
        frame.pair("UPS-1", "MDS-1");

        enforcer.enforce(tree, frame, baselines, new LayoutDiagnostics());

        assertThat(frame.position("MDS-1")).isEqualTo(Position.of(400, -150));
        assertThat(frame.position("UPS-1")).isEqualTo(Position.of(20, -150));
        assertThat(frame.row("UPS-1")).isEqualTo(3);
    }

    @Test
    void alignmentKeyByFamily() {
        PlacementTree tree = TestTrees.rootedAt("R", "PDU")
                .primary("R", "SWGR-1", "SWGR")
                .primary("SWGR-1", "UPS-2", "UPS")
                .loop("R", "loop-1", Branch.SECONDARY)
                .primary("loop-1", "TX-1", "TX")
                .primary("TX-1", "GEN-1", "GENERATOR")
                .primary("R", "P-1", "PANEL")
                .build();

        assertThat(enforcer.alignmentKey(tree.node("SWGR-1"), tree)).isEqualTo(AlignmentKey.DISTRIBUTION_SWITCH);
        assertThat(enforcer.alignmentKey(tree.node("UPS-2"), tree)).isEqualTo(AlignmentKey.POWER_STORAGE_PAIRED);
        assertThat(enforcer.alignmentKey(tree.node("loop-1"), tree)).isEqualTo(AlignmentKey.LOOP_GROUP);
        assertThat(enforcer.alignmentKey(tree.node("TX-1"), tree)).isEqualTo(AlignmentKey.TRANSFORMER);
        assertThat(enforcer.alignmentKey(tree.node("GEN-1"), tree)).isEqualTo(AlignmentKey.GENERATOR);
        assertThat(enforcer.alignmentKey(tree.node("P-1"), tree)).isNull();
    }
}

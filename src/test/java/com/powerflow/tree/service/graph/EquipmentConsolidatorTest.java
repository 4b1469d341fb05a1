package com.powerflow.tree.service.graph;

import com.powerflow.tree.model.AlternateParent;
import com.powerflow.tree.model.Branch;
import com.powerflow.tree.model.ConnectionType;
import com.powerflow.tree.model.EquipmentNode;
import com.powerflow.tree.model.graph.EquipmentOccurrence;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EquipmentConsolidatorTest {

    private final EquipmentConsolidator consolidator = new EquipmentConsolidator();

    @Test
    void closerSightingBecomesCanonical_whileSourcesAndParentsAreUnioned() {
        List<EquipmentNode> nodes = consolidator.consolidate(List.of(
                occurrence("X", "PANEL", 3, "A", "S1", Branch.PRIMARY, ConnectionType.NORMAL, 0),
                occurrence("X", "PANEL", 1, "R", "S2", Branch.SECONDARY, ConnectionType.NORMAL, 1)
        ), ConsolidationPolicy.standard());

        assertThat(nodes).hasSize(1);
        EquipmentNode x = nodes.get(0);
        assertThat(x.getLevel()).isEqualTo(1);
        assertThat(x.getParentId()).isEqualTo("R");
        assertThat(x.getBranch()).isEqualTo(Branch.SECONDARY);
        assertThat(x.getSources()).containsExactly("S1", "S2");
        assertThat(x.getParentIds()).containsExactly("A", "R");
        assertThat(x.getSequence()).isZero();
    }

    @Test
    void secondarySightingWinsLevelTie() {
        List<EquipmentNode> nodes = consolidator.consolidate(List.of(
                occurrence("X", "PANEL", 2, "A", "S1", Branch.PRIMARY, ConnectionType.NORMAL, 0),
                occurrence("X", "PANEL", 2, "B", "S2", Branch.SECONDARY, ConnectionType.NORMAL, 1)
        ), ConsolidationPolicy.standard());

        assertThat(nodes.get(0).getParentId()).isEqualTo("B");
        assertThat(nodes.get(0).getBranch()).isEqualTo(Branch.SECONDARY);
    }

    @Test
    void convergencePointFedFromBothSidesStaysPrimary() {
        List<EquipmentNode> nodes = consolidator.consolidate(List.of(
                occurrence("U", "UTILITY", 2, "B", "S2", Branch.SECONDARY, ConnectionType.NORMAL, 0),
                occurrence("U", "UTILITY", 2, "A", "S1", Branch.PRIMARY, ConnectionType.NORMAL, 1),
                occurrence("U", "UTILITY", 1, "R", "S2", Branch.SECONDARY, ConnectionType.NORMAL, 2)
        ), ConsolidationPolicy.standard());

        EquipmentNode utility = nodes.get(0);
        assertThat(utility.getBranch()).isEqualTo(Branch.PRIMARY);
        assertThat(utility.getSourceLabel()).isEqualTo("S1");
        assertThat(utility.getLevel()).isEqualTo(2);
    }

    @Test
    void branchComesFromTheRelationThatReachedTheSighting_beforeTheInheritedOne() {
        List<EquipmentNode> nodes = consolidator.consolidate(List.of(
                occurrence("D", "PANEL", 3, "C", "S2", Branch.PRIMARY, ConnectionType.NORMAL, 0),
                occurrence("E", "PANEL", 4, "D", null, Branch.SECONDARY, ConnectionType.NORMAL, 1)
        ), ConsolidationPolicy.standard());

        assertThat(nodes.get(0).getBranch()).isEqualTo(Branch.SECONDARY);
        assertThat(nodes.get(1).getBranch()).isEqualTo(Branch.SECONDARY);
    }

    @Test
    void secondaryFeedDeepInPrimaryPathWinsLevelTie() {
        List<EquipmentNode> nodes = consolidator.consolidate(List.of(
                occurrence("X", "PANEL", 3, "A", "S1", Branch.PRIMARY, ConnectionType.NORMAL, 0),
                occurrence("X", "PANEL", 3, "B", "S2", Branch.PRIMARY, ConnectionType.NORMAL, 1)
        ), ConsolidationPolicy.standard());

        assertThat(nodes.get(0).getParentId()).isEqualTo("B");
        assertThat(nodes.get(0).getBranch()).isEqualTo(Branch.SECONDARY);
    }

    @Test
    void nonNormalSightingsAreKeptAsAlternateParents() {
        List<EquipmentNode> nodes = consolidator.consolidate(List.of(
                occurrence("UPS-1", "UPS", 1, "R", "S1", Branch.PRIMARY, ConnectionType.NORMAL, 0),
                occurrence("UPS-1", "UPS", 2, "B", "S2", Branch.SECONDARY, ConnectionType.BYPASS, 1),
                occurrence("UPS-1", "UPS", 2, "B", "S2", Branch.SECONDARY, ConnectionType.BYPASS, 2)
        ), ConsolidationPolicy.standard());

        EquipmentNode ups = nodes.get(0);
        assertThat(ups.getParentId()).isEqualTo("R");
        assertThat(ups.getAlternateParents()).extracting(AlternateParent::getId).containsExactly("B");
        assertThat(ups.getAlternateParents().get(0).getClassification()).isEqualTo(ConnectionType.BYPASS);
    }

    @Test
    void resultKeepsFirstSeenOrder() {
        List<EquipmentNode> nodes = consolidator.consolidate(List.of(
                occurrence("B", "PANEL", 1, "R", "S1", Branch.PRIMARY, ConnectionType.NORMAL, 0),
                occurrence("A", "PANEL", 1, "R", "S1", Branch.PRIMARY, ConnectionType.NORMAL, 1),
                occurrence("B", "PANEL", 2, "A", "S1", Branch.PRIMARY, ConnectionType.NORMAL, 2)
        ), ConsolidationPolicy.standard());

        assertThat(nodes).extracting(EquipmentNode::getId).containsExactly("B", "A");
    }

    @Test
    void policyRequiresAtLeastOneRule() {
        assertThatThrownBy(() -> new ConsolidationPolicy("empty", List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void policyFallsBackToKeepFirstSeen() {
        ConsolidationPolicy policy = new ConsolidationPolicy("closer-only",
                List.of(StandardConsolidationRule.CLOSER_PATH_WINS));
        EquipmentNode existing = EquipmentNode.builder().id("X").level(1).branch(Branch.PRIMARY).build();

        ConsolidationRule applied = policy.resolve(existing,
                occurrence("X", "PANEL", 3, "A", "S2", Branch.SECONDARY, ConnectionType.NORMAL, 1),
                Branch.SECONDARY);

        assertThat(applied).isEqualTo(StandardConsolidationRule.KEEP_FIRST_SEEN);
        assertThat(existing.getLevel()).isEqualTo(1);
    }

    private static EquipmentOccurrence occurrence(String id, String type, int level, String parentId, String label,
                                                  Branch branch, ConnectionType classification, long sequence) {
        return EquipmentOccurrence.builder()
                .id(id)
                .name(id)
                .type(type)
                .level(level)
                .parentId(parentId)
                .sourceLabel(label)
                .path(List.of("R", parentId))
                .branch(branch)
                .classification(classification)
                .sequence(sequence)
                .build();
    }
}

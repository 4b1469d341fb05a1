package com.powerflow.tree.dto.graph;

import com.powerflow.tree.model.EquipmentNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Complete layout for one selected equipment id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PowerFlowTreeResponse {

    private List<PositionedNode> nodes;
    private List<LayoutEdge> edges;
    private EquipmentNode selectedEquipment;
    private List<EquipmentNode> upstream;
    private List<EquipmentNode> downstream;
    private LayoutDiagnostics diagnostics;
}

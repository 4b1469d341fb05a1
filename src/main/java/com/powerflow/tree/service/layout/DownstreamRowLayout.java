package com.powerflow.tree.service.layout;

import com.powerflow.tree.dto.graph.DiagnosticCode;
import com.powerflow.tree.dto.graph.LayoutDiagnostics;
import com.powerflow.tree.model.EquipmentNode;
import com.powerflow.tree.model.LayoutSettings;
import com.powerflow.tree.model.layout.LayoutFrame;
import com.powerflow.tree.model.layout.LevelBaselines;
import com.powerflow.tree.model.layout.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rows of downstream equipment below the selected equipment, one row per hop, each row
 * evenly spaced and centred on the centre line.
 */
@Service
@Slf4j
public class DownstreamRowLayout {

    /**
     * @return ids placed by this pass, in row order
     */
    public List<String> layout(List<EquipmentNode> downstream, LayoutFrame frame, LevelBaselines baselines,
                               LayoutSettings settings, LayoutDiagnostics diagnostics) {
        Map<Integer, List<EquipmentNode>> rows = new TreeMap<>();
        for (EquipmentNode node : downstream) {
            if (node.isAbsorbed()) continue;
            if (frame.isPlaced(node.getId())) {
                log.debug("Downstream node {} already rendered upstream, skipping", node.getId());
                diagnostics.info(DiagnosticCode.DUPLICATE_NODE_SKIPPED, node.getId(),
                        "Already rendered above the selected equipment");
                continue;
            }
            rows.computeIfAbsent(node.getLevel(), level -> new ArrayList<>()).add(node);
        }

        List<String> placed = new ArrayList<>();
        double spacing = settings.centerSpacing();
        rows.forEach((level, nodes) -> {
            int row = baselines.getRootLevel() - level;
            double y = baselines.yFor(row);
            double startX = settings.getCenterX() - (nodes.size() - 1) * spacing / 2;
            for (int i = 0; i < nodes.size(); i++) {
                String id = nodes.get(i).getId();
                frame.place(id, Position.of(startX + i * spacing, y), row);
                placed.add(id);
            }
        });

        log.info("Placed {} downstream nodes over {} rows", placed.size(), rows.size());
        return placed;
    }
}

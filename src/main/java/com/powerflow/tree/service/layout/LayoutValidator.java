package com.powerflow.tree.service.layout;

import com.powerflow.tree.dto.graph.DiagnosticCode;
import com.powerflow.tree.dto.graph.LayoutDiagnostics;
import com.powerflow.tree.dto.graph.ValidationReport;
import com.powerflow.tree.model.LayoutSettings;
import com.powerflow.tree.model.layout.CollisionInfo;
import com.powerflow.tree.model.layout.LayoutFrame;
import com.powerflow.tree.model.layout.LevelBaselines;
import com.powerflow.tree.model.layout.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read-only check of a finished layout: every node sits on the baseline of its row and no two
 * nodes collide. Findings go to the report and the diagnostics log; positions are never touched.
 */
@Service
@Slf4j
public class LayoutValidator {

    public static final double BASELINE_TOLERANCE = 0.5;

    public ValidationReport validate(LayoutFrame frame, LevelBaselines baselines, LayoutSettings settings,
                                     LayoutDiagnostics diagnostics) {
        List<String> issues = new ArrayList<>();

        for (Map.Entry<String, Position> entry : frame.positions().entrySet()) {
            String id = entry.getKey();
            double expected = baselines.yFor(frame.row(id));
            double actual = entry.getValue().getY();
            if (Math.abs(actual - expected) > BASELINE_TOLERANCE) {
                String issue = String.format("Node %s at y=%.1f is off its row baseline %.1f", id, actual, expected);
                issues.add(issue);
                diagnostics.warn(DiagnosticCode.BASELINE_DRIFT, id, issue);
            }
        }

        List<CollisionInfo> collisions = LayoutGeometry.findAllCollisions(frame.positions(), settings);
        for (CollisionInfo collision : collisions) {
            String issue = String.format("Nodes %s and %s overlap by %.1f", collision.getFirst(),
                    collision.getSecond(), collision.getHorizontalOverlap());
            issues.add(issue);
            diagnostics.warn(DiagnosticCode.RESIDUAL_COLLISION, collision.getFirst(), issue);
        }

        ValidationReport report = new ValidationReport(issues.isEmpty(), issues, frame.positions().size(),
                collisions.size(), LocalDateTime.now());
        diagnostics.setValidation(report);

        if (report.isValid()) {
            log.info("Layout validated: {} nodes, no issues", report.getTotalNodes());
        } else {
            log.warn("Layout validation found {} issues ({} collisions)", issues.size(), collisions.size());
        }
        return report;
    }
}

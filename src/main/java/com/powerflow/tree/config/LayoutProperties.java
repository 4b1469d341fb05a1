package com.powerflow.tree.config;

import com.powerflow.tree.model.LayoutSettings;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Layout tunables ({@code powerflow.layout.*}). Defaults match {@link LayoutSettings#defaults()}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "powerflow.layout")
public class LayoutProperties {

    @Positive
    private double nodeWidth = 180;

    @Positive
    private double nodeHeight = 70;

    /** Edge-to-edge gap between horizontal neighbours. */
    @Positive
    private double minimumGap = 200;

    @Positive
    private double levelSpacing = 150;

    @Positive
    private double verticalClearance = 50;

    private double centerX = 400;

    private double centerY = 300;

    @Positive
    private double branchOffset = 120;

    @Positive
    private double branchSpreadIncrement = 60;

    @Positive
    private double collisionPadding = 12;

    /** Hop ceiling for upstream and downstream traversal. */
    @Positive
    private int maxTraversalDepth = 10;

    @Positive
    private int maxCollisionPasses = 10;

    public LayoutSettings toSettings() {
        return LayoutSettings.builder()
                .nodeWidth(nodeWidth)
                .nodeHeight(nodeHeight)
                .minimumGap(minimumGap)
                .levelSpacing(levelSpacing)
                .verticalClearance(verticalClearance)
                .centerX(centerX)
                .centerY(centerY)
                .branchOffset(branchOffset)
                .branchSpreadIncrement(branchSpreadIncrement)
                .collisionPadding(collisionPadding)
                .maxTraversalDepth(maxTraversalDepth)
                .maxCollisionPasses(maxCollisionPasses)
                .build();
    }
}

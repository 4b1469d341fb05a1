package com.powerflow.tree.model;

import com.powerflow.tree.exception.InvalidLayoutConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable geometry and spacing used by one layout run.
 * Every pass receives it explicitly; nothing reads layout constants from shared state.
 */
@Value
@Builder(toBuilder = true)
public class LayoutSettings {

    @Builder.Default
    double nodeWidth = 180;

    @Builder.Default
    double nodeHeight = 70;

    @Builder.Default
    double minimumGap = 200;            // Edge-to-edge gap between horizontal neighbours

    @Builder.Default
    double levelSpacing = 150;          // Vertical distance between adjacent rows

    @Builder.Default
    double verticalClearance = 50;      // Extra vertical room two stacked nodes need

    @Builder.Default
    double centerX = 400;

    @Builder.Default
    double centerY = 300;

    @Builder.Default
    double branchOffset = 120;          // Base horizontal bias between primary and secondary blocks

    @Builder.Default
    double branchSpreadIncrement = 60;  // Extra spread per upstream level

    @Builder.Default
    double collisionPadding = 12;

    @Builder.Default
    int maxTraversalDepth = 10;

    @Builder.Default
    int maxCollisionPasses = 10;

    public static LayoutSettings defaults() {
        return LayoutSettings.builder().build();
    }

    /** Centre-to-centre distance of two horizontal neighbours. */
    public double centerSpacing() {
        return nodeWidth + minimumGap;
    }

    /** Centre-to-centre distance between a lateral and its parent. */
    public double pairingDistance() {
        return centerSpacing();
    }

    public double minimumVerticalSeparation() {
        return nodeHeight + verticalClearance;
    }

    /**
     * Check every spacing constant is strictly positive.
     *
     * @return this instance, for chaining
     * @throws InvalidLayoutConfigurationException naming every offending constant
     */
    public LayoutSettings validate() {
        Map<String, Double> constants = new LinkedHashMap<>();
        constants.put("nodeWidth", nodeWidth);
        constants.put("nodeHeight", nodeHeight);
        constants.put("minimumGap", minimumGap);
        constants.put("levelSpacing", levelSpacing);
        constants.put("verticalClearance", verticalClearance);
        constants.put("branchOffset", branchOffset);
        constants.put("branchSpreadIncrement", branchSpreadIncrement);
        constants.put("collisionPadding", collisionPadding);
        constants.put("maxTraversalDepth", (double) maxTraversalDepth);
        constants.put("maxCollisionPasses", (double) maxCollisionPasses);

        List<String> invalid = new ArrayList<>();
        constants.forEach((name, value) -> {
            if (value == null || Double.isNaN(value) || value <= 0) {
                invalid.add(name + "=" + value);
            }
        });
        if (!invalid.isEmpty()) {
            throw new InvalidLayoutConfigurationException(
                    "Layout constants must be positive: " + String.join(", ", invalid));
        }
        return this;
    }
}

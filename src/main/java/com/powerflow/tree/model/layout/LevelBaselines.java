package com.powerflow.tree.model.layout;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical y per tree level. The baseline only depends on the level, never on the
 * path a node was reached through.
 */
public class LevelBaselines {

    private final double rootY;
    private final int rootLevel;
    private final double levelSpacing;
    private final Map<Integer, Double> known = new TreeMap<>();

    public LevelBaselines(double rootY, int rootLevel, double levelSpacing) {
        this.rootY = rootY;
        this.rootLevel = rootLevel;
        this.levelSpacing = levelSpacing;
        known.put(rootLevel, rootY);
    }

    public double yFor(int level) {
        return known.computeIfAbsent(level, l -> rootY - (l - rootLevel) * levelSpacing);
    }

    /**
     * Row whose baseline is {@code offset} rows away from the root, negative offsets upwards.
     */
    public int rowForOffset(int offset) {
        return rootLevel - offset;
    }

    public double getRootY() {
        return rootY;
    }

    public int getRootLevel() {
        return rootLevel;
    }

    public Map<Integer, Double> asMap() {
        return Collections.unmodifiableMap(known);
    }
}

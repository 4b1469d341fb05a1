package com.powerflow.tree.model.layout;

import lombok.Value;

/**
 * Tree-wide figures the position assigner uses to widen branch blocks.
 */
@Value
public class LayoutMetrics {

    double maxRowWidth;
    int maxRowCount;
    Integer firstSplitLevel;    // First level where a node has both primary and secondary children
}

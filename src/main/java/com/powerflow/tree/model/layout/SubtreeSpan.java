package com.powerflow.tree.model.layout;

import lombok.Value;

/**
 * Horizontal room reserved for a node and everything placed above it.
 * {@code leftBias + rightBias == width}.
 */
@Value
public class SubtreeSpan {

    double width;
    double leftBias;
    double rightBias;

    public static SubtreeSpan centered(double width) {
        return new SubtreeSpan(width, width / 2, width / 2);
    }

    public static SubtreeSpan of(double leftBias, double rightBias) {
        return new SubtreeSpan(leftBias + rightBias, leftBias, rightBias);
    }
}

package com.powerflow.tree.model.layout;

import lombok.Value;

@Value
public class CollisionInfo {

    String first;
    String second;
    double horizontalOverlap;
    double verticalOverlap;

    public double totalOverlap() {
        return horizontalOverlap + verticalOverlap;
    }
}

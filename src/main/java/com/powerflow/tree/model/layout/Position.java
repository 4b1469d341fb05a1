package com.powerflow.tree.model.layout;

import lombok.Value;

@Value(staticConstructor = "of")
public class Position {

    double x;
    double y;

    public Position withX(double newX) {
        return Position.of(newX, y);
    }

    public Position withY(double newY) {
        return Position.of(x, newY);
    }
}

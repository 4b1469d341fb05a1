package com.powerflow.tree.model.layout;

public enum LateralDirection {
    LEFT(-1),
    RIGHT(1);

    private final int sign;

    LateralDirection(int sign) {
        this.sign = sign;
    }

    public int sign() {
        return sign;
    }
}

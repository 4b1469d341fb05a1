package com.powerflow.tree.model.layout;

public enum TypeCategory {
    UTILITY,
    GENERATOR,
    TRANSFORMER,
    DISTRIBUTION,
    END_EQUIPMENT
}

package com.powerflow.tree.model.graph;

public enum Direction {
    UPSTREAM,
    DOWNSTREAM
}

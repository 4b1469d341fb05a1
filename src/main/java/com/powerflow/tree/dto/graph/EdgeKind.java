package com.powerflow.tree.dto.graph;

/**
 * Why an edge exists, so the renderer can route and style it.
 */
public enum EdgeKind {
    TREE,               // Canonical parent link of an upstream node
    LATERAL_RETURN,     // Return path from a lateral back to the node it pairs with
    ALTERNATE,          // Bypass or redundant parent that is not canonical
    DOWNSTREAM,         // Link below the selected equipment
    DIRECT              // Selected equipment to a bidirectional neighbour
}

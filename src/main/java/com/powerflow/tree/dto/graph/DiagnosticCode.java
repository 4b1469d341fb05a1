package com.powerflow.tree.dto.graph;

public enum DiagnosticCode {
    MALFORMED_RECORD,
    DEPTH_CEILING_REACHED,
    LOOP_GROUP_CREATED,
    ANCESTOR_RESTORED,
    UNREACHABLE_NODE,
    SPAN_RECURSION_GUARD,
    COLLISION_PASSES_EXHAUSTED,
    RESIDUAL_OVERLAP_SEPARATED,
    CATEGORY_SNAPPED,
    DUPLICATE_NODE_SKIPPED,
    BASELINE_DRIFT,
    RESIDUAL_COLLISION
}

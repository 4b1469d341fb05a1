package com.powerflow.tree.dto.graph;

import com.powerflow.tree.model.ConnectionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A classified edge between two rendered nodes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayoutEdge {

    private String id;
    private String sourceId;
    private String targetId;
    private ConnectionType classification;
    private String sourceLabel;     // S1, S2 or null when unknown
    private EdgeKind kind;
}

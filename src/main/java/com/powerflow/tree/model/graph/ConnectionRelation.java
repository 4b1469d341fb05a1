package com.powerflow.tree.model.graph;

import com.powerflow.tree.model.ConnectionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One neighbour of an equipment entry in the adjacency map.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionRelation {

    private String id;              // Neighbour id
    private String name;            // Neighbour display name
    private String type;            // Neighbour type tag
    private String sourceLabel;     // S1 or S2
    private ConnectionType classification;
}

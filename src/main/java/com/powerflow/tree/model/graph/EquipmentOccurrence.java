package com.powerflow.tree.model.graph;

import com.powerflow.tree.model.Branch;
import com.powerflow.tree.model.ConnectionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A single sighting of an equipment id during traversal. The same id may be seen
 * several times through different paths; the consolidator merges the sightings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EquipmentOccurrence {

    private String id;
    private String name;
    private String type;
    private int level;
    private String parentId;
    private String sourceLabel;
    private List<String> path;          // Ids from the traversal start up to the parent
    private Branch branch;              // Inherited from the first hop; null when walking downstream
    private ConnectionType classification;
    private long sequence;
}

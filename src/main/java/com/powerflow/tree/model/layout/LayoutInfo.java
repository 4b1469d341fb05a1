package com.powerflow.tree.model.layout;

import com.powerflow.tree.model.Branch;
import com.powerflow.tree.model.EquipmentNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Layout classification of one equipment node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayoutInfo {

    private EquipmentNode equipment;
    private Branch branch;
    private TypeCategory typeCategory;
    private int level;
    private boolean lateral;
    private String parentId;
    private LateralDirection lateralDirection;

    public String id() {
        return equipment.getId();
    }

    public String name() {
        return equipment.getName();
    }

    public boolean isLoopGroup() {
        return equipment.isLoopGroup();
    }
}

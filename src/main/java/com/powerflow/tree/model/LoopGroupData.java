package com.powerflow.tree.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * Members absorbed by a loop group representative, ordered by name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoopGroupData {

    private String groupKey;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<EquipmentNode> members;

    private String startMemberId;
    private String endMemberId;
}

package com.powerflow.tree.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A non-canonical parent reached through a bypass or redundant relation.
 * Kept so the auxiliary edge can still be drawn.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlternateParent {

    private String id;
    private String sourceLabel;
    private ConnectionType classification;
}

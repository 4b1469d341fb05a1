package com.powerflow.tree.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A rendered equipment node with its resolved position.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionedNode {

    public static final String STYLE_SELECTED = "selected";
    public static final String STYLE_PRIMARY = "primary";
    public static final String STYLE_SECONDARY = "secondary";
    public static final String STYLE_LOOP_GROUP = "loop-group";
    public static final String STYLE_DOWNSTREAM = "downstream";

    private String id;
    private double x;
    private double y;
    private String label;       // "name\ntype"
    private String styleClass;  // selected, primary, secondary, loop-group, downstream
    private String name;
    private String type;
}

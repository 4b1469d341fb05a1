package com.powerflow.tree.model.layout;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Node of the placement tree with its three ordered child groups.
 */
@Getter
public class PlacementNode {

    private final String id;
    private final LayoutInfo info;
    private final List<String> primaryChildren = new ArrayList<>();
    private final List<String> secondaryChildren = new ArrayList<>();
    private final List<String> lateralChildren = new ArrayList<>();

    @Setter
    private String parentId;

    public PlacementNode(String id, LayoutInfo info) {
        this.id = id;
        this.info = info;
    }

    public boolean hasPrimaryChildren() {
        return !primaryChildren.isEmpty();
    }

    public boolean hasSecondaryChildren() {
        return !secondaryChildren.isEmpty();
    }
}

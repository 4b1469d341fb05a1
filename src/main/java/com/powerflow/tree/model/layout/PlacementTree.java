package com.powerflow.tree.model.layout;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;

/**
 * Strict tree over equipment ids rooted at the selected equipment. Every id has at most
 * one parent; nodes not reached from the root are absent.
 */
public class PlacementTree {

    private final String rootId;
    private final Map<String, PlacementNode> nodes;

    public PlacementTree(String rootId, Map<String, PlacementNode> nodes) {
        this.rootId = rootId;
        this.nodes = nodes;
    }

    public String getRootId() {
        return rootId;
    }

    public PlacementNode node(String id) {
        return nodes.get(id);
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public Collection<PlacementNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int size() {
        return nodes.size();
    }
}

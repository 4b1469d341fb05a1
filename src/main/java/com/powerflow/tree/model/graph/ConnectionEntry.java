package com.powerflow.tree.model.graph;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Adjacency of one equipment id: who feeds it and whom it feeds.
 */
@Data
public class ConnectionEntry {

    private final List<ConnectionRelation> upstream = new ArrayList<>();
    private final List<ConnectionRelation> downstream = new ArrayList<>();

    public List<ConnectionRelation> relations(Direction direction) {
        return direction == Direction.UPSTREAM ? upstream : downstream;
    }
}

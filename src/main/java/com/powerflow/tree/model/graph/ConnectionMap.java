package com.powerflow.tree.model.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bidirectional adjacency over equipment ids, in first-seen order.
 */
public class ConnectionMap {

    private final Map<String, ConnectionEntry> entries = new LinkedHashMap<>();

    public ConnectionEntry getOrCreate(String equipmentId) {
        return entries.computeIfAbsent(equipmentId, id -> new ConnectionEntry());
    }

    public boolean contains(String equipmentId) {
        return entries.containsKey(equipmentId);
    }

    public Set<String> equipmentIds() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public List<ConnectionRelation> upstreamOf(String equipmentId) {
        return relations(equipmentId, Direction.UPSTREAM);
    }

    public List<ConnectionRelation> downstreamOf(String equipmentId) {
        return relations(equipmentId, Direction.DOWNSTREAM);
    }

    public List<ConnectionRelation> relations(String equipmentId, Direction direction) {
        ConnectionEntry entry = entries.get(equipmentId);
        if (entry == null) return Collections.emptyList();
        return Collections.unmodifiableList(entry.relations(direction));
    }

    /**
     * Find the relation through which {@code neighbourId} is attached to {@code equipmentId}.
     */
    public Optional<ConnectionRelation> findRelation(String equipmentId, Direction direction, String neighbourId) {
        return relations(equipmentId, direction).stream()
                .filter(relation -> relation.getId().equals(neighbourId))
                .findFirst();
    }
}

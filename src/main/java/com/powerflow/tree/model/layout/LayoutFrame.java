package com.powerflow.tree.model.layout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Positions of one layout run, the row each node sits on and the drift anchors the
 * collision resolver clamps against. Created and mutated by a single run only.
 */
public class LayoutFrame {

    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final Map<String, Integer> rows = new LinkedHashMap<>();
    private final Map<String, Position> anchors = new LinkedHashMap<>();
    private final Map<String, String> partners = new LinkedHashMap<>();

    public void place(String id, Position position, int row) {
        positions.put(id, position);
        rows.put(id, row);
    }

    public boolean isPlaced(String id) {
        return positions.containsKey(id);
    }

    public Position position(String id) {
        return positions.get(id);
    }

    public void move(String id, Position position) {
        if (!positions.containsKey(id)) {
            throw new IllegalStateException("Cannot move unplaced node " + id);
        }
        positions.put(id, position);
    }

    public int row(String id) {
        Integer row = rows.get(id);
        if (row == null) {
            throw new IllegalStateException("No row recorded for " + id);
        }
        return row;
    }

    public void assignRow(String id, int row) {
        rows.put(id, row);
    }

    public Set<String> placedIds() {
        return Collections.unmodifiableSet(positions.keySet());
    }

    public Map<String, Position> positions() {
        return Collections.unmodifiableMap(positions);
    }

    public void captureAnchors() {
        anchors.clear();
        anchors.putAll(positions);
    }

    public Position anchor(String id) {
        return anchors.get(id);
    }

    public void updateAnchor(String id, Position position) {
        anchors.put(id, position);
    }

    public Map<String, Position> anchors() {
        return Collections.unmodifiableMap(anchors);
    }

    /**
     * Record that {@code id} sits beside {@code partnerId} outside the tree's lateral groups.
     */
    public void pair(String id, String partnerId) {
        partners.put(id, partnerId);
    }

    public String partnerOf(String id) {
        return partners.get(id);
    }

    public boolean hasPartner(String partnerId) {
        return partners.containsValue(partnerId);
    }
}

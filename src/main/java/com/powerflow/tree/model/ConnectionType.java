package com.powerflow.tree.model;

/**
 * Classification of an electrical relation between two pieces of equipment.
 * Non-normal relations are rendered as auxiliary edges.
 */
public enum ConnectionType {
    NORMAL("normal"),
    BYPASS("bypass"),
    REDUNDANT("redundant");

    private final String value;

    ConnectionType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isAlternate() {
        return this != NORMAL;
    }
}

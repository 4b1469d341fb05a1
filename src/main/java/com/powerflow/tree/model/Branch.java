package com.powerflow.tree.model;

/**
 * Layout side of an upstream feed. Primary feeds are drawn left of their child,
 * secondary feeds to the right.
 */
public enum Branch {
    PRIMARY("S1"),
    SECONDARY("S2");

    private final String sourceLabel;

    Branch(String sourceLabel) {
        this.sourceLabel = sourceLabel;
    }

    public String getSourceLabel() {
        return sourceLabel;
    }

    /**
     * Get the branch for a source label ("S1"/"S2"), or null when the label names neither.
     */
    public static Branch fromSourceLabel(String label) {
        if (label == null) return null;
        for (Branch branch : values()) {
            if (branch.sourceLabel.equalsIgnoreCase(label.trim())) {
                return branch;
            }
        }
        return null;
    }

    public static Branch orPrimary(Branch branch) {
        return branch != null ? branch : PRIMARY;
    }
}

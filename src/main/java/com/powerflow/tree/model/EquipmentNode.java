package com.powerflow.tree.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Consolidated equipment reached from the selected equipment.
 *
 * A node is either ordinary equipment, a loop group representative ({@link #loopGroup} set,
 * members in {@link #loopGroupData}) or a loop member absorbed by a representative
 * ({@link #absorbedBy} set). Absorbed members stay in the dataset but are never rendered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EquipmentNode {

    private String id;
    private String name;
    private String type;
    private int level;                  // Hops from the selected equipment
    private String parentId;            // Canonical parent, the downstream neighbour on the chosen path
    private String sourceLabel;         // Source label of the canonical relation
    private Branch branch;
    private ConnectionType classification;
    private long sequence;              // Discovery order, breaks first-seen ties explicitly

    @Builder.Default
    private Set<String> sources = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> parentIds = new LinkedHashSet<>();

    @Builder.Default
    private List<String> path = new ArrayList<>();

    @Builder.Default
    private List<AlternateParent> alternateParents = new ArrayList<>();

    private boolean loopGroup;
    private LoopGroupData loopGroupData;
    private String absorbedBy;          // Representative id when this node is a loop member
    private boolean synthesized;        // Restored by coverage completion rather than traversal

    public boolean isAbsorbed() {
        return absorbedBy != null;
    }

    /**
     * Branch hint in priority order: canonical branch, canonical source label, recorded sources.
     */
    public Branch branchHint() {
        if (branch != null) return branch;
        Branch fromLabel = Branch.fromSourceLabel(sourceLabel);
        if (fromLabel != null) return fromLabel;
        for (String source : sources) {
            Branch fromSource = Branch.fromSourceLabel(source);
            if (fromSource != null) return fromSource;
        }
        return null;
    }
}

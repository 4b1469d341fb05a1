package com.powerflow.tree.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Read-only verdict on a finished layout.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationReport {

    private boolean valid;
    private List<String> issues;
    private int totalNodes;
    private int collisionCount;
    private LocalDateTime validatedAt;
}

package com.powerflow.tree.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiagnosticEvent {

    public enum Severity {
        INFO,
        WARN
    }

    private Severity severity;
    private DiagnosticCode code;
    private String subjectId;   // Equipment the event is about, null for run-wide events
    private String message;
}

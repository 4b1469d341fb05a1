package com.powerflow.tree.dto.graph;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered event log of one layout run plus the validator's report.
 * Degraded input and structural anomalies are recorded here instead of failing the run.
 */
public class LayoutDiagnostics {

    private final List<DiagnosticEvent> events = new ArrayList<>();

    @Getter
    @Setter
    private ValidationReport validation;

    public void info(DiagnosticCode code, String subjectId, String message) {
        events.add(new DiagnosticEvent(DiagnosticEvent.Severity.INFO, code, subjectId, message));
    }

    public void warn(DiagnosticCode code, String subjectId, String message) {
        events.add(new DiagnosticEvent(DiagnosticEvent.Severity.WARN, code, subjectId, message));
    }

    public List<DiagnosticEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public List<DiagnosticEvent> eventsWith(DiagnosticCode code) {
        return events.stream()
                .filter(event -> event.getCode() == code)
                .collect(Collectors.toList());
    }

    public boolean hasWarnings() {
        return events.stream().anyMatch(event -> event.getSeverity() == DiagnosticEvent.Severity.WARN);
    }
}

package com.heronix.grader.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.heronix.grader.model.enums.DiagnosticType;

import lombok.extern.slf4j.Slf4j;

/**
 * Collects the warnings of one grading operation.
 *
 * Every diagnostic is also logged at WARN. Instances are not shared between
 * operations.
 */
@Slf4j
public class GradingDiagnostics {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void warn(DiagnosticType type, String message) {
        log.warn("[{}] {}", type, message);
        diagnostics.add(new Diagnostic(type, message));
    }

    public void addAll(List<Diagnostic> others) {
        diagnostics.addAll(others);
    }

    public List<Diagnostic> list() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public boolean has(DiagnosticType type) {
        return diagnostics.stream().anyMatch(d -> d.type() == type);
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }
}

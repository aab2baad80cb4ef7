package com.heronix.grader.diagnostics;

import com.heronix.grader.model.enums.DiagnosticType;

/**
 * A non-fatal grading issue.
 */
public record Diagnostic(
        DiagnosticType type,
        String message
) {}

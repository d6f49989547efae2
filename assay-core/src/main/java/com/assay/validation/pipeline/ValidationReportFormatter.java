/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.pipeline;

import com.assay.validation.api.model.ValidationError;
import com.assay.validation.api.model.ValidationResult;

import java.util.List;

/**
 * Renders validation outcomes as plain text for logs and command-line output.
 *
 * <p>Example output of {@link #formatErrors}:
 * <pre>
 * 1. ERROR: Value 150 is not in range 0 ≤ x ≤ 100 (at compound.temperature) [VALUE_OUT_OF_RANGE]
 *    Suggestions: Provide value between 0 and 100
 * </pre>
 */
public final class ValidationReportFormatter {

    static final String NO_ERRORS = "No validation errors found.";

    private ValidationReportFormatter() {
        throw new AssertionError("ValidationReportFormatter should not be instantiated");
    }

    public static String formatErrors(List<ValidationError> errors) {
        if (errors.isEmpty()) {
            return NO_ERRORS;
        }

        StringBuilder report = new StringBuilder();
        for (int i = 0; i < errors.size(); i++) {
            ValidationError error = errors.get(i);
            if (i > 0) {
                report.append('\n');
            }
            report.append(i + 1).append(". ")
                    .append(error.severity().name()).append(": ")
                    .append(error.message());
            if (!error.path().isEmpty()) {
                report.append(" (at ").append(error.pathString()).append(')');
            }
            report.append(" [").append(error.code()).append(']');
            if (!error.suggestions().isEmpty()) {
                report.append("\n   Suggestions: ").append(String.join(", ", error.suggestions()));
            }
        }
        return report.toString();
    }

    public static String summarize(ValidationResult result) {
        StringBuilder summary = new StringBuilder("Validation ")
                .append(result.valid() ? "PASSED" : "FAILED")
                .append('\n');

        if (!result.errors().isEmpty()) {
            summary.append("Errors: ").append(result.errors().size()).append('\n');
        }
        if (!result.warnings().isEmpty()) {
            summary.append("Warnings: ").append(result.warnings().size()).append('\n');
        }
        if (result.errors().isEmpty() && result.warnings().isEmpty()) {
            summary.append("No issues found.");
        }
        return summary.toString();
    }
}

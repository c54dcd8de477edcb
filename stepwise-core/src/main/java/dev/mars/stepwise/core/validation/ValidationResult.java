/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.stepwise.core.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Errors and warnings collected by a static check of a flow graph or a flow definition.
 *
 * <p>Issues keep the order in which they were reported. A result with no errors is
 * valid whatever its warnings.</p>
 */
public class ValidationResult {

    private static final int NO_LINE = -1;

    private final List<ValidationIssue> issues = new ArrayList<>();

    public void addError(String message) {
        report(ValidationIssue.Severity.ERROR, NO_LINE, null, message);
    }

    public void addError(String fieldPath, String message) {
        report(ValidationIssue.Severity.ERROR, NO_LINE, fieldPath, message);
    }

    public void addError(int lineNumber, String fieldPath, String message) {
        report(ValidationIssue.Severity.ERROR, lineNumber, fieldPath, message);
    }

    public void addWarning(String fieldPath, String message) {
        report(ValidationIssue.Severity.WARNING, NO_LINE, fieldPath, message);
    }

    private void report(ValidationIssue.Severity severity, int lineNumber, String fieldPath, String message) {
        issues.add(new ValidationIssue(severity, lineNumber, fieldPath, message));
    }

    /**
     * Appends every issue of {@code other}, with {@code pathPrefix} put in front of
     * its field path. An empty prefix keeps the issues as they are.
     */
    public void merge(String pathPrefix, ValidationResult other) {
        for (ValidationIssue issue : other.issues) {
            issues.add(issue.under(pathPrefix));
        }
    }

    public List<ValidationIssue> getErrors() {
        return issuesOf(ValidationIssue.Severity.ERROR);
    }

    public List<ValidationIssue> getWarnings() {
        return issuesOf(ValidationIssue.Severity.WARNING);
    }

    private List<ValidationIssue> issuesOf(ValidationIssue.Severity severity) {
        return issues.stream()
                .filter(issue -> issue.getSeverity() == severity)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Errors as {@code [path] message}, or just the message for issues without a path.
     */
    public List<String> getErrorMessages() {
        return getErrors().stream()
                .map(issue -> issue.getFieldPath() == null
                        ? issue.getMessage()
                        : "[" + issue.getFieldPath() + "] " + issue.getMessage())
                .collect(Collectors.toList());
    }

    public boolean isValid() {
        return getErrorCount() == 0;
    }

    public boolean hasWarnings() {
        return getWarningCount() > 0;
    }

    public int getErrorCount() {
        return count(ValidationIssue.Severity.ERROR);
    }

    public int getWarningCount() {
        return count(ValidationIssue.Severity.WARNING);
    }

    private int count(ValidationIssue.Severity severity) {
        return (int) issues.stream().filter(issue -> issue.getSeverity() == severity).count();
    }

    @Override
    public String toString() {
        return "ValidationResult{errors=" + getErrorCount() + ", warnings=" + getWarningCount() + '}';
    }

    /**
     * One reported problem. The line number is {@code -1} when the issue does not
     * come from a parsed document.
     */
    public static final class ValidationIssue {

        public enum Severity {
            ERROR, WARNING
        }

        private final Severity severity;
        private final int lineNumber;
        private final String fieldPath;
        private final String message;

        public ValidationIssue(Severity severity, String message) {
            this(severity, NO_LINE, null, message);
        }

        public ValidationIssue(Severity severity, int lineNumber, String fieldPath, String message) {
            this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
            this.lineNumber = lineNumber;
            this.fieldPath = fieldPath;
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }

        ValidationIssue under(String prefix) {
            if (prefix == null || prefix.isEmpty()) {
                return this;
            }
            return new ValidationIssue(severity, lineNumber,
                    fieldPath == null ? prefix : prefix + "." + fieldPath, message);
        }

        public Severity getSeverity() {
            return severity;
        }

        public int getLineNumber() {
            return lineNumber;
        }

        public String getFieldPath() {
            return fieldPath;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            String line = lineNumber > 0 ? " (line " + lineNumber + ")" : "";
            String path = fieldPath != null ? " [" + fieldPath + "]" : "";
            return severity + line + path + ": " + message;
        }
    }
}

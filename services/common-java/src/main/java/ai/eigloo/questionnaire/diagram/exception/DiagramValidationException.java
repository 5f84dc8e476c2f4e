package ai.eigloo.questionnaire.diagram.exception;

import ai.eigloo.questionnaire.diagram.validation.ValidationIssue;

/**
 * Thrown when a validation issue is severe enough to abort under the active validation mode,
 * or when a compiled graph fails a structural check with no collector to report to.
 */
public class DiagramValidationException extends RuntimeException {

    private final transient ValidationIssue issue;

    public DiagramValidationException(ValidationIssue issue) {
        super(issue.describe());
        this.issue = issue;
    }

    public DiagramValidationException(String message) {
        super(message);
        this.issue = null;
    }

    /**
     * The issue that triggered the abort, or null when raised without a collector.
     */
    public ValidationIssue getIssue() {
        return issue;
    }
}

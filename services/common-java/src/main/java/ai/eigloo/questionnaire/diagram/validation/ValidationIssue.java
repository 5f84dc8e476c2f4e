package ai.eigloo.questionnaire.diagram.validation;

import java.time.Instant;

/**
 * A single validation finding.
 *
 * @param severity issue severity
 * @param message human readable description
 * @param elementId id of the affected element, or null
 * @param elementType type of the affected element (Node, Edge, Group, ...), or null
 * @param fieldName affected field, or null
 * @param timestamp when the issue was recorded
 */
public record ValidationIssue(
        ValidationSeverity severity,
        String message,
        String elementId,
        String elementType,
        String fieldName,
        Instant timestamp
) {

    public ValidationIssue {
        if (severity == null) {
            throw new IllegalArgumentException("Issue severity cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Issue message cannot be null or empty");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Issue timestamp cannot be null");
        }
    }

    /**
     * One-line form used for logging and exception messages.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder()
                .append(severity.name()).append(": ").append(message);
        if (elementId != null) {
            sb.append(" (Element ID: ").append(elementId).append(')');
        }
        if (elementType != null) {
            sb.append(" (Type: ").append(elementType).append(')');
        }
        return sb.toString();
    }
}

package ai.eigloo.questionnaire.diagram.validation;

/**
 * Severity of a validation issue, most severe first.
 */
public enum ValidationSeverity {
    /** The compiled graph is unusable. */
    CRITICAL,
    /** The element is invalid and was dropped or left unresolved. */
    ERROR,
    /** The element is suspicious but usable. */
    WARNING
}

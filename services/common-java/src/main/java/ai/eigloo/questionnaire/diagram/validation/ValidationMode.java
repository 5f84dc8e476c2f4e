package ai.eigloo.questionnaire.diagram.validation;

/**
 * How strictly a {@link ValidationCollector} reacts to the issues it receives.
 */
public enum ValidationMode {
    /** ERROR and CRITICAL issues abort. */
    STRICT,
    /** Only CRITICAL issues abort. */
    NORMAL,
    /** Nothing aborts. */
    LENIENT;

    public boolean aborts(ValidationSeverity severity) {
        return switch (this) {
            case STRICT -> severity == ValidationSeverity.CRITICAL || severity == ValidationSeverity.ERROR;
            case NORMAL -> severity == ValidationSeverity.CRITICAL;
            case LENIENT -> false;
        };
    }
}

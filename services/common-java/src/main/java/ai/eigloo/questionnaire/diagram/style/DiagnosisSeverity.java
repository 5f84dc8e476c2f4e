package ai.eigloo.questionnaire.diagram.style;

/**
 * Severity of a diagnosis, read from the fill colour of a rounded rectangle.
 */
public enum DiagnosisSeverity {
    /**
     * Red fill.
     */
    SEVERE,

    /**
     * Orange or yellow fill.
     */
    MODERATE,

    /**
     * Green fill.
     */
    BENIGN
}

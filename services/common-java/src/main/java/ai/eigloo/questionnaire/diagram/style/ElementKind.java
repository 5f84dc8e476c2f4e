package ai.eigloo.questionnaire.diagram.style;

/**
 * Semantic kind of a diagram element as read from its shape, colour and edges.
 */
public enum ElementKind {
    SELECT_ONE_YESNO,
    SELECT_ONE,
    SELECT_MULTIPLE,
    INTEGER,
    DECIMAL,
    TEXT,
    GOTO,
    NOTE,
    CALCULATE,
    DIAGNOSIS,
    HELP,
    HINT,
    DECISION_POINT,
    UNKNOWN
}

package ai.eigloo.questionnaire.graphbuilder.logic;

/**
 * What a decision point refers to, once resolved.
 */
public enum ReferenceKind {
    FLAG,
    SELECT_ONE,
    SELECT_MULTIPLE,
    NUMERIC,
    /** Resolved to a node whose answers cannot be compared, or not resolved at all. */
    UNKNOWN
}

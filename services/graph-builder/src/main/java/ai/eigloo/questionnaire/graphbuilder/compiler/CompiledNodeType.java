package ai.eigloo.questionnaire.graphbuilder.compiler;

/**
 * Consolidated node kinds of a compiled questionnaire graph.
 *
 * <p>{@link #HELP}, {@link #HINT} and {@link #SELECT_OPTION} only exist while the compiler
 * runs; they are absorbed before the graph is returned.</p>
 */
public enum CompiledNodeType {
    SELECT_ONE,
    SELECT_MULTIPLE,
    NUMERIC,
    TEXT,
    NOTE,
    FLAG,
    DECISION_POINT,
    GOTO,
    HELP,
    HINT,
    SELECT_OPTION
}

package ai.eigloo.questionnaire.graphbuilder.logic;

/**
 * Comparison of a subject with a value.
 *
 * @param subject node id, external reference name or {@code flags}
 * @param operator comparison operator
 * @param value compared value: string, boolean or number
 */
public record Condition(String subject, ComparisonOperator operator, Object value) implements ConditionExpr {

    public static final String FLAGS_SUBJECT = "flags";

    public Condition {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Condition subject cannot be null or empty");
        }
        if (operator == null) {
            throw new IllegalArgumentException("Condition operator cannot be null");
        }
    }

    @Override
    public String toString() {
        return "(" + subject + " " + operator.symbol() + " " + value + ")";
    }
}

package ai.eigloo.questionnaire.graphbuilder.logic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AND / OR over two or more expressions.
 *
 * @param kind combination kind
 * @param operands combined expressions
 */
public record LogicOperator(Kind kind, List<ConditionExpr> operands) implements ConditionExpr {

    public enum Kind {
        AND,
        OR
    }

    public LogicOperator {
        if (kind == null) {
            throw new IllegalArgumentException("Logic operator kind cannot be null");
        }
        if (operands == null || operands.isEmpty()) {
            throw new IllegalArgumentException("Logic operator needs at least one operand");
        }
        operands = List.copyOf(operands);
    }

    @Override
    public String toString() {
        return operands.stream()
                .map(Object::toString)
                .collect(Collectors.joining(" " + kind + " ", "(", ")"));
    }
}

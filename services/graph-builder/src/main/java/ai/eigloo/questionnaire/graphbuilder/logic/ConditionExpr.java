package ai.eigloo.questionnaire.graphbuilder.logic;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Boolean expression attached to a compiled edge.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Condition.class, name = "condition"),
        @JsonSubTypes.Type(value = LogicOperator.class, name = "operator")
})
public interface ConditionExpr {

    /**
     * Conjunction of the operands; a single operand is returned unchanged.
     *
     * @throws IllegalArgumentException when no operand is given
     */
    static ConditionExpr and(ConditionExpr... operands) {
        return combine(LogicOperator.Kind.AND, operands);
    }

    /**
     * Disjunction of the operands; a single operand is returned unchanged.
     *
     * @throws IllegalArgumentException when no operand is given
     */
    static ConditionExpr or(ConditionExpr... operands) {
        return combine(LogicOperator.Kind.OR, operands);
    }

    private static ConditionExpr combine(LogicOperator.Kind kind, ConditionExpr... operands) {
        if (operands == null || operands.length == 0) {
            throw new IllegalArgumentException(kind + " needs at least one operand");
        }
        if (operands.length == 1) {
            return operands[0];
        }
        return new LogicOperator(kind, List.of(operands));
    }
}

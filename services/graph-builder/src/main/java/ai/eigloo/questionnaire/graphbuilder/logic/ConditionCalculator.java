package ai.eigloo.questionnaire.graphbuilder.logic;

import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledEdge;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledNode;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledNodeType;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledOption;
import ai.eigloo.questionnaire.graphbuilder.compiler.SelectOneNode;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the condition under which an edge is taken from the edge and its source node.
 *
 * <ul>
 *   <li>select-one edges compare the answer with the edge's option;</li>
 *   <li>select-multiple edges test whether the answer contains the option;</li>
 *   <li>flag edges test membership of the flag in the raised flags;</li>
 *   <li>decision point edges compare the referenced question, flag or external value with
 *       what the decision label states.</li>
 * </ul>
 * Edges leaving any other kind of node carry no condition.
 */
public class ConditionCalculator {

    static final String YES = "yes";
    static final String NO = "no";

    private static final Pattern NUMERIC_CONDITION =
            Pattern.compile("^(.*?)\\s*(>=|<=|!=|=|>|<)\\s*(-?\\d+(?:\\.\\d+)?)");
    private static final Pattern BRACKETED_OPTION = Pattern.compile("\\[(.*?)]");

    public Optional<ConditionExpr> calculate(CompiledEdge edge, CompiledNode source, ReferenceLookup lookup) {
        if (source == null) {
            return Optional.empty();
        }
        return switch (source.type()) {
            case SELECT_ONE -> selectOne(source.getId(), selectOneValue(edge, source), edge.label());
            case SELECT_MULTIPLE -> selectMultiple(source.getId(), edge.option());
            case FLAG -> flag(source.getLabel(), edge.label());
            case DECISION_POINT -> decision(source, edge.label(), lookup);
            default -> Optional.empty();
        };
    }

    private static String selectOneValue(CompiledEdge edge, CompiledNode source) {
        if (edge.option() == null) {
            return null;
        }
        if (source instanceof SelectOneNode) {
            boolean synthesized = ((SelectOneNode) source).findOption(edge.option())
                    .map(CompiledOption::synthesized)
                    .orElse(false);
            if (synthesized) {
                return YES;
            }
        }
        return edge.option();
    }

    private static Optional<ConditionExpr> selectOne(String subject, String value, String edgeLabel) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (normalize(edgeLabel)) {
            case YES -> Optional.of(new Condition(subject, ComparisonOperator.EQUALS, value));
            case NO -> Optional.of(new Condition(subject, ComparisonOperator.NOT_EQUALS, value));
            default -> Optional.empty();
        };
    }

    private static Optional<ConditionExpr> selectMultiple(String subject, String option) {
        if (option == null) {
            return Optional.empty();
        }
        return Optional.of(new Condition(subject, ComparisonOperator.CONTAINS, option));
    }

    private static Optional<ConditionExpr> flag(String flagName, String edgeLabel) {
        String answer = normalize(edgeLabel);
        if (answer.isEmpty() || YES.equals(answer)) {
            return Optional.of(new Condition(Condition.FLAGS_SUBJECT, ComparisonOperator.IN, flagName));
        }
        if (NO.equals(answer)) {
            return Optional.of(new Condition(Condition.FLAGS_SUBJECT, ComparisonOperator.NOT_IN, flagName));
        }
        return Optional.empty();
    }

    private Optional<ConditionExpr> decision(CompiledNode decision, String edgeLabel, ReferenceLookup lookup) {
        String name = decision.getName() != null ? decision.getName() : decision.getId();
        String subject = name;
        ReferenceKind kind = ReferenceKind.UNKNOWN;

        Optional<CompiledNode> referenced = lookup.findNodeByName(name)
                .filter(node -> !node.getId().equals(decision.getId()))
                .filter(node -> node.type() != CompiledNodeType.DECISION_POINT);
        if (referenced.isPresent()) {
            subject = referenced.get().getId();
            kind = kindOf(referenced.get().type());
        } else if (lookup.isExternalFlag(name)) {
            kind = ReferenceKind.FLAG;
        } else if (lookup.isExternalNumeric(name)) {
            kind = ReferenceKind.NUMERIC;
        }

        String decisionLabel = decision.getLabel();
        return switch (kind) {
            case FLAG -> flag(decisionLabel, edgeLabel);
            case SELECT_ONE -> selectOne(subject, decisionLabel, edgeLabel);
            case SELECT_MULTIPLE -> Optional.of(selectMultipleDecision(subject, decisionLabel, edgeLabel));
            case NUMERIC -> Optional.of(numericDecision(subject, decisionLabel, edgeLabel));
            case UNKNOWN -> Optional.of(fallback(subject, edgeLabel));
        };
    }

    private static ReferenceKind kindOf(CompiledNodeType type) {
        return switch (type) {
            case FLAG -> ReferenceKind.FLAG;
            case SELECT_ONE -> ReferenceKind.SELECT_ONE;
            case SELECT_MULTIPLE -> ReferenceKind.SELECT_MULTIPLE;
            case NUMERIC -> ReferenceKind.NUMERIC;
            default -> ReferenceKind.UNKNOWN;
        };
    }

    private static ConditionExpr selectMultipleDecision(String subject, String decisionLabel, String edgeLabel) {
        Matcher matcher = BRACKETED_OPTION.matcher(decisionLabel);
        if (matcher.find()) {
            String option = matcher.group(1).trim();
            String answer = normalize(edgeLabel);
            if (YES.equals(answer)) {
                return new Condition(subject, ComparisonOperator.CONTAINS, option);
            }
            if (NO.equals(answer)) {
                return new Condition(subject, ComparisonOperator.NOT_CONTAINS, option);
            }
        }
        return fallback(subject, edgeLabel);
    }

    private static ConditionExpr numericDecision(String subject, String decisionLabel, String edgeLabel) {
        Matcher matcher = NUMERIC_CONDITION.matcher(asciiOperators(decisionLabel));
        if (!matcher.find()) {
            return fallback(subject, edgeLabel);
        }
        Number value;
        try {
            value = normalizeNumber(matcher.group(3));
        } catch (NumberFormatException e) {
            return fallback(subject, edgeLabel);
        }
        ComparisonOperator operator = ComparisonOperator.fromSymbol(matcher.group(2));
        if (NO.equals(normalize(edgeLabel))) {
            operator = operator.negate();
        }
        return new Condition(subject, operator, value);
    }

    private static String asciiOperators(String label) {
        return label.replace("\u2265", ">=").replace("\u2264", "<=").replace("\u2260", "!=");
    }

    private static ConditionExpr fallback(String subject, String edgeLabel) {
        return new Condition(subject, ComparisonOperator.EQUALS, YES.equals(normalize(edgeLabel)));
    }

    /**
     * Whole numbers become integers (or longs when they do not fit), everything else a double.
     */
    static Number normalizeNumber(String literal) {
        BigDecimal decimal = new BigDecimal(literal);
        if (decimal.stripTrailingZeros().scale() <= 0) {
            try {
                return decimal.intValueExact();
            } catch (ArithmeticException e) {
                try {
                    return decimal.longValueExact();
                } catch (ArithmeticException tooLarge) {
                    return decimal.doubleValue();
                }
            }
        }
        return decimal.doubleValue();
    }

    private static String normalize(String label) {
        return label == null ? "" : label.trim().toLowerCase(Locale.ROOT);
    }
}

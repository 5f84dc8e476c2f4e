package ai.eigloo.questionnaire.diagram.style;

import ai.eigloo.questionnaire.diagram.model.ShapeKind;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps a node shape and its structural context to a semantic {@link ElementKind}.
 *
 * <p>Rules are evaluated in a fixed precedence:</p>
 * <ol>
 *   <li>rhombus is a decision point;</li>
 *   <li>hexagon is an integer input, ellipse a decimal input;</li>
 *   <li>callout is free text, off-page connector a goto;</li>
 *   <li>list is select-one when rounded, otherwise select-multiple;</li>
 *   <li>rectangles are yes/no questions, help, hint, diagnosis, calculation or note depending on
 *       outgoing labels, incoming edges, rounding and fill colour.</li>
 * </ol>
 */
public class ShapeClassifier {

    private static final Set<String> YES_NO_LABELS = Set.of("yes", "no");

    public Classification classify(Map<String, String> style, ClassificationContext context) {
        return classify(ShapeKind.fromStyle(style), context);
    }

    public Classification classify(ShapeKind shape, ClassificationContext context) {
        if (shape == null) {
            return Classification.of(ElementKind.UNKNOWN);
        }
        ClassificationContext ctx = context != null ? context : ClassificationContext.isolated(false, null);
        return switch (shape) {
            case RHOMBUS -> Classification.of(ElementKind.DECISION_POINT);
            case HEXAGON -> Classification.of(ElementKind.INTEGER);
            case ELLIPSE -> Classification.of(ElementKind.DECIMAL);
            case CALLOUT -> Classification.of(ElementKind.TEXT);
            case OFF_PAGE_CONNECTOR -> Classification.of(ElementKind.GOTO);
            case LIST -> Classification.of(ctx.rounded() ? ElementKind.SELECT_ONE : ElementKind.SELECT_MULTIPLE);
            case RECTANGLE -> classifyRectangle(ctx);
        };
    }

    private Classification classifyRectangle(ClassificationContext ctx) {
        if (isYesNoQuestion(ctx)) {
            return Classification.of(ElementKind.SELECT_ONE_YESNO);
        }

        String fill = ctx.fillColor();
        if (ctx.incomingEdgeCount() == 0) {
            if (ColorRange.GREEN.matches(fill)) {
                return Classification.of(ElementKind.HELP);
            }
            if (ColorRange.GREY.matches(fill)) {
                return Classification.of(ElementKind.HINT);
            }
        }

        if (!ctx.rounded()) {
            return Classification.of(ElementKind.NOTE);
        }
        if (ColorRange.RED.matches(fill)) {
            return Classification.diagnosis(DiagnosisSeverity.SEVERE);
        }
        if (ColorRange.ORANGE.matches(fill) || ColorRange.YELLOW.matches(fill)) {
            return Classification.diagnosis(DiagnosisSeverity.MODERATE);
        }
        if (ColorRange.GREEN.matches(fill)) {
            return Classification.diagnosis(DiagnosisSeverity.BENIGN);
        }
        return Classification.of(ElementKind.CALCULATE);
    }

    private static boolean isYesNoQuestion(ClassificationContext ctx) {
        if (ctx.outgoingEdgeLabels().isEmpty()) {
            return false;
        }
        for (String label : ctx.outgoingEdgeLabels()) {
            if (label == null || !YES_NO_LABELS.contains(label.trim().toLowerCase(Locale.ROOT))) {
                return false;
            }
        }
        return true;
    }
}

package ai.eigloo.questionnaire.diagram.style;

import ai.eigloo.questionnaire.diagram.model.ShapeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class ShapeClassifierTest {

    private ShapeClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ShapeClassifier();
    }

    @Test
    void testNonRectangleShapes() {
        ClassificationContext ctx = ClassificationContext.isolated(false, null);

        assertThat(classifier.classify(ShapeKind.RHOMBUS, ctx).kind()).isEqualTo(ElementKind.DECISION_POINT);
        assertThat(classifier.classify(ShapeKind.HEXAGON, ctx).kind()).isEqualTo(ElementKind.INTEGER);
        assertThat(classifier.classify(ShapeKind.ELLIPSE, ctx).kind()).isEqualTo(ElementKind.DECIMAL);
        assertThat(classifier.classify(ShapeKind.CALLOUT, ctx).kind()).isEqualTo(ElementKind.TEXT);
        assertThat(classifier.classify(ShapeKind.OFF_PAGE_CONNECTOR, ctx).kind()).isEqualTo(ElementKind.GOTO);
    }

    @Test
    void testListRoundingSelectsCardinality() {
        assertThat(classifier.classify(ShapeKind.LIST, ClassificationContext.isolated(true, null)).kind())
                .isEqualTo(ElementKind.SELECT_ONE);
        assertThat(classifier.classify(ShapeKind.LIST, ClassificationContext.isolated(false, null)).kind())
                .isEqualTo(ElementKind.SELECT_MULTIPLE);
    }

    @Test
    void testMissingShapeIsUnknown() {
        assertThat(classifier.classify((ShapeKind) null, ClassificationContext.isolated(false, null)).kind())
                .isEqualTo(ElementKind.UNKNOWN);
    }

    @Test
    void testYesNoRectangle() {
        ClassificationContext ctx = new ClassificationContext(false, null, 1, List.of(" Yes", "NO "));

        assertThat(classifier.classify(ShapeKind.RECTANGLE, ctx).kind()).isEqualTo(ElementKind.SELECT_ONE_YESNO);
    }

    @Test
    void testYesNoNeedsEveryLabelToMatch() {
        ClassificationContext ctx = new ClassificationContext(false, null, 1, List.of("yes", "maybe"));

        assertThat(classifier.classify(ShapeKind.RECTANGLE, ctx).kind()).isEqualTo(ElementKind.NOTE);
    }

    @Test
    void testYesNoTakesPrecedenceOverColour() {
        ClassificationContext ctx = new ClassificationContext(true, "#ff0000", 0, List.of("yes"));

        assertThat(classifier.classify(ShapeKind.RECTANGLE, ctx).kind()).isEqualTo(ElementKind.SELECT_ONE_YESNO);
    }

    @Test
    void testHelpAndHintNeedNoIncomingEdges() {
        assertThat(classifier.classify(ShapeKind.RECTANGLE, new ClassificationContext(false, "#60a917", 0, List.of("")))
                .kind()).isEqualTo(ElementKind.HELP);
        assertThat(classifier.classify(ShapeKind.RECTANGLE, new ClassificationContext(false, "#808080", 0, List.of("")))
                .kind()).isEqualTo(ElementKind.HINT);
        assertThat(classifier.classify(ShapeKind.RECTANGLE, new ClassificationContext(false, "#60a917", 1, List.of("")))
                .kind()).isEqualTo(ElementKind.NOTE);
    }

    @Test
    void testRoundedRectangleDiagnoses() {
        assertThat(classifier.classify(ShapeKind.RECTANGLE, new ClassificationContext(true, "#ff0000", 1, List.of())))
                .isEqualTo(Classification.diagnosis(DiagnosisSeverity.SEVERE));
        assertThat(classifier.classify(ShapeKind.RECTANGLE, new ClassificationContext(true, "#ff9900", 1, List.of())))
                .isEqualTo(Classification.diagnosis(DiagnosisSeverity.MODERATE));
        assertThat(classifier.classify(ShapeKind.RECTANGLE, new ClassificationContext(true, "#ffff00", 1, List.of())))
                .isEqualTo(Classification.diagnosis(DiagnosisSeverity.MODERATE));
        assertThat(classifier.classify(ShapeKind.RECTANGLE, new ClassificationContext(true, "#60a917", 1, List.of())))
                .isEqualTo(Classification.diagnosis(DiagnosisSeverity.BENIGN));
    }

    @Test
    void testRoundedRectangleWithoutColourIsCalculation() {
        assertThat(classifier.classify(ShapeKind.RECTANGLE, new ClassificationContext(true, "#dae8fc", 1, List.of()))
                .kind()).isEqualTo(ElementKind.CALCULATE);
        assertThat(classifier.classify(ShapeKind.RECTANGLE, new ClassificationContext(true, "bogus", 1, List.of()))
                .kind()).isEqualTo(ElementKind.CALCULATE);
    }

    @Test
    void testPlainRectangleIsNote() {
        assertThat(classifier.classify(ShapeKind.RECTANGLE, new ClassificationContext(false, "#ff0000", 1, List.of("next")))
                .kind()).isEqualTo(ElementKind.NOTE);
    }

    @Test
    void testClassifyFromStyleMapIgnoresFlagOrder() {
        List<String> tokens = new ArrayList<>(List.of("rhombus", "whiteSpace=wrap", "html=1", "fillColor=#fff", "rounded=1"));
        ClassificationContext ctx = ClassificationContext.isolated(true, "#ffffff");
        Classification expected = classifier.classify(StyleGrammar.parse(String.join(";", tokens)), ctx);

        Random random = new Random(42);
        for (int i = 0; i < 20; i++) {
            Collections.shuffle(tokens, random);
            assertThat(classifier.classify(StyleGrammar.parse(String.join(";", tokens)), ctx)).isEqualTo(expected);
        }
        assertThat(expected.kind()).isEqualTo(ElementKind.DECISION_POINT);
    }
}

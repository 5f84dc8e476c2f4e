package ai.eigloo.questionnaire.graphbuilder.compiler.pass;

import ai.eigloo.questionnaire.diagram.model.Diagram;
import ai.eigloo.questionnaire.diagram.style.ShapeClassifier;
import ai.eigloo.questionnaire.diagram.validation.ValidationSeverity;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompilationContext;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledEdge;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledGraph;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledNode;
import org.junit.jupiter.api.Test;

import static ai.eigloo.questionnaire.graphbuilder.compiler.DiagramFixtures.GREEN;
import static ai.eigloo.questionnaire.graphbuilder.compiler.DiagramFixtures.GREY;
import static ai.eigloo.questionnaire.graphbuilder.compiler.DiagramFixtures.builder;
import static ai.eigloo.questionnaire.graphbuilder.compiler.DiagramFixtures.edge;
import static ai.eigloo.questionnaire.graphbuilder.compiler.DiagramFixtures.filled;
import static ai.eigloo.questionnaire.graphbuilder.compiler.DiagramFixtures.note;
import static ai.eigloo.questionnaire.graphbuilder.compiler.DiagramFixtures.seed;
import static org.assertj.core.api.Assertions.assertThat;

class HelpHintAbsorptionPassTest {

    private final TypeConsolidationPass consolidation = new TypeConsolidationPass(new ShapeClassifier());
    private final HelpHintAbsorptionPass pass = new HelpHintAbsorptionPass();

    @Test
    void testHelpAndHintTextMoveToTargets() {
        // Given
        Diagram diagram = builder()
                .node(filled("help", "Count all cigarettes", GREEN, false))
                .node(filled("hint", "Roughly is fine", GREY, false))
                .node(note("q1", "How many?"))
                .node(note("q2", "Since when?"))
                .edge(edge("e1", "help", "q1"))
                .edge(edge("e2", "help", "q2"))
                .edge(edge("e3", "hint", "q1"))
                .edge(edge("e4", "q1", "q2"))
                .build();
        CompilationContext context = seed(diagram);
        consolidation.apply(context);

        // When
        pass.apply(context);

        // Then
        CompiledGraph graph = context.getGraph();
        assertThat(graph.nodeIdSnapshot()).containsExactly("q1", "q2");
        assertThat(graph.edges()).extracting(CompiledEdge::id).containsExactly("e4");

        CompiledNode first = graph.getNode("q1").orElseThrow();
        assertThat(first.getHelpText()).isEqualTo("Count all cigarettes");
        assertThat(first.getHintText()).isEqualTo("Roughly is fine");
        CompiledNode second = graph.getNode("q2").orElseThrow();
        assertThat(second.getHelpText()).isEqualTo("Count all cigarettes");
        assertThat(second.getHintText()).isNull();
        assertThat(context.getCollector().getIssues()).isEmpty();
    }

    @Test
    void testHelpPointingNowhereIsRemovedWithWarning() {
        // Given
        Diagram diagram = builder()
                .node(filled("help", "Stray help", GREEN, false))
                .node(note("q1", "Question"))
                .build();
        CompilationContext context = seed(diagram);
        consolidation.apply(context);

        // When
        pass.apply(context);

        // Then
        assertThat(context.getGraph().containsNode("help")).isFalse();
        assertThat(context.getCollector().getIssues(ValidationSeverity.WARNING))
                .singleElement()
                .satisfies(issue -> assertThat(issue.elementId()).isEqualTo("help"));
    }
}

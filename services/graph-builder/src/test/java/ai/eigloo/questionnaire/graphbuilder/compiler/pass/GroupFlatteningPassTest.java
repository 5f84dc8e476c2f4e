package ai.eigloo.questionnaire.graphbuilder.compiler.pass;

import ai.eigloo.questionnaire.diagram.model.Diagram;
import ai.eigloo.questionnaire.diagram.model.Geometry;
import ai.eigloo.questionnaire.diagram.model.Group;
import ai.eigloo.questionnaire.diagram.style.ShapeClassifier;
import ai.eigloo.questionnaire.diagram.validation.ValidationSeverity;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompilationContext;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledEdge;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledGraph;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledNode;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;

import static ai.eigloo.questionnaire.graphbuilder.compiler.DiagramFixtures.GREEN;
import static ai.eigloo.questionnaire.graphbuilder.compiler.DiagramFixtures.GREY;
import static ai.eigloo.questionnaire.graphbuilder.compiler.DiagramFixtures.builder;
import static ai.eigloo.questionnaire.graphbuilder.compiler.DiagramFixtures.edge;
import static ai.eigloo.questionnaire.graphbuilder.compiler.DiagramFixtures.filled;
import static ai.eigloo.questionnaire.graphbuilder.compiler.DiagramFixtures.note;
import static ai.eigloo.questionnaire.graphbuilder.compiler.DiagramFixtures.seed;
import static org.assertj.core.api.Assertions.assertThat;

class GroupFlatteningPassTest {

    private final TypeConsolidationPass consolidation = new TypeConsolidationPass(new ShapeClassifier());
    private final GroupFlatteningPass pass = new GroupFlatteningPass();

    @Test
    void testEdgeIntoGroupTargetsFirstEnterableMember() {
        // Given
        Diagram diagram = builder()
                .node(note("start", "Start"))
                .node(filled("help", "Help for the section", GREEN, false))
                .node(note("first", "First question"))
                .node(note("second", "Second question"))
                .group(group("grp", "Lifestyle", "help", "first", "second"))
                .edge(edge("e1", "start", "grp"))
                .edge(edge("e2", "help", "first"))
                .edge(edge("e3", "first", "second"))
                .build();
        CompilationContext context = seed(diagram);
        consolidation.apply(context);

        // When
        pass.apply(context);

        // Then
        CompiledGraph graph = context.getGraph();
        CompiledEdge redirected = graph.getEdge("e1").orElseThrow();
        assertThat(redirected.target()).isEqualTo("first");
        assertThat(redirected.originalTarget()).isEqualTo("grp");

        for (String member : List.of("help", "first", "second")) {
            CompiledNode node = graph.getNode(member).orElseThrow();
            assertThat(node.getGroupId()).isEqualTo("grp");
            assertThat(node.getGroupHeading()).isEqualTo("Lifestyle");
        }
        assertThat(graph.getNode("start").orElseThrow().getGroupId()).isNull();
        assertThat(graph.getEdge("e3").orElseThrow().originalTarget()).isNull();
    }

    @Test
    void testEdgeIntoGroupWithoutEnterableMemberIsDropped() {
        // Given
        Diagram diagram = builder()
                .node(note("start", "Start"))
                .node(filled("hint", "Only a hint", GREY, false))
                .node(note("end", "End"))
                .group(group("grp", "Hints", "hint"))
                .edge(edge("e1", "start", "grp"))
                .edge(edge("e2", "hint", "end"))
                .build();
        CompilationContext context = seed(diagram);
        consolidation.apply(context);

        // When
        pass.apply(context);

        // Then
        assertThat(context.getGraph().getEdge("e1")).isEmpty();
        assertThat(context.getCollector().getIssues(ValidationSeverity.ERROR))
                .singleElement()
                .satisfies(issue -> assertThat(issue.elementId()).isEqualTo("e1"));
    }

    private static Group group(String id, String label, String... members) {
        return new Group(id, label, "page-1", Geometry.empty(), null, new LinkedHashSet<>(List.of(members)));
    }
}

package ai.eigloo.questionnaire.diagram.model;

import ai.eigloo.questionnaire.diagram.exception.DiagramValidationException;
import ai.eigloo.questionnaire.diagram.external.ExternalReferenceOracle;
import ai.eigloo.questionnaire.diagram.external.ExternalReferences;
import ai.eigloo.questionnaire.diagram.validation.ValidationCollector;
import ai.eigloo.questionnaire.diagram.validation.ValidationIssue;
import ai.eigloo.questionnaire.diagram.validation.ValidationMode;
import ai.eigloo.questionnaire.diagram.validation.ValidationSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiagramTest {

    private ValidationCollector collector;

    @BeforeEach
    void setUp() {
        collector = new ValidationCollector(ValidationMode.LENIENT);
    }

    @Test
    void testGhostEdgeDroppedWithSingleWarning() {
        Diagram diagram = Diagram.builder(collector, ExternalReferenceOracle.none())
                .node(Node.of("a", "A", ShapeKind.RECTANGLE))
                .edge(Edge.of("ghost", null, null, ""))
                .build();

        assertThat(diagram.getEdges()).isEmpty();
        assertThat(collector.getIssues()).hasSize(1);
        assertThat(collector.getIssues().get(0).severity()).isEqualTo(ValidationSeverity.WARNING);
        assertThat(collector.getIssues().get(0).elementId()).isEqualTo("ghost");
    }

    @Test
    void testMissingEndpointsReportedAtError() {
        Diagram diagram = Diagram.builder(collector, null)
                .node(Node.of("a", "A", ShapeKind.RECTANGLE))
                .edge(Edge.of("e1", "a", null, ""))
                .edge(Edge.of("e2", null, "a", ""))
                .build();

        assertThat(diagram.getEdges()).isEmpty();
        assertThat(collector.getIssues(ValidationSeverity.ERROR))
                .extracting(ValidationIssue::fieldName)
                .containsExactly("target", "source");
    }

    @Test
    void testMissingEndpointMessagesDescribeTheOtherEnd() {
        Diagram diagram = Diagram.builder(collector, null)
                .node(new Node("q", "Your age", "", ShapeKind.HEXAGON, null, null, null, null))
                .node(new Node("list", "Symptoms", "", ShapeKind.LIST, null, null, null,
                        List.of(new SelectOption("opt", "Fever", "list", null, null))))
                .node(Node.of("a", "A", ShapeKind.RECTANGLE))
                .group(new Group("g", "Vitals", "", null, null, Set.of("a")))
                .edge(Edge.of("e1", "q", null, ""))
                .edge(Edge.of("e2", "opt", null, ""))
                .edge(Edge.of("e3", null, "g", ""))
                .edge(Edge.of("e4", null, "unknown", ""))
                .build();

        assertThat(diagram.getEdges()).isEmpty();
        assertThat(collector.getIssues(ValidationSeverity.ERROR)).extracting(ValidationIssue::message).containsExactly(
                "Edge has no target. Source 'q' is a hexagon node, label is 'Your age'",
                "Edge has no target. Source 'opt' is a select option, label is 'Fever'",
                "Edge has no source. Target 'g' is a group with 1 elements, label is 'Vitals'",
                "Edge has no source. Target 'unknown' is not an element of the diagram");
    }

    @Test
    void testDanglingEdgesDropped() {
        Diagram diagram = Diagram.builder(collector, null)
                .node(Node.of("a", "A", ShapeKind.RECTANGLE))
                .node(Node.of("b", "B", ShapeKind.RECTANGLE))
                .edge(Edge.of("e1", "a", "b", ""))
                .edge(Edge.of("e2", "a", "missing", ""))
                .edge(Edge.of("e3", "missing", "b", ""))
                .build();

        assertThat(diagram.getEdges()).containsOnlyKeys("e1");
        assertThat(collector.getIssues(ValidationSeverity.ERROR))
                .extracting(ValidationIssue::elementId)
                .containsExactly("e2", "e3");
    }

    @Test
    void testEdgeIntoListOptionDroppedAtError() {
        Diagram diagram = Diagram.builder(collector, null)
                .node(new Node("list", "Symptoms", "", ShapeKind.LIST, null, null, null,
                        List.of(new SelectOption("opt", "Fever", "list", null, null))))
                .node(Node.of("a", "A", ShapeKind.RECTANGLE))
                .edge(Edge.of("e1", "a", "opt", ""))
                .build();

        assertThat(diagram.getEdges()).isEmpty();
        assertThat(collector.getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.severity()).isEqualTo(ValidationSeverity.ERROR);
            assertThat(issue.elementId()).isEqualTo("e1");
            assertThat(issue.fieldName()).isEqualTo("target");
        });
    }

    @Test
    void testEdgeFromGroupRejected() {
        Diagram diagram = Diagram.builder(collector, null)
                .node(Node.of("a", "A", ShapeKind.RECTANGLE))
                .group(new Group("g", "Group", "", null, null, Set.of("a")))
                .edge(Edge.of("e1", "g", "a", ""))
                .build();

        assertThat(diagram.getEdges()).isEmpty();
        assertThat(collector.getIssues(ValidationSeverity.ERROR)).hasSize(1);
    }

    @Test
    void testEdgeFromListOptionAccepted() {
        SelectOption option = new SelectOption("o1", "Cough", "list", null, null);
        Diagram diagram = Diagram.builder(collector, null)
                .node(new Node("list", "Symptoms", "", ShapeKind.LIST, null, null, null, List.of(option)))
                .node(Node.of("b", "B", ShapeKind.RECTANGLE))
                .edge(Edge.of("e1", "o1", "b", ""))
                .build();

        assertThat(diagram.getEdges()).containsOnlyKeys("e1");
        assertThat(diagram.findOption("o1")).contains(option);
        assertThat(collector.getIssues()).isEmpty();
    }

    @Test
    void testGroupMembersPrunedAndEmptyGroupsDropped() {
        LinkedHashSet<String> members = new LinkedHashSet<>(List.of("a", "ghost"));
        Diagram diagram = Diagram.builder(collector, null)
                .node(Node.of("a", "A", ShapeKind.RECTANGLE))
                .group(new Group("g1", "Kept", "", null, null, members))
                .group(new Group("g2", "Dropped", "", null, null, Set.of("nobody")))
                .edge(Edge.of("e1", "a", "g2", ""))
                .build();

        assertThat(diagram.getGroups()).containsOnlyKeys("g1");
        assertThat(diagram.getGroups().get("g1").containedElements()).containsExactly("a");
        assertThat(diagram.getEdges()).isEmpty();
        assertThat(collector.getIssues(ValidationSeverity.ERROR)).hasSize(4);
    }

    @Test
    void testListWithoutOptionsKeptWithError() {
        Diagram diagram = Diagram.builder(collector, null)
                .node(new Node("list", "Symptoms", "", ShapeKind.LIST, null, null, null, List.of()))
                .build();

        assertThat(diagram.getNodes()).containsKey("list");
        assertThat(collector.getIssues(ValidationSeverity.ERROR)).hasSize(1);
    }

    @Test
    void testDecisionReferenceResolution() {
        ExternalReferences externals = new ExternalReferences(Set.of("fever_flag"), Set.of("bmi"));
        Diagram diagram = Diagram.builder(collector, externals)
                .node(new Node("q", "Age", "", ShapeKind.HEXAGON, null, null, ElementMetadata.named("age"), null))
                .node(decision("d1", "age"))
                .node(decision("d2", "fever_flag"))
                .node(decision("d3", "bmi"))
                .node(decision("d4", "nowhere"))
                .build();

        assertThat(collector.getIssues()).extracting(ValidationIssue::elementId).containsExactly("d4");
        assertThat(diagram.getNodes()).containsKey("d4");
    }

    @Test
    void testDecisionCannotReferenceAnotherDecision() {
        Diagram.builder(collector, null)
                .node(decision("d1", "x"))
                .node(decision("d2", "x"))
                .build();

        assertThat(collector.getIssues(ValidationSeverity.ERROR)).hasSize(2);
    }

    @Test
    void testNameIndexRebuiltAfterMutation() {
        Diagram diagram = Diagram.builder(collector, null)
                .node(new Node("a", "A", "", ShapeKind.RECTANGLE, null, null, ElementMetadata.named("first"), null))
                .build();
        assertThat(diagram.resolveName("first")).contains("a");
        assertThat(diagram.resolveName("second")).isEmpty();

        diagram.addNode(new Node("b", "B", "", ShapeKind.RECTANGLE, null, null, ElementMetadata.named("second"), null));

        assertThat(diagram.resolveName("second")).contains("b");
    }

    @Test
    void testNamedGroupsAreIndexed() {
        Diagram diagram = Diagram.builder(collector, null)
                .node(Node.of("a", "A", ShapeKind.RECTANGLE))
                .group(new Group("g", "Vitals", "", null, ElementMetadata.named("vitals"), Set.of("a")))
                .build();

        assertThat(diagram.nameIndex()).containsEntry("vitals", "g");
    }

    @Test
    void testValidateIsIdempotentOnCleanDiagram() {
        Diagram diagram = Diagram.builder(collector, null)
                .node(Node.of("a", "A", ShapeKind.RECTANGLE))
                .node(Node.of("b", "B", ShapeKind.RECTANGLE))
                .edge(Edge.of("e1", "a", "b", ""))
                .build();

        diagram.validate();
        diagram.validate();

        assertThat(collector.getIssues()).isEmpty();
        assertThat(diagram.getEdges()).hasSize(1);
    }

    @Test
    void testStrictModeAbortsOnDanglingEdge() {
        ValidationCollector strict = new ValidationCollector(ValidationMode.STRICT);
        Diagram.Builder builder = Diagram.builder(strict, null)
                .node(Node.of("a", "A", ShapeKind.RECTANGLE))
                .edge(Edge.of("e1", "a", "missing", ""));

        assertThatThrownBy(builder::build)
                .isInstanceOf(DiagramValidationException.class)
                .hasMessageContaining("e1");
        assertThat(strict.getIssues()).hasSize(1);
    }

    @Test
    void testNormalModeDoesNotAbortOnGhostEdge() {
        ValidationCollector normal = new ValidationCollector(ValidationMode.NORMAL);
        Diagram diagram = Diagram.builder(normal, null)
                .edge(Edge.of("ghost", null, null, ""))
                .build();

        assertThat(diagram.getEdges()).isEmpty();
        assertThat(normal.getIssues(ValidationSeverity.WARNING)).hasSize(1);
    }

    @Test
    void testDuplicateIdsRejected() {
        Diagram diagram = Diagram.builder(collector, null)
                .node(Node.of("a", "A", ShapeKind.RECTANGLE))
                .node(Node.of("a", "Again", ShapeKind.RECTANGLE))
                .build();

        assertThat(diagram.getNodes().get("a").label()).isEqualTo("A");
        assertThat(collector.getIssues(ValidationSeverity.ERROR)).hasSize(1);
    }

    private static Node decision(String id, String name) {
        return new Node(id, "?", "", ShapeKind.RHOMBUS, null, null, ElementMetadata.named(name), null);
    }
}

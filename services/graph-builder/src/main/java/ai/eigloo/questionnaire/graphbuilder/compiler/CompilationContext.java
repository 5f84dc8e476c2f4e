package ai.eigloo.questionnaire.graphbuilder.compiler;

import ai.eigloo.questionnaire.diagram.external.ExternalReferenceOracle;
import ai.eigloo.questionnaire.diagram.model.Diagram;
import ai.eigloo.questionnaire.diagram.model.Group;
import ai.eigloo.questionnaire.diagram.validation.ValidationCollector;
import ai.eigloo.questionnaire.graphbuilder.logic.ReferenceLookup;

import java.util.Map;
import java.util.Optional;

/**
 * State shared by the passes of one compilation.
 */
public class CompilationContext implements ReferenceLookup {

    private final Diagram diagram;
    private final CompiledGraph graph;
    private final ValidationCollector collector;
    private final ExternalReferenceOracle oracle;

    private NameIndex nameIndex;
    private long indexedVersion = -1;

    public CompilationContext(Diagram diagram, CompiledGraph graph) {
        this.diagram = diagram;
        this.graph = graph;
        this.collector = diagram.getCollector();
        this.oracle = diagram.getOracle();
    }

    public Diagram getDiagram() {
        return diagram;
    }

    public CompiledGraph getGraph() {
        return graph;
    }

    public ValidationCollector getCollector() {
        return collector;
    }

    public Map<String, Group> getGroups() {
        return diagram.getGroups();
    }

    /**
     * Name index of the current graph, rebuilt when the graph structure changed since the
     * last call.
     */
    public NameIndex nameIndex() {
        if (nameIndex == null || indexedVersion != graph.structureVersion()) {
            nameIndex = NameIndex.build(graph, diagram.getGroups().values());
            indexedVersion = graph.structureVersion();
        }
        return nameIndex;
    }

    @Override
    public Optional<CompiledNode> findNodeByName(String name) {
        return nameIndex().nodeId(name).flatMap(graph::getNode);
    }

    @Override
    public boolean isExternalFlag(String name) {
        return oracle.isFlagReference(name);
    }

    @Override
    public boolean isExternalNumeric(String name) {
        return oracle.isNumericReference(name);
    }
}

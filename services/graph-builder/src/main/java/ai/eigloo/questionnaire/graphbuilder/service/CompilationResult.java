package ai.eigloo.questionnaire.graphbuilder.service;

import ai.eigloo.questionnaire.diagram.validation.ValidationReport;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledGraph;

import java.util.Optional;

/**
 * Outcome of one compilation.
 *
 * @param graph the compiled graph, null when compilation aborted before a usable graph existed
 * @param report every issue reported along the way
 */
public record CompilationResult(CompiledGraph graph, ValidationReport report) {

    public CompilationResult {
        if (report == null) {
            throw new IllegalArgumentException("Compilation result needs a report");
        }
    }

    public Optional<CompiledGraph> compiledGraph() {
        return Optional.ofNullable(graph);
    }

    public boolean succeeded() {
        return graph != null;
    }
}

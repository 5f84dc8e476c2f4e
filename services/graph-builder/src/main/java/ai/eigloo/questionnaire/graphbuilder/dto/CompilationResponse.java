package ai.eigloo.questionnaire.graphbuilder.dto;

import ai.eigloo.questionnaire.diagram.validation.ValidationMode;
import ai.eigloo.questionnaire.diagram.validation.ValidationReport;
import ai.eigloo.questionnaire.diagram.validation.ValidationSeverity;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledGraph;
import ai.eigloo.questionnaire.graphbuilder.service.CompilationResult;

import java.util.List;
import java.util.Map;

/**
 * Response of the compile endpoint: the compiled graph, when there is one, and the validation
 * report.
 */
public class CompilationResponse {

    private boolean compiled;
    private List<CompiledNodeDto> nodes;
    private List<CompiledEdgeDto> edges;
    private ValidationMode validationMode;
    private Map<ValidationSeverity, Integer> issueCounts;
    private boolean criticalIssues;
    private List<ValidationIssueDto> issues;

    public static CompilationResponse from(CompilationResult result) {
        CompilationResponse response = new CompilationResponse();
        CompiledGraph graph = result.graph();
        response.compiled = graph != null;
        response.nodes = graph == null ? List.of()
                : graph.nodes().stream().map(CompiledNodeDto::from).toList();
        response.edges = graph == null ? List.of()
                : graph.edges().stream().map(CompiledEdgeDto::from).toList();

        ValidationReport report = result.report();
        response.validationMode = report.mode();
        response.issueCounts = report.counts();
        response.criticalIssues = report.hasCriticalIssues();
        response.issues = report.issues().stream().map(ValidationIssueDto::from).toList();
        return response;
    }

    public boolean isCompiled() {
        return compiled;
    }

    public List<CompiledNodeDto> getNodes() {
        return nodes;
    }

    public List<CompiledEdgeDto> getEdges() {
        return edges;
    }

    public ValidationMode getValidationMode() {
        return validationMode;
    }

    public Map<ValidationSeverity, Integer> getIssueCounts() {
        return issueCounts;
    }

    public boolean isCriticalIssues() {
        return criticalIssues;
    }

    public List<ValidationIssueDto> getIssues() {
        return issues;
    }
}

package ai.eigloo.questionnaire.graphbuilder.service;

import ai.eigloo.questionnaire.diagram.exception.DiagramValidationException;
import ai.eigloo.questionnaire.diagram.external.ExternalReferences;
import ai.eigloo.questionnaire.diagram.model.Diagram;
import ai.eigloo.questionnaire.diagram.validation.ValidationCollector;
import ai.eigloo.questionnaire.diagram.validation.ValidationMode;
import ai.eigloo.questionnaire.diagram.validation.ValidationReport;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledGraph;
import ai.eigloo.questionnaire.graphbuilder.compiler.GraphCompiler;
import ai.eigloo.questionnaire.graphbuilder.config.CompilerProperties;
import ai.eigloo.questionnaire.graphbuilder.ingest.DiagramIngestor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Runs read, ingest and compile for one draw.io document.
 *
 * <p>Each call gets its own {@link ValidationCollector}. The result always carries the report;
 * the graph is missing only when the collector's mode aborted compilation or the document
 * could not be read at all.</p>
 */
@Service
public class QuestionnaireCompilationService {

    private static final Logger logger = LoggerFactory.getLogger(QuestionnaireCompilationService.class);

    private final DiagramIngestor ingestor;
    private final GraphCompiler compiler;
    private final ExternalReferences externalReferences;
    private final CompilerProperties properties;

    public QuestionnaireCompilationService(DiagramIngestor ingestor,
                                           GraphCompiler compiler,
                                           ExternalReferences externalReferences,
                                           CompilerProperties properties) {
        this.ingestor = ingestor;
        this.compiler = compiler;
        this.externalReferences = externalReferences;
        this.properties = properties;
    }

    public CompilationResult compile(String xml) {
        return compile(xml, null);
    }

    /**
     * Compiles the document.
     *
     * @param xml draw.io document
     * @param mode validation mode, the configured default when null
     */
    public CompilationResult compile(String xml, ValidationMode mode) {
        ValidationMode effectiveMode = mode != null ? mode : properties.getValidationMode();
        String correlationId = getOrCreateCorrelationId();
        ValidationCollector collector = new ValidationCollector(effectiveMode);
        logger.info("Compiling questionnaire diagram in {} mode [correlationId={}]", effectiveMode, correlationId);

        CompiledGraph graph = null;
        try {
            Optional<Diagram> diagram = ingestor.ingest(xml, collector);
            if (diagram.isPresent()) {
                graph = compiler.compile(diagram.get());
            }
        } catch (DiagramValidationException e) {
            logger.warn("Compilation aborted in {} mode: {} [correlationId={}]",
                    effectiveMode, e.getMessage(), correlationId);
        }

        ValidationReport report = collector.report();
        logger.info("Compilation finished with {} issues, graph {} [correlationId={}]",
                report.totalIssues(), graph != null ? "available" : "not available", correlationId);
        return new CompilationResult(graph, report);
    }

    public ExternalReferences externalReferences() {
        return externalReferences;
    }

    private String getOrCreateCorrelationId() {
        String mdcId = MDC.get("correlationId");
        if (mdcId != null && !mdcId.trim().isEmpty()) {
            return mdcId;
        }
        String newId = UUID.randomUUID().toString();
        MDC.put("correlationId", newId);
        return newId;
    }
}

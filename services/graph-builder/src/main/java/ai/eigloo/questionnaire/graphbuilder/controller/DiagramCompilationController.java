package ai.eigloo.questionnaire.graphbuilder.controller;

import ai.eigloo.questionnaire.diagram.external.ExternalReferences;
import ai.eigloo.questionnaire.graphbuilder.dto.CompilationResponse;
import ai.eigloo.questionnaire.graphbuilder.dto.CompileDiagramRequest;
import ai.eigloo.questionnaire.graphbuilder.service.CompilationResult;
import ai.eigloo.questionnaire.graphbuilder.service.QuestionnaireCompilationService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for compiling questionnaire diagrams.
 */
@RestController
@RequestMapping("/api/v1/diagrams")
public class DiagramCompilationController {

    private final QuestionnaireCompilationService compilationService;

    public DiagramCompilationController(QuestionnaireCompilationService compilationService) {
        this.compilationService = compilationService;
    }

    /**
     * Compile a draw.io document. The response always carries the validation report; the
     * graph is empty when compilation aborted.
     *
     * @param request document and optional validation mode
     * @return compiled graph and report
     */
    @PostMapping("/compile")
    public ResponseEntity<CompilationResponse> compile(@Valid @RequestBody CompileDiagramRequest request) {
        CompilationResult result = compilationService.compile(request.getXml(), request.getValidationMode());
        return ResponseEntity.ok(CompilationResponse.from(result));
    }

    @GetMapping("/external-references")
    public ResponseEntity<ExternalReferences> externalReferences() {
        return ResponseEntity.ok(compilationService.externalReferences());
    }
}

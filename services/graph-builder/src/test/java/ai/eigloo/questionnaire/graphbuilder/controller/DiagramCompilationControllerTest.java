package ai.eigloo.questionnaire.graphbuilder.controller;

import ai.eigloo.questionnaire.diagram.external.ExternalReferences;
import ai.eigloo.questionnaire.diagram.style.ShapeClassifier;
import ai.eigloo.questionnaire.diagram.validation.ValidationCollector;
import ai.eigloo.questionnaire.diagram.validation.ValidationMode;
import ai.eigloo.questionnaire.graphbuilder.TestResourceUtils;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledGraph;
import ai.eigloo.questionnaire.graphbuilder.compiler.GraphCompiler;
import ai.eigloo.questionnaire.graphbuilder.dto.CompileDiagramRequest;
import ai.eigloo.questionnaire.graphbuilder.exception.GraphBuilderExceptionHandler;
import ai.eigloo.questionnaire.graphbuilder.ingest.DiagramIngestor;
import ai.eigloo.questionnaire.graphbuilder.ingest.DrawIoXmlReader;
import ai.eigloo.questionnaire.graphbuilder.logic.ConditionCalculator;
import ai.eigloo.questionnaire.graphbuilder.service.CompilationResult;
import ai.eigloo.questionnaire.graphbuilder.service.QuestionnaireCompilationService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DiagramCompilationControllerTest {

    @Mock
    private QuestionnaireCompilationService compilationService;

    private MockMvc mockMvc;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        mockMvc = MockMvcBuilders.standaloneSetup(new DiagramCompilationController(compilationService))
                .setControllerAdvice(new GraphBuilderExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
                .build();
    }

    @Test
    void testCompileReturnsGraphAndReport() throws Exception {
        // Given
        String xml = TestResourceUtils.readResource("diagrams/smoking_questionnaire.drawio");
        when(compilationService.compile(xml, ValidationMode.NORMAL)).thenReturn(compileForReal(xml));
        CompileDiagramRequest request = new CompileDiagramRequest(xml, ValidationMode.NORMAL);

        // When & Then
        mockMvc.perform(post("/api/v1/diagrams/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.compiled").value(true))
                .andExpect(jsonPath("$.validationMode").value("NORMAL"))
                .andExpect(jsonPath("$.nodes.length()").value(5))
                .andExpect(jsonPath("$.nodes[0].id").value("q1"))
                .andExpect(jsonPath("$.nodes[0].type").value("SELECT_ONE"))
                .andExpect(jsonPath("$.nodes[0].options[0].id").value("q1_yes"))
                .andExpect(jsonPath("$.edges[0].id").value("e1"))
                .andExpect(jsonPath("$.edges[0].logic.subject").value("q1"))
                .andExpect(jsonPath("$.criticalIssues").value(false))
                .andExpect(jsonPath("$.issues.length()").value(1))
                .andExpect(jsonPath("$.issues[0].elementId").value("e8"))
                .andExpect(jsonPath("$.issues[0].severity").value("WARNING"));
    }

    @Test
    void testCompileWithoutModeUsesServiceDefault() throws Exception {
        // Given
        String xml = TestResourceUtils.readResource("diagrams/cyclic_questionnaire.drawio");
        ValidationCollector collector = new ValidationCollector(ValidationMode.NORMAL);
        collector.warning("Example", "a", "Node");
        when(compilationService.compile(eq(xml), isNull())).thenReturn(new CompilationResult(null, collector.report()));

        // When & Then
        mockMvc.perform(post("/api/v1/diagrams/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new CompileDiagramRequest(xml, null))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.compiled").value(false))
                .andExpect(jsonPath("$.nodes.length()").value(0))
                .andExpect(jsonPath("$.issues[0].message").value("Example"));
    }

    @Test
    void testBlankDiagramIsRejected() throws Exception {
        // Given
        CompileDiagramRequest request = new CompileDiagramRequest("  ", ValidationMode.NORMAL);

        // When & Then
        mockMvc.perform(post("/api/v1/diagrams/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));

        verify(compilationService, never()).compile(anyString(), any());
    }

    @Test
    void testUnreadableBodyIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/diagrams/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"xml\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
    }

    @Test
    void testExternalReferencesAreListed() throws Exception {
        // Given
        when(compilationService.externalReferences())
                .thenReturn(new ExternalReferences(Set.of("high_risk"), Set.of("bmi")));

        // When & Then
        mockMvc.perform(get("/api/v1/diagrams/external-references"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.flags[0]").value("high_risk"))
                .andExpect(jsonPath("$.numeric[0]").value("bmi"));
    }

    private static CompilationResult compileForReal(String xml) {
        ValidationCollector collector = new ValidationCollector(ValidationMode.NORMAL);
        DiagramIngestor ingestor = new DiagramIngestor(new DrawIoXmlReader(), ExternalReferences.empty());
        GraphCompiler compiler = new GraphCompiler(new ShapeClassifier(), new ConditionCalculator());
        CompiledGraph graph = compiler.compile(ingestor.ingest(xml, collector).orElseThrow());
        return new CompilationResult(graph, collector.report());
    }
}

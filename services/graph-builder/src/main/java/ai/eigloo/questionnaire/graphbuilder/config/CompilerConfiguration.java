package ai.eigloo.questionnaire.graphbuilder.config;

import ai.eigloo.questionnaire.diagram.external.ExternalReferences;
import ai.eigloo.questionnaire.diagram.external.ExternalReferencesLoader;
import ai.eigloo.questionnaire.diagram.style.ShapeClassifier;
import ai.eigloo.questionnaire.graphbuilder.compiler.GraphCompiler;
import ai.eigloo.questionnaire.graphbuilder.ingest.DiagramIngestor;
import ai.eigloo.questionnaire.graphbuilder.ingest.DrawIoXmlReader;
import ai.eigloo.questionnaire.graphbuilder.logic.ConditionCalculator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Wires the compiler components. All of them are stateless and shared across requests.
 */
@Configuration
public class CompilerConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(CompilerConfiguration.class);

    static final String CLASSPATH_PREFIX = "classpath:";

    @Bean
    public ExternalReferences externalReferences(CompilerProperties properties, ObjectMapper objectMapper) {
        ExternalReferencesLoader loader = new ExternalReferencesLoader(objectMapper);
        String location = properties.getExternalReferencesPath();
        if (location == null || location.isBlank()) {
            return loader.load((Path) null);
        }
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
                if (in == null) {
                    logger.warn("External references resource {} not found, using an empty registry", resource);
                    return ExternalReferences.empty();
                }
                return loader.load(in);
            } catch (IOException e) {
                logger.warn("Failed to close external references resource {}: {}", resource, e.getMessage());
                return ExternalReferences.empty();
            }
        }
        return loader.load(Path.of(location));
    }

    @Bean
    public ShapeClassifier shapeClassifier() {
        return new ShapeClassifier();
    }

    @Bean
    public ConditionCalculator conditionCalculator() {
        return new ConditionCalculator();
    }

    @Bean
    public GraphCompiler graphCompiler(ShapeClassifier shapeClassifier, ConditionCalculator conditionCalculator) {
        return new GraphCompiler(shapeClassifier, conditionCalculator);
    }

    @Bean
    public DrawIoXmlReader drawIoXmlReader() {
        return new DrawIoXmlReader();
    }

    @Bean
    public DiagramIngestor diagramIngestor(DrawIoXmlReader reader, ExternalReferences externalReferences) {
        return new DiagramIngestor(reader, externalReferences);
    }
}

package ai.eigloo.questionnaire.graphbuilder;

import ai.eigloo.questionnaire.graphbuilder.config.CompilerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main Spring Boot application class for the questionnaire graph builder service.
 * The service compiles draw.io questionnaire flowcharts into logic-annotated graphs.
 */
@SpringBootApplication
@EnableConfigurationProperties(CompilerProperties.class)
public class GraphBuilderApplication {

    public static void main(String[] args) {
        SpringApplication.run(GraphBuilderApplication.class, args);
    }
}

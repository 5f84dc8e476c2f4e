package ai.eigloo.questionnaire.diagram.external;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link ExternalReferences} from a JSON document of the form
 * {@code {"flags": [...], "numeric": [...]}}.
 *
 * <p>A missing or unreadable document never fails the caller: it yields an empty registry
 * and a warning.</p>
 */
public class ExternalReferencesLoader {

    private static final Logger logger = LoggerFactory.getLogger(ExternalReferencesLoader.class);

    private final ObjectMapper objectMapper;

    public ExternalReferencesLoader() {
        this(new ObjectMapper());
    }

    public ExternalReferencesLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ExternalReferences load(Path path) {
        if (path == null) {
            logger.debug("No external references path configured, using an empty registry");
            return ExternalReferences.empty();
        }
        if (!Files.isRegularFile(path)) {
            logger.warn("External references file {} does not exist, using an empty registry", path);
            return ExternalReferences.empty();
        }
        try (InputStream in = Files.newInputStream(path)) {
            ExternalReferences references = read(in);
            logger.info("Loaded {} flag and {} numeric external references from {}",
                    references.flags().size(), references.numeric().size(), path);
            return references;
        } catch (IOException e) {
            logger.warn("Failed to load external references from {}: {}", path, e.getMessage());
            return ExternalReferences.empty();
        }
    }

    public ExternalReferences load(InputStream in) {
        if (in == null) {
            return ExternalReferences.empty();
        }
        try {
            return read(in);
        } catch (IOException e) {
            logger.warn("Failed to load external references: {}", e.getMessage());
            return ExternalReferences.empty();
        }
    }

    private ExternalReferences read(InputStream in) throws IOException {
        ExternalReferences references = objectMapper.readValue(in, ExternalReferences.class);
        return references != null ? references : ExternalReferences.empty();
    }
}

package ai.eigloo.questionnaire.graphbuilder.ingest;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One element of a diagram source document.
 */
public interface SourceElement {

    /**
     * The {@code id} attribute, or null when absent.
     */
    String id();

    String tag();

    Map<String, String> attributes();

    /**
     * Attributes of the element's geometry child, empty when it has none.
     */
    Map<String, String> geometryAttributes();

    Optional<SourceElement> parent();

    List<SourceElement> children();

    default String attribute(String name) {
        return attributes().get(name);
    }

    default String attribute(String name, String defaultValue) {
        String value = attributes().get(name);
        return value != null ? value : defaultValue;
    }

    /**
     * Closest ancestor with the given tag.
     */
    default Optional<SourceElement> ancestor(String tag) {
        Optional<SourceElement> current = parent();
        while (current.isPresent()) {
            if (tag.equals(current.get().tag())) {
                return current;
            }
            current = current.get().parent();
        }
        return Optional.empty();
    }
}

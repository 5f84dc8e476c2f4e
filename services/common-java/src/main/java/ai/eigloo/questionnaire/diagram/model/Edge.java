package ai.eigloo.questionnaire.diagram.model;

/**
 * A connector between two diagram elements.
 *
 * <p>Source and target may be missing while the edge is being read; {@link #endpointState()}
 * tells which one. Only {@link EndpointState#VALID} edges survive ingestion.</p>
 *
 * @param id edge id
 * @param label edge label, trimmed
 * @param pageId id of the page holding the edge
 * @param metadata optional metadata
 * @param source source element id, or null
 * @param target target element id, or null
 */
public record Edge(
        String id,
        String label,
        String pageId,
        ElementMetadata metadata,
        String source,
        String target
) {

    public Edge {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Edge id cannot be null or empty");
        }
        label = label == null ? "" : label.trim();
        pageId = pageId == null ? "" : pageId;
        source = blankToNull(source);
        target = blankToNull(target);
    }

    public static Edge of(String id, String source, String target, String label) {
        return new Edge(id, label, "", null, source, target);
    }

    public EndpointState endpointState() {
        if (source == null && target == null) {
            return EndpointState.GHOST;
        }
        if (source == null) {
            return EndpointState.MISSING_SOURCE;
        }
        if (target == null) {
            return EndpointState.MISSING_TARGET;
        }
        return EndpointState.VALID;
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value;
    }
}

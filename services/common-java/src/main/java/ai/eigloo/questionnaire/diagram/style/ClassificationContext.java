package ai.eigloo.questionnaire.diagram.style;

import java.util.List;

/**
 * Structural context of a node at classification time.
 *
 * @param rounded whether the node is drawn with rounded corners
 * @param fillColor the fill colour, may be null
 * @param incomingEdgeCount number of edges pointing at the node
 * @param outgoingEdgeLabels labels of the edges leaving the node, in edge order
 */
public record ClassificationContext(
        boolean rounded,
        String fillColor,
        int incomingEdgeCount,
        List<String> outgoingEdgeLabels
) {

    public ClassificationContext {
        if (incomingEdgeCount < 0) {
            throw new IllegalArgumentException("Incoming edge count cannot be negative");
        }
        outgoingEdgeLabels = outgoingEdgeLabels == null ? List.of() : List.copyOf(outgoingEdgeLabels);
    }

    public static ClassificationContext isolated(boolean rounded, String fillColor) {
        return new ClassificationContext(rounded, fillColor, 0, List.of());
    }
}

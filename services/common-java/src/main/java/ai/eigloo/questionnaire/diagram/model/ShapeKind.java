package ai.eigloo.questionnaire.diagram.model;

import ai.eigloo.questionnaire.diagram.style.StyleGrammar;

import java.util.Map;

/**
 * Closed set of node shapes recognised in questionnaire diagrams.
 */
public enum ShapeKind {
    RECTANGLE("rectangle"),
    HEXAGON("hexagon"),
    ELLIPSE("ellipse"),
    RHOMBUS("rhombus"),
    CALLOUT("callout"),
    OFF_PAGE_CONNECTOR("offPageConnector"),
    LIST("list");

    private final String styleName;

    ShapeKind(String styleName) {
        this.styleName = styleName;
    }

    public String styleName() {
        return styleName;
    }

    /**
     * Derives the shape from a parsed style map.
     *
     * <p>List shapes need both the swimlane marker and a stack child layout. Rhombus and
     * ellipse are signalled by a bare key, the remaining shapes by the {@code shape} key.
     * Anything else is a rectangle.</p>
     */
    public static ShapeKind fromStyle(Map<String, String> style) {
        if (style == null || style.isEmpty()) {
            return RECTANGLE;
        }
        String shape = style.getOrDefault("shape", "");

        boolean swimlane = StyleGrammar.hasKey(style, "swimlane") || "swimlane".equals(shape);
        if (swimlane && "stackLayout".equals(style.get("childLayout"))) {
            return LIST;
        }
        if (StyleGrammar.hasKey(style, "rhombus") || "rhombus".equals(shape)) {
            return RHOMBUS;
        }
        if (StyleGrammar.hasKey(style, "ellipse") || "ellipse".equals(shape)) {
            return ELLIPSE;
        }
        return switch (shape) {
            case "hexagon" -> HEXAGON;
            case "callout" -> CALLOUT;
            case "offPageConnector" -> OFF_PAGE_CONNECTOR;
            default -> RECTANGLE;
        };
    }
}

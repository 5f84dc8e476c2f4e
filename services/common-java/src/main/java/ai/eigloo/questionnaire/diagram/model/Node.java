package ai.eigloo.questionnaire.diagram.model;

import java.util.List;

/**
 * A shape in the diagram.
 *
 * <p>Only {@link ShapeKind#LIST} nodes may carry options, and a {@link ShapeKind#RHOMBUS}
 * must name the element it conditions on.</p>
 *
 * @param id element id
 * @param label plain-text label
 * @param pageId id of the page holding the node
 * @param shape shape kind
 * @param geometry geometry
 * @param style style
 * @param metadata optional metadata
 * @param options options of a list node, null for every other shape
 */
public record Node(
        String id,
        String label,
        String pageId,
        ShapeKind shape,
        Geometry geometry,
        Style style,
        ElementMetadata metadata,
        List<SelectOption> options
) {

    public Node {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Node id cannot be null or empty");
        }
        if (shape == null) {
            throw new IllegalArgumentException("Node '" + id + "' must have a shape");
        }
        if (shape != ShapeKind.LIST && options != null) {
            throw new IllegalArgumentException("Only list nodes can have options, node '" + id + "' is a " + shape.styleName());
        }
        if (shape == ShapeKind.RHOMBUS && (metadata == null || !metadata.hasName())) {
            throw new IllegalArgumentException("Rhombus node '" + id + "' must have a name to reference another node");
        }
        label = label == null ? "" : label;
        pageId = pageId == null ? "" : pageId;
        geometry = geometry == null ? Geometry.empty() : geometry;
        style = style == null ? Style.plain() : style;
        if (options != null) {
            options = List.copyOf(options);
        }
    }

    public static Node of(String id, String label, ShapeKind shape) {
        return new Node(id, label, "", shape, Geometry.empty(), Style.plain(), null, null);
    }

    public String name() {
        return metadata != null ? metadata.name() : null;
    }

    public List<SelectOption> optionsOrEmpty() {
        return options != null ? options : List.of();
    }

    public Node withOptions(List<SelectOption> newOptions) {
        return new Node(id, label, pageId, shape, geometry, style, metadata, newOptions);
    }

    public Node withStyle(Style newStyle) {
        return new Node(id, label, pageId, shape, geometry, newStyle, metadata, options);
    }
}

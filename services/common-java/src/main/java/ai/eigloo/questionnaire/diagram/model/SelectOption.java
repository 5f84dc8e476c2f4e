package ai.eigloo.questionnaire.diagram.model;

import java.util.Comparator;

/**
 * A user choice inside a list node.
 *
 * @param id option cell id; edges leaving the option use it as their source
 * @param label option text
 * @param parentId id of the owning list node
 * @param geometry option geometry, used for ordering
 * @param style option style
 */
public record SelectOption(String id, String label, String parentId, Geometry geometry, Style style) {

    /**
     * Top-to-bottom, then left-to-right.
     */
    public static final Comparator<SelectOption> VERTICAL_ORDER = Comparator
            .comparingDouble((SelectOption option) -> option.geometry().y())
            .thenComparingDouble(option -> option.geometry().x());

    public SelectOption {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Select option id cannot be null or empty");
        }
        if (parentId == null || parentId.trim().isEmpty()) {
            throw new IllegalArgumentException("Select option '" + id + "' must reference its list node");
        }
        label = label == null ? "" : label;
        geometry = geometry == null ? Geometry.empty() : geometry;
        style = style == null ? Style.plain() : style;
    }
}

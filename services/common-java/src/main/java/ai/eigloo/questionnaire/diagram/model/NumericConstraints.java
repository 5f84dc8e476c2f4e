package ai.eigloo.questionnaire.diagram.model;

/**
 * Bounds attached to numeric (hexagon / ellipse) inputs.
 *
 * @param min lower bound, inclusive, or null
 * @param max upper bound, inclusive, or null
 * @param message message shown when a value is out of bounds, or null
 */
public record NumericConstraints(Double min, Double max, String message) {

    public NumericConstraints {
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("Numeric constraint min " + min + " exceeds max " + max);
        }
    }

    public boolean isEmpty() {
        return min == null && max == null && (message == null || message.isBlank());
    }
}

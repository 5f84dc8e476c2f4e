package ai.eigloo.questionnaire.diagram.model;

/**
 * Position and size of a non-edge diagram element.
 */
public record Geometry(double x, double y, double width, double height) {

    private static final Geometry EMPTY = new Geometry(0, 0, 0, 0);

    public Geometry {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Geometry dimensions must not be negative");
        }
    }

    public static Geometry empty() {
        return EMPTY;
    }
}

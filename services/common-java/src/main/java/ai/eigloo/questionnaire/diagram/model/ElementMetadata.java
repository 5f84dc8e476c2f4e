package ai.eigloo.questionnaire.diagram.model;

/**
 * Non-visual information attached to a diagram element.
 *
 * @param name cross-reference key; rhombus and goto nodes use it to point at another element
 * @param numericConstraints bounds for numeric inputs, or null
 */
public record ElementMetadata(String name, NumericConstraints numericConstraints) {

    public ElementMetadata {
        if (name != null) {
            name = name.trim();
            if (name.isEmpty()) {
                name = null;
            }
        }
    }

    public static ElementMetadata named(String name) {
        return new ElementMetadata(name, null);
    }

    public boolean hasName() {
        return name != null;
    }
}

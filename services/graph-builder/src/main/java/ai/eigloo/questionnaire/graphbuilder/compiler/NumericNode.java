package ai.eigloo.questionnaire.graphbuilder.compiler;

import ai.eigloo.questionnaire.diagram.model.NumericConstraints;

/**
 * A numeric input (integer from hexagons, decimal from ellipses).
 */
public class NumericNode extends CompiledNode {

    private final NumericValueType valueType;
    private final NumericConstraints constraints;

    public NumericNode(String id, String label, String pageId, String name,
                       NumericValueType valueType, NumericConstraints constraints) {
        super(id, label, pageId, name);
        if (valueType == null) {
            throw new IllegalArgumentException("Numeric node '" + id + "' needs a value type");
        }
        this.valueType = valueType;
        this.constraints = constraints;
    }

    @Override
    public CompiledNodeType type() {
        return CompiledNodeType.NUMERIC;
    }

    public NumericValueType getValueType() {
        return valueType;
    }

    /**
     * Bounds for the input, or null when the diagram sets none.
     */
    public NumericConstraints getConstraints() {
        return constraints;
    }
}

package ai.eigloo.questionnaire.graphbuilder.compiler;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NumericValueType {
    INT("int"),
    DECIMAL("decimal");

    private final String value;

    NumericValueType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

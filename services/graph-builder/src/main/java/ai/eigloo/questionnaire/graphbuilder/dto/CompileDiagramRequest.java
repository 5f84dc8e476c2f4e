package ai.eigloo.questionnaire.graphbuilder.dto;

import ai.eigloo.questionnaire.diagram.validation.ValidationMode;
import jakarta.validation.constraints.NotBlank;

/**
 * Request to compile one draw.io document.
 */
public class CompileDiagramRequest {

    @NotBlank(message = "Diagram xml cannot be blank")
    private String xml;

    private ValidationMode validationMode;

    public CompileDiagramRequest() {
    }

    public CompileDiagramRequest(String xml, ValidationMode validationMode) {
        this.xml = xml;
        this.validationMode = validationMode;
    }

    public String getXml() {
        return xml;
    }

    public void setXml(String xml) {
        this.xml = xml;
    }

    public ValidationMode getValidationMode() {
        return validationMode;
    }

    public void setValidationMode(ValidationMode validationMode) {
        this.validationMode = validationMode;
    }
}

package ai.eigloo.questionnaire.graphbuilder.config;

import ai.eigloo.questionnaire.diagram.validation.ValidationMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Compiler settings.
 */
@ConfigurationProperties(prefix = "questionnaire.compiler")
public class CompilerProperties {

    private ValidationMode validationMode = ValidationMode.NORMAL;

    /**
     * JSON file listing the flag and numeric names that decision points may reference across
     * diagrams. No external references are allowed when unset.
     */
    private String externalReferencesPath;

    public ValidationMode getValidationMode() {
        return validationMode;
    }

    public void setValidationMode(ValidationMode validationMode) {
        this.validationMode = validationMode;
    }

    public String getExternalReferencesPath() {
        return externalReferencesPath;
    }

    public void setExternalReferencesPath(String externalReferencesPath) {
        this.externalReferencesPath = externalReferencesPath;
    }
}

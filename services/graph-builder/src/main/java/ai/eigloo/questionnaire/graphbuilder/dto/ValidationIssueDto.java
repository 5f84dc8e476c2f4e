package ai.eigloo.questionnaire.graphbuilder.dto;

import ai.eigloo.questionnaire.diagram.validation.ValidationIssue;
import ai.eigloo.questionnaire.diagram.validation.ValidationSeverity;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationIssueDto(
        ValidationSeverity severity,
        String message,
        String elementId,
        String elementType,
        String fieldName,
        String timestamp
) {

    public static ValidationIssueDto from(ValidationIssue issue) {
        return new ValidationIssueDto(issue.severity(), issue.message(), issue.elementId(),
                issue.elementType(), issue.fieldName(), issue.timestamp().toString());
    }
}

package ai.eigloo.questionnaire.graphbuilder.dto;

/**
 * Error body returned for rejected requests.
 */
public record ErrorResponse(String error, String message) {
}

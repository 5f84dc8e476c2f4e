package ai.eigloo.questionnaire.graphbuilder.exception;

import ai.eigloo.questionnaire.diagram.exception.DiagramParsingException;
import ai.eigloo.questionnaire.diagram.exception.DiagramValidationException;
import ai.eigloo.questionnaire.graphbuilder.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps request and diagram failures to 400 responses.
 */
@RestControllerAdvice
public class GraphBuilderExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GraphBuilderExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        logger.debug("Rejected compile request: {}", message);
        return badRequest("INVALID_REQUEST", message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(HttpMessageNotReadableException e) {
        logger.debug("Unreadable compile request: {}", e.getMessage());
        return badRequest("INVALID_REQUEST", "Request body could not be read");
    }

    @ExceptionHandler({DiagramParsingException.class, DiagramValidationException.class})
    public ResponseEntity<ErrorResponse> handleDiagramFailure(RuntimeException e) {
        logger.warn("Diagram rejected: {}", e.getMessage());
        return badRequest("INVALID_DIAGRAM", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        logger.warn("Bad request: {}", e.getMessage());
        return badRequest("BAD_REQUEST", e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> badRequest(String error, String message) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorResponse(error, message));
    }
}

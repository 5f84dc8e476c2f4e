package ai.eigloo.questionnaire.diagram.exception;

/**
 * Thrown when a diagram source cannot be read at all.
 */
public class DiagramParsingException extends RuntimeException {

    public DiagramParsingException(String message) {
        super(message);
    }

    public DiagramParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}

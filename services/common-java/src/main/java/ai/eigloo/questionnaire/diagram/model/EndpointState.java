package ai.eigloo.questionnaire.diagram.model;

/**
 * Connection state of an edge.
 */
public enum EndpointState {
    /** Both endpoints are present. */
    VALID,
    /** The source is missing. */
    MISSING_SOURCE,
    /** The target is missing. */
    MISSING_TARGET,
    /** Neither endpoint is present. */
    GHOST
}

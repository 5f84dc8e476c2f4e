package ai.eigloo.questionnaire.graphbuilder.logic;

import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledNode;

import java.util.Optional;

/**
 * Name resolution available to the condition calculator.
 */
public interface ReferenceLookup {

    /**
     * Finds the node carrying {@code name}, ignoring decision points and goto connectors.
     */
    Optional<CompiledNode> findNodeByName(String name);

    boolean isExternalFlag(String name);

    boolean isExternalNumeric(String name);
}

package ai.eigloo.questionnaire.diagram.external;

/**
 * Registry of names that decision points may reference outside the diagram.
 */
public interface ExternalReferenceOracle {

    boolean isFlagReference(String name);

    boolean isNumericReference(String name);

    /**
     * An oracle that knows no external names.
     */
    static ExternalReferenceOracle none() {
        return ExternalReferences.EMPTY;
    }
}

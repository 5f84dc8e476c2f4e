package ai.eigloo.questionnaire.graphbuilder.compiler;

/**
 * An answer option of a compiled select node.
 *
 * @param id option id
 * @param label option label, also the value stored on edges that leave the option
 * @param synthesized true for the yes/no options derived from a yes/no question
 */
public record CompiledOption(String id, String label, boolean synthesized) {

    public CompiledOption {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Option id cannot be null or empty");
        }
        label = label == null ? "" : label;
    }
}

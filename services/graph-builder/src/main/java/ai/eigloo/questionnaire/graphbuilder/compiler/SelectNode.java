package ai.eigloo.questionnaire.graphbuilder.compiler;

import java.util.List;
import java.util.Optional;

/**
 * A question answered by picking from a list of options.
 */
public abstract class SelectNode extends CompiledNode {

    private final List<CompiledOption> options;

    protected SelectNode(String id, String label, String pageId, String name, List<CompiledOption> options) {
        super(id, label, pageId, name);
        this.options = options == null ? List.of() : List.copyOf(options);
    }

    public List<CompiledOption> getOptions() {
        return options;
    }

    public Optional<CompiledOption> findOption(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return options.stream().filter(option -> option.label().equals(label)).findFirst();
    }

    /**
     * True when the options were synthesized from yes/no edge labels.
     */
    public boolean isYesNo() {
        return !options.isEmpty() && options.stream().allMatch(CompiledOption::synthesized);
    }
}

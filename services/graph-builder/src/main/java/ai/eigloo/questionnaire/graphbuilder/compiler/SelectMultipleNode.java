package ai.eigloo.questionnaire.graphbuilder.compiler;

import java.util.List;

public class SelectMultipleNode extends SelectNode {

    public SelectMultipleNode(String id, String label, String pageId, String name, List<CompiledOption> options) {
        super(id, label, pageId, name, options);
    }

    @Override
    public CompiledNodeType type() {
        return CompiledNodeType.SELECT_MULTIPLE;
    }
}

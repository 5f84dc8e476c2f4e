package ai.eigloo.questionnaire.graphbuilder.compiler;

public class HintNode extends CompiledNode {

    public HintNode(String id, String label, String pageId, String name) {
        super(id, label, pageId, name);
    }

    @Override
    public CompiledNodeType type() {
        return CompiledNodeType.HINT;
    }
}

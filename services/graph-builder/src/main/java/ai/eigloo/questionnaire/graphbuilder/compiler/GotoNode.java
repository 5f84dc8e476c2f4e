package ai.eigloo.questionnaire.graphbuilder.compiler;

public class GotoNode extends CompiledNode {

    public GotoNode(String id, String label, String pageId, String name) {
        super(id, label, pageId, name);
    }

    @Override
    public CompiledNodeType type() {
        return CompiledNodeType.GOTO;
    }
}

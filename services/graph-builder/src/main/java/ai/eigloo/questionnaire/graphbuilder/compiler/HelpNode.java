package ai.eigloo.questionnaire.graphbuilder.compiler;

public class HelpNode extends CompiledNode {

    public HelpNode(String id, String label, String pageId, String name) {
        super(id, label, pageId, name);
    }

    @Override
    public CompiledNodeType type() {
        return CompiledNodeType.HELP;
    }
}

package ai.eigloo.questionnaire.graphbuilder.compiler;

public class NoteNode extends CompiledNode {

    public NoteNode(String id, String label, String pageId, String name) {
        super(id, label, pageId, name);
    }

    @Override
    public CompiledNodeType type() {
        return CompiledNodeType.NOTE;
    }
}

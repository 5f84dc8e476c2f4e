package ai.eigloo.questionnaire.graphbuilder.compiler;

/**
 * A free-text input.
 */
public class TextNode extends CompiledNode {

    public TextNode(String id, String label, String pageId, String name) {
        super(id, label, pageId, name);
    }

    @Override
    public CompiledNodeType type() {
        return CompiledNodeType.TEXT;
    }
}

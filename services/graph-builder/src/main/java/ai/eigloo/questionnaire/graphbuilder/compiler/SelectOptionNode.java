package ai.eigloo.questionnaire.graphbuilder.compiler;

/**
 * Placeholder for a list option while its outgoing edges are still attached to it.
 */
public class SelectOptionNode extends CompiledNode {

    private final String parentId;

    public SelectOptionNode(String id, String label, String pageId, String parentId) {
        super(id, label, pageId, null);
        this.parentId = parentId;
    }

    @Override
    public CompiledNodeType type() {
        return CompiledNodeType.SELECT_OPTION;
    }

    public String getParentId() {
        return parentId;
    }
}

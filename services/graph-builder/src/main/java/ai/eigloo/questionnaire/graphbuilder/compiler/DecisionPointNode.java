package ai.eigloo.questionnaire.graphbuilder.compiler;

/**
 * A branch on a previously answered question, flag or external reference.
 */
public class DecisionPointNode extends CompiledNode {

    public DecisionPointNode(String id, String label, String pageId, String name) {
        super(id, label, pageId, name);
    }

    @Override
    public CompiledNodeType type() {
        return CompiledNodeType.DECISION_POINT;
    }
}

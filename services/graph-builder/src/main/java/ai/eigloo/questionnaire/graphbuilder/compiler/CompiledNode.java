package ai.eigloo.questionnaire.graphbuilder.compiler;

/**
 * Base class of the compiled node variants.
 *
 * <p>Identity and type are fixed. Attributes that compiler passes attach later (group, help
 * and hint text) and the label, which note fusion rewrites, are mutable.</p>
 */
public abstract class CompiledNode {

    private final String id;
    private final String pageId;
    private final String name;
    private String label;
    private String groupId;
    private String groupHeading;
    private String helpText;
    private String hintText;

    protected CompiledNode(String id, String label, String pageId, String name) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Compiled node id cannot be null or empty");
        }
        this.id = id;
        this.label = label == null ? "" : label;
        this.pageId = pageId == null ? "" : pageId;
        this.name = name;
    }

    public abstract CompiledNodeType type();

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label == null ? "" : label;
    }

    public String getPageId() {
        return pageId;
    }

    public String getName() {
        return name;
    }

    public String getGroupId() {
        return groupId;
    }

    public String getGroupHeading() {
        return groupHeading;
    }

    public void assignGroup(String groupId, String groupHeading) {
        this.groupId = groupId;
        this.groupHeading = groupHeading;
    }

    public String getHelpText() {
        return helpText;
    }

    public void setHelpText(String helpText) {
        this.helpText = helpText;
    }

    public String getHintText() {
        return hintText;
    }

    public void setHintText(String hintText) {
        this.hintText = hintText;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id='" + id + "', label='" + label + "'}";
    }
}

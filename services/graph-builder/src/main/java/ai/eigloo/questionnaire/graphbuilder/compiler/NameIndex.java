package ai.eigloo.questionnaire.graphbuilder.compiler;

import ai.eigloo.questionnaire.diagram.model.Group;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of the names that goto connectors and decision points can point at.
 *
 * <p>Goto and decision point nodes are never indexed. For duplicate names the first node in
 * graph order wins; nodes win over groups.</p>
 */
public final class NameIndex {

    private final Map<String, String> nodeIds;
    private final Map<String, String> groupIds;

    private NameIndex(Map<String, String> nodeIds, Map<String, String> groupIds) {
        this.nodeIds = Collections.unmodifiableMap(nodeIds);
        this.groupIds = Collections.unmodifiableMap(groupIds);
    }

    public static NameIndex build(CompiledGraph graph, Collection<Group> groups) {
        LinkedHashMap<String, String> nodeIds = new LinkedHashMap<>();
        for (CompiledNode node : graph.nodes()) {
            if (node.getName() == null
                    || node.type() == CompiledNodeType.GOTO
                    || node.type() == CompiledNodeType.DECISION_POINT) {
                continue;
            }
            nodeIds.putIfAbsent(node.getName(), node.getId());
        }
        LinkedHashMap<String, String> groupIds = new LinkedHashMap<>();
        for (Group group : groups) {
            if (group.name() != null) {
                groupIds.putIfAbsent(group.name(), group.id());
            }
        }
        return new NameIndex(nodeIds, groupIds);
    }

    public Optional<String> nodeId(String name) {
        return Optional.ofNullable(name == null ? null : nodeIds.get(name));
    }

    /**
     * Node id for the name, falling back to a group id.
     */
    public Optional<String> targetId(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String id = nodeIds.get(name);
        return Optional.ofNullable(id != null ? id : groupIds.get(name));
    }

    public int size() {
        return nodeIds.size() + groupIds.size();
    }
}

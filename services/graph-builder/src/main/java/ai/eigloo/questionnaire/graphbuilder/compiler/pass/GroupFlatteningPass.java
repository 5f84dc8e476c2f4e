package ai.eigloo.questionnaire.graphbuilder.compiler.pass;

import ai.eigloo.questionnaire.diagram.model.Group;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompilationContext;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledEdge;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledGraph;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledNode;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledNodeType;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompilerPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Dissolves groups: members are tagged with the group, and edges into a group are redirected
 * to its first member that is neither help nor hint.
 */
public class GroupFlatteningPass implements CompilerPass {

    private static final Logger logger = LoggerFactory.getLogger(GroupFlatteningPass.class);

    @Override
    public String name() {
        return "group-flattening";
    }

    @Override
    public void apply(CompilationContext context) {
        CompiledGraph graph = context.getGraph();
        Map<String, Group> groups = context.getGroups();

        for (Group group : groups.values()) {
            for (String member : group.containedElements()) {
                graph.getNode(member).ifPresent(node -> node.assignGroup(group.id(), group.label()));
            }
        }

        for (CompiledEdge edge : graph.edgeSnapshot()) {
            Group group = groups.get(edge.target());
            if (group == null) {
                continue;
            }
            Optional<String> entry = firstEligibleMember(group, graph);
            if (entry.isPresent()) {
                graph.replaceEdge(edge.redirectedFromGroup(group.id(), entry.get()));
            } else {
                graph.removeEdge(edge.id());
                context.getCollector().error(
                        "Group '" + group.id() + "' has no member that can be entered, edge dropped", edge.id(), "Edge");
            }
        }
        logger.debug("Flattened {} groups", groups.size());
    }

    private static Optional<String> firstEligibleMember(Group group, CompiledGraph graph) {
        for (String member : group.containedElements()) {
            Optional<CompiledNode> node = graph.getNode(member);
            if (node.isPresent()
                    && node.get().type() != CompiledNodeType.HELP
                    && node.get().type() != CompiledNodeType.HINT) {
                return Optional.of(member);
            }
        }
        return Optional.empty();
    }
}

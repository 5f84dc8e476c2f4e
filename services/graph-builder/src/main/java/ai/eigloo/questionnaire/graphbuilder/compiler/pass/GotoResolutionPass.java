package ai.eigloo.questionnaire.graphbuilder.compiler.pass;

import ai.eigloo.questionnaire.graphbuilder.compiler.CompilationContext;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledEdge;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledGraph;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledNodeType;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompilerPass;
import ai.eigloo.questionnaire.graphbuilder.compiler.GotoNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Replaces goto connectors by direct edges to the node or group they name.
 *
 * <p>Unmatched gotos stay in the graph and are reported. Edges leaving a resolved goto have
 * nowhere to go and are dropped.</p>
 */
public class GotoResolutionPass implements CompilerPass {

    private static final Logger logger = LoggerFactory.getLogger(GotoResolutionPass.class);

    @Override
    public String name() {
        return "goto-resolution";
    }

    @Override
    public void apply(CompilationContext context) {
        CompiledGraph graph = context.getGraph();
        int resolved = 0;
        for (String id : graph.nodeIdsOfType(CompiledNodeType.GOTO)) {
            GotoNode gotoNode = (GotoNode) graph.getNode(id).orElseThrow();
            String name = gotoNode.getName();
            if (name == null) {
                context.getCollector().warning("Goto node has no name to resolve", id, "Node");
                continue;
            }
            Optional<String> target = context.nameIndex().targetId(name);
            if (target.isEmpty()) {
                context.getCollector().warning("Goto target '" + name + "' not found, goto kept", id, "Node");
                continue;
            }
            for (CompiledEdge edge : graph.incoming(id)) {
                graph.replaceEdge(edge.withTarget(target.get()));
            }
            for (CompiledEdge dropped : graph.removeNode(id)) {
                context.getCollector().warning(
                        "Edge leaving resolved goto '" + id + "' dropped", dropped.id(), "Edge");
            }
            resolved++;
        }
        logger.debug("Resolved {} goto nodes", resolved);
    }
}

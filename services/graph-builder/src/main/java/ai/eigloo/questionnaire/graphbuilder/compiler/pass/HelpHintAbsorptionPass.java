package ai.eigloo.questionnaire.graphbuilder.compiler.pass;

import ai.eigloo.questionnaire.graphbuilder.compiler.CompilationContext;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledEdge;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledGraph;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledNode;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledNodeType;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompilerPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns help and hint nodes into text attached to the nodes they point at.
 */
public class HelpHintAbsorptionPass implements CompilerPass {

    private static final Logger logger = LoggerFactory.getLogger(HelpHintAbsorptionPass.class);

    @Override
    public String name() {
        return "help-hint-absorption";
    }

    @Override
    public void apply(CompilationContext context) {
        CompiledGraph graph = context.getGraph();
        int absorbed = 0;
        for (String id : graph.nodeIdSnapshot()) {
            CompiledNode node = graph.getNode(id).orElse(null);
            if (node == null
                    || (node.type() != CompiledNodeType.HELP && node.type() != CompiledNodeType.HINT)) {
                continue;
            }
            List<CompiledEdge> outgoing = graph.outgoing(id);
            if (outgoing.isEmpty()) {
                context.getCollector().warning(
                        "Help or hint node does not point at any node, removed", id, "Node");
            }
            for (CompiledEdge edge : outgoing) {
                graph.getNode(edge.target()).ifPresent(target -> {
                    if (node.type() == CompiledNodeType.HELP) {
                        target.setHelpText(node.getLabel());
                    } else {
                        target.setHintText(node.getLabel());
                    }
                });
            }
            graph.removeNode(id);
            absorbed++;
        }
        logger.debug("Absorbed {} help and hint nodes", absorbed);
    }
}

package ai.eigloo.questionnaire.graphbuilder.compiler.pass;

import ai.eigloo.questionnaire.graphbuilder.compiler.CompilationContext;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledEdge;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledGraph;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledNode;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledOption;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompilerPass;
import ai.eigloo.questionnaire.graphbuilder.compiler.SelectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the edges leaving list options onto the owning select node and deletes the option
 * nodes. The moved edges remember the option label.
 */
public class SelectOptionInliningPass implements CompilerPass {

    private static final Logger logger = LoggerFactory.getLogger(SelectOptionInliningPass.class);

    @Override
    public String name() {
        return "select-option-inlining";
    }

    @Override
    public void apply(CompilationContext context) {
        CompiledGraph graph = context.getGraph();
        int inlined = 0;
        for (String id : graph.nodeIdSnapshot()) {
            CompiledNode node = graph.getNode(id).orElse(null);
            if (!(node instanceof SelectNode)) {
                continue;
            }
            for (CompiledOption option : ((SelectNode) node).getOptions()) {
                if (option.synthesized() || !graph.containsNode(option.id())) {
                    continue;
                }
                for (CompiledEdge edge : graph.outgoing(option.id())) {
                    graph.replaceEdge(edge.withSource(node.getId()).withOption(option.label()));
                }
                graph.removeNode(option.id());
                inlined++;
            }
        }
        logger.debug("Inlined {} list options", inlined);
    }
}

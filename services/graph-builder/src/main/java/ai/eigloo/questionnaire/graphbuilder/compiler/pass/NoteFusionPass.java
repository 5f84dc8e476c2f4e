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
 * Merges chains of notes into one note.
 *
 * <p>A note whose only successor is a note with no other predecessor absorbs it: labels are
 * joined with a blank line and the successor's outgoing edges move to the absorbing note.
 * Runs until no pair is left, so running it twice changes nothing.</p>
 */
public class NoteFusionPass implements CompilerPass {

    private static final Logger logger = LoggerFactory.getLogger(NoteFusionPass.class);

    static final String SEPARATOR = "\n\n";

    @Override
    public String name() {
        return "note-fusion";
    }

    @Override
    public void apply(CompilationContext context) {
        CompiledGraph graph = context.getGraph();
        int fused = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String id : graph.nodeIdSnapshot()) {
                CompiledNode current = graph.getNode(id).orElse(null);
                if (current == null || current.type() != CompiledNodeType.NOTE) {
                    continue;
                }
                List<String> successors = graph.successors(id);
                if (successors.size() != 1 || successors.get(0).equals(id)) {
                    continue;
                }
                CompiledNode next = graph.getNode(successors.get(0)).orElse(null);
                if (next == null
                        || next.type() != CompiledNodeType.NOTE
                        || graph.predecessors(next.getId()).size() != 1) {
                    continue;
                }
                fuse(graph, current, next);
                fused++;
                changed = true;
            }
        }
        logger.debug("Fused {} notes", fused);
    }

    private static void fuse(CompiledGraph graph, CompiledNode current, CompiledNode next) {
        current.setLabel(current.getLabel() + SEPARATOR + next.getLabel());
        if (current.getHelpText() == null) {
            current.setHelpText(next.getHelpText());
        }
        if (current.getHintText() == null) {
            current.setHintText(next.getHintText());
        }
        for (CompiledEdge edge : graph.outgoing(next.getId())) {
            graph.replaceEdge(edge.withSource(current.getId()));
        }
        graph.removeNode(next.getId());
    }
}

package ai.eigloo.questionnaire.graphbuilder.compiler;

import ai.eigloo.questionnaire.diagram.model.Diagram;
import ai.eigloo.questionnaire.diagram.model.Edge;
import ai.eigloo.questionnaire.diagram.style.ShapeClassifier;
import ai.eigloo.questionnaire.graphbuilder.compiler.pass.ConditionCalculationPass;
import ai.eigloo.questionnaire.graphbuilder.compiler.pass.GotoResolutionPass;
import ai.eigloo.questionnaire.graphbuilder.compiler.pass.GroupFlatteningPass;
import ai.eigloo.questionnaire.graphbuilder.compiler.pass.HelpHintAbsorptionPass;
import ai.eigloo.questionnaire.graphbuilder.compiler.pass.NoteFusionPass;
import ai.eigloo.questionnaire.graphbuilder.compiler.pass.SelectOptionInliningPass;
import ai.eigloo.questionnaire.graphbuilder.compiler.pass.TypeConsolidationPass;
import ai.eigloo.questionnaire.graphbuilder.logic.ConditionCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Compiles a validated {@link Diagram} into a {@link CompiledGraph}.
 *
 * <p>The graph is seeded with the diagram's edges, rewritten by the passes in a fixed order and
 * checked by {@link CompiledGraphValidator}. Issues go to the diagram's collector. The compiler
 * holds no per-compilation state and can be shared.</p>
 */
public class GraphCompiler {

    private static final Logger logger = LoggerFactory.getLogger(GraphCompiler.class);

    private final List<CompilerPass> passes;

    public GraphCompiler(ShapeClassifier classifier, ConditionCalculator calculator) {
        this.passes = List.of(
                new TypeConsolidationPass(classifier),
                new SelectOptionInliningPass(),
                new GotoResolutionPass(),
                new GroupFlatteningPass(),
                new HelpHintAbsorptionPass(),
                new NoteFusionPass(),
                new ConditionCalculationPass(calculator));
    }

    public List<CompilerPass> getPasses() {
        return passes;
    }

    public CompiledGraph compile(Diagram diagram) {
        CompiledGraph graph = new CompiledGraph();
        for (Edge edge : diagram.getEdges().values()) {
            graph.addEdge(CompiledEdge.of(edge.id(), edge.source(), edge.target(), edge.label()));
        }

        CompilationContext context = new CompilationContext(diagram, graph);
        for (CompilerPass pass : passes) {
            pass.apply(context);
            logger.debug("Pass {} done: {} nodes, {} edges", pass.name(), graph.nodeCount(), graph.edgeCount());
        }

        CompiledGraphValidator.validate(graph, diagram.getCollector());
        logger.info("Compiled diagram into {} nodes and {} edges", graph.nodeCount(), graph.edgeCount());
        return graph;
    }
}

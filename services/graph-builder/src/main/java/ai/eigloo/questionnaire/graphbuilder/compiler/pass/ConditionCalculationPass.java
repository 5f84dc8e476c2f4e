package ai.eigloo.questionnaire.graphbuilder.compiler.pass;

import ai.eigloo.questionnaire.graphbuilder.compiler.CompilationContext;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledEdge;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledGraph;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompilerPass;
import ai.eigloo.questionnaire.graphbuilder.logic.ConditionCalculator;
import ai.eigloo.questionnaire.graphbuilder.logic.ConditionExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attaches the branch condition to every edge.
 */
public class ConditionCalculationPass implements CompilerPass {

    private static final Logger logger = LoggerFactory.getLogger(ConditionCalculationPass.class);

    private final ConditionCalculator calculator;

    public ConditionCalculationPass(ConditionCalculator calculator) {
        this.calculator = calculator;
    }

    @Override
    public String name() {
        return "condition-calculation";
    }

    @Override
    public void apply(CompilationContext context) {
        CompiledGraph graph = context.getGraph();
        int withLogic = 0;
        for (CompiledEdge edge : graph.edgeSnapshot()) {
            ConditionExpr logic = calculator
                    .calculate(edge, graph.getNode(edge.source()).orElse(null), context)
                    .orElse(null);
            if (logic != null) {
                withLogic++;
            }
            graph.replaceEdge(edge.withLogic(logic));
        }
        logger.debug("Calculated logic for {} of {} edges", withLogic, graph.edgeCount());
    }
}

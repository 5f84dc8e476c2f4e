package ai.eigloo.questionnaire.graphbuilder.compiler.pass;

import ai.eigloo.questionnaire.diagram.model.Node;
import ai.eigloo.questionnaire.diagram.model.NumericConstraints;
import ai.eigloo.questionnaire.diagram.model.SelectOption;
import ai.eigloo.questionnaire.diagram.style.Classification;
import ai.eigloo.questionnaire.diagram.style.ClassificationContext;
import ai.eigloo.questionnaire.diagram.style.ShapeClassifier;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompilationContext;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledEdge;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledGraph;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledNode;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompiledOption;
import ai.eigloo.questionnaire.graphbuilder.compiler.CompilerPass;
import ai.eigloo.questionnaire.graphbuilder.compiler.DecisionPointNode;
import ai.eigloo.questionnaire.graphbuilder.compiler.FlagNode;
import ai.eigloo.questionnaire.graphbuilder.compiler.GotoNode;
import ai.eigloo.questionnaire.graphbuilder.compiler.HelpNode;
import ai.eigloo.questionnaire.graphbuilder.compiler.HintNode;
import ai.eigloo.questionnaire.graphbuilder.compiler.NoteNode;
import ai.eigloo.questionnaire.graphbuilder.compiler.NumericNode;
import ai.eigloo.questionnaire.graphbuilder.compiler.NumericValueType;
import ai.eigloo.questionnaire.graphbuilder.compiler.SelectMultipleNode;
import ai.eigloo.questionnaire.graphbuilder.compiler.SelectOneNode;
import ai.eigloo.questionnaire.graphbuilder.compiler.SelectOptionNode;
import ai.eigloo.questionnaire.graphbuilder.compiler.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Classifies every diagram node and adds its consolidated variant to the graph.
 *
 * <p>Calculations and diagnoses become flags, integer and decimal inputs become numeric
 * inputs, and yes/no questions become select-one questions with synthesized {@code yes} and
 * {@code no} options; their outgoing yes/no edges get the matching option. List options are
 * added as temporary option nodes so that their outgoing edges stay attached until inlining.</p>
 */
public class TypeConsolidationPass implements CompilerPass {

    private static final Logger logger = LoggerFactory.getLogger(TypeConsolidationPass.class);

    static final String YES = "yes";
    static final String NO = "no";

    private final ShapeClassifier classifier;

    public TypeConsolidationPass(ShapeClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public String name() {
        return "type-consolidation";
    }

    @Override
    public void apply(CompilationContext context) {
        CompiledGraph graph = context.getGraph();
        for (Node node : List.copyOf(context.getDiagram().getNodes().values())) {
            List<CompiledEdge> outgoing = graph.outgoing(node.id());
            List<String> outgoingLabels = outgoing.stream().map(CompiledEdge::label).toList();
            ClassificationContext classificationContext = new ClassificationContext(
                    node.style().rounded(),
                    node.style().fillColor(),
                    graph.incoming(node.id()).size(),
                    outgoingLabels);
            Classification classification = classifier.classify(node.shape(), classificationContext);
            if (graph.containsNode(node.id())) {
                context.getCollector().error("Node id '" + node.id() + "' collides with a list option, node ignored",
                        node.id(), "Node");
                continue;
            }
            graph.addNode(consolidate(node, classification, outgoing, context));
        }
        logger.debug("Consolidated {} nodes", graph.nodeCount());
    }

    private CompiledNode consolidate(Node node, Classification classification,
                                     List<CompiledEdge> outgoing, CompilationContext context) {
        String id = node.id();
        String label = node.label();
        String pageId = node.pageId();
        String name = node.name();
        return switch (classification.kind()) {
            case SELECT_ONE_YESNO -> yesNoQuestion(node, outgoing, context.getGraph());
            case SELECT_ONE -> new SelectOneNode(id, label, pageId, name, listOptions(node, context.getGraph()));
            case SELECT_MULTIPLE -> new SelectMultipleNode(id, label, pageId, name, listOptions(node, context.getGraph()));
            case INTEGER -> new NumericNode(id, label, pageId, name, NumericValueType.INT, constraints(node));
            case DECIMAL -> new NumericNode(id, label, pageId, name, NumericValueType.DECIMAL, constraints(node));
            case TEXT -> new TextNode(id, label, pageId, name);
            case GOTO -> new GotoNode(id, label, pageId, name);
            case NOTE -> new NoteNode(id, label, pageId, name);
            case CALCULATE -> new FlagNode(id, label, pageId, name, false, null);
            case DIAGNOSIS -> new FlagNode(id, label, pageId, name, true, classification.severity());
            case HELP -> new HelpNode(id, label, pageId, name);
            case HINT -> new HintNode(id, label, pageId, name);
            case DECISION_POINT -> new DecisionPointNode(id, label, pageId, name);
            case UNKNOWN -> {
                context.getCollector().warning("Node shape could not be classified, treated as a note", id, "Node");
                yield new NoteNode(id, label, pageId, name);
            }
        };
    }

    private static SelectOneNode yesNoQuestion(Node node, List<CompiledEdge> outgoing, CompiledGraph graph) {
        for (CompiledEdge edge : outgoing) {
            graph.replaceEdge(edge.withOption(edge.label().trim().toLowerCase(Locale.ROOT)));
        }
        List<CompiledOption> options = List.of(
                new CompiledOption(node.id() + "_" + YES, YES, true),
                new CompiledOption(node.id() + "_" + NO, NO, true));
        return new SelectOneNode(node.id(), node.label(), node.pageId(), node.name(), options);
    }

    private static List<CompiledOption> listOptions(Node node, CompiledGraph graph) {
        List<CompiledOption> options = new ArrayList<>();
        for (SelectOption option : node.optionsOrEmpty()) {
            options.add(new CompiledOption(option.id(), option.label(), false));
            if (!graph.containsNode(option.id())) {
                graph.addNode(new SelectOptionNode(option.id(), option.label(), node.pageId(), node.id()));
            }
        }
        return options;
    }

    private static NumericConstraints constraints(Node node) {
        return node.metadata() != null ? node.metadata().numericConstraints() : null;
    }
}

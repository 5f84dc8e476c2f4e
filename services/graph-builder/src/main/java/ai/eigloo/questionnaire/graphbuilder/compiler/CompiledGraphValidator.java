package ai.eigloo.questionnaire.graphbuilder.compiler;

import ai.eigloo.questionnaire.diagram.exception.DiagramValidationException;
import ai.eigloo.questionnaire.diagram.validation.ValidationCollector;
import ai.eigloo.questionnaire.diagram.validation.ValidationSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structural checks run on a graph after compilation.
 *
 * <ul>
 *   <li>a cycle makes the graph unusable and is reported at CRITICAL;</li>
 *   <li>nodes without any edge are reported at WARNING;</li>
 *   <li>a graph without an entry point is reported at ERROR, one with several entry points
 *       at WARNING;</li>
 *   <li>edges whose source or target is not a node are reported at ERROR.</li>
 * </ul>
 */
public final class CompiledGraphValidator {

    private static final Logger logger = LoggerFactory.getLogger(CompiledGraphValidator.class);

    private enum Mark { UNVISITED, IN_PROGRESS, DONE }

    private CompiledGraphValidator() {
    }

    /**
     * Validates the graph, reporting to the collector.
     *
     * @param graph the compiled graph
     * @param collector issue sink; when null a cycle is raised directly
     * @throws DiagramValidationException when a cycle is found and no collector is given, or
     *         when the collector's mode aborts on a reported issue
     */
    public static void validate(CompiledGraph graph, ValidationCollector collector) {
        findCycle(graph).ifPresent(cycle -> {
            String message = "Compiled graph contains a cycle: " + String.join(" -> ", cycle);
            if (collector == null) {
                throw new DiagramValidationException(message);
            }
            collector.critical(message, cycle.get(0), "Graph");
        });
        if (collector == null) {
            return;
        }
        for (CompiledNode node : graph.nodes()) {
            if (graph.degree(node.getId()) == 0) {
                collector.warning("Node '" + node.getId() + "' is not connected to any other node", node.getId(), "Node");
            }
        }
        validateEntryPoints(graph, collector);
        for (CompiledEdge edge : graph.edges()) {
            if (!graph.containsNode(edge.source())) {
                collector.add(ValidationSeverity.ERROR,
                        "Edge source '" + edge.source() + "' is not a node", edge.id(), "Edge", "source");
            } else if (!graph.containsNode(edge.target())) {
                collector.add(ValidationSeverity.ERROR,
                        "Edge target '" + edge.target() + "' is not a node", edge.id(), "Edge", "target");
            }
        }
        logger.debug("Validated compiled graph with {} nodes and {} edges", graph.nodeCount(), graph.edgeCount());
    }

    private static void validateEntryPoints(CompiledGraph graph, ValidationCollector collector) {
        boolean connected = graph.nodes().stream().anyMatch(node -> graph.degree(node.getId()) > 0);
        if (!connected) {
            return;
        }
        List<String> entryPoints = graph.entryPoints();
        if (entryPoints.isEmpty()) {
            collector.error("Compiled graph has no entry point", null, "Graph");
        } else if (entryPoints.size() > 1) {
            collector.warning("Compiled graph has multiple entry points: " + String.join(", ", entryPoints),
                    entryPoints.get(0), "Graph");
        }
    }

    /**
     * Depth-first search for a back edge.
     *
     * @return the node ids along the cycle, first node repeated at the end
     */
    public static Optional<List<String>> findCycle(CompiledGraph graph) {
        Map<String, List<String>> adjacency = new HashMap<>();
        for (CompiledEdge edge : graph.edges()) {
            if (graph.containsNode(edge.source()) && graph.containsNode(edge.target())) {
                adjacency.computeIfAbsent(edge.source(), key -> new ArrayList<>()).add(edge.target());
            }
        }
        Map<String, Mark> marks = new HashMap<>();
        Map<String, String> parents = new HashMap<>();

        for (String start : graph.nodeIdSnapshot()) {
            if (marks.getOrDefault(start, Mark.UNVISITED) != Mark.UNVISITED) {
                continue;
            }
            Deque<Iterator<String>> stack = new ArrayDeque<>();
            Deque<String> path = new ArrayDeque<>();
            marks.put(start, Mark.IN_PROGRESS);
            stack.push(adjacency.getOrDefault(start, List.of()).iterator());
            path.push(start);

            while (!stack.isEmpty()) {
                Iterator<String> next = stack.peek();
                if (!next.hasNext()) {
                    marks.put(path.pop(), Mark.DONE);
                    stack.pop();
                    continue;
                }
                String current = path.peek();
                String successor = next.next();
                Mark mark = marks.getOrDefault(successor, Mark.UNVISITED);
                if (mark == Mark.IN_PROGRESS) {
                    return Optional.of(cyclePath(parents, current, successor));
                }
                if (mark == Mark.UNVISITED) {
                    marks.put(successor, Mark.IN_PROGRESS);
                    parents.put(successor, current);
                    stack.push(adjacency.getOrDefault(successor, List.of()).iterator());
                    path.push(successor);
                }
            }
        }
        return Optional.empty();
    }

    private static List<String> cyclePath(Map<String, String> parents, String from, String to) {
        List<String> cycle = new ArrayList<>();
        cycle.add(to);
        String current = from;
        while (current != null && !current.equals(to)) {
            cycle.add(current);
            current = parents.get(current);
        }
        cycle.add(to);
        Collections.reverse(cycle);
        return cycle;
    }
}

package ai.eigloo.questionnaire.diagram.model;

import ai.eigloo.questionnaire.diagram.external.ExternalReferenceOracle;
import ai.eigloo.questionnaire.diagram.validation.ValidationCollector;
import ai.eigloo.questionnaire.diagram.validation.ValidationMode;
import ai.eigloo.questionnaire.diagram.validation.ValidationSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated intermediate representation of one questionnaire diagram.
 *
 * <p>Elements are kept in insertion order. Problems found while adding elements or running
 * {@link #validate()} are reported to the bound {@link ValidationCollector}; offending edges and
 * groups are dropped, offending nodes are kept.</p>
 */
public class Diagram {

    private static final Logger logger = LoggerFactory.getLogger(Diagram.class);

    static final String NODE = "Node";
    static final String EDGE = "Edge";
    static final String GROUP = "Group";

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, Edge> edges = new LinkedHashMap<>();
    private final Map<String, Group> groups = new LinkedHashMap<>();
    private final ValidationCollector collector;
    private final ExternalReferenceOracle oracle;

    private Map<String, String> nameIndex;
    private Map<String, SelectOption> optionIndex;

    public Diagram(ValidationCollector collector, ExternalReferenceOracle oracle) {
        this.collector = collector != null ? collector : new ValidationCollector(ValidationMode.LENIENT);
        this.oracle = oracle != null ? oracle : ExternalReferenceOracle.none();
    }

    public static Builder builder(ValidationCollector collector, ExternalReferenceOracle oracle) {
        return new Builder(collector, oracle);
    }

    public ValidationCollector getCollector() {
        return collector;
    }

    public ExternalReferenceOracle getOracle() {
        return oracle;
    }

    public Map<String, Node> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public Map<String, Edge> getEdges() {
        return Collections.unmodifiableMap(edges);
    }

    public Map<String, Group> getGroups() {
        return Collections.unmodifiableMap(groups);
    }

    public Optional<Node> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public Optional<Group> getGroup(String id) {
        return Optional.ofNullable(groups.get(id));
    }

    public void addNode(Node node) {
        if (nodes.containsKey(node.id()) || groups.containsKey(node.id())) {
            collector.error("Duplicate element id '" + node.id() + "', node ignored", node.id(), NODE);
            return;
        }
        nodes.put(node.id(), node);
        invalidateIndexes();
    }

    public void addGroup(Group group) {
        if (nodes.containsKey(group.id()) || groups.containsKey(group.id())) {
            collector.error("Duplicate element id '" + group.id() + "', group ignored", group.id(), GROUP);
            return;
        }
        groups.put(group.id(), group);
        invalidateIndexes();
    }

    /**
     * Adds an edge when both endpoints are present.
     *
     * @return true when the edge was kept
     */
    public boolean addEdge(Edge edge) {
        switch (edge.endpointState()) {
            case GHOST -> {
                collector.warning("Ghost edge without source and target ignored", edge.id(), EDGE);
                return false;
            }
            case MISSING_SOURCE -> {
                collector.add(ValidationSeverity.ERROR,
                        "Edge has no source. " + describeEndpoint(edge.target(), "Target"), edge.id(), EDGE, "source");
                return false;
            }
            case MISSING_TARGET -> {
                collector.add(ValidationSeverity.ERROR,
                        "Edge has no target. " + describeEndpoint(edge.source(), "Source"), edge.id(), EDGE, "target");
                return false;
            }
            default -> {
                if (edges.containsKey(edge.id())) {
                    collector.error("Duplicate edge id '" + edge.id() + "', edge ignored", edge.id(), EDGE);
                    return false;
                }
                edges.put(edge.id(), edge);
                return true;
            }
        }
    }

    /**
     * Describes the endpoint that an edge still has, for endpoint error messages.
     */
    String describeEndpoint(String elementId, String role) {
        Node node = nodes.get(elementId);
        if (node != null) {
            return role + " '" + elementId + "' is a " + node.shape().styleName() + " node, label is '" + node.label() + "'";
        }
        Optional<SelectOption> option = findOption(elementId);
        if (option.isPresent()) {
            return role + " '" + elementId + "' is a select option, label is '" + option.get().label() + "'";
        }
        Group group = groups.get(elementId);
        if (group != null) {
            return role + " '" + elementId + "' is a group with " + group.containedElements().size()
                    + " elements, label is '" + group.label() + "'";
        }
        return role + " '" + elementId + "' is not an element of the diagram";
    }

    public void replaceNode(Node node) {
        if (!nodes.containsKey(node.id())) {
            throw new IllegalArgumentException("Unknown node '" + node.id() + "'");
        }
        nodes.put(node.id(), node);
        invalidateIndexes();
    }

    public void removeEdge(String edgeId) {
        edges.remove(edgeId);
    }

    /**
     * Checks the whole-model invariants, dropping what cannot be kept.
     *
     * <p>Groups are checked before edges so that edges pointing at a dropped group are
     * dropped in the same call. Running it again on a clean diagram reports nothing.</p>
     */
    public void validate() {
        validateGroups();
        validateEdges();
        validateListNodes();
        validateDecisionReferences();
        logger.debug("Diagram validated: {} nodes, {} edges, {} groups", nodes.size(), edges.size(), groups.size());
    }

    private void validateGroups() {
        for (Group group : List.copyOf(groups.values())) {
            LinkedHashSet<String> members = new LinkedHashSet<>();
            for (String member : group.containedElements()) {
                if (nodes.containsKey(member)) {
                    members.add(member);
                } else {
                    collector.error("Group '" + group.id() + "' contains unknown element '" + member + "', member removed",
                            group.id(), GROUP);
                }
            }
            if (members.isEmpty()) {
                groups.remove(group.id());
                collector.error("Group '" + group.id() + "' has no members and was dropped", group.id(), GROUP);
            } else if (members.size() != group.containedElements().size()) {
                groups.put(group.id(), group.withContainedElements(members));
            }
        }
        invalidateIndexes();
    }

    private void validateEdges() {
        for (Edge edge : List.copyOf(edges.values())) {
            String source = edge.source();
            if (groups.containsKey(source)) {
                drop(edge, "Edge source '" + source + "' is a group", "source");
            } else if (!nodes.containsKey(source) && findOption(source).isEmpty()) {
                drop(edge, "Edge references non-existent source '" + source + "'", "source");
            } else if (!nodes.containsKey(edge.target()) && !groups.containsKey(edge.target())) {
                drop(edge, "Edge references non-existent target '" + edge.target() + "'", "target");
            }
        }
    }

    private void drop(Edge edge, String message, String field) {
        edges.remove(edge.id());
        collector.add(ValidationSeverity.ERROR,
                message + ", edge dropped", edge.id(), EDGE, field);
    }

    private void validateListNodes() {
        for (Node node : nodes.values()) {
            if (node.shape() == ShapeKind.LIST && node.optionsOrEmpty().isEmpty()) {
                collector.error("List node '" + node.id() + "' has no options", node.id(), NODE);
            }
        }
    }

    private void validateDecisionReferences() {
        for (Node node : List.copyOf(nodes.values())) {
            if (node.shape() != ShapeKind.RHOMBUS) {
                continue;
            }
            String name = node.name();
            boolean internal = resolveName(name).filter(id -> !id.equals(node.id())).isPresent();
            if (!internal && !oracle.isFlagReference(name) && !oracle.isNumericReference(name)) {
                collector.add(ValidationSeverity.ERROR,
                        "Decision point references unknown element '" + name + "'", node.id(), NODE, "name");
            }
        }
    }

    /**
     * Index of referable names to element ids.
     *
     * <p>Decision points and goto connectors carry names that point elsewhere, so they are not
     * indexed. Nodes are indexed before groups and the first element with a given name wins.
     * The index is rebuilt on first use after a mutation.</p>
     */
    public Map<String, String> nameIndex() {
        if (nameIndex == null) {
            LinkedHashMap<String, String> index = new LinkedHashMap<>();
            for (Node node : nodes.values()) {
                if (node.name() != null
                        && node.shape() != ShapeKind.RHOMBUS
                        && node.shape() != ShapeKind.OFF_PAGE_CONNECTOR) {
                    index.putIfAbsent(node.name(), node.id());
                }
            }
            for (Group group : groups.values()) {
                if (group.name() != null) {
                    index.putIfAbsent(group.name(), group.id());
                }
            }
            nameIndex = Collections.unmodifiableMap(index);
        }
        return nameIndex;
    }

    public Optional<String> resolveName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(nameIndex().get(name));
    }

    /**
     * Finds a list option by its cell id.
     */
    public Optional<SelectOption> findOption(String optionId) {
        if (optionIndex == null) {
            LinkedHashMap<String, SelectOption> index = new LinkedHashMap<>();
            for (Node node : nodes.values()) {
                for (SelectOption option : node.optionsOrEmpty()) {
                    index.putIfAbsent(option.id(), option);
                }
            }
            optionIndex = index;
        }
        return Optional.ofNullable(optionIndex.get(optionId));
    }

    private void invalidateIndexes() {
        nameIndex = null;
        optionIndex = null;
    }

    /**
     * Collects elements and validates them once when the batch is complete.
     */
    public static final class Builder {

        private final Diagram diagram;
        private final List<Edge> pendingEdges = new ArrayList<>();

        private Builder(ValidationCollector collector, ExternalReferenceOracle oracle) {
            this.diagram = new Diagram(collector, oracle);
        }

        public Builder node(Node node) {
            diagram.addNode(node);
            return this;
        }

        public Builder group(Group group) {
            diagram.addGroup(group);
            return this;
        }

        public Builder edge(Edge edge) {
            pendingEdges.add(edge);
            return this;
        }

        public Diagram build() {
            for (Edge edge : pendingEdges) {
                diagram.addEdge(edge);
            }
            diagram.validate();
            return diagram;
        }
    }
}

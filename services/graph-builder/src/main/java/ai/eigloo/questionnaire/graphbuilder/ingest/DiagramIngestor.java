package ai.eigloo.questionnaire.graphbuilder.ingest;

import ai.eigloo.questionnaire.diagram.exception.DiagramParsingException;
import ai.eigloo.questionnaire.diagram.external.ExternalReferenceOracle;
import ai.eigloo.questionnaire.diagram.model.Diagram;
import ai.eigloo.questionnaire.diagram.model.Edge;
import ai.eigloo.questionnaire.diagram.model.ElementMetadata;
import ai.eigloo.questionnaire.diagram.model.Geometry;
import ai.eigloo.questionnaire.diagram.model.Group;
import ai.eigloo.questionnaire.diagram.model.Node;
import ai.eigloo.questionnaire.diagram.model.NumericConstraints;
import ai.eigloo.questionnaire.diagram.model.SelectOption;
import ai.eigloo.questionnaire.diagram.model.ShapeKind;
import ai.eigloo.questionnaire.diagram.model.Style;
import ai.eigloo.questionnaire.diagram.style.StyleGrammar;
import ai.eigloo.questionnaire.diagram.validation.ValidationCollector;
import ai.eigloo.questionnaire.diagram.validation.ValidationSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Walks a draw.io {@link SourceTree} and builds a validated {@link Diagram}.
 *
 * <p>Cells wrapped in {@code object} / {@code UserObject} elements take their id, label and
 * custom attributes from the wrapper. List shapes absorb their child cells as options, group
 * and container cells absorb their child nodes, and edge label cells supply the label of the
 * edge they belong to.</p>
 */
public class DiagramIngestor {

    private static final Logger logger = LoggerFactory.getLogger(DiagramIngestor.class);

    private static final Set<String> RESERVED_IDS = Set.of("0", "1");
    private static final Set<String> WRAPPER_TAGS = Set.of("object", "UserObject");
    private static final String CELL_TAG = "mxCell";
    private static final String PAGE_TAG = "diagram";

    static final String NAME_ATTRIBUTE = "name";
    static final String MIN_ATTRIBUTE = "min_value";
    static final String MAX_ATTRIBUTE = "max_value";
    static final String CONSTRAINT_MESSAGE_ATTRIBUTE = "constraint_message";

    private final DrawIoXmlReader reader;
    private final ExternalReferenceOracle oracle;

    public DiagramIngestor(DrawIoXmlReader reader, ExternalReferenceOracle oracle) {
        this.reader = reader;
        this.oracle = oracle != null ? oracle : ExternalReferenceOracle.none();
    }

    /**
     * Reads and ingests a draw.io document.
     *
     * <p>A document that cannot be read is reported at CRITICAL. Under NORMAL and STRICT modes
     * that aborts with the collector's exception; under LENIENT mode no diagram is returned.</p>
     */
    public Optional<Diagram> ingest(String xml, ValidationCollector collector) {
        SourceTree tree;
        try {
            tree = reader.read(xml);
        } catch (DiagramParsingException e) {
            collector.critical(e.getMessage(), null, "Diagram");
            return Optional.empty();
        }
        return Optional.of(ingest(tree, collector));
    }

    public Diagram ingest(SourceTree tree, ValidationCollector collector) {
        List<Cell> cells = collectCells(tree, collector);

        Set<String> listIds = new HashSet<>();
        Set<String> groupIds = new LinkedHashSet<>();
        Set<String> edgeIds = new HashSet<>();
        for (Cell cell : cells) {
            if (cell.edge()) {
                edgeIds.add(cell.id());
            } else if (ShapeKind.fromStyle(cell.style()) == ShapeKind.LIST) {
                listIds.add(cell.id());
            } else if (isGroup(cell.style())) {
                groupIds.add(cell.id());
            }
        }

        Map<String, List<Cell>> optionCells = new LinkedHashMap<>();
        Map<String, List<String>> edgeLabels = new LinkedHashMap<>();
        for (Cell cell : cells) {
            if (cell.edge() || cell.parentRef() == null) {
                continue;
            }
            if (listIds.contains(cell.parentRef())) {
                optionCells.computeIfAbsent(cell.parentRef(), key -> new ArrayList<>()).add(cell);
            } else if (edgeIds.contains(cell.parentRef()) && !cell.label().isEmpty()) {
                edgeLabels.computeIfAbsent(cell.parentRef(), key -> new ArrayList<>()).add(cell.label());
            }
        }

        Diagram.Builder builder = Diagram.builder(collector, oracle);
        Map<String, Set<String>> groupMembers = new LinkedHashMap<>();
        groupIds.forEach(id -> groupMembers.put(id, new LinkedHashSet<>()));

        for (Cell cell : cells) {
            String parentRef = cell.parentRef();
            if (cell.edge()) {
                String label = cell.label().isEmpty()
                        ? String.join(" ", edgeLabels.getOrDefault(cell.id(), List.of()))
                        : cell.label();
                buildEdge(cell, label, collector).ifPresent(builder::edge);
            } else if (groupIds.contains(cell.id())
                    || listIds.contains(parentRef)
                    || edgeIds.contains(parentRef)) {
                continue;
            } else {
                Optional<Node> node = buildNode(cell, optionCells.get(cell.id()), collector);
                if (node.isPresent()) {
                    builder.node(node.get());
                    if (groupMembers.containsKey(parentRef)) {
                        groupMembers.get(parentRef).add(cell.id());
                    }
                }
            }
        }

        Map<String, Cell> groupCells = new LinkedHashMap<>();
        for (Cell cell : cells) {
            if (groupIds.contains(cell.id())) {
                groupCells.put(cell.id(), cell);
            }
        }
        groupCells.forEach((id, cell) -> buildGroup(cell, groupMembers.get(id), collector).ifPresent(builder::group));

        Diagram diagram = builder.build();
        logger.debug("Ingested diagram with {} nodes, {} edges, {} groups",
                diagram.getNodes().size(), diagram.getEdges().size(), diagram.getGroups().size());
        return diagram;
    }

    private List<Cell> collectCells(SourceTree tree, ValidationCollector collector) {
        List<Cell> cells = new ArrayList<>();
        for (SourceElement element : tree.elements(CELL_TAG)) {
            boolean vertex = "1".equals(element.attribute("vertex"));
            boolean edge = "1".equals(element.attribute("edge"));

            SourceElement identity = element.parent()
                    .filter(parent -> WRAPPER_TAGS.contains(parent.tag()))
                    .orElse(element);
            String id = identity.id();
            if (id != null && RESERVED_IDS.contains(id)) {
                continue;
            }
            if (!vertex && !edge) {
                // layer cell
                continue;
            }
            if (id == null || id.isBlank()) {
                collector.add(ValidationSeverity.ERROR, "Diagram cell without id ignored", null,
                        edge ? "Edge" : "Node", "id");
                continue;
            }

            Map<String, String> style = StyleGrammar.parse(element.attribute("style"));
            String rawLabel = identity == element ? element.attribute("value") : identity.attribute("label");
            String label = LabelText.toPlainText(rawLabel, StyleGrammar.isEnabled(style, "html"));
            String pageId = element.ancestor(PAGE_TAG).map(SourceElement::id).orElse("");

            cells.add(new Cell(id, label, style, identity.attributes(), element.geometryAttributes(),
                    element.attribute("parent"), pageId, edge,
                    element.attribute("source"), element.attribute("target")));
        }
        return cells;
    }

    private static boolean isGroup(Map<String, String> style) {
        return StyleGrammar.hasKey(style, "group") || StyleGrammar.isEnabled(style, "container");
    }

    private Optional<Node> buildNode(Cell cell, List<Cell> optionCells, ValidationCollector collector) {
        try {
            ShapeKind shape = ShapeKind.fromStyle(cell.style());
            List<SelectOption> options = null;
            if (shape == ShapeKind.LIST) {
                options = new ArrayList<>();
                for (Cell optionCell : optionCells != null ? optionCells : List.<Cell>of()) {
                    options.add(new SelectOption(optionCell.id(), optionCell.label(), cell.id(),
                            geometry(optionCell), Style.fromProperties(optionCell.style())));
                }
                options.sort(SelectOption.VERTICAL_ORDER);
            }
            return Optional.of(new Node(cell.id(), cell.label(), cell.pageId(), shape, geometry(cell),
                    Style.fromProperties(cell.style()), metadata(cell), options));
        } catch (IllegalArgumentException e) {
            collector.error(e.getMessage(), cell.id(), "Node");
            return Optional.empty();
        }
    }

    private Optional<Edge> buildEdge(Cell cell, String label, ValidationCollector collector) {
        try {
            return Optional.of(new Edge(cell.id(), label, cell.pageId(), metadata(cell), cell.source(), cell.target()));
        } catch (IllegalArgumentException e) {
            collector.error(e.getMessage(), cell.id(), "Edge");
            return Optional.empty();
        }
    }

    private Optional<Group> buildGroup(Cell cell, Set<String> members, ValidationCollector collector) {
        try {
            return Optional.of(new Group(cell.id(), cell.label(), cell.pageId(), geometry(cell), metadata(cell), members));
        } catch (IllegalArgumentException e) {
            collector.error(e.getMessage(), cell.id(), "Group");
            return Optional.empty();
        }
    }

    private static Geometry geometry(Cell cell) {
        Map<String, String> attrs = cell.geometry();
        if (attrs.isEmpty()) {
            return Geometry.empty();
        }
        return new Geometry(
                number(attrs, "x", cell.id()),
                number(attrs, "y", cell.id()),
                number(attrs, "width", cell.id()),
                number(attrs, "height", cell.id()));
    }

    private static double number(Map<String, String> attrs, String key, String cellId) {
        String value = attrs.get(key);
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid geometry " + key + " '" + value + "' on element '" + cellId + "'");
        }
    }

    private static ElementMetadata metadata(Cell cell) {
        Map<String, String> attrs = cell.attributes();
        Double min = optionalNumber(attrs.get(MIN_ATTRIBUTE), MIN_ATTRIBUTE, cell.id());
        Double max = optionalNumber(attrs.get(MAX_ATTRIBUTE), MAX_ATTRIBUTE, cell.id());
        String message = attrs.get(CONSTRAINT_MESSAGE_ATTRIBUTE);

        NumericConstraints constraints = new NumericConstraints(min, max, message);
        ElementMetadata metadata = new ElementMetadata(attrs.get(NAME_ATTRIBUTE), constraints.isEmpty() ? null : constraints);
        return metadata.hasName() || metadata.numericConstraints() != null ? metadata : null;
    }

    private static Double optionalNumber(String value, String key, String cellId) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Double.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + " '" + value + "' on element '" + cellId + "'");
        }
    }

    /**
     * A vertex or edge cell with wrapper indirection already resolved.
     */
    private record Cell(
            String id,
            String label,
            Map<String, String> style,
            Map<String, String> attributes,
            Map<String, String> geometry,
            String parentRef,
            String pageId,
            boolean edge,
            String source,
            String target
    ) {
    }
}

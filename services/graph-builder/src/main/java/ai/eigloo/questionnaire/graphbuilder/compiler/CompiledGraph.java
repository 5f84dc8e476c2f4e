package ai.eigloo.questionnaire.graphbuilder.compiler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Directed multigraph of compiled nodes, mutated in place by the compiler passes.
 *
 * <p>Nodes and edges keep insertion order; replacing an edge keeps its position. Edges may
 * point at ids that are not nodes (groups, before flattening); the validator reports any that
 * are left once compilation ends. Every structural change bumps {@link #structureVersion()}.</p>
 */
public class CompiledGraph {

    private final Map<String, CompiledNode> nodes = new LinkedHashMap<>();
    private final Map<String, CompiledEdge> edges = new LinkedHashMap<>();
    private long structureVersion;

    public void addNode(CompiledNode node) {
        if (nodes.containsKey(node.getId())) {
            throw new IllegalArgumentException("Node '" + node.getId() + "' already exists");
        }
        nodes.put(node.getId(), node);
        structureVersion++;
    }

    /**
     * Removes a node together with every edge touching it.
     *
     * @return the removed edges
     */
    public List<CompiledEdge> removeNode(String id) {
        if (nodes.remove(id) == null) {
            return List.of();
        }
        List<CompiledEdge> removed = new ArrayList<>();
        edges.values().removeIf(edge -> {
            boolean incident = edge.source().equals(id) || edge.target().equals(id);
            if (incident) {
                removed.add(edge);
            }
            return incident;
        });
        structureVersion++;
        return removed;
    }

    public void addEdge(CompiledEdge edge) {
        if (edges.containsKey(edge.id())) {
            throw new IllegalArgumentException("Edge '" + edge.id() + "' already exists");
        }
        edges.put(edge.id(), edge);
        structureVersion++;
    }

    /**
     * Replaces the edge with the same id, keeping its position.
     */
    public void replaceEdge(CompiledEdge edge) {
        CompiledEdge previous = edges.get(edge.id());
        if (previous == null) {
            throw new IllegalArgumentException("Edge '" + edge.id() + "' does not exist");
        }
        edges.put(edge.id(), edge);
        if (!previous.source().equals(edge.source()) || !previous.target().equals(edge.target())) {
            structureVersion++;
        }
    }

    public void removeEdge(String id) {
        if (edges.remove(id) != null) {
            structureVersion++;
        }
    }

    public Optional<CompiledNode> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public Optional<CompiledEdge> getEdge(String id) {
        return Optional.ofNullable(edges.get(id));
    }

    public Collection<CompiledNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Collection<CompiledEdge> edges() {
        return Collections.unmodifiableCollection(edges.values());
    }

    /**
     * Copy of the current node ids, safe to iterate while mutating the graph.
     */
    public List<String> nodeIdSnapshot() {
        return List.copyOf(nodes.keySet());
    }

    public List<CompiledEdge> edgeSnapshot() {
        return List.copyOf(edges.values());
    }

    public List<String> nodeIdsOfType(CompiledNodeType type) {
        List<String> ids = new ArrayList<>();
        for (CompiledNode node : nodes.values()) {
            if (node.type() == type) {
                ids.add(node.getId());
            }
        }
        return ids;
    }

    public List<CompiledEdge> outgoing(String id) {
        return edges.values().stream().filter(edge -> edge.source().equals(id)).toList();
    }

    public List<CompiledEdge> incoming(String id) {
        return edges.values().stream().filter(edge -> edge.target().equals(id)).toList();
    }

    public List<String> successors(String id) {
        LinkedHashSet<String> successors = new LinkedHashSet<>();
        for (CompiledEdge edge : edges.values()) {
            if (edge.source().equals(id)) {
                successors.add(edge.target());
            }
        }
        return List.copyOf(successors);
    }

    public List<String> predecessors(String id) {
        LinkedHashSet<String> predecessors = new LinkedHashSet<>();
        for (CompiledEdge edge : edges.values()) {
            if (edge.target().equals(id)) {
                predecessors.add(edge.source());
            }
        }
        return List.copyOf(predecessors);
    }

    public int degree(String id) {
        int degree = 0;
        for (CompiledEdge edge : edges.values()) {
            if (edge.source().equals(id)) {
                degree++;
            }
            if (edge.target().equals(id)) {
                degree++;
            }
        }
        return degree;
    }

    /**
     * Connected nodes that no edge from another node points at, in insertion order.
     * Nodes without any edge are not entry points.
     */
    public List<String> entryPoints() {
        List<String> entryPoints = new ArrayList<>();
        for (String id : nodes.keySet()) {
            boolean entered = false;
            boolean connected = false;
            for (CompiledEdge edge : edges.values()) {
                if (edge.target().equals(id) && nodes.containsKey(edge.source())) {
                    entered = true;
                }
                if (edge.source().equals(id) || edge.target().equals(id)) {
                    connected = true;
                }
            }
            if (connected && !entered) {
                entryPoints.add(id);
            }
        }
        return entryPoints;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public long structureVersion() {
        return structureVersion;
    }
}

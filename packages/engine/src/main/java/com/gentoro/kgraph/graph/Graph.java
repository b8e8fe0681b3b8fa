package com.gentoro.kgraph.graph;

import com.gentoro.kgraph.model.Direction;
import com.gentoro.kgraph.model.Edge;
import com.gentoro.kgraph.model.Node;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable directed multigraph of one collection.
 *
 * <p>Nodes and edges iterate in id order; adjacency lists are sorted by edge id, which makes every
 * traversal over a snapshot deterministic. Edges whose endpoints are missing are never part of a
 * graph.
 */
public final class Graph {
  private static final Comparator<Edge> BY_ID = Comparator.comparing(Edge::getId);

  private final String collection;
  private final Map<String, Node> nodes;
  private final Map<String, Edge> edges;
  private final Map<String, List<Edge>> outgoing;
  private final Map<String, List<Edge>> incoming;
  private final Map<String, List<Node>> nodesByType;
  private final Map<String, List<Edge>> edgesByRelation;

  Graph(String collection, Collection<Node> nodeList, Collection<Edge> edgeList) {
    this.collection = collection;
    TreeMap<String, Node> n = new TreeMap<>();
    for (Node node : nodeList) n.put(node.getId(), node);
    TreeMap<String, Edge> e = new TreeMap<>();
    for (Edge edge : edgeList) e.put(edge.getId(), edge);

    Map<String, List<Edge>> out = new HashMap<>();
    Map<String, List<Edge>> in = new HashMap<>();
    Map<String, List<Edge>> byRelation = new TreeMap<>();
    // edges iterate in id order, so every list below is already sorted
    for (Edge edge : e.values()) {
      out.computeIfAbsent(edge.getSourceNodeId(), k -> new ArrayList<>()).add(edge);
      in.computeIfAbsent(edge.getTargetNodeId(), k -> new ArrayList<>()).add(edge);
      byRelation
          .computeIfAbsent(relationKey(edge.getRelationType()), k -> new ArrayList<>())
          .add(edge);
    }
    Map<String, List<Node>> byType = new TreeMap<>();
    for (Node node : n.values()) {
      byType.computeIfAbsent(typeKey(node.getType()), k -> new ArrayList<>()).add(node);
    }

    this.nodes = Collections.unmodifiableMap(n);
    this.edges = Collections.unmodifiableMap(e);
    this.outgoing = freeze(out);
    this.incoming = freeze(in);
    this.nodesByType = freeze(byType);
    this.edgesByRelation = freeze(byRelation);
  }

  static Graph empty(String collection) {
    return new Graph(collection, List.of(), List.of());
  }

  private static <T> Map<String, List<T>> freeze(Map<String, List<T>> source) {
    Map<String, List<T>> copy = source instanceof TreeMap ? new TreeMap<>() : new HashMap<>();
    source.forEach((k, v) -> copy.put(k, List.copyOf(v)));
    return Collections.unmodifiableMap(copy);
  }

  /** Lookup key for a node type; untyped nodes are grouped under the empty string. */
  public static String typeKey(String type) {
    return type == null ? "" : type;
  }

  /** Lookup key for a relation type; edges without one are grouped under the empty string. */
  public static String relationKey(String relationType) {
    return relationType == null ? "" : relationType;
  }

  public String getCollection() {
    return collection;
  }

  public Optional<Node> node(String id) {
    return Optional.ofNullable(nodes.get(id));
  }

  public boolean containsNode(String id) {
    return nodes.containsKey(id);
  }

  public Optional<Edge> edge(String id) {
    return Optional.ofNullable(edges.get(id));
  }

  /** Nodes in id order. */
  public Collection<Node> nodes() {
    return nodes.values();
  }

  /** Edges in id order. */
  public Collection<Edge> edges() {
    return edges.values();
  }

  public List<Edge> outgoing(String nodeId) {
    return outgoing.getOrDefault(nodeId, List.of());
  }

  public List<Edge> incoming(String nodeId) {
    return incoming.getOrDefault(nodeId, List.of());
  }

  /**
   * Edges followed from {@code nodeId} in {@code direction}, sorted by edge id. For {@link
   * Direction#BOTH} a self-loop is listed once.
   */
  public List<Edge> edgesOf(String nodeId, Direction direction) {
    switch (direction) {
      case OUT:
        return outgoing(nodeId);
      case IN:
        return incoming(nodeId);
      default:
        Map<String, Edge> merged = new TreeMap<>();
        for (Edge e : outgoing(nodeId)) merged.put(e.getId(), e);
        for (Edge e : incoming(nodeId)) merged.put(e.getId(), e);
        return List.copyOf(merged.values());
    }
  }

  public List<Node> nodesOfType(String type) {
    return nodesByType.getOrDefault(typeKey(type), List.of());
  }

  public List<Edge> edgesOfRelation(String relationType) {
    return edgesByRelation.getOrDefault(relationKey(relationType), List.of());
  }

  /** Node count per type key, in key order. */
  public Map<String, Integer> nodeTypeCounts() {
    Map<String, Integer> counts = new LinkedHashMap<>();
    nodesByType.forEach((k, v) -> counts.put(k, v.size()));
    return counts;
  }

  /** Edge count per relation key, in key order. */
  public Map<String, Integer> relationTypeCounts() {
    Map<String, Integer> counts = new LinkedHashMap<>();
    edgesByRelation.forEach((k, v) -> counts.put(k, v.size()));
    return counts;
  }

  public int nodeCount() {
    return nodes.size();
  }

  public int edgeCount() {
    return edges.size();
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  @Override
  public String toString() {
    return "Graph{collection='" + collection + "', nodes=" + nodes.size() + ", edges="
        + edges.size() + '}';
  }
}

package com.gentoro.kgraph.context;

import com.gentoro.kgraph.exception.ValidationException;
import com.gentoro.kgraph.model.Edge;
import com.gentoro.kgraph.model.Node;
import com.gentoro.kgraph.store.RecordFilter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders ranked nodes and their connecting edges as a bounded, human-readable text block.
 *
 * <p>Layout:
 *
 * <pre>
 * # Knowledge Graph Context
 *
 * ## Entities
 * - Alice (Person) [id: p1]
 *   - age: 30
 *
 * ## Relations
 * - Alice -[knows]-&gt; Bob
 * </pre>
 *
 * <p>Node {@code i} of the input has rank {@code i}; an edge takes the best rank of its endpoints
 * (edges touching no listed node rank last). When the text is longer than {@code maxChars}, items
 * are dropped from the worst rank upward, the edges of a rank before its node, until it fits.
 */
public class ContextFormatter {
  public static final String NO_KNOWLEDGE = "No relevant knowledge found.";

  static final String HEADER = "# Knowledge Graph Context";
  static final String ENTITIES = "## Entities";
  static final String RELATIONS = "## Relations";

  /** Format using the names of the listed nodes for relation endpoints. */
  public String format(List<Node> rankedNodes, List<Edge> edges, int maxChars) {
    return format(rankedNodes, edges, maxChars, Map.of());
  }

  /**
   * @param endpointNames display names for edge endpoints not in {@code rankedNodes}
   * @throws ValidationException when {@code maxChars <= 0}
   */
  public String format(
      List<Node> rankedNodes, List<Edge> edges, int maxChars, Map<String, String> endpointNames) {
    if (maxChars <= 0) {
      throw new ValidationException("max_chars", "'max_chars' must be >= 1, got " + maxChars);
    }
    List<Node> nodes = rankedNodes == null ? List.of() : rankedNodes;
    List<Edge> relations = edges == null ? List.of() : edges;

    Map<String, Integer> rankOf = new HashMap<>();
    Map<String, String> names = new HashMap<>(endpointNames == null ? Map.of() : endpointNames);
    for (int i = 0; i < nodes.size(); i++) {
      rankOf.putIfAbsent(nodes.get(i).getId(), i);
      names.put(nodes.get(i).getId(), nodes.get(i).getName());
    }

    // keep order: node 0, edges of rank 0, node 1, edges of rank 1, ..., unranked edges
    List<List<Edge>> edgesByRank = new ArrayList<>();
    for (int i = 0; i <= nodes.size(); i++) edgesByRank.add(new ArrayList<>());
    for (Edge edge : relations) {
      int rank =
          Math.min(
              rankOf.getOrDefault(edge.getSourceNodeId(), nodes.size()),
              rankOf.getOrDefault(edge.getTargetNodeId(), nodes.size()));
      edgesByRank.get(rank).add(edge);
    }
    List<Object> items = new ArrayList<>();
    for (int i = 0; i <= nodes.size(); i++) {
      if (i < nodes.size()) items.add(nodes.get(i));
      edgesByRank.get(i).sort(Comparator.comparing(Edge::getId));
      items.addAll(edgesByRank.get(i));
    }

    for (int keep = items.size(); keep > 0; keep--) {
      String text = render(items.subList(0, keep), names);
      if (text.length() <= maxChars) return text;
    }
    return NO_KNOWLEDGE.length() <= maxChars ? NO_KNOWLEDGE : NO_KNOWLEDGE.substring(0, maxChars);
  }

  private static String render(List<Object> items, Map<String, String> names) {
    StringBuilder entities = new StringBuilder();
    StringBuilder relations = new StringBuilder();
    for (Object item : items) {
      if (item instanceof Node node) {
        appendNode(entities, node);
      } else {
        appendEdge(relations, (Edge) item, names);
      }
    }
    StringBuilder out = new StringBuilder(HEADER).append('\n');
    if (entities.length() > 0) out.append('\n').append(ENTITIES).append('\n').append(entities);
    if (relations.length() > 0) out.append('\n').append(RELATIONS).append('\n').append(relations);
    return out.toString().stripTrailing();
  }

  private static void appendNode(StringBuilder sb, Node node) {
    sb.append("- ").append(node.getName());
    if (node.getType() != null && !node.getType().isBlank()) {
      sb.append(" (").append(node.getType()).append(')');
    }
    sb.append(" [id: ").append(node.getId()).append("]\n");
    node.getProperties()
        .forEach(
            (k, v) -> sb.append("  - ").append(k).append(": ").append(valueText(v)).append('\n'));
  }

  private static void appendEdge(StringBuilder sb, Edge edge, Map<String, String> names) {
    String relation =
        edge.getRelationType() == null || edge.getRelationType().isBlank()
            ? "related"
            : edge.getRelationType();
    sb.append("- ")
        .append(names.getOrDefault(edge.getSourceNodeId(), edge.getSourceNodeId()))
        .append(" -[")
        .append(relation)
        .append("]-> ")
        .append(names.getOrDefault(edge.getTargetNodeId(), edge.getTargetNodeId()));
    if (Double.compare(edge.getWeight(), Edge.DEFAULT_WEIGHT) != 0) {
      sb.append(" (weight ").append(edge.getWeight()).append(')');
    }
    sb.append('\n');
  }

  private static String valueText(Object value) {
    if (value instanceof Map<?, ?> || value instanceof List<?>) {
      return RecordFilter.text(value);
    }
    return String.valueOf(value);
  }
}

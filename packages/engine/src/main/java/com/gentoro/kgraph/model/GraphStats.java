package com.gentoro.kgraph.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.Map;

/** Aggregate statistics computed from one snapshot of a collection. */
@JsonPropertyOrder({
  "collection",
  "node_count",
  "edge_count",
  "node_types",
  "relation_types",
  "isolated_node_count",
  "max_out_degree",
  "max_in_degree",
  "average_degree"
})
public final class GraphStats {
  @JsonProperty("collection")
  private final String collection;

  @JsonProperty("node_count")
  private final int nodeCount;

  @JsonProperty("edge_count")
  private final int edgeCount;

  @JsonProperty("node_types")
  private final Map<String, Integer> nodeTypes;

  @JsonProperty("relation_types")
  private final Map<String, Integer> relationTypes;

  @JsonProperty("isolated_node_count")
  private final int isolatedNodeCount;

  @JsonProperty("max_out_degree")
  private final int maxOutDegree;

  @JsonProperty("max_in_degree")
  private final int maxInDegree;

  @JsonProperty("average_degree")
  private final double averageDegree;

  public GraphStats(
      String collection,
      int nodeCount,
      int edgeCount,
      Map<String, Integer> nodeTypes,
      Map<String, Integer> relationTypes,
      int isolatedNodeCount,
      int maxOutDegree,
      int maxInDegree,
      double averageDegree) {
    this.collection = collection;
    this.nodeCount = nodeCount;
    this.edgeCount = edgeCount;
    this.nodeTypes = Collections.unmodifiableMap(nodeTypes);
    this.relationTypes = Collections.unmodifiableMap(relationTypes);
    this.isolatedNodeCount = isolatedNodeCount;
    this.maxOutDegree = maxOutDegree;
    this.maxInDegree = maxInDegree;
    this.averageDegree = averageDegree;
  }

  public String getCollection() {
    return collection;
  }

  public int getNodeCount() {
    return nodeCount;
  }

  public int getEdgeCount() {
    return edgeCount;
  }

  /** Node count per type; untyped nodes are counted under an empty key. */
  public Map<String, Integer> getNodeTypes() {
    return nodeTypes;
  }

  public Map<String, Integer> getRelationTypes() {
    return relationTypes;
  }

  public int getIsolatedNodeCount() {
    return isolatedNodeCount;
  }

  public int getMaxOutDegree() {
    return maxOutDegree;
  }

  public int getMaxInDegree() {
    return maxInDegree;
  }

  /** Mean of in+out degree over all nodes; {@code 0} for an empty collection. */
  public double getAverageDegree() {
    return averageDegree;
  }

  @Override
  public String toString() {
    return "GraphStats{collection="
        + collection
        + ", nodes="
        + nodeCount
        + ", edges="
        + edgeCount
        + '}';
  }
}

package com.gentoro.kgraph.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Result of a neighbor expansion: every reachable node once, in discovery order, plus every edge
 * followed while expanding. The start node is not listed.
 */
public record NeighborResult(
    @JsonProperty("start_node_id") String startNodeId,
    @JsonProperty("direction") Direction direction,
    @JsonProperty("max_depth") int maxDepth,
    @JsonProperty("neighbors") List<Neighbor> neighbors,
    @JsonProperty("edges") List<Edge> edges) {

  public NeighborResult {
    neighbors = List.copyOf(neighbors);
    edges = List.copyOf(edges);
  }

  @JsonIgnore
  public Set<String> nodeIds() {
    Set<String> ids = new LinkedHashSet<>();
    for (Neighbor n : neighbors) ids.add(n.node().getId());
    return ids;
  }

  @JsonIgnore
  public boolean isEmpty() {
    return neighbors.isEmpty();
  }
}

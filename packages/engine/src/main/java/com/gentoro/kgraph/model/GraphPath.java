package com.gentoro.kgraph.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * An ordered walk: {@code nodeIds.get(i)} and {@code nodeIds.get(i + 1)} are joined by {@code
 * edges.get(i)}. A zero-hop path has one node and no edges.
 */
public record GraphPath(
    @JsonProperty("node_ids") List<String> nodeIds, @JsonProperty("edges") List<Edge> edges) {

  public GraphPath {
    nodeIds = List.copyOf(nodeIds);
    edges = List.copyOf(edges);
    if (nodeIds.size() != edges.size() + 1) {
      throw new IllegalArgumentException(
          "A path with " + edges.size() + " edges needs " + (edges.size() + 1) + " nodes");
    }
  }

  @JsonProperty("hops")
  public int hops() {
    return edges.size();
  }

  @JsonIgnore
  public String source() {
    return nodeIds.get(0);
  }

  @JsonIgnore
  public String target() {
    return nodeIds.get(nodeIds.size() - 1);
  }
}

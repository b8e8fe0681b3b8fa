package com.gentoro.kgraph.context;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.kgraph.model.Edge;
import com.gentoro.kgraph.model.Node;
import java.util.List;

/**
 * Retrieval result handed to text-generation callers: the ranked nodes, their connecting edges and
 * the formatted text built from them.
 */
public record GraphContext(
    @JsonProperty("nodes") List<Node> nodes,
    @JsonProperty("edges") List<Edge> edges,
    @JsonProperty("text") String text,
    @JsonProperty("estimated_tokens") int estimatedTokens) {

  public GraphContext {
    nodes = List.copyOf(nodes);
    edges = List.copyOf(edges);
  }

  @JsonIgnore
  public boolean isEmpty() {
    return nodes.isEmpty();
  }
}

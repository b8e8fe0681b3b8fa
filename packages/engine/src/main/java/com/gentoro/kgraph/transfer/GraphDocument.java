package com.gentoro.kgraph.transfer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gentoro.kgraph.model.Edge;
import com.gentoro.kgraph.model.Node;
import java.time.Instant;
import java.util.List;

/**
 * Whole-collection interchange document.
 *
 * <p>The format only ever gains optional fields. Readers ignore fields they do not know, so
 * documents written by newer versions still import.
 */
@JsonPropertyOrder({"format_version", "collection", "exported_at", "nodes", "edges"})
public final class GraphDocument {
  public static final int FORMAT_VERSION = 1;

  private final int formatVersion;
  private final String collection;
  private final Instant exportedAt;
  private final List<Node> nodes;
  private final List<Edge> edges;

  @JsonCreator
  public GraphDocument(
      @JsonProperty("format_version") Integer formatVersion,
      @JsonProperty("collection") String collection,
      @JsonProperty("exported_at") Instant exportedAt,
      @JsonProperty("nodes") List<Node> nodes,
      @JsonProperty("edges") List<Edge> edges) {
    this.formatVersion = formatVersion == null ? FORMAT_VERSION : formatVersion;
    this.collection = collection;
    this.exportedAt = exportedAt;
    this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
    this.edges = edges == null ? List.of() : List.copyOf(edges);
  }

  public GraphDocument(String collection, List<Node> nodes, List<Edge> edges) {
    this(FORMAT_VERSION, collection, null, nodes, edges);
  }

  @JsonProperty("format_version")
  public int getFormatVersion() {
    return formatVersion;
  }

  /** Collection the document was exported from; informational on import. */
  @JsonProperty("collection")
  public String getCollection() {
    return collection;
  }

  @JsonProperty("exported_at")
  public Instant getExportedAt() {
    return exportedAt;
  }

  @JsonProperty("nodes")
  public List<Node> getNodes() {
    return nodes;
  }

  @JsonProperty("edges")
  public List<Edge> getEdges() {
    return edges;
  }

  @Override
  public String toString() {
    return "GraphDocument{collection='"
        + collection
        + "', nodes="
        + nodes.size()
        + ", edges="
        + edges.size()
        + '}';
  }
}

package com.gentoro.kgraph.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input for creating an edge. When no id is given one is derived from the endpoints and the
 * relation type, see {@link #resolveId()}.
 */
public class EdgeSpec {
  /** Relation name used in derived ids when the edge has no relation type. */
  public static final String DEFAULT_RELATION = "related";

  @JsonProperty("edge_id")
  private String id;

  @JsonProperty("source_node_id")
  private String sourceNodeId;

  @JsonProperty("target_node_id")
  private String targetNodeId;

  @JsonProperty("relation_type")
  private String relationType;

  @JsonProperty("properties")
  private Map<String, Object> properties = new LinkedHashMap<>();

  @JsonProperty("weight")
  private Double weight;

  public EdgeSpec() {}

  public EdgeSpec(String id, String sourceNodeId, String targetNodeId, String relationType) {
    this.id = id;
    this.sourceNodeId = sourceNodeId;
    this.targetNodeId = targetNodeId;
    this.relationType = relationType;
  }

  public static EdgeSpec of(String id, String source, String target, String relationType) {
    return new EdgeSpec(id, source, target, relationType);
  }

  /** The explicit id, or {@code <source>_<relation>_<target>} when none was set. */
  public String resolveId() {
    if (id != null && !id.isBlank()) return id;
    if (sourceNodeId == null || targetNodeId == null) return id;
    String relation =
        relationType == null || relationType.isBlank() ? DEFAULT_RELATION : relationType;
    return sourceNodeId + "_" + relation + "_" + targetNodeId;
  }

  public String getId() {
    return id;
  }

  public EdgeSpec setId(String id) {
    this.id = id;
    return this;
  }

  public String getSourceNodeId() {
    return sourceNodeId;
  }

  public EdgeSpec setSourceNodeId(String sourceNodeId) {
    this.sourceNodeId = sourceNodeId;
    return this;
  }

  public String getTargetNodeId() {
    return targetNodeId;
  }

  public EdgeSpec setTargetNodeId(String targetNodeId) {
    this.targetNodeId = targetNodeId;
    return this;
  }

  public String getRelationType() {
    return relationType;
  }

  public EdgeSpec setRelationType(String relationType) {
    this.relationType = relationType;
    return this;
  }

  public Map<String, Object> getProperties() {
    return properties;
  }

  public EdgeSpec setProperties(Map<String, Object> properties) {
    this.properties = properties;
    return this;
  }

  public EdgeSpec putProperty(String key, Object value) {
    if (properties == null) properties = new LinkedHashMap<>();
    properties.put(key, value);
    return this;
  }

  public Double getWeight() {
    return weight;
  }

  public EdgeSpec setWeight(Double weight) {
    this.weight = weight;
    return this;
  }
}

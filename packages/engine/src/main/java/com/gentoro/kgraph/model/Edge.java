package com.gentoro.kgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A typed, weighted, directed relationship between two nodes of the same collection.
 *
 * <p>Immutable. See {@link Node} for the JSON and record conventions.
 */
@JsonPropertyOrder({
  "edge_id",
  "source_node_id",
  "target_node_id",
  "relation_type",
  "properties",
  "weight",
  "created_at",
  "updated_at"
})
@JsonInclude(value = JsonInclude.Include.ALWAYS, content = JsonInclude.Include.ALWAYS)
public final class Edge {
  public static final double DEFAULT_WEIGHT = 1.0;

  public static final String FIELD_ID = "id";
  public static final String FIELD_SOURCE = "source_node_id";
  public static final String FIELD_TARGET = "target_node_id";
  public static final String FIELD_RELATION_TYPE = "relation_type";
  public static final String FIELD_PROPERTIES = "properties";
  public static final String FIELD_WEIGHT = "weight";
  public static final String FIELD_CREATED_AT = "created_at";
  public static final String FIELD_UPDATED_AT = "updated_at";

  private final String id;
  private final String sourceNodeId;
  private final String targetNodeId;
  private final String relationType;
  private final Map<String, Object> properties;
  private final double weight;
  private final Instant createdAt;
  private final Instant updatedAt;

  @JsonCreator
  public Edge(
      @JsonProperty("edge_id") String id,
      @JsonProperty("source_node_id") String sourceNodeId,
      @JsonProperty("target_node_id") String targetNodeId,
      @JsonProperty("relation_type") String relationType,
      @JsonProperty("properties") Map<String, ?> properties,
      @JsonProperty("weight") Double weight,
      @JsonProperty("created_at") Instant createdAt,
      @JsonProperty("updated_at") Instant updatedAt) {
    this.id = id;
    this.sourceNodeId = sourceNodeId;
    this.targetNodeId = targetNodeId;
    this.relationType = relationType;
    this.properties = PropertyValues.normalize(properties);
    this.weight = weight == null ? DEFAULT_WEIGHT : weight;
    this.createdAt = createdAt;
    this.updatedAt = updatedAt;
  }

  @JsonProperty("edge_id")
  public String getId() {
    return id;
  }

  @JsonProperty("source_node_id")
  public String getSourceNodeId() {
    return sourceNodeId;
  }

  @JsonProperty("target_node_id")
  public String getTargetNodeId() {
    return targetNodeId;
  }

  @JsonProperty("relation_type")
  public String getRelationType() {
    return relationType;
  }

  @JsonProperty("properties")
  public Map<String, Object> getProperties() {
    return properties;
  }

  @JsonProperty("weight")
  public double getWeight() {
    return weight;
  }

  @JsonProperty("created_at")
  public Instant getCreatedAt() {
    return createdAt;
  }

  @JsonProperty("updated_at")
  public Instant getUpdatedAt() {
    return updatedAt;
  }

  /** True when {@code nodeId} is the source or the target. */
  public boolean touches(String nodeId) {
    return Objects.equals(sourceNodeId, nodeId) || Objects.equals(targetNodeId, nodeId);
  }

  /** The endpoint opposite to {@code nodeId}; for a self-loop this is {@code nodeId} itself. */
  public String opposite(String nodeId) {
    return Objects.equals(sourceNodeId, nodeId) ? targetNodeId : sourceNodeId;
  }

  public Edge withContent(
      String sourceNodeId,
      String targetNodeId,
      String relationType,
      Map<String, Object> properties,
      double weight,
      Instant updatedAt) {
    return new Edge(
        id, sourceNodeId, targetNodeId, relationType, properties, weight, createdAt, updatedAt);
  }

  public Map<String, Object> toRecord() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(FIELD_ID, id);
    map.put(FIELD_SOURCE, sourceNodeId);
    map.put(FIELD_TARGET, targetNodeId);
    map.put(FIELD_RELATION_TYPE, relationType);
    map.put(FIELD_PROPERTIES, properties);
    map.put(FIELD_WEIGHT, weight);
    map.put(FIELD_CREATED_AT, createdAt == null ? null : createdAt.toString());
    map.put(FIELD_UPDATED_AT, updatedAt == null ? null : updatedAt.toString());
    return map;
  }

  public static Edge fromRecord(Map<String, Object> record) {
    return new Edge(
        Records.string(record, FIELD_ID),
        Records.string(record, FIELD_SOURCE),
        Records.string(record, FIELD_TARGET),
        Records.string(record, FIELD_RELATION_TYPE),
        Records.properties(record, FIELD_PROPERTIES),
        Records.number(record, FIELD_WEIGHT),
        Records.instant(record, FIELD_CREATED_AT),
        Records.instant(record, FIELD_UPDATED_AT));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Edge other)) return false;
    return Double.compare(weight, other.weight) == 0
        && Objects.equals(id, other.id)
        && Objects.equals(sourceNodeId, other.sourceNodeId)
        && Objects.equals(targetNodeId, other.targetNodeId)
        && Objects.equals(relationType, other.relationType)
        && Objects.equals(properties, other.properties)
        && Objects.equals(createdAt, other.createdAt)
        && Objects.equals(updatedAt, other.updatedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        id, sourceNodeId, targetNodeId, relationType, properties, weight, createdAt, updatedAt);
  }

  @Override
  public String toString() {
    return "Edge{id="
        + id
        + ", "
        + sourceNodeId
        + " -["
        + relationType
        + "]-> "
        + targetNodeId
        + ", weight="
        + weight
        + '}';
  }
}

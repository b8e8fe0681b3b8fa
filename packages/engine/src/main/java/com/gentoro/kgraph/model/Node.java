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
 * A typed entity stored in a collection.
 *
 * <p>Instances are immutable. The JSON shape (snake_case) is the node entry of the export
 * document; {@link #toRecord()} and {@link #fromRecord(Map)} convert to and from the flat record
 * kept by a {@link com.gentoro.kgraph.store.RecordStore}.
 */
@JsonPropertyOrder({"node_id", "name", "type", "properties", "created_at", "updated_at"})
@JsonInclude(value = JsonInclude.Include.ALWAYS, content = JsonInclude.Include.ALWAYS)
public final class Node {
  public static final String FIELD_ID = "id";
  public static final String FIELD_NAME = "name";
  public static final String FIELD_TYPE = "type";
  public static final String FIELD_PROPERTIES = "properties";
  public static final String FIELD_CREATED_AT = "created_at";
  public static final String FIELD_UPDATED_AT = "updated_at";

  private final String id;
  private final String name;
  private final String type;
  private final Map<String, Object> properties;
  private final Instant createdAt;
  private final Instant updatedAt;

  @JsonCreator
  public Node(
      @JsonProperty("node_id") String id,
      @JsonProperty("name") String name,
      @JsonProperty("type") String type,
      @JsonProperty("properties") Map<String, ?> properties,
      @JsonProperty("created_at") Instant createdAt,
      @JsonProperty("updated_at") Instant updatedAt) {
    this.id = id;
    this.name = name;
    this.type = type;
    this.properties = PropertyValues.normalize(properties);
    this.createdAt = createdAt;
    this.updatedAt = updatedAt;
  }

  @JsonProperty("node_id")
  public String getId() {
    return id;
  }

  @JsonProperty("name")
  public String getName() {
    return name;
  }

  @JsonProperty("type")
  public String getType() {
    return type;
  }

  @JsonProperty("properties")
  public Map<String, Object> getProperties() {
    return properties;
  }

  @JsonProperty("created_at")
  public Instant getCreatedAt() {
    return createdAt;
  }

  @JsonProperty("updated_at")
  public Instant getUpdatedAt() {
    return updatedAt;
  }

  /** Copy with new content fields; {@code created_at} is kept and {@code updated_at} replaced. */
  public Node withContent(
      String name, String type, Map<String, Object> properties, Instant updatedAt) {
    return new Node(id, name, type, properties, createdAt, updatedAt);
  }

  /** Flat record for the record store. Timestamps are ISO-8601 strings. */
  public Map<String, Object> toRecord() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(FIELD_ID, id);
    map.put(FIELD_NAME, name);
    map.put(FIELD_TYPE, type);
    map.put(FIELD_PROPERTIES, properties);
    map.put(FIELD_CREATED_AT, createdAt == null ? null : createdAt.toString());
    map.put(FIELD_UPDATED_AT, updatedAt == null ? null : updatedAt.toString());
    return map;
  }

  public static Node fromRecord(Map<String, Object> record) {
    return new Node(
        Records.string(record, FIELD_ID),
        Records.string(record, FIELD_NAME),
        Records.string(record, FIELD_TYPE),
        Records.properties(record, FIELD_PROPERTIES),
        Records.instant(record, FIELD_CREATED_AT),
        Records.instant(record, FIELD_UPDATED_AT));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Node other)) return false;
    return Objects.equals(id, other.id)
        && Objects.equals(name, other.name)
        && Objects.equals(type, other.type)
        && Objects.equals(properties, other.properties)
        && Objects.equals(createdAt, other.createdAt)
        && Objects.equals(updatedAt, other.updatedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, name, type, properties, createdAt, updatedAt);
  }

  @Override
  public String toString() {
    return "Node{id=" + id + ", name=" + name + ", type=" + type + ", properties=" + properties
        + '}';
  }
}

package com.gentoro.kgraph.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/** Input for creating a node; used by single and batch creation. */
public class NodeSpec {
  @JsonProperty("node_id")
  private String id;

  @JsonProperty("name")
  private String name;

  @JsonProperty("type")
  private String type;

  @JsonProperty("properties")
  private Map<String, Object> properties = new LinkedHashMap<>();

  public NodeSpec() {}

  public NodeSpec(String id, String name) {
    this.id = id;
    this.name = name;
  }

  public NodeSpec(String id, String name, String type) {
    this(id, name);
    this.type = type;
  }

  public static NodeSpec of(String id, String name, String type) {
    return new NodeSpec(id, name, type);
  }

  public String getId() {
    return id;
  }

  public NodeSpec setId(String id) {
    this.id = id;
    return this;
  }

  public String getName() {
    return name;
  }

  public NodeSpec setName(String name) {
    this.name = name;
    return this;
  }

  public String getType() {
    return type;
  }

  public NodeSpec setType(String type) {
    this.type = type;
    return this;
  }

  public Map<String, Object> getProperties() {
    return properties;
  }

  public NodeSpec setProperties(Map<String, Object> properties) {
    this.properties = properties;
    return this;
  }

  public NodeSpec putProperty(String key, Object value) {
    if (properties == null) properties = new LinkedHashMap<>();
    properties.put(key, value);
    return this;
  }
}

package com.gentoro.kgraph.model;

import java.util.Map;

/** Partial update of an edge; see {@link NodeUpdate}. Changed endpoints are re-validated. */
public final class EdgeUpdate {
  private String sourceNodeId;
  private String targetNodeId;
  private String relationType;
  private boolean relationTypeSet;
  private Double weight;
  private Map<String, Object> properties;
  private PropertyMode propertyMode = PropertyMode.MERGE;

  public static EdgeUpdate create() {
    return new EdgeUpdate();
  }

  public EdgeUpdate source(String sourceNodeId) {
    this.sourceNodeId = sourceNodeId;
    return this;
  }

  public EdgeUpdate target(String targetNodeId) {
    this.targetNodeId = targetNodeId;
    return this;
  }

  public EdgeUpdate relationType(String relationType) {
    this.relationType = relationType;
    this.relationTypeSet = true;
    return this;
  }

  public EdgeUpdate weight(double weight) {
    this.weight = weight;
    return this;
  }

  public EdgeUpdate mergeProperties(Map<String, Object> properties) {
    this.properties = properties;
    this.propertyMode = PropertyMode.MERGE;
    return this;
  }

  public EdgeUpdate replaceProperties(Map<String, Object> properties) {
    this.properties = properties;
    this.propertyMode = PropertyMode.REPLACE;
    return this;
  }

  public String getSourceNodeId() {
    return sourceNodeId;
  }

  public String getTargetNodeId() {
    return targetNodeId;
  }

  public boolean isRelationTypeSet() {
    return relationTypeSet;
  }

  public String getRelationType() {
    return relationType;
  }

  public Double getWeight() {
    return weight;
  }

  public boolean isPropertiesSet() {
    return properties != null;
  }

  public Map<String, Object> getProperties() {
    return properties;
  }

  public PropertyMode getPropertyMode() {
    return propertyMode;
  }

  public boolean isEmpty() {
    return sourceNodeId == null
        && targetNodeId == null
        && !relationTypeSet
        && weight == null
        && properties == null;
  }
}

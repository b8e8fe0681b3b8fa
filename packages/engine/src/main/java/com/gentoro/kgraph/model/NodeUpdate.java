package com.gentoro.kgraph.model;

import java.util.Map;

/**
 * Partial update of a node. Only fields that were explicitly set are applied; the rest of the
 * stored node is left untouched. {@code type(null)} clears the type.
 */
public final class NodeUpdate {
  private String name;
  private boolean nameSet;
  private String type;
  private boolean typeSet;
  private Map<String, Object> properties;
  private PropertyMode propertyMode = PropertyMode.MERGE;

  public static NodeUpdate create() {
    return new NodeUpdate();
  }

  public NodeUpdate name(String name) {
    this.name = name;
    this.nameSet = true;
    return this;
  }

  public NodeUpdate type(String type) {
    this.type = type;
    this.typeSet = true;
    return this;
  }

  /** Merge {@code properties} into the stored bag. */
  public NodeUpdate mergeProperties(Map<String, Object> properties) {
    this.properties = properties;
    this.propertyMode = PropertyMode.MERGE;
    return this;
  }

  /** Replace the stored bag with {@code properties}. */
  public NodeUpdate replaceProperties(Map<String, Object> properties) {
    this.properties = properties;
    this.propertyMode = PropertyMode.REPLACE;
    return this;
  }

  public boolean isNameSet() {
    return nameSet;
  }

  public String getName() {
    return name;
  }

  public boolean isTypeSet() {
    return typeSet;
  }

  public String getType() {
    return type;
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
    return !nameSet && !typeSet && properties == null;
  }
}

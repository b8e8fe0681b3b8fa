package com.gentoro.kgraph.store;

/** The two record kinds a collection holds. */
public enum RecordKind {
  NODE("node", "kg_nodes"),
  EDGE("edge", "kg_edges");

  private final String label;
  private final String storageName;

  RecordKind(String label, String storageName) {
    this.label = label;
    this.storageName = storageName;
  }

  /** Lower-case name used in messages and error context. */
  public String label() {
    return label;
  }

  /** Physical collection/table name for backends that keep one per kind. */
  public String storageName() {
    return storageName;
  }
}

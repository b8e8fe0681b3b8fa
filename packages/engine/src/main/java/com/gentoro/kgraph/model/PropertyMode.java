package com.gentoro.kgraph.model;

/** How an update applies a property bag to the stored one. */
public enum PropertyMode {
  /** Overlay key by key; a null value removes the key. */
  MERGE,
  /** Replace the whole bag. */
  REPLACE
}

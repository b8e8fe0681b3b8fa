package com.gentoro.kgraph.search;

/** Why a record matched a keyword. Lower tiers rank first. */
public enum MatchKind {
  EXACT_NAME(1),
  NAME_PREFIX(2),
  NAME_SUBSTRING(3),
  TYPE(4),
  NODE_PROPERTIES(5),
  EXACT_RELATION(1),
  RELATION_PREFIX(2),
  RELATION_SUBSTRING(3),
  EDGE_PROPERTIES(4);

  private final int tier;

  MatchKind(int tier) {
    this.tier = tier;
  }

  public int tier() {
    return tier;
  }
}

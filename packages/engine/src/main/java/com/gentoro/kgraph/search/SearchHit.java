package com.gentoro.kgraph.search;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A ranked search result. */
public record SearchHit<T>(@JsonProperty("item") T item, @JsonProperty("match") MatchKind match) {

  @JsonProperty("tier")
  public int tier() {
    return match.tier();
  }
}

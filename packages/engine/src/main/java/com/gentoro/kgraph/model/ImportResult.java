package com.gentoro.kgraph.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Counts of an import. Existing ids count as updates. */
public record ImportResult(
    @JsonProperty("collection") String collection,
    @JsonProperty("cleared") boolean cleared,
    @JsonProperty("nodes_created") int nodesCreated,
    @JsonProperty("nodes_updated") int nodesUpdated,
    @JsonProperty("edges_created") int edgesCreated,
    @JsonProperty("edges_updated") int edgesUpdated) {}

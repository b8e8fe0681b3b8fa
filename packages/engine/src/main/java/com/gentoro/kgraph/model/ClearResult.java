package com.gentoro.kgraph.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Number of records removed by a collection clear. */
public record ClearResult(
    @JsonProperty("nodes_removed") int nodesRemoved,
    @JsonProperty("edges_removed") int edgesRemoved) {}

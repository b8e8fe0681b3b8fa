package com.gentoro.kgraph.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A node reached by neighbor expansion.
 *
 * @param node the reached node
 * @param depth hop count at which it was first discovered
 * @param via the edge that discovered it
 */
public record Neighbor(
    @JsonProperty("node") Node node,
    @JsonProperty("depth") int depth,
    @JsonProperty("via") Edge via) {}

package com.gentoro.kgraph.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.kgraph.exception.KnowledgeGraphErrorCode;

/** Outcome of one rejected batch item. {@code id} may be null when the item carried none. */
public record BatchFailure(
    @JsonProperty("index") int index,
    @JsonProperty("id") String id,
    @JsonProperty("code") KnowledgeGraphErrorCode code,
    @JsonProperty("message") String message) {}

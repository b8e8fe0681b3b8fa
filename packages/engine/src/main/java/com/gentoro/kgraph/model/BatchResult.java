package com.gentoro.kgraph.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Per-item outcome of a batch create. Partial success is a normal result, not an error. */
public final class BatchResult {
  private final List<String> createdIds = new ArrayList<>();
  private final List<BatchFailure> failures = new ArrayList<>();

  public void recordSuccess(String id) {
    createdIds.add(id);
  }

  public void recordFailure(BatchFailure failure) {
    failures.add(failure);
  }

  @JsonProperty("succeeded")
  public int getSucceeded() {
    return createdIds.size();
  }

  @JsonProperty("failed")
  public int getFailed() {
    return failures.size();
  }

  @JsonProperty("created_ids")
  public List<String> getCreatedIds() {
    return Collections.unmodifiableList(createdIds);
  }

  @JsonProperty("failures")
  public List<BatchFailure> getFailures() {
    return Collections.unmodifiableList(failures);
  }

  @Override
  public String toString() {
    return "BatchResult{succeeded=" + getSucceeded() + ", failed=" + getFailed() + '}';
  }
}

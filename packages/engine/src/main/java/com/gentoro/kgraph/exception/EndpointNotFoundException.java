package com.gentoro.kgraph.exception;

import java.util.List;
import java.util.Map;

/**
 * One or more edges reference nodes that do not exist in the collection.
 *
 * <p>{@link #getMissingEndpoints()} maps each offending edge id to the endpoint ids that could not
 * be resolved.
 */
public class EndpointNotFoundException extends KnowledgeGraphException {
  private final Map<String, List<String>> missingEndpoints;

  public EndpointNotFoundException(String collection, String edgeId, List<String> missing) {
    this(collection, Map.of(edgeId == null ? "" : edgeId, List.copyOf(missing)));
  }

  public EndpointNotFoundException(String collection, Map<String, List<String>> missingEndpoints) {
    super(
        KnowledgeGraphErrorCode.FAILED_PRECONDITION,
        describe(collection, missingEndpoints),
        details("collection", collection, "kind", "edge", "missingEndpoints", missingEndpoints));
    this.missingEndpoints = Map.copyOf(missingEndpoints);
  }

  public Map<String, List<String>> getMissingEndpoints() {
    return missingEndpoints;
  }

  private static String describe(String collection, Map<String, List<String>> missing) {
    if (missing.size() == 1) {
      Map.Entry<String, List<String>> e = missing.entrySet().iterator().next();
      return "Edge '%s' references missing node(s) %s in collection '%s'"
          .formatted(e.getKey(), e.getValue(), collection);
    }
    return "%d edges reference missing nodes in collection '%s': %s"
        .formatted(missing.size(), collection, missing);
  }
}

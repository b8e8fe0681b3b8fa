package com.gentoro.kgraph.graph;

import com.gentoro.kgraph.model.Edge;
import com.gentoro.kgraph.model.Node;
import com.gentoro.kgraph.store.RecordFilter;
import com.gentoro.kgraph.store.RecordKind;
import com.gentoro.kgraph.store.RecordStore;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rebuilds a {@link Graph} from the flat records of a collection.
 *
 * <p>With caching enabled, built graphs are kept per collection until {@link #invalidate(String)}.
 * Callers fill the cache under the collection read lock and invalidate it under the write lock, so
 * a cached graph always reflects the last completed mutation.
 */
public class GraphMaterializer {
  private static final org.slf4j.Logger log =
      com.gentoro.kgraph.logging.LoggingService.getLogger(GraphMaterializer.class);

  private final RecordStore store;
  private final CollectionLocks locks;
  private final boolean cacheEnabled;
  private final Map<String, Graph> cache = new ConcurrentHashMap<>();

  public GraphMaterializer(RecordStore store, CollectionLocks locks, boolean cacheEnabled) {
    this.store = Objects.requireNonNull(store, "store");
    this.locks = Objects.requireNonNull(locks, "locks");
    this.cacheEnabled = cacheEnabled;
  }

  /** Build a fresh graph, bypassing the cache. The caller is responsible for locking. */
  public Graph materialize(String collection) {
    List<Node> nodes = new ArrayList<>();
    Set<String> nodeIds = new HashSet<>();
    for (Map<String, Object> record :
        store.list(collection, RecordKind.NODE, RecordFilter.all(), 0)) {
      Node node = Node.fromRecord(record);
      nodes.add(node);
      nodeIds.add(node.getId());
    }
    List<Edge> edges = new ArrayList<>();
    for (Map<String, Object> record :
        store.list(collection, RecordKind.EDGE, RecordFilter.all(), 0)) {
      Edge edge = Edge.fromRecord(record);
      if (!nodeIds.contains(edge.getSourceNodeId()) || !nodeIds.contains(edge.getTargetNodeId())) {
        log.warn(
            "Skipping dangling edge '{}' in collection '{}' ({} -> {})",
            edge.getId(),
            collection,
            edge.getSourceNodeId(),
            edge.getTargetNodeId());
        continue;
      }
      edges.add(edge);
    }
    Graph graph =
        nodes.isEmpty() && edges.isEmpty()
            ? Graph.empty(collection)
            : new Graph(collection, nodes, edges);
    log.debug("Materialized {}", graph);
    return graph;
  }

  /** Current graph of the collection, read under the collection read lock. */
  public Graph snapshot(String collection) {
    return locks.read(
        collection,
        () ->
            cacheEnabled
                ? cache.computeIfAbsent(collection, this::materialize)
                : materialize(collection));
  }

  /** Drop the cached graph. Must be called while holding the collection write lock. */
  public void invalidate(String collection) {
    if (cache.remove(collection) != null) {
      log.trace("Invalidated cached graph of collection '{}'", collection);
    }
  }

  public boolean isCacheEnabled() {
    return cacheEnabled;
  }
}

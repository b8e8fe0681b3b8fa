package com.gentoro.kgraph.mutation;

import static com.gentoro.kgraph.utility.ArgumentChecks.requireCollection;
import static com.gentoro.kgraph.utility.ArgumentChecks.requireFinite;
import static com.gentoro.kgraph.utility.ArgumentChecks.requireText;

import com.gentoro.kgraph.exception.DuplicateIdException;
import com.gentoro.kgraph.exception.EndpointNotFoundException;
import com.gentoro.kgraph.exception.KnowledgeGraphException;
import com.gentoro.kgraph.exception.NotFoundException;
import com.gentoro.kgraph.exception.StoreException;
import com.gentoro.kgraph.exception.ValidationException;
import com.gentoro.kgraph.graph.CollectionLocks;
import com.gentoro.kgraph.graph.GraphMaterializer;
import com.gentoro.kgraph.model.BatchFailure;
import com.gentoro.kgraph.model.BatchResult;
import com.gentoro.kgraph.model.ClearResult;
import com.gentoro.kgraph.model.Edge;
import com.gentoro.kgraph.model.EdgeSpec;
import com.gentoro.kgraph.model.EdgeUpdate;
import com.gentoro.kgraph.model.Node;
import com.gentoro.kgraph.model.NodeSpec;
import com.gentoro.kgraph.model.NodeUpdate;
import com.gentoro.kgraph.model.PropertyMode;
import com.gentoro.kgraph.model.PropertyValues;
import com.gentoro.kgraph.store.RecordFilter;
import com.gentoro.kgraph.store.RecordKind;
import com.gentoro.kgraph.store.RecordStore;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Validated create, update and delete of nodes and edges.
 *
 * <p>Every mutation validates completely before its first write and runs under the collection
 * write lock, so callers never observe partial state. Each write invalidates the collection's
 * materialized graph before the lock is released.
 */
public class MutationManager {
  private static final org.slf4j.Logger log =
      com.gentoro.kgraph.logging.LoggingService.getLogger(MutationManager.class);

  private final RecordStore store;
  private final GraphMaterializer materializer;
  private final CollectionLocks locks;
  private final Clock clock;

  public MutationManager(
      RecordStore store, GraphMaterializer materializer, CollectionLocks locks, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.materializer = Objects.requireNonNull(materializer, "materializer");
    this.locks = Objects.requireNonNull(locks, "locks");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  // ---------------------------------------------------------------- nodes

  public Node createNode(String collection, NodeSpec spec) {
    requireCollection(collection);
    if (spec == null) throw new ValidationException("node", "Node spec is required");
    String id = requireText("node_id", spec.getId());
    String name = requireText("name", spec.getName());
    Map<String, Object> properties = PropertyValues.normalize(spec.getProperties());
    return locks.write(
        collection,
        () -> {
          if (store.exists(collection, RecordKind.NODE, id)) {
            throw new DuplicateIdException(collection, RecordKind.NODE, id);
          }
          Instant now = clock.instant();
          Node node = new Node(id, name, spec.getType(), properties, now, now);
          store.upsert(collection, RecordKind.NODE, node.toRecord());
          materializer.invalidate(collection);
          log.info("Created node '{}' in collection '{}'", id, collection);
          return node;
        });
  }

  public Node updateNode(String collection, String nodeId, NodeUpdate update) {
    requireCollection(collection);
    requireText("node_id", nodeId);
    if (update == null) throw new ValidationException("update", "Node update is required");
    if (update.isNameSet()) requireText("name", update.getName());
    // validated up front so a bad bag never reaches the store
    Map<String, Object> patch = PropertyValues.normalize(update.getProperties());
    return locks.write(
        collection,
        () -> {
          Node current = loadNode(collection, nodeId);
          if (update.isEmpty()) return current;
          Map<String, Object> properties = current.getProperties();
          if (update.isPropertiesSet()) {
            properties =
                update.getPropertyMode() == PropertyMode.REPLACE
                    ? patch
                    : PropertyValues.merge(current.getProperties(), patch);
          }
          Node updated =
              current.withContent(
                  update.isNameSet() ? update.getName() : current.getName(),
                  update.isTypeSet() ? update.getType() : current.getType(),
                  properties,
                  clock.instant());
          store.upsert(collection, RecordKind.NODE, updated.toRecord());
          materializer.invalidate(collection);
          log.info("Updated node '{}' in collection '{}'", nodeId, collection);
          return updated;
        });
  }

  /**
   * Delete a node and every edge touching it.
   *
   * @return the number of edges removed along with the node
   */
  public int deleteNode(String collection, String nodeId) {
    requireCollection(collection);
    requireText("node_id", nodeId);
    return locks.write(
        collection,
        () -> {
          loadNode(collection, nodeId);
          int cascaded = 0;
          RecordFilter touching =
              RecordFilter.all().andAnyEquals(nodeId, Edge.FIELD_SOURCE, Edge.FIELD_TARGET);
          for (Map<String, Object> record : store.list(collection, RecordKind.EDGE, touching, 0)) {
            String edgeId = String.valueOf(record.get(Edge.FIELD_ID));
            if (store.delete(collection, RecordKind.EDGE, edgeId)) {
              cascaded++;
            }
          }
          store.delete(collection, RecordKind.NODE, nodeId);
          materializer.invalidate(collection);
          log.info(
              "Deleted node '{}' from collection '{}' with {} edge(s)",
              nodeId,
              collection,
              cascaded);
          return cascaded;
        });
  }

  public Node getNode(String collection, String nodeId) {
    requireCollection(collection);
    requireText("node_id", nodeId);
    return locks.read(collection, () -> loadNode(collection, nodeId));
  }

  /**
   * Nodes ordered by id, optionally restricted to one type.
   *
   * @param limit maximum number of nodes; {@code <= 0} means no limit
   */
  public List<Node> listNodes(String collection, String type, int limit) {
    requireCollection(collection);
    RecordFilter filter =
        type == null ? RecordFilter.all() : RecordFilter.where(Node.FIELD_TYPE, type);
    return locks.read(
        collection,
        () -> map(store.list(collection, RecordKind.NODE, filter, limit), Node::fromRecord));
  }

  // ---------------------------------------------------------------- edges

  public Edge createEdge(String collection, EdgeSpec spec) {
    requireCollection(collection);
    if (spec == null) throw new ValidationException("edge", "Edge spec is required");
    String source = requireText("source_node_id", spec.getSourceNodeId());
    String target = requireText("target_node_id", spec.getTargetNodeId());
    String id = requireText("edge_id", spec.resolveId());
    double weight =
        requireFinite("weight", spec.getWeight() == null ? Edge.DEFAULT_WEIGHT : spec.getWeight());
    Map<String, Object> properties = PropertyValues.normalize(spec.getProperties());
    return locks.write(
        collection,
        () -> {
          if (store.exists(collection, RecordKind.EDGE, id)) {
            throw new DuplicateIdException(collection, RecordKind.EDGE, id);
          }
          requireEndpoints(collection, id, source, target);
          Instant now = clock.instant();
          Edge edge =
              new Edge(id, source, target, spec.getRelationType(), properties, weight, now, now);
          store.upsert(collection, RecordKind.EDGE, edge.toRecord());
          materializer.invalidate(collection);
          log.info(
              "Created edge '{}' ({} -> {}) in collection '{}'", id, source, target, collection);
          return edge;
        });
  }

  public Edge updateEdge(String collection, String edgeId, EdgeUpdate update) {
    requireCollection(collection);
    requireText("edge_id", edgeId);
    if (update == null) throw new ValidationException("update", "Edge update is required");
    if (update.getSourceNodeId() != null) requireText("source_node_id", update.getSourceNodeId());
    if (update.getTargetNodeId() != null) requireText("target_node_id", update.getTargetNodeId());
    if (update.getWeight() != null) requireFinite("weight", update.getWeight());
    Map<String, Object> patch = PropertyValues.normalize(update.getProperties());
    return locks.write(
        collection,
        () -> {
          Edge current = loadEdge(collection, edgeId);
          if (update.isEmpty()) return current;
          String source =
              update.getSourceNodeId() != null
                  ? update.getSourceNodeId()
                  : current.getSourceNodeId();
          String target =
              update.getTargetNodeId() != null
                  ? update.getTargetNodeId()
                  : current.getTargetNodeId();
          if (!source.equals(current.getSourceNodeId())
              || !target.equals(current.getTargetNodeId())) {
            requireEndpoints(collection, edgeId, source, target);
          }
          Map<String, Object> properties = current.getProperties();
          if (update.isPropertiesSet()) {
            properties =
                update.getPropertyMode() == PropertyMode.REPLACE
                    ? patch
                    : PropertyValues.merge(current.getProperties(), patch);
          }
          Edge updated =
              current.withContent(
                  source,
                  target,
                  update.isRelationTypeSet() ? update.getRelationType() : current.getRelationType(),
                  properties,
                  update.getWeight() != null ? update.getWeight() : current.getWeight(),
                  clock.instant());
          store.upsert(collection, RecordKind.EDGE, updated.toRecord());
          materializer.invalidate(collection);
          log.info("Updated edge '{}' in collection '{}'", edgeId, collection);
          return updated;
        });
  }

  public void deleteEdge(String collection, String edgeId) {
    requireCollection(collection);
    requireText("edge_id", edgeId);
    locks.write(
        collection,
        () -> {
          loadEdge(collection, edgeId);
          store.delete(collection, RecordKind.EDGE, edgeId);
          materializer.invalidate(collection);
          log.info("Deleted edge '{}' from collection '{}'", edgeId, collection);
        });
  }

  public Edge getEdge(String collection, String edgeId) {
    requireCollection(collection);
    requireText("edge_id", edgeId);
    return locks.read(collection, () -> loadEdge(collection, edgeId));
  }

  /**
   * Edges ordered by id. {@code nodeId} keeps edges touching that node, {@code relationType} edges
   * of that relation; either may be null.
   *
   * @param limit maximum number of edges; {@code <= 0} means no limit
   */
  public List<Edge> listEdges(String collection, String nodeId, String relationType, int limit) {
    requireCollection(collection);
    RecordFilter filter = RecordFilter.all();
    if (nodeId != null) filter = filter.andAnyEquals(nodeId, Edge.FIELD_SOURCE, Edge.FIELD_TARGET);
    if (relationType != null) filter = filter.and(Edge.FIELD_RELATION_TYPE, relationType);
    RecordFilter effective = filter;
    return locks.read(
        collection,
        () -> map(store.list(collection, RecordKind.EDGE, effective, limit), Edge::fromRecord));
  }

  // ---------------------------------------------------------------- batches

  /**
   * Create each node independently. Rejected items, store failures included, are reported per
   * item and never affect the others.
   */
  public BatchResult batchCreateNodes(String collection, List<NodeSpec> specs) {
    requireCollection(collection);
    BatchResult result = new BatchResult();
    List<NodeSpec> items = specs == null ? List.of() : specs;
    for (int i = 0; i < items.size(); i++) {
      NodeSpec spec = items.get(i);
      try {
        result.recordSuccess(createNode(collection, spec).getId());
      } catch (StoreException e) {
        log.warn("Store failure on batch node {} in '{}': {}", i, collection, e.getMessage());
        materializer.invalidate(collection);
        result.recordFailure(
            new BatchFailure(i, spec == null ? null : spec.getId(), e.getCode(), e.getMessage()));
      } catch (KnowledgeGraphException e) {
        result.recordFailure(
            new BatchFailure(i, spec == null ? null : spec.getId(), e.getCode(), e.getMessage()));
      }
    }
    log.info("Batch node create in '{}': {}", collection, result);
    return result;
  }

  /** Edge counterpart of {@link #batchCreateNodes(String, List)}. */
  public BatchResult batchCreateEdges(String collection, List<EdgeSpec> specs) {
    requireCollection(collection);
    BatchResult result = new BatchResult();
    List<EdgeSpec> items = specs == null ? List.of() : specs;
    for (int i = 0; i < items.size(); i++) {
      EdgeSpec spec = items.get(i);
      try {
        result.recordSuccess(createEdge(collection, spec).getId());
      } catch (StoreException e) {
        log.warn("Store failure on batch edge {} in '{}': {}", i, collection, e.getMessage());
        materializer.invalidate(collection);
        result.recordFailure(
            new BatchFailure(
                i, spec == null ? null : spec.resolveId(), e.getCode(), e.getMessage()));
      } catch (KnowledgeGraphException e) {
        result.recordFailure(
            new BatchFailure(
                i, spec == null ? null : spec.resolveId(), e.getCode(), e.getMessage()));
      }
    }
    log.info("Batch edge create in '{}': {}", collection, result);
    return result;
  }

  // ---------------------------------------------------------------- clear

  /** Remove every edge, then every node. Clearing an empty collection is a no-op. */
  public ClearResult clear(String collection) {
    requireCollection(collection);
    return locks.write(collection, () -> clearLocked(collection));
  }

  /** Clear body for callers that already hold the collection write lock. */
  public ClearResult clearLocked(String collection) {
    int edges = store.deleteAll(collection, RecordKind.EDGE);
    int nodes = store.deleteAll(collection, RecordKind.NODE);
    materializer.invalidate(collection);
    log.info("Cleared collection '{}': {} node(s), {} edge(s)", collection, nodes, edges);
    return new ClearResult(nodes, edges);
  }

  // ---------------------------------------------------------------- helpers

  private Node loadNode(String collection, String nodeId) {
    return store
        .get(collection, RecordKind.NODE, nodeId)
        .map(Node::fromRecord)
        .orElseThrow(() -> new NotFoundException(collection, RecordKind.NODE, nodeId));
  }

  private Edge loadEdge(String collection, String edgeId) {
    return store
        .get(collection, RecordKind.EDGE, edgeId)
        .map(Edge::fromRecord)
        .orElseThrow(() -> new NotFoundException(collection, RecordKind.EDGE, edgeId));
  }

  private void requireEndpoints(String collection, String edgeId, String source, String target) {
    List<String> missing = new ArrayList<>();
    if (!store.exists(collection, RecordKind.NODE, source)) missing.add(source);
    if (!target.equals(source) && !store.exists(collection, RecordKind.NODE, target)) {
      missing.add(target);
    }
    if (!missing.isEmpty()) {
      throw new EndpointNotFoundException(collection, edgeId, missing);
    }
  }

  private static <T> List<T> map(
      List<Map<String, Object>> records, Function<Map<String, Object>, T> fn) {
    List<T> out = new ArrayList<>(records.size());
    for (Map<String, Object> record : records) out.add(fn.apply(record));
    return out;
  }
}

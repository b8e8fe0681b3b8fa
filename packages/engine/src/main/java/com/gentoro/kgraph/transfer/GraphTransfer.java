package com.gentoro.kgraph.transfer;

import static com.gentoro.kgraph.utility.ArgumentChecks.requireCollection;

import com.gentoro.kgraph.exception.EndpointNotFoundException;
import com.gentoro.kgraph.exception.ValidationException;
import com.gentoro.kgraph.graph.CollectionLocks;
import com.gentoro.kgraph.graph.Graph;
import com.gentoro.kgraph.graph.GraphMaterializer;
import com.gentoro.kgraph.model.Edge;
import com.gentoro.kgraph.model.EdgeSpec;
import com.gentoro.kgraph.model.ImportResult;
import com.gentoro.kgraph.model.Node;
import com.gentoro.kgraph.mutation.MutationManager;
import com.gentoro.kgraph.store.RecordFilter;
import com.gentoro.kgraph.store.RecordKind;
import com.gentoro.kgraph.store.RecordStore;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Whole-collection export and import.
 *
 * <p>An import is validated completely before anything is written and then applied inside a single
 * write-lock scope. Existing ids are updated in place, so importing the same document twice leaves
 * the collection as one import did.
 */
public class GraphTransfer {
  private static final org.slf4j.Logger log =
      com.gentoro.kgraph.logging.LoggingService.getLogger(GraphTransfer.class);

  private final RecordStore store;
  private final GraphMaterializer materializer;
  private final CollectionLocks locks;
  private final MutationManager mutations;
  private final Clock clock;

  public GraphTransfer(
      RecordStore store,
      GraphMaterializer materializer,
      CollectionLocks locks,
      MutationManager mutations,
      Clock clock) {
    this.store = store;
    this.materializer = materializer;
    this.locks = locks;
    this.mutations = mutations;
    this.clock = clock;
  }

  /** Every node and edge of the collection, ordered by id. */
  public GraphDocument exportGraph(String collection) {
    requireCollection(collection);
    Graph graph = materializer.snapshot(collection);
    GraphDocument document =
        new GraphDocument(
            GraphDocument.FORMAT_VERSION,
            collection,
            clock.instant(),
            new ArrayList<>(graph.nodes()),
            new ArrayList<>(graph.edges()));
    log.info("Exported {}", document);
    return document;
  }

  /**
   * Import {@code document} into {@code collection}.
   *
   * @param clearExisting remove the current contents first; otherwise merge by id
   * @throws ValidationException when an entry is malformed or an id repeats inside the document
   * @throws EndpointNotFoundException listing every edge whose endpoints are in neither the
   *     collection nor the document; nothing is changed in that case
   */
  public ImportResult importGraph(
      String collection, GraphDocument document, boolean clearExisting) {
    requireCollection(collection);
    if (document == null) throw new ValidationException("document", "Graph document is required");
    return locks.write(collection, () -> importLocked(collection, document, clearExisting));
  }

  private ImportResult importLocked(String collection, GraphDocument document, boolean clear) {
    Map<String, Node> nodes = validateNodes(document.getNodes());
    Map<String, Edge> edges = resolveEdges(document.getEdges());

    Map<String, Node> existingNodes = clear ? Map.of() : loadNodes(collection);
    Map<String, Edge> existingEdges = clear ? Map.of() : loadEdges(collection);

    Set<String> nodeIds = new HashSet<>(existingNodes.keySet());
    nodeIds.addAll(nodes.keySet());
    Map<String, List<String>> dangling = new LinkedHashMap<>();
    for (Edge edge : edges.values()) {
      List<String> missing = new ArrayList<>();
      if (!nodeIds.contains(edge.getSourceNodeId())) missing.add(edge.getSourceNodeId());
      if (!nodeIds.contains(edge.getTargetNodeId())
          && !edge.getTargetNodeId().equals(edge.getSourceNodeId())) {
        missing.add(edge.getTargetNodeId());
      }
      if (!missing.isEmpty()) dangling.put(edge.getId(), missing);
    }
    if (!dangling.isEmpty()) {
      throw new EndpointNotFoundException(collection, dangling);
    }

    if (clear) mutations.clearLocked(collection);
    Instant now = clock.instant();
    int nodesCreated = 0;
    int nodesUpdated = 0;
    for (Node node : nodes.values()) {
      Node previous = existingNodes.get(node.getId());
      Instant createdAt =
          node.getCreatedAt() != null
              ? node.getCreatedAt()
              : previous != null && previous.getCreatedAt() != null ? previous.getCreatedAt() : now;
      Node stored =
          new Node(
              node.getId(),
              node.getName(),
              node.getType(),
              node.getProperties(),
              createdAt,
              updatedAt(
                  node.getUpdatedAt(),
                  previous == null ? null : previous.getUpdatedAt(),
                  sameContent(node, previous),
                  now));
      store.upsert(collection, RecordKind.NODE, stored.toRecord());
      if (previous == null) nodesCreated++;
      else nodesUpdated++;
    }
    int edgesCreated = 0;
    int edgesUpdated = 0;
    for (Edge edge : edges.values()) {
      Edge previous = existingEdges.get(edge.getId());
      Instant createdAt =
          edge.getCreatedAt() != null
              ? edge.getCreatedAt()
              : previous != null && previous.getCreatedAt() != null ? previous.getCreatedAt() : now;
      Edge stored =
          new Edge(
              edge.getId(),
              edge.getSourceNodeId(),
              edge.getTargetNodeId(),
              edge.getRelationType(),
              edge.getProperties(),
              edge.getWeight(),
              createdAt,
              updatedAt(
                  edge.getUpdatedAt(),
                  previous == null ? null : previous.getUpdatedAt(),
                  sameContent(edge, previous),
                  now));
      store.upsert(collection, RecordKind.EDGE, stored.toRecord());
      if (previous == null) edgesCreated++;
      else edgesUpdated++;
    }
    materializer.invalidate(collection);

    ImportResult result =
        new ImportResult(collection, clear, nodesCreated, nodesUpdated, edgesCreated, edgesUpdated);
    log.info("Imported into '{}': {}", collection, result);
    return result;
  }

  private static Map<String, Node> validateNodes(List<Node> nodes) {
    Map<String, Node> byId = new LinkedHashMap<>();
    for (int i = 0; i < nodes.size(); i++) {
      Node node = nodes.get(i);
      String field = "nodes[" + i + "]";
      if (node == null) throw new ValidationException(field, "Null node entry at " + field);
      if (isBlank(node.getId())) {
        throw new ValidationException(field + ".node_id", "Missing node_id at " + field);
      }
      if (isBlank(node.getName())) {
        throw new ValidationException(
            field + ".name", "Node '" + node.getId() + "' has no name");
      }
      if (byId.putIfAbsent(node.getId(), node) != null) {
        throw new ValidationException(
            field + ".node_id", "Duplicate node_id '" + node.getId() + "' in document");
      }
    }
    return byId;
  }

  /** Validates edge entries and derives missing ids the way edge creation does. */
  private static Map<String, Edge> resolveEdges(List<Edge> edges) {
    Map<String, Edge> byId = new LinkedHashMap<>();
    for (int i = 0; i < edges.size(); i++) {
      Edge edge = edges.get(i);
      String field = "edges[" + i + "]";
      if (edge == null) throw new ValidationException(field, "Null edge entry at " + field);
      if (isBlank(edge.getSourceNodeId()) || isBlank(edge.getTargetNodeId())) {
        throw new ValidationException(field, "Edge at " + field + " needs both endpoints");
      }
      if (!Double.isFinite(edge.getWeight())) {
        throw new ValidationException(field + ".weight", "Edge weight must be finite at " + field);
      }
      if (isBlank(edge.getId())) {
        String derived =
            EdgeSpec.of(
                    null, edge.getSourceNodeId(), edge.getTargetNodeId(), edge.getRelationType())
                .resolveId();
        edge =
            new Edge(
                derived,
                edge.getSourceNodeId(),
                edge.getTargetNodeId(),
                edge.getRelationType(),
                edge.getProperties(),
                edge.getWeight(),
                edge.getCreatedAt(),
                edge.getUpdatedAt());
      }
      if (byId.putIfAbsent(edge.getId(), edge) != null) {
        throw new ValidationException(
            field + ".edge_id", "Duplicate edge_id '" + edge.getId() + "' in document");
      }
    }
    return byId;
  }

  /**
   * The document's timestamp when it has one. Otherwise an unchanged record keeps its stored
   * timestamp and a new or changed one is stamped {@code now}.
   */
  private static Instant updatedAt(
      Instant fromDocument, Instant stored, boolean unchanged, Instant now) {
    if (fromDocument != null) return fromDocument;
    return unchanged && stored != null ? stored : now;
  }

  private static boolean sameContent(Node incoming, Node previous) {
    return previous != null
        && Objects.equals(incoming.getName(), previous.getName())
        && Objects.equals(incoming.getType(), previous.getType())
        && incoming.getProperties().equals(previous.getProperties());
  }

  private static boolean sameContent(Edge incoming, Edge previous) {
    return previous != null
        && incoming.getSourceNodeId().equals(previous.getSourceNodeId())
        && incoming.getTargetNodeId().equals(previous.getTargetNodeId())
        && Objects.equals(incoming.getRelationType(), previous.getRelationType())
        && incoming.getProperties().equals(previous.getProperties())
        && Double.compare(incoming.getWeight(), previous.getWeight()) == 0;
  }

  private Map<String, Node> loadNodes(String collection) {
    Map<String, Node> out = new HashMap<>();
    for (Map<String, Object> r : store.list(collection, RecordKind.NODE, RecordFilter.all(), 0)) {
      Node node = Node.fromRecord(r);
      out.put(node.getId(), node);
    }
    return out;
  }

  private Map<String, Edge> loadEdges(String collection) {
    Map<String, Edge> out = new HashMap<>();
    for (Map<String, Object> r : store.list(collection, RecordKind.EDGE, RecordFilter.all(), 0)) {
      Edge edge = Edge.fromRecord(r);
      out.put(edge.getId(), edge);
    }
    return out;
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}

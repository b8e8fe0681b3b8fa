package com.gentoro.kgraph;

import com.gentoro.kgraph.context.ContextFormatter;
import com.gentoro.kgraph.context.ContextRetriever;
import com.gentoro.kgraph.context.GraphContext;
import com.gentoro.kgraph.graph.CollectionLocks;
import com.gentoro.kgraph.graph.GraphMaterializer;
import com.gentoro.kgraph.model.BatchResult;
import com.gentoro.kgraph.model.ClearResult;
import com.gentoro.kgraph.model.Direction;
import com.gentoro.kgraph.model.Edge;
import com.gentoro.kgraph.model.EdgeSpec;
import com.gentoro.kgraph.model.EdgeUpdate;
import com.gentoro.kgraph.model.GraphPath;
import com.gentoro.kgraph.model.GraphStats;
import com.gentoro.kgraph.model.ImportResult;
import com.gentoro.kgraph.model.NeighborResult;
import com.gentoro.kgraph.model.Node;
import com.gentoro.kgraph.model.NodeSpec;
import com.gentoro.kgraph.model.NodeUpdate;
import com.gentoro.kgraph.mutation.MutationManager;
import com.gentoro.kgraph.search.GraphSearch;
import com.gentoro.kgraph.store.RecordStore;
import com.gentoro.kgraph.transfer.GraphDocument;
import com.gentoro.kgraph.transfer.GraphTransfer;
import com.gentoro.kgraph.traversal.TraversalEngine;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Collection-scoped entry point of the knowledge graph engine.
 *
 * <p>A service is bound to one {@link RecordStore}; there is no shared global instance. Mutations
 * of a collection are serialized by its write lock while reads share its read lock, and
 * different collections never block each other. The store is initialized on first use.
 */
public class KnowledgeGraphService implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.kgraph.logging.LoggingService.getLogger(KnowledgeGraphService.class);

  private final RecordStore store;
  private final KnowledgeGraphSettings settings;
  private final GraphMaterializer materializer;
  private final MutationManager mutations;
  private final TraversalEngine traversal;
  private final GraphSearch search;
  private final GraphTransfer transfer;
  private final ContextFormatter formatter;
  private final ContextRetriever retriever;

  public KnowledgeGraphService(RecordStore store, KnowledgeGraphSettings settings) {
    this(store, settings, Clock.systemUTC());
  }

  public KnowledgeGraphService(RecordStore store, KnowledgeGraphSettings settings, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.settings = Objects.requireNonNull(settings, "settings");
    CollectionLocks locks = new CollectionLocks();
    this.materializer = new GraphMaterializer(store, locks, settings.isCacheEnabled());
    this.mutations = new MutationManager(store, materializer, locks, clock);
    this.traversal = new TraversalEngine(materializer, settings);
    this.search = new GraphSearch(store, locks, settings.getTieBreak());
    this.transfer = new GraphTransfer(store, materializer, locks, mutations, clock);
    this.formatter = new ContextFormatter();
    this.retriever =
        new ContextRetriever(
            search,
            materializer,
            locks,
            formatter,
            settings.getContextMaxChars(),
            settings.getContextEdgesPerNode());
    log.debug(
        "KnowledgeGraphService created on '{}' store with {}", store.getDriverName(), settings);
  }

  public void initialize() {
    store.initialize();
  }

  public KnowledgeGraphSettings getSettings() {
    return settings;
  }

  public String getDriverName() {
    return store.getDriverName();
  }

  // nodes

  public Node createNode(String collection, NodeSpec spec) {
    ensureReady();
    return mutations.createNode(collection, spec);
  }

  public Node getNode(String collection, String nodeId) {
    ensureReady();
    return mutations.getNode(collection, nodeId);
  }

  public List<Node> listNodes(String collection, String type, int limit) {
    ensureReady();
    return mutations.listNodes(collection, type, limit);
  }

  public Node updateNode(String collection, String nodeId, NodeUpdate update) {
    ensureReady();
    return mutations.updateNode(collection, nodeId, update);
  }

  /** @return number of edges removed together with the node */
  public int deleteNode(String collection, String nodeId) {
    ensureReady();
    return mutations.deleteNode(collection, nodeId);
  }

  public BatchResult batchCreateNodes(String collection, List<NodeSpec> specs) {
    ensureReady();
    return mutations.batchCreateNodes(collection, specs);
  }

  // edges

  public Edge createEdge(String collection, EdgeSpec spec) {
    ensureReady();
    return mutations.createEdge(collection, spec);
  }

  public Edge getEdge(String collection, String edgeId) {
    ensureReady();
    return mutations.getEdge(collection, edgeId);
  }

  public List<Edge> listEdges(String collection, String nodeId, String relationType, int limit) {
    ensureReady();
    return mutations.listEdges(collection, nodeId, relationType, limit);
  }

  public Edge updateEdge(String collection, String edgeId, EdgeUpdate update) {
    ensureReady();
    return mutations.updateEdge(collection, edgeId, update);
  }

  public void deleteEdge(String collection, String edgeId) {
    ensureReady();
    mutations.deleteEdge(collection, edgeId);
  }

  public BatchResult batchCreateEdges(String collection, List<EdgeSpec> specs) {
    ensureReady();
    return mutations.batchCreateEdges(collection, specs);
  }

  public ClearResult clear(String collection) {
    ensureReady();
    return mutations.clear(collection);
  }

  // traversal

  public NeighborResult neighbors(
      String collection, String nodeId, Direction direction, int maxDepth) {
    ensureReady();
    return traversal.neighbors(collection, nodeId, direction, maxDepth);
  }

  public Optional<GraphPath> findPath(
      String collection, String source, String target, int maxLength) {
    ensureReady();
    return traversal.findPath(collection, source, target, maxLength);
  }

  public Optional<GraphPath> findPath(
      String collection, String source, String target, int maxLength, Direction direction) {
    ensureReady();
    return traversal.findPath(collection, source, target, maxLength, direction);
  }

  public List<GraphPath> findAllPaths(
      String collection, String source, String target, int maxLength, Direction direction) {
    ensureReady();
    return traversal.findAllPaths(collection, source, target, maxLength, direction);
  }

  public GraphStats stats(String collection) {
    ensureReady();
    return traversal.stats(collection);
  }

  // search

  public List<Node> searchNodes(String collection, String keyword, int limit) {
    ensureReady();
    return search.searchNodes(collection, keyword, limit);
  }

  public List<Edge> searchEdges(String collection, String keyword, int limit) {
    ensureReady();
    return search.searchEdges(collection, keyword, limit);
  }

  // import / export

  public GraphDocument exportGraph(String collection) {
    ensureReady();
    return transfer.exportGraph(collection);
  }

  public ImportResult importGraph(
      String collection, GraphDocument document, boolean clearExisting) {
    ensureReady();
    return transfer.importGraph(collection, document, clearExisting);
  }

  // context

  /** Format already ranked nodes and edges; see {@link ContextFormatter}. */
  public String formatContext(List<Node> rankedNodes, List<Edge> edges, int maxChars) {
    return formatter.format(rankedNodes, edges, maxChars);
  }

  public GraphContext retrieveContext(String collection, String query, int topK) {
    ensureReady();
    return retriever.retrieveContext(collection, query, topK);
  }

  @Override
  public void close() {
    store.shutdown();
  }

  private void ensureReady() {
    if (!store.isInitialized()) store.initialize();
  }
}

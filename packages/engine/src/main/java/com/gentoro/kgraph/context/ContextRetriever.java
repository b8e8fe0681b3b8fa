package com.gentoro.kgraph.context;

import static com.gentoro.kgraph.utility.ArgumentChecks.requireCollection;
import static com.gentoro.kgraph.utility.ArgumentChecks.requirePositive;
import static com.gentoro.kgraph.utility.ArgumentChecks.requireText;

import com.gentoro.kgraph.graph.CollectionLocks;
import com.gentoro.kgraph.graph.Graph;
import com.gentoro.kgraph.graph.GraphMaterializer;
import com.gentoro.kgraph.model.Direction;
import com.gentoro.kgraph.model.Edge;
import com.gentoro.kgraph.model.Node;
import com.gentoro.kgraph.search.GraphSearch;
import com.gentoro.kgraph.search.SearchHit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Search-then-format pipeline for text-generation callers.
 *
 * <p>The whole query is searched first. When it matches nothing, the query is split into keywords
 * and the per-keyword hits are merged: best tier first, then the number of keywords a node
 * matched, then the search tie-break. Search and graph reads share one read-lock scope, so the
 * context reflects a single state of the collection.
 */
public class ContextRetriever {
  private static final org.slf4j.Logger log =
      com.gentoro.kgraph.logging.LoggingService.getLogger(ContextRetriever.class);

  private final GraphSearch search;
  private final GraphMaterializer materializer;
  private final CollectionLocks locks;
  private final ContextFormatter formatter;
  private final int maxChars;
  private final int edgesPerNode;

  public ContextRetriever(
      GraphSearch search,
      GraphMaterializer materializer,
      CollectionLocks locks,
      ContextFormatter formatter,
      int maxChars,
      int edgesPerNode) {
    this.search = search;
    this.materializer = materializer;
    this.locks = locks;
    this.formatter = formatter;
    this.maxChars = maxChars;
    this.edgesPerNode = edgesPerNode;
  }

  public GraphContext retrieveContext(String collection, String query, int topK) {
    requireCollection(collection);
    requireText("query", query);
    requirePositive("top_k", topK);
    return locks.read(collection, () -> retrieveLocked(collection, query, topK));
  }

  private GraphContext retrieveLocked(String collection, String query, int topK) {
    List<Node> nodes = rank(collection, query, topK);
    Graph graph = materializer.snapshot(collection);

    Map<String, Edge> edges = new LinkedHashMap<>();
    Map<String, String> names = new HashMap<>();
    for (Node node : nodes) {
      int taken = 0;
      for (Edge edge : graph.edgesOf(node.getId(), Direction.BOTH)) {
        if (taken++ >= edgesPerNode) break;
        edges.putIfAbsent(edge.getId(), edge);
        names.put(edge.getSourceNodeId(), displayName(graph, edge.getSourceNodeId()));
        names.put(edge.getTargetNodeId(), displayName(graph, edge.getTargetNodeId()));
      }
    }
    List<Edge> connecting = new ArrayList<>(edges.values());
    String text = formatter.format(nodes, connecting, maxChars, names);
    log.debug(
        "retrieveContext({}, '{}', {}) -> {} node(s), {} edge(s), {} char(s)",
        collection,
        query,
        topK,
        nodes.size(),
        connecting.size(),
        text.length());
    return new GraphContext(nodes, connecting, text, QueryTokenizer.estimateTokens(text));
  }

  private List<Node> rank(String collection, String query, int topK) {
    List<SearchHit<Node>> direct = search.rankNodes(collection, query, topK);
    if (!direct.isEmpty()) {
      List<Node> nodes = new ArrayList<>(direct.size());
      for (SearchHit<Node> hit : direct) nodes.add(hit.item());
      return nodes;
    }

    Map<String, Merged> merged = new LinkedHashMap<>();
    for (String keyword : QueryTokenizer.keywords(query)) {
      for (SearchHit<Node> hit : search.rankNodes(collection, keyword, topK)) {
        merged
            .computeIfAbsent(hit.item().getId(), id -> new Merged(hit.item()))
            .add(hit.tier());
      }
    }
    List<Merged> ranked = new ArrayList<>(merged.values());
    ranked.sort(
        Comparator.comparingInt((Merged m) -> m.bestTier)
            .thenComparing(Comparator.comparingInt((Merged m) -> m.keywords).reversed())
            .thenComparing(m -> m.node, search.tieBreakOrder()));
    List<Node> nodes = new ArrayList<>();
    for (Merged m : ranked) {
      if (nodes.size() >= topK) break;
      nodes.add(m.node);
    }
    return nodes;
  }

  private static String displayName(Graph graph, String nodeId) {
    return graph.node(nodeId).map(Node::getName).orElse(nodeId);
  }

  private static final class Merged {
    private final Node node;
    private int bestTier = Integer.MAX_VALUE;
    private int keywords;

    Merged(Node node) {
      this.node = node;
    }

    void add(int tier) {
      bestTier = Math.min(bestTier, tier);
      keywords++;
    }
  }
}

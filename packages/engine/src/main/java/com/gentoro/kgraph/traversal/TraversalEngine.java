package com.gentoro.kgraph.traversal;

import static com.gentoro.kgraph.utility.ArgumentChecks.requireCollection;
import static com.gentoro.kgraph.utility.ArgumentChecks.requirePositive;
import static com.gentoro.kgraph.utility.ArgumentChecks.requireRange;
import static com.gentoro.kgraph.utility.ArgumentChecks.requireText;

import com.gentoro.kgraph.KnowledgeGraphSettings;
import com.gentoro.kgraph.exception.NotFoundException;
import com.gentoro.kgraph.graph.Graph;
import com.gentoro.kgraph.graph.GraphMaterializer;
import com.gentoro.kgraph.model.Direction;
import com.gentoro.kgraph.model.Edge;
import com.gentoro.kgraph.model.GraphPath;
import com.gentoro.kgraph.model.GraphStats;
import com.gentoro.kgraph.model.Neighbor;
import com.gentoro.kgraph.model.NeighborResult;
import com.gentoro.kgraph.model.Node;
import com.gentoro.kgraph.store.RecordKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

/**
 * Structural queries over one materialized snapshot of a collection.
 *
 * <p>Adjacency is always explored in edge-id order, so results are deterministic for a given
 * snapshot. Each query reads exactly one snapshot and therefore never observes a half-applied
 * mutation.
 */
public class TraversalEngine {
  private static final org.slf4j.Logger log =
      com.gentoro.kgraph.logging.LoggingService.getLogger(TraversalEngine.class);

  private final GraphMaterializer materializer;
  private final int maxPathLength;
  private final int maxPaths;

  public TraversalEngine(GraphMaterializer materializer, KnowledgeGraphSettings settings) {
    this.materializer = materializer;
    this.maxPathLength = settings.getMaxPathLength();
    this.maxPaths = settings.getMaxPaths();
  }

  /**
   * Breadth-first expansion from {@code nodeId}. Every reachable node is reported once, at the
   * depth it was first discovered; the start node itself is not reported.
   *
   * @param direction {@code null} means {@link Direction#BOTH}
   */
  public NeighborResult neighbors(
      String collection, String nodeId, Direction direction, int depth) {
    requireCollection(collection);
    requireText("node_id", nodeId);
    requirePositive("max_depth", depth);
    Direction dir = direction == null ? Direction.BOTH : direction;
    Graph graph = materializer.snapshot(collection);
    requireNode(graph, nodeId);

    Set<String> visited = new HashSet<>();
    Map<String, Integer> depths = new HashMap<>();
    Queue<String> queue = new LinkedList<>();
    List<Neighbor> found = new ArrayList<>();
    Map<String, Edge> followed = new LinkedHashMap<>();

    visited.add(nodeId);
    depths.put(nodeId, 0);
    queue.add(nodeId);
    while (!queue.isEmpty()) {
      String current = queue.poll();
      int currentDepth = depths.get(current);
      if (currentDepth >= depth) continue;

      for (Edge edge : graph.edgesOf(current, dir)) {
        followed.putIfAbsent(edge.getId(), edge);
        String next = step(edge, current, dir);
        if (visited.add(next)) {
          depths.put(next, currentDepth + 1);
          queue.add(next);
          found.add(new Neighbor(graph.node(next).orElseThrow(), currentDepth + 1, edge));
        }
      }
    }
    log.debug(
        "neighbors({}, {}, {}, {}) -> {} node(s)", collection, nodeId, dir, depth, found.size());
    return new NeighborResult(nodeId, dir, depth, found, new ArrayList<>(followed.values()));
  }

  /** Shortest path following outgoing edges. */
  public Optional<GraphPath> findPath(
      String collection, String source, String target, int maxLength) {
    return findPath(collection, source, target, maxLength, Direction.OUT);
  }

  /**
   * Shortest path by hop count, at most {@code maxLength} hops. Among equally short paths the one
   * found first wins: nodes are expanded in discovery order and edges in id order, and the first
   * edge reaching a node fixes its predecessor.
   *
   * @return the path, or empty when none exists within the bound
   */
  public Optional<GraphPath> findPath(
      String collection, String source, String target, int maxLength, Direction direction) {
    requireCollection(collection);
    requireText("source_node_id", source);
    requireText("target_node_id", target);
    requirePositive("max_length", maxLength);
    Direction dir = direction == null ? Direction.OUT : direction;
    Graph graph = materializer.snapshot(collection);
    requireNode(graph, source);
    requireNode(graph, target);
    if (source.equals(target)) {
      return Optional.of(new GraphPath(List.of(source), List.of()));
    }

    Map<String, Edge> via = new HashMap<>();
    Map<String, Integer> depths = new HashMap<>();
    Queue<String> queue = new ArrayDeque<>();
    depths.put(source, 0);
    queue.add(source);
    while (!queue.isEmpty()) {
      String current = queue.poll();
      int currentDepth = depths.get(current);
      if (currentDepth >= maxLength) continue;
      for (Edge edge : graph.edgesOf(current, dir)) {
        String next = step(edge, current, dir);
        if (depths.containsKey(next)) continue;
        depths.put(next, currentDepth + 1);
        via.put(next, edge);
        if (next.equals(target)) {
          GraphPath path = rebuild(source, target, via, dir);
          log.debug("findPath({}, {} -> {}) -> {} hop(s)", collection, source, target, path.hops());
          return Optional.of(path);
        }
        queue.add(next);
      }
    }
    log.debug("findPath({}, {} -> {}) -> no path within {}", collection, source, target, maxLength);
    return Optional.empty();
  }

  /** All simple paths following outgoing edges. */
  public List<GraphPath> findAllPaths(
      String collection, String source, String target, int maxLength) {
    return findAllPaths(collection, source, target, maxLength, Direction.OUT);
  }

  /**
   * Every simple path (no repeated node) from {@code source} to {@code target} of at most {@code
   * maxLength} hops, shortest first and then by edge-id sequence. At most {@code
   * kgraph.traversal.maxPaths} paths are returned, and {@code maxLength} may not exceed {@code
   * kgraph.traversal.maxPathLength}.
   */
  public List<GraphPath> findAllPaths(
      String collection, String source, String target, int maxLength, Direction direction) {
    requireCollection(collection);
    requireText("source_node_id", source);
    requireText("target_node_id", target);
    requireRange("max_length", maxLength, maxPathLength);
    Direction dir = direction == null ? Direction.OUT : direction;
    Graph graph = materializer.snapshot(collection);
    requireNode(graph, source);
    requireNode(graph, target);
    if (source.equals(target)) {
      return List.of(new GraphPath(List.of(source), List.of()));
    }

    List<GraphPath> paths = new ArrayList<>();
    // one depth-first pass per length keeps the result sorted by hops, then by edge ids
    for (int hops = 1; hops <= maxLength && paths.size() < maxPaths; hops++) {
      Deque<String> nodes = new ArrayDeque<>();
      nodes.addLast(source);
      collectPaths(
          graph, dir, target, hops, nodes, new ArrayDeque<>(), new HashSet<>(nodes), paths);
    }
    log.debug(
        "findAllPaths({}, {} -> {}, {}) -> {} path(s)",
        collection,
        source,
        target,
        maxLength,
        paths.size());
    return Collections.unmodifiableList(paths);
  }

  private void collectPaths(
      Graph graph,
      Direction dir,
      String target,
      int remaining,
      Deque<String> nodes,
      Deque<Edge> edges,
      Set<String> onPath,
      List<GraphPath> out) {
    if (out.size() >= maxPaths) return;
    String current = nodes.peekLast();
    for (Edge edge : graph.edgesOf(current, dir)) {
      String next = step(edge, current, dir);
      if (onPath.contains(next)) continue;
      if (remaining == 1) {
        if (!next.equals(target)) continue;
        List<String> nodeIds = new ArrayList<>(nodes);
        nodeIds.add(next);
        List<Edge> path = new ArrayList<>(edges);
        path.add(edge);
        out.add(new GraphPath(nodeIds, path));
        if (out.size() >= maxPaths) return;
        continue;
      }
      if (next.equals(target)) continue;
      nodes.addLast(next);
      edges.addLast(edge);
      onPath.add(next);
      collectPaths(graph, dir, target, remaining - 1, nodes, edges, onPath, out);
      onPath.remove(next);
      edges.removeLast();
      nodes.removeLast();
      if (out.size() >= maxPaths) return;
    }
  }

  /** Counts and degree figures, all taken from the same snapshot. */
  public GraphStats stats(String collection) {
    requireCollection(collection);
    Graph graph = materializer.snapshot(collection);
    int isolated = 0;
    int maxOut = 0;
    int maxIn = 0;
    for (Node node : graph.nodes()) {
      int out = graph.outgoing(node.getId()).size();
      int in = graph.incoming(node.getId()).size();
      if (out == 0 && in == 0) isolated++;
      maxOut = Math.max(maxOut, out);
      maxIn = Math.max(maxIn, in);
    }
    double average = graph.nodeCount() == 0 ? 0.0 : 2.0 * graph.edgeCount() / graph.nodeCount();
    return new GraphStats(
        collection,
        graph.nodeCount(),
        graph.edgeCount(),
        graph.nodeTypeCounts(),
        graph.relationTypeCounts(),
        isolated,
        maxOut,
        maxIn,
        average);
  }

  /** Node reached from {@code current} over {@code edge} when moving in {@code dir}. */
  private static String step(Edge edge, String current, Direction dir) {
    switch (dir) {
      case OUT:
        return edge.getTargetNodeId();
      case IN:
        return edge.getSourceNodeId();
      default:
        return edge.opposite(current);
    }
  }

  private static GraphPath rebuild(
      String source, String target, Map<String, Edge> via, Direction dir) {
    LinkedList<String> nodeIds = new LinkedList<>();
    LinkedList<Edge> edges = new LinkedList<>();
    String current = target;
    nodeIds.addFirst(current);
    while (!current.equals(source)) {
      Edge edge = via.get(current);
      edges.addFirst(edge);
      current = previous(edge, current, dir);
      nodeIds.addFirst(current);
    }
    return new GraphPath(nodeIds, edges);
  }

  private static String previous(Edge edge, String reached, Direction dir) {
    switch (dir) {
      case OUT:
        return edge.getSourceNodeId();
      case IN:
        return edge.getTargetNodeId();
      default:
        return edge.opposite(reached);
    }
  }

  private static void requireNode(Graph graph, String nodeId) {
    if (!graph.containsNode(nodeId)) {
      throw new NotFoundException(graph.getCollection(), RecordKind.NODE, nodeId);
    }
  }
}

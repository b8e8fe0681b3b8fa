package com.gentoro.kgraph.traversal;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kgraph.KnowledgeGraphSettings;
import com.gentoro.kgraph.exception.NotFoundException;
import com.gentoro.kgraph.exception.ValidationException;
import com.gentoro.kgraph.graph.CollectionLocks;
import com.gentoro.kgraph.graph.GraphMaterializer;
import com.gentoro.kgraph.model.Direction;
import com.gentoro.kgraph.model.Edge;
import com.gentoro.kgraph.model.EdgeSpec;
import com.gentoro.kgraph.model.GraphPath;
import com.gentoro.kgraph.model.GraphStats;
import com.gentoro.kgraph.model.Neighbor;
import com.gentoro.kgraph.model.NeighborResult;
import com.gentoro.kgraph.model.NodeSpec;
import com.gentoro.kgraph.mutation.MutationManager;
import com.gentoro.kgraph.store.memory.InMemoryRecordStore;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Fixture:
 *
 * <pre>
 *   a -e1-> b -e3-> d -e5-> e
 *   a -e2-> c -e4-> d
 *   a -e7-> d
 *   x (isolated)
 * </pre>
 */
class TraversalEngineTest {
  private static final String KG = "kg";

  private InMemoryRecordStore store;
  private CollectionLocks locks;
  private GraphMaterializer materializer;
  private TraversalEngine engine;

  @BeforeEach
  void setUp() {
    store = new InMemoryRecordStore();
    store.initialize();
    locks = new CollectionLocks();
    materializer = new GraphMaterializer(store, locks, true);
    engine = new TraversalEngine(materializer, KnowledgeGraphSettings.defaults());

    MutationManager mutations =
        new MutationManager(store, materializer, locks, Clock.systemUTC());
    mutations.createNode(KG, NodeSpec.of("a", "Alice", "Person"));
    mutations.createNode(KG, NodeSpec.of("b", "Bob", "Person"));
    mutations.createNode(KG, NodeSpec.of("c", "Carol", "Person"));
    mutations.createNode(KG, NodeSpec.of("d", "Acme", "Company"));
    mutations.createNode(KG, NodeSpec.of("e", "Rome", "City"));
    mutations.createNode(KG, NodeSpec.of("x", "Loner", null));
    mutations.createEdge(KG, EdgeSpec.of("e1", "a", "b", "knows"));
    mutations.createEdge(KG, EdgeSpec.of("e2", "a", "c", "knows"));
    mutations.createEdge(KG, EdgeSpec.of("e3", "b", "d", "likes"));
    mutations.createEdge(KG, EdgeSpec.of("e4", "c", "d", "likes"));
    mutations.createEdge(KG, EdgeSpec.of("e5", "d", "e", "works_at"));
    mutations.createEdge(KG, EdgeSpec.of("e7", "a", "d", "shortcut"));
  }

  private static List<String> ids(List<Edge> edges) {
    return edges.stream().map(Edge::getId).collect(Collectors.toList());
  }

  @Test
  @DisplayName("depth-1 outgoing neighbors are exactly the direct targets")
  void directTargets() {
    NeighborResult result = engine.neighbors(KG, "a", Direction.OUT, 1);

    assertEquals(Set.of("b", "c", "d"), result.nodeIds());
    assertEquals(List.of("e1", "e2", "e7"), ids(result.edges()));
    assertTrue(result.neighbors().stream().allMatch(n -> n.depth() == 1));
  }

  @Test
  @DisplayName("deeper expansion reports each node once at its first discovery depth")
  void deeperExpansion() {
    NeighborResult result = engine.neighbors(KG, "a", Direction.OUT, 2);

    assertEquals(List.of("b", "c", "d", "e"), List.copyOf(result.nodeIds()));
    Neighbor e = result.neighbors().get(3);
    assertEquals(2, e.depth());
    assertEquals("e5", e.via().getId());
    assertEquals(List.of("e1", "e2", "e7", "e3", "e4", "e5"), ids(result.edges()));
  }

  @Test
  @DisplayName("incoming and undirected expansion follow the requested direction")
  void directions() {
    assertEquals(
        List.of("b", "c", "a"),
        List.copyOf(engine.neighbors(KG, "d", Direction.IN, 1).nodeIds()));
    assertEquals(
        List.of("b", "c", "e", "a"),
        List.copyOf(engine.neighbors(KG, "d", Direction.BOTH, 1).nodeIds()));
    assertEquals(
        engine.neighbors(KG, "d", Direction.BOTH, 1).nodeIds(),
        engine.neighbors(KG, "d", null, 1).nodeIds());
  }

  @Test
  @DisplayName("the start node is never reported even when a cycle leads back to it")
  void startExcluded() {
    NeighborResult result = engine.neighbors(KG, "a", Direction.BOTH, 3);
    assertFalse(result.nodeIds().contains("a"));
    assertEquals(Set.of("b", "c", "d", "e"), result.nodeIds());
    assertTrue(engine.neighbors(KG, "x", Direction.BOTH, 3).isEmpty());
  }

  @Test
  @DisplayName("neighbor depth must be positive and the start node must exist")
  void neighborValidation() {
    assertThrows(ValidationException.class, () -> engine.neighbors(KG, "a", Direction.OUT, 0));
    assertEquals(
        engine.neighbors(KG, "a", Direction.OUT, 4).neighbors(),
        engine.neighbors(KG, "a", Direction.OUT, 50).neighbors());
    assertThrows(NotFoundException.class, () -> engine.neighbors(KG, "zz", Direction.OUT, 1));
  }

  @Test
  @DisplayName("findPath returns a shortest path and its edges")
  void shortestPath() {
    GraphPath path = engine.findPath(KG, "a", "e", 10).orElseThrow();

    assertEquals(List.of("a", "d", "e"), path.nodeIds());
    assertEquals(List.of("e7", "e5"), ids(path.edges()));
    assertEquals(2, path.hops());
  }

  @Test
  @DisplayName("findPath is empty when the target is out of reach or too far")
  void noPath() {
    assertEquals(Optional.empty(), engine.findPath(KG, "e", "a", 10));
    assertEquals(Optional.empty(), engine.findPath(KG, "a", "e", 1));
    assertEquals(Optional.empty(), engine.findPath(KG, "a", "x", 10));
  }

  @Test
  @DisplayName("undirected path search may walk edges backwards")
  void undirectedPath() {
    GraphPath path = engine.findPath(KG, "e", "a", 10, Direction.BOTH).orElseThrow();
    assertEquals(List.of("e", "d", "a"), path.nodeIds());
    assertEquals(List.of("e5", "e7"), ids(path.edges()));
  }

  @Test
  @DisplayName("a path from a node to itself has zero hops")
  void selfPath() {
    GraphPath path = engine.findPath(KG, "b", "b", 3).orElseThrow();
    assertEquals(List.of("b"), path.nodeIds());
    assertEquals(0, path.hops());
  }

  @Test
  @DisplayName("path endpoints must exist and the length bound is checked")
  void pathValidation() {
    assertThrows(NotFoundException.class, () -> engine.findPath(KG, "a", "zz", 3));
    assertThrows(NotFoundException.class, () -> engine.findPath(KG, "zz", "a", 3));
    assertThrows(ValidationException.class, () -> engine.findPath(KG, "a", "e", 0));
    assertThrows(ValidationException.class, () -> engine.findAllPaths(KG, "a", "e", 11));
  }

  @Test
  @DisplayName("findPath accepts any positive bound, however large")
  void pathBoundIsNotCapped() {
    assertEquals(
        List.of("a", "d", "e"), engine.findPath(KG, "a", "e", 15).orElseThrow().nodeIds());
    assertTrue(engine.findPath(KG, "a", "x", 1_000).isEmpty());
  }

  @Test
  @DisplayName("findAllPaths lists simple paths shortest first")
  void allPaths() {
    List<GraphPath> paths = engine.findAllPaths(KG, "a", "d", 10);

    assertEquals(3, paths.size());
    assertEquals(List.of("a", "d"), paths.get(0).nodeIds());
    assertEquals(List.of("a", "b", "d"), paths.get(1).nodeIds());
    assertEquals(List.of("a", "c", "d"), paths.get(2).nodeIds());
    assertEquals(List.of("e1", "e3"), ids(paths.get(1).edges()));
  }

  @Test
  @DisplayName("findAllPaths stops at the configured path cap")
  void allPathsCapped() {
    TraversalEngine capped =
        new TraversalEngine(materializer, KnowledgeGraphSettings.defaults().withMaxPaths(2));

    List<GraphPath> paths = capped.findAllPaths(KG, "a", "d", 10);
    assertEquals(2, paths.size());
    assertEquals(List.of("a", "b", "d"), paths.get(1).nodeIds());
    assertTrue(capped.findAllPaths(KG, "e", "a", 10).isEmpty());
  }

  @Test
  @DisplayName("stats count nodes, edges, types and degrees from one snapshot")
  void stats() {
    GraphStats stats = engine.stats(KG);

    assertEquals(6, stats.getNodeCount());
    assertEquals(6, stats.getEdgeCount());
    assertEquals(Map.of("", 1, "City", 1, "Company", 1, "Person", 3), stats.getNodeTypes());
    assertEquals(
        Map.of("knows", 2, "likes", 2, "shortcut", 1, "works_at", 1), stats.getRelationTypes());
    assertEquals(1, stats.getIsolatedNodeCount());
    assertEquals(3, stats.getMaxOutDegree());
    assertEquals(3, stats.getMaxInDegree());
    assertEquals(2.0, stats.getAverageDegree(), 1e-9);
  }

  @Test
  @DisplayName("stats of an unknown collection are all zero")
  void emptyStats() {
    GraphStats stats = engine.stats("nothing-here");
    assertEquals(0, stats.getNodeCount());
    assertEquals(0, stats.getEdgeCount());
    assertTrue(stats.getNodeTypes().isEmpty());
    assertEquals(0.0, stats.getAverageDegree());
  }
}

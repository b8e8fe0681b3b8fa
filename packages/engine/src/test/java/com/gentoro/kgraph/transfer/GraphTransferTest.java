package com.gentoro.kgraph.transfer;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kgraph.exception.EndpointNotFoundException;
import com.gentoro.kgraph.exception.ValidationException;
import com.gentoro.kgraph.graph.CollectionLocks;
import com.gentoro.kgraph.graph.GraphMaterializer;
import com.gentoro.kgraph.model.Edge;
import com.gentoro.kgraph.model.EdgeSpec;
import com.gentoro.kgraph.model.ImportResult;
import com.gentoro.kgraph.model.Node;
import com.gentoro.kgraph.model.NodeSpec;
import com.gentoro.kgraph.mutation.MutationManager;
import com.gentoro.kgraph.store.memory.InMemoryRecordStore;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GraphTransferTest {
  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
  private static final Instant EARLIER = Instant.parse("2024-01-01T00:00:00Z");

  private MutationManager mutations;
  private GraphTransfer transfer;

  @BeforeEach
  void setUp() {
    InMemoryRecordStore store = new InMemoryRecordStore();
    store.initialize();
    CollectionLocks locks = new CollectionLocks();
    GraphMaterializer materializer = new GraphMaterializer(store, locks, true);
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    mutations = new MutationManager(store, materializer, locks, clock);
    transfer = new GraphTransfer(store, materializer, locks, mutations, clock);

    mutations.createNode("src", NodeSpec.of("p1", "Alice", "Person").putProperty("age", 30));
    mutations.createNode("src", NodeSpec.of("p2", "Bob", "Person"));
    mutations.createNode("src", NodeSpec.of("c1", "Acme", null));
    mutations.createEdge("src", EdgeSpec.of("e1", "p1", "p2", "knows").setWeight(0.5));
    mutations.createEdge(
        "src", EdgeSpec.of("e2", "p1", "c1", "works_at").putProperty("since", 2020));
  }

  private static Node node(String id, String name) {
    return new Node(id, name, null, Map.of(), null, null);
  }

  private static Edge edge(String id, String source, String target) {
    return new Edge(id, source, target, "rel", Map.of(), null, null, null);
  }

  @Test
  @DisplayName("export lists every node and edge in id order")
  void export() {
    GraphDocument document = transfer.exportGraph("src");

    assertEquals("src", document.getCollection());
    assertEquals(GraphDocument.FORMAT_VERSION, document.getFormatVersion());
    assertEquals(NOW, document.getExportedAt());
    assertEquals(
        List.of("c1", "p1", "p2"), document.getNodes().stream().map(Node::getId).toList());
    assertEquals(List.of("e1", "e2"), document.getEdges().stream().map(Edge::getId).toList());
  }

  @Test
  @DisplayName("an exported document imported elsewhere reproduces the graph, JSON and YAML alike")
  void roundTrip() {
    GraphDocument exported = transfer.exportGraph("src");

    for (GraphDocumentCodec.Format format : GraphDocumentCodec.Format.values()) {
      String copy = "copy-" + format;
      GraphDocument parsed =
          GraphDocumentCodec.read(GraphDocumentCodec.write(exported, format), format);
      ImportResult result = transfer.importGraph(copy, parsed, false);

      assertEquals(new ImportResult(copy, false, 3, 0, 2, 0), result);
      GraphDocument reExported = transfer.exportGraph(copy);
      assertEquals(exported.getNodes(), reExported.getNodes(), format.name());
      assertEquals(exported.getEdges(), reExported.getEdges(), format.name());
    }
  }

  @Test
  @DisplayName("importing the same document twice merges by id")
  void idempotentMerge() {
    GraphDocument exported = transfer.exportGraph("src");

    transfer.importGraph("dst", exported, false);
    ImportResult second = transfer.importGraph("dst", exported, false);

    assertEquals(new ImportResult("dst", false, 0, 3, 0, 2), second);
    assertEquals(3, mutations.listNodes("dst", null, 0).size());
    assertEquals(2, mutations.listEdges("dst", null, null, 0).size());
  }

  @Test
  @DisplayName("null property values, nested ones included, survive export and re-import")
  void nullPropertiesRoundTrip() {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("alias", null);
    meta.put("rank", 2);
    mutations.createNode(
        "src",
        NodeSpec.of("p3", "Carol", "Person")
            .putProperty("nick", null)
            .putProperty("meta", meta)
            .putProperty("price", new BigDecimal("0.10")));
    GraphDocument exported = transfer.exportGraph("src");

    for (GraphDocumentCodec.Format format : GraphDocumentCodec.Format.values()) {
      String copy = "nulls-" + format;
      transfer.importGraph(
          copy, GraphDocumentCodec.read(GraphDocumentCodec.write(exported, format), format), true);

      Node carol = mutations.getNode(copy, "p3");
      assertTrue(carol.getProperties().containsKey("nick"), format.name());
      assertNull(carol.getProperties().get("nick"));
      assertEquals(meta.keySet(), ((Map<?, ?>) carol.getProperties().get("meta")).keySet());
      assertEquals(0.1d, carol.getProperties().get("price"));
      assertEquals(exported.getNodes(), transfer.exportGraph(copy).getNodes(), format.name());
    }
  }

  @Test
  @DisplayName("merging a document without timestamps twice leaves the first result untouched")
  void idempotentMergeWithoutTimestamps() {
    AtomicReference<Instant> now = new AtomicReference<>(EARLIER);
    Clock ticking =
        new Clock() {
          @Override
          public ZoneOffset getZone() {
            return ZoneOffset.UTC;
          }

          @Override
          public Clock withZone(java.time.ZoneId zone) {
            return this;
          }

          @Override
          public Instant instant() {
            return now.getAndUpdate(t -> t.plusSeconds(1));
          }
        };
    InMemoryRecordStore store = new InMemoryRecordStore();
    store.initialize();
    CollectionLocks locks = new CollectionLocks();
    GraphMaterializer materializer = new GraphMaterializer(store, locks, true);
    MutationManager tickingMutations = new MutationManager(store, materializer, locks, ticking);
    GraphTransfer tickingTransfer =
        new GraphTransfer(store, materializer, locks, tickingMutations, ticking);
    GraphDocument document =
        new GraphDocument(
            "dst", List.of(node("a", "A"), node("b", "B")), List.of(edge("e1", "a", "b")));

    tickingTransfer.importGraph("dst", document, false);
    GraphDocument once = tickingTransfer.exportGraph("dst");
    tickingTransfer.importGraph("dst", document, false);
    GraphDocument twice = tickingTransfer.exportGraph("dst");

    assertEquals(once.getNodes(), twice.getNodes());
    assertEquals(once.getEdges(), twice.getEdges());

    GraphDocument renamed =
        new GraphDocument(
            "dst", List.of(node("a", "A2"), node("b", "B")), List.of(edge("e1", "a", "b")));
    tickingTransfer.importGraph("dst", renamed, false);
    Node a = tickingMutations.getNode("dst", "a");
    assertTrue(a.getUpdatedAt().isAfter(once.getNodes().get(0).getUpdatedAt()));
    assertEquals(once.getNodes().get(0).getCreatedAt(), a.getCreatedAt());
    assertEquals(
        once.getNodes().get(1).getUpdatedAt(), tickingMutations.getNode("dst", "b").getUpdatedAt());
  }

  @Test
  @DisplayName("clearing import replaces the collection contents")
  void clearingImport() {
    GraphDocument document =
        new GraphDocument("other", List.of(node("z1", "Zed")), List.of());

    ImportResult result = transfer.importGraph("src", document, true);

    assertEquals(new ImportResult("src", true, 1, 0, 0, 0), result);
    assertEquals(
        List.of("z1"), mutations.listNodes("src", null, 0).stream().map(Node::getId).toList());
    assertTrue(mutations.listEdges("src", null, null, 0).isEmpty());
  }

  @Test
  @DisplayName("edges may point at existing nodes or at nodes in the same document")
  void endpointsResolved() {
    GraphDocument document =
        new GraphDocument(
            "src", List.of(node("p3", "Carol")), List.of(edge("e9", "p3", "p1")));

    ImportResult result = transfer.importGraph("src", document, false);

    assertEquals(1, result.nodesCreated());
    assertEquals(1, result.edgesCreated());
    assertEquals("p1", mutations.getEdge("src", "e9").getTargetNodeId());
  }

  @Test
  @DisplayName("dangling edges are all reported and nothing is written")
  void danglingEdges() {
    GraphDocument document =
        new GraphDocument(
            "src",
            List.of(node("p3", "Carol")),
            List.of(edge("e8", "p3", "ghost"), edge("e9", "nobody", "p1")));

    EndpointNotFoundException ex =
        assertThrows(
            EndpointNotFoundException.class, () -> transfer.importGraph("src", document, false));

    assertEquals(
        Map.of("e8", List.of("ghost"), "e9", List.of("nobody")), ex.getMissingEndpoints());
    assertEquals(3, mutations.listNodes("src", null, 0).size());
  }

  @Test
  @DisplayName("a clearing import cannot lean on nodes it is about to remove")
  void clearingImportChecksDocumentOnly() {
    GraphDocument document =
        new GraphDocument("src", List.of(node("p3", "Carol")), List.of(edge("e9", "p3", "p1")));

    assertThrows(
        EndpointNotFoundException.class, () -> transfer.importGraph("src", document, true));
    assertEquals(3, mutations.listNodes("src", null, 0).size());
  }

  @Test
  @DisplayName("duplicate ids and missing names inside a document are rejected")
  void malformedDocument() {
    GraphDocument duplicate =
        new GraphDocument("x", List.of(node("n1", "A"), node("n1", "B")), List.of());
    GraphDocument nameless = new GraphDocument("x", List.of(node("n1", " ")), List.of());
    GraphDocument badWeight =
        new GraphDocument(
            "x",
            List.of(node("n1", "A")),
            List.of(new Edge("e", "n1", "n1", "r", Map.of(), Double.NaN, null, null)));

    ValidationException ex =
        assertThrows(ValidationException.class, () -> transfer.importGraph("x", duplicate, false));
    assertEquals("nodes[1].node_id", ex.getContext().get("field"));
    assertThrows(ValidationException.class, () -> transfer.importGraph("x", nameless, false));
    assertThrows(ValidationException.class, () -> transfer.importGraph("x", badWeight, false));
    assertTrue(mutations.listNodes("x", null, 0).isEmpty());
  }

  @Test
  @DisplayName("edges without ids get the derived id")
  void derivedIds() {
    GraphDocument document =
        new GraphDocument("src", List.of(), List.of(edge(null, "p2", "p1")));

    transfer.importGraph("src", document, false);

    assertEquals("p1", mutations.getEdge("src", "p2_rel_p1").getTargetNodeId());
  }

  @Test
  @DisplayName("imported timestamps are kept; missing ones keep the stored created_at")
  void timestamps() {
    Node dated = new Node("p9", "Dana", null, Map.of(), EARLIER, EARLIER);
    Node undated = node("p1", "Alice Updated");

    GraphDocument document = new GraphDocument("src", List.of(dated, undated), List.of());
    transfer.importGraph("src", document, false);

    assertEquals(EARLIER, mutations.getNode("src", "p9").getCreatedAt());
    Node p1 = mutations.getNode("src", "p1");
    assertEquals("Alice Updated", p1.getName());
    assertEquals(NOW, p1.getCreatedAt());
    assertEquals(NOW, p1.getUpdatedAt());
  }
}

package com.gentoro.kgraph.store.memory;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kgraph.exception.ValidationException;
import com.gentoro.kgraph.store.RecordFilter;
import com.gentoro.kgraph.store.RecordKind;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryRecordStoreTest {

  private InMemoryRecordStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryRecordStore();
    store.initialize();
  }

  @AfterEach
  void tearDown() {
    store.shutdown();
  }

  private static Map<String, Object> record(String id, String type) {
    Map<String, Object> m = new HashMap<>();
    m.put("id", id);
    m.put("type", type);
    return m;
  }

  @Test
  @DisplayName("list returns records ordered by id and honours the limit")
  void listOrderedAndLimited() {
    store.upsert("c", RecordKind.NODE, record("b", "x"));
    store.upsert("c", RecordKind.NODE, record("c", "x"));
    store.upsert("c", RecordKind.NODE, record("a", "x"));

    List<Map<String, Object>> all = store.list("c", RecordKind.NODE, RecordFilter.all(), 0);
    assertEquals(List.of("a", "b", "c"), all.stream().map(r -> r.get("id")).toList());

    List<Map<String, Object>> two = store.list("c", RecordKind.NODE, null, 2);
    assertEquals(List.of("a", "b"), two.stream().map(r -> r.get("id")).toList());
  }

  @Test
  @DisplayName("collections and record kinds are isolated namespaces")
  void namespacesIsolated() {
    store.upsert("c1", RecordKind.NODE, record("n", "x"));
    store.upsert("c2", RecordKind.EDGE, record("n", "y"));

    assertEquals("x", store.get("c1", RecordKind.NODE, "n").orElseThrow().get("type"));
    assertTrue(store.get("c1", RecordKind.EDGE, "n").isEmpty());
    assertTrue(store.get("c2", RecordKind.NODE, "n").isEmpty());
    assertEquals(1, store.count("c2", RecordKind.EDGE));
  }

  @Test
  @DisplayName("stored records are copies that callers cannot mutate")
  void storedRecordsAreCopies() {
    Map<String, Object> r = record("n", "x");
    store.upsert("c", RecordKind.NODE, r);
    r.put("type", "changed");

    Map<String, Object> stored = store.get("c", RecordKind.NODE, "n").orElseThrow();
    assertEquals("x", stored.get("type"));
    assertThrows(UnsupportedOperationException.class, () -> stored.put("type", "y"));
  }

  @Test
  @DisplayName("filters are applied before the limit")
  void filterBeforeLimit() {
    store.upsert("c", RecordKind.NODE, record("a", "x"));
    store.upsert("c", RecordKind.NODE, record("b", "y"));
    store.upsert("c", RecordKind.NODE, record("c", "y"));

    List<Map<String, Object>> ys =
        store.list("c", RecordKind.NODE, RecordFilter.where("type", "y"), 1);
    assertEquals(1, ys.size());
    assertEquals("b", ys.get(0).get("id"));
  }

  @Test
  @DisplayName("delete and deleteAll report what they removed")
  void deleteReports() {
    store.upsert("c", RecordKind.EDGE, record("e1", null));
    store.upsert("c", RecordKind.EDGE, record("e2", null));

    assertTrue(store.delete("c", RecordKind.EDGE, "e1"));
    assertFalse(store.delete("c", RecordKind.EDGE, "e1"));
    assertEquals(1, store.deleteAll("c", RecordKind.EDGE));
    assertEquals(0, store.deleteAll("c", RecordKind.EDGE));
  }

  @Test
  @DisplayName("upsert rejects records without an id")
  void upsertRequiresId() {
    Map<String, Object> r = new HashMap<>();
    r.put("name", "no id");
    assertThrows(ValidationException.class, () -> store.upsert("c", RecordKind.NODE, r));
  }

  @Test
  @DisplayName("lifecycle flags follow initialize and shutdown")
  void lifecycle() {
    assertTrue(store.isInitialized());
    assertEquals("in-memory", store.getDriverName());
    store.close();
    assertFalse(store.isInitialized());
  }
}

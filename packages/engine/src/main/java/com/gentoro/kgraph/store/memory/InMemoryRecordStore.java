package com.gentoro.kgraph.store.memory;

import com.gentoro.kgraph.exception.ValidationException;
import com.gentoro.kgraph.store.RecordFilter;
import com.gentoro.kgraph.store.RecordKind;
import com.gentoro.kgraph.store.RecordStore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Key-sorted in-memory {@link RecordStore} for tests and default usage.
 *
 * <p>Records are copied on the way in and handed out as unmodifiable maps, so callers can never
 * mutate stored state. Each collection holds one sorted map per {@link RecordKind}.
 */
public class InMemoryRecordStore implements RecordStore {
  private static final org.slf4j.Logger log =
      com.gentoro.kgraph.logging.LoggingService.getLogger(InMemoryRecordStore.class);

  private final Map<String, Map<RecordKind, NavigableMap<String, Map<String, Object>>>>
      collections = new ConcurrentHashMap<>();
  private volatile boolean initialized = false;

  @Override
  public void initialize() {
    initialized = true;
  }

  @Override
  public boolean isInitialized() {
    return initialized;
  }

  @Override
  public Optional<Map<String, Object>> get(String collection, RecordKind kind, String id) {
    return Optional.ofNullable(table(collection, kind).get(id));
  }

  @Override
  public List<Map<String, Object>> list(
      String collection, RecordKind kind, RecordFilter filter, int limit) {
    RecordFilter effective = filter == null ? RecordFilter.all() : filter;
    List<Map<String, Object>> result = new ArrayList<>();
    for (Map<String, Object> record : table(collection, kind).values()) {
      if (!effective.matches(record)) continue;
      result.add(record);
      if (limit > 0 && result.size() >= limit) break;
    }
    return result;
  }

  @Override
  public void upsert(String collection, RecordKind kind, Map<String, Object> record) {
    Object id = record.get(ID_FIELD);
    if (id == null) {
      throw new ValidationException(ID_FIELD, "Record has no '" + ID_FIELD + "' field");
    }
    table(collection, kind)
        .put(id.toString(), Collections.unmodifiableMap(new LinkedHashMap<>(record)));
    log.trace("InMemoryRecordStore: upsert {}/{}/{}", collection, kind.label(), id);
  }

  @Override
  public boolean delete(String collection, RecordKind kind, String id) {
    boolean removed = table(collection, kind).remove(id) != null;
    log.trace("InMemoryRecordStore: delete {}/{}/{} -> {}", collection, kind.label(), id, removed);
    return removed;
  }

  @Override
  public int deleteAll(String collection, RecordKind kind) {
    NavigableMap<String, Map<String, Object>> table = table(collection, kind);
    int size = table.size();
    table.clear();
    return size;
  }

  @Override
  public long count(String collection, RecordKind kind) {
    return table(collection, kind).size();
  }

  @Override
  public String getDriverName() {
    return "in-memory";
  }

  @Override
  public void shutdown() {
    initialized = false;
    collections.clear();
  }

  private NavigableMap<String, Map<String, Object>> table(String collection, RecordKind kind) {
    return collections
        .computeIfAbsent(
            collection,
            c -> {
              Map<RecordKind, NavigableMap<String, Map<String, Object>>> kinds =
                  new EnumMap<>(RecordKind.class);
              for (RecordKind k : RecordKind.values()) kinds.put(k, new ConcurrentSkipListMap<>());
              return kinds;
            })
        .get(kind);
  }
}

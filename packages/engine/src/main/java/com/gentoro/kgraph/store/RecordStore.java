package com.gentoro.kgraph.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable keyed storage for node and edge records, grouped by collection.
 *
 * <p>A record is a flat map whose {@code "id"} entry is its key within {@code (collection, kind)}.
 * Implementations encapsulate how records are stored so the engine stays backend-agnostic; they
 * provide per-call atomicity only. Multi-record consistency (cascade delete, imports) is the
 * engine's job. Every backend failure must surface as {@link
 * com.gentoro.kgraph.exception.StoreException}.
 */
public interface RecordStore extends AutoCloseable {

  /** Record field holding the record key. */
  String ID_FIELD = "id";

  /** Initialize the store and any underlying connections/resources. */
  void initialize();

  /** @return true when the store is ready to accept operations. */
  boolean isInitialized();

  Optional<Map<String, Object>> get(String collection, RecordKind kind, String id);

  /**
   * List records matching {@code filter}, ordered by id.
   *
   * @param limit maximum number of records; {@code <= 0} means no limit
   */
  List<Map<String, Object>> list(
      String collection, RecordKind kind, RecordFilter filter, int limit);

  /** Insert or replace the record keyed by its {@code "id"} field. */
  void upsert(String collection, RecordKind kind, Map<String, Object> record);

  /** @return true when a record was removed. */
  boolean delete(String collection, RecordKind kind, String id);

  /** Remove every record of {@code kind} in the collection; returns the number removed. */
  default int deleteAll(String collection, RecordKind kind) {
    int removed = 0;
    for (Map<String, Object> record : list(collection, kind, RecordFilter.all(), 0)) {
      if (delete(collection, kind, String.valueOf(record.get(ID_FIELD)))) removed++;
    }
    return removed;
  }

  default long count(String collection, RecordKind kind) {
    return list(collection, kind, RecordFilter.all(), 0).size();
  }

  default boolean exists(String collection, RecordKind kind, String id) {
    return get(collection, kind, id).isPresent();
  }

  /** Logical backend/driver name. */
  String getDriverName();

  /** Shut down the store and release resources. */
  void shutdown();

  @Override
  default void close() {
    shutdown();
  }
}

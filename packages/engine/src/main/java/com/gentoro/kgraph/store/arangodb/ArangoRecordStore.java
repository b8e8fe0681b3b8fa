package com.gentoro.kgraph.store.arangodb;

import com.arangodb.ArangoDB;
import com.arangodb.ArangoDBException;
import com.arangodb.ArangoDatabase;
import com.arangodb.entity.CollectionType;
import com.arangodb.model.AqlQueryOptions;
import com.arangodb.model.CollectionCreateOptions;
import com.arangodb.model.PersistentIndexOptions;
import com.gentoro.kgraph.exception.StoreException;
import com.gentoro.kgraph.exception.ValidationException;
import com.gentoro.kgraph.store.RecordFilter;
import com.gentoro.kgraph.store.RecordKind;
import com.gentoro.kgraph.store.RecordStore;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.apache.commons.configuration2.Configuration;

/**
 * ArangoDB implementation of {@link RecordStore}.
 *
 * <p>All collections share one database with two document collections, {@code kg_nodes} and
 * {@code kg_edges}. Each document carries its owning collection in {@code kg_collection}; a unique
 * persistent index on {@code [kg_collection, id]} keys the records, so ids never need to be
 * rewritten into ArangoDB-compliant {@code _key} values.
 */
public class ArangoRecordStore implements RecordStore {
  private static final org.slf4j.Logger log =
      com.gentoro.kgraph.logging.LoggingService.getLogger(ArangoRecordStore.class);

  public static final String CONFIG_PREFIX = "kgraph.store.arangodb.";
  static final String COLLECTION_FIELD = "kg_collection";

  private final String host;
  private final int port;
  private final String user;
  private final String password;
  private final String databaseName;
  private final Supplier<ArangoDB> clientFactory;
  private final AtomicBoolean initialized = new AtomicBoolean(false);

  private ArangoDB arango;
  private ArangoDatabase db;

  public ArangoRecordStore(Configuration configuration) {
    this(configuration, null);
  }

  /** {@code clientFactory} replaces the driver's builder; {@code null} uses the builder. */
  ArangoRecordStore(Configuration configuration, Supplier<ArangoDB> clientFactory) {
    this.host = configuration.getString(CONFIG_PREFIX + "host", "localhost");
    this.port = configuration.getInt(CONFIG_PREFIX + "port", 8529);
    this.user = configuration.getString(CONFIG_PREFIX + "user", "root");
    this.password = configuration.getString(CONFIG_PREFIX + "password", "");
    this.databaseName = configuration.getString(CONFIG_PREFIX + "database", "kgraph");
    this.clientFactory = clientFactory != null ? clientFactory : this::newClient;
  }

  private ArangoDB newClient() {
    return new ArangoDB.Builder().host(host, port).user(user).password(password).build();
  }

  @Override
  public synchronized void initialize() {
    if (initialized.get()) return;
    try {
      arango = clientFactory.get();
      if (!arango.getDatabases().contains(databaseName)) {
        arango.createDatabase(databaseName);
      }
      db = arango.db(databaseName);
      for (RecordKind kind : RecordKind.values()) {
        createCollectionIfNeeded(kind.storageName());
      }
    } catch (ArangoDBException e) {
      releaseClient();
      throw new StoreException(
          "Failed to initialize ArangoDB store at %s:%d/%s".formatted(host, port, databaseName), e);
    } catch (RuntimeException e) {
      releaseClient();
      throw e;
    }
    initialized.set(true);
    log.info("ArangoRecordStore initialized database '{}' at {}:{}", databaseName, host, port);
  }

  private void createCollectionIfNeeded(String name) {
    if (!db.collection(name).exists()) {
      db.createCollection(name, new CollectionCreateOptions().type(CollectionType.DOCUMENT));
      log.debug("Created ArangoDB collection '{}'", name);
    }
    db.collection(name)
        .ensurePersistentIndex(
            List.of(COLLECTION_FIELD, ID_FIELD), new PersistentIndexOptions().unique(true));
  }

  @Override
  public boolean isInitialized() {
    return initialized.get();
  }

  @Override
  public Optional<Map<String, Object>> get(String collection, RecordKind kind, String id) {
    String aql =
        "FOR d IN "
            + kind.storageName()
            + " FILTER d."
            + COLLECTION_FIELD
            + " == @collection AND d.id == @id LIMIT 1"
            + " RETURN UNSET(d, '_key', '_id', '_rev', '"
            + COLLECTION_FIELD
            + "')";
    List<Map<String, Object>> rows =
        run(collection, "get", () -> query(aql, Map.of("collection", collection, "id", id)));
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public List<Map<String, Object>> list(
      String collection, RecordKind kind, RecordFilter filter, int limit) {
    Map<String, Object> bind = new HashMap<>();
    bind.put("collection", collection);
    StringBuilder aql =
        new StringBuilder("FOR d IN ")
            .append(kind.storageName())
            .append(" FILTER d.")
            .append(COLLECTION_FIELD)
            .append(" == @collection");
    if (filter != null) {
      int clauseIndex = 0;
      for (RecordFilter.Clause clause : filter.clauses()) {
        aql.append(" AND (").append(toAql(clause, clauseIndex++, bind)).append(")");
      }
    }
    aql.append(" SORT d.id");
    if (limit > 0) {
      aql.append(" LIMIT @limit");
      bind.put("limit", limit);
    }
    aql.append(" RETURN UNSET(d, '_key', '_id', '_rev', '").append(COLLECTION_FIELD).append("')");
    return run(collection, "list", () -> query(aql.toString(), bind));
  }

  private static String toAql(
      RecordFilter.Clause clause, int clauseIndex, Map<String, Object> bind) {
    String valueParam = "v" + clauseIndex;
    bind.put(valueParam, clause.value());
    List<String> parts = new ArrayList<>();
    int fieldIndex = 0;
    for (String field : clause.fields()) {
      String fieldParam = "f" + clauseIndex + "_" + fieldIndex++;
      bind.put(fieldParam, field);
      if (clause.operator() == RecordFilter.Operator.EQUALS) {
        parts.add("d.@" + fieldParam + " == @" + valueParam);
      } else {
        parts.add(
            "CONTAINS(LOWER(IS_STRING(d.@"
                + fieldParam
                + ") ? d.@"
                + fieldParam
                + " : JSON_STRINGIFY(d.@"
                + fieldParam
                + ")), @"
                + valueParam
                + ")");
      }
    }
    return String.join(" OR ", parts);
  }

  @Override
  public void upsert(String collection, RecordKind kind, Map<String, Object> record) {
    Object id = record.get(ID_FIELD);
    if (id == null) {
      throw new ValidationException(ID_FIELD, "Record has no '" + ID_FIELD + "' field");
    }
    Map<String, Object> doc = new LinkedHashMap<>(record);
    doc.put(COLLECTION_FIELD, collection);
    String aql =
        "UPSERT { "
            + COLLECTION_FIELD
            + ": @collection, id: @id } INSERT @doc REPLACE @doc IN "
            + kind.storageName();
    run(
        collection,
        "upsert",
        () -> query(aql, Map.of("collection", collection, "id", id.toString(), "doc", doc)));
  }

  @Override
  public boolean delete(String collection, RecordKind kind, String id) {
    String aql =
        "FOR d IN "
            + kind.storageName()
            + " FILTER d."
            + COLLECTION_FIELD
            + " == @collection AND d.id == @id REMOVE d IN "
            + kind.storageName()
            + " RETURN 1";
    return !run(collection, "delete", () -> query(aql, Map.of("collection", collection, "id", id)))
        .isEmpty();
  }

  @Override
  public int deleteAll(String collection, RecordKind kind) {
    String aql =
        "FOR d IN "
            + kind.storageName()
            + " FILTER d."
            + COLLECTION_FIELD
            + " == @collection REMOVE d IN "
            + kind.storageName()
            + " RETURN 1";
    return run(collection, "deleteAll", () -> query(aql, Map.of("collection", collection))).size();
  }

  @Override
  public long count(String collection, RecordKind kind) {
    String aql =
        "RETURN LENGTH(FOR d IN "
            + kind.storageName()
            + " FILTER d."
            + COLLECTION_FIELD
            + " == @collection RETURN 1)";
    List<Long> rows =
        run(
            collection,
            "count",
            () ->
                db.query(aql, Long.class, Map.of("collection", collection), new AqlQueryOptions())
                    .asListRemaining());
    return rows.isEmpty() || rows.get(0) == null ? 0L : rows.get(0).longValue();
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private List<Map<String, Object>> query(String aql, Map<String, Object> bind) {
    List<Map> raw = db.query(aql, Map.class, bind, new AqlQueryOptions()).asListRemaining();
    List<Map<String, Object>> rows = new ArrayList<>(raw.size());
    for (Map m : raw) rows.add(new LinkedHashMap<>((Map<String, Object>) m));
    return rows;
  }

  private <T> T run(String collection, String operation, Supplier<T> action) {
    if (!initialized.get()) {
      throw new StoreException("ArangoRecordStore used before initialize()");
    }
    try {
      return action.get();
    } catch (ArangoDBException e) {
      log.warn("Arango {} on collection '{}' failed: {}", operation, collection, e.getMessage());
      throw new StoreException(collection, operation, e);
    }
  }

  @Override
  public String getDriverName() {
    return "arangodb";
  }

  @Override
  public synchronized void shutdown() {
    initialized.set(false);
    releaseClient();
  }

  private void releaseClient() {
    if (arango != null) {
      try {
        arango.shutdown();
      } catch (ArangoDBException e) {
        log.warn("ArangoDB shutdown failed: {}", e.getMessage());
      }
    }
    arango = null;
    db = null;
  }
}

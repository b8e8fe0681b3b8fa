package com.gentoro.kgraph.store.arangodb;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.arangodb.ArangoDB;
import com.arangodb.ArangoDBException;
import com.gentoro.kgraph.exception.KnowledgeGraphErrorCode;
import com.gentoro.kgraph.exception.StoreException;
import com.gentoro.kgraph.store.RecordFilter;
import com.gentoro.kgraph.store.RecordKind;
import com.gentoro.kgraph.store.providers.ArangoRecordStoreProvider;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ArangoRecordStoreTest {

  @Mock private Configuration configuration;

  @BeforeEach
  void setUp() {
    lenient()
        .when(configuration.getString("kgraph.store.arangodb.host", "localhost"))
        .thenReturn("localhost");
    lenient().when(configuration.getInt("kgraph.store.arangodb.port", 8529)).thenReturn(8529);
    lenient()
        .when(configuration.getString("kgraph.store.arangodb.user", "root"))
        .thenReturn("root");
    lenient().when(configuration.getString("kgraph.store.arangodb.password", "")).thenReturn("");
    lenient()
        .when(configuration.getString("kgraph.store.arangodb.database", "kgraph"))
        .thenReturn("kgraph");
  }

  @Test
  @DisplayName("constructor reads connection settings with documented defaults")
  void readsConfiguration() {
    ArangoRecordStore store = new ArangoRecordStore(configuration);

    verify(configuration).getString("kgraph.store.arangodb.host", "localhost");
    verify(configuration).getInt("kgraph.store.arangodb.port", 8529);
    verify(configuration).getString("kgraph.store.arangodb.database", "kgraph");
    assertEquals("arangodb", store.getDriverName());
    assertFalse(store.isInitialized());
  }

  @Test
  @DisplayName("operations before initialize fail with a store error")
  void usedBeforeInitialize() {
    ArangoRecordStore store = new ArangoRecordStore(configuration);

    StoreException ex =
        assertThrows(StoreException.class, () -> store.get("kg", RecordKind.NODE, "p1"));
    assertEquals(KnowledgeGraphErrorCode.STORE_ERROR, ex.getCode());
    assertThrows(
        StoreException.class, () -> store.list("kg", RecordKind.EDGE, RecordFilter.all(), 10));
    assertThrows(
        StoreException.class,
        () -> store.upsert("kg", RecordKind.NODE, Map.of("id", "p1", "name", "Alice")));
  }

  @Test
  @DisplayName("shutdown without initialize is a no-op")
  void shutdownWithoutInitialize() {
    ArangoRecordStore store = new ArangoRecordStore(configuration);
    assertDoesNotThrow(store::shutdown);
  }

  @Test
  @DisplayName("a failed initialize shuts the freshly built client down")
  void failedInitializeReleasesClient() {
    ArangoDB client = mock(ArangoDB.class);
    when(client.getDatabases()).thenThrow(new ArangoDBException("connection refused"));
    ArangoRecordStore store = new ArangoRecordStore(configuration, () -> client);

    StoreException ex = assertThrows(StoreException.class, store::initialize);

    assertEquals(KnowledgeGraphErrorCode.STORE_ERROR, ex.getCode());
    verify(client).shutdown();
    assertFalse(store.isInitialized());
  }

  @Test
  @DisplayName("provider is available when selected or when a host is configured")
  void providerAvailability() {
    ArangoRecordStoreProvider provider = new ArangoRecordStoreProvider();
    BaseConfiguration cfg = new BaseConfiguration();
    assertFalse(provider.isAvailable(cfg));

    cfg.setProperty("kgraph.store.driver", "arangodb");
    assertTrue(provider.isAvailable(cfg));

    BaseConfiguration withHost = new BaseConfiguration();
    withHost.setProperty("kgraph.store.arangodb.host", "db.internal");
    assertTrue(provider.isAvailable(withHost));
    assertTrue(provider.create(withHost) instanceof ArangoRecordStore);
  }
}

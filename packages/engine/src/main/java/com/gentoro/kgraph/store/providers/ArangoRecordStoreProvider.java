package com.gentoro.kgraph.store.providers;

import com.gentoro.kgraph.store.RecordStore;
import com.gentoro.kgraph.store.arangodb.ArangoRecordStore;
import com.gentoro.kgraph.store.spi.RecordStoreProvider;
import org.apache.commons.configuration2.Configuration;

/** Service provider for the ArangoDB-based record store. */
public class ArangoRecordStoreProvider implements RecordStoreProvider {
  public static final String ID = "arangodb";

  @Override
  public String id() {
    return ID;
  }

  @Override
  public boolean isAvailable(Configuration configuration) {
    // Available if explicitly selected or an Arango host is configured
    String desired = configuration.getString("kgraph.store.driver", InMemoryRecordStoreProvider.ID);
    if (ID.equalsIgnoreCase(desired)) return true;
    return configuration.getString(ArangoRecordStore.CONFIG_PREFIX + "host", null) != null;
  }

  @Override
  public RecordStore create(Configuration configuration) {
    return new ArangoRecordStore(configuration);
  }
}

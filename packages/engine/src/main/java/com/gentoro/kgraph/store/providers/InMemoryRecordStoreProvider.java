package com.gentoro.kgraph.store.providers;

import com.gentoro.kgraph.store.RecordStore;
import com.gentoro.kgraph.store.memory.InMemoryRecordStore;
import com.gentoro.kgraph.store.spi.RecordStoreProvider;
import org.apache.commons.configuration2.Configuration;

/** Service provider for the in-memory record store. Always available. */
public class InMemoryRecordStoreProvider implements RecordStoreProvider {
  public static final String ID = "in-memory";

  @Override
  public String id() {
    return ID;
  }

  @Override
  public RecordStore create(Configuration configuration) {
    return new InMemoryRecordStore();
  }
}

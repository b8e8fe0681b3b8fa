package com.gentoro.kgraph;

import com.gentoro.kgraph.exception.ConfigException;
import com.gentoro.kgraph.logging.LoggingService;
import com.gentoro.kgraph.store.RecordStore;
import com.gentoro.kgraph.store.providers.InMemoryRecordStoreProvider;
import com.gentoro.kgraph.store.spi.RecordStoreProvider;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/** Builds {@link KnowledgeGraphService}s from configuration. */
public final class KnowledgeGraphFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.kgraph.logging.LoggingService.getLogger(KnowledgeGraphFactory.class);

  private KnowledgeGraphFactory() {}

  /** Service configured from {@code classpath:application.yaml}. */
  public static KnowledgeGraphService create() {
    return create(new ConfigurationProvider().config());
  }

  public static KnowledgeGraphService create(Configuration configuration) {
    LoggingService.applyConfiguration(configuration);
    KnowledgeGraphSettings settings = KnowledgeGraphSettings.fromConfiguration(configuration);
    RecordStore store = resolveStore(configuration, settings.getStoreDriver());
    KnowledgeGraphService service = new KnowledgeGraphService(store, settings);
    service.initialize();
    log.info("Knowledge graph service ready on '{}' store", store.getDriverName());
    return service;
  }

  /**
   * Store of the provider registered under {@code desired}; falls back to the in-memory provider
   * when that one is missing or unavailable.
   */
  static RecordStore resolveStore(Configuration configuration, String desired) {
    return resolveStore(configuration, desired, ServiceLoader.load(RecordStoreProvider.class));
  }

  static RecordStore resolveStore(
      Configuration configuration, String desired, Iterable<RecordStoreProvider> providers) {
    log.trace("Resolving record store (desired '{}')", desired);
    RecordStoreProvider fallback = null;
    for (RecordStoreProvider p : providers) {
      if (p.id().equalsIgnoreCase(desired) && p.isAvailable(configuration)) {
        return p.create(configuration);
      }
      if (p.id().equalsIgnoreCase(InMemoryRecordStoreProvider.ID)) fallback = p;
    }
    if (fallback == null) {
      throw new ConfigException(
          "No record store provider for '%s' and no in-memory fallback registered"
              .formatted(desired));
    }
    log.warn("Record store '{}' is not available, falling back to in-memory", desired);
    return fallback.create(configuration);
  }
}

package com.gentoro.kgraph.store.spi;

import com.gentoro.kgraph.store.RecordStore;
import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for pluggable {@link RecordStore} backends.
 *
 * <p>Implementations must register using ServiceLoader by adding their fully qualified class name
 * to: META-INF/services/com.gentoro.kgraph.store.spi.RecordStoreProvider
 */
public interface RecordStoreProvider {
  /** Unique driver id used in configuration, e.g., "in-memory", "arangodb". */
  String id();

  /**
   * Whether the provider can operate in the current runtime (e.g., dependencies present, enabled).
   */
  default boolean isAvailable(Configuration configuration) {
    return true;
  }

  /** Create a new, not yet initialized, store bound to this configuration. */
  RecordStore create(Configuration configuration);
}

package com.gentoro.kgraph;

import com.gentoro.kgraph.exception.ConfigException;
import com.gentoro.kgraph.store.providers.InMemoryRecordStoreProvider;
import java.util.Locale;
import org.apache.commons.configuration2.Configuration;

/**
 * Engine tunables read from the {@code kgraph.*} configuration block.
 *
 * <p>Instances are immutable; the {@code with*} methods return adjusted copies, which is mostly
 * useful in tests.
 */
public final class KnowledgeGraphSettings {
  public static final String KEY_STORE_DRIVER = "kgraph.store.driver";
  public static final String KEY_CACHE_ENABLED = "kgraph.cache.enabled";
  public static final String KEY_MAX_PATH_LENGTH = "kgraph.traversal.maxPathLength";
  public static final String KEY_MAX_PATHS = "kgraph.traversal.maxPaths";
  public static final String KEY_TIE_BREAK = "kgraph.search.tieBreak";
  public static final String KEY_CONTEXT_MAX_CHARS = "kgraph.context.maxChars";
  public static final String KEY_CONTEXT_EDGES_PER_NODE = "kgraph.context.edgesPerNode";

  /** How equally ranked search hits are ordered. */
  public enum TieBreak {
    /** By node id. */
    NODE_ID,
    /** By name, then node id. */
    NAME;

    static TieBreak parse(String value) {
      String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
      return switch (v) {
        case "", "node_id", "id" -> NODE_ID;
        case "name" -> NAME;
        default -> throw new ConfigException(
            "Unsupported %s '%s', expected node_id or name".formatted(KEY_TIE_BREAK, value));
      };
    }
  }

  private final String storeDriver;
  private final boolean cacheEnabled;
  private final int maxPathLength;
  private final int maxPaths;
  private final TieBreak tieBreak;
  private final int contextMaxChars;
  private final int contextEdgesPerNode;

  private KnowledgeGraphSettings(
      String storeDriver,
      boolean cacheEnabled,
      int maxPathLength,
      int maxPaths,
      TieBreak tieBreak,
      int contextMaxChars,
      int contextEdgesPerNode) {
    this.storeDriver = storeDriver;
    this.cacheEnabled = cacheEnabled;
    this.maxPathLength = positive(KEY_MAX_PATH_LENGTH, maxPathLength);
    this.maxPaths = positive(KEY_MAX_PATHS, maxPaths);
    this.tieBreak = tieBreak;
    this.contextMaxChars = positive(KEY_CONTEXT_MAX_CHARS, contextMaxChars);
    this.contextEdgesPerNode = positive(KEY_CONTEXT_EDGES_PER_NODE, contextEdgesPerNode);
  }

  public static KnowledgeGraphSettings defaults() {
    return new KnowledgeGraphSettings(
        InMemoryRecordStoreProvider.ID, true, 10, 100, TieBreak.NODE_ID, 4000, 20);
  }

  public static KnowledgeGraphSettings fromConfiguration(Configuration cfg) {
    KnowledgeGraphSettings d = defaults();
    try {
      return new KnowledgeGraphSettings(
          cfg.getString(KEY_STORE_DRIVER, d.storeDriver),
          cfg.getBoolean(KEY_CACHE_ENABLED, d.cacheEnabled),
          cfg.getInt(KEY_MAX_PATH_LENGTH, d.maxPathLength),
          cfg.getInt(KEY_MAX_PATHS, d.maxPaths),
          TieBreak.parse(cfg.getString(KEY_TIE_BREAK, "node_id")),
          cfg.getInt(KEY_CONTEXT_MAX_CHARS, d.contextMaxChars),
          cfg.getInt(KEY_CONTEXT_EDGES_PER_NODE, d.contextEdgesPerNode));
    } catch (org.apache.commons.configuration2.ex.ConversionException e) {
      throw new ConfigException("Invalid kgraph configuration value: " + e.getMessage(), e);
    }
  }

  private static int positive(String key, int value) {
    if (value < 1) {
      throw new ConfigException("%s must be >= 1, got %d".formatted(key, value));
    }
    return value;
  }

  public String getStoreDriver() {
    return storeDriver;
  }

  public boolean isCacheEnabled() {
    return cacheEnabled;
  }

  public int getMaxPathLength() {
    return maxPathLength;
  }

  public int getMaxPaths() {
    return maxPaths;
  }

  public TieBreak getTieBreak() {
    return tieBreak;
  }

  public int getContextMaxChars() {
    return contextMaxChars;
  }

  public int getContextEdgesPerNode() {
    return contextEdgesPerNode;
  }

  public KnowledgeGraphSettings withCacheEnabled(boolean enabled) {
    return new KnowledgeGraphSettings(
        storeDriver, enabled, maxPathLength, maxPaths, tieBreak, contextMaxChars,
        contextEdgesPerNode);
  }

  public KnowledgeGraphSettings withMaxPaths(int paths) {
    return new KnowledgeGraphSettings(
        storeDriver, cacheEnabled, maxPathLength, paths, tieBreak, contextMaxChars,
        contextEdgesPerNode);
  }

  public KnowledgeGraphSettings withTieBreak(TieBreak order) {
    return new KnowledgeGraphSettings(
        storeDriver, cacheEnabled, maxPathLength, maxPaths, order, contextMaxChars,
        contextEdgesPerNode);
  }

  public KnowledgeGraphSettings withContextMaxChars(int chars) {
    return new KnowledgeGraphSettings(
        storeDriver, cacheEnabled, maxPathLength, maxPaths, tieBreak, chars,
        contextEdgesPerNode);
  }

  @Override
  public String toString() {
    return "KnowledgeGraphSettings{driver="
        + storeDriver
        + ", cache="
        + cacheEnabled
        + ", maxPathLength="
        + maxPathLength
        + ", maxPaths="
        + maxPaths
        + ", tieBreak="
        + tieBreak
        + ", contextMaxChars="
        + contextMaxChars
        + ", edgesPerNode="
        + contextEdgesPerNode
        + '}';
  }
}

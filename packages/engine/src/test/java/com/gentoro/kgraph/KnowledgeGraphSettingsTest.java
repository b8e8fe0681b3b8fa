package com.gentoro.kgraph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kgraph.KnowledgeGraphSettings.TieBreak;
import com.gentoro.kgraph.exception.ConfigException;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class KnowledgeGraphSettingsTest {

  @Test
  @DisplayName("missing keys take the defaults")
  void defaults() {
    KnowledgeGraphSettings settings =
        KnowledgeGraphSettings.fromConfiguration(new BaseConfiguration());

    assertEquals("in-memory", settings.getStoreDriver());
    assertTrue(settings.isCacheEnabled());
    assertEquals(10, settings.getMaxPathLength());
    assertEquals(100, settings.getMaxPaths());
    assertEquals(TieBreak.NODE_ID, settings.getTieBreak());
    assertEquals(4000, settings.getContextMaxChars());
    assertEquals(20, settings.getContextEdgesPerNode());
  }

  @Test
  @DisplayName("configured values override the defaults")
  void overrides() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty(KnowledgeGraphSettings.KEY_CACHE_ENABLED, "false");
    cfg.setProperty(KnowledgeGraphSettings.KEY_MAX_PATH_LENGTH, "3");
    cfg.setProperty(KnowledgeGraphSettings.KEY_TIE_BREAK, "Name");
    cfg.setProperty(KnowledgeGraphSettings.KEY_CONTEXT_MAX_CHARS, 500);

    KnowledgeGraphSettings settings = KnowledgeGraphSettings.fromConfiguration(cfg);

    assertFalse(settings.isCacheEnabled());
    assertEquals(3, settings.getMaxPathLength());
    assertEquals(TieBreak.NAME, settings.getTieBreak());
    assertEquals(500, settings.getContextMaxChars());
  }

  @Test
  @DisplayName("invalid values are configuration errors")
  void invalid() {
    BaseConfiguration badTieBreak = new BaseConfiguration();
    badTieBreak.setProperty(KnowledgeGraphSettings.KEY_TIE_BREAK, "random");
    BaseConfiguration zeroLength = new BaseConfiguration();
    zeroLength.setProperty(KnowledgeGraphSettings.KEY_MAX_PATH_LENGTH, 0);
    BaseConfiguration notANumber = new BaseConfiguration();
    notANumber.setProperty(KnowledgeGraphSettings.KEY_MAX_PATHS, "many");

    assertThrows(
        ConfigException.class, () -> KnowledgeGraphSettings.fromConfiguration(badTieBreak));
    assertThrows(ConfigException.class, () -> KnowledgeGraphSettings.fromConfiguration(zeroLength));
    assertThrows(ConfigException.class, () -> KnowledgeGraphSettings.fromConfiguration(notANumber));
  }

  @Test
  @DisplayName("with-methods copy the settings with one value changed")
  void withers() {
    KnowledgeGraphSettings base = KnowledgeGraphSettings.defaults();
    KnowledgeGraphSettings changed = base.withMaxPaths(5).withCacheEnabled(false);

    assertEquals(5, changed.getMaxPaths());
    assertFalse(changed.isCacheEnabled());
    assertEquals(100, base.getMaxPaths());
    assertThrows(ConfigException.class, () -> base.withContextMaxChars(0));
  }
}

package com.gentoro.kgraph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kgraph.exception.ConfigException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @Test
  @DisplayName("the default location is the bundled application.yaml")
  void defaultLocation() {
    Configuration cfg = new ConfigurationProvider().config();

    assertEquals("in-memory", cfg.getString(KnowledgeGraphSettings.KEY_STORE_DRIVER));
    assertEquals(8529, cfg.getInt("kgraph.store.arangodb.port"));
    assertEquals(100, cfg.getInt(KnowledgeGraphSettings.KEY_MAX_PATHS));
  }

  @Test
  @DisplayName("a missing classpath resource gives an empty configuration")
  void missingClasspathResource() {
    Configuration cfg = new ConfigurationProvider("classpath:does-not-exist.yaml").config();
    assertTrue(cfg.isEmpty());
  }

  @Test
  @DisplayName("files are read from plain paths and file: URIs")
  void fileLocations(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("kgraph.yaml");
    Files.writeString(
        file,
        "kgraph:\n  search:\n    tieBreak: name\n  traversal:\n    maxPathLength: 4\n",
        StandardCharsets.UTF_8);

    Configuration byPath = new ConfigurationProvider(file.toString()).config();
    Configuration byUri = new ConfigurationProvider(file.toUri().toString()).config();

    assertEquals("name", byPath.getString(KnowledgeGraphSettings.KEY_TIE_BREAK));
    assertEquals(4, byUri.getInt(KnowledgeGraphSettings.KEY_MAX_PATH_LENGTH));
    assertEquals(
        KnowledgeGraphSettings.TieBreak.NAME,
        KnowledgeGraphSettings.fromConfiguration(byPath).getTieBreak());
  }

  @Test
  @DisplayName("a missing file is a configuration error")
  void missingFile(@TempDir Path dir) {
    String location = dir.resolve("nope.yaml").toString();
    assertThrows(ConfigException.class, () -> new ConfigurationProvider(location));
  }
}

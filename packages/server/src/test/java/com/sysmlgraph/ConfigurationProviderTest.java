package com.sysmlgraph;

import static org.junit.jupiter.api.Assertions.*;

import com.sysmlgraph.exception.ConfigException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path tempDir;

  @Test
  void testLoadFromClasspath() {
    Configuration cfg = new ConfigurationProvider("classpath:test-application.yaml").config();

    assertEquals("in-memory", cfg.getString("graph.driver"));
    assertEquals("test-graph", cfg.getString("graph.name"));
    assertTrue(cfg.getBoolean("model.kinds.strict"));
    assertFalse(cfg.getBoolean("model.timestamps.enabled"));
  }

  @Test
  void testBlankLocationUsesDefaultResource() {
    Configuration cfg = new ConfigurationProvider(" ").config();

    assertEquals("sysml", cfg.getString("graph.name"));
  }

  @Test
  void testMissingClasspathResourceGivesEmptyConfiguration() {
    Configuration cfg = new ConfigurationProvider("classpath:does-not-exist.yaml").config();

    assertTrue(cfg.isEmpty());
    assertEquals("fallback", cfg.getString("graph.name", "fallback"));
  }

  @Test
  void testLoadFromFileAndFileUri() throws Exception {
    Path yaml = tempDir.resolve("custom.yaml");
    Files.writeString(yaml, "graph:\n  name: from-file\n", StandardCharsets.UTF_8);

    assertEquals(
        "from-file", new ConfigurationProvider(yaml.toString()).config().getString("graph.name"));
    assertEquals(
        "from-file",
        new ConfigurationProvider(yaml.toUri().toString()).config().getString("graph.name"));
  }

  @Test
  void testMissingFileFails() {
    String location = tempDir.resolve("missing.yaml").toString();

    assertThrows(ConfigException.class, () -> new ConfigurationProvider(location));
  }

  @Test
  void testEnvLookupFallsBackToDotenvFile() throws Exception {
    Path env = tempDir.resolve(".env.local");
    Files.writeString(
        env,
        "# comment\nSYSML_GRAPH_TEST_ONLY_KEY=\"quoted value\"\nNO_EQUALS\n",
        StandardCharsets.UTF_8);
    ConfigurationProvider.FallbackEnvLookup lookup =
        new ConfigurationProvider.FallbackEnvLookup(env);

    assertEquals("quoted value", lookup.lookup("SYSML_GRAPH_TEST_ONLY_KEY"));
    assertNull(lookup.lookup("SYSML_GRAPH_TEST_UNDEFINED_KEY"));
  }

  @Test
  void testParseLine() {
    assertEquals(Map.entry("A", "b c"), ConfigurationProvider.FallbackEnvLookup.parseLine("A = 'b c'"));
    assertEquals(Map.entry("K", "v=1"), ConfigurationProvider.FallbackEnvLookup.parseLine("K=v=1"));
    assertEquals(Map.entry("", ""), ConfigurationProvider.FallbackEnvLookup.parseLine("=x"));
  }
}

package com.gentoro.geocontext;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.geocontext.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @Test
  void loadsClasspathResource() {
    Configuration config = new ConfigurationProvider("classpath:geocontext-test.yaml").config();

    assertEquals("test", config.getString("geocontext.project"));
    assertEquals(2, config.getInt("geocontext.synchronizer.batchSize"));
    assertEquals(
        List.of("building", "floor"), config.getList(String.class, "geocontext.layout.keys"));
  }

  @Test
  void blankLocationUsesBundledDefaults() {
    Configuration config = new ConfigurationProvider("  ").config();

    assertEquals("BIMObjectContext", config.getString("geocontext.referenceContext"));
    assertEquals(300, config.getInt("geocontext.synchronizer.batchSize"));
    assertEquals("in-memory", config.getString("geocontext.store.driver"));
  }

  @Test
  void loadsFileLocationAndFileUri(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("custom.yaml");
    Files.writeString(file, "geocontext:\n  referenceContext: SiteObjects\n");

    assertEquals(
        "SiteObjects",
        new ConfigurationProvider(file.toString())
            .config()
            .getString("geocontext.referenceContext"));
    assertEquals(
        "SiteObjects",
        new ConfigurationProvider(file.toUri().toString())
            .config()
            .getString("geocontext.referenceContext"));
  }

  @Test
  void missingFileIsAConfigError(@TempDir Path dir) {
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(dir.resolve("absent.yaml").toString()));
  }

  @Test
  void missingClasspathResourceYieldsEmptyConfiguration() {
    Configuration config = new ConfigurationProvider("classpath:does-not-exist.yaml").config();

    assertTrue(config.isEmpty());
  }
}

package com.gentoro.geocontext.dataset;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.geocontext.exception.SerializationException;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonItemCatalogTest {

  @Test
  void loadsItemsFromJson() throws Exception {
    try (InputStream in = getClass().getClassLoader().getResourceAsStream("catalog.json")) {
      JsonItemCatalog catalog = JsonItemCatalog.load(in);

      assertEquals(4, catalog.size());
      ExternalItem chair = catalog.find(1).orElseThrow();
      assertEquals("Chair", chair.name());
      assertEquals("F1", chair.attribute("floor"));
      assertNull(catalog.find(3).orElseThrow().attribute("floor"));
      assertTrue(catalog.find(42).isEmpty());
    }
  }

  @Test
  void loadsYamlFileByExtension(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("items.yaml");
    Files.writeString(
        file,
        """
        - externalId: 10
          name: Sink
          attributes:
            building: B3
            floor: F2
        """);

    JsonItemCatalog catalog = JsonItemCatalog.load(file);

    assertEquals(1, catalog.size());
    assertEquals("B3", catalog.items().get(0).attribute("building"));
  }

  @Test
  void malformedInputIsASerializationError() {
    InputStream in = new ByteArrayInputStream("{ not a list".getBytes(StandardCharsets.UTF_8));

    assertThrows(SerializationException.class, () -> JsonItemCatalog.load(in));
  }

  @Test
  void missingFileIsASerializationError(@TempDir Path dir) {
    assertThrows(
        SerializationException.class, () -> JsonItemCatalog.load(dir.resolve("absent.json")));
  }
}

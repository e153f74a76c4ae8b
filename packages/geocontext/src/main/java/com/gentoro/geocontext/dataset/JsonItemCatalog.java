package com.gentoro.geocontext.dataset;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gentoro.geocontext.exception.SerializationException;
import com.gentoro.geocontext.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Item catalog loaded from a JSON (or YAML) array of {@link ExternalItem}s:
 *
 * <pre>
 * [ { "externalId": 1, "name": "Chair", "attributes": { "building": "B1", "floor": "F1" } } ]
 * </pre>
 */
public class JsonItemCatalog implements ItemCatalog {
  private static final TypeReference<List<ExternalItem>> ITEMS = new TypeReference<>() {};

  private final Map<Long, ExternalItem> items;

  public JsonItemCatalog(Collection<ExternalItem> items) {
    Map<Long, ExternalItem> byId = new LinkedHashMap<>();
    for (ExternalItem item : items) {
      byId.put(item.externalId(), item);
    }
    this.items = byId;
  }

  public static JsonItemCatalog load(Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      return new JsonItemCatalog(JacksonUtility.mapperFor(path).readValue(in, ITEMS));
    } catch (IOException e) {
      throw new SerializationException("Failed to read item catalog from " + path, e);
    }
  }

  public static JsonItemCatalog load(InputStream json) {
    try {
      return new JsonItemCatalog(JacksonUtility.getJsonMapper().readValue(json, ITEMS));
    } catch (IOException e) {
      throw new SerializationException("Failed to read item catalog", e);
    }
  }

  @Override
  public Optional<ExternalItem> find(long externalId) {
    return Optional.ofNullable(items.get(externalId));
  }

  /** All items in file order. */
  public List<ExternalItem> items() {
    return List.copyOf(items.values());
  }

  public int size() {
    return items.size();
  }
}

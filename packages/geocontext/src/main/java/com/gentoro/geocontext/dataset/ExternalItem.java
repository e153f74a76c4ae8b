package com.gentoro.geocontext.dataset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An item owned by an external system (for instance a BIM object of a model) that gets attached
 * to the leaves of the materialized tree.
 *
 * @param externalId identifier of the item in the external system
 * @param name display name
 * @param attributes grouping attributes, e.g. {@code building -> "B1"}
 */
public record ExternalItem(long externalId, String name, Map<String, String> attributes) {

  @JsonCreator
  public ExternalItem(
      @JsonProperty("externalId") long externalId,
      @JsonProperty("name") String name,
      @JsonProperty("attributes") Map<String, String> attributes) {
    this.externalId = externalId;
    this.name = Objects.requireNonNull(name, "name");
    this.attributes =
        attributes == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  /** @return the attribute value, or {@code null} when absent. */
  public String attribute(String key) {
    return attributes.get(key);
  }
}

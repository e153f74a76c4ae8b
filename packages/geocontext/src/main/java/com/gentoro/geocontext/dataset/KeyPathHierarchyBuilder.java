package com.gentoro.geocontext.dataset;

import com.gentoro.geocontext.exception.ValidationException;
import com.gentoro.geocontext.layout.Layout;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Groups items by the attribute keys of a {@link Layout}, one key per depth. Group entries and
 * leaf items keep the order in which they first appear in the input.
 */
public class KeyPathHierarchyBuilder implements HierarchyBuilder {
  private final List<String> keys;

  public KeyPathHierarchyBuilder(Layout layout) {
    this.keys = Objects.requireNonNull(layout, "layout").keys();
  }

  @Override
  public HierarchyNode build(List<ExternalItem> items) {
    Map<String, Object> root = new LinkedHashMap<>();
    for (ExternalItem item : items) {
      insert(root, item);
    }
    return freeze(root, 0);
  }

  @SuppressWarnings("unchecked")
  private void insert(Map<String, Object> root, ExternalItem item) {
    Map<String, Object> current = root;
    for (int depth = 0; depth < keys.size(); depth++) {
      String value = item.attribute(keys.get(depth));
      if (value == null || value.isBlank()) {
        throw new ValidationException(
            "Item %d (%s) has no value for '%s'"
                .formatted(item.externalId(), item.name(), keys.get(depth)));
      }
      if (depth == keys.size() - 1) {
        ((List<ExternalItem>) current.computeIfAbsent(value, k -> new ArrayList<>())).add(item);
      } else {
        current = (Map<String, Object>) current.computeIfAbsent(value, k -> new LinkedHashMap<>());
      }
    }
  }

  @SuppressWarnings("unchecked")
  private HierarchyNode freeze(Map<String, Object> level, int depth) {
    Map<String, HierarchyNode> children = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : level.entrySet()) {
      HierarchyNode child =
          depth == keys.size() - 1
              ? new HierarchyNode.Leaf((List<ExternalItem>) entry.getValue())
              : freeze((Map<String, Object>) entry.getValue(), depth + 1);
      children.put(entry.getKey(), child);
    }
    return new HierarchyNode.Group(children);
  }
}

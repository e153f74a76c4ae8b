package com.gentoro.geocontext.dataset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Nested grouping of {@link ExternalItem}s: a {@link Group} maps names to sub-hierarchies in
 * insertion order, a {@link Leaf} holds the items of the deepest level.
 */
public sealed interface HierarchyNode permits HierarchyNode.Group, HierarchyNode.Leaf {

  <R> R accept(Visitor<R> visitor);

  /** Number of items below this node. */
  int itemCount();

  interface Visitor<R> {
    R visitGroup(Group group);

    R visitLeaf(Leaf leaf);
  }

  record Group(Map<String, HierarchyNode> children) implements HierarchyNode {
    public Group {
      Objects.requireNonNull(children, "children");
      children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitGroup(this);
    }

    @Override
    public int itemCount() {
      int total = 0;
      for (HierarchyNode child : children.values()) {
        total += child.itemCount();
      }
      return total;
    }
  }

  record Leaf(List<ExternalItem> items) implements HierarchyNode {
    public Leaf {
      items = List.copyOf(Objects.requireNonNull(items, "items"));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLeaf(this);
    }

    @Override
    public int itemCount() {
      return items.size();
    }
  }
}

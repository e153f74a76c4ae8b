package com.gentoro.geocontext.graph;

import java.util.Objects;

/**
 * Identity of a node in the graph store.
 *
 * @param id store-assigned identifier, unique within a store
 * @param name node name, used to match dataset entries
 * @param type node type, e.g. {@code Building}
 */
public record GraphNodeRef(String id, String name, String type) {
  public GraphNodeRef {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }
}

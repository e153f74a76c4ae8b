package com.gentoro.geocontext.graph;

/** What a {@link PendingWrite} puts into the graph. */
public enum WriteKind {
  /** A newly created node attached to its parent. */
  NODE,
  /** An external item attached below a leaf-level node. */
  REFERENCE
}

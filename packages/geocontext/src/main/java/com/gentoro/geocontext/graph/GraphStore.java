package com.gentoro.geocontext.graph;

import java.util.List;

/**
 * Graph persistence primitives needed to materialize a context.
 *
 * <p>Implementations must be safe to call concurrently for distinct parents. Lookups and node
 * creation are synchronous; attach calls return a {@link PendingWrite} and may complete in the
 * background.
 */
public interface GraphStore extends AutoCloseable {

  /** Initialize the store and any underlying connections/resources. Idempotent. */
  void initialize();

  /** @return true when the store is ready to accept operations. */
  boolean isInitialized();

  /**
   * Return the context node called {@code name}, creating it first when it does not exist. Safe
   * to call on every run.
   */
  GraphNodeRef ensureContext(String name);

  /**
   * Return the current children of {@code parent} reachable through {@code relation}, in no
   * particular order.
   *
   * @throws com.gentoro.geocontext.exception.NotFoundException when {@code parent} is unknown
   */
  List<GraphNodeRef> resolveChildren(GraphNodeRef parent, String relation);

  /**
   * Allocate a node. The node becomes reachable once it has been {@link #attach attached}.
   *
   * @throws com.gentoro.geocontext.exception.CreationException when the store refuses it
   */
  GraphNodeRef createNode(String name, String type);

  /** Link {@code child} below {@code parent} through {@code relation} within {@code context}. */
  PendingWrite attach(
      GraphNodeRef parent, GraphNodeRef child, String relation, GraphNodeRef context);

  /**
   * Attach the external item {@code externalId} below {@code parent} within {@code context}.
   * Attaching the same item twice below the same parent has no further effect.
   */
  PendingWrite attachExternalReference(
      GraphNodeRef context, GraphNodeRef parent, long externalId, String name, String relation);

  /** @return identifier of the backing engine, e.g. "in-memory". */
  String getDriverName();

  /** Shut down the store and release resources. */
  void shutdown();

  @Override
  default void close() {
    shutdown();
  }
}

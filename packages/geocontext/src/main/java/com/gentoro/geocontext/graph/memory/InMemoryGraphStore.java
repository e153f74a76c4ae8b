package com.gentoro.geocontext.graph.memory;

import com.gentoro.geocontext.exception.CreationException;
import com.gentoro.geocontext.exception.NotFoundException;
import com.gentoro.geocontext.exception.StateException;
import com.gentoro.geocontext.exception.ValidationException;
import com.gentoro.geocontext.graph.GraphNodeRef;
import com.gentoro.geocontext.graph.GraphStore;
import com.gentoro.geocontext.graph.PendingWrite;
import com.gentoro.geocontext.graph.WriteKind;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Graph store keeping everything in memory.
 *
 * <p>Attach calls run on a background executor and register their write id as pending. A pending
 * write becomes durable after {@code confirmationDelay} (zero confirms as soon as the write has
 * been applied); with a {@code null} delay writes stay pending until {@link #confirmAll()} is
 * called, which mimics a store whose durability signal arrives out of band.
 */
public class InMemoryGraphStore implements GraphStore {
  private static final org.slf4j.Logger log =
      com.gentoro.geocontext.logging.LoggingService.getLogger(InMemoryGraphStore.class);

  private final String name;
  private final Duration confirmationDelay;
  private final AtomicBoolean initialized = new AtomicBoolean(false);
  private final AtomicLong sequence = new AtomicLong();

  private final Map<String, GraphNodeRef> nodes = new ConcurrentHashMap<>();
  private final Map<String, GraphNodeRef> contexts = new ConcurrentHashMap<>();
  private final Set<Relation> relations = ConcurrentHashMap.newKeySet();
  // (parentId, label) -> child ids, in attach order
  private final Map<ChildrenKey, Set<String>> children = new ConcurrentHashMap<>();
  private final Set<Reference> references = ConcurrentHashMap.newKeySet();

  private final Map<String, String> pending = new ConcurrentHashMap<>();
  private final AtomicInteger maxUnconfirmed = new AtomicInteger();
  private final List<String> confirmed = Collections.synchronizedList(new ArrayList<>());

  private ExecutorService issuer;
  private ScheduledExecutorService confirmer;

  /** Relation from {@code parentId} to {@code childId}, recorded within a context. */
  public record Relation(String parentId, String childId, String label, String contextId) {}

  /** External item attached below {@code parentId}. */
  public record Reference(String parentId, long externalId, String label, String contextId) {}

  private record ChildrenKey(String parentId, String label) {}

  public InMemoryGraphStore(String name) {
    this(name, Duration.ZERO);
  }

  /**
   * @param name store name, used in logs
   * @param confirmationDelay delay between applying a write and confirming it durable; {@code
   *     null} disables automatic confirmation
   */
  public InMemoryGraphStore(String name, Duration confirmationDelay) {
    this.name = name != null ? name : "default";
    if (confirmationDelay != null && confirmationDelay.isNegative()) {
      throw new ValidationException("Confirmation delay must not be negative");
    }
    this.confirmationDelay = confirmationDelay;
  }

  @Override
  public void initialize() {
    if (!initialized.compareAndSet(false, true)) return;
    issuer =
        Executors.newFixedThreadPool(
            4, daemonFactory("geocontext-memstore-" + this.name + "-issuer"));
    confirmer =
        Executors.newSingleThreadScheduledExecutor(
            daemonFactory("geocontext-memstore-" + this.name + "-confirm"));
    log.debug(
        "InMemoryGraphStore '{}' initialized (confirmationDelay={})", name, confirmationDelay);
  }

  @Override
  public boolean isInitialized() {
    return initialized.get();
  }

  @Override
  public GraphNodeRef ensureContext(String contextName) {
    requireInitialized();
    if (contextName == null || contextName.isBlank()) {
      throw new ValidationException("Context name must not be blank");
    }
    return contexts.computeIfAbsent(
        contextName, n -> new GraphNodeRef(nextId("ctx"), n, "geographicContext"));
  }

  @Override
  public List<GraphNodeRef> resolveChildren(GraphNodeRef parent, String relation) {
    requireInitialized();
    if (!exists(parent)) {
      throw new NotFoundException(
          "Node " + parent.id() + " does not exist", Map.of("node", parent.id()));
    }
    Set<String> childIds = children.get(new ChildrenKey(parent.id(), relation));
    if (childIds == null) {
      return List.of();
    }
    List<GraphNodeRef> resolved = new ArrayList<>();
    synchronized (childIds) {
      for (String childId : childIds) {
        resolved.add(nodes.get(childId));
      }
    }
    return resolved;
  }

  @Override
  public GraphNodeRef createNode(String nodeName, String type) {
    requireInitialized();
    if (nodeName == null || type == null) {
      throw new CreationException("Node name and type are required");
    }
    GraphNodeRef ref = new GraphNodeRef(nextId("node"), nodeName, type);
    nodes.put(ref.id(), ref);
    return ref;
  }

  @Override
  public PendingWrite attach(
      GraphNodeRef parent, GraphNodeRef child, String relation, GraphNodeRef context) {
    requireInitialized();
    Relation edge = new Relation(parent.id(), child.id(), relation, context.id());
    return submit(
        WriteKind.NODE,
        child.name(),
        () -> {
          if (!exists(parent) || !nodes.containsKey(child.id())) {
            throw new CreationException(
                "Cannot attach " + child.id() + " below " + parent.id(),
                Map.of("parent", parent.id(), "child", child.id()),
                null);
          }
          if (relations.add(edge)) {
            Set<String> childIds =
                children.computeIfAbsent(
                    new ChildrenKey(edge.parentId(), edge.label()),
                    k -> Collections.synchronizedSet(new LinkedHashSet<>()));
            childIds.add(edge.childId());
          }
        });
  }

  @Override
  public PendingWrite attachExternalReference(
      GraphNodeRef context,
      GraphNodeRef parent,
      long externalId,
      String itemName,
      String relation) {
    requireInitialized();
    Reference ref = new Reference(parent.id(), externalId, relation, context.id());
    return submit(
        WriteKind.REFERENCE,
        itemName,
        () -> {
          if (!exists(parent)) {
            throw new CreationException(
                "Cannot attach item " + externalId + " below unknown node " + parent.id(),
                Map.of("parent", parent.id(), "externalId", externalId),
                null);
          }
          references.add(ref);
        });
  }

  private PendingWrite submit(WriteKind kind, String subject, Runnable apply) {
    String writeId = nextId("w");
    pending.put(writeId, subject);
    maxUnconfirmed.accumulateAndGet(pending.size(), Math::max);
    CompletableFuture<Void> issued =
        CompletableFuture.runAsync(apply, issuer)
            .whenComplete(
                (ok, error) -> {
                  if (error == null) {
                    scheduleConfirmation(writeId);
                  }
                });
    return PendingWrite.of(writeId, kind, subject, issued, () -> !pending.containsKey(writeId));
  }

  private void scheduleConfirmation(String writeId) {
    if (confirmationDelay == null) {
      return;
    }
    if (confirmationDelay.isZero()) {
      confirm(writeId);
    } else {
      confirmer.schedule(
          () -> confirm(writeId), confirmationDelay.toMillis(), TimeUnit.MILLISECONDS);
    }
  }

  private void confirm(String writeId) {
    String subject = pending.remove(writeId);
    if (subject != null) {
      confirmed.add(subject);
    }
  }

  /** Confirm every pending write at once. */
  public void confirmAll() {
    for (String writeId : new ArrayList<>(pending.keySet())) {
      confirm(writeId);
    }
  }

  private boolean exists(GraphNodeRef ref) {
    if (nodes.containsKey(ref.id())) {
      return true;
    }
    GraphNodeRef context = contexts.get(ref.name());
    return context != null && context.id().equals(ref.id());
  }

  private void requireInitialized() {
    if (!initialized.get()) {
      throw new StateException("InMemoryGraphStore '" + name + "' is not initialized");
    }
  }

  private String nextId(String prefix) {
    return prefix + "-" + sequence.incrementAndGet();
  }

  /** Find the child called {@code childName} below {@code parent} through {@code relation}. */
  public Optional<GraphNodeRef> findChild(GraphNodeRef parent, String relation, String childName) {
    return resolveChildren(parent, relation).stream()
        .filter(c -> c.name().equals(childName))
        .findFirst();
  }

  /** External ids attached below {@code parent}. */
  public List<Long> referencesOf(GraphNodeRef parent) {
    List<Long> ids = new ArrayList<>();
    for (Reference r : references) {
      if (r.parentId().equals(parent.id())) {
        ids.add(r.externalId());
      }
    }
    Collections.sort(ids);
    return ids;
  }

  /** Nodes reachable through a relation; nodes created but never attached are not counted. */
  public long attachedNodeCount() {
    return relations.stream().map(Relation::childId).distinct().count();
  }

  public int relationCount() {
    return relations.size();
  }

  public int referenceCount() {
    return references.size();
  }

  public Set<Relation> relations() {
    return Set.copyOf(relations);
  }

  /** Durability registry lookup: true while {@code writeId} is not confirmed. */
  public boolean isPending(String writeId) {
    return pending.containsKey(writeId);
  }

  /** Writes issued but not confirmed yet. */
  public int pendingCount() {
    return pending.size();
  }

  /** Highest number of simultaneously unconfirmed writes observed so far. */
  public int maxUnconfirmed() {
    return maxUnconfirmed.get();
  }

  /** Subjects of confirmed writes, in confirmation order. */
  public List<String> confirmedSubjects() {
    synchronized (confirmed) {
      return List.copyOf(confirmed);
    }
  }

  @Override
  public String getDriverName() {
    return "in-memory";
  }

  public String getName() {
    return name;
  }

  @Override
  public void shutdown() {
    if (!initialized.compareAndSet(true, false)) return;
    issuer.shutdownNow();
    confirmer.shutdownNow();
  }

  private static java.util.concurrent.ThreadFactory daemonFactory(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  @Override
  public String toString() {
    return "InMemoryGraphStore{" + Objects.toString(name) + '}';
  }
}

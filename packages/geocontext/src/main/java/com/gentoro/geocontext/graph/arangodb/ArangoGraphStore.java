package com.gentoro.geocontext.graph.arangodb;

import com.arangodb.ArangoCursor;
import com.arangodb.ArangoDB;
import com.arangodb.ArangoDBException;
import com.arangodb.ArangoDatabase;
import com.arangodb.entity.CollectionType;
import com.arangodb.model.AqlQueryOptions;
import com.arangodb.model.CollectionCreateOptions;
import com.arangodb.model.DocumentCreateOptions;
import com.arangodb.model.OverwriteMode;
import com.gentoro.geocontext.exception.CreationException;
import com.gentoro.geocontext.exception.IoException;
import com.gentoro.geocontext.exception.NotFoundException;
import com.gentoro.geocontext.exception.StateException;
import com.gentoro.geocontext.graph.GraphNodeRef;
import com.gentoro.geocontext.graph.GraphStore;
import com.gentoro.geocontext.graph.PendingWrite;
import com.gentoro.geocontext.graph.WriteKind;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.configuration2.Configuration;

/**
 * ArangoDB implementation of {@link GraphStore}.
 *
 * <p>Nodes and contexts live in the document collection "nodes", external items in "references"
 * and every link (node to node, node to item) in the edge collection "relations". Nodes are
 * inserted by {@link #createNode}; attach calls insert the edge on a background executor. With
 * {@code waitForSync} enabled an edge insert only returns once it is on disk, so a write counts as
 * durable as soon as it has been issued.
 */
public class ArangoGraphStore implements GraphStore {
  private static final org.slf4j.Logger log =
      com.gentoro.geocontext.logging.LoggingService.getLogger(ArangoGraphStore.class);

  private static final String DEFAULT_DB_PREFIX = "geocontext_";
  static final String COLLECTION_NODES = "nodes";
  static final String COLLECTION_REFERENCES = "references";
  static final String COLLECTION_RELATIONS = "relations";
  static final String CONTEXT_TYPE = "geographicContext";
  private static final int MAX_KEY_LENGTH = 254;
  private static final int EDGE_DIGEST_BYTES = 6;

  private static final String CHILDREN_AQL =
      "LET parent = DOCUMENT(@parent) "
          + "RETURN { exists: parent != null, children: ("
          + "FOR v, e IN 1..1 OUTBOUND @parent "
          + COLLECTION_RELATIONS
          + " FILTER e.label == @label AND IS_SAME_COLLECTION('"
          + COLLECTION_NODES
          + "', v) RETURN { id: v._id, name: v.name, type: v.type }) }";

  private final Configuration configuration;
  private final String projectName;
  private final String databaseName;
  private final AtomicBoolean initialized = new AtomicBoolean(false);

  private ArangoDB arango;
  private ArangoDatabase db;
  private ExecutorService issuer;
  private boolean waitForSync;

  public ArangoGraphStore(Configuration configuration, String projectName) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
    this.projectName = projectName != null ? projectName : "default";
    String configured = configuration.getString("geocontext.store.arangodb.database", "");
    String prefix =
        configuration.getString("geocontext.store.arangodb.databasePrefix", DEFAULT_DB_PREFIX);
    if (prefix == null) prefix = DEFAULT_DB_PREFIX;
    this.databaseName =
        configured != null && !configured.isBlank()
            ? configured
            : prefix + sanitize(this.projectName);
  }

  @Override
  public void initialize() {
    if (initialized.get()) return;
    String host = configuration.getString("geocontext.store.arangodb.host", "localhost");
    int port = configuration.getInteger("geocontext.store.arangodb.port", 8529);
    String user = configuration.getString("geocontext.store.arangodb.user", "root");
    String password = configuration.getString("geocontext.store.arangodb.password", "");
    int threads = configuration.getInteger("geocontext.store.arangodb.issuerThreads", 4);
    this.waitForSync = configuration.getBoolean("geocontext.store.arangodb.waitForSync", true);

    try {
      arango = new ArangoDB.Builder().host(host, port).user(user).password(password).build();
      if (!arango.getDatabases().contains(databaseName)) {
        arango.createDatabase(databaseName);
      }
      db = arango.db(databaseName);
      createCollectionIfNeeded(COLLECTION_NODES, CollectionType.DOCUMENT);
      createCollectionIfNeeded(COLLECTION_REFERENCES, CollectionType.DOCUMENT);
      createCollectionIfNeeded(COLLECTION_RELATIONS, CollectionType.EDGES);
    } catch (ArangoDBException e) {
      shutdownQuietly();
      throw new IoException("Failed to initialize ArangoDB database '" + databaseName + "'", e);
    }

    AtomicInteger counter = new AtomicInteger();
    issuer =
        Executors.newFixedThreadPool(
            Math.max(1, threads),
            r -> {
              Thread t = new Thread(r, "geocontext-arango-issuer-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    initialized.set(true);
    log.info(
        "ArangoGraphStore initialized database '{}' for project '{}' (waitForSync={})",
        databaseName,
        projectName,
        waitForSync);
  }

  private void createCollectionIfNeeded(String name, CollectionType type) {
    if (!db.collection(name).exists()) {
      db.createCollection(name, new CollectionCreateOptions().type(type));
    }
  }

  @Override
  public boolean isInitialized() {
    return initialized.get();
  }

  @Override
  public GraphNodeRef ensureContext(String name) {
    requireInitialized();
    String key = "ctx_" + sanitizeDocumentKey(name);
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("_key", key);
    doc.put("name", name);
    doc.put("type", CONTEXT_TYPE);
    try {
      db.collection(COLLECTION_NODES)
          .insertDocument(doc, new DocumentCreateOptions().overwriteMode(OverwriteMode.ignore));
    } catch (ArangoDBException e) {
      throw new IoException("Failed to ensure context '" + name + "'", e);
    }
    return new GraphNodeRef(COLLECTION_NODES + "/" + key, name, CONTEXT_TYPE);
  }

  @Override
  @SuppressWarnings({"rawtypes", "unchecked"})
  public List<GraphNodeRef> resolveChildren(GraphNodeRef parent, String relation) {
    requireInitialized();
    Map<String, Object> bind = Map.of("parent", parent.id(), "label", relation);
    Map result;
    try (ArangoCursor<Map> cursor =
        db.query(CHILDREN_AQL, Map.class, bind, new AqlQueryOptions())) {
      result = cursor.hasNext() ? cursor.next() : Map.of();
    } catch (Exception e) {
      throw new IoException("Failed to resolve children of " + parent.id(), e);
    }
    if (!Boolean.TRUE.equals(result.get("exists"))) {
      throw new NotFoundException(
          "Node " + parent.id() + " does not exist", Map.of("node", parent.id()));
    }
    List<GraphNodeRef> children = new ArrayList<>();
    for (Object o : (List<Object>) result.getOrDefault("children", List.of())) {
      Map<String, Object> child = (Map<String, Object>) o;
      children.add(
          new GraphNodeRef(
              (String) child.get("id"), (String) child.get("name"), (String) child.get("type")));
    }
    return children;
  }

  @Override
  public GraphNodeRef createNode(String name, String type) {
    requireInitialized();
    String key = "n_" + UUID.randomUUID().toString().replace("-", "");
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("_key", key);
    doc.put("name", name);
    doc.put("type", type);
    try {
      db.collection(COLLECTION_NODES).insertDocument(doc, syncOptions());
    } catch (ArangoDBException e) {
      throw new CreationException(
          "Failed to create node '" + name + "'", Map.of("name", name, "type", type), e);
    }
    return new GraphNodeRef(COLLECTION_NODES + "/" + key, name, type);
  }

  @Override
  public PendingWrite attach(
      GraphNodeRef parent, GraphNodeRef child, String relation, GraphNodeRef context) {
    requireInitialized();
    Map<String, Object> edge = new LinkedHashMap<>();
    edge.put("_key", edgeKey(parent.id(), child.id(), relation));
    edge.put("_from", parent.id());
    edge.put("_to", child.id());
    edge.put("label", relation);
    edge.put("context", context.id());
    return submit(WriteKind.NODE, child.name(), edge);
  }

  @Override
  public PendingWrite attachExternalReference(
      GraphNodeRef context, GraphNodeRef parent, long externalId, String name, String relation) {
    requireInitialized();
    String referenceKey = "ext_" + externalId;
    String referenceId = COLLECTION_REFERENCES + "/" + referenceKey;
    Map<String, Object> edge = new LinkedHashMap<>();
    edge.put("_key", edgeKey(parent.id(), referenceId, relation));
    edge.put("_from", parent.id());
    edge.put("_to", referenceId);
    edge.put("label", relation);
    edge.put("context", context.id());

    String writeId = "ref-" + UUID.randomUUID();
    CompletableFuture<Void> issued =
        CompletableFuture.runAsync(
            () -> {
              Map<String, Object> reference = new LinkedHashMap<>();
              reference.put("_key", referenceKey);
              reference.put("externalId", externalId);
              reference.put("name", name);
              insert(COLLECTION_REFERENCES, reference, "item " + externalId);
              insert(COLLECTION_RELATIONS, edge, "item " + externalId);
            },
            issuer);
    return PendingWrite.of(writeId, WriteKind.REFERENCE, name, issued, () -> isDurable(issued));
  }

  private PendingWrite submit(WriteKind kind, String subject, Map<String, Object> edge) {
    String writeId = "edge-" + edge.get("_key");
    CompletableFuture<Void> issued =
        CompletableFuture.runAsync(() -> insert(COLLECTION_RELATIONS, edge, subject), issuer);
    return PendingWrite.of(writeId, kind, subject, issued, () -> isDurable(issued));
  }

  private void insert(String collection, Map<String, Object> doc, String subject) {
    try {
      db.collection(collection)
          .insertDocument(doc, syncOptions().overwriteMode(OverwriteMode.ignore));
    } catch (ArangoDBException e) {
      throw new CreationException(
          "Failed to write " + subject + " into '" + collection + "'",
          Map.of("collection", collection, "key", String.valueOf(doc.get("_key"))),
          e);
    }
  }

  private boolean isDurable(CompletableFuture<Void> issued) {
    return issued.isDone() && !issued.isCompletedExceptionally();
  }

  private DocumentCreateOptions syncOptions() {
    return new DocumentCreateOptions().waitForSync(waitForSync);
  }

  private void requireInitialized() {
    if (!initialized.get()) {
      throw new StateException("ArangoGraphStore for '" + projectName + "' is not initialized");
    }
  }

  @Override
  public String getDriverName() {
    return "arangodb";
  }

  public String getDatabaseName() {
    return databaseName;
  }

  /** @return the ArangoDB database handle, or null when not initialized. */
  public ArangoDatabase getDatabase() {
    return db;
  }

  @Override
  public void shutdown() {
    initialized.set(false);
    if (issuer != null) {
      issuer.shutdown();
    }
    shutdownQuietly();
  }

  private void shutdownQuietly() {
    try {
      if (arango != null) arango.shutdown();
    } catch (ArangoDBException e) {
      log.warn("Error while shutting down ArangoDB client: {}", e.getMessage());
    }
  }

  /**
   * Readable edge key suffixed with a digest of the raw endpoints and label, so that inputs which
   * sanitize or truncate to the same text still get distinct keys.
   */
  static String edgeKey(String from, String to, String label) {
    String digest = shortDigest(from + "|" + label + "|" + to);
    String readable = sanitizeDocumentKey(from + "_" + label + "_" + to);
    int max = MAX_KEY_LENGTH - digest.length() - 1;
    if (readable.length() > max) {
      readable = readable.substring(0, max);
    }
    return readable + "_" + digest;
  }

  private static String shortDigest(String raw) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(raw.getBytes(StandardCharsets.UTF_8));
      StringBuilder hex = new StringBuilder();
      for (int i = 0; i < EDGE_DIGEST_BYTES; i++) {
        String h = Integer.toHexString(0xff & hash[i]);
        if (h.length() == 1) {
          hex.append('0');
        }
        hex.append(h);
      }
      return hex.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new StateException("SHA-256 algorithm not available", e);
    }
  }

  static String sanitize(String name) {
    String s = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_\\-]", "_");
    if (!s.matches("^[a-z].*")) s = "p_" + s;
    if (s.length() > 64) s = s.substring(0, 64);
    return s;
  }

  /**
   * Sanitizes a document key to be ArangoDB-compliant: letters, digits, dashes and underscores
   * only, not starting with a digit or underscore, at most 254 characters.
   */
  static String sanitizeDocumentKey(String key) {
    if (key == null || key.isEmpty()) {
      throw new IllegalArgumentException("Document key cannot be null or empty");
    }
    String sanitized = key.replaceAll("[^a-zA-Z0-9_\\-]", "_");
    if (sanitized.matches("^[0-9].*")) {
      sanitized = "k_" + sanitized;
    }
    if (sanitized.startsWith("_")) {
      sanitized = "k" + sanitized;
    }
    if (sanitized.length() > MAX_KEY_LENGTH) {
      sanitized = sanitized.substring(0, MAX_KEY_LENGTH);
    }
    return sanitized;
  }
}

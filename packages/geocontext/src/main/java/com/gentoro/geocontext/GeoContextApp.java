package com.gentoro.geocontext;

import com.gentoro.geocontext.dataset.ItemFilter;
import com.gentoro.geocontext.dataset.JsonItemCatalog;
import com.gentoro.geocontext.dataset.RequiredAttributeItemFilter;
import com.gentoro.geocontext.exception.StateException;
import com.gentoro.geocontext.graph.GraphStore;
import com.gentoro.geocontext.graph.GraphStoreFactory;
import com.gentoro.geocontext.layout.Layout;
import com.gentoro.geocontext.materialize.SynchronizerSettings;
import com.gentoro.geocontext.materialize.WriteSynchronizer;
import com.gentoro.geocontext.progress.LoggingProgressSink;
import com.gentoro.geocontext.progress.Progression;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.configuration2.Configuration;

/**
 * Application context: loads the configuration, opens the configured graph store and wires a
 * {@link GeoContextGenerator} on top of it.
 */
public class GeoContextApp implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.geocontext.logging.LoggingService.getLogger(GeoContextApp.class);

  public static final String DEFAULT_REFERENCE_CONTEXT = "BIMObjectContext";

  private final String configLocation;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private ConfigurationProvider configurationProvider;
  private GraphStore graphStore;
  private Layout layout;
  private ExecutorService executor;
  private GeoContextGenerator generator;

  /**
   * @param configLocation "classpath:..." or a file path; blank selects
   *     classpath:application.yaml
   */
  public GeoContextApp(String configLocation) {
    this.configLocation = configLocation;
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(configLocation);
    com.gentoro.geocontext.logging.LoggingService.applyConfiguration(configuration());

    Configuration cfg = configuration();
    String project = cfg.getString("geocontext.project", "default");
    this.layout = Layout.fromConfiguration(cfg, "geocontext.layout");
    this.graphStore = GraphStoreFactory.create(cfg, project);
    this.graphStore.initialize();

    AtomicInteger counter = new AtomicInteger();
    this.executor =
        Executors.newFixedThreadPool(
            2,
            r -> {
              Thread t = new Thread(r, "geocontext-prepare-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });

    this.generator =
        new GeoContextGenerator(
            graphStore,
            new WriteSynchronizer(SynchronizerSettings.fromConfiguration(cfg)),
            createFilter(cfg),
            cfg.getString("geocontext.referenceContext", DEFAULT_REFERENCE_CONTEXT),
            executor);
    log.info(
        "GeoContext initialized for project '{}' (store: {}, layout depth: {})",
        project,
        graphStore.getDriverName(),
        layout.depth());
  }

  private ItemFilter createFilter(Configuration cfg) {
    String catalog = cfg.getString("geocontext.catalog.path", null);
    if (catalog == null || catalog.isBlank()) {
      log.debug("No item catalog configured; reference-based generation disabled");
      return null;
    }
    return new RequiredAttributeItemFilter(JsonItemCatalog.load(Path.of(catalog)));
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("GeoContextApp not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public GraphStore graphStore() {
    requireInitialized();
    return graphStore;
  }

  public Layout layout() {
    requireInitialized();
    return layout;
  }

  public GeoContextGenerator generator() {
    requireInitialized();
    return generator;
  }

  /**
   * New progress cell for one {@link GeoContextGenerator#generate} run, logged as rate-limited
   * JSON lines ({@code geocontext.progress.minIntervalMs}, {@code geocontext.progress.minDelta}).
   */
  public Progression newProgression() {
    Configuration cfg = configuration();
    return new Progression(
        new LoggingProgressSink(
            com.gentoro.geocontext.logging.LoggingService.getLogger(GeoContextGenerator.class),
            cfg.getLong("geocontext.progress.minIntervalMs", 1000L),
            cfg.getLong("geocontext.progress.minDelta", 5L)));
  }

  private void requireInitialized() {
    if (generator == null) {
      throw new StateException("GeoContextApp not initialized. Call initialize() first.");
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) return;
    if (executor != null) executor.shutdownNow();
    if (graphStore != null) graphStore.shutdown();
  }

  @Override
  public void close() {
    shutdown();
  }
}

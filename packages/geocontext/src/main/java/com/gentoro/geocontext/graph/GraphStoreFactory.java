package com.gentoro.geocontext.graph;

import com.gentoro.geocontext.exception.ConfigException;
import com.gentoro.geocontext.graph.spi.GraphStoreProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/** Creates the {@link GraphStore} selected by {@code geocontext.store.driver}. */
public final class GraphStoreFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.geocontext.logging.LoggingService.getLogger(GraphStoreFactory.class);

  public static final String DEFAULT_DRIVER = "in-memory";

  private GraphStoreFactory() {}

  public static GraphStore create(Configuration configuration, String projectName) {
    String driver =
        configuration
            .getString("geocontext.store.driver", DEFAULT_DRIVER)
            .trim()
            .toLowerCase(Locale.ROOT);
    List<String> known = new ArrayList<>();
    for (GraphStoreProvider provider : ServiceLoader.load(GraphStoreProvider.class)) {
      known.add(provider.id());
      if (!provider.id().equalsIgnoreCase(driver)) {
        continue;
      }
      if (!provider.isAvailable(configuration)) {
        throw new ConfigException("Graph store driver '" + driver + "' is not available");
      }
      log.info("Using graph store driver '{}' for project '{}'", driver, projectName);
      return provider.create(configuration, projectName);
    }
    throw new ConfigException(
        "Unknown graph store driver '" + driver + "'; available drivers: " + known);
  }
}

package com.gentoro.geocontext.graph.spi;

import com.gentoro.geocontext.graph.GraphStore;
import com.gentoro.geocontext.graph.memory.InMemoryGraphStore;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/** Service provider for the in-memory {@link GraphStore}. Always available. */
public class InMemoryGraphStoreProvider implements GraphStoreProvider {
  @Override
  public String id() {
    return "in-memory";
  }

  @Override
  public boolean isAvailable(Configuration configuration) {
    return true;
  }

  @Override
  public GraphStore create(Configuration configuration, String projectName) {
    long delayMs = configuration.getLong("geocontext.store.memory.confirmationDelayMs", 0L);
    return new InMemoryGraphStore(projectName, delayMs < 0 ? null : Duration.ofMillis(delayMs));
  }
}

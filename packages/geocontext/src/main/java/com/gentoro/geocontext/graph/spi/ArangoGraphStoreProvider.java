package com.gentoro.geocontext.graph.spi;

import com.gentoro.geocontext.graph.GraphStore;
import com.gentoro.geocontext.graph.arangodb.ArangoGraphStore;
import org.apache.commons.configuration2.Configuration;

/** Service provider for the ArangoDB-based {@link GraphStore}. */
public class ArangoGraphStoreProvider implements GraphStoreProvider {
  @Override
  public String id() {
    return "arangodb";
  }

  @Override
  public boolean isAvailable(Configuration configuration) {
    // Explicit selection or an Arango host block both count
    String desired = configuration.getString("geocontext.store.driver", "in-memory");
    if ("arangodb".equalsIgnoreCase(desired.trim())) return true;
    return configuration.getString("geocontext.store.arangodb.host", null) != null;
  }

  @Override
  public GraphStore create(Configuration configuration, String projectName) {
    return new ArangoGraphStore(configuration, projectName);
  }
}

package com.gentoro.geocontext.graph.spi;

import com.gentoro.geocontext.graph.GraphStore;
import org.apache.commons.configuration2.Configuration;

/**
 * Service provider creating a {@link GraphStore}. Providers are discovered through {@link
 * java.util.ServiceLoader} and selected by {@link #id()}.
 */
public interface GraphStoreProvider {

  /** Stable identifier matched against {@code geocontext.store.driver}. */
  String id();

  /** @return true when the provider can be used with the given configuration. */
  boolean isAvailable(Configuration configuration);

  GraphStore create(Configuration configuration, String projectName);
}

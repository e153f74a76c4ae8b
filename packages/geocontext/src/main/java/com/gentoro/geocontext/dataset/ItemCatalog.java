package com.gentoro.geocontext.dataset;

import java.util.Optional;

/** Read access to the items of the external system, by identifier. */
@FunctionalInterface
public interface ItemCatalog {

  Optional<ExternalItem> find(long externalId);
}

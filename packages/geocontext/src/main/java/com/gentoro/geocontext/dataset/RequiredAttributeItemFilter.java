package com.gentoro.geocontext.dataset;

import com.gentoro.geocontext.exception.FilterException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** {@link ItemFilter} backed by an {@link ItemCatalog}. */
public class RequiredAttributeItemFilter implements ItemFilter {
  private static final org.slf4j.Logger log =
      com.gentoro.geocontext.logging.LoggingService.getLogger(RequiredAttributeItemFilter.class);

  private final ItemCatalog catalog;

  public RequiredAttributeItemFilter(ItemCatalog catalog) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  @Override
  public FilterResult filterQualifying(List<Long> referenceIds, List<String> requiredKeys) {
    List<ExternalItem> valid = new ArrayList<>();
    List<Long> invalid = new ArrayList<>();
    for (Long id : referenceIds) {
      Optional<ExternalItem> item;
      try {
        item = catalog.find(id);
      } catch (RuntimeException e) {
        throw new FilterException("Failed to resolve item " + id, e);
      }
      if (item.isPresent() && hasAll(item.get(), requiredKeys)) {
        valid.add(item.get());
      } else {
        invalid.add(id);
      }
    }
    if (!invalid.isEmpty()) {
      log.debug(
          "{} of {} reference(s) lack one of {}",
          invalid.size(),
          referenceIds.size(),
          requiredKeys);
    }
    return new FilterResult(valid, invalid);
  }

  private static boolean hasAll(ExternalItem item, List<String> keys) {
    for (String key : keys) {
      String value = item.attribute(key);
      if (value == null || value.isBlank()) {
        return false;
      }
    }
    return true;
  }
}

package com.gentoro.geocontext.dataset;

import java.util.List;

/** Selects the referenced items that carry every attribute needed to place them in the tree. */
@FunctionalInterface
public interface ItemFilter {

  /**
   * @param referenceIds identifiers of candidate items
   * @param requiredKeys attribute keys each qualifying item must carry
   * @throws com.gentoro.geocontext.exception.FilterException when the items cannot be resolved
   */
  FilterResult filterQualifying(List<Long> referenceIds, List<String> requiredKeys);
}

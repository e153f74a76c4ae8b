package com.gentoro.geocontext.dataset;

import java.util.List;

/**
 * Outcome of {@link ItemFilter#filterQualifying}.
 *
 * @param valid items carrying every required attribute, in input order
 * @param invalid reference ids that are unknown or miss at least one attribute
 */
public record FilterResult(List<ExternalItem> valid, List<Long> invalid) {
  public FilterResult {
    valid = List.copyOf(valid);
    invalid = List.copyOf(invalid);
  }
}

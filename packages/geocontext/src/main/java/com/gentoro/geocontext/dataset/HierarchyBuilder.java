package com.gentoro.geocontext.dataset;

import java.util.List;

/** Groups a flat list of items into the nested structure consumed by the materializer. */
@FunctionalInterface
public interface HierarchyBuilder {

  HierarchyNode build(List<ExternalItem> items);
}

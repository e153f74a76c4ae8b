package com.gentoro.geocontext.layout;

/**
 * One depth of a {@link Layout}.
 *
 * @param key item attribute used to group items at this depth
 * @param nodeType type given to nodes created at this depth
 * @param relation relation linking nodes of this depth to their parent
 */
public record LayoutLevel(String key, String nodeType, String relation) {}

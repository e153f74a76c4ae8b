package com.gentoro.geocontext.layout;

import com.gentoro.geocontext.exception.ConfigException;
import com.gentoro.geocontext.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;

/**
 * Per-depth configuration of the tree to materialize: which attribute groups items, which node
 * type is created and which relation links it to its parent.
 *
 * <p>Depth {@code 0} is the level directly below the context. Leaves are not described by the
 * layout; items are always attached with {@link #referenceRelation()}.
 */
public final class Layout {
  public static final String DEFAULT_REFERENCE_RELATION = "hasReferenceObject";

  private final List<LayoutLevel> levels;
  private final String referenceRelation;

  public Layout(List<LayoutLevel> levels) {
    this(levels, DEFAULT_REFERENCE_RELATION);
  }

  public Layout(List<LayoutLevel> levels, String referenceRelation) {
    Objects.requireNonNull(levels, "levels");
    if (levels.isEmpty()) {
      throw new ValidationException("Layout must define at least one level");
    }
    Set<String> keys = new HashSet<>();
    for (int i = 0; i < levels.size(); i++) {
      LayoutLevel level = levels.get(i);
      if (level == null
          || isBlank(level.key())
          || isBlank(level.nodeType())
          || isBlank(level.relation())) {
        throw new ValidationException("Layout level " + i + " is incomplete: " + level);
      }
      if (!keys.add(level.key())) {
        throw new ValidationException("Layout key '" + level.key() + "' is used twice");
      }
    }
    if (isBlank(referenceRelation)) {
      throw new ValidationException("Layout reference relation must not be blank");
    }
    this.levels = List.copyOf(levels);
    this.referenceRelation = referenceRelation;
  }

  /**
   * Read a layout from the parallel lists {@code <prefix>.keys}, {@code <prefix>.types} and
   * {@code <prefix>.relations}, plus the optional {@code <prefix>.referenceRelation}.
   */
  public static Layout fromConfiguration(Configuration config, String prefix) {
    List<String> keys = config.getList(String.class, prefix + ".keys", Collections.emptyList());
    List<String> types = config.getList(String.class, prefix + ".types", Collections.emptyList());
    List<String> relations =
        config.getList(String.class, prefix + ".relations", Collections.emptyList());
    if (keys.isEmpty()) {
      throw new ConfigException("No layout configured under '" + prefix + "'");
    }
    if (keys.size() != types.size() || keys.size() != relations.size()) {
      throw new ConfigException(
          "Layout '%s' lists differ in length: keys=%d, types=%d, relations=%d"
              .formatted(prefix, keys.size(), types.size(), relations.size()));
    }
    List<LayoutLevel> levels = new ArrayList<>(keys.size());
    for (int i = 0; i < keys.size(); i++) {
      levels.add(new LayoutLevel(keys.get(i), types.get(i), relations.get(i)));
    }
    String referenceRelation =
        config.getString(prefix + ".referenceRelation", DEFAULT_REFERENCE_RELATION);
    try {
      return new Layout(levels, referenceRelation);
    } catch (ValidationException e) {
      throw new ConfigException("Invalid layout '" + prefix + "': " + e.getMessage(), e);
    }
  }

  /** Number of group levels. */
  public int depth() {
    return levels.size();
  }

  public LayoutLevel level(int depth) {
    if (depth < 0 || depth >= levels.size()) {
      throw new ValidationException(
          "Depth " + depth + " is outside of the layout (0.." + (levels.size() - 1) + ")");
    }
    return levels.get(depth);
  }

  public String key(int depth) {
    return level(depth).key();
  }

  public String nodeType(int depth) {
    return level(depth).nodeType();
  }

  public String relation(int depth) {
    return level(depth).relation();
  }

  public String referenceRelation() {
    return referenceRelation;
  }

  /** Grouping keys in depth order. */
  public List<String> keys() {
    return levels.stream().map(LayoutLevel::key).toList();
  }

  public List<LayoutLevel> levels() {
    return levels;
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Layout other)) return false;
    return levels.equals(other.levels) && referenceRelation.equals(other.referenceRelation);
  }

  @Override
  public int hashCode() {
    return Objects.hash(levels, referenceRelation);
  }

  @Override
  public String toString() {
    return "Layout{levels=" + levels + ", referenceRelation=" + referenceRelation + '}';
  }
}

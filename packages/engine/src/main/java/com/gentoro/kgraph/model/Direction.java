package com.gentoro.kgraph.model;

import com.gentoro.kgraph.exception.ValidationException;
import java.util.Locale;

/** Edge traversal direction relative to the node being expanded. */
public enum Direction {
  /** Follow edges from target back to source. */
  IN,
  /** Follow edges from source to target. */
  OUT,
  /** Follow edges either way. */
  BOTH;

  public boolean followsOutgoing() {
    return this != IN;
  }

  public boolean followsIncoming() {
    return this != OUT;
  }

  /** Parse {@code in}, {@code out} or {@code both}, case-insensitively. */
  public static Direction parse(String value) {
    if (value == null || value.isBlank()) {
      throw new ValidationException("direction", "Direction is required (in, out or both)");
    }
    try {
      return Direction.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ValidationException("direction", "Unknown direction '" + value + "'");
    }
  }
}

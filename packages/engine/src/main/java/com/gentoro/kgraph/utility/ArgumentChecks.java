package com.gentoro.kgraph.utility;

import com.gentoro.kgraph.exception.ValidationException;

/** Argument validation shared by the engine entry points. */
public final class ArgumentChecks {
  private ArgumentChecks() {}

  public static String requireCollection(String collection) {
    return requireText("collection", collection);
  }

  /** Non-blank string for {@code field}; returned unchanged. */
  public static String requireText(String field, String value) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(field, "'" + field + "' must be a non-blank string");
    }
    return value;
  }

  /** {@code value} within {@code [1, max]}. */
  public static int requireRange(String field, int value, int max) {
    if (value < 1 || value > max) {
      throw new ValidationException(
          field, "'%s' must be between 1 and %d, got %d".formatted(field, max, value));
    }
    return value;
  }

  public static int requirePositive(String field, int value) {
    if (value < 1) {
      throw new ValidationException(field, "'%s' must be >= 1, got %d".formatted(field, value));
    }
    return value;
  }

  public static double requireFinite(String field, double value) {
    if (!Double.isFinite(value)) {
      throw new ValidationException(field, "'" + field + "' must be a finite number, got " + value);
    }
    return value;
  }
}

package com.gentoro.kgraph.model;

import com.gentoro.kgraph.exception.ValidationException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validation and normalisation of node/edge property bags.
 *
 * <p>A property value is one of: {@code String}, {@code Long}, {@code Double}, {@code BigInteger},
 * {@code BigDecimal}, {@code Boolean}, {@code null}, a {@code List} of property values, or a
 * string-keyed {@code Map} of property values. Smaller integral types are widened to {@code Long}
 * and {@code Float} to {@code Double}. A {@code BigInteger} that fits in a long becomes a {@code
 * Long}, and a {@code BigDecimal} whose value a double represents exactly becomes a {@code
 * Double}; only wider numbers stay big. A bag read back from JSON therefore compares equal to the
 * bag that was written. Returned bags are deeply unmodifiable and keep insertion order.
 */
public final class PropertyValues {
  private PropertyValues() {}

  /** Normalise a property bag; {@code null} yields an empty bag. */
  public static Map<String, Object> normalize(Map<?, ?> properties) {
    return normalize(properties, "properties");
  }

  /**
   * Normalise a property bag, reporting violations against {@code field}.
   *
   * @throws ValidationException when a key is not a string or a value is outside the closed set
   */
  public static Map<String, Object> normalize(Map<?, ?> properties, String field) {
    if (properties == null || properties.isEmpty()) return Collections.emptyMap();
    return normalizeMap(properties, field);
  }

  /** Overlay {@code patch} onto {@code base}; a null patch value removes the key. */
  public static Map<String, Object> merge(Map<String, Object> base, Map<?, ?> patch) {
    Map<String, Object> normalizedPatch = normalize(patch);
    Map<String, Object> merged = new LinkedHashMap<>(base == null ? Map.of() : base);
    normalizedPatch.forEach(
        (k, v) -> {
          if (v == null) merged.remove(k);
          else merged.put(k, v);
        });
    return merged.isEmpty() ? Collections.emptyMap() : Collections.unmodifiableMap(merged);
  }

  private static Map<String, Object> normalizeMap(Map<?, ?> in, String path) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<?, ?> e : in.entrySet()) {
      if (!(e.getKey() instanceof String key)) {
        throw new ValidationException(
            path, "Property keys must be strings, got " + describe(e.getKey()) + " in " + path);
      }
      out.put(key, normalizeValue(e.getValue(), path + "." + key));
    }
    return Collections.unmodifiableMap(out);
  }

  private static Object normalizeValue(Object value, String path) {
    if (value == null || value instanceof String || value instanceof Boolean) {
      return value;
    }
    if (value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new ValidationException(
            path, "Non-finite number at " + path + " is not serializable");
      }
      return d;
    }
    if (value instanceof BigInteger big) {
      return big.bitLength() < Long.SIZE ? (Object) big.longValue() : big;
    }
    if (value instanceof BigDecimal big) {
      double d = big.doubleValue();
      boolean exact = Double.isFinite(d) && BigDecimal.valueOf(d).compareTo(big) == 0;
      return exact ? (Object) d : big;
    }
    if (value instanceof Character) {
      return value.toString();
    }
    if (value instanceof Map<?, ?> nested) {
      return normalizeMap(nested, path);
    }
    if (value instanceof Collection<?> items) {
      List<Object> out = new ArrayList<>(items.size());
      int i = 0;
      for (Object item : items) {
        out.add(normalizeValue(item, path + "[" + i++ + "]"));
      }
      return Collections.unmodifiableList(out);
    }
    if (value instanceof Object[] array) {
      return normalizeValue(Arrays.asList(array), path);
    }
    throw new ValidationException(
        path, "Unsupported property value " + describe(value) + " at " + path);
  }

  private static String describe(Object o) {
    return o == null ? "null" : o.getClass().getSimpleName();
  }
}

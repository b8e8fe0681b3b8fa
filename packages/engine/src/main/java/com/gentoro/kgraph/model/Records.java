package com.gentoro.kgraph.model;

import com.gentoro.kgraph.exception.StoreException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/** Typed reads from flat store records. A malformed record is a store failure. */
final class Records {
  private Records() {}

  static String string(Map<String, Object> record, String field) {
    Object v = record.get(field);
    return v == null ? null : v.toString();
  }

  static Double number(Map<String, Object> record, String field) {
    Object v = record.get(field);
    if (v == null) return null;
    if (v instanceof Number n) return n.doubleValue();
    try {
      return Double.parseDouble(v.toString());
    } catch (NumberFormatException e) {
      throw new StoreException("Record field '" + field + "' is not a number: " + v, e);
    }
  }

  static Instant instant(Map<String, Object> record, String field) {
    Object v = record.get(field);
    if (v == null) return null;
    if (v instanceof Instant i) return i;
    try {
      return Instant.parse(v.toString());
    } catch (DateTimeParseException e) {
      throw new StoreException("Record field '" + field + "' is not a timestamp: " + v, e);
    }
  }

  @SuppressWarnings("unchecked")
  static Map<String, ?> properties(Map<String, Object> record, String field) {
    Object v = record.get(field);
    if (v == null) return null;
    // key types are checked by PropertyValues.normalize
    if (v instanceof Map<?, ?> m) return (Map<String, ?>) m;
    throw new StoreException("Record field '" + field + "' is not a map: " + v);
  }
}

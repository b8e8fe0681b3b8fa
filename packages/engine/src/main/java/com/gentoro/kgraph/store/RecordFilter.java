package com.gentoro.kgraph.store;

import com.gentoro.kgraph.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Backend-neutral record predicate: a conjunction of clauses, each satisfied when any of its
 * fields matches.
 *
 * <p>Backends either translate the clauses into their native query language or call {@link
 * #matches(Map)}. {@link Operator#CONTAINS_IGNORE_CASE} compares map and list values through their
 * JSON text. Filters are immutable; the builder-style methods return new instances.
 */
public final class RecordFilter {
  private static final RecordFilter ALL = new RecordFilter(List.of());

  public enum Operator {
    EQUALS,
    CONTAINS_IGNORE_CASE
  }

  /** One clause: {@code fields[0] op value OR fields[1] op value ...}. */
  public record Clause(List<String> fields, Operator operator, Object value) {
    public Clause {
      fields = List.copyOf(fields);
      Objects.requireNonNull(operator, "operator");
      if (fields.isEmpty()) throw new IllegalArgumentException("A clause needs at least one field");
      if (operator == Operator.CONTAINS_IGNORE_CASE) {
        value = String.valueOf(value).toLowerCase(Locale.ROOT);
      }
    }

    public boolean test(Map<String, Object> record) {
      for (String field : fields) {
        Object actual = record.get(field);
        if (operator == Operator.EQUALS) {
          if (Objects.equals(actual, value)) return true;
        } else if (actual != null
            && text(actual).toLowerCase(Locale.ROOT).contains((String) value)) {
          return true;
        }
      }
      return false;
    }
  }

  private final List<Clause> clauses;

  private RecordFilter(List<Clause> clauses) {
    this.clauses = Collections.unmodifiableList(clauses);
  }

  /** Matches every record. */
  public static RecordFilter all() {
    return ALL;
  }

  public static RecordFilter where(String field, Object value) {
    return ALL.and(field, value);
  }

  /** Record matches when {@code field} equals {@code value}. */
  public RecordFilter and(String field, Object value) {
    return with(new Clause(List.of(field), Operator.EQUALS, value));
  }

  /** Record matches when any of {@code fields} equals {@code value}. */
  public RecordFilter andAnyEquals(Object value, String... fields) {
    return with(new Clause(List.of(fields), Operator.EQUALS, value));
  }

  /** Record matches when any of {@code fields} contains {@code keyword}, ignoring case. */
  public RecordFilter andContains(String keyword, String... fields) {
    return with(new Clause(List.of(fields), Operator.CONTAINS_IGNORE_CASE, keyword));
  }

  public boolean matches(Map<String, Object> record) {
    for (Clause clause : clauses) {
      if (!clause.test(record)) return false;
    }
    return true;
  }

  public List<Clause> clauses() {
    return clauses;
  }

  public boolean isEmpty() {
    return clauses.isEmpty();
  }

  private RecordFilter with(Clause clause) {
    List<Clause> next = new ArrayList<>(clauses);
    next.add(clause);
    return new RecordFilter(next);
  }

  /** Searchable text of a record value: strings as-is, maps and lists as compact JSON. */
  public static String text(Object value) {
    if (value == null) return "";
    if (value instanceof String s) return s;
    if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
      return JacksonUtility.toCompactJson(value);
    }
    return String.valueOf(value);
  }

  @Override
  public String toString() {
    return "RecordFilter" + clauses;
  }
}

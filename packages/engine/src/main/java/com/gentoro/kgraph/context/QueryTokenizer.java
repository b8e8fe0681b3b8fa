package com.gentoro.kgraph.context;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public class QueryTokenizer {
  private static final Set<String> STOP_WORDS =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "can", "do", "does", "for", "from",
          "has", "have", "how", "in", "is", "it", "of", "on", "or", "that", "the", "this", "to",
          "was", "what", "when", "where", "which", "who", "whom", "why", "with", "about", "tell",
          "me", "know", "show", "list", "all", "any", "there");

  /**
   * Very small heuristic: 1 token ~ 4 characters (approx for many LLMs). Good enough to budget
   * prompt context; not a substitute for the model's own tokenizer.
   */
  public static int estimateTokens(String text) {
    if (text == null || text.isEmpty()) return 0;
    return Math.max(1, text.length() / 4);
  }

  /**
   * Distinct lower-case keywords of {@code query} in first-seen order. Stop words and single
   * characters are dropped.
   */
  public static List<String> keywords(String query) {
    if (query == null || query.isBlank()) return List.of();
    Set<String> out = new LinkedHashSet<>();
    for (String token : query.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}_-]+")) {
      if (token.length() < 2 || STOP_WORDS.contains(token)) continue;
      out.add(token);
    }
    return new ArrayList<>(out);
  }
}

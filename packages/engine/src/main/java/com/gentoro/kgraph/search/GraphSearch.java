package com.gentoro.kgraph.search;

import static com.gentoro.kgraph.utility.ArgumentChecks.requireCollection;
import static com.gentoro.kgraph.utility.ArgumentChecks.requirePositive;
import static com.gentoro.kgraph.utility.ArgumentChecks.requireText;

import com.gentoro.kgraph.KnowledgeGraphSettings.TieBreak;
import com.gentoro.kgraph.graph.CollectionLocks;
import com.gentoro.kgraph.model.Edge;
import com.gentoro.kgraph.model.Node;
import com.gentoro.kgraph.store.RecordFilter;
import com.gentoro.kgraph.store.RecordKind;
import com.gentoro.kgraph.store.RecordStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Case-insensitive keyword search over nodes and edges.
 *
 * <p>Candidates are prefiltered by the record store (substring match on the searchable fields) and
 * ranked here. Node tiers: exact name, name prefix, name substring, type, properties. Edge tiers:
 * exact relation type, relation prefix, relation substring, properties. Equal tiers are ordered by
 * the configured {@link TieBreak}; edges always by id.
 */
public class GraphSearch {
  private static final org.slf4j.Logger log =
      com.gentoro.kgraph.logging.LoggingService.getLogger(GraphSearch.class);

  private final RecordStore store;
  private final CollectionLocks locks;
  private final Comparator<Node> tieBreakOrder;
  private final Comparator<SearchHit<Node>> nodeOrder;

  public GraphSearch(RecordStore store, CollectionLocks locks, TieBreak tieBreak) {
    this.store = store;
    this.locks = locks;
    Comparator<Node> byId = Comparator.comparing(Node::getId);
    this.tieBreakOrder =
        tieBreak == TieBreak.NAME ? Comparator.comparing(Node::getName).thenComparing(byId) : byId;
    Comparator<SearchHit<Node>> byTier = Comparator.comparingInt(SearchHit::tier);
    this.nodeOrder = byTier.thenComparing(SearchHit::item, tieBreakOrder);
  }

  /** Best {@code limit} nodes matching {@code keyword}, best first. */
  public List<Node> searchNodes(String collection, String keyword, int limit) {
    List<Node> nodes = new ArrayList<>();
    for (SearchHit<Node> hit : rankNodes(collection, keyword, limit)) nodes.add(hit.item());
    return nodes;
  }

  /** Like {@link #searchNodes} but keeps the match kind of every hit. */
  public List<SearchHit<Node>> rankNodes(String collection, String keyword, int limit) {
    requireCollection(collection);
    requireText("keyword", keyword);
    requirePositive("limit", limit);
    String needle = keyword.trim().toLowerCase(Locale.ROOT);
    RecordFilter filter =
        RecordFilter.all()
            .andContains(needle, Node.FIELD_NAME, Node.FIELD_TYPE, Node.FIELD_PROPERTIES);
    List<Map<String, Object>> candidates =
        locks.read(collection, () -> store.list(collection, RecordKind.NODE, filter, 0));

    List<SearchHit<Node>> hits = new ArrayList<>(candidates.size());
    for (Map<String, Object> record : candidates) {
      Node node = Node.fromRecord(record);
      MatchKind match = classify(node, needle);
      if (match != null) hits.add(new SearchHit<>(node, match));
    }
    hits.sort(nodeOrder);
    List<SearchHit<Node>> top = hits.size() > limit ? hits.subList(0, limit) : hits;
    log.debug(
        "searchNodes({}, '{}', {}) -> {} of {} candidate(s)",
        collection,
        keyword,
        limit,
        top.size(),
        candidates.size());
    return new ArrayList<>(top);
  }

  /** Best {@code limit} edges matching {@code keyword} on relation type or properties. */
  public List<Edge> searchEdges(String collection, String keyword, int limit) {
    requireCollection(collection);
    requireText("keyword", keyword);
    requirePositive("limit", limit);
    String needle = keyword.trim().toLowerCase(Locale.ROOT);
    RecordFilter filter =
        RecordFilter.all().andContains(needle, Edge.FIELD_RELATION_TYPE, Edge.FIELD_PROPERTIES);
    List<Map<String, Object>> candidates =
        locks.read(collection, () -> store.list(collection, RecordKind.EDGE, filter, 0));

    List<SearchHit<Edge>> hits = new ArrayList<>(candidates.size());
    for (Map<String, Object> record : candidates) {
      Edge edge = Edge.fromRecord(record);
      MatchKind match = classify(edge, needle);
      if (match != null) hits.add(new SearchHit<>(edge, match));
    }
    hits.sort(
        Comparator.<SearchHit<Edge>>comparingInt(SearchHit::tier)
            .thenComparing(h -> h.item().getId()));
    List<Edge> edges = new ArrayList<>();
    for (SearchHit<Edge> hit : hits) {
      if (edges.size() >= limit) break;
      edges.add(hit.item());
    }
    log.debug("searchEdges({}, '{}', {}) -> {}", collection, keyword, limit, edges.size());
    return edges;
  }

  /** Order applied between nodes of the same tier. */
  public Comparator<Node> tieBreakOrder() {
    return tieBreakOrder;
  }

  static MatchKind classify(Node node, String needle) {
    String name = lower(node.getName());
    if (name.equals(needle)) return MatchKind.EXACT_NAME;
    if (name.startsWith(needle)) return MatchKind.NAME_PREFIX;
    if (name.contains(needle)) return MatchKind.NAME_SUBSTRING;
    if (lower(node.getType()).contains(needle)) return MatchKind.TYPE;
    if (!node.getProperties().isEmpty()
        && lower(RecordFilter.text(node.getProperties())).contains(needle)) {
      return MatchKind.NODE_PROPERTIES;
    }
    return null;
  }

  static MatchKind classify(Edge edge, String needle) {
    String relation = lower(edge.getRelationType());
    if (!relation.isEmpty()) {
      if (relation.equals(needle)) return MatchKind.EXACT_RELATION;
      if (relation.startsWith(needle)) return MatchKind.RELATION_PREFIX;
      if (relation.contains(needle)) return MatchKind.RELATION_SUBSTRING;
    }
    if (!edge.getProperties().isEmpty()
        && lower(RecordFilter.text(edge.getProperties())).contains(needle)) {
      return MatchKind.EDGE_PROPERTIES;
    }
    return null;
  }

  private static String lower(String s) {
    return s == null ? "" : s.toLowerCase(Locale.ROOT);
  }
}

package com.gentoro.kgraph.exception;

import com.gentoro.kgraph.store.RecordKind;

/** Referenced node or edge is absent from the collection. */
public class NotFoundException extends KnowledgeGraphException {
  public NotFoundException(String collection, RecordKind kind, String id) {
    super(
        KnowledgeGraphErrorCode.NOT_FOUND,
        "%s '%s' not found in collection '%s'".formatted(kind.label(), id, collection),
        details("collection", collection, "kind", kind.label(), "id", id));
  }

  public NotFoundException(String message) {
    super(KnowledgeGraphErrorCode.NOT_FOUND, message);
  }
}

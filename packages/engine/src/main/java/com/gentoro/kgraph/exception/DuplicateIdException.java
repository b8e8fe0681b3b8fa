package com.gentoro.kgraph.exception;

import com.gentoro.kgraph.store.RecordKind;

/** A node or edge id is already taken in the collection. */
public class DuplicateIdException extends KnowledgeGraphException {
  public DuplicateIdException(String collection, RecordKind kind, String id) {
    super(
        KnowledgeGraphErrorCode.ALREADY_EXISTS,
        "%s '%s' already exists in collection '%s'".formatted(kind.label(), id, collection),
        details("collection", collection, "kind", kind.label(), "id", id));
  }
}

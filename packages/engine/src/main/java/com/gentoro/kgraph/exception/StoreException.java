package com.gentoro.kgraph.exception;

/** Record store failure. The engine does not retry; callers may. */
public class StoreException extends KnowledgeGraphException {
  public StoreException(String message) {
    super(KnowledgeGraphErrorCode.STORE_ERROR, message);
  }

  public StoreException(String message, Throwable cause) {
    super(KnowledgeGraphErrorCode.STORE_ERROR, message, cause);
  }

  public StoreException(String collection, String operation, Throwable cause) {
    super(
        KnowledgeGraphErrorCode.STORE_ERROR,
        "Record store failed during '%s' on collection '%s': %s"
            .formatted(operation, collection, cause.getMessage()),
        details("collection", collection, "operation", operation),
        cause);
  }
}

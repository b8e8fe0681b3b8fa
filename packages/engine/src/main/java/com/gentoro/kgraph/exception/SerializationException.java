package com.gentoro.kgraph.exception;

/** Serialization/deserialization failures (JSON/YAML). */
public class SerializationException extends KnowledgeGraphException {
  public SerializationException(String message) {
    super(KnowledgeGraphErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(KnowledgeGraphErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}

package com.gentoro.kgraph.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends KnowledgeGraphException {
  public ValidationException(String message) {
    super(KnowledgeGraphErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String field, String message) {
    super(KnowledgeGraphErrorCode.INVALID_ARGUMENT, message, details("field", field));
  }

  public ValidationException(String message, Throwable cause) {
    super(KnowledgeGraphErrorCode.INVALID_ARGUMENT, message, cause);
  }
}

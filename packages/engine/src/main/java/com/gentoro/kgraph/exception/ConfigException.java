package com.gentoro.kgraph.exception;

/** Misconfiguration or missing configuration. */
public class ConfigException extends KnowledgeGraphException {
  public ConfigException(String message) {
    super(KnowledgeGraphErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(KnowledgeGraphErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}

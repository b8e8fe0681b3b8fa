package com.gentoro.kgraph.exception;

/**
 * Canonical error codes for the knowledge graph engine. Codes are stable and suitable for a
 * transport layer to map onto status codes and for logs. Prefer the most specific code that
 * reflects the failure origin.
 */
public enum KnowledgeGraphErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  ALREADY_EXISTS,

  // I/O and configuration
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,

  // Record store failures, retryable by the caller
  STORE_ERROR,
}

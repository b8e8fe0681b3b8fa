package com.gentoro.kgraph.exception;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kgraph.store.RecordKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  @DisplayName("engine errors keep their code and context")
  void engineErrorDetails() {
    ErrorDetails details =
        ExceptionUtil.toErrorDetails(new NotFoundException("kg1", RecordKind.NODE, "p1"));

    assertEquals("NotFoundException", details.type);
    assertEquals(KnowledgeGraphErrorCode.NOT_FOUND, details.code);
    assertEquals("p1", details.context.get("id"));
    assertEquals("kg1", details.context.get("collection"));
    assertNotNull(details.timestamp);
  }

  @Test
  @DisplayName("foreign errors map to UNKNOWN")
  void foreignErrorDetails() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException());

    assertEquals("IllegalStateException", details.type);
    assertEquals("", details.message);
    assertEquals(KnowledgeGraphErrorCode.UNKNOWN, details.code);
  }

  @Test
  @DisplayName("only store failures are retryable")
  void retryable() {
    assertTrue(ExceptionUtil.isRetryable(new StoreException("down")));
    assertFalse(ExceptionUtil.isRetryable(new ValidationException("limit", "bad")));
    assertFalse(ExceptionUtil.isRetryable(new RuntimeException("x")));
  }

  @Test
  @DisplayName("validation errors name the offending field")
  void validationField() {
    ValidationException ex = new ValidationException("max_depth", "too deep");
    assertEquals(KnowledgeGraphErrorCode.INVALID_ARGUMENT, ex.getCode());
    assertEquals("max_depth", ex.getContext().get("field"));
  }
}

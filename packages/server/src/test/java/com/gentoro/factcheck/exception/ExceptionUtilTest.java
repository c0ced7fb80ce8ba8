package com.gentoro.factcheck.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void keepsCodeAndContextOfOwnExceptions() {
    ErrorDetails details =
        ExceptionUtil.toErrorDetails(
            new ToolExecutionException("medical_claims_identification", "failed", null));

    assertEquals("ToolExecutionException", details.type());
    assertEquals(FactCheckErrorCode.TOOL_EXECUTION_ERROR, details.code());
    assertEquals("medical_claims_identification", details.context().get("tool"));
    assertNotNull(details.timestamp());
  }

  @Test
  void foreignExceptionsAreUnknown() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException());
    assertEquals(FactCheckErrorCode.UNKNOWN, details.code());
    assertEquals("", details.message());
  }

  @Test
  void rootMessageIsTheInnermostOne() {
    Exception e = new IoException("outer", new IOException("disk full"));
    assertEquals("disk full", ExceptionUtil.rootMessage(e));
    assertEquals("NullPointerException", ExceptionUtil.rootMessage(new NullPointerException()));
  }

  @Test
  void ownExceptionsAreNotWrappedTwice() {
    ValidationException original = new ValidationException("bad");
    assertSame(
        original,
        ExceptionUtil.rethrowIfUnchecked(original, e -> new ConfigException("wrapped", e)));
    assertEquals(
        FactCheckErrorCode.CONFIGURATION_ERROR,
        ExceptionUtil.rethrowIfUnchecked(new Exception("x"), e -> new ConfigException("wrapped", e))
            .getCode());
  }
}

package com.sysmlgraph.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  private final Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

  @Test
  void testSysmlGraphExceptionKeepsCodeAndContext() {
    NotFoundException e = new NotFoundException("Element with id x not found", Map.of("id", "x"));

    ErrorDetails details = ExceptionUtil.toErrorDetails(e, clock);

    assertEquals("NotFoundException", details.type);
    assertEquals(SysmlGraphErrorCode.NOT_FOUND, details.code);
    assertEquals(Map.of("id", "x"), details.context);
    assertEquals(Instant.parse("2024-01-01T00:00:00Z"), details.timestamp);
  }

  @Test
  void testOtherThrowablesMapToUnknown() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException(), clock);

    assertEquals(SysmlGraphErrorCode.UNKNOWN, details.code);
    assertEquals("", details.message);
    assertNull(details.context);
  }

  @Test
  void testContextIsCopied() {
    Map<String, Object> context = new HashMap<>();
    context.put("kind", "part-usage");
    ValidationException e = new ValidationException("bad", context);
    context.put("kind", "changed");

    assertEquals("part-usage", e.getContext().get("kind"));
    assertThrows(UnsupportedOperationException.class, () -> e.getContext().put("a", "b"));
    assertEquals(SysmlGraphErrorCode.INVALID_ARGUMENT, e.getCode());
  }

  @Test
  void testCodesOfSubclasses() {
    assertEquals(SysmlGraphErrorCode.ALREADY_EXISTS, new AlreadyExistsException("x").getCode());
    assertEquals(SysmlGraphErrorCode.FAILED_PRECONDITION, new StateException("x").getCode());
    assertEquals(SysmlGraphErrorCode.CONFIGURATION_ERROR, new ConfigException("x").getCode());
    assertEquals(
        SysmlGraphErrorCode.SERIALIZATION_ERROR,
        new SerializationException("x", new RuntimeException()).getCode());
    assertTrue(new StateException("x").toString().contains("FAILED_PRECONDITION"));
  }

  @Test
  void testRethrowIfUncheckedKeepsOwnExceptions() {
    NotFoundException own = new NotFoundException("missing");

    assertSame(own, ExceptionUtil.rethrowIfUnchecked(own, e -> new StateException("wrapped", e)));

    IllegalStateException foreign = new IllegalStateException("boom");
    SysmlGraphException wrapped =
        ExceptionUtil.rethrowIfUnchecked(foreign, e -> new StateException("wrapped", e));
    assertInstanceOf(StateException.class, wrapped);
    assertSame(foreign, wrapped.getCause());
  }
}

package com.gentoro.factcheck.exception;

import java.time.Instant;
import java.util.Map;

/**
 * Structured error information attached to conversation results, progress documents and HTTP
 * responses. Rendering into display text happens only at the chat boundary.
 */
public record ErrorDetails(
    String type,
    String message,
    FactCheckErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}

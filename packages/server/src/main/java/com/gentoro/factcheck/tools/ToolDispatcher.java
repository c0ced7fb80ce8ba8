package com.gentoro.factcheck.tools;

import com.gentoro.factcheck.exception.ExceptionUtil;
import com.gentoro.factcheck.exception.ToolExecutionException;
import com.gentoro.factcheck.exception.UnresolvedFunctionException;
import com.gentoro.factcheck.model.Part;

/**
 * Routes model-emitted function calls to their handlers.
 *
 * <p>Arguments are decoded once here. A failing handler (or undecodable arguments) yields an
 * error-shaped {@link ToolResponse} and an entry in the context's error list, so sibling calls and
 * the conversation continue. Names outside {@link ToolKind} are not recoverable and surface as
 * {@link UnresolvedFunctionException}.
 */
public class ToolDispatcher {
  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(ToolDispatcher.class);

  private final ToolCallDecoder decoder;
  private final ToolHandler<ToolCall.ClaimsIdentification> claimsHandler;
  private final ToolHandler<ToolCall.ImpreciseLanguage> impreciseLanguageHandler;

  public ToolDispatcher(
      ToolCallDecoder decoder,
      ToolHandler<ToolCall.ClaimsIdentification> claimsHandler,
      ToolHandler<ToolCall.ImpreciseLanguage> impreciseLanguageHandler) {
    this.decoder = decoder;
    this.claimsHandler = claimsHandler;
    this.impreciseLanguageHandler = impreciseLanguageHandler;
  }

  public boolean supports(String functionName) {
    return ToolKind.fromFunctionName(functionName).isPresent();
  }

  public ToolResponse dispatch(Part.FunctionCall call, ToolInvocationContext context) {
    ToolKind kind = decoder.resolve(call.name());
    long start = System.currentTimeMillis();
    try {
      return switch (kind) {
        case MEDICAL_CLAIMS_IDENTIFICATION -> claimsHandler.handle(
            decoder.decodeClaims(call.args()), context);
        case IMPRECISE_LANGUAGE_IDENTIFICATION -> impreciseLanguageHandler.handle(
            decoder.decodeImpreciseLanguage(call.args()), context);
      };
    } catch (Exception e) {
      ToolExecutionException failure =
          new ToolExecutionException(
              kind.functionName(),
              kind.errorPrefix() + ": " + ExceptionUtil.rootMessage(e),
              e);
      log.error("Tool `{}` failed for chat {}", kind.functionName(), context.sessionId(), e);
      context.recordError(failure);
      return ToolResponse.error(kind, failure.getMessage());
    } finally {
      log.debug("Tool `{}` took {} ms", kind.functionName(), System.currentTimeMillis() - start);
    }
  }
}

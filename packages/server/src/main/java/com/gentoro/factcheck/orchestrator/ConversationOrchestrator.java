package com.gentoro.factcheck.orchestrator;

import com.gentoro.factcheck.exception.ExceptionUtil;
import com.gentoro.factcheck.exception.UnresolvedFunctionException;
import com.gentoro.factcheck.history.HistoryStore;
import com.gentoro.factcheck.model.ModelResponse;
import com.gentoro.factcheck.model.Part;
import com.gentoro.factcheck.orchestrator.progress.ProgressSink;
import com.gentoro.factcheck.tools.ToolDispatcher;
import com.gentoro.factcheck.tools.ToolInvocationContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Drives one conversation through its phases.
 *
 * <p>The prompt goes to the claims model. As long as a response consists only of function calls,
 * every call is dispatched and the collected responses go to the next model: the imprecise-language
 * model after the first round, the tool-free terminal model after that. The first response
 * carrying a non-call part ends the loop with that part's text.
 *
 * <p>The terminal model is the last stop: function calls it emits are not routed any further and
 * end the conversation with {@link #UNRESOLVED_FUNCTION_TEXT}. The same text ends the conversation
 * when a response names a function without a handler; in that case nothing from that response is
 * dispatched.
 *
 * <p>Any exception escaping the loop ends it with an apology that embeds the error. The history
 * gathered up to that point is still saved.
 */
public class ConversationOrchestrator {
  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(ConversationOrchestrator.class);

  static final String UNRESOLVED_FUNCTION_TEXT =
      "Could not resolve appropriate function and determine an answer.";
  static final String UNEXPECTED_ERROR_PREFIX = "Please try again. An unexpected error occurred. ";

  private final HistoryStore historyStore;
  private final ToolDispatcher dispatcher;
  private final Supplier<String> sessionIdGenerator;

  public ConversationOrchestrator(HistoryStore historyStore, ToolDispatcher dispatcher) {
    this(historyStore, dispatcher, () -> UUID.randomUUID().toString());
  }

  public ConversationOrchestrator(
      HistoryStore historyStore, ToolDispatcher dispatcher, Supplier<String> sessionIdGenerator) {
    this.historyStore = historyStore;
    this.dispatcher = dispatcher;
    this.sessionIdGenerator = sessionIdGenerator;
  }

  public ConversationResult run(
      ConversationRequest request, PhaseModels models, ProgressSink progressSink) {
    boolean resumed = request.sessionId() != null && !request.sessionId().isBlank();
    String sessionId = resumed ? request.sessionId() : sessionIdGenerator.get();
    ConversationSession session = new ConversationSession(request.userId(), sessionId, List.of());
    ToolInvocationContext context =
        new ToolInvocationContext(
            request.userId(),
            sessionId,
            request.styleMode(),
            request.workflowEngaged(),
            models.verification(),
            request.verificationPrompt(),
            progressSink);

    long start = System.currentTimeMillis();
    String outputText;
    try {
      if (resumed) {
        session.history(historyStore.load(request.userId(), sessionId));
      }
      outputText = drive(session, request.prompt(), models, context);
    } catch (Exception e) {
      log.error("Conversation {} failed in phase {}", sessionId, session.phase(), e);
      context.recordError(e);
      session.terminate();
      outputText = UNEXPECTED_ERROR_PREFIX + ExceptionUtil.rootMessage(e);
    }
    log.debug(
        "Conversation {} finished after {} round(s) in {} ms",
        sessionId,
        session.roundIndex(),
        System.currentTimeMillis() - start);

    if (request.saveHistory()) {
      saveHistory(session, context);
    }
    return new ConversationResult(
        outputText,
        sessionId,
        context.processedClaims(),
        context.processedInstances(),
        context.errors(),
        session.roundIndex());
  }

  private String drive(
      ConversationSession session,
      List<Part> prompt,
      PhaseModels models,
      ToolInvocationContext context) {
    ModelResponse response =
        models.forPhase(Phase.CLAIMS_IDENTIFICATION).send(session.history(), prompt);
    session.history(response.history());

    while (true) {
      Optional<String> text = terminalText(response);
      if (text.isPresent()) {
        log.trace("Chat {} ended with text in phase {}", session.id(), session.phase());
        session.terminate();
        return text.get();
      }

      List<Part.FunctionCall> calls = response.functionCalls();
      if (session.phase() == Phase.FREE_FORM) {
        log.warn(
            "Terminal model of chat {} requested {} function call(s); they are not routed",
            session.id(),
            calls.size());
        session.terminate();
        return UNRESOLVED_FUNCTION_TEXT;
      }
      Optional<Part.FunctionCall> unknown =
          calls.stream().filter(c -> !dispatcher.supports(c.name())).findFirst();
      if (unknown.isPresent()) {
        UnresolvedFunctionException failure =
            new UnresolvedFunctionException(unknown.get().name());
        log.warn("Chat {}: {}", session.id(), failure.getMessage());
        context.recordError(failure);
        session.terminate();
        return UNRESOLVED_FUNCTION_TEXT;
      }

      List<Part> toolResponses = new ArrayList<>(calls.size());
      for (Part.FunctionCall call : calls) {
        toolResponses.add(dispatcher.dispatch(call, context).toPart());
      }

      Phase next = session.nextPhase();
      log.debug(
          "Chat {} round {}: {} tool response(s) to {}",
          session.id(),
          session.roundIndex(),
          toolResponses.size(),
          next);
      response = models.forPhase(next).send(session.history(), toolResponses);
      session.completeRound(next, response.history());
    }
  }

  /** Text of the first part that is not a function call, if the response has one. */
  private static Optional<String> terminalText(ModelResponse response) {
    for (Part part : response.parts()) {
      if (part instanceof Part.FunctionCall) continue;
      return Optional.of(part instanceof Part.Text t ? t.text() : "");
    }
    return Optional.empty();
  }

  private void saveHistory(ConversationSession session, ToolInvocationContext context) {
    try {
      historyStore.save(session.userId(), session.id(), session.history());
    } catch (RuntimeException e) {
      log.error("Could not save history of chat {}", session.id(), e);
      context.recordError(e);
    }
  }
}

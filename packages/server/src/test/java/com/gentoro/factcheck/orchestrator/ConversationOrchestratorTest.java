package com.gentoro.factcheck.orchestrator;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.factcheck.exception.FactCheckErrorCode;
import com.gentoro.factcheck.exception.LlmException;
import com.gentoro.factcheck.history.InMemoryHistoryStore;
import com.gentoro.factcheck.model.GroundedResult;
import com.gentoro.factcheck.model.GroundingChunk;
import com.gentoro.factcheck.model.GroundingSupport;
import com.gentoro.factcheck.model.Part;
import com.gentoro.factcheck.model.Turn;
import com.gentoro.factcheck.orchestrator.progress.NoOpProgressSink;
import com.gentoro.factcheck.prompt.impl.PebblePromptTemplate;
import com.gentoro.factcheck.tools.ClaimsIdentificationHandler;
import com.gentoro.factcheck.tools.ImpreciseLanguageHandler;
import com.gentoro.factcheck.tools.ToolCallDecoder;
import com.gentoro.factcheck.tools.ToolDispatcher;
import com.gentoro.factcheck.verification.GroundedTextStructurer;
import com.gentoro.factcheck.verification.RateLimiter;
import com.gentoro.factcheck.verification.VerificationWorkerPool;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConversationOrchestratorTest {

  private static final Part.FunctionCall CLAIMS_CALL =
      new Part.FunctionCall(
          "medical_claims_identification",
          Map.of("identified_claims", List.of(Map.of("claim", "Statins lower LDL"))));
  private static final Part.FunctionCall IMPRECISE_CALL =
      new Part.FunctionCall(
          "imprecise_language_identification",
          Map.of("identified_instances", List.of(Map.of("imprecise_text", "dramatically"))));

  private InMemoryHistoryStore historyStore;
  private ConversationOrchestrator orchestrator;
  private ScriptedModelClient claimsModel;
  private ScriptedModelClient impreciseModel;
  private ScriptedModelClient terminalModel;
  private AtomicInteger verificationCalls;
  private PhaseModels models;

  @BeforeEach
  void setUp() {
    historyStore = new InMemoryHistoryStore();
    AtomicInteger ids = new AtomicInteger();
    ToolDispatcher dispatcher =
        new ToolDispatcher(
            new ToolCallDecoder(),
            new ClaimsIdentificationHandler(
                new VerificationWorkerPool(new RateLimiter(100, Duration.ofSeconds(60)), 2),
                new GroundedTextStructurer(),
                () -> "claim-" + ids.incrementAndGet()),
            new ImpreciseLanguageHandler(() -> "inst-" + ids.incrementAndGet()));
    orchestrator = new ConversationOrchestrator(historyStore, dispatcher, () -> "s-new");

    claimsModel = new ScriptedModelClient("claims");
    impreciseModel = new ScriptedModelClient("imprecise");
    terminalModel = new ScriptedModelClient("terminal");
    verificationCalls = new AtomicInteger();
    models =
        new PhaseModels(
            claimsModel,
            impreciseModel,
            terminalModel,
            prompt -> {
              verificationCalls.incrementAndGet();
              return new GroundedResult(
                  "Claim Analysis: Supported.",
                  List.of(new GroundingSupport(16, 26, List.of(0), List.of(0.8))),
                  List.of(new GroundingChunk("NIH", "https://nih.gov")));
            });
  }

  private static ConversationRequest request(String sessionId, boolean engaged) {
    return new ConversationRequest(
        "u-1",
        sessionId,
        List.of(Part.text("Statins lower LDL dramatically.")),
        engaged,
        "descriptive",
        new PebblePromptTemplate("verification_prompt", "Verify: {{ input_claim }}"),
        true);
  }

  private ConversationResult run(ConversationRequest request) {
    return orchestrator.run(request, models, new NoOpProgressSink());
  }

  @Test
  @DisplayName("Text from the first model ends the conversation without further calls")
  void firstTextReplyTerminates() {
    claimsModel.reply(Part.text("Hello! How can I help?"));

    ConversationResult result = run(request(null, false));

    assertEquals("Hello! How can I help?", result.outputText());
    assertEquals("s-new", result.sessionId());
    assertEquals(0, result.rounds());
    assertNull(result.processedClaims());
    assertNull(result.processedInstances());
    assertEquals(0, impreciseModel.calls());
    assertEquals(0, terminalModel.calls());
    assertEquals(2, historyStore.load("u-1", "s-new").size());
  }

  @Test
  @DisplayName("Round 0 responses go to the imprecise-language model, later rounds to the terminal")
  void routesRoundsByIndex() {
    claimsModel.reply(CLAIMS_CALL);
    impreciseModel.reply(IMPRECISE_CALL);
    terminalModel.reply(Part.text("Here is what I found."));

    ConversationResult result = run(request(null, true));

    assertEquals("Here is what I found.", result.outputText());
    assertEquals(2, result.rounds());
    assertEquals(1, verificationCalls.get());
    assertEquals(1, result.processedClaims().size());
    assertEquals("Supported.[1][0.80]", result.processedClaims().get(0).analysis().claimAnalysis());
    assertEquals(1, result.processedInstances().size());
    assertTrue(result.errors().isEmpty());

    Part.FunctionResponse toImprecise =
        assertInstanceOf(Part.FunctionResponse.class, impreciseModel.messages.get(0).get(0));
    assertEquals("medical_claims_identification", toImprecise.name());
    Part.FunctionResponse toTerminal =
        assertInstanceOf(Part.FunctionResponse.class, terminalModel.messages.get(0).get(0));
    assertEquals("imprecise_language_identification", toTerminal.name());

    // user, model(call), user(responses), model(call), user(responses), model(text)
    List<Turn> saved = historyStore.load("u-1", "s-new");
    assertEquals(6, saved.size());
  }

  @Test
  void everyCallOfARoundIsAnswered() {
    claimsModel.reply(CLAIMS_CALL, IMPRECISE_CALL);
    impreciseModel.reply(Part.text("Done."));

    ConversationResult result = run(request(null, false));

    assertEquals("Done.", result.outputText());
    assertEquals(1, result.rounds());
    List<Part> sent = impreciseModel.messages.get(0);
    assertEquals(2, sent.size());
    assertEquals("medical_claims_identification", ((Part.FunctionResponse) sent.get(0)).name());
    assertEquals("imprecise_language_identification", ((Part.FunctionResponse) sent.get(1)).name());
  }

  @Test
  void textAnywhereInTheResponseIsTerminal() {
    claimsModel.reply(Part.text("Answer first."), CLAIMS_CALL);

    ConversationResult result = run(request(null, false));

    assertEquals("Answer first.", result.outputText());
    assertEquals(0, verificationCalls.get());
    assertEquals(0, impreciseModel.calls());
  }

  @Test
  void unknownFunctionStopsTheLoop() {
    claimsModel.reply(new Part.FunctionCall("get_weather", Map.of("city", "Paris")), CLAIMS_CALL);

    ConversationResult result = run(request(null, false));

    assertEquals(ConversationOrchestrator.UNRESOLVED_FUNCTION_TEXT, result.outputText());
    assertEquals(0, verificationCalls.get());
    assertEquals(1, result.errors().size());
    assertEquals(FactCheckErrorCode.UNRESOLVED_FUNCTION, result.errors().get(0).code());
  }

  @Test
  void functionCallFromTheTerminalModelIsNotRouted() {
    claimsModel.reply(CLAIMS_CALL);
    impreciseModel.reply(IMPRECISE_CALL);
    terminalModel.reply(CLAIMS_CALL);

    ConversationResult result = run(request(null, false));

    assertEquals(ConversationOrchestrator.UNRESOLVED_FUNCTION_TEXT, result.outputText());
    assertEquals(1, terminalModel.calls());
    assertEquals(1, verificationCalls.get());
  }

  @Test
  void transportFailureBecomesApologyAndHistoryIsStillSaved() {
    claimsModel.reply(CLAIMS_CALL);
    impreciseModel.fail(new LlmException("connection reset"));

    ConversationResult result = run(request(null, false));

    assertEquals(
        ConversationOrchestrator.UNEXPECTED_ERROR_PREFIX + "connection reset",
        result.outputText());
    assertEquals(FactCheckErrorCode.LLM_ERROR, result.errors().get(0).code());
    assertEquals(1, result.processedClaims().size());
    assertEquals(2, historyStore.load("u-1", "s-new").size());
  }

  @Test
  void failedToolIsReportedAndTheConversationContinues() {
    claimsModel.reply(
        new Part.FunctionCall("medical_claims_identification", Map.of("identified_claims", 7)));
    impreciseModel.reply(Part.text("Sorry, I could not check the claims."));

    ConversationResult result = run(request(null, false));

    assertEquals("Sorry, I could not check the claims.", result.outputText());
    assertEquals(1, result.errors().size());
    assertEquals(FactCheckErrorCode.TOOL_EXECUTION_ERROR, result.errors().get(0).code());
    assertTrue(
        result.displayText().startsWith("Sorry, I could not check the claims.\nError when"));
    Part.FunctionResponse errorResponse =
        assertInstanceOf(Part.FunctionResponse.class, impreciseModel.messages.get(0).get(0));
    assertTrue(errorResponse.response().containsKey("error"));
  }

  @Test
  void resumedSessionContinuesStoredHistory() {
    historyStore.save(
        "u-1",
        "s-old",
        List.of(Turn.user(List.of(Part.text("Hi"))), Turn.model(List.of(Part.text("Hello")))));
    claimsModel.reply(Part.text("Welcome back."));

    ConversationResult result = run(request("s-old", false));

    assertEquals("s-old", result.sessionId());
    assertEquals(2, claimsModel.histories.get(0).size());
    assertEquals(4, historyStore.load("u-1", "s-old").size());
  }

  @Test
  void historyIsNotSavedWhenNotRequested() {
    claimsModel.reply(Part.text("Ok."));
    ConversationRequest base = request(null, false);
    ConversationRequest noSave =
        new ConversationRequest(
            base.userId(),
            null,
            base.prompt(),
            false,
            base.styleMode(),
            base.verificationPrompt(),
            false);

    run(noSave);

    assertTrue(historyStore.load("u-1", "s-new").isEmpty());
  }
}

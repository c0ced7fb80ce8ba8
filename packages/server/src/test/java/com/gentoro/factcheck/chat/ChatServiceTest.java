package com.gentoro.factcheck.chat;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.factcheck.exception.ValidationException;
import com.gentoro.factcheck.model.GenerationOptions;
import com.gentoro.factcheck.model.ModelClient;
import com.gentoro.factcheck.model.ModelClientFactory;
import com.gentoro.factcheck.model.ModelSettings;
import com.gentoro.factcheck.model.Part;
import com.gentoro.factcheck.model.ToolCallingMode;
import com.gentoro.factcheck.model.VerificationModelClient;
import com.gentoro.factcheck.orchestrator.ConversationOrchestrator;
import com.gentoro.factcheck.orchestrator.ConversationRequest;
import com.gentoro.factcheck.orchestrator.ConversationResult;
import com.gentoro.factcheck.orchestrator.progress.ProgressSink;
import com.gentoro.factcheck.orchestrator.progress.ProgressUpdate;
import com.gentoro.factcheck.prompt.CachingPromptSource;
import com.gentoro.factcheck.prompt.PromptCatalog;
import com.gentoro.factcheck.prompt.impl.ClasspathPromptRepository;
import com.gentoro.factcheck.prompt.impl.YamlPromptReferenceLoader;
import com.gentoro.factcheck.tools.IdentifiedClaim;
import com.gentoro.factcheck.tools.VerificationResult;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChatServiceTest {

  @Mock private ModelClientFactory factory;
  @Mock private ConversationOrchestrator orchestrator;
  @Mock private ProgressSink progressSink;
  @Mock private ModelClient chatClient;
  @Mock private VerificationModelClient verificationClient;

  private ChatService service;

  @BeforeEach
  void setUp() {
    PromptCatalog catalog =
        new PromptCatalog(
            new CachingPromptSource(
                new YamlPromptReferenceLoader("classpath:prompts/remote-config.yaml"),
                new ClasspathPromptRepository("prompts"),
                Duration.ofHours(1)));
    service =
        new ChatService(
            catalog,
            factory,
            new GenerationOptions("gemini-test", 0.2f, 0.0f, 2048),
            orchestrator,
            progressSink,
            ChatService.DEFAULT_ENGAGE_TRIGGER);
  }

  private void stubConversation(ConversationResult result) {
    when(factory.createChatClient(any())).thenReturn(chatClient);
    when(factory.createVerificationClient(any())).thenReturn(verificationClient);
    when(orchestrator.run(any(), any(), any())).thenReturn(result);
  }

  private static ChatRequest request(String text, List<Attachment> attachments) {
    return new ChatRequest("u-1", "c-1", "m-1", text, null, attachments);
  }

  @Test
  void runsConversationAndPublishesFinalUpdate() {
    VerificationResult claim =
        new VerificationResult("claim-1", new IdentifiedClaim("Water is wet", null), null);
    stubConversation(
        new ConversationResult("All done.", "c-1", List.of(claim), null, List.of(), 2));

    ChatReply reply = service.handle(request("Is   water\n wet?", null));

    assertEquals("All done.", reply.outputText());
    assertEquals("c-1", reply.chatHistoryId());
    assertEquals("claim-1", reply.processedClaims().get(0).get("id"));
    assertNull(reply.processedInstances());

    ArgumentCaptor<ConversationRequest> sent = ArgumentCaptor.forClass(ConversationRequest.class);
    verify(orchestrator).run(sent.capture(), any(), eq(progressSink));
    assertEquals(List.of(Part.text("Is water wet?")), sent.getValue().prompt());
    assertEquals(ChatService.DEFAULT_STYLE_MODE, sent.getValue().styleMode());
    assertFalse(sent.getValue().workflowEngaged());
    assertTrue(sent.getValue().saveHistory());

    ArgumentCaptor<ProgressUpdate> update = ArgumentCaptor.forClass(ProgressUpdate.class);
    verify(progressSink).update(update.capture());
    assertTrue(update.getValue().isFinal());
    assertEquals("All done.", update.getValue().outputText());
  }

  @Test
  void freeFormModelsChooseToolsThemselves() {
    stubConversation(new ConversationResult("ok", "c-1", null, null, List.of(), 0));

    service.handle(request("Hello", null));

    ArgumentCaptor<ModelSettings> settings = ArgumentCaptor.forClass(ModelSettings.class);
    verify(factory, times(3)).createChatClient(settings.capture());
    List<ModelSettings> all = settings.getAllValues();
    assertEquals(ToolCallingMode.auto(), all.get(0).toolCallingMode());
    assertEquals(ToolCallingMode.auto(), all.get(1).toolCallingMode());
    assertEquals(ToolCallingMode.none(), all.get(2).toolCallingMode());
    assertEquals(2, all.get(0).tools().size());
    assertEquals("gemini-test", all.get(0).modelName());
    assertNotNull(all.get(0).systemInstruction());
  }

  @Test
  void triggerPhraseEngagesTheGuidedWorkflow() {
    stubConversation(new ConversationResult("ok", "c-1", null, null, List.of(), 0));

    service.handle(request("Text to check. " + ChatService.DEFAULT_ENGAGE_TRIGGER, null));

    ArgumentCaptor<ModelSettings> settings = ArgumentCaptor.forClass(ModelSettings.class);
    verify(factory, times(3)).createChatClient(settings.capture());
    assertEquals(
        ToolCallingMode.forced("medical_claims_identification"),
        settings.getAllValues().get(0).toolCallingMode());
    assertEquals(
        ToolCallingMode.forced("imprecise_language_identification"),
        settings.getAllValues().get(1).toolCallingMode());

    ArgumentCaptor<ModelSettings> verification = ArgumentCaptor.forClass(ModelSettings.class);
    verify(factory).createVerificationClient(verification.capture());
    assertEquals(0.0f, verification.getValue().temperature());
  }

  @Test
  void attachmentsPrecedeTheText() {
    stubConversation(new ConversationResult("ok", "c-1", null, null, List.of(), 0));

    service.handle(
        request(
            "What does this say?",
            List.of(new Attachment("gs://b/f.pdf", "application/pdf", null))));

    ArgumentCaptor<ConversationRequest> sent = ArgumentCaptor.forClass(ConversationRequest.class);
    verify(orchestrator).run(sent.capture(), any(), any());
    assertEquals(
        List.of(Part.file("gs://b/f.pdf", "application/pdf"), Part.text("What does this say?")),
        sent.getValue().prompt());
  }

  @Test
  void rejectsRequestsWithoutContentOrUser() {
    assertThrows(ValidationException.class, () -> service.handle(request("  ", null)));
    assertThrows(
        ValidationException.class,
        () -> service.handle(new ChatRequest(" ", "c-1", null, "hello", null, null)));
    assertThrows(
        ValidationException.class,
        () -> service.handle(request(null, List.of(new Attachment("gs://b/f.pdf", null, null)))));
    verifyNoInteractions(orchestrator, progressSink);
  }

  @Test
  void failingFinalUpdateDoesNotFailTheReply() {
    stubConversation(new ConversationResult("ok", "c-1", null, null, List.of(), 0));
    doThrow(new IllegalStateException("sink down")).when(progressSink).update(any());

    assertEquals("ok", service.handle(request("Hello", null)).outputText());
  }
}

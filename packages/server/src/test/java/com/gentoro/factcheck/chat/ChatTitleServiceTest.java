package com.gentoro.factcheck.chat;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.factcheck.exception.ConfigException;
import com.gentoro.factcheck.exception.ValidationException;
import com.gentoro.factcheck.model.GenerationOptions;
import com.gentoro.factcheck.model.ModelClient;
import com.gentoro.factcheck.model.ModelClientFactory;
import com.gentoro.factcheck.model.ModelResponse;
import com.gentoro.factcheck.model.ModelSettings;
import com.gentoro.factcheck.model.Part;
import com.gentoro.factcheck.prompt.CachingPromptSource;
import com.gentoro.factcheck.prompt.PromptCatalog;
import com.gentoro.factcheck.prompt.impl.ClasspathPromptRepository;
import com.gentoro.factcheck.prompt.impl.YamlPromptReferenceLoader;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChatTitleServiceTest {

  @Mock private ModelClientFactory factory;
  @Mock private ModelClient client;

  private final GenerationOptions options = new GenerationOptions("gemini-test", 0.2f, 0f, 2048);

  private static PromptCatalog bundledCatalog() {
    return new PromptCatalog(
        new CachingPromptSource(
            new YamlPromptReferenceLoader("classpath:prompts/remote-config.yaml"),
            new ClasspathPromptRepository("prompts"),
            Duration.ofHours(1)));
  }

  @Test
  @SuppressWarnings("unchecked")
  void rendersThePromptAndCallsAToolFreeModel() {
    when(factory.createChatClient(any())).thenReturn(client);
    when(client.send(any(), any()))
        .thenReturn(new ModelResponse(List.of(Part.text(" Vitamin C and colds\n")), List.of()));
    ChatTitleService service = new ChatTitleService(bundledCatalog(), factory, options);

    String title = service.generateTitle("Does   vitamin C\n cure colds?");

    assertEquals("Vitamin C and colds", title);
    ArgumentCaptor<ModelSettings> settings = ArgumentCaptor.forClass(ModelSettings.class);
    verify(factory).createChatClient(settings.capture());
    assertEquals("gemini-test", settings.getValue().modelName());
    assertTrue(settings.getValue().tools().isEmpty());
    assertNull(settings.getValue().systemInstruction());

    ArgumentCaptor<List<Part>> message = ArgumentCaptor.forClass(List.class);
    verify(client).send(eq(List.of()), message.capture());
    String prompt = ((Part.Text) message.getValue().get(0)).text();
    assertTrue(prompt.contains("Message: Does vitamin C cure colds?"), prompt);
  }

  @Test
  void blankTextIsRejectedBeforeAnyModelCall() {
    ChatTitleService service = new ChatTitleService(bundledCatalog(), factory, options);

    assertThrows(ValidationException.class, () -> service.generateTitle("  \n "));
    assertThrows(ValidationException.class, () -> service.generateTitle(null));
    verifyNoInteractions(factory);
  }

  @Test
  void missingTitlePromptIsAConfigurationError() {
    PromptCatalog empty =
        new PromptCatalog(new CachingPromptSource(Map::of, f -> "", Duration.ofHours(1)));
    ChatTitleService service = new ChatTitleService(empty, factory, options);

    assertThrows(ConfigException.class, () -> service.generateTitle("hello"));
    verifyNoInteractions(factory);
  }
}

package com.gentoro.factcheck.chat;

import com.gentoro.factcheck.exception.ValidationException;
import com.gentoro.factcheck.model.GenerationOptions;
import com.gentoro.factcheck.model.ModelClient;
import com.gentoro.factcheck.model.ModelClientFactory;
import com.gentoro.factcheck.model.ModelResponse;
import com.gentoro.factcheck.model.ModelSettings;
import com.gentoro.factcheck.model.Part;
import com.gentoro.factcheck.prompt.PromptCatalog;
import com.gentoro.factcheck.utility.StringUtility;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Names a chat after its opening message with a single tool-free model call. */
public class ChatTitleService {
  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(ChatTitleService.class);

  private final PromptCatalog promptCatalog;
  private final ModelClientFactory modelClientFactory;
  private final GenerationOptions generationOptions;

  public ChatTitleService(
      PromptCatalog promptCatalog,
      ModelClientFactory modelClientFactory,
      GenerationOptions generationOptions) {
    this.promptCatalog = promptCatalog;
    this.modelClientFactory = modelClientFactory;
    this.generationOptions = generationOptions;
  }

  /**
   * @throws com.gentoro.factcheck.exception.ConfigException when the title prompt is not
   *     configured
   * @throws ValidationException when {@code text} is blank
   */
  public String generateTitle(String text) {
    String cleaned = StringUtility.collapseWhitespace(text);
    if (cleaned == null || cleaned.isBlank()) {
      throw new ValidationException("A chat title needs text");
    }
    String prompt =
        promptCatalog
            .template(PromptCatalog.CHAT_TITLE_PROMPT)
            .render(Map.of("input_text", cleaned.strip()));

    ModelClient client =
        modelClientFactory.createChatClient(
            ModelSettings.of(
                generationOptions.modelName(),
                null,
                generationOptions.temperature(),
                generationOptions.maxOutputTokens()));
    ModelResponse response = client.send(List.of(), List.of(Part.text(prompt)));
    String title =
        response.parts().stream()
            .filter(Part.Text.class::isInstance)
            .map(p -> ((Part.Text) p).text())
            .collect(Collectors.joining())
            .strip();
    log.debug("Generated chat title '{}'", title);
    return title;
  }
}

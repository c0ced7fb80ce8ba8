package com.gentoro.factcheck.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.factcheck.exception.ConfigException;
import com.gentoro.factcheck.exception.PromptException;
import com.gentoro.factcheck.model.ToolDefinition;
import com.gentoro.factcheck.model.ToolProperty;
import com.gentoro.factcheck.prompt.impl.PebblePromptTemplate;
import com.gentoro.factcheck.utility.JacksonUtility;
import java.util.Objects;

/** Named prompts of the {@value #GROUP} group and the definitions built from them. */
public class PromptCatalog {
  public static final String GROUP = "Prompts";
  public static final String ROLE_PROMPT = "role_prompt";
  public static final String VERIFICATION_PROMPT = "verification_prompt";
  public static final String CHAT_TITLE_PROMPT = "generate_chat_title";

  private final PromptSource source;

  public PromptCatalog(PromptSource source) {
    this.source = Objects.requireNonNull(source, "source");
  }

  /**
   * @throws ConfigException when no reference is registered for {@code key}
   */
  public String prompt(String key) {
    PromptReference reference =
        source
            .get(GROUP, key)
            .orElseThrow(() -> new ConfigException("Configuration not found for " + key));
    return source.fetchText(reference);
  }

  public PromptTemplate template(String key) {
    return new PebblePromptTemplate(key, prompt(key));
  }

  public ToolDefinition toolDefinition(String name, String descriptionKey, String parametersKey) {
    String description = prompt(descriptionKey);
    String parameters = prompt(parametersKey);
    JsonNode schema;
    try {
      schema = JacksonUtility.getJsonMapper().readTree(parameters);
    } catch (Exception e) {
      throw new PromptException("Parameters of `" + name + "` are not valid JSON", e);
    }
    return ToolDefinition.builder()
        .name(name)
        .description(description)
        .schema(ToolProperty.fromJsonSchema(null, schema))
        .build();
  }
}

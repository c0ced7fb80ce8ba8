package com.gentoro.factcheck.prompt;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.factcheck.exception.ConfigException;
import com.gentoro.factcheck.exception.PromptException;
import com.gentoro.factcheck.model.ToolDefinition;
import com.gentoro.factcheck.model.ToolProperty;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PromptCatalogTest {

  @Mock private PromptSource source;
  private PromptCatalog catalog;

  @BeforeEach
  void setUp() {
    catalog = new PromptCatalog(source);
  }

  private void register(String key, String fileName, String text) {
    PromptReference ref = PromptReference.of(fileName);
    when(source.get(PromptCatalog.GROUP, key)).thenReturn(Optional.of(ref));
    when(source.fetchText(ref)).thenReturn(text);
  }

  @Test
  void missingPromptIsAConfigurationError() {
    when(source.get(PromptCatalog.GROUP, "role_prompt")).thenReturn(Optional.empty());

    ConfigException e = assertThrows(ConfigException.class, () -> catalog.prompt("role_prompt"));
    assertTrue(e.getMessage().contains("Configuration not found"));
  }

  @Test
  void templateRendersTheClaim() {
    register("verification_prompt", "verification.txt", "Check: {{ input_claim }}");

    PromptTemplate template = catalog.template("verification_prompt");

    assertEquals("verification_prompt", template.id());
    assertEquals("Check: X", template.render(Map.of("input_claim", "X")));
  }

  @Test
  void buildsToolDefinitionFromDescriptionAndSchema() {
    register("tool_description", "d.txt", "Find claims.");
    register(
        "tool_parameters",
        "p.json",
        "{\"type\":\"object\",\"properties\":{\"identified_claims\":{\"type\":\"array\","
            + "\"items\":{\"type\":\"object\",\"properties\":{\"claim\":{\"type\":\"string\"}},"
            + "\"required\":[\"claim\"]}}},\"required\":[\"identified_claims\"]}");

    ToolDefinition definition =
        catalog.toolDefinition(
            "medical_claims_identification", "tool_description", "tool_parameters");

    assertEquals("medical_claims_identification", definition.name());
    assertEquals("Find claims.", definition.description());
    assertEquals(ToolProperty.Type.OBJECT, definition.schema().getType());
  }

  @Test
  void invalidSchemaIsAPromptError() {
    register("tool_description", "d.txt", "Find claims.");
    register("tool_parameters", "p.json", "{not json");

    assertThrows(
        PromptException.class,
        () -> catalog.toolDefinition("x", "tool_description", "tool_parameters"));
  }
}

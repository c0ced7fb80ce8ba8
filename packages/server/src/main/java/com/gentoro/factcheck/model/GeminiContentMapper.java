package com.gentoro.factcheck.model;

import com.gentoro.factcheck.exception.LlmException;
import com.google.genai.types.Blob;
import com.google.genai.types.Content;
import com.google.genai.types.FunctionCallingConfig;
import com.google.genai.types.FunctionCallingConfigMode;
import com.google.genai.types.FunctionDeclaration;
import com.google.genai.types.HarmBlockThreshold;
import com.google.genai.types.HarmCategory;
import com.google.genai.types.SafetySetting;
import com.google.genai.types.Schema;
import com.google.genai.types.Tool;
import com.google.genai.types.ToolConfig;
import com.google.genai.types.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Conversions between the provider-neutral conversation types and the Gemini SDK types. */
final class GeminiContentMapper {
  private static final List<HarmCategory.Known> SAFETY_CATEGORIES =
      List.of(
          HarmCategory.Known.HARM_CATEGORY_HATE_SPEECH,
          HarmCategory.Known.HARM_CATEGORY_DANGEROUS_CONTENT,
          HarmCategory.Known.HARM_CATEGORY_SEXUALLY_EXPLICIT,
          HarmCategory.Known.HARM_CATEGORY_HARASSMENT);

  private GeminiContentMapper() {}

  static List<Content> toContents(List<Turn> turns) {
    List<Content> contents = new ArrayList<>(turns.size());
    for (Turn turn : turns) {
      contents.add(toContent(turn));
    }
    return contents;
  }

  static Content toContent(Turn turn) {
    List<com.google.genai.types.Part> parts = new ArrayList<>(turn.parts().size());
    for (Part part : turn.parts()) {
      parts.add(toGeminiPart(part));
    }
    return Content.builder().role(turn.role().wireName()).parts(parts).build();
  }

  static Content systemInstruction(String text) {
    return Content.builder()
        .role(Role.USER.wireName())
        .parts(List.of(com.google.genai.types.Part.fromText(text)))
        .build();
  }

  static com.google.genai.types.Part toGeminiPart(Part part) {
    if (part instanceof Part.Text t) {
      return com.google.genai.types.Part.fromText(t.text());
    } else if (part instanceof Part.FileData f) {
      return com.google.genai.types.Part.builder()
          .fileData(
              com.google.genai.types.FileData.builder()
                  .fileUri(f.uri())
                  .mimeType(f.mimeType())
                  .build())
          .build();
    } else if (part instanceof Part.InlineData d) {
      return com.google.genai.types.Part.builder()
          .inlineData(Blob.builder().data(d.data()).mimeType(d.mimeType()).build())
          .build();
    } else if (part instanceof Part.FunctionCall c) {
      return com.google.genai.types.Part.builder()
          .functionCall(
              com.google.genai.types.FunctionCall.builder().name(c.name()).args(c.args()).build())
          .build();
    } else if (part instanceof Part.FunctionResponse r) {
      return com.google.genai.types.Part.builder()
          .functionResponse(
              com.google.genai.types.FunctionResponse.builder()
                  .name(r.name())
                  .response(r.response())
                  .build())
          .build();
    }
    throw new LlmException("Unsupported content part: " + part.getClass().getSimpleName());
  }

  static Turn fromContent(Content content) {
    List<Part> parts = new ArrayList<>();
    for (com.google.genai.types.Part p : content.parts().orElse(List.of())) {
      Part converted = fromGeminiPart(p);
      if (converted != null) {
        parts.add(converted);
      }
    }
    return new Turn(Role.fromWireName(content.role().orElse(Role.MODEL.wireName())), parts);
  }

  /** Returns null for parts this application does not carry (e.g. executable code). */
  static Part fromGeminiPart(com.google.genai.types.Part p) {
    if (p.functionCall().isPresent()) {
      com.google.genai.types.FunctionCall call = p.functionCall().get();
      return new Part.FunctionCall(
          call.name().orElse(""), new LinkedHashMap<>(call.args().orElse(Map.of())));
    }
    if (p.functionResponse().isPresent()) {
      com.google.genai.types.FunctionResponse response = p.functionResponse().get();
      return new Part.FunctionResponse(
          response.name().orElse(""), response.response().orElse(Map.of()));
    }
    if (p.text().isPresent()) {
      return new Part.Text(p.text().get());
    }
    if (p.fileData().isPresent()) {
      com.google.genai.types.FileData f = p.fileData().get();
      return new Part.FileData(
          f.fileUri().orElse(""), f.mimeType().orElse("application/octet-stream"));
    }
    if (p.inlineData().isPresent()) {
      Blob b = p.inlineData().get();
      return new Part.InlineData(
          b.data().orElse(new byte[0]), b.mimeType().orElse("application/octet-stream"));
    }
    return null;
  }

  static Tool functionTool(List<ToolDefinition> definitions) {
    List<FunctionDeclaration> declarations = new ArrayList<>();
    definitions.stream().map(GeminiContentMapper::toDeclaration).forEach(declarations::add);
    return Tool.builder().functionDeclarations(declarations).build();
  }

  static ToolConfig toolConfig(ToolCallingMode mode) {
    FunctionCallingConfig.Builder calling = FunctionCallingConfig.builder();
    switch (mode.kind()) {
      case FORCED -> calling
          .mode(FunctionCallingConfigMode.Known.ANY)
          .allowedFunctionNames(List.of(mode.allowedFunctionName()));
      case AUTO -> calling.mode(FunctionCallingConfigMode.Known.AUTO);
      case NONE -> calling.mode(FunctionCallingConfigMode.Known.NONE);
    }
    return ToolConfig.builder().functionCallingConfig(calling.build()).build();
  }

  static List<SafetySetting> safetySettings(HarmBlockThreshold.Known threshold) {
    List<SafetySetting> settings = new ArrayList<>();
    for (HarmCategory.Known category : SAFETY_CATEGORIES) {
      settings.add(SafetySetting.builder().category(category).threshold(threshold).build());
    }
    return settings;
  }

  static FunctionDeclaration toDeclaration(ToolDefinition def) {
    FunctionDeclaration.Builder builder =
        FunctionDeclaration.builder().name(def.name()).description(def.description());
    if (def.schema() != null) {
      builder.parameters(toSchema(def.schema()));
    }
    return builder.build();
  }

  static Schema toSchema(ToolProperty property) {
    Schema.Builder builder = Schema.builder().type(toGeminiType(property.getType()));
    if (property.getDescription() != null) {
      builder.description(property.getDescription());
    }
    if (!property.getEnumValues().isEmpty()) {
      builder.enum_(property.getEnumValues());
    }
    switch (property.getType()) {
      case ARRAY -> builder.items(toSchema(property.getItems()));
      case OBJECT -> {
        Map<String, Schema> properties = new LinkedHashMap<>();
        property.getProperties().forEach(p -> properties.put(p.getName(), toSchema(p)));
        builder.properties(properties);
        List<String> required = property.requiredPropertyNames();
        if (!required.isEmpty()) {
          builder.required(required);
        }
      }
      default -> {}
    }
    return builder.build();
  }

  private static Type.Known toGeminiType(ToolProperty.Type type) {
    return switch (type) {
      case OBJECT -> Type.Known.OBJECT;
      case NUMBER -> Type.Known.NUMBER;
      case INTEGER -> Type.Known.INTEGER;
      case ARRAY -> Type.Known.ARRAY;
      case BOOLEAN -> Type.Known.BOOLEAN;
      case STRING -> Type.Known.STRING;
    };
  }
}

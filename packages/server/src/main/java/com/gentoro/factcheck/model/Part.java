package com.gentoro.factcheck.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.Map;
import java.util.Objects;

/**
 * One content part of a conversation turn. A model response is an ordered sequence of parts,
 * each either text or a function call; requests may also carry attachments and function
 * responses.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = Part.Text.class, name = "text"),
  @JsonSubTypes.Type(value = Part.FileData.class, name = "file"),
  @JsonSubTypes.Type(value = Part.InlineData.class, name = "inline"),
  @JsonSubTypes.Type(value = Part.FunctionCall.class, name = "function_call"),
  @JsonSubTypes.Type(value = Part.FunctionResponse.class, name = "function_response")
})
public sealed interface Part
    permits Part.Text, Part.FileData, Part.InlineData, Part.FunctionCall, Part.FunctionResponse {

  static Part text(String text) {
    return new Text(text);
  }

  static Part file(String uri, String mimeType) {
    return new FileData(uri, mimeType);
  }

  static Part inline(byte[] data, String mimeType) {
    return new InlineData(data, mimeType);
  }

  record Text(String text) implements Part {
    public Text {
      text = text == null ? "" : text;
    }
  }

  /** Attachment referenced by URI (e.g. an object-storage path) rather than carried inline. */
  record FileData(String uri, String mimeType) implements Part {
    public FileData {
      Objects.requireNonNull(uri, "uri");
      Objects.requireNonNull(mimeType, "mimeType");
    }
  }

  record InlineData(byte[] data, String mimeType) implements Part {
    public InlineData {
      Objects.requireNonNull(data, "data");
      Objects.requireNonNull(mimeType, "mimeType");
    }
  }

  /** A model-emitted request to invoke one of the host's named capabilities. */
  record FunctionCall(String name, Map<String, Object> args) implements Part {
    public FunctionCall {
      args = args == null ? Map.of() : args;
    }
  }

  record FunctionResponse(String name, Map<String, Object> response) implements Part {
    public FunctionResponse {
      Objects.requireNonNull(name, "name");
      response = response == null ? Map.of() : response;
    }
  }
}

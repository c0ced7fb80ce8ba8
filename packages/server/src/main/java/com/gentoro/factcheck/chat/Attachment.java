package com.gentoro.factcheck.chat;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.factcheck.exception.ValidationException;
import com.gentoro.factcheck.model.Part;

/**
 * Media sent along with a chat message, either stored elsewhere ({@code uri}) or carried inline
 * ({@code data}, base64 in JSON).
 */
public record Attachment(
    @JsonProperty("uri") @JsonAlias({"gcsPath", "gcs_path"}) String uri,
    @JsonProperty("mime_type") @JsonAlias({"mimeType", "fileMimeType"}) String mimeType,
    @JsonProperty("data") byte[] data) {

  public Part toPart() {
    if (mimeType == null || mimeType.isBlank()) {
      throw new ValidationException("Attachment is missing its MIME type");
    }
    if (data != null && data.length > 0) {
      return Part.inline(data, mimeType);
    }
    if (uri == null || uri.isBlank()) {
      throw new ValidationException("Attachment needs either a uri or inline data");
    }
    return Part.file(uri, mimeType);
  }
}

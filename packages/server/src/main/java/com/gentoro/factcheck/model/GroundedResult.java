package com.gentoro.factcheck.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Text of a search-grounded generation together with its grounding metadata. A result without
 * metadata has empty {@link #supports()} and {@link #chunks()}.
 */
public record GroundedResult(
    String text, List<GroundingSupport> supports, List<GroundingChunk> chunks) {
  public GroundedResult {
    text = text == null ? "" : text;
    supports = supports == null ? List.of() : List.copyOf(supports);
    chunks = chunks == null ? List.of() : List.copyOf(chunks);
  }

  public boolean hasGrounding() {
    return !supports.isEmpty();
  }

  /**
   * Read a generation response document. Only the first candidate is considered, and only the
   * first part of its content supplies the text. Field names are accepted in both camelCase and
   * snake_case.
   */
  public static GroundedResult fromJson(JsonNode response) {
    JsonNode candidate = field(response, "candidates", "candidates").path(0);
    String text =
        field(candidate, "content", "content").path("parts").path(0).path("text").asText("");

    JsonNode metadata = field(candidate, "groundingMetadata", "grounding_metadata");
    List<GroundingSupport> supports = new ArrayList<>();
    for (JsonNode s : field(metadata, "groundingSupports", "grounding_supports")) {
      JsonNode segment = s.path("segment");
      List<Integer> indices = new ArrayList<>();
      field(s, "groundingChunkIndices", "grounding_chunk_indices")
          .forEach(i -> indices.add(i.asInt()));
      List<Double> scores = new ArrayList<>();
      field(s, "confidenceScores", "confidence_scores").forEach(c -> scores.add(c.asDouble()));
      supports.add(
          new GroundingSupport(
              field(segment, "startIndex", "start_index").asInt(0),
              field(segment, "endIndex", "end_index").asInt(0),
              indices,
              scores));
    }

    List<GroundingChunk> chunks = new ArrayList<>();
    for (JsonNode c : field(metadata, "groundingChunks", "grounding_chunks")) {
      JsonNode web = c.path("web");
      chunks.add(new GroundingChunk(web.path("title").asText(""), web.path("uri").asText("")));
    }
    return new GroundedResult(text, supports, chunks);
  }

  private static JsonNode field(JsonNode node, String camel, String snake) {
    if (node == null) return MissingNode.getInstance();
    JsonNode value = node.get(camel);
    if (value == null || value.isNull()) value = node.get(snake);
    return value == null || value.isNull() ? MissingNode.getInstance() : value;
  }
}

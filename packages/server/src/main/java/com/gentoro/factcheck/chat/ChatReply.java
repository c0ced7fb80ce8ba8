package com.gentoro.factcheck.chat;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.factcheck.exception.ErrorDetails;
import java.util.List;
import java.util.Map;

/** Response of a processed chat message. Claim and instance lists are null when none ran. */
public record ChatReply(
    @JsonProperty("output_text") String outputText,
    @JsonProperty("chat_history_id") String chatHistoryId,
    @JsonProperty("processed_claims") List<Map<String, Object>> processedClaims,
    @JsonProperty("processed_imprecise_language_instances")
        List<Map<String, Object>> processedInstances,
    @JsonProperty("errors") List<ErrorDetails> errors) {}

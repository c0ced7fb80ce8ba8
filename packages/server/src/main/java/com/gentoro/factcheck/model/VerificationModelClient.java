package com.gentoro.factcheck.model;

/** One-shot generation with web-search grounding, used to verify individual claims. */
public interface VerificationModelClient {

  /**
   * @throws com.gentoro.factcheck.exception.LlmException on transport or provider failure
   */
  GroundedResult generate(String prompt);
}

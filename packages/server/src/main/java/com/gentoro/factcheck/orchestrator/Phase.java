package com.gentoro.factcheck.orchestrator;

/** Stage of the conversation loop; selects the model instance that receives the next message. */
public enum Phase {
  CLAIMS_IDENTIFICATION,
  IMPRECISE_LANGUAGE_IDENTIFICATION,
  FREE_FORM,
  TERMINAL
}

package com.gentoro.factcheck.orchestrator;

import com.gentoro.factcheck.model.Turn;
import java.util.List;
import java.util.Objects;

/** Mutable state of one conversation while the orchestrator drives it. */
final class ConversationSession {
  private final String userId;
  private final String id;
  private List<Turn> history;
  private Phase phase = Phase.CLAIMS_IDENTIFICATION;
  private int roundIndex;

  ConversationSession(String userId, String id, List<Turn> history) {
    this.userId = userId;
    this.id = Objects.requireNonNull(id, "id");
    this.history = List.copyOf(history);
  }

  String userId() {
    return userId;
  }

  String id() {
    return id;
  }

  List<Turn> history() {
    return history;
  }

  void history(List<Turn> history) {
    this.history = List.copyOf(history);
  }

  Phase phase() {
    return phase;
  }

  int roundIndex() {
    return roundIndex;
  }

  /** Phase that receives the tool responses of the current round. */
  Phase nextPhase() {
    return roundIndex == 0 ? Phase.IMPRECISE_LANGUAGE_IDENTIFICATION : Phase.FREE_FORM;
  }

  void completeRound(Phase next, List<Turn> updatedHistory) {
    this.phase = next;
    this.roundIndex++;
    history(updatedHistory);
  }

  void terminate() {
    this.phase = Phase.TERMINAL;
  }
}

package com.gentoro.factcheck.history;

import com.gentoro.factcheck.model.Turn;
import java.util.List;

/** Persistent conversation histories, addressed by user and session. */
public interface HistoryStore {

  /** @return the stored turns, oldest first; empty when the session has no history yet */
  List<Turn> load(String userId, String sessionId);

  void save(String userId, String sessionId, List<Turn> turns);
}

package com.gentoro.factcheck.history;

import com.gentoro.factcheck.model.Turn;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local {@link HistoryStore}; histories are lost on restart. */
public class InMemoryHistoryStore implements HistoryStore {
  private final Map<String, List<Turn>> histories = new ConcurrentHashMap<>();

  @Override
  public List<Turn> load(String userId, String sessionId) {
    return histories.getOrDefault(key(userId, sessionId), List.of());
  }

  @Override
  public void save(String userId, String sessionId, List<Turn> turns) {
    histories.put(key(userId, sessionId), List.copyOf(turns));
  }

  private static String key(String userId, String sessionId) {
    return userId + "/" + sessionId;
  }
}

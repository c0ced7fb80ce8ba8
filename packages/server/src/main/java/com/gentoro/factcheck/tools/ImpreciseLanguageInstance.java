package com.gentoro.factcheck.tools;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A flagged instance of imprecise language with its identifier. */
public record ImpreciseLanguageInstance(String id, Map<String, Object> attributes) {
  public ImpreciseLanguageInstance {
    Objects.requireNonNull(id, "id");
    attributes = attributes == null ? Map.of() : new LinkedHashMap<>(attributes);
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>(attributes);
    map.put("id", id);
    return map;
  }
}

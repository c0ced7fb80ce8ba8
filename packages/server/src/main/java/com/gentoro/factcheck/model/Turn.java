package com.gentoro.factcheck.model;

import java.util.List;
import java.util.Objects;

/** One entry of a conversation history. */
public record Turn(Role role, List<Part> parts) {
  public Turn {
    Objects.requireNonNull(role, "role");
    parts = parts == null ? List.of() : List.copyOf(parts);
  }

  public static Turn user(List<Part> parts) {
    return new Turn(Role.USER, parts);
  }

  public static Turn model(List<Part> parts) {
    return new Turn(Role.MODEL, parts);
  }
}

package com.gentoro.factcheck.model;

import java.util.Objects;

/**
 * Provider-agnostic function declaration offered to a model. The parameter schema follows a
 * simplified JSON-Schema structure, see {@link ToolProperty}.
 */
public record ToolDefinition(String name, String description, ToolProperty schema) {
  public ToolDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(description, "description");
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String name;
    private String description;
    private ToolProperty schema;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    /** Parameter schema; may be null for tools without arguments. */
    public Builder schema(ToolProperty schema) {
      this.schema = schema;
      return this;
    }

    public ToolDefinition build() {
      return new ToolDefinition(name, description, schema);
    }
  }
}

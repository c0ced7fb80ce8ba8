package com.gentoro.factcheck.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.factcheck.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Node of a tool parameter schema. Tool parameter schemas are kept as JSON-Schema documents in
 * the prompt store and parsed into this tree with {@link #fromJsonSchema(String, JsonNode)}.
 */
public final class ToolProperty {
  public enum Type {
    STRING,
    BOOLEAN,
    INTEGER,
    NUMBER,
    OBJECT,
    ARRAY
  }

  private final String name;
  private final String description;
  private final boolean required;
  private final Type type;
  private final List<String> enumValues;
  private final ToolProperty items;
  private final List<ToolProperty> properties;

  private ToolProperty(Builder b) {
    this.name = b.name;
    this.description = b.description;
    this.required = b.required;
    this.type = Objects.requireNonNull(b.type, "type");
    this.enumValues = b.enumValues == null ? List.of() : List.copyOf(b.enumValues);
    this.items = b.items;
    this.properties = b.properties == null ? List.of() : List.copyOf(b.properties);
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public boolean isRequired() {
    return required;
  }

  public Type getType() {
    return type;
  }

  public List<String> getEnumValues() {
    return enumValues;
  }

  public ToolProperty getItems() {
    return items;
  }

  public List<ToolProperty> getProperties() {
    return properties;
  }

  /**
   * Parse a JSON-Schema node ({@code type}, {@code description}, {@code properties}, {@code
   * required}, {@code items}, {@code enum}) into a property tree. Type names are accepted in any
   * case, matching both JSON-Schema and OpenAPI spellings.
   *
   * @param name property name, null for the root
   * @throws ValidationException when a node has no usable type
   */
  public static ToolProperty fromJsonSchema(String name, JsonNode node) {
    return parse(name, node, false);
  }

  private static ToolProperty parse(String name, JsonNode node, boolean required) {
    if (node == null || !node.isObject()) {
      throw new ValidationException("Schema node for '" + name + "' must be an object");
    }
    Type type = parseType(name, node.path("type").asText(null));
    Builder builder =
        builder()
            .name(name)
            .type(type)
            .required(required)
            .description(node.path("description").asText(null));

    if (node.has("enum") && node.get("enum").isArray()) {
      List<String> values = new ArrayList<>();
      node.get("enum").forEach(v -> values.add(v.asText()));
      builder.enumValues(values);
    }

    if (type == Type.ARRAY) {
      if (!node.has("items")) {
        throw new ValidationException("Array schema '" + name + "' must declare items");
      }
      builder.items(parse(null, node.get("items"), false));
    } else if (type == Type.OBJECT) {
      Set<String> requiredNames = new HashSet<>();
      node.path("required").forEach(r -> requiredNames.add(r.asText()));
      JsonNode props = node.path("properties");
      Iterator<Map.Entry<String, JsonNode>> it = props.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> entry = it.next();
        builder.property(
            parse(entry.getKey(), entry.getValue(), requiredNames.contains(entry.getKey())));
      }
    }
    return builder.build();
  }

  private static Type parseType(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      throw new ValidationException("Schema node '" + name + "' is missing a type");
    }
    try {
      return Type.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Unsupported schema type '" + raw + "' for '" + name + "'", e);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ToolProperty that)) return false;
    return required == that.required
        && Objects.equals(name, that.name)
        && Objects.equals(description, that.description)
        && type == that.type
        && Objects.equals(enumValues, that.enumValues)
        && Objects.equals(items, that.items)
        && Objects.equals(properties, that.properties);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, description, required, type, enumValues, items, properties);
  }

  @Override
  public String toString() {
    return "ToolProperty{" + name + ":" + type + (required ? "!" : "") + "}";
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String name;
    private String description;
    private boolean required;
    private Type type;
    private List<String> enumValues;
    private ToolProperty items;
    private List<ToolProperty> properties;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder required(boolean required) {
      this.required = required;
      return this;
    }

    public Builder type(Type type) {
      this.type = type;
      return this;
    }

    public Builder enumValues(List<String> enumValues) {
      this.enumValues = enumValues;
      return this;
    }

    public Builder items(ToolProperty items) {
      this.items = items;
      return this;
    }

    public Builder property(ToolProperty property) {
      if (this.properties == null) {
        this.properties = new ArrayList<>();
      }
      this.properties.add(property);
      return this;
    }

    public ToolProperty build() {
      return new ToolProperty(this);
    }
  }

  /** Names of the required child properties, in declaration order. */
  public List<String> requiredPropertyNames() {
    if (properties.isEmpty()) return Collections.emptyList();
    return properties.stream().filter(ToolProperty::isRequired).map(ToolProperty::getName).toList();
  }
}

package com.gentoro.factcheck.prompt.impl;

import com.gentoro.factcheck.exception.PromptException;
import com.gentoro.factcheck.prompt.PromptTemplate;
import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.io.StringWriter;
import java.io.Writer;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/** Pebble-based {@link PromptTemplate}; placeholders are written as {@code {{ name }}}. */
public class PebblePromptTemplate implements PromptTemplate {
  private static final PebbleEngine ENGINE =
      new PebbleEngine.Builder().strictVariables(true).autoEscaping(false).build();

  private final String id;
  private final PebbleTemplate template;

  public PebblePromptTemplate(String id, String content) {
    this.id = Objects.requireNonNull(id, "id");
    try {
      this.template = ENGINE.getLiteralTemplate(Objects.requireNonNull(content, "content"));
    } catch (RuntimeException e) {
      throw new PromptException("Failed to compile prompt template '" + id + "'", e);
    }
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public String render(Map<String, Object> variables) {
    try {
      Writer writer = new StringWriter();
      template.evaluate(writer, variables == null ? Map.of() : new HashMap<>(variables));
      return writer.toString();
    } catch (Exception e) {
      throw new PromptException("Failed to render prompt template '" + id + "'", e);
    }
  }
}

package com.gentoro.factcheck.prompt.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.factcheck.exception.ConfigException;
import com.gentoro.factcheck.prompt.PromptReference;
import com.gentoro.factcheck.prompt.PromptReferenceLoader;
import com.gentoro.factcheck.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the prompt reference document from the classpath ({@code classpath:} prefix) or the
 * filesystem. Two layouts are accepted.
 *
 * <p>Plain:
 *
 * <pre>
 * Prompts:
 *   role_prompt:
 *     fileName: role_prompt.txt
 * </pre>
 *
 * <p>Remote Config template export, where JSON values arrive as strings:
 *
 * <pre>
 * parameterGroups:
 *   Prompts:
 *     parameters:
 *       role_prompt:
 *         valueType: JSON
 *         defaultValue:
 *           value: '{"fileName": "role_prompt.txt"}'
 * </pre>
 */
public class YamlPromptReferenceLoader implements PromptReferenceLoader {
  private static final String CLASSPATH_PREFIX = "classpath:";

  private final String location;

  public YamlPromptReferenceLoader(String location) {
    this.location = location;
  }

  @Override
  public Map<String, Map<String, PromptReference>> load() {
    JsonNode root = readDocument();
    Map<String, Map<String, PromptReference>> groups = new LinkedHashMap<>();
    if (root == null || !root.isObject()) {
      return groups;
    }
    if (root.has("parameterGroups")) {
      forEachField(
          root.get("parameterGroups"),
          (group, groupNode) ->
              forEachField(
                  groupNode.path("parameters"),
                  (key, param) -> {
                    JsonNode value = param.path("defaultValue").path("value");
                    if ("JSON".equalsIgnoreCase(param.path("valueType").asText())) {
                      value = parseJson(group + ":" + key, value.asText());
                    }
                    put(groups, group, key, value);
                  }));
    } else {
      forEachField(
          root,
          (group, groupNode) ->
              forEachField(groupNode, (key, value) -> put(groups, group, key, value)));
    }
    return groups;
  }

  private static void put(
      Map<String, Map<String, PromptReference>> groups, String group, String key, JsonNode value) {
    String fileName = value.path("fileName").asText(null);
    if (fileName == null || fileName.isBlank()) {
      return;
    }
    Map<String, Object> attributes = JacksonUtility.toPlainMap(value);
    groups
        .computeIfAbsent(group, g -> new LinkedHashMap<>())
        .put(key, new PromptReference(fileName, attributes));
  }

  private JsonNode readDocument() {
    try {
      if (location.startsWith(CLASSPATH_PREFIX)) {
        String resource = location.substring(CLASSPATH_PREFIX.length());
        if (resource.startsWith("/")) resource = resource.substring(1);
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = YamlPromptReferenceLoader.class.getClassLoader();
        try (InputStream is = cl.getResourceAsStream(resource)) {
          if (is == null) {
            throw new ConfigException("Prompt reference document not found: " + location);
          }
          return JacksonUtility.getYamlMapper().readTree(is);
        }
      }
      Path path = Path.of(location);
      if (!Files.isRegularFile(path)) {
        throw new ConfigException("Prompt reference document not found: " + location);
      }
      try (InputStream is = Files.newInputStream(path)) {
        return JacksonUtility.getYamlMapper().readTree(is);
      }
    } catch (IOException e) {
      throw new ConfigException("Failed to read prompt reference document: " + location, e);
    }
  }

  private static JsonNode parseJson(String name, String json) {
    try {
      return JacksonUtility.getJsonMapper().readTree(json);
    } catch (IOException e) {
      throw new ConfigException("Remote config value " + name + " is not valid JSON", e);
    }
  }

  private interface FieldVisitor {
    void visit(String name, JsonNode value);
  }

  private static void forEachField(JsonNode node, FieldVisitor visitor) {
    if (node == null || !node.isObject()) return;
    Iterator<Map.Entry<String, JsonNode>> it = node.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      visitor.visit(e.getKey(), e.getValue());
    }
  }
}

package com.gentoro.factcheck.prompt.impl;

import com.gentoro.factcheck.exception.PromptException;
import com.gentoro.factcheck.prompt.PromptRepository;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Reads prompt files from the classpath below a base directory. Example basePath: "prompts"
 * (resolves resources like "prompts/role_prompt.txt").
 */
public class ClasspathPromptRepository implements PromptRepository {
  private final String basePath;
  private final ClassLoader classLoader;

  public ClasspathPromptRepository(String basePath) {
    this(basePath, Thread.currentThread().getContextClassLoader());
  }

  public ClasspathPromptRepository(String basePath, ClassLoader classLoader) {
    this.basePath = normalize(Objects.requireNonNull(basePath, "basePath"));
    this.classLoader =
        Objects.requireNonNullElseGet(
            classLoader, () -> ClasspathPromptRepository.class.getClassLoader());
  }

  @Override
  public String read(String fileName) {
    String resource = basePath + "/" + normalize(fileName);
    try (InputStream is = classLoader.getResourceAsStream(resource)) {
      if (is == null) {
        throw new PromptException("Prompt not found on classpath: " + resource);
      }
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new PromptException("Failed to read prompt file: " + resource, e);
    }
  }

  private static String normalize(String p) {
    String out = p.trim();
    if (out.startsWith("/")) out = out.substring(1);
    if (out.endsWith("/")) out = out.substring(0, out.length() - 1);
    return out;
  }
}

package com.gentoro.factcheck.prompt.impl;

import com.gentoro.factcheck.exception.PromptException;
import com.gentoro.factcheck.prompt.PromptRepository;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class FileSystemPromptRepository implements PromptRepository {
  private final Path path;

  public FileSystemPromptRepository(Path path) {
    this.path = path.toAbsolutePath().normalize();
  }

  @Override
  public String read(String fileName) {
    Path file = path.resolve(fileName).normalize();
    if (!file.startsWith(path)) {
      throw new PromptException("Prompt file escapes the prompt directory: " + fileName);
    }
    if (!Files.isRegularFile(file)) {
      throw new PromptException("Prompt not found: " + file);
    }
    try {
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new PromptException("Failed to read prompt file: " + fileName, e);
    }
  }
}

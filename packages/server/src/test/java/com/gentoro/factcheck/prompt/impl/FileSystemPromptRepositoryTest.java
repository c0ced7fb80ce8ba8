package com.gentoro.factcheck.prompt.impl;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.factcheck.exception.PromptException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemPromptRepositoryTest {

  @TempDir Path tmp;

  @Test
  void readsPromptFiles() throws Exception {
    Files.writeString(tmp.resolve("role.txt"), "You are helpful.");
    assertEquals("You are helpful.", new FileSystemPromptRepository(tmp).read("role.txt"));
  }

  @Test
  void refusesPathsOutsideTheRoot() {
    FileSystemPromptRepository repository = new FileSystemPromptRepository(tmp);
    assertThrows(PromptException.class, () -> repository.read("../secret.txt"));
    assertThrows(PromptException.class, () -> repository.read("missing.txt"));
  }

  @Test
  void classpathRepositoryReadsBundledPrompts() {
    String text = new ClasspathPromptRepository("prompts").read("verification_prompt.txt");
    assertTrue(text.contains("{{ input_claim }}"));
  }
}

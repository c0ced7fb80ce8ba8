package com.gentoro.factcheck.prompt;

/** Storage of prompt files, addressed by file name relative to the repository root. */
public interface PromptRepository {

  /**
   * @throws com.gentoro.factcheck.exception.PromptException when the file is missing or unreadable
   */
  String read(String fileName);
}

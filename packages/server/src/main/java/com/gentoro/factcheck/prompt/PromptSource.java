package com.gentoro.factcheck.prompt;

import java.util.Optional;

/** Resolves configuration keys to prompt files and reads their text. */
public interface PromptSource {

  /** @return the reference registered under {@code group}/{@code key}, if any */
  Optional<PromptReference> get(String group, String key);

  /**
   * @throws com.gentoro.factcheck.exception.PromptException when the file cannot be read
   */
  String fetchText(PromptReference reference);
}

package com.gentoro.factcheck.prompt;

import java.util.Map;

/** Loads the full reference document: group name to key to reference. */
@FunctionalInterface
public interface PromptReferenceLoader {
  Map<String, Map<String, PromptReference>> load();
}

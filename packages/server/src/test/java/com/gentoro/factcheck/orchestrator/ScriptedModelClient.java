package com.gentoro.factcheck.orchestrator;

import com.gentoro.factcheck.model.ModelClient;
import com.gentoro.factcheck.model.ModelResponse;
import com.gentoro.factcheck.model.ModelSettings;
import com.gentoro.factcheck.model.Part;
import com.gentoro.factcheck.model.Turn;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/** Model client replaying canned replies and recording what it was sent. */
class ScriptedModelClient implements ModelClient {
  private final String name;
  private final Deque<Supplier<List<Part>>> replies = new ArrayDeque<>();
  final List<List<Part>> messages = new ArrayList<>();
  final List<List<Turn>> histories = new ArrayList<>();

  ScriptedModelClient(String name) {
    this.name = name;
  }

  ScriptedModelClient reply(Part... parts) {
    replies.add(() -> List.of(parts));
    return this;
  }

  ScriptedModelClient fail(RuntimeException error) {
    replies.add(
        () -> {
          throw error;
        });
    return this;
  }

  int calls() {
    return messages.size();
  }

  @Override
  public ModelResponse send(List<Turn> history, List<Part> message) {
    messages.add(message);
    histories.add(history);
    if (replies.isEmpty()) {
      throw new AssertionError(name + " model was not expected to be called");
    }
    List<Part> reply = replies.poll().get();
    List<Turn> updated = new ArrayList<>(history);
    updated.add(Turn.user(message));
    updated.add(Turn.model(reply));
    return new ModelResponse(reply, updated);
  }

  @Override
  public ModelSettings settings() {
    return ModelSettings.of("scripted-" + name, null, 0f, 1024);
  }
}

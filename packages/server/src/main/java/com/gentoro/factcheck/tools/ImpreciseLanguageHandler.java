package com.gentoro.factcheck.tools;

import com.gentoro.factcheck.orchestrator.progress.ProgressUpdate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/** Assigns identifiers to the flagged imprecise-language instances and reports them. */
public class ImpreciseLanguageHandler implements ToolHandler<ToolCall.ImpreciseLanguage> {
  static final String CONTENT = "Processed all imprecise language identified.";

  private final Supplier<String> idGenerator;

  public ImpreciseLanguageHandler() {
    this(() -> UUID.randomUUID().toString());
  }

  public ImpreciseLanguageHandler(Supplier<String> idGenerator) {
    this.idGenerator = idGenerator;
  }

  @Override
  public ToolResponse handle(ToolCall.ImpreciseLanguage call, ToolInvocationContext context) {
    List<ImpreciseLanguageInstance> processed = new ArrayList<>(call.instances().size());
    for (Map<String, Object> instance : call.instances()) {
      processed.add(new ImpreciseLanguageInstance(idGenerator.get(), instance));
    }
    context.recordInstances(processed);
    context.publish(
        ProgressUpdate.builder(context.userId(), context.sessionId(), context.styleMode())
            .processedInstances(processed)
            .build());

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("content", CONTENT);
    payload.put(
        "processed_imprecise_language_instances",
        processed.stream().map(ImpreciseLanguageInstance::toMap).collect(Collectors.toList()));
    ToolKind kind = call.kind();
    return new ToolResponse(
        kind.functionName(), payload, kind.nextStepInstruction(context.workflowEngaged()));
  }
}

package com.gentoro.factcheck.tools;

import com.gentoro.factcheck.model.GroundedResult;
import com.gentoro.factcheck.orchestrator.progress.ProgressUpdate;
import com.gentoro.factcheck.verification.ClaimAnalysis;
import com.gentoro.factcheck.verification.GroundedTextStructurer;
import com.gentoro.factcheck.verification.VerificationWorkerPool;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Verifies every identified claim against the grounded verification model, structures the
 * answers and reports them as processed claims.
 */
public class ClaimsIdentificationHandler implements ToolHandler<ToolCall.ClaimsIdentification> {
  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(ClaimsIdentificationHandler.class);

  static final String INPUT_CLAIM_VARIABLE = "input_claim";
  static final String CONTENT = "Processed all claims and generated analysis.";

  private final VerificationWorkerPool workerPool;
  private final GroundedTextStructurer structurer;
  private final Supplier<String> idGenerator;

  public ClaimsIdentificationHandler(
      VerificationWorkerPool workerPool, GroundedTextStructurer structurer) {
    this(workerPool, structurer, () -> UUID.randomUUID().toString());
  }

  public ClaimsIdentificationHandler(
      VerificationWorkerPool workerPool,
      GroundedTextStructurer structurer,
      Supplier<String> idGenerator) {
    this.workerPool = workerPool;
    this.structurer = structurer;
    this.idGenerator = idGenerator;
  }

  @Override
  public ToolResponse handle(ToolCall.ClaimsIdentification call, ToolInvocationContext context) {
    List<IdentifiedClaim> claims = call.claims();
    List<String> prompts =
        claims.stream()
            .map(c -> context.verificationPrompt().render(Map.of(INPUT_CLAIM_VARIABLE, c.claim())))
            .collect(Collectors.toList());
    log.debug("Verifying {} claim(s) for chat {}", claims.size(), context.sessionId());

    List<Optional<GroundedResult>> results =
        workerPool.generateAll(context.verificationClient(), prompts);

    List<VerificationResult> processed = new ArrayList<>(claims.size());
    for (int i = 0; i < claims.size(); i++) {
      ClaimAnalysis analysis =
          i < results.size()
              ? results.get(i).map(structurer::structure).orElse(ClaimAnalysis.empty())
              : ClaimAnalysis.empty();
      processed.add(new VerificationResult(idGenerator.get(), claims.get(i), analysis));
    }
    context.recordClaims(processed);
    context.publish(
        ProgressUpdate.builder(context.userId(), context.sessionId(), context.styleMode())
            .processedClaims(processed)
            .build());

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("content", CONTENT);
    payload.put(
        "processed_claims",
        processed.stream().map(VerificationResult::toMap).collect(Collectors.toList()));
    ToolKind kind = call.kind();
    return new ToolResponse(
        kind.functionName(), payload, kind.nextStepInstruction(context.workflowEngaged()));
  }
}

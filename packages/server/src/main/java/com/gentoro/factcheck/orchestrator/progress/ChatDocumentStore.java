package com.gentoro.factcheck.orchestrator.progress;

import com.gentoro.factcheck.tools.ImpreciseLanguageInstance;
import com.gentoro.factcheck.tools.VerificationResult;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * In-process store of {@link ChatDocument}s keyed by user and chat.
 *
 * <p>Claims and instances are upserted under their own identifiers, so repeating an update does
 * not create duplicates and an identifier is never replaced.
 */
public class ChatDocumentStore {
  private final Map<String, ChatDocument> documents = new ConcurrentHashMap<>();
  private final Clock clock;
  private final Supplier<String> idGenerator;

  public ChatDocumentStore() {
    this(Clock.systemUTC(), () -> UUID.randomUUID().toString());
  }

  public ChatDocumentStore(Clock clock, Supplier<String> idGenerator) {
    this.clock = clock;
    this.idGenerator = idGenerator;
  }

  public void apply(ProgressUpdate update) {
    ChatDocument document =
        documents.computeIfAbsent(
            key(update.userId(), update.sessionId()),
            k -> new ChatDocument(update.userId(), update.sessionId()));
    Instant now = clock.instant();
    synchronized (document) {
      if (update.outputText() != null && !update.outputText().isEmpty()) {
        document.addAnswer(idGenerator.get(), update.outputText(), update.isFinal(), now);
      }
      document.touch(update.styleMode(), update.isFinal(), now);
      if (update.processedClaims() != null) {
        for (VerificationResult claim : update.processedClaims()) {
          document.upsertClaim(claim.id(), claim.toMap(), update.styleMode(), now);
        }
      }
      if (update.processedInstances() != null) {
        for (ImpreciseLanguageInstance instance : update.processedInstances()) {
          document.upsertInstance(instance.id(), instance.toMap(), update.styleMode(), now);
        }
      }
    }
  }

  public Optional<Map<String, Object>> find(String userId, String chatId) {
    ChatDocument document = documents.get(key(userId, chatId));
    if (document == null) return Optional.empty();
    synchronized (document) {
      return Optional.of(document.snapshot());
    }
  }

  private static String key(String userId, String chatId) {
    return (userId == null ? "" : userId) + "/" + chatId;
  }
}

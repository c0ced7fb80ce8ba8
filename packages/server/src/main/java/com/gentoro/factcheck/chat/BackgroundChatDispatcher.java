package com.gentoro.factcheck.chat;

import com.gentoro.factcheck.exception.ExceptionUtil;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs chat requests off the request thread. Callers receive the chat id immediately and follow
 * the outcome through the progress endpoint.
 */
public class BackgroundChatDispatcher implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(BackgroundChatDispatcher.class);

  private final ChatService chatService;
  private final ExecutorService executor;
  private final Supplier<String> chatIdGenerator;

  public BackgroundChatDispatcher(ChatService chatService, int threads) {
    this(chatService, newExecutor(threads), () -> UUID.randomUUID().toString());
  }

  BackgroundChatDispatcher(
      ChatService chatService, ExecutorService executor, Supplier<String> chatIdGenerator) {
    this.chatService = chatService;
    this.executor = executor;
    this.chatIdGenerator = chatIdGenerator;
  }

  /** Queue the request and return the chat id it will be processed under. */
  public String submit(ChatRequest request) {
    ChatRequest effective =
        request.chatId() == null || request.chatId().isBlank()
            ? request.withChatId(chatIdGenerator.get())
            : request;
    executor.execute(
        () -> {
          try {
            chatService.handle(effective);
          } catch (Exception e) {
            log.error(
                "Background processing of chat {} failed: {}",
                effective.chatId(),
                ExceptionUtil.rootMessage(e),
                e);
          }
        });
    return effective.chatId();
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
        log.warn("Chat workers did not finish in time, interrupting");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static ExecutorService newExecutor(int threads) {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newFixedThreadPool(
        Math.max(1, threads),
        r -> {
          Thread t = new Thread(r, "chat-worker-" + counter.incrementAndGet());
          t.setDaemon(true);
          return t;
        });
  }
}

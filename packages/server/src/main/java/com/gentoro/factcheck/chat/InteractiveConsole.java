package com.gentoro.factcheck.chat;

import com.gentoro.factcheck.exception.ExceptionUtil;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.util.List;

/**
 * Line-based chat loop over a console. Consecutive messages continue the same chat; {@code new}
 * starts a fresh one and {@code exit} leaves the loop.
 */
public class InteractiveConsole {
  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(InteractiveConsole.class);

  public static final String CONSOLE_USER = "console";

  private final ChatService chatService;
  private final String userId;

  public InteractiveConsole(ChatService chatService) {
    this(chatService, CONSOLE_USER);
  }

  public InteractiveConsole(ChatService chatService, String userId) {
    this.chatService = chatService;
    this.userId = userId;
  }

  public void run(Reader input, PrintStream out) throws IOException {
    BufferedReader reader = new BufferedReader(input);
    String chatId = null;
    out.println("Welcome! Type a message ('new' starts another chat, 'exit' quits):");
    while (true) {
      out.print("> ");
      out.flush();
      String line = reader.readLine();
      if (line == null) {
        break;
      }
      String text = line.trim();
      if (text.isEmpty()) {
        continue;
      }
      if (text.equalsIgnoreCase("exit")) {
        out.println("Goodbye!");
        break;
      }
      if (text.equalsIgnoreCase("new")) {
        chatId = null;
        out.println("Started a new chat.");
        continue;
      }
      try {
        ChatReply reply =
            chatService.handle(new ChatRequest(userId, chatId, null, text, null, List.of()));
        chatId = reply.chatHistoryId();
        out.println(reply.outputText());
        if (reply.processedClaims() != null) {
          out.printf("(%d claim(s) verified)%n", reply.processedClaims().size());
        }
      } catch (Exception e) {
        log.error("Error handling console message", e);
        out.println("Could not handle the message: " + ExceptionUtil.rootMessage(e));
      }
    }
  }
}

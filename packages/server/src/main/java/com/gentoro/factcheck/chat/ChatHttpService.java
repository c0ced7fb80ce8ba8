package com.gentoro.factcheck.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.factcheck.exception.ConfigException;
import com.gentoro.factcheck.exception.ExceptionUtil;
import com.gentoro.factcheck.exception.ValidationException;
import com.gentoro.factcheck.http.EmbeddedJettyServer;
import com.gentoro.factcheck.orchestrator.progress.ChatDocumentStore;
import com.gentoro.factcheck.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * HTTP surface of the chat service.
 *
 * <ul>
 *   <li>{@code POST /chat} queues a message and answers 202 with the chat id
 *   <li>{@code POST /chat/task} processes a message and answers with the full reply
 *   <li>{@code GET /chat/progress?chat_id=...} returns the chat document built from progress
 *       updates
 *   <li>{@code POST /chat/title} generates a title for the {@code text} of the body
 * </ul>
 *
 * The user id comes from the body's {@code user_id} or the {@code X-User-Id} header.
 */
public class ChatHttpService {
  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(ChatHttpService.class);

  public static final String USER_HEADER = "X-User-Id";

  private final EmbeddedJettyServer httpServer;
  private final String contextPath;
  private final ChatService chatService;
  private final BackgroundChatDispatcher dispatcher;
  private final ChatDocumentStore documentStore;
  private final ChatTitleService titleService;

  public ChatHttpService(
      EmbeddedJettyServer httpServer,
      String contextPath,
      ChatService chatService,
      BackgroundChatDispatcher dispatcher,
      ChatDocumentStore documentStore,
      ChatTitleService titleService) {
    if (contextPath == null || !contextPath.startsWith("/")) {
      throw new ConfigException("Invalid chat context path: " + contextPath);
    }
    this.httpServer = httpServer;
    this.contextPath =
        contextPath.length() > 1 && contextPath.endsWith("/")
            ? contextPath.substring(0, contextPath.length() - 1)
            : contextPath;
    this.chatService = chatService;
    this.dispatcher = dispatcher;
    this.documentStore = documentStore;
    this.titleService = titleService;
  }

  public void register() {
    var handler = httpServer.getContextHandler();
    handler.addServlet(new ServletHolder(new SubmitServlet()), contextPath);
    handler.addServlet(new ServletHolder(new TaskServlet()), contextPath + "/task");
    handler.addServlet(new ServletHolder(new ProgressServlet()), contextPath + "/progress");
    handler.addServlet(new ServletHolder(new TitleServlet()), contextPath + "/title");
    log.info("Chat endpoints registered under {}", contextPath);
  }

  class SubmitServlet extends HttpServlet {
    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      ChatRequest request;
      try {
        request = readRequest(req);
      } catch (ValidationException e) {
        sendError(resp, 400, e.getMessage());
        return;
      }
      String chatId = dispatcher.submit(request);
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("status", "processing");
      body.put("chat_id", chatId);
      sendJson(resp, 202, body);
    }
  }

  class TaskServlet extends HttpServlet {
    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      try {
        ChatReply reply = chatService.handle(readRequest(req));
        sendJson(resp, 200, reply);
      } catch (ValidationException e) {
        sendError(resp, 400, e.getMessage());
      } catch (ConfigException e) {
        log.error("Chat task failed on missing configuration", e);
        sendText(resp, 404, e.getMessage());
      } catch (Exception e) {
        log.error("Chat task failed", e);
        sendError(resp, 500, "Internal server error: " + ExceptionUtil.rootMessage(e));
      }
    }
  }

  class ProgressServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      String userId = firstNonBlank(req.getParameter("user_id"), req.getHeader(USER_HEADER));
      String chatId = req.getParameter("chat_id");
      if (userId == null || chatId == null || chatId.isBlank()) {
        sendError(resp, 400, "Both user id and chat_id are required");
        return;
      }
      Optional<Map<String, Object>> document = documentStore.find(userId, chatId);
      if (document.isEmpty()) {
        sendError(resp, 404, "Unknown chat: " + chatId);
        return;
      }
      sendJson(resp, 200, document.get());
    }
  }

  class TitleServlet extends HttpServlet {
    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      try {
        String title = titleService.generateTitle(readTitleText(req));
        sendJson(resp, 200, Map.of("title", title));
      } catch (ValidationException e) {
        sendError(resp, 400, e.getMessage());
      } catch (ConfigException e) {
        log.error("Chat title failed on missing configuration", e);
        sendText(resp, 404, e.getMessage());
      } catch (Exception e) {
        log.error("Chat title generation failed", e);
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("title", "Error occurred");
        error.put("error", ExceptionUtil.rootMessage(e));
        sendJson(resp, 500, error);
      }
    }
  }

  private ChatRequest readRequest(HttpServletRequest req) {
    ChatRequest request;
    try {
      request = JacksonUtility.getJsonMapper().readValue(req.getInputStream(), ChatRequest.class);
    } catch (IOException e) {
      throw new ValidationException("Malformed chat request: " + ExceptionUtil.rootMessage(e), e);
    }
    if (request == null) {
      throw new ValidationException("Empty chat request");
    }
    String userId = firstNonBlank(request.userId(), req.getHeader(USER_HEADER));
    if (userId == null) {
      throw new ValidationException("Missing user id");
    }
    return request.withUserId(userId);
  }

  private static String readTitleText(HttpServletRequest req) {
    JsonNode body;
    try {
      body = JacksonUtility.getJsonMapper().readTree(req.getInputStream());
    } catch (IOException e) {
      throw new ValidationException("Malformed title request: " + ExceptionUtil.rootMessage(e), e);
    }
    return body == null ? null : body.path("text").asText(null);
  }

  private static String firstNonBlank(String a, String b) {
    if (a != null && !a.isBlank()) return a;
    if (b != null && !b.isBlank()) return b;
    return null;
  }

  private void sendJson(HttpServletResponse resp, int code, Object body) throws IOException {
    String json = JacksonUtility.toJson(body);
    log.debug("Sending response ({}): {}", code, json);
    resp.setStatus(code);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    try (PrintWriter out = resp.getWriter()) {
      out.println(json);
    }
  }

  private void sendError(HttpServletResponse resp, int code, String message) throws IOException {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", false);
    body.put("error", message);
    sendJson(resp, code, body);
  }

  private void sendText(HttpServletResponse resp, int code, String message) throws IOException {
    resp.setStatus(code);
    resp.setContentType("text/plain");
    resp.setCharacterEncoding("UTF-8");
    try (PrintWriter out = resp.getWriter()) {
      out.println(message);
    }
  }
}

package com.gentoro.factcheck.history;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gentoro.factcheck.exception.IoException;
import com.gentoro.factcheck.exception.ValidationException;
import com.gentoro.factcheck.model.Turn;
import com.gentoro.factcheck.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Stores each history as a JSON array of turns at {@code users/<userId>/chats/<sessionId>.json}
 * below the root directory. Writes go through a temporary file and an atomic move.
 */
public class FileSystemHistoryStore implements HistoryStore {
  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(FileSystemHistoryStore.class);
  private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._@-]+");
  private static final TypeReference<List<Turn>> TURNS = new TypeReference<>() {};

  private final Path root;

  public FileSystemHistoryStore(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  @Override
  public List<Turn> load(String userId, String sessionId) {
    Path file = pathOf(userId, sessionId);
    if (!Files.isRegularFile(file)) {
      return List.of();
    }
    try {
      List<Turn> turns = JacksonUtility.getJsonMapper().readValue(file.toFile(), TURNS);
      log.debug("Loaded {} turn(s) from {}", turns.size(), file);
      return turns;
    } catch (IOException e) {
      throw new IoException("Failed to read chat history " + file, e);
    }
  }

  @Override
  public void save(String userId, String sessionId, List<Turn> turns) {
    Path file = pathOf(userId, sessionId);
    Path tmp = null;
    try {
      Files.createDirectories(file.getParent());
      tmp = Files.createTempFile(file.getParent(), sessionId, ".tmp");
      JacksonUtility.getJsonMapper().writeValue(tmp.toFile(), turns);
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      log.debug("Saved {} turn(s) to {}", turns.size(), file);
    } catch (IOException e) {
      throw new IoException("Failed to write chat history " + file, e);
    } finally {
      deleteQuietly(tmp);
    }
  }

  // no-op once the move succeeded
  private static void deleteQuietly(Path tmp) {
    if (tmp == null) return;
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      log.warn("Could not remove temporary file {}", tmp, e);
    }
  }

  Path pathOf(String userId, String sessionId) {
    return root.resolve("users")
        .resolve(safe("userId", userId))
        .resolve("chats")
        .resolve(safe("sessionId", sessionId) + ".json");
  }

  private static String safe(String name, String value) {
    if (value == null || !SAFE_ID.matcher(value).matches() || value.startsWith(".")) {
      throw new ValidationException("Invalid " + name + ": " + value);
    }
    return value;
  }
}

package com.gentoro.factcheck.prompt;

import com.gentoro.factcheck.exception.ConfigException;
import com.gentoro.factcheck.prompt.impl.ClasspathPromptRepository;
import com.gentoro.factcheck.prompt.impl.FileSystemPromptRepository;
import com.gentoro.factcheck.prompt.impl.YamlPromptReferenceLoader;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

public class PromptRepositoryFactory {
  private static final String CLASSPATH_PREFIX = "classpath:";

  /**
   * Create a cached prompt source from the {@code prompts} configuration subset:
   *
   * <ul>
   *   <li>{@code remote-config}: location of the reference document
   *   <li>{@code location}: {@code classpath:prompts}, {@code file:/absolute/path} or a plain
   *       directory path holding the prompt files
   *   <li>{@code cache-ttl-seconds}: reference document time-to-live (default 3600)
   * </ul>
   */
  public static PromptSource createSource(Configuration promptCfg) {
    String remoteConfig = promptCfg.getString("remote-config");
    if (remoteConfig == null || remoteConfig.isBlank()) {
      throw new ConfigException("Missing prompts.remote-config configuration");
    }
    return new CachingPromptSource(
        new YamlPromptReferenceLoader(remoteConfig.trim()),
        create(promptCfg),
        Duration.ofSeconds(promptCfg.getLong("cache-ttl-seconds", 3600L)));
  }

  /** Create the repository holding prompt files from {@code location}. */
  public static PromptRepository create(Configuration promptCfg) {
    String location = promptCfg.getString("location");
    if (location == null || location.isBlank()) {
      throw new ConfigException("Missing prompts.location configuration");
    }
    location = location.trim();

    if (location.startsWith(CLASSPATH_PREFIX)) {
      String base = location.substring(CLASSPATH_PREFIX.length());
      if (base.startsWith("/")) base = base.substring(1);
      if (base.isBlank()) {
        throw new ConfigException("Invalid prompts.location: classpath base path is empty");
      }
      return new ClasspathPromptRepository(base);
    }

    Path basePath;
    try {
      basePath = location.startsWith("file:") ? Path.of(URI.create(location)) : Path.of(location);
    } catch (IllegalArgumentException iae) {
      throw new ConfigException("Invalid prompt location URI/path: " + location, iae);
    }
    if (!Files.isDirectory(basePath)) {
      throw new ConfigException("Prompt storage path is not a directory: " + basePath);
    }
    return new FileSystemPromptRepository(basePath);
  }
}

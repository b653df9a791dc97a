package com.magsasa.runtimeintel.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.magsasa.runtimeintel.notification.transport.webhook.ObjectMapperProvider;
import com.typesafe.config.Config;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Appends events that could not be delivered or flushed to a JSON lines file. */
public class DeadLetterLog {
  private static final Logger LOGGER = LoggerFactory.getLogger(DeadLetterLog.class);
  private static final String PATH_CONFIG = "dead-letter.path";
  private static final String DEFAULT_PATH = "dead-letter.jsonl";

  private final Path path;
  private final Clock clock;
  private final AtomicLong written = new AtomicLong();

  public DeadLetterLog(Path path, Clock clock) {
    this.path = path;
    this.clock = clock;
  }

  public static DeadLetterLog fromConfig(Config appConfig, Clock clock) {
    return new DeadLetterLog(
        Paths.get(appConfig.hasPath(PATH_CONFIG) ? appConfig.getString(PATH_CONFIG) : DEFAULT_PATH),
        clock);
  }

  /** Returns false when the entry could not be written; the failure is logged with the entry. */
  public synchronized boolean append(String reason, Object payload) {
    Entry entry = new Entry(reason, clock.instant(), payload);
    String line;
    try {
      line = ObjectMapperProvider.get().writeValueAsString(entry);
    } catch (JsonProcessingException e) {
      LOGGER.error("Unable to serialize dead letter reason={} payload={}", reason, payload, e);
      return false;
    }
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (BufferedWriter writer =
          Files.newBufferedWriter(
              path,
              StandardCharsets.UTF_8,
              StandardOpenOption.CREATE,
              StandardOpenOption.APPEND)) {
        writer.write(line);
        writer.newLine();
      }
    } catch (IOException e) {
      LOGGER.error("Unable to write dead letter to {}: {}", path, line, e);
      return false;
    }
    written.incrementAndGet();
    LOGGER.warn("Dead lettered reason={} to {}", reason, path);
    return true;
  }

  public long getWrittenCount() {
    return written.get();
  }

  public Path getPath() {
    return path;
  }

  @Getter
  static class Entry {
    private final String reason;
    private final Instant recordedAt;
    private final Object payload;

    Entry(String reason, Instant recordedAt, Object payload) {
      this.reason = reason;
      this.recordedAt = recordedAt;
      this.payload = payload;
    }
  }
}

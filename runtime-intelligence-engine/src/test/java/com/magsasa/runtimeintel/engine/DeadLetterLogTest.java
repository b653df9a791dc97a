package com.magsasa.runtimeintel.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.ConfigFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DeadLetterLogTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);

  @TempDir Path tempDir;

  @Test
  void testEntriesAreAppendedAsJsonLines() throws IOException {
    DeadLetterLog log = new DeadLetterLog(tempDir.resolve("nested/dead-letter.jsonl"), CLOCK);

    assertTrue(log.append("delivery-failed", Map.of("channelId", "ops")));
    assertTrue(log.append("shutdown-pending", Map.of("fingerprint", "3f2a9c")));

    List<String> lines = Files.readAllLines(log.getPath(), StandardCharsets.UTF_8);
    assertEquals(2, lines.size());
    JsonNode first = new ObjectMapper().readTree(lines.get(0));
    assertEquals("delivery-failed", first.get("reason").asText());
    assertEquals("2024-03-01T12:00:00Z", first.get("recordedAt").asText());
    assertEquals("ops", first.get("payload").get("channelId").asText());
    assertEquals(2, log.getWrittenCount());
  }

  @Test
  void testUnwritablePathIsReported() throws IOException {
    Path directory = Files.createDirectory(tempDir.resolve("occupied"));
    DeadLetterLog log = new DeadLetterLog(directory, CLOCK);

    assertFalse(log.append("delivery-failed", Map.of("channelId", "ops")));
    assertEquals(0, log.getWrittenCount());
  }

  @Test
  void testPathFromConfig() {
    assertEquals(
        Paths.get("dead-letter.jsonl"),
        DeadLetterLog.fromConfig(ConfigFactory.parseMap(Map.of()), CLOCK).getPath());
    assertEquals(
        Paths.get("/var/log/dlq.jsonl"),
        DeadLetterLog.fromConfig(
                ConfigFactory.parseMap(Map.of("dead-letter.path", "/var/log/dlq.jsonl")), CLOCK)
            .getPath());
  }
}

package com.magsasa.runtimeintel.notification.transport;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves API tokens and routing keys. A system property {@code notification.secret.<key>} wins
 * over the file {@code <root>/<key>}, where the root defaults to {@code /var/notification/secrets}
 * and can be moved with {@code notification.secrets.path}.
 */
public class NotificationSecretFinder {
  private static final Logger LOG = LoggerFactory.getLogger(NotificationSecretFinder.class);
  private static final String DEFAULT_ROOT_PATH = "/var/notification/secrets";
  static final String ROOT_PATH_SYS_PROP = "notification.secrets.path";
  static final String SECRET_SYS_PROP_PREFIX = "notification.secret.";

  private NotificationSecretFinder() {}

  public static Optional<String> findSecret(String key) {
    String secret = System.getProperty(SECRET_SYS_PROP_PREFIX + key);
    if (secret != null) {
      return Optional.of(secret.trim());
    }

    File file = new File(System.getProperty(ROOT_PATH_SYS_PROP, DEFAULT_ROOT_PATH), key);
    if (!file.exists() || !file.canRead()) {
      LOG.error("Unable to read secret file: {}", file.getPath());
      return Optional.empty();
    }

    try (Stream<String> stream = Files.lines(file.toPath(), StandardCharsets.UTF_8)) {
      String value = stream.collect(Collectors.joining()).trim();
      return value.isEmpty() ? Optional.empty() : Optional.of(value);
    } catch (IOException e) {
      LOG.error("Unable to read lines from secret file: {}", file.getPath(), e);
      return Optional.empty();
    }
  }
}
